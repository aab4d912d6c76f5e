package model.schedule;

import lombok.Value;

/**
 * 乘客引用：乘客本人的载体车辆ID + 人员ID
 */
@Value
public class PassengerRef {
    String vehicleId;
    String personId;
}
