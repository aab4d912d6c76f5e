package model.dto.allocation;

import lombok.Value;
import model.entity.Point;

/**
 * 分配结果：选中的车辆及其当前位置
 */
@Value
public class VehicleAllocation {
    String vehicleId;
    Point currentLocation;
    double distanceToPickup;
}
