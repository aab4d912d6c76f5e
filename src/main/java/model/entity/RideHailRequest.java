package model.entity;

import common.consts.ReservationStatusEnum;
import lombok.Data;
import lombok.NoArgsConstructor;
import model.schedule.PassengerRef;

/**
 * 网约车订单
 */
@Data
@NoArgsConstructor
public class RideHailRequest {
    private long requestId;          // 订单号 (Key)
    private PassengerRef customer;   // 乘客
    private Point pickup;            // 上车点
    private Point dropoff;           // 下车点
    private long requestTick;        // 下单时刻

    private ReservationStatusEnum status;
    private int retryCount;          // 因车辆离线导致修改失败后的重试次数
    private String assignedVehicleId;

    public RideHailRequest(long requestId, PassengerRef customer, Point pickup, Point dropoff, long requestTick) {
        this.requestId = requestId;
        this.customer = customer;
        this.pickup = pickup;
        this.dropoff = dropoff;
        this.requestTick = requestTick;
    }
}
