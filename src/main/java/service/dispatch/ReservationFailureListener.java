package service.dispatch;

/**
 * 订单子系统回调：订单对应的计划修改因车辆离线而无法完成
 * 是否重试由订单子系统自行决定
 */
public interface ReservationFailureListener {

    void onReservationModificationFailed(long reservationRequestId, String vehicleId, long tick);
}
