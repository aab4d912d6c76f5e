package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 订单预约状态
 */
@Getter
@AllArgsConstructor
public enum ReservationStatusEnum {
    BUFFERED("01", "缓冲中，等待批量分配"),
    PENDING("02", "已选车，等待计划下发"),
    CONFIRMED("03", "车辆已确认"),
    UNMATCHED("04", "半径内无空闲车辆"),
    FAILED("05", "重试耗尽");

    private final String code;
    private final String desc;
}
