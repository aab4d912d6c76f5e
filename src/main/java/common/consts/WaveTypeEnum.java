package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 批处理波次类型，两类波次的间隔相互独立
 */
@Getter
@AllArgsConstructor
public enum WaveTypeEnum {
    REPOSITION(TriggerTypeEnum.REPOSITION_TIMEOUT, "车辆再平衡"),
    BATCHED_RESERVATION(TriggerTypeEnum.BUFFERED_REQUESTS_TIMEOUT, "缓冲订单批量分配");

    // 下一波次的定时触发器类型
    private final TriggerTypeEnum timerTrigger;
    private final String desc;

    public static WaveTypeEnum fromTrigger(TriggerTypeEnum type) {
        for (WaveTypeEnum value : values()) {
            if (value.getTimerTrigger() == type) {
                return value;
            }
        }
        return null;
    }
}
