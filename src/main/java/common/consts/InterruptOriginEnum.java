package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 中断来源：决定修改尝试的优先级与放弃策略
 */
@Getter
@AllArgsConstructor
public enum InterruptOriginEnum {
    BATCHED_RESERVATION("批量订单"),
    SINGLE_RESERVATION("单笔订单"),   // 阻塞同一车辆上的任何新尝试
    REPOSITION("再平衡"),
    HOLD_FOR_PLANNING("波次规划保持");

    private final String desc;
}
