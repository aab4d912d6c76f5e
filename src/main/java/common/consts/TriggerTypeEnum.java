package common.consts;

/**
 * 调度器中的触发器类型
 */
public enum TriggerTypeEnum {
    //  调度波次
    REPOSITION_TIMEOUT,        // 车辆再平衡波次到期
    BUFFERED_REQUESTS_TIMEOUT, // 缓冲订单批量分配波次到期

    //  车辆行驶
    END_LEG                    // 车辆到达当前路段终点
}
