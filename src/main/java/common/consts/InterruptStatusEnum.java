package common.consts;

/**
 * 协调器本地的协议状态，与车辆自身状态无关
 */
public enum InterruptStatusEnum {
    INTERRUPT_SENT,  // 已发送中断，等待回复
    MODIFY_SENT      // 已下发新计划，等待确认
}
