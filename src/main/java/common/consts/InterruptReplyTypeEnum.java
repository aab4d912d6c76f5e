package common.consts;

/**
 * 车辆收到中断时的真实状况
 */
public enum InterruptReplyTypeEnum {
    DRIVING,  // 行驶中，附带当前计划
    IDLE,     // 空闲
    OFFLINE   // 离线，已被别处占用
}
