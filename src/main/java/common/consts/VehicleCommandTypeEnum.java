package common.consts;

/**
 * 协调器发给车辆代理的指令
 * 单车上的顺序固定为 INTERRUPT -> (STOP_DRIVING) -> MODIFY_PASSENGER_SCHEDULE -> RESUME
 */
public enum VehicleCommandTypeEnum {
    INTERRUPT,
    STOP_DRIVING,
    MODIFY_PASSENGER_SCHEDULE,
    RESUME
}
