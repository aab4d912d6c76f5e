package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 网约车运营状态
 */
@Getter
@AllArgsConstructor
public enum VehicleStateEnum {
    IDLE("01", "空闲"),
    IN_SERVICE("02", "服务中 (载客/调度行驶)"),
    OFFLINE("03", "离线/退出服务");

    private final String code;
    private final String desc;

    /**
     * 根据 code 获取枚举对象
     * @param code 状态码
     * @return 对应的枚举对象 若未找到返回 null
     */
    public static VehicleStateEnum getByCode(String code) {
        for (VehicleStateEnum value : values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }
}
