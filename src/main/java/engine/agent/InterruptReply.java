package engine.agent;

import common.consts.InterruptReplyTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import model.schedule.PassengerSchedule;

/**
 * 车辆对中断的回复
 * 反映中断送达那一刻车辆的真实状况，可能与协调器发出指令时的判断不同
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterruptReply {
    private InterruptReplyTypeEnum type;
    private String interruptId;
    private String vehicleId;
    private long tick;
    private PassengerSchedule currentSchedule; // 仅 DRIVING 携带

    public static InterruptReply whileDriving(String interruptId, String vehicleId, long tick, PassengerSchedule currentSchedule) {
        return new InterruptReply(InterruptReplyTypeEnum.DRIVING, interruptId, vehicleId, tick, currentSchedule);
    }

    public static InterruptReply whileIdle(String interruptId, String vehicleId, long tick) {
        return new InterruptReply(InterruptReplyTypeEnum.IDLE, interruptId, vehicleId, tick, null);
    }

    public static InterruptReply whileOffline(String interruptId, String vehicleId, long tick) {
        return new InterruptReply(InterruptReplyTypeEnum.OFFLINE, interruptId, vehicleId, tick, null);
    }
}
