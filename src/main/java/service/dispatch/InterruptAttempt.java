package service.dispatch;

import common.consts.InterruptOriginEnum;
import common.consts.InterruptStatusEnum;
import engine.agent.InterruptReply;
import engine.agent.VehicleAgentRef;
import lombok.Data;
import model.schedule.PassengerSchedule;

/**
 * 一次针对单辆车的计划修改尝试
 * 从发出中断开始，到新计划被确认或被放弃为止；同一车辆同一时刻至多一个
 */
@Data
public class InterruptAttempt {
    private String interruptId;
    private String vehicleId;
    private PassengerSchedule newSchedule;
    private Long reservationRequestId;      // 与订单绑定时非空
    private InterruptOriginEnum origin;
    private InterruptReply reply;           // 收到回复前为空
    private long tick;                      // 发出中断的时刻
    private VehicleAgentRef agent;
    private InterruptStatusEnum status;

    public InterruptAttempt(String interruptId, String vehicleId, PassengerSchedule newSchedule,
                            Long reservationRequestId, InterruptOriginEnum origin, long tick, VehicleAgentRef agent) {
        this.interruptId = interruptId;
        this.vehicleId = vehicleId;
        this.newSchedule = newSchedule;
        this.reservationRequestId = reservationRequestId;
        this.origin = origin;
        this.tick = tick;
        this.agent = agent;
        this.status = InterruptStatusEnum.INTERRUPT_SENT;
    }

    /**
     * 供协调器之外读取的副本
     */
    public InterruptAttempt copy() {
        InterruptAttempt copy = new InterruptAttempt(interruptId, vehicleId, newSchedule, reservationRequestId,
                origin, tick, agent);
        if (reply != null) {
            copy.setReply(new InterruptReply(reply.getType(), reply.getInterruptId(), reply.getVehicleId(),
                    reply.getTick(), reply.getCurrentSchedule()));
        }
        copy.setStatus(status);
        return copy;
    }

    public boolean isReplyReceived() {
        return reply != null;
    }
}
