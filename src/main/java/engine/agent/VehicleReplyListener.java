package engine.agent;

/**
 * 车辆代理的回复出口，由调度管理器实现
 */
public interface VehicleReplyListener {

    void onInterruptReply(InterruptReply reply);

    void onModifyScheduleAck(ModifyScheduleAck ack);
}
