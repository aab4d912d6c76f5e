package engine;

/**
 * 触发器接收方扩展点
 * 调度器按 agentId 路由，接收方处理完成后必须通过 completionNotice 归还该触发器。
 * 实现方不应在此方法内阻塞等待其他组件的锁，只做入队。
 */
public interface TriggerHandler {

    /**
     * 接收方ID (车辆ID 或 调度管理器ID)
     */
    String getAgentId();

    /**
     * 处理投递的触发器
     */
    void handleTrigger(ScheduleTrigger trigger, TriggerScheduler scheduler);
}
