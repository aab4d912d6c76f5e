package engine;

import java.util.List;

/**
 * 全局调度器对外暴露的完成通知接口
 */
public interface CompletionNoticeSink {

    /**
     * 归还一个已投递的触发器，并附带后续需要调度的新触发器
     */
    void completionNotice(long triggerId, List<ScheduleTrigger> newTriggers);

    /**
     * 不依附于任何已投递触发器，直接调度新触发器
     */
    void scheduleTriggers(List<ScheduleTrigger> newTriggers);
}
