package engine;

import common.config.DispatchConfig;
import common.exception.SimulationDeadLoopException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.dto.snapshot.TriggerLogEntryDto;
import org.springframework.stereotype.Component;
import service.algorithm.impl.DispatchErrorLog;
import service.algorithm.impl.TriggerLog;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按步同步的全局触发器调度器
 *
 * 每次投递当前最小 tick 的全部触发器；只要还有已投递的触发器未收到完成通知，
 * 就不会推进到更晚的 tick。接收方可能在任意线程上归还触发器。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TriggerScheduler implements CompletionNoticeSink {
    // 数据注入
    private final DispatchConfig dispatchConfig;
    private final TriggerLog triggerLog;
    private final DispatchErrorLog errorLog;

    private final PriorityQueue<ScheduleTrigger> triggerQueue = new PriorityQueue<>();
    private final Map<String, TriggerHandler> handlerMap = new ConcurrentHashMap<>();
    // 已投递、等待完成通知的触发器
    private final Map<Long, ScheduleTrigger> awaitingCompletion = new HashMap<>();
    private final AtomicLong triggerIdGenerator = new AtomicLong(0);

    private long nowTick = 0L;
    private long stopTick = -1L;
    // 防止完成通知在投递过程中同步回调造成递归推进
    private boolean stepping = false;
    // 死循环检测
    private long lastDeliveredTick = -1L;
    private int sameTickCount = 0;

    /**
     * 注册触发器接收方
     */
    public void register(TriggerHandler handler) {
        handlerMap.put(handler.getAgentId(), handler);
    }

    public void unregister(String agentId) {
        handlerMap.remove(agentId);
    }

    /**
     * 调度单个触发器，返回分配的触发器ID
     */
    public synchronized long scheduleTrigger(ScheduleTrigger trigger) {
        if (trigger.getTick() < nowTick) {
            log.warn("触发器时间早于当前时钟，按当前时钟处理: Type={}, Agent={}, Tick={}, Now={}",
                    trigger.getType(), trigger.getAgentId(), trigger.getTick(), nowTick);
            trigger.setTick(nowTick);
        }
        trigger.setTriggerId(triggerIdGenerator.incrementAndGet());
        triggerQueue.add(trigger);
        return trigger.getTriggerId();
    }

    @Override
    public synchronized void scheduleTriggers(List<ScheduleTrigger> newTriggers) {
        for (ScheduleTrigger trigger : newTriggers) {
            scheduleTrigger(trigger);
        }
        doSimStep();
    }

    @Override
    public synchronized void completionNotice(long triggerId, List<ScheduleTrigger> newTriggers) {
        ScheduleTrigger completed = awaitingCompletion.remove(triggerId);
        if (completed == null) {
            log.warn("收到未知触发器的完成通知，已忽略: TriggerId={}", triggerId);
        }
        for (ScheduleTrigger trigger : newTriggers) {
            scheduleTrigger(trigger);
        }
        doSimStep();
    }

    /**
     * 推进仿真到指定 tick
     * 所有接收方异步归还触发器时，本方法可能在到达目标前返回，后续由完成通知继续推进
     */
    public synchronized void runUntil(long targetTick) {
        stopTick = Math.max(stopTick, targetTick);
        doSimStep();
    }

    private void doSimStep() {
        if (stepping) {
            return;
        }
        stepping = true;
        try {
            while (!triggerQueue.isEmpty()) {
                ScheduleTrigger next = triggerQueue.peek();
                if (next.getTick() > stopTick) {
                    break;
                }
                // 同一 tick 的触发器全部归还前不能推进时钟
                if (!awaitingCompletion.isEmpty() && next.getTick() > nowTick) {
                    break;
                }
                checkDeadLoop(next.getTick());
                triggerQueue.poll();
                nowTick = next.getTick();
                awaitingCompletion.put(next.getTriggerId(), next);
                deliver(next);
            }
            if (awaitingCompletion.isEmpty() && stopTick > nowTick
                    && (triggerQueue.isEmpty() || triggerQueue.peek().getTick() > stopTick)) {
                nowTick = stopTick;
            }
        } finally {
            stepping = false;
        }
    }

    private void checkDeadLoop(long tick) {
        if (tick == lastDeliveredTick) {
            sameTickCount++;
            int maxTriggersPerTick = dispatchConfig.getMaxTriggersPerTick();
            if (sameTickCount > maxTriggersPerTick) {
                String errorMsg = String.format("仿真死循环检测: tick %d 已投递 %d 个触发器，超过阈值 %d",
                        tick, sameTickCount, maxTriggersPerTick);
                errorLog.recordDeadLoopError(tick, sameTickCount, maxTriggersPerTick, errorMsg);
                throw new SimulationDeadLoopException(errorMsg, tick, sameTickCount);
            }
        } else {
            lastDeliveredTick = tick;
            sameTickCount = 1;
        }
    }

    private void deliver(ScheduleTrigger trigger) {
        TriggerLogEntryDto logEntry = new TriggerLogEntryDto();
        logEntry.setTick(trigger.getTick());
        logEntry.setType(trigger.getType());
        logEntry.setTriggerId(trigger.getTriggerId());
        logEntry.setAgentId(trigger.getAgentId());
        triggerLog.append(logEntry);

        TriggerHandler handler = handlerMap.get(trigger.getAgentId());
        if (handler == null) {
            log.warn("触发器 {} 没有对应的接收方，将被忽略: Agent={}, Tick={}",
                    trigger.getType(), trigger.getAgentId(), trigger.getTick());
            awaitingCompletion.remove(trigger.getTriggerId());
            return;
        }
        try {
            handler.handleTrigger(trigger, this);
        } catch (Exception e) {
            // 记录异常并直接归还该触发器，不中断仿真
            String errorMsg = String.format("触发器处理异常: Type=%s, Id=%d, Agent=%s, Tick=%d",
                    trigger.getType(), trigger.getTriggerId(), trigger.getAgentId(), trigger.getTick());
            errorLog.recordTriggerError(trigger.getTriggerId(), trigger.getType(), trigger.getTick(), errorMsg, e);
            log.error(errorMsg, e);
            awaitingCompletion.remove(trigger.getTriggerId());
        }
    }

    public synchronized long getNowTick() {
        return nowTick;
    }

    public synchronized int getAwaitingCount() {
        return awaitingCompletion.size();
    }

    public synchronized int getQueuedCount() {
        return triggerQueue.size();
    }

    /**
     * 重置调度器状态（用于测试或场景切换），接收方注册表保留
     */
    public synchronized void reset() {
        triggerQueue.clear();
        awaitingCompletion.clear();
        nowTick = 0L;
        stopTick = -1L;
        lastDeliveredTick = -1L;
        sameTickCount = 0;
    }
}
