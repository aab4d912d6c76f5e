package engine;

import common.config.DispatchConfig;
import common.consts.TriggerTypeEnum;
import common.exception.SimulationDeadLoopException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.algorithm.impl.DispatchErrorLog;
import service.algorithm.impl.TriggerLog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("按步同步触发器调度器测试")
class TriggerSchedulerTest {

    private DispatchConfig config;
    private TriggerLog triggerLog;
    private DispatchErrorLog errorLog;
    private TriggerScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new DispatchConfig();
        triggerLog = new TriggerLog();
        errorLog = new DispatchErrorLog();
        scheduler = new TriggerScheduler(config, triggerLog, errorLog);
    }

    /**
     * 记录收到的触发器，由回调决定何时归还
     */
    static class RecordingHandler implements TriggerHandler {
        private final String agentId;
        private final BiConsumer<ScheduleTrigger, TriggerScheduler> onTrigger;
        final List<ScheduleTrigger> received = new ArrayList<>();

        RecordingHandler(String agentId, BiConsumer<ScheduleTrigger, TriggerScheduler> onTrigger) {
            this.agentId = agentId;
            this.onTrigger = onTrigger;
        }

        @Override
        public String getAgentId() {
            return agentId;
        }

        @Override
        public void handleTrigger(ScheduleTrigger trigger, TriggerScheduler scheduler) {
            received.add(trigger);
            onTrigger.accept(trigger, scheduler);
        }
    }

    @Test
    @DisplayName("同一 tick 的触发器全部归还前不推进时钟")
    void waitsForCompletionBeforeAdvancing() {
        RecordingHandler holder = new RecordingHandler("a", (t, s) -> { });
        RecordingHandler auto = new RecordingHandler("b",
                (t, s) -> s.completionNotice(t.getTriggerId(), Collections.emptyList()));
        scheduler.register(holder);
        scheduler.register(auto);

        long heldId = scheduler.scheduleTrigger(new ScheduleTrigger(10, TriggerTypeEnum.END_LEG, "a"));
        scheduler.scheduleTrigger(new ScheduleTrigger(10, TriggerTypeEnum.END_LEG, "b"));
        scheduler.scheduleTrigger(new ScheduleTrigger(20, TriggerTypeEnum.END_LEG, "b"));

        scheduler.runUntil(100);
        assertEquals(10, scheduler.getNowTick());
        assertEquals(1, auto.received.size(), "同一 tick 的其他触发器照常投递");
        assertEquals(1, scheduler.getAwaitingCount());

        scheduler.completionNotice(heldId, Collections.emptyList());
        assertEquals(2, auto.received.size());
        assertEquals(100, scheduler.getNowTick(), "队列清空后时钟推进到目标");
    }

    @Test
    @DisplayName("完成通知附带的新触发器被调度")
    void followUpTriggersScheduled() {
        RecordingHandler chain = new RecordingHandler("a", (t, s) -> {
            List<ScheduleTrigger> next = t.getTick() < 30
                    ? Collections.singletonList(new ScheduleTrigger(t.getTick() + 10, TriggerTypeEnum.END_LEG, "a"))
                    : Collections.emptyList();
            s.completionNotice(t.getTriggerId(), next);
        });
        scheduler.register(chain);
        scheduler.scheduleTrigger(new ScheduleTrigger(10, TriggerTypeEnum.END_LEG, "a"));

        scheduler.runUntil(25);
        assertEquals(2, chain.received.size());
        assertEquals(25, scheduler.getNowTick());

        scheduler.runUntil(50);
        assertEquals(3, chain.received.size());
        assertEquals(3, triggerLog.listSince(0).size());
    }

    @Test
    @DisplayName("接收方异常被记录，触发器自动归还")
    void handlerExceptionIsRecorded() {
        scheduler.register(new RecordingHandler("bad", (t, s) -> {
            throw new IllegalStateException("boom");
        }));
        scheduler.scheduleTrigger(new ScheduleTrigger(5, TriggerTypeEnum.END_LEG, "bad"));
        scheduler.scheduleTrigger(new ScheduleTrigger(6, TriggerTypeEnum.END_LEG, "nobody"));

        scheduler.runUntil(10);

        assertEquals(10, scheduler.getNowTick());
        assertEquals(1, errorLog.count(DispatchErrorLog.ErrorType.TRIGGER_PROCESSING_ERROR));
        assertEquals(0, scheduler.getAwaitingCount());
    }

    @Test
    @DisplayName("同一 tick 触发器过多时判定为死循环")
    void deadLoopDetected() {
        config.setMaxTriggersPerTick(5);
        scheduler.register(new RecordingHandler("loop", (t, s) -> s.completionNotice(t.getTriggerId(),
                Collections.singletonList(new ScheduleTrigger(t.getTick(), TriggerTypeEnum.END_LEG, "loop")))));
        scheduler.scheduleTrigger(new ScheduleTrigger(1, TriggerTypeEnum.END_LEG, "loop"));

        assertThrows(SimulationDeadLoopException.class, () -> scheduler.runUntil(10));
        assertEquals(1, errorLog.count(DispatchErrorLog.ErrorType.DEAD_LOOP));
    }

    @Test
    @DisplayName("早于当前时钟的触发器按当前时钟处理")
    void pastTriggerClamped() {
        scheduler.runUntil(50);
        ScheduleTrigger late = new ScheduleTrigger(10, TriggerTypeEnum.END_LEG, "x");
        scheduler.scheduleTrigger(late);
        assertEquals(50, late.getTick());
    }
}
