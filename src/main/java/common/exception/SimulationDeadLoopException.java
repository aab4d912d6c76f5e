package common.exception;

/**
 * 仿真死循环异常 同一 tick 内投递的触发器过多
 */
public class SimulationDeadLoopException extends RuntimeException {
    private final long tick;
    private final int triggerCount;

    public SimulationDeadLoopException(String message, long tick, int triggerCount) {
        super(message);
        this.tick = tick;
        this.triggerCount = triggerCount;
    }

    public long getTick() {
        return tick;
    }

    public int getTriggerCount() {
        return triggerCount;
    }
}
