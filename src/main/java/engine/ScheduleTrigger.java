package engine;

import common.consts.TriggerTypeEnum;
import lombok.Data;

import java.util.concurrent.atomic.AtomicLong;

@Data
public class ScheduleTrigger implements Comparable<ScheduleTrigger> {
    private long triggerId;         // 由调度器在入队时分配，0 表示尚未入队
    private long tick;              // 触发的绝对仿真时刻 (秒)
    private TriggerTypeEnum type;   // 触发器类型
    private String agentId;         // 接收方：车辆ID 或 调度管理器ID
    private Object data;            // 触发器负载
    private long creationSequence;  // 创建序号

    // 计数器 解决同一 tick 内的触发器排序
    private static final AtomicLong sequenceGenerator = new AtomicLong(0);

    public ScheduleTrigger(long tick, TriggerTypeEnum type, String agentId, Object data) {
        this.tick = tick;
        this.type = type;
        this.agentId = agentId;
        this.data = data;
        this.creationSequence = sequenceGenerator.getAndIncrement();
    }

    public ScheduleTrigger(long tick, TriggerTypeEnum type, String agentId) {
        this(tick, type, agentId, null);
    }

    @Override
    public int compareTo(ScheduleTrigger other) {
        //  按时间早晚排
        int timeCompare = Long.compare(this.tick, other.tick);
        if (timeCompare != 0) {
            return timeCompare;
        }
        //  时间相同 按生成顺序排
        return Long.compare(this.creationSequence, other.creationSequence);
    }
}
