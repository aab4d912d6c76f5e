package model.dto.snapshot;

import common.consts.TriggerTypeEnum;
import lombok.Data;

/**
 * 触发器投递日志条目 DTO
 */
@Data
public class TriggerLogEntryDto {
    /**
     * 投递时的仿真时刻 (秒)
     */
    private long tick;

    /**
     * 触发器类型
     */
    private TriggerTypeEnum type;

    /**
     * 触发器ID
     */
    private long triggerId;

    /**
     * 接收方 (车辆ID 或 调度管理器ID)
     */
    private String agentId;
}
