package model.dto.snapshot;

import common.consts.VehicleStateEnum;
import lombok.Data;

/**
 * 对外暴露的车辆状态快照 DTO
 */
@Data
public class VehicleSnapshotDto {
    private String id;
    private VehicleStateEnum state;

    // 位置
    private Double posX;
    private Double posY;

    private long lastUpdateTick;

    // 代理侧状态
    private boolean paused;
    private int scheduledLegs;
}
