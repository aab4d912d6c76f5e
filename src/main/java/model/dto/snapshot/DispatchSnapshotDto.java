package model.dto.snapshot;

import common.consts.WaveTypeEnum;
import lombok.Data;

import java.util.List;
import java.util.Set;

/**
 * 调度全局快照
 */
@Data
public class DispatchSnapshotDto {
    private long nowTick;
    private int queuedTriggers;
    private int awaitingTriggers;

    private List<VehicleSnapshotDto> vehicles;
    private List<InterruptAttemptSnapshotDto> attempts;
    private int pendingInterruptReplies;

    // 波次
    private WaveTypeEnum activeWave;
    private Set<String> waitingVehicles;
    private int bufferedRequests;
}
