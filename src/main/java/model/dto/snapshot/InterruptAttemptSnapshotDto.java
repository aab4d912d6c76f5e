package model.dto.snapshot;

import common.consts.InterruptOriginEnum;
import common.consts.InterruptReplyTypeEnum;
import common.consts.InterruptStatusEnum;
import lombok.Data;

/**
 * 进行中的计划修改尝试快照
 */
@Data
public class InterruptAttemptSnapshotDto {
    private String interruptId;
    private String vehicleId;
    private InterruptOriginEnum origin;
    private InterruptStatusEnum status;

    /**
     * 尚未收到回复时为空
     */
    private InterruptReplyTypeEnum replyType;

    private Long reservationRequestId;
    private long tick;
    private int newScheduleLegs;
}
