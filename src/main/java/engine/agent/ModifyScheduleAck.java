package engine.agent;

import engine.ScheduleTrigger;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 车辆确认新计划已生效，附带需要随波次完成通知一并调度的后续触发器
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModifyScheduleAck {
    private String vehicleId;
    private long tick;
    private List<ScheduleTrigger> triggersToSchedule = new ArrayList<>();
    private Long reservationRequestId;
}
