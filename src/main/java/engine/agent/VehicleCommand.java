package engine.agent;

import common.consts.VehicleCommandTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import model.schedule.PassengerSchedule;

/**
 * 发往车辆代理的指令，按 type 区分负载
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VehicleCommand {
    private VehicleCommandTypeEnum type;
    private String interruptId;             // INTERRUPT
    private long tick;                      // INTERRUPT / STOP_DRIVING / MODIFY_PASSENGER_SCHEDULE
    private PassengerSchedule schedule;     // MODIFY_PASSENGER_SCHEDULE
    private Long reservationRequestId;      // MODIFY_PASSENGER_SCHEDULE，可为空

    public static VehicleCommand interrupt(String interruptId, long tick) {
        return new VehicleCommand(VehicleCommandTypeEnum.INTERRUPT, interruptId, tick, null, null);
    }

    public static VehicleCommand stopDriving(long tick) {
        return new VehicleCommand(VehicleCommandTypeEnum.STOP_DRIVING, null, tick, null, null);
    }

    public static VehicleCommand modifyPassengerSchedule(PassengerSchedule schedule, long tick, Long reservationRequestId) {
        return new VehicleCommand(VehicleCommandTypeEnum.MODIFY_PASSENGER_SCHEDULE, null, tick, schedule, reservationRequestId);
    }

    public static VehicleCommand resume() {
        return new VehicleCommand(VehicleCommandTypeEnum.RESUME, null, 0L, null, null);
    }
}
