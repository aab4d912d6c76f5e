package service.dispatch;

import common.config.DispatchConfig;
import common.consts.AgentIds;
import common.consts.ReservationStatusEnum;
import common.consts.TriggerTypeEnum;
import common.consts.VehicleCommandTypeEnum;
import common.consts.VehicleStateEnum;
import engine.ScheduleTrigger;
import engine.TriggerScheduler;
import engine.agent.InterruptReply;
import engine.agent.ModifyScheduleAck;
import engine.agent.VehicleAgentRef;
import engine.agent.VehicleCommand;
import model.entity.Point;
import model.entity.RideHailRequest;
import model.entity.RideHailVehicle;
import model.schedule.PassengerRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.algorithm.impl.DispatchErrorLog;
import service.algorithm.impl.DispatchErrorLog.ErrorType;
import service.algorithm.impl.StraightLineTravelTimeEstimator;
import service.allocation.impl.NearestIdleAllocationManager;
import service.fleet.FleetStateTracker;
import service.reservation.ReservationService;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("网约车调度管理器测试")
class RideHailDispatchServiceTest {

    private TriggerScheduler scheduler;
    private DispatchErrorLog errorLog;
    private FleetStateTracker fleet;
    private ReservationService reservations;
    private ModifyPassengerScheduleManager coordinator;
    private RideHailDispatchService dispatchService;

    private long now;
    private ScriptedAgent v1;
    private ScriptedAgent v2;

    /**
     * 收到中断回复空闲，收到新计划立即确认；silent 时不做任何回复
     */
    class ScriptedAgent implements VehicleAgentRef {
        private final String vehicleId;
        boolean silent;
        final List<VehicleCommand> received = new ArrayList<>();

        ScriptedAgent(String vehicleId) {
            this.vehicleId = vehicleId;
        }

        @Override
        public String getVehicleId() {
            return vehicleId;
        }

        @Override
        public void tell(VehicleCommand command) {
            received.add(command);
            if (silent) {
                return;
            }
            switch (command.getType()) {
                case INTERRUPT:
                    dispatchService.onInterruptReply(
                            InterruptReply.whileIdle(command.getInterruptId(), vehicleId, command.getTick()));
                    break;
                case MODIFY_PASSENGER_SCHEDULE:
                    dispatchService.onModifyScheduleAck(new ModifyScheduleAck(vehicleId, command.getTick(),
                            Collections.emptyList(), command.getReservationRequestId()));
                    break;
                default:
                    break;
            }
        }
    }

    @BeforeEach
    void setUp() {
        scheduler = mock(TriggerScheduler.class);
        when(scheduler.getNowTick()).thenAnswer(invocation -> now);

        DispatchConfig config = new DispatchConfig();
        errorLog = new DispatchErrorLog();
        fleet = new FleetStateTracker();
        reservations = new ReservationService(config);
        WaveController waveController = new WaveController(scheduler, config);
        coordinator = new ModifyPassengerScheduleManager(fleet, waveController, reservations, errorLog, config);
        dispatchService = new RideHailDispatchService(scheduler, coordinator, waveController,
                new NearestIdleAllocationManager(fleet, config), reservations, fleet,
                new StraightLineTravelTimeEstimator(config), config, Runnable::run);

        v1 = new ScriptedAgent("v1");
        v2 = new ScriptedAgent("v2");
        fleet.registerVehicle(new RideHailVehicle("v1", VehicleStateEnum.IDLE, new Point(0, 0), v1));
        fleet.registerVehicle(new RideHailVehicle("v2", VehicleStateEnum.IDLE, new Point(3000, 0), v2));
    }

    private RideHailRequest request(long id, Point pickup) {
        return new RideHailRequest(id, new PassengerRef("body-p" + id, "p" + id), pickup,
                new Point(pickup.getX(), pickup.getY() + 100), now);
    }

    private ScheduleTrigger waveTrigger(long triggerId, long tick, TriggerTypeEnum type) {
        ScheduleTrigger trigger = new ScheduleTrigger(tick, type, AgentIds.RIDE_HAIL_MANAGER);
        trigger.setTriggerId(triggerId);
        return trigger;
    }

    @Test
    @DisplayName("单笔订单的中断迟迟未回复，不影响不含该车的波次完成")
    void unansweredSingleReservationDoesNotBlockWave() {
        v1.silent = true;
        now = 10;
        RideHailRequest req = dispatchService.reserve(request(1, new Point(10, 0)));
        assertEquals(ReservationStatusEnum.PENDING, req.getStatus());
        assertTrue(coordinator.isPendingReservation("v1"));

        now = 60;
        dispatchService.handleTrigger(waveTrigger(5, 60, TriggerTypeEnum.REPOSITION_TIMEOUT), scheduler);

        verify(scheduler).completionNotice(eq(5L), anyList());
        assertTrue(coordinator.isPendingReservation("v1"));
        assertFalse(coordinator.allInterruptRepliesReceived());
        assertTrue(coordinator.allWaveRepliesReceived());
        assertEquals(1, v1.received.size(), "v1 只收到订单的那次中断");
    }

    @Test
    @DisplayName("未回复的单笔订单中断超时后放弃，订单重新缓冲并在下一批量波次中完成分配")
    void expiredSingleReservationIsRetriedInNextBatch() {
        v1.silent = true;
        now = 10;
        RideHailRequest req = dispatchService.reserve(request(1, new Point(10, 0)));

        now = 700;
        v1.silent = false;
        dispatchService.handleTrigger(waveTrigger(6, 700, TriggerTypeEnum.BUFFERED_REQUESTS_TIMEOUT), scheduler);

        assertEquals(1, errorLog.count(ErrorType.INTERRUPT_REPLY_TIMEOUT));
        assertEquals(1, req.getRetryCount());
        assertEquals(ReservationStatusEnum.CONFIRMED, req.getStatus());
        assertEquals("v1", req.getAssignedVehicleId());
        verify(scheduler).completionNotice(eq(6L), anyList());
        assertTrue(coordinator.isCacheEmpty());
    }

    @Test
    @DisplayName("超时检查在任意调度消息后执行，无需等待下一波次")
    void expiryRunsOnAnyDispatchMessage() {
        v1.silent = true;
        now = 10;
        RideHailRequest first = dispatchService.reserve(request(1, new Point(10, 0)));

        now = 620;
        RideHailRequest second = dispatchService.reserve(request(2, new Point(3000, 10)));

        assertEquals(ReservationStatusEnum.CONFIRMED, second.getStatus());
        assertEquals("v2", second.getAssignedVehicleId());
        assertEquals(ReservationStatusEnum.BUFFERED, first.getStatus());
        assertEquals(1, first.getRetryCount());
        assertFalse(coordinator.isPendingReservation("v1"));
        assertEquals(VehicleCommandTypeEnum.RESUME, v1.received.get(v1.received.size() - 1).getType());
        verify(scheduler, never()).completionNotice(anyLong(), anyList());
    }
}
