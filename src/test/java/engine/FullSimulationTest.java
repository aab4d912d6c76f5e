package engine;

import common.config.ExecutorConfig;
import common.consts.ReservationStatusEnum;
import common.consts.VehicleStateEnum;
import model.dto.request.FleetLoadReq;
import model.dto.request.VehicleStateReq;
import model.dto.snapshot.DispatchSnapshotDto;
import model.dto.snapshot.VehicleSnapshotDto;
import model.entity.Point;
import model.entity.RideHailRequest;
import model.schedule.PassengerRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.TestPropertySource;
import service.SimulationService;
import service.algorithm.impl.DispatchErrorLog;
import service.dispatch.ModifyPassengerScheduleManager;
import service.dispatch.RideHailDispatchService;
import service.fleet.FleetStateTracker;
import service.reservation.ReservationService;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 完整调度仿真测试
 * 车辆代理与调度线程都替换为同步执行，结果确定
 */
@SpringBootTest(classes = application.RideHailApplication.class)
@Import(FullSimulationTest.DirectExecutorConfig.class)
@TestPropertySource(properties = {
        "spring.main.allow-bean-definition-overriding=true"
})
@DisplayName("完整调度仿真测试")
@Timeout(60)
class FullSimulationTest {

    @TestConfiguration
    static class DirectExecutorConfig {

        @Bean
        @Primary
        @Qualifier(ExecutorConfig.AGENT_EXECUTOR)
        Executor directAgentExecutor() {
            return Runnable::run;
        }

        @Bean
        @Primary
        @Qualifier(ExecutorConfig.DISPATCH_EXECUTOR)
        Executor directDispatchExecutor() {
            return Runnable::run;
        }
    }

    @Autowired
    private SimulationService simulationService;

    @Autowired
    private RideHailDispatchService dispatchService;

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private ModifyPassengerScheduleManager coordinator;

    @Autowired
    private FleetStateTracker fleet;

    @Autowired
    private TriggerScheduler scheduler;

    @Autowired
    private DispatchErrorLog errorLog;

    @BeforeEach
    void setUp() {
        FleetLoadReq req = new FleetLoadReq();
        List<FleetLoadReq.VehicleSpec> vehicles = new ArrayList<>();
        vehicles.add(vehicle("v1", 0, 0));
        vehicles.add(vehicle("v2", 2000, 0));
        vehicles.add(vehicle("v3", 4000, 0));
        req.setVehicles(vehicles);
        simulationService.loadFleet(req);
    }

    private FleetLoadReq.VehicleSpec vehicle(String id, double x, double y) {
        FleetLoadReq.VehicleSpec spec = new FleetLoadReq.VehicleSpec();
        spec.setId(id);
        spec.setPosX(x);
        spec.setPosY(y);
        return spec;
    }

    private RideHailRequest request(long id, Point pickup, Point dropoff) {
        return new RideHailRequest(id, new PassengerRef("body-p" + id, "p" + id), pickup, dropoff, scheduler.getNowTick());
    }

    @Test
    @DisplayName("无订单时两类波次各完成一次，并调度下一波次定时触发器")
    void idleWavesComplete() {
        assertTrue(simulationService.start());
        assertFalse(simulationService.start(), "重复启动无效");

        assertEquals(1, simulationService.step(1));

        DispatchSnapshotDto snapshot = simulationService.snapshot();
        assertTrue(snapshot.getAttempts().isEmpty());
        assertNull(snapshot.getActiveWave());
        assertEquals(0, snapshot.getAwaitingTriggers());
        // 下一次再平衡 @300，下一次批量分配 @60
        assertEquals(2, snapshot.getQueuedTriggers());
        for (VehicleSnapshotDto vehicle : snapshot.getVehicles()) {
            assertFalse(vehicle.isPaused(), "波次结束后不能有车辆停留在暂停状态");
            assertEquals(VehicleStateEnum.IDLE, vehicle.getState());
        }
        assertTrue(errorLog.listAll().isEmpty());
    }

    @Test
    @DisplayName("缓冲订单在批量波次中分配给最近车辆，送达后车辆回到空闲")
    void bufferedRequestServed() {
        RideHailRequest req = dispatchService.bufferRequest(request(1, new Point(100, 0), new Point(100, 1000)));
        simulationService.start();
        simulationService.step(1);

        assertEquals(ReservationStatusEnum.CONFIRMED, req.getStatus());
        assertEquals("v1", req.getAssignedVehicleId());
        assertEquals(VehicleStateEnum.IN_SERVICE, fleet.getVehicle("v1").getState());
        assertTrue(coordinator.isCacheEmpty());

        // 接驾 10 秒 + 送客 100 秒
        simulationService.step(1000);

        assertEquals(1001, scheduler.getNowTick());
        assertEquals(VehicleStateEnum.IDLE, fleet.getVehicle("v1").getState());
        assertEquals(new Point(100, 1000), fleet.getVehicle("v1").getLocation());
        assertTrue(coordinator.isCacheEmpty());
    }

    @Test
    @DisplayName("单笔订单立即中断最近车辆并确认")
    void singleReservationConfirmed() {
        simulationService.start();
        simulationService.step(1);

        RideHailRequest req = dispatchService.reserve(request(2, new Point(2100, 0), new Point(2100, 500)));

        assertEquals(ReservationStatusEnum.CONFIRMED, req.getStatus());
        assertEquals("v2", req.getAssignedVehicleId());
        assertEquals(VehicleStateEnum.IN_SERVICE, fleet.getVehicle("v2").getState());
        assertTrue(coordinator.isCacheEmpty());

        simulationService.step(200);
        assertEquals(VehicleStateEnum.IDLE, fleet.getVehicle("v2").getState());
        assertEquals(new Point(2100, 500), fleet.getVehicle("v2").getLocation());
    }

    @Test
    @DisplayName("半径内无车的订单标记为未匹配")
    void farRequestUnmatched() {
        simulationService.start();
        simulationService.step(1);

        RideHailRequest req = dispatchService.reserve(request(3, new Point(100_000, 0), new Point(100_000, 10)));

        assertEquals(ReservationStatusEnum.UNMATCHED, req.getStatus());
        assertNull(req.getAssignedVehicleId());
    }

    @Test
    @DisplayName("离线车辆不参与波次，也不会被分配订单")
    void offlineVehicleSkipped() {
        VehicleStateReq offline = new VehicleStateReq();
        offline.setVehicleId("v1");
        offline.setStateCode(VehicleStateEnum.OFFLINE.getCode());
        simulationService.setVehicleState(offline);

        RideHailRequest req = dispatchService.bufferRequest(request(4, new Point(0, 0), new Point(0, 300)));
        simulationService.start();
        simulationService.step(1);

        assertEquals(ReservationStatusEnum.CONFIRMED, req.getStatus());
        assertEquals("v2", req.getAssignedVehicleId());
        assertEquals(VehicleStateEnum.OFFLINE, fleet.getVehicle("v1").getState());
    }

    @Test
    @DisplayName("重置后所有状态清空")
    void resetClearsEverything() {
        dispatchService.bufferRequest(request(5, new Point(100, 0), new Point(100, 100)));
        simulationService.start();
        simulationService.step(1);

        simulationService.reset();

        assertEquals(0, fleet.size());
        assertEquals(0, scheduler.getNowTick());
        assertEquals(0, scheduler.getQueuedCount());
        assertTrue(reservationService.list().isEmpty());
        assertTrue(coordinator.isCacheEmpty());
    }
}
