package service;

import common.config.ExecutorConfig;
import common.consts.AgentIds;
import common.consts.ErrorCodes;
import common.consts.TriggerTypeEnum;
import common.consts.VehicleStateEnum;
import common.exception.BusinessException;
import engine.ScheduleTrigger;
import engine.TriggerScheduler;
import engine.agent.SimulatedVehicleAgent;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.FleetLoadReq;
import model.dto.request.VehicleStateReq;
import model.dto.snapshot.DispatchSnapshotDto;
import model.dto.snapshot.VehicleSnapshotDto;
import model.entity.Point;
import model.entity.RideHailVehicle;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import service.algorithm.impl.DispatchErrorLog;
import service.algorithm.impl.TriggerLog;
import service.dispatch.ModifyPassengerScheduleManager;
import service.dispatch.RideHailDispatchService;
import service.dispatch.WaveController;
import service.fleet.FleetStateTracker;
import service.reservation.ReservationService;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 仿真控制：车队装载、启动、推进与重置
 */
@Slf4j
@Service
public class SimulationService {

    private final FleetStateTracker fleet;
    private final TriggerScheduler scheduler;
    private final ModifyPassengerScheduleManager coordinator;
    private final WaveController waveController;
    private final ReservationService reservations;
    private final RideHailDispatchService dispatchService;
    private final TriggerLog triggerLog;
    private final DispatchErrorLog errorLog;
    private final Executor agentExecutor;

    private final Map<String, SimulatedVehicleAgent> agents = new ConcurrentHashMap<>();
    private boolean started;

    public SimulationService(FleetStateTracker fleet,
                             TriggerScheduler scheduler,
                             ModifyPassengerScheduleManager coordinator,
                             WaveController waveController,
                             ReservationService reservations,
                             RideHailDispatchService dispatchService,
                             TriggerLog triggerLog,
                             DispatchErrorLog errorLog,
                             @Qualifier(ExecutorConfig.AGENT_EXECUTOR) Executor agentExecutor) {
        this.fleet = fleet;
        this.scheduler = scheduler;
        this.coordinator = coordinator;
        this.waveController = waveController;
        this.reservations = reservations;
        this.dispatchService = dispatchService;
        this.triggerLog = triggerLog;
        this.errorLog = errorLog;
        this.agentExecutor = agentExecutor;
    }

    /**
     * 清空当前场景后装载车队
     * @return 装载的车辆数
     */
    public synchronized int loadFleet(FleetLoadReq req) {
        reset();
        if (req.getVehicles() == null) {
            return 0;
        }
        for (FleetLoadReq.VehicleSpec spec : req.getVehicles()) {
            VehicleStateEnum state = spec.getStateCode() == null
                    ? VehicleStateEnum.IDLE : VehicleStateEnum.getByCode(spec.getStateCode());
            if (state == null) {
                throw new BusinessException(ErrorCodes.INVALID_VEHICLE_STATE);
            }
            SimulatedVehicleAgent agent = new SimulatedVehicleAgent(
                    spec.getId(), agentExecutor, scheduler, fleet, dispatchService);
            fleet.registerVehicle(new RideHailVehicle(spec.getId(), state, new Point(spec.getPosX(), spec.getPosY()), agent));
            scheduler.register(agent);
            agents.put(spec.getId(), agent);
        }
        log.info("车队装载完成: {} 辆", agents.size());
        return agents.size();
    }

    /**
     * 在当前时刻调度两类波次的首个定时触发器，重复调用无效
     */
    public synchronized boolean start() {
        if (started) {
            log.warn("仿真已启动，忽略重复启动");
            return false;
        }
        long now = scheduler.getNowTick();
        scheduler.scheduleTriggers(Arrays.asList(
                new ScheduleTrigger(now, TriggerTypeEnum.REPOSITION_TIMEOUT, AgentIds.RIDE_HAIL_MANAGER),
                new ScheduleTrigger(now, TriggerTypeEnum.BUFFERED_REQUESTS_TIMEOUT, AgentIds.RIDE_HAIL_MANAGER)));
        started = true;
        return true;
    }

    /**
     * 推进仿真时钟
     * @return 推进后的当前时刻；接收方异步归还触发器时可能尚未到达目标
     */
    public long step(long ticks) {
        if (ticks <= 0) {
            throw new BusinessException(ErrorCodes.INVALID_STEP);
        }
        scheduler.runUntil(scheduler.getNowTick() + ticks);
        return scheduler.getNowTick();
    }

    /**
     * 清空场景：先恢复所有被暂停的车辆，再清理各组件
     */
    public synchronized void reset() {
        coordinator.clearAllPendingInterrupts();
        waveController.reset();
        dispatchService.reset();
        agents.keySet().forEach(scheduler::unregister);
        agents.clear();
        fleet.clearAll();
        scheduler.reset();
        reservations.clearAll();
        triggerLog.clear();
        errorLog.clear();
        started = false;
    }

    /**
     * 外部设置车辆运营状态 (例如下线)
     */
    public void setVehicleState(VehicleStateReq req) {
        VehicleStateEnum state = VehicleStateEnum.getByCode(req.getStateCode());
        if (state == null) {
            throw new BusinessException(ErrorCodes.INVALID_VEHICLE_STATE);
        }
        if (fleet.getVehicle(req.getVehicleId()) == null) {
            throw new BusinessException(ErrorCodes.VEHICLE_NOT_FOUND + ": " + req.getVehicleId());
        }
        fleet.updateState(req.getVehicleId(), state, scheduler.getNowTick());
    }

    public DispatchSnapshotDto snapshot() {
        DispatchSnapshotDto snapshot = new DispatchSnapshotDto();
        snapshot.setNowTick(scheduler.getNowTick());
        snapshot.setQueuedTriggers(scheduler.getQueuedCount());
        snapshot.setAwaitingTriggers(scheduler.getAwaitingCount());
        snapshot.setVehicles(buildVehicleSnapshots());
        snapshot.setAttempts(coordinator.snapshot());
        snapshot.setPendingInterruptReplies(coordinator.getPendingReplyCount());
        snapshot.setActiveWave(waveController.getActiveWave());
        snapshot.setWaitingVehicles(waveController.getWaitingVehicles());
        snapshot.setBufferedRequests(reservations.getBufferedCount());
        return snapshot;
    }

    private List<VehicleSnapshotDto> buildVehicleSnapshots() {
        return fleet.getAllVehicles().stream()
                .sorted(Comparator.comparing(RideHailVehicle::getId))
                .map(vehicle -> {
                    VehicleSnapshotDto dto = new VehicleSnapshotDto();
                    dto.setId(vehicle.getId());
                    dto.setState(vehicle.getState());
                    dto.setPosX(vehicle.getPosX());
                    dto.setPosY(vehicle.getPosY());
                    dto.setLastUpdateTick(vehicle.getLastUpdateTick());

                    SimulatedVehicleAgent agent = agents.get(vehicle.getId());
                    if (agent != null) {
                        dto.setPaused(agent.isPaused());
                        dto.setScheduledLegs(agent.getCurrentSchedule().size());
                    }
                    return dto;
                }).collect(Collectors.toList());
    }
}
