package service.dispatch;

import common.config.DispatchConfig;
import common.config.ExecutorConfig;
import common.consts.AgentIds;
import common.consts.InterruptOriginEnum;
import common.consts.InterruptReplyTypeEnum;
import common.consts.WaveTypeEnum;
import common.exception.TriggerNotHeldException;
import engine.ScheduleTrigger;
import engine.TriggerHandler;
import engine.TriggerScheduler;
import engine.agent.InterruptReply;
import engine.agent.ModifyScheduleAck;
import engine.agent.VehicleReplyListener;
import lombok.extern.slf4j.Slf4j;
import model.dto.allocation.BatchAllocation;
import model.dto.allocation.RepositionDirective;
import model.dto.allocation.VehicleAllocation;
import model.entity.Point;
import model.entity.RideHailRequest;
import model.entity.RideHailVehicle;
import model.schedule.Leg;
import model.schedule.PassengerSchedule;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import service.algorithm.TravelTimeEstimator;
import service.allocation.VehicleAllocationManager;
import service.fleet.FleetStateTracker;
import service.reservation.ReservationService;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 网约车调度管理器
 *
 * 接收两类波次定时触发器与车辆回复，所有协调决策在单一调度线程上串行执行。
 * 波次：持有触发器 → 中断参与车辆 → 回复到齐后规划 → 下发计划 / 释放车辆 → 完成通知。
 */
@Slf4j
@Service
public class RideHailDispatchService implements TriggerHandler, VehicleReplyListener, InitializingBean {

    private final TriggerScheduler scheduler;
    private final ModifyPassengerScheduleManager coordinator;
    private final WaveController waveController;
    private final VehicleAllocationManager allocationManager;
    private final ReservationService reservations;
    private final FleetStateTracker fleet;
    private final TravelTimeEstimator travelTimeEstimator;
    private final DispatchConfig dispatchConfig;
    private final Executor dispatchExecutor;

    private final Queue<Runnable> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    // 以下状态只在调度线程上读写
    // 波次进行中到达的另一类波次触发器
    private final Deque<ScheduleTrigger> deferredWaveTriggers = new ArrayDeque<>();
    private boolean planned;

    public RideHailDispatchService(TriggerScheduler scheduler,
                                   ModifyPassengerScheduleManager coordinator,
                                   WaveController waveController,
                                   VehicleAllocationManager allocationManager,
                                   ReservationService reservations,
                                   FleetStateTracker fleet,
                                   TravelTimeEstimator travelTimeEstimator,
                                   DispatchConfig dispatchConfig,
                                   @Qualifier(ExecutorConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor) {
        this.scheduler = scheduler;
        this.coordinator = coordinator;
        this.waveController = waveController;
        this.allocationManager = allocationManager;
        this.reservations = reservations;
        this.fleet = fleet;
        this.travelTimeEstimator = travelTimeEstimator;
        this.dispatchConfig = dispatchConfig;
        this.dispatchExecutor = dispatchExecutor;
    }

    @Override
    public void afterPropertiesSet() {
        scheduler.register(this);
    }

    @Override
    public String getAgentId() {
        return AgentIds.RIDE_HAIL_MANAGER;
    }

    @Override
    public void handleTrigger(ScheduleTrigger trigger, TriggerScheduler scheduler) {
        post(() -> onWaveTrigger(trigger));
    }

    @Override
    public void onInterruptReply(InterruptReply reply) {
        post(() -> handleInterruptReply(reply));
    }

    @Override
    public void onModifyScheduleAck(ModifyScheduleAck ack) {
        post(() -> handleModifyScheduleAck(ack));
    }

    /**
     * 单笔订单：立即选车并中断
     */
    public RideHailRequest reserve(RideHailRequest request) {
        reservations.submit(request);
        post(() -> processSingleReservation(request, scheduler.getNowTick()));
        return request;
    }

    /**
     * 缓冲订单：等待下一个批量分配波次
     */
    public RideHailRequest bufferRequest(RideHailRequest request) {
        reservations.submit(request);
        reservations.buffer(request);
        return request;
    }

    /**
     * 场景重置
     */
    public void reset() {
        post(() -> {
            deferredWaveTriggers.clear();
            planned = false;
        });
    }

    //  邮箱

    private void post(Runnable message) {
        mailbox.add(message);
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            dispatchExecutor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            Runnable message;
            while ((message = mailbox.poll()) != null) {
                try {
                    message.run();
                    coordinator.expireUnansweredInterrupts(scheduler.getNowTick());
                    maybePlanWave();
                    startDeferredWave();
                } catch (TriggerNotHeldException e) {
                    // 不变量被破坏，不能静默丢弃波次
                    log.error("波次完成通知缺少持有的触发器", e);
                    throw e;
                } catch (RuntimeException e) {
                    log.error("调度消息处理异常", e);
                }
            }
        } finally {
            draining.set(false);
            if (!mailbox.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    //  波次

    private void onWaveTrigger(ScheduleTrigger trigger) {
        if (waveController.isHoldingTrigger()) {
            log.debug("波次进行中，暂存触发器 {} @ {}", trigger.getType(), trigger.getTick());
            deferredWaveTriggers.add(trigger);
            return;
        }
        startWave(trigger);
    }

    private void startDeferredWave() {
        while (!waveController.isHoldingTrigger() && !deferredWaveTriggers.isEmpty()) {
            startWave(deferredWaveTriggers.poll());
        }
    }

    private void startWave(ScheduleTrigger trigger) {
        WaveTypeEnum waveType = WaveTypeEnum.fromTrigger(trigger.getType());
        if (waveType == null) {
            log.warn("调度管理器收到无法处理的触发器 {}", trigger.getType());
            scheduler.completionNotice(trigger.getTriggerId(), Collections.emptyList());
            return;
        }
        long tick = trigger.getTick();
        coordinator.expireUnansweredInterrupts(tick);
        waveController.holdTickAndTriggerId(tick, trigger.getTriggerId());
        planned = false;
        coordinator.beginWave(waveType, fleet.getIdleAndInServiceVehicleIds(), tick);
    }

    private void maybePlanWave() {
        if (planned || !waveController.isWaveActive() || !coordinator.allWaveRepliesReceived()) {
            return;
        }
        planned = true;
        WaveTypeEnum waveType = waveController.getActiveWave();
        long tick = waveController.getHeldTick();
        List<InterruptAttempt> attempts = coordinator.getRepliedPlanningAttempts();

        // 离线车辆走放弃分支
        Map<String, Point> available = new HashMap<>();
        for (InterruptAttempt attempt : attempts) {
            InterruptReply reply = attempt.getReply();
            if (reply.getType() == InterruptReplyTypeEnum.OFFLINE) {
                coordinator.applyMutation(attempt.getVehicleId(), PassengerSchedule.empty(), tick, null);
            } else if (reply.getType() == InterruptReplyTypeEnum.IDLE) {
                available.put(attempt.getVehicleId(), currentLocation(attempt.getVehicleId(), reply, tick));
            }
        }

        Set<String> used = waveType == WaveTypeEnum.REPOSITION
                ? planReposition(available, tick)
                : planBatchedReservations(available, tick);

        for (InterruptAttempt attempt : attempts) {
            String vehicleId = attempt.getVehicleId();
            if (attempt.getReply().getType() != InterruptReplyTypeEnum.OFFLINE && !used.contains(vehicleId)) {
                coordinator.releaseVehicle(vehicleId);
            }
        }
        log.info("{} 波次规划 @ {}: 参与车辆={}, 下发计划={}", waveType.getDesc(), tick, attempts.size(), used.size());
    }

    private Set<String> planReposition(Map<String, Point> available, long tick) {
        Set<String> used = new HashSet<>();
        List<RepositionDirective> directives =
                allocationManager.repositionVehicles(reservations.drainUnservedPickups(), tick);
        for (RepositionDirective directive : directives) {
            Point from = available.get(directive.getVehicleId());
            if (from == null || !used.add(directive.getVehicleId())) {
                continue;
            }
            Leg leg = travelTimeEstimator.planLeg(from, directive.getTarget(), tick);
            coordinator.applyMutation(directive.getVehicleId(),
                    PassengerSchedule.empty().addLegs(Collections.singletonList(leg)), tick, null);
        }
        return used;
    }

    private Set<String> planBatchedReservations(Map<String, Point> available, long tick) {
        Set<String> used = new HashSet<>();
        for (BatchAllocation batch : allocationManager.allocateBatch(reservations.drainBuffered())) {
            RideHailRequest request = batch.getRequest();
            if (batch.getAllocation().isEmpty()) {
                reservations.markUnmatched(request.getRequestId());
                continue;
            }
            String vehicleId = batch.getAllocation().get().getVehicleId();
            Point from = available.get(vehicleId);
            if (from == null || !used.add(vehicleId)) {
                // 车辆不在本波次中，留待下一波次
                reservations.buffer(request);
                continue;
            }
            reservations.markPending(request.getRequestId(), vehicleId);
            coordinator.applyMutation(vehicleId, buildReservationSchedule(from, request, tick), tick,
                    request.getRequestId());
        }
        return used;
    }

    //  单笔订单

    private void processSingleReservation(RideHailRequest request, long tick) {
        Optional<VehicleAllocation> allocation =
                allocationManager.proposeAllocation(request.getPickup(), dispatchConfig.getSearchRadius());
        if (allocation.isEmpty()) {
            reservations.markUnmatched(request.getRequestId());
            return;
        }
        String vehicleId = allocation.get().getVehicleId();
        PassengerSchedule schedule = buildReservationSchedule(allocation.get().getCurrentLocation(), request, tick);
        if (!coordinator.interruptForReservation(vehicleId, schedule, tick, request.getRequestId())) {
            reservations.buffer(request);
            return;
        }
        reservations.markPending(request.getRequestId(), vehicleId);
    }

    private void handleInterruptReply(InterruptReply reply) {
        coordinator.onInterruptReply(reply);
        Optional<InterruptAttempt> attempt = coordinator.findAttempt(reply.getVehicleId());
        if (attempt.isEmpty()
                || attempt.get().getOrigin() != InterruptOriginEnum.SINGLE_RESERVATION
                || !reply.getInterruptId().equals(attempt.get().getInterruptId())) {
            return;
        }
        // 单笔订单收到回复后立即修改计划
        InterruptAttempt single = attempt.get();
        PassengerSchedule schedule = single.getNewSchedule();
        RideHailRequest request = reservations.get(single.getReservationRequestId());
        if (reply.getType() == InterruptReplyTypeEnum.DRIVING && request != null) {
            Point from = currentLocation(reply.getVehicleId(), reply, reply.getTick());
            schedule = buildReservationSchedule(from, request, reply.getTick());
        }
        coordinator.applyMutation(reply.getVehicleId(), schedule, reply.getTick(), single.getReservationRequestId());
    }

    private void handleModifyScheduleAck(ModifyScheduleAck ack) {
        coordinator.acknowledgeMutation(ack.getVehicleId(), ack.getTriggersToSchedule(), ack.getTick());
        if (ack.getReservationRequestId() != null) {
            reservations.confirm(ack.getReservationRequestId(), ack.getVehicleId());
        }
    }

    //  计划构建

    private PassengerSchedule buildReservationSchedule(Point from, RideHailRequest request, long tick) {
        Leg pickupLeg = travelTimeEstimator.planLeg(from, request.getPickup(), tick);
        Leg tripLeg = travelTimeEstimator.planLeg(request.getPickup(), request.getDropoff(), pickupLeg.getEndTime());
        return PassengerSchedule.empty()
                .addLegs(Arrays.asList(pickupLeg, tripLeg))
                .addPassenger(request.getCustomer(), Collections.singletonList(tripLeg));
    }

    /**
     * 行驶中的车辆以回复所带计划推算位置，其余以跟踪器记录为准
     */
    private Point currentLocation(String vehicleId, InterruptReply reply, long tick) {
        if (reply.getType() == InterruptReplyTypeEnum.DRIVING && reply.getCurrentSchedule() != null
                && !reply.getCurrentSchedule().isEmpty()) {
            for (Leg leg : reply.getCurrentSchedule().getLegs()) {
                if (leg.getEndTime() > tick) {
                    return leg.positionAt(tick);
                }
            }
            return reply.getCurrentSchedule().lastLeg().getEndPoint();
        }
        RideHailVehicle vehicle = fleet.getVehicle(vehicleId);
        return vehicle != null ? vehicle.getLocation() : new Point(0, 0);
    }
}
