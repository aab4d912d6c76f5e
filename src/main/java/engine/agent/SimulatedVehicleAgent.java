package engine.agent;

import common.consts.TriggerTypeEnum;
import common.consts.VehicleStateEnum;
import engine.ScheduleTrigger;
import engine.TriggerHandler;
import engine.TriggerScheduler;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import model.entity.RideHailVehicle;
import model.schedule.Leg;
import model.schedule.PassengerSchedule;
import service.fleet.FleetStateTracker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 仿真车辆代理
 *
 * 邮箱在共享线程池上串行消费，同一辆车的指令与触发器严格按到达顺序处理。
 * 只有在暂停状态（收到 INTERRUPT 之后、RESUME 之前）才能安全地改写其乘客计划；
 * 暂停期间到达的触发器先暂存，恢复后再处理。
 */
@Slf4j
public class SimulatedVehicleAgent implements VehicleAgentRef, TriggerHandler {

    private final String vehicleId;
    private final Executor executor;
    private final TriggerScheduler scheduler;
    private final FleetStateTracker fleet;
    private final VehicleReplyListener replyListener;

    private final Queue<Runnable> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    // 以下状态只在邮箱消费时读写
    private volatile boolean paused;
    private volatile PassengerSchedule schedule = PassengerSchedule.empty();
    private List<Leg> legs = Collections.emptyList();
    private int currentLegIndex;
    // 计划版本号，用于识别已被替换计划遗留的 END_LEG 触发器
    private long scheduleVersion;
    private final List<ScheduleTrigger> stashedTriggers = new ArrayList<>();

    public SimulatedVehicleAgent(String vehicleId, Executor executor, TriggerScheduler scheduler,
                                 FleetStateTracker fleet, VehicleReplyListener replyListener) {
        this.vehicleId = vehicleId;
        this.executor = executor;
        this.scheduler = scheduler;
        this.fleet = fleet;
        this.replyListener = replyListener;
    }

    @Override
    public String getVehicleId() {
        return vehicleId;
    }

    @Override
    public String getAgentId() {
        return vehicleId;
    }

    @Override
    public void tell(VehicleCommand command) {
        enqueue(() -> onCommand(command));
    }

    @Override
    public void handleTrigger(ScheduleTrigger trigger, TriggerScheduler scheduler) {
        enqueue(() -> onTrigger(trigger));
    }

    public boolean isPaused() {
        return paused;
    }

    public PassengerSchedule getCurrentSchedule() {
        return schedule;
    }

    //  邮箱

    private void enqueue(Runnable message) {
        mailbox.add(message);
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            Runnable message;
            while ((message = mailbox.poll()) != null) {
                try {
                    message.run();
                } catch (RuntimeException e) {
                    log.error("车辆 {} 处理消息异常", vehicleId, e);
                }
            }
        } finally {
            draining.set(false);
            if (!mailbox.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    //  指令处理

    private void onCommand(VehicleCommand command) {
        switch (command.getType()) {
            case INTERRUPT:
                onInterrupt(command);
                break;
            case STOP_DRIVING:
                onStopDriving(command.getTick());
                break;
            case MODIFY_PASSENGER_SCHEDULE:
                onModifyPassengerSchedule(command);
                break;
            case RESUME:
                onResume();
                break;
            default:
                log.warn("车辆 {} 收到未知指令: {}", vehicleId, command.getType());
        }
    }

    private void onInterrupt(VehicleCommand command) {
        paused = true;
        RideHailVehicle vehicle = fleet.getVehicle(vehicleId);
        InterruptReply reply;
        if (vehicle == null || vehicle.getState() == VehicleStateEnum.OFFLINE) {
            reply = InterruptReply.whileOffline(command.getInterruptId(), vehicleId, command.getTick());
        } else if (isDriving()) {
            reply = InterruptReply.whileDriving(command.getInterruptId(), vehicleId, command.getTick(), schedule);
        } else {
            reply = InterruptReply.whileIdle(command.getInterruptId(), vehicleId, command.getTick());
        }
        log.debug("车辆 {} 已暂停，回复中断 {}: {}", vehicleId, command.getInterruptId(), reply.getType());
        replyListener.onInterruptReply(reply);
    }

    private void onStopDriving(long tick) {
        if (!isDriving()) {
            return;
        }
        // 在当前路段上截断，剩余计划全部作废
        Leg current = legs.get(currentLegIndex);
        fleet.updateLocation(vehicleId, current.positionAt(tick), tick);
        clearSchedule();
        log.debug("车辆 {} 于 {} 停止行驶", vehicleId, tick);
    }

    private void onModifyPassengerSchedule(VehicleCommand command) {
        if (!paused) {
            log.warn("车辆 {} 未暂停时收到新计划，仍然执行", vehicleId);
        }
        PassengerSchedule newSchedule = command.getSchedule() != null ? command.getSchedule() : PassengerSchedule.empty();
        scheduleVersion++;
        schedule = newSchedule;
        legs = newSchedule.getLegs();
        currentLegIndex = 0;

        List<ScheduleTrigger> triggers = new ArrayList<>();
        VehicleStateEnum state = legs.isEmpty() ? VehicleStateEnum.IDLE : VehicleStateEnum.IN_SERVICE;
        if (!fleet.updateStateUnlessOffline(vehicleId, state, command.getTick())) {
            log.debug("车辆 {} 已离线，保持离线状态", vehicleId);
        }
        if (!legs.isEmpty()) {
            triggers.add(legEndTrigger(0, command.getTick()));
        }
        replyListener.onModifyScheduleAck(
                new ModifyScheduleAck(vehicleId, command.getTick(), triggers, command.getReservationRequestId()));
    }

    private void onResume() {
        paused = false;
        List<ScheduleTrigger> replay = new ArrayList<>(stashedTriggers);
        stashedTriggers.clear();
        for (ScheduleTrigger trigger : replay) {
            onLegEnd(trigger);
        }
    }

    //  触发器处理

    private void onTrigger(ScheduleTrigger trigger) {
        if (trigger.getType() != TriggerTypeEnum.END_LEG) {
            log.warn("车辆 {} 收到无法处理的触发器 {}", vehicleId, trigger.getType());
            scheduler.completionNotice(trigger.getTriggerId(), Collections.emptyList());
            return;
        }
        if (paused) {
            stashedTriggers.add(trigger);
            return;
        }
        onLegEnd(trigger);
    }

    private void onLegEnd(ScheduleTrigger trigger) {
        LegProgress progress = (LegProgress) trigger.getData();
        if (progress == null || progress.getScheduleVersion() != scheduleVersion || !isDriving()) {
            // 已被替换的计划遗留的触发器
            scheduler.completionNotice(trigger.getTriggerId(), Collections.emptyList());
            return;
        }
        Leg finished = legs.get(progress.getLegIndex());
        fleet.updateLocation(vehicleId, finished.getEndPoint(), trigger.getTick());

        List<ScheduleTrigger> next = new ArrayList<>();
        int nextIndex = progress.getLegIndex() + 1;
        if (nextIndex < legs.size()) {
            currentLegIndex = nextIndex;
            next.add(legEndTrigger(nextIndex, trigger.getTick()));
        } else {
            clearSchedule();
            if (fleet.updateStateUnlessOffline(vehicleId, VehicleStateEnum.IDLE, trigger.getTick())) {
                log.debug("车辆 {} 于 {} 完成全部路段，当前空闲", vehicleId, trigger.getTick());
            } else {
                log.debug("车辆 {} 于 {} 完成全部路段，保持离线", vehicleId, trigger.getTick());
            }
        }
        scheduler.completionNotice(trigger.getTriggerId(), next);
    }

    private ScheduleTrigger legEndTrigger(int legIndex, long notBefore) {
        long tick = Math.max(legs.get(legIndex).getEndTime(), notBefore);
        return new ScheduleTrigger(tick, TriggerTypeEnum.END_LEG, vehicleId, new LegProgress(scheduleVersion, legIndex));
    }

    private boolean isDriving() {
        return currentLegIndex < legs.size();
    }

    private void clearSchedule() {
        scheduleVersion++;
        schedule = PassengerSchedule.empty();
        legs = Collections.emptyList();
        currentLegIndex = 0;
    }

    /**
     * END_LEG 触发器负载
     */
    @Value
    static class LegProgress {
        long scheduleVersion;
        int legIndex;
    }
}
