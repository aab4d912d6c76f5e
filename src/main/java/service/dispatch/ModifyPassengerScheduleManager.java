package service.dispatch;

import common.config.DispatchConfig;
import common.consts.InterruptOriginEnum;
import common.consts.InterruptReplyTypeEnum;
import common.consts.InterruptStatusEnum;
import common.consts.WaveTypeEnum;
import engine.ScheduleTrigger;
import engine.agent.InterruptReply;
import engine.agent.VehicleAgentRef;
import engine.agent.VehicleCommand;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.dto.snapshot.InterruptAttemptSnapshotDto;
import model.schedule.PassengerSchedule;
import org.springframework.stereotype.Component;
import service.algorithm.impl.DispatchErrorLog;
import service.algorithm.impl.DispatchErrorLog.ErrorType;
import service.fleet.FleetStateTracker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 乘客计划修改协调器
 *
 * 每辆车的协议：中断 → 回复 → (停止行驶) → 下发新计划 → 恢复。
 * 进行中的尝试同时按中断ID与车辆ID索引，保证同一车辆至多一个未完成的尝试。
 * 协议层面的异常只记录日志与错误缓冲，不向调用方抛出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModifyPassengerScheduleManager {

    private final FleetStateTracker fleet;
    private final WaveController waveController;
    private final ReservationFailureListener reservationFailureListener;
    private final DispatchErrorLog errorLog;
    private final DispatchConfig dispatchConfig;

    private final Map<String, InterruptAttempt> interruptIdToAttempt = new HashMap<>();
    private final Map<String, InterruptAttempt> vehicleIdToAttempt = new HashMap<>();
    private int numInterruptRepliesPending = 0;

    /**
     * 开始一个波次：中断所有参与规划的车辆
     * 已被单笔订单占用的车辆不中断，直接从波次中移除
     */
    public synchronized void beginWave(WaveTypeEnum waveType, Collection<String> vehicleIds, long tick) {
        waveController.startWave(waveType, new LinkedHashSet<>(vehicleIds));

        List<InterruptAttempt> toSend = new ArrayList<>();
        for (String vehicleId : vehicleIds) {
            InterruptAttempt existing = vehicleIdToAttempt.get(vehicleId);
            if (existing != null) {
                if (existing.getOrigin() == InterruptOriginEnum.SINGLE_RESERVATION) {
                    log.debug("车辆 {} 正在处理单笔订单，本波次跳过", vehicleId);
                } else {
                    reportProtocolError(tick, vehicleId, existing.getInterruptId(),
                            "车辆已有未完成的修改尝试: " + existing.getOrigin());
                }
                waveController.vehicleResolved(vehicleId);
                continue;
            }
            VehicleAgentRef agent = fleet.getAgent(vehicleId);
            if (agent == null) {
                log.warn("车辆 {} 没有可用代理，本波次跳过", vehicleId);
                waveController.vehicleResolved(vehicleId);
                continue;
            }
            InterruptAttempt attempt = new InterruptAttempt(nextInterruptId(), vehicleId, PassengerSchedule.empty(),
                    null, InterruptOriginEnum.HOLD_FOR_PLANNING, tick, agent);
            saveAttempt(attempt);
            toSend.add(attempt);
        }

        // 先计数再发送：回复可能在发送过程中同步到达
        numInterruptRepliesPending += toSend.size();
        for (InterruptAttempt attempt : toSend) {
            sendInterrupt(attempt);
        }
    }

    /**
     * 为单笔订单中断车辆
     * @return 车辆已有任何未完成的尝试时返回 false，不发送中断
     */
    public synchronized boolean interruptForReservation(String vehicleId, PassengerSchedule schedule, long tick,
                                                        long reservationRequestId) {
        if (vehicleIdToAttempt.containsKey(vehicleId)) {
            log.debug("车辆 {} 已有未完成的修改尝试，订单 {} 无法使用该车", vehicleId, reservationRequestId);
            return false;
        }
        VehicleAgentRef agent = fleet.getAgent(vehicleId);
        if (agent == null) {
            log.warn("车辆 {} 没有可用代理，订单 {} 无法使用该车", vehicleId, reservationRequestId);
            return false;
        }
        InterruptAttempt attempt = new InterruptAttempt(nextInterruptId(), vehicleId, schedule,
                reservationRequestId, InterruptOriginEnum.SINGLE_RESERVATION, tick, agent);
        saveAttempt(attempt);
        numInterruptRepliesPending++;
        sendInterrupt(attempt);
        return true;
    }

    /**
     * 记录车辆对中断的回复，此时尚不修改计划
     */
    public synchronized void onInterruptReply(InterruptReply reply) {
        InterruptAttempt attempt = interruptIdToAttempt.get(reply.getInterruptId());
        if (attempt == null) {
            log.error("中断ID不存在: interruptId {}, 当前计划 {}, 车辆 {}, tick {}", reply.getInterruptId(),
                    reply.getType() == InterruptReplyTypeEnum.DRIVING ? reply.getCurrentSchedule() : "NA",
                    reply.getVehicleId(), reply.getTick());
            errorLog.recordProtocolError(ErrorType.STALE_INTERRUPT_REPLY, reply.getTick(), reply.getVehicleId(),
                    reply.getInterruptId(), "回复的中断不在缓存中: " + reply.getType());
            return;
        }
        if (attempt.isReplyReceived()) {
            log.error("重复的中断回复: interruptId {}, 车辆 {}", reply.getInterruptId(), reply.getVehicleId());
            errorLog.recordProtocolError(ErrorType.STALE_INTERRUPT_REPLY, reply.getTick(), reply.getVehicleId(),
                    reply.getInterruptId(), "重复的中断回复: " + reply.getType());
            return;
        }
        attempt.setReply(reply);
        numInterruptRepliesPending--;
        log.debug("车辆 {} 回复中断 {}: {}", reply.getVehicleId(), reply.getInterruptId(), reply.getType());
    }

    /**
     * 按回复结果下发新计划或放弃
     *
     * 离线：恢复车辆并清除尝试；若为订单则通知订单子系统。
     * 行驶中 / 空闲：[StopDriving] → ModifyPassengerSchedule → Resume。
     */
    public synchronized void applyMutation(String vehicleId, PassengerSchedule newSchedule, long tick,
                                           Long reservationRequestId) {
        InterruptAttempt attempt = vehicleIdToAttempt.get(vehicleId);
        if (attempt == null) {
            reportProtocolError(tick, vehicleId, null, "没有对应的修改尝试");
            dropFromWave(vehicleId);
            return;
        }
        if (attempt.getStatus() != InterruptStatusEnum.INTERRUPT_SENT) {
            // 新计划已下发，等待确认即可
            reportProtocolError(tick, vehicleId, attempt.getInterruptId(), "新计划已下发，不能重复修改");
            return;
        }
        if (!attempt.isReplyReceived()) {
            reportProtocolError(tick, vehicleId, attempt.getInterruptId(), "尚未收到中断回复");
            abandon(attempt);
            return;
        }

        InterruptReply reply = attempt.getReply();
        switch (reply.getType()) {
            case OFFLINE:
                abandonOffline(attempt, tick, reservationRequestId);
                break;
            case DRIVING:
            case IDLE:
                sendModifyPassengerSchedule(attempt, newSchedule, tick, reservationRequestId,
                        reply.getType() == InterruptReplyTypeEnum.DRIVING);
                break;
            default:
                reportProtocolError(tick, vehicleId, attempt.getInterruptId(), "未知的回复类型: " + reply.getType());
                dropFromWave(vehicleId);
        }
    }

    private void abandonOffline(InterruptAttempt attempt, long tick, Long reservationRequestId) {
        String vehicleId = attempt.getVehicleId();
        Long requestId = attempt.getReservationRequestId() != null
                ? attempt.getReservationRequestId() : reservationRequestId;
        boolean repositioning = waveController.getActiveWave() == WaveTypeEnum.REPOSITION
                && attempt.getOrigin() != InterruptOriginEnum.SINGLE_RESERVATION;

        attempt.getAgent().tell(VehicleCommand.resume());
        clearAttempt(attempt);

        if (repositioning) {
            log.debug("车辆 {} 已离线，取消再平衡, interruptId {}", vehicleId, attempt.getInterruptId());
            errorLog.recordProtocolError(ErrorType.REPOSITION_CANCELLED, tick, vehicleId,
                    attempt.getInterruptId(), "车辆已离线，取消再平衡");
        } else if (requestId == null) {
            log.debug("车辆 {} 已离线，退出 {} 波次, interruptId {}", vehicleId,
                    waveController.getActiveWave(), attempt.getInterruptId());
            errorLog.recordProtocolError(ErrorType.WAVE_VEHICLE_OFFLINE, tick, vehicleId,
                    attempt.getInterruptId(), "车辆已离线，退出本波次规划");
        } else {
            log.warn("车辆 {} @ {} 已离线，放弃订单 {} 的计划修改", vehicleId, tick, requestId);
            errorLog.recordReservationFailure(tick, vehicleId, requestId, "车辆已离线，订单计划修改失败");
            reservationFailureListener.onReservationModificationFailed(requestId, vehicleId, tick);
        }
        dropFromWave(vehicleId);
    }

    private void sendModifyPassengerSchedule(InterruptAttempt attempt, PassengerSchedule newSchedule, long tick,
                                             Long reservationRequestId, boolean stopDriving) {
        VehicleAgentRef agent = attempt.getAgent();
        if (reservationRequestId != null) {
            attempt.setReservationRequestId(reservationRequestId);
        }
        attempt.setNewSchedule(newSchedule);
        if (stopDriving) {
            agent.tell(VehicleCommand.stopDriving(tick));
        }
        agent.tell(VehicleCommand.modifyPassengerSchedule(newSchedule, tick, attempt.getReservationRequestId()));
        agent.tell(VehicleCommand.resume());
        attempt.setStatus(InterruptStatusEnum.MODIFY_SENT);
        log.debug("已向车辆 {} 下发新计划: {} 段", attempt.getVehicleId(), newSchedule.size());
    }

    /**
     * 车辆确认新计划生效：累计后续触发器，尝试结束
     */
    public synchronized void acknowledgeMutation(String vehicleId, List<ScheduleTrigger> followUpTriggers, long tick) {
        // 无论尝试状态如何，车辆的路段触发器都必须进入调度
        waveController.addTriggersToSendWithCompletion(followUpTriggers);

        InterruptAttempt attempt = vehicleIdToAttempt.get(vehicleId);
        if (attempt == null || attempt.getStatus() != InterruptStatusEnum.MODIFY_SENT) {
            reportProtocolError(tick, vehicleId, attempt != null ? attempt.getInterruptId() : null,
                    "收到未下发计划的确认");
            return;
        }
        clearAttempt(attempt);
        dropFromWave(vehicleId);
    }

    /**
     * 规划未使用该车：恢复车辆并结束尝试
     */
    public synchronized void releaseVehicle(String vehicleId) {
        InterruptAttempt attempt = vehicleIdToAttempt.get(vehicleId);
        if (attempt == null) {
            dropFromWave(vehicleId);
            return;
        }
        if (attempt.getStatus() == InterruptStatusEnum.MODIFY_SENT) {
            log.warn("车辆 {} 的新计划已下发，不能释放", vehicleId);
            return;
        }
        abandon(attempt);
    }

    /**
     * 放弃超时未回复的中断
     * @return 放弃的尝试数
     */
    public synchronized int expireUnansweredInterrupts(long tick) {
        long timeout = dispatchConfig.getInterruptReplyTimeoutSec();
        if (timeout <= 0) {
            return 0;
        }
        List<InterruptAttempt> expired = new ArrayList<>();
        for (InterruptAttempt attempt : interruptIdToAttempt.values()) {
            if (!attempt.isReplyReceived() && tick - attempt.getTick() >= timeout) {
                expired.add(attempt);
            }
        }
        for (InterruptAttempt attempt : expired) {
            log.warn("车辆 {} 的中断 {} 超过 {} 秒未回复，放弃", attempt.getVehicleId(), attempt.getInterruptId(), timeout);
            errorLog.recordProtocolError(ErrorType.INTERRUPT_REPLY_TIMEOUT, tick, attempt.getVehicleId(),
                    attempt.getInterruptId(), "中断回复超时");
            abandon(attempt);
            if (attempt.getReservationRequestId() != null) {
                reservationFailureListener.onReservationModificationFailed(
                        attempt.getReservationRequestId(), attempt.getVehicleId(), tick);
            }
        }
        return expired.size();
    }

    /**
     * 恢复所有仍持有尝试的车辆并清空缓存，重复调用无副作用
     */
    @PreDestroy
    public synchronized void clearAllPendingInterrupts() {
        if (interruptIdToAttempt.isEmpty()) {
            return;
        }
        log.info("清理 {} 个未完成的修改尝试", interruptIdToAttempt.size());
        for (InterruptAttempt attempt : interruptIdToAttempt.values()) {
            attempt.getAgent().tell(VehicleCommand.resume());
        }
        interruptIdToAttempt.clear();
        vehicleIdToAttempt.clear();
        numInterruptRepliesPending = 0;
    }

    //  查询

    public synchronized boolean isPendingReservation(String vehicleId) {
        InterruptAttempt attempt = vehicleIdToAttempt.get(vehicleId);
        return attempt != null && attempt.getOrigin() == InterruptOriginEnum.SINGLE_RESERVATION;
    }

    public synchronized boolean isVehicleNeitherRepositioningNorProcessingReservation(String vehicleId) {
        return !vehicleIdToAttempt.containsKey(vehicleId);
    }

    public synchronized boolean doesPendingReservationContainSchedule(String vehicleId, PassengerSchedule schedule) {
        InterruptAttempt attempt = vehicleIdToAttempt.get(vehicleId);
        return attempt != null
                && attempt.getOrigin() == InterruptOriginEnum.SINGLE_RESERVATION
                && attempt.getNewSchedule().equals(schedule);
    }

    public synchronized boolean isCacheEmpty() {
        return interruptIdToAttempt.isEmpty() && vehicleIdToAttempt.isEmpty();
    }

    public synchronized int getPendingReplyCount() {
        return numInterruptRepliesPending;
    }

    public synchronized boolean allInterruptRepliesReceived() {
        return numInterruptRepliesPending == 0;
    }

    /**
     * 当前波次发出的中断是否都已回复，单笔订单的尝试不计入
     */
    public synchronized boolean allWaveRepliesReceived() {
        for (InterruptAttempt attempt : vehicleIdToAttempt.values()) {
            if (attempt.getOrigin() == InterruptOriginEnum.HOLD_FOR_PLANNING && !attempt.isReplyReceived()) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return 尝试的副本，修改它不影响协调器
     */
    public synchronized Optional<InterruptAttempt> findAttempt(String vehicleId) {
        return Optional.ofNullable(vehicleIdToAttempt.get(vehicleId)).map(InterruptAttempt::copy);
    }

    /**
     * 当前波次中已回复、尚未下发计划的车辆
     */
    public synchronized List<InterruptAttempt> getRepliedPlanningAttempts() {
        List<InterruptAttempt> result = new ArrayList<>();
        for (InterruptAttempt attempt : vehicleIdToAttempt.values()) {
            if (attempt.getOrigin() == InterruptOriginEnum.HOLD_FOR_PLANNING
                    && attempt.isReplyReceived()
                    && attempt.getStatus() == InterruptStatusEnum.INTERRUPT_SENT) {
                result.add(attempt.copy());
            }
        }
        result.sort((a, b) -> a.getVehicleId().compareTo(b.getVehicleId()));
        return result;
    }

    public synchronized List<InterruptAttemptSnapshotDto> snapshot() {
        List<InterruptAttemptSnapshotDto> result = new ArrayList<>();
        for (InterruptAttempt attempt : vehicleIdToAttempt.values()) {
            InterruptAttemptSnapshotDto dto = new InterruptAttemptSnapshotDto();
            dto.setInterruptId(attempt.getInterruptId());
            dto.setVehicleId(attempt.getVehicleId());
            dto.setOrigin(attempt.getOrigin());
            dto.setStatus(attempt.getStatus());
            dto.setReplyType(attempt.isReplyReceived() ? attempt.getReply().getType() : null);
            dto.setReservationRequestId(attempt.getReservationRequestId());
            dto.setTick(attempt.getTick());
            dto.setNewScheduleLegs(attempt.getNewSchedule().size());
            result.add(dto);
        }
        result.sort((a, b) -> a.getVehicleId().compareTo(b.getVehicleId()));
        return result;
    }

    //  缓存

    private void saveAttempt(InterruptAttempt attempt) {
        interruptIdToAttempt.put(attempt.getInterruptId(), attempt);
        vehicleIdToAttempt.put(attempt.getVehicleId(), attempt);
    }

    private void clearAttempt(InterruptAttempt attempt) {
        log.debug("清除修改尝试 {}", attempt.getInterruptId());
        interruptIdToAttempt.remove(attempt.getInterruptId());
        vehicleIdToAttempt.remove(attempt.getVehicleId());
    }

    private void sendInterrupt(InterruptAttempt attempt) {
        log.debug("发送中断 {} -> 车辆 {} ({})", attempt.getInterruptId(), attempt.getVehicleId(), attempt.getOrigin());
        attempt.getAgent().tell(VehicleCommand.interrupt(attempt.getInterruptId(), attempt.getTick()));
    }

    /**
     * 放弃一个尚未下发计划的尝试：恢复车辆，清除缓存，结束波次成员身份
     */
    private void abandon(InterruptAttempt attempt) {
        if (!attempt.isReplyReceived()) {
            numInterruptRepliesPending--;
        }
        attempt.getAgent().tell(VehicleCommand.resume());
        clearAttempt(attempt);
        dropFromWave(attempt.getVehicleId());
    }

    private void dropFromWave(String vehicleId) {
        if (waveController.isWaiting(vehicleId)) {
            waveController.vehicleResolved(vehicleId);
        }
    }

    private void reportProtocolError(long tick, String vehicleId, String interruptId, String message) {
        log.error("协议错误: 车辆 {}, interruptId {}, tick {}: {}", vehicleId, interruptId, tick, message);
        errorLog.recordProtocolError(ErrorType.PROTOCOL_VIOLATION, tick, vehicleId, interruptId, message);
    }

    private static String nextInterruptId() {
        return UUID.randomUUID().toString();
    }
}
