package service.dispatch;

import common.config.DispatchConfig;
import common.consts.AgentIds;
import common.consts.WaveTypeEnum;
import common.exception.TriggerNotHeldException;
import engine.CompletionNoticeSink;
import engine.ScheduleTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 波次控制器
 *
 * 持有触发本波次的 tick 与触发器ID，跟踪仍未完成的车辆集合；
 * 集合清空时向调度器发送唯一一次完成通知，附带波次内累计的后续触发器和下一波次的定时触发器。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WaveController {

    private final CompletionNoticeSink scheduler;
    private final DispatchConfig dispatchConfig;

    private Long heldTick;
    private Long heldTriggerId;

    private WaveTypeEnum activeWave;
    private final Set<String> waitingVehicles = new LinkedHashSet<>();
    private final List<ScheduleTrigger> triggersInWave = new ArrayList<>();

    public synchronized void holdTickAndTriggerId(long tick, long triggerId) {
        if (heldTriggerId != null) {
            throw new IllegalStateException(String.format(
                    "已持有触发器 %d @ %d，无法再持有 %d @ %d", heldTriggerId, heldTick, triggerId, tick));
        }
        heldTick = tick;
        heldTriggerId = triggerId;
    }

    /**
     * 释放持有的 tick 与触发器ID
     * @return [tick, triggerId]
     * @throws TriggerNotHeldException 当前未持有任何触发器
     */
    public synchronized long[] releaseTickAndTriggerId() {
        if (heldTriggerId == null) {
            throw new TriggerNotHeldException(activeWave);
        }
        long[] released = {heldTick, heldTriggerId};
        heldTick = null;
        heldTriggerId = null;
        return released;
    }

    public synchronized boolean isHoldingTrigger() {
        return heldTriggerId != null;
    }

    /**
     * 开始一个波次，空集合立即完成
     */
    public synchronized void startWave(WaveTypeEnum waveType, Collection<String> vehicleIds) {
        if (activeWave != null) {
            throw new IllegalStateException("上一波次尚未完成: " + activeWave);
        }
        activeWave = waveType;
        waitingVehicles.clear();
        waitingVehicles.addAll(vehicleIds);
        log.info("{} 波次开始 @ {}: 车辆数={}", waveType.getDesc(), heldTick, waitingVehicles.size());
        if (waitingVehicles.isEmpty()) {
            waveComplete();
        }
    }

    /**
     * 车辆在本波次中已有终态 (计划已确认 / 已放弃)
     */
    public synchronized void vehicleResolved(String vehicleId) {
        if (!waitingVehicles.remove(vehicleId)) {
            log.error("车辆 {} 不在当前波次的等待集合中", vehicleId);
            return;
        }
        if (waitingVehicles.isEmpty()) {
            waveComplete();
        }
    }

    /**
     * 发送本波次唯一的完成通知，随后复位
     */
    public synchronized void waveComplete() {
        WaveTypeEnum waveType = activeWave;
        if (waveType == null && heldTriggerId != null) {
            throw new IllegalStateException("没有进行中的波次，触发器 " + heldTriggerId + " 保持不变");
        }
        long[] released = releaseTickAndTriggerId();
        long tick = released[0];
        long triggerId = released[1];

        List<ScheduleTrigger> toSend = new ArrayList<>(triggersInWave);
        toSend.add(new ScheduleTrigger(tick + intervalOf(waveType), waveType.getTimerTrigger(), AgentIds.RIDE_HAIL_MANAGER));
        triggersInWave.clear();
        waitingVehicles.clear();
        activeWave = null;

        log.info("{} 波次完成 @ {}: 后续触发器数={}", waveType.getDesc(), tick, toSend.size());
        scheduler.completionNotice(triggerId, toSend);
    }

    /**
     * 波次进行中时累计到完成通知里，否则直接交给调度器
     */
    public synchronized void addTriggersToSendWithCompletion(List<ScheduleTrigger> triggers) {
        if (triggers.isEmpty()) {
            return;
        }
        if (activeWave != null) {
            triggersInWave.addAll(triggers);
        } else {
            scheduler.scheduleTriggers(triggers);
        }
    }

    public synchronized boolean isWaveActive() {
        return activeWave != null;
    }

    public synchronized WaveTypeEnum getActiveWave() {
        return activeWave;
    }

    public synchronized boolean isWaiting(String vehicleId) {
        return waitingVehicles.contains(vehicleId);
    }

    public synchronized Set<String> getWaitingVehicles() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(waitingVehicles));
    }

    public synchronized Long getHeldTick() {
        return heldTick;
    }

    /**
     * 场景重置
     */
    public synchronized void reset() {
        heldTick = null;
        heldTriggerId = null;
        activeWave = null;
        waitingVehicles.clear();
        triggersInWave.clear();
    }

    private long intervalOf(WaveTypeEnum waveType) {
        switch (waveType) {
            case REPOSITION:
                return dispatchConfig.getRepositionTimeoutSec();
            case BATCHED_RESERVATION:
                return dispatchConfig.getRequestBufferTimeoutSec();
            default:
                throw new IllegalArgumentException("未知波次类型: " + waveType);
        }
    }
}
