package service.algorithm.impl;

import common.consts.TriggerTypeEnum;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 调度错误日志服务
 * 协调器的各类异常都只记录、不抛出，供外部查询
 */
@Component
public class DispatchErrorLog {

    private static final int DEFAULT_CAPACITY = 500;

    private final Deque<ErrorLogEntry> errorBuffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    /**
     * 记录与车辆中断协议相关的异常
     */
    public synchronized void recordProtocolError(ErrorType errorType, long tick, String vehicleId,
                                                 String interruptId, String message) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(errorType);
        entry.setTick(tick);
        entry.setVehicleId(vehicleId);
        entry.setInterruptId(interruptId);
        entry.setMessage(message);
        entry.setTimestamp(System.currentTimeMillis());

        addEntry(entry);
    }

    /**
     * 记录订单修改失败
     */
    public synchronized void recordReservationFailure(long tick, String vehicleId, long reservationRequestId,
                                                      String message) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.RESERVATION_MODIFY_FAILED);
        entry.setTick(tick);
        entry.setVehicleId(vehicleId);
        entry.setReservationRequestId(reservationRequestId);
        entry.setMessage(message);
        entry.setTimestamp(System.currentTimeMillis());

        addEntry(entry);
    }

    /**
     * 记录触发器处理异常
     */
    public synchronized void recordTriggerError(long triggerId, TriggerTypeEnum triggerType, long tick,
                                                String message, Throwable cause) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.TRIGGER_PROCESSING_ERROR);
        entry.setTick(tick);
        entry.setTriggerId(triggerId);
        entry.setTriggerType(triggerType);
        entry.setMessage(message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setTimestamp(System.currentTimeMillis());

        addEntry(entry);
    }

    /**
     * 记录死循环错误
     */
    public synchronized void recordDeadLoopError(long tick, int triggerCount, int threshold, String message) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.DEAD_LOOP);
        entry.setTick(tick);
        entry.setMessage(message);
        entry.setTriggerCount(triggerCount);
        entry.setThreshold(threshold);
        entry.setTimestamp(System.currentTimeMillis());

        addEntry(entry);
    }

    private void addEntry(ErrorLogEntry entry) {
        if (errorBuffer.size() >= DEFAULT_CAPACITY) {
            errorBuffer.removeFirst();
        }
        errorBuffer.addLast(entry);
    }

    /**
     * 查询指定时刻之后的错误日志
     */
    public synchronized List<ErrorLogEntry> listSince(long sinceTick) {
        List<ErrorLogEntry> result = new ArrayList<>();
        for (ErrorLogEntry entry : errorBuffer) {
            if (entry.getTick() >= sinceTick) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * 查询所有错误日志
     */
    public synchronized List<ErrorLogEntry> listAll() {
        return new ArrayList<>(errorBuffer);
    }

    /**
     * 按类型统计
     */
    public synchronized long count(ErrorType errorType) {
        return errorBuffer.stream().filter(e -> e.getErrorType() == errorType).count();
    }

    public synchronized void clear() {
        errorBuffer.clear();
    }

    /**
     * 错误类型
     */
    public enum ErrorType {
        STALE_INTERRUPT_REPLY,     // 回复的中断ID不在缓存中
        PROTOCOL_VIOLATION,        // 无对应尝试或协议状态不符
        REPOSITION_CANCELLED,      // 再平衡目标车辆已离线
        WAVE_VEHICLE_OFFLINE,      // 批量分配波次中车辆已离线
        RESERVATION_MODIFY_FAILED, // 订单目标车辆已离线
        INTERRUPT_REPLY_TIMEOUT,   // 中断回复超时
        TRIGGER_PROCESSING_ERROR,  // 触发器处理异常
        DEAD_LOOP                  // 死循环
    }

    /**
     * 错误日志条目
     */
    @Data
    public static class ErrorLogEntry {
        private ErrorType errorType;
        private long tick;
        private String vehicleId;
        private String interruptId;
        private Long reservationRequestId;
        private Long triggerId;
        private TriggerTypeEnum triggerType;
        private String message;
        private String cause;
        private Integer triggerCount;
        private Integer threshold;
        private long timestamp;
    }
}
