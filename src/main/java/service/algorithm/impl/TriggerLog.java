package service.algorithm.impl;

import model.dto.snapshot.TriggerLogEntryDto;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 简单的内存触发器日志（最近 N 条）
 */
@Component
public class TriggerLog {

    private static final int DEFAULT_CAPACITY = 1000;

    private final Deque<TriggerLogEntryDto> buffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    public synchronized void append(TriggerLogEntryDto entry) {
        if (buffer.size() >= DEFAULT_CAPACITY) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
    }

    /**
     * 按仿真时刻过滤最近的触发器
     */
    public synchronized List<TriggerLogEntryDto> listSince(long sinceTick) {
        List<TriggerLogEntryDto> result = new ArrayList<>();
        for (TriggerLogEntryDto dto : buffer) {
            if (dto.getTick() >= sinceTick) {
                result.add(dto);
            }
        }
        return result;
    }

    public synchronized void clear() {
        buffer.clear();
    }
}
