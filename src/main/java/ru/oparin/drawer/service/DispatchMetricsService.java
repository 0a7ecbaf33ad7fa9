package ru.oparin.drawer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.drawer.model.dto.admin.DispatchStatsDTO;
import ru.oparin.drawer.model.enums.BackendErrorType;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Счетчики диспетчеризации в памяти: успехи по каналам, ошибки по типам,
 * переключения каналов и исчерпанные запросы.
 */
@Slf4j
@Service
public class DispatchMetricsService {

    private final AtomicLong totalRequests = new AtomicLong();
    private final Map<String, LongAdder> successesByChannel = new ConcurrentHashMap<>();
    private final Map<BackendErrorType, LongAdder> failuresByType = new ConcurrentHashMap<>();
    private final AtomicLong failovers = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordSuccess(String channel) {
        successesByChannel.computeIfAbsent(channel, key -> new LongAdder()).increment();
    }

    public void recordFailure(BackendErrorType errorType) {
        failuresByType.computeIfAbsent(errorType, key -> new LongAdder()).increment();
    }

    /**
     * Записать переключение с одного канала на другой.
     */
    public void recordFailover(String fromChannel, String toChannel) {
        long count = failovers.incrementAndGet();
        log.debug("Переключение канала {} -> {} (всего переключений: {})", fromChannel, toChannel, count);
    }

    public void recordExhausted() {
        exhausted.incrementAndGet();
    }

    public void recordRejected() {
        rejected.incrementAndGet();
    }

    public DispatchStatsDTO getStats() {
        Map<String, Long> successes = new TreeMap<>();
        successesByChannel.forEach((channel, adder) -> successes.put(channel, adder.sum()));
        Map<String, Long> failures = new TreeMap<>();
        failuresByType.forEach((type, adder) -> failures.put(type.name(), adder.sum()));
        return DispatchStatsDTO.builder()
                .totalRequests(totalRequests.get())
                .successesByChannel(successes)
                .failuresByErrorType(failures)
                .failovers(failovers.get())
                .exhausted(exhausted.get())
                .rejected(rejected.get())
                .build();
    }
}
