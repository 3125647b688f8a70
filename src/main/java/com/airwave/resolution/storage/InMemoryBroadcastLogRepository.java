package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.BroadcastLog;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link BroadcastLogRepository}.
 */
public class InMemoryBroadcastLogRepository implements BroadcastLogRepository {

    private final ConcurrentMap<Long, BroadcastLog> logs = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public BroadcastLog save(BroadcastLog log) {
        BroadcastLog stored = log.getId() != null ? log
                : BroadcastLog.builder(log).id(ids.incrementAndGet()).build();
        logs.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public List<BroadcastLog> findUnlinked() {
        return logs.values().stream()
                .filter(log -> !log.isLinked())
                .sorted(Comparator.comparing(BroadcastLog::getId))
                .toList();
    }

    @Override
    public int linkToWork(Collection<Long> logIds, long workId, String matchReason) {
        AtomicInteger updated = new AtomicInteger();
        for (Long id : logIds) {
            logs.computeIfPresent(id, (k, current) -> {
                if (current.isLinked()) {
                    return current;
                }
                updated.incrementAndGet();
                return current.linkedTo(workId, matchReason);
            });
        }
        return updated.get();
    }

    public BroadcastLog get(long id) {
        return logs.get(id);
    }
}
