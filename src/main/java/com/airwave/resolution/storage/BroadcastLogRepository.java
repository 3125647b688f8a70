package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.BroadcastLog;

import java.util.Collection;
import java.util.List;

/**
 * Access to broadcast logs that still need a work linkage.
 */
public interface BroadcastLogRepository {

    BroadcastLog save(BroadcastLog log);

    List<BroadcastLog> findUnlinked();

    /**
     * Links the given logs to a work, skipping any that were linked in the meantime.
     *
     * @return the number of logs actually updated
     */
    int linkToWork(Collection<Long> logIds, long workId, String matchReason);
}
