package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.IdentityBridgeEntry;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link IdentityBridgeRepository}.
 * {@link ConcurrentMap#putIfAbsent} stands in for the unique index on signature.
 */
public class InMemoryIdentityBridgeRepository implements IdentityBridgeRepository {

    private final ConcurrentMap<String, IdentityBridgeEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public Optional<IdentityBridgeEntry> findBySignature(String signature) {
        return Optional.ofNullable(entries.get(signature));
    }

    @Override
    public Map<String, IdentityBridgeEntry> findBySignatures(Collection<String> signatures) {
        Map<String, IdentityBridgeEntry> result = new HashMap<>();
        for (String signature : signatures) {
            IdentityBridgeEntry entry = entries.get(signature);
            if (entry != null) {
                result.put(signature, entry);
            }
        }
        return result;
    }

    @Override
    public IdentityBridgeEntry insert(IdentityBridgeEntry entry) {
        IdentityBridgeEntry stored = entry.withId(ids.incrementAndGet());
        IdentityBridgeEntry existing = entries.putIfAbsent(entry.getSignature(), stored);
        if (existing != null) {
            throw new UniqueConstraintViolationException("identity_bridge_signature", entry.getSignature());
        }
        return stored;
    }

    @Override
    public IdentityBridgeEntry update(IdentityBridgeEntry entry) {
        IdentityBridgeEntry replaced = entries.computeIfPresent(entry.getSignature(), (k, v) -> entry);
        if (replaced == null) {
            throw new IllegalArgumentException("Bridge entry not found: " + entry.getSignature());
        }
        return replaced;
    }

    public int size() {
        return entries.size();
    }
}
