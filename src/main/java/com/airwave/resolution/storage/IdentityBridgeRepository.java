package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.IdentityBridgeEntry;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent store of identity bridge entries. The signature is unique across
 * active and revoked rows alike.
 */
public interface IdentityBridgeRepository {

    Optional<IdentityBridgeEntry> findBySignature(String signature);

    /**
     * Returns every row, active or revoked, for the given signatures.
     */
    Map<String, IdentityBridgeEntry> findBySignatures(Collection<String> signatures);

    /**
     * @throws UniqueConstraintViolationException if a row with the signature exists
     */
    IdentityBridgeEntry insert(IdentityBridgeEntry entry);

    /**
     * Replaces the row for the entry's signature. Used for revocation only.
     */
    IdentityBridgeEntry update(IdentityBridgeEntry entry);
}
