package com.airwave.resolution.cache;

/**
 * An active bridge entry already maps the signature to a different work.
 * This is a data-integrity alarm: callers surface it and never pick a side.
 */
public class DuplicateSignatureException extends RuntimeException {

    private final String signature;
    private final long existingWorkId;
    private final long requestedWorkId;

    public DuplicateSignatureException(String signature, long existingWorkId, long requestedWorkId) {
        super("Signature '" + signature + "' is already bridged to work " + existingWorkId
                + ", refusing to bridge it to work " + requestedWorkId);
        this.signature = signature;
        this.existingWorkId = existingWorkId;
        this.requestedWorkId = requestedWorkId;
    }

    public String getSignature() {
        return signature;
    }

    public long getExistingWorkId() {
        return existingWorkId;
    }

    public long getRequestedWorkId() {
        return requestedWorkId;
    }
}
