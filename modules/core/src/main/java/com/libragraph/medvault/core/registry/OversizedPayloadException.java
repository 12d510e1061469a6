package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.VaultErrorKind;

public class OversizedPayloadException extends VaultRegistryException {

    private final long payloadByteSize;

    public OversizedPayloadException(long payloadByteSize, long limit) {
        super(VaultErrorKind.OVERSIZED_PAYLOAD,
                "Payload size must be > 0 and < " + limit + ", got: " + payloadByteSize);
        this.payloadByteSize = payloadByteSize;
    }

    public long payloadByteSize() {
        return payloadByteSize;
    }
}
