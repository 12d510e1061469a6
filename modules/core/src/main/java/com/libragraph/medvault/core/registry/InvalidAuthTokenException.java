package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.Principal;
import com.libragraph.medvault.types.VaultErrorKind;

/**
 * Thrown when a mutation is attempted by someone other than the entry's medical authority.
 */
public class InvalidAuthTokenException extends VaultRegistryException {

    private final long entryId;
    private final Principal caller;

    public InvalidAuthTokenException(long entryId, Principal caller) {
        super(VaultErrorKind.INVALID_AUTH_TOKEN,
                "Caller " + caller + " is not the medical authority of entry " + entryId);
        this.entryId = entryId;
        this.caller = caller;
    }

    public long entryId() {
        return entryId;
    }

    public Principal caller() {
        return caller;
    }
}
