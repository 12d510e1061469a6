package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.VaultErrorKind;

/**
 * Base class for every failure the vault registry reports to its caller.
 * All failures are terminal and leave the registry unchanged.
 */
public abstract class VaultRegistryException extends RuntimeException {

    private final VaultErrorKind kind;

    protected VaultRegistryException(VaultErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public VaultErrorKind kind() {
        return kind;
    }
}
