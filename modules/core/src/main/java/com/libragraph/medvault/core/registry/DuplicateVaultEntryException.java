package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.VaultErrorKind;

/**
 * Thrown when a new entry would land on an ID that is already taken. Unreachable while
 * the entry counter is only advanced by the registry itself.
 */
public class DuplicateVaultEntryException extends VaultRegistryException {

    private final long entryId;

    public DuplicateVaultEntryException(long entryId) {
        super(VaultErrorKind.DUPLICATE_VAULT_ENTRY, "Vault entry already exists: " + entryId);
        this.entryId = entryId;
    }

    public long entryId() {
        return entryId;
    }
}
