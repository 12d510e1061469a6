package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.VaultErrorKind;

public class VaultEntryAbsentException extends VaultRegistryException {

    private final long entryId;

    public VaultEntryAbsentException(long entryId) {
        super(VaultErrorKind.VAULT_ENTRY_ABSENT, "Vault entry not found: " + entryId);
        this.entryId = entryId;
    }

    public long entryId() {
        return entryId;
    }
}
