package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.Principal;
import com.libragraph.medvault.types.VaultErrorKind;

public class PermissionBreachException extends VaultRegistryException {

    private final long entryId;
    private final Principal accessor;

    public PermissionBreachException(long entryId, Principal accessor) {
        super(VaultErrorKind.PERMISSION_BREACH,
                "No access permission recorded: entry=" + entryId + " accessor=" + accessor);
        this.entryId = entryId;
        this.accessor = accessor;
    }

    public long entryId() {
        return entryId;
    }

    public Principal accessor() {
        return accessor;
    }
}
