package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.Principal;

public record AccessPermission(long entryId, Principal accessor, boolean hasAccessRights) {

    public static AccessPermission granted(long entryId, Principal accessor) {
        return new AccessPermission(entryId, accessor, true);
    }
}
