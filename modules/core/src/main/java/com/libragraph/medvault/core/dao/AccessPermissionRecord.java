package com.libragraph.medvault.core.dao;

import com.libragraph.medvault.core.registry.AccessPermission;
import com.libragraph.medvault.types.Principal;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record AccessPermissionRecord(
        @ColumnName("entry_id") long entryId,
        @ColumnName("accessor_identity") String accessorIdentity,
        @ColumnName("has_access_rights") boolean hasAccessRights
) {

    public AccessPermission toPermission() {
        return new AccessPermission(entryId, Principal.of(accessorIdentity), hasAccessRights);
    }
}
