package com.libragraph.medvault.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(AccessPermissionRecord.class)
public interface AccessPermissionDao {

    @SqlUpdate("INSERT INTO access_permission (entry_id, accessor_identity, has_access_rights) " +
            "VALUES (:entryId, :accessorIdentity, :hasAccessRights)")
    void insert(@Bind("entryId") long entryId,
                @Bind("accessorIdentity") String accessorIdentity,
                @Bind("hasAccessRights") boolean hasAccessRights);

    @SqlQuery("SELECT * FROM access_permission " +
            "WHERE entry_id = :entryId AND accessor_identity = :accessorIdentity")
    Optional<AccessPermissionRecord> find(@Bind("entryId") long entryId,
                                          @Bind("accessorIdentity") String accessorIdentity);
}
