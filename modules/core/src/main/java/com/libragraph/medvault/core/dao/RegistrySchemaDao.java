package com.libragraph.medvault.core.dao;

import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Idempotent DDL for the registry tables. Kept to SQL that both PostgreSQL and SQLite accept.
 */
public interface RegistrySchemaDao {

    @SqlUpdate("CREATE TABLE IF NOT EXISTS vault_entry (" +
            "entry_id BIGINT PRIMARY KEY, " +
            "patient_hash_code VARCHAR(64) NOT NULL, " +
            "medical_authority TEXT NOT NULL, " +
            "payload_byte_size BIGINT NOT NULL, " +
            "creation_timestamp BIGINT NOT NULL, " +
            "diagnostic_notes VARCHAR(128) NOT NULL, " +
            "classification_tags TEXT NOT NULL)")
    void createVaultEntryTable();

    @SqlUpdate("CREATE TABLE IF NOT EXISTS access_permission (" +
            "entry_id BIGINT NOT NULL, " +
            "accessor_identity TEXT NOT NULL, " +
            "has_access_rights BOOLEAN NOT NULL, " +
            "PRIMARY KEY (entry_id, accessor_identity))")
    void createAccessPermissionTable();

    @SqlUpdate("CREATE TABLE IF NOT EXISTS registry_counter (" +
            "id SMALLINT PRIMARY KEY, " +
            "total_vault_entries BIGINT NOT NULL, " +
            "ledger_height BIGINT NOT NULL)")
    void createRegistryCounterTable();

    @SqlUpdate("INSERT INTO registry_counter (id, total_vault_entries, ledger_height) " +
            "VALUES (1, 0, 0) ON CONFLICT (id) DO NOTHING")
    void seedCounter();
}
