package com.libragraph.medvault.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * The single counter row ({@code id = 1}) seeded by {@link RegistrySchemaDao#seedCounter()}.
 */
@RegisterConstructorMapper(RegistryCounterRecord.class)
public interface RegistryCounterDao {

    @SqlQuery("SELECT total_vault_entries, ledger_height FROM registry_counter WHERE id = 1")
    RegistryCounterRecord read();

    @SqlUpdate("UPDATE registry_counter SET total_vault_entries = :total, ledger_height = :height WHERE id = 1")
    void write(@Bind("total") long totalVaultEntries, @Bind("height") long ledgerHeight);

    @SqlUpdate("UPDATE registry_counter SET ledger_height = ledger_height + 1 WHERE id = 1")
    void advanceHeight();
}
