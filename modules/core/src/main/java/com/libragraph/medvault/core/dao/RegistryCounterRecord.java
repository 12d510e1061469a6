package com.libragraph.medvault.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record RegistryCounterRecord(
        @ColumnName("total_vault_entries") long totalVaultEntries,
        @ColumnName("ledger_height") long ledgerHeight
) {}
