package com.libragraph.medvault.core.store;

import com.libragraph.medvault.core.registry.AccessPermission;
import com.libragraph.medvault.core.registry.DuplicateVaultEntryException;
import com.libragraph.medvault.core.registry.EntryDraft;
import com.libragraph.medvault.core.registry.VaultEntry;
import com.libragraph.medvault.core.registry.VaultEntryAbsentException;
import com.libragraph.medvault.types.Principal;

import java.util.Optional;

/**
 * Persistence for the registry's catalog, permission table and counters.
 *
 * <p>Every mutating method is atomic: it applies all of its writes or none. Callers are
 * responsible for serializing access and for validating field contents beforehand.
 *
 * <p>The ledger height advances by exactly one per successful mutation.
 */
public interface RegistryStore {

    /** Short backend name, reported by the readiness check. */
    String storeType();

    Optional<VaultEntry> findEntry(long entryId);

    Optional<AccessPermission> findPermission(long entryId, Principal accessor);

    long totalVaultEntries();

    long ledgerHeight();

    /**
     * Inserts a new entry at {@code totalVaultEntries() + 1}, stamped with the height this
     * mutation commits at, grants the authority an access permission, and advances both
     * counters.
     *
     * @throws DuplicateVaultEntryException if the next ID is already occupied
     */
    VaultEntry create(EntryDraft draft, Principal authority);

    /**
     * Replaces the stored entry with the same ID. Permission rows are not touched.
     *
     * @throws VaultEntryAbsentException if no entry has that ID
     */
    void update(VaultEntry entry);
}
