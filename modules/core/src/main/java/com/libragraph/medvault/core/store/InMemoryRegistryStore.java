package com.libragraph.medvault.core.store;

import com.libragraph.medvault.core.registry.AccessPermission;
import com.libragraph.medvault.core.registry.DuplicateVaultEntryException;
import com.libragraph.medvault.core.registry.EntryDraft;
import com.libragraph.medvault.core.registry.VaultEntry;
import com.libragraph.medvault.core.registry.VaultEntryAbsentException;
import com.libragraph.medvault.types.Principal;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Heap-backed RegistryStore for development and testing. State is lost on restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "vault.registry.store", stringValue = "memory")
public class InMemoryRegistryStore implements RegistryStore {

    private final Map<Long, VaultEntry> entries = new HashMap<>();
    private final Map<PermissionKey, AccessPermission> permissions = new HashMap<>();
    private long totalVaultEntries;
    private long ledgerHeight;

    @Override
    public String storeType() {
        return "memory";
    }

    @Override
    public Optional<VaultEntry> findEntry(long entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    @Override
    public Optional<AccessPermission> findPermission(long entryId, Principal accessor) {
        return Optional.ofNullable(permissions.get(new PermissionKey(entryId, accessor)));
    }

    @Override
    public long totalVaultEntries() {
        return totalVaultEntries;
    }

    @Override
    public long ledgerHeight() {
        return ledgerHeight;
    }

    @Override
    public VaultEntry create(EntryDraft draft, Principal authority) {
        long newId = totalVaultEntries + 1;
        if (findEntry(newId).isPresent()) {
            throw new DuplicateVaultEntryException(newId);
        }
        long height = ledgerHeight + 1;
        VaultEntry entry = VaultEntry.create(newId, draft, authority, height);

        entries.put(newId, entry);
        permissions.put(new PermissionKey(newId, authority), AccessPermission.granted(newId, authority));
        totalVaultEntries = newId;
        ledgerHeight = height;
        return entry;
    }

    @Override
    public void update(VaultEntry entry) {
        if (!entries.containsKey(entry.entryId())) {
            throw new VaultEntryAbsentException(entry.entryId());
        }
        entries.put(entry.entryId(), entry);
        ledgerHeight++;
    }

    private record PermissionKey(long entryId, Principal accessor) {}
}
