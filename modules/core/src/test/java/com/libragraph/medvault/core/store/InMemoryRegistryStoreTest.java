package com.libragraph.medvault.core.store;

import com.libragraph.medvault.core.registry.VaultEntry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

class InMemoryRegistryStoreTest extends RegistryStoreContractTest {

    @Override
    protected RegistryStore newStore() {
        return new OutOfBandStore();
    }

    @Override
    protected void seedOutOfBand(VaultEntry entry) {
        ((OutOfBandStore) store).foreign.put(entry.entryId(), entry);
    }

    /** Layers rows written behind the registry's back over the real store. */
    private static class OutOfBandStore extends InMemoryRegistryStore {

        final Map<Long, VaultEntry> foreign = new HashMap<>();

        @Override
        public Optional<VaultEntry> findEntry(long entryId) {
            VaultEntry seeded = foreign.get(entryId);
            return seeded != null ? Optional.of(seeded) : super.findEntry(entryId);
        }
    }
}
