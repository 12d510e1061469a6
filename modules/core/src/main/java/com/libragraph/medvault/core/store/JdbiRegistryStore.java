package com.libragraph.medvault.core.store;

import com.libragraph.medvault.core.dao.AccessPermissionDao;
import com.libragraph.medvault.core.dao.AccessPermissionRecord;
import com.libragraph.medvault.core.dao.RegistryCounterDao;
import com.libragraph.medvault.core.dao.RegistryCounterRecord;
import com.libragraph.medvault.core.dao.RegistrySchemaDao;
import com.libragraph.medvault.core.dao.VaultEntryDao;
import com.libragraph.medvault.core.dao.VaultEntryRecord;
import com.libragraph.medvault.core.registry.AccessPermission;
import com.libragraph.medvault.core.registry.DuplicateVaultEntryException;
import com.libragraph.medvault.core.registry.EntryDraft;
import com.libragraph.medvault.core.registry.VaultEntry;
import com.libragraph.medvault.core.registry.VaultEntryAbsentException;
import com.libragraph.medvault.types.Principal;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.Optional;

/**
 * Database-backed RegistryStore. Each mutation runs in one Jdbi transaction, so a thrown
 * exception rolls back every row it touched.
 *
 * <p>Creates its tables on startup if they are missing.
 */
@ApplicationScoped
@Startup
@IfBuildProperty(name = "vault.registry.store", stringValue = "jdbi", enableIfMissing = true)
public class JdbiRegistryStore implements RegistryStore {

    private static final Logger log = Logger.getLogger(JdbiRegistryStore.class);

    private final Jdbi jdbi;

    @Inject
    public JdbiRegistryStore(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @PostConstruct
    void init() {
        createSchema();
        RegistryCounterRecord counter = jdbi.withExtension(RegistryCounterDao.class, RegistryCounterDao::read);
        log.infof("Vault registry schema ready: entries=%d, height=%d",
                counter.totalVaultEntries(), counter.ledgerHeight());
    }

    public void createSchema() {
        jdbi.useTransaction(handle -> {
            RegistrySchemaDao schema = handle.attach(RegistrySchemaDao.class);
            schema.createVaultEntryTable();
            schema.createAccessPermissionTable();
            schema.createRegistryCounterTable();
            schema.seedCounter();
        });
    }

    @Override
    public String storeType() {
        return "jdbi";
    }

    @Override
    public Optional<VaultEntry> findEntry(long entryId) {
        return jdbi.withExtension(VaultEntryDao.class, dao -> dao.findById(entryId))
                .map(VaultEntryRecord::toEntry);
    }

    @Override
    public Optional<AccessPermission> findPermission(long entryId, Principal accessor) {
        return jdbi.withExtension(AccessPermissionDao.class, dao -> dao.find(entryId, accessor.id()))
                .map(AccessPermissionRecord::toPermission);
    }

    @Override
    public long totalVaultEntries() {
        return jdbi.withExtension(RegistryCounterDao.class, RegistryCounterDao::read).totalVaultEntries();
    }

    @Override
    public long ledgerHeight() {
        return jdbi.withExtension(RegistryCounterDao.class, RegistryCounterDao::read).ledgerHeight();
    }

    @Override
    public VaultEntry create(EntryDraft draft, Principal authority) {
        return jdbi.inTransaction(handle -> {
            RegistryCounterDao counters = handle.attach(RegistryCounterDao.class);
            VaultEntryDao entries = handle.attach(VaultEntryDao.class);

            RegistryCounterRecord counter = counters.read();
            long newId = counter.totalVaultEntries() + 1;
            if (entries.countById(newId) > 0) {
                throw new DuplicateVaultEntryException(newId);
            }
            long height = counter.ledgerHeight() + 1;
            VaultEntry entry = VaultEntry.create(newId, draft, authority, height);

            entries.insert(entry.entryId(), entry.patientHashCode(), authority.id(),
                    entry.payloadByteSize(), entry.creationTimestamp(), entry.diagnosticNotes(),
                    entry.classificationTags());
            handle.attach(AccessPermissionDao.class).insert(newId, authority.id(), true);
            counters.write(newId, height);
            return entry;
        });
    }

    @Override
    public void update(VaultEntry entry) {
        jdbi.useTransaction(handle -> {
            int rows = handle.attach(VaultEntryDao.class).update(entry.entryId(), entry.patientHashCode(),
                    entry.medicalAuthority().id(), entry.payloadByteSize(), entry.diagnosticNotes(),
                    entry.classificationTags());
            if (rows == 0) {
                throw new VaultEntryAbsentException(entry.entryId());
            }
            handle.attach(RegistryCounterDao.class).advanceHeight();
        });
    }
}
