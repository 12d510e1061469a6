package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.core.store.RegistryStore;
import com.libragraph.medvault.types.ClassificationTags;
import com.libragraph.medvault.types.Principal;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The vault registry: a catalog of medical record metadata pointers plus a side table of
 * access flags.
 *
 * <p>Every operation runs to completion under a single lock, so entry IDs are assigned
 * race-free and in order. All checks happen before any write; a thrown
 * {@link VaultRegistryException} means nothing changed.
 *
 * <p>Mutating operations take the authenticated caller explicitly. The permission table is
 * written on creation and can be queried, but no mutation consults it: only the recorded
 * medical authority gates transfers and rewrites.
 */
@ApplicationScoped
public class VaultRegistry {

    private static final Logger log = Logger.getLogger(VaultRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final RegistryStore store;

    @Inject
    public VaultRegistry(RegistryStore store) {
        this.store = store;
    }

    // -- mutations --

    /**
     * Creates an entry owned by {@code caller} and grants the caller an access permission.
     *
     * @return the new entry ID, one greater than the previous total
     * @throws CorruptedIdFormatException if the patient hash or notes are malformed
     * @throws OversizedPayloadException if the payload size is out of range
     * @throws ForbiddenTagTypeException if the tag list is malformed
     */
    public long createVaultEntry(Principal caller, String patientHashCode, long payloadByteSize,
                                 String diagnosticNotes, List<String> classificationTags) {
        Objects.requireNonNull(caller, "caller cannot be null");
        EntryDraft draft = new EntryDraft(patientHashCode, payloadByteSize, diagnosticNotes,
                new ClassificationTags(classificationTags));

        return locked(() -> {
            EntryFieldRules.check(draft);
            VaultEntry entry = store.create(draft, caller);
            log.debugf("Vault entry created: id=%d, authority=%s, height=%d",
                    (Object) entry.entryId(), caller, entry.creationTimestamp());
            return entry.entryId();
        });
    }

    /**
     * Hands the entry over to {@code newAuthority}. Permission rows are left as they are.
     *
     * @throws VaultEntryAbsentException if the entry does not exist
     * @throws InvalidAuthTokenException if the caller is not the current authority
     */
    public boolean transferMedicalAuthority(Principal caller, long entryId, Principal newAuthority) {
        Objects.requireNonNull(caller, "caller cannot be null");
        Objects.requireNonNull(newAuthority, "newAuthority cannot be null");

        return locked(() -> {
            VaultEntry entry = requireHeldBy(entryId, caller);
            store.update(entry.withAuthority(newAuthority));
            log.debugf("Vault entry %d transferred: %s -> %s", entryId, caller, newAuthority);
            return true;
        });
    }

    /**
     * Rewrites the patient hash, payload size, notes and tags of an entry under the same
     * rules as creation.
     *
     * @throws VaultEntryAbsentException if the entry does not exist
     * @throws InvalidAuthTokenException if the caller is not the current authority
     */
    public boolean modifyVaultMetadata(Principal caller, long entryId, String newPatientHash,
                                       long newPayloadSize, String newNotes, List<String> newTags) {
        Objects.requireNonNull(caller, "caller cannot be null");
        EntryDraft draft = new EntryDraft(newPatientHash, newPayloadSize, newNotes,
                new ClassificationTags(newTags));

        return locked(() -> {
            VaultEntry entry = requireHeldBy(entryId, caller);
            EntryFieldRules.check(draft);
            store.update(entry.withMetadata(draft));
            log.debugf("Vault entry %d metadata rewritten by %s", entryId, caller);
            return true;
        });
    }

    // -- reads --

    public VaultEntry getVaultEntry(long entryId) {
        return locked(() -> requireEntry(entryId));
    }

    public List<String> getClassificationTags(long entryId) {
        return getVaultEntry(entryId).classificationTags().values();
    }

    public Principal getMedicalAuthority(long entryId) {
        return getVaultEntry(entryId).medicalAuthority();
    }

    public long getCreationTimestamp(long entryId) {
        return getVaultEntry(entryId).creationTimestamp();
    }

    public long getEntryPayloadSize(long entryId) {
        return getVaultEntry(entryId).payloadByteSize();
    }

    public String getDiagnosticSummary(long entryId) {
        return getVaultEntry(entryId).diagnosticNotes();
    }

    public long getTotalVaultCount() {
        return locked(store::totalVaultEntries);
    }

    /** Number of successful mutations so far; new entries are stamped with it. */
    public long getLedgerHeight() {
        return locked(store::ledgerHeight);
    }

    /**
     * @throws PermissionBreachException if no permission row exists for the pair, including
     *                                   when the entry itself does not exist
     */
    public boolean checkAccessPermissions(long entryId, Principal accessor) {
        Objects.requireNonNull(accessor, "accessor cannot be null");
        return locked(() -> store.findPermission(entryId, accessor)
                .orElseThrow(() -> new PermissionBreachException(entryId, accessor))
                .hasAccessRights());
    }

    public String storeType() {
        return store.storeType();
    }

    // -- internals --

    private VaultEntry requireEntry(long entryId) {
        return store.findEntry(entryId)
                .orElseThrow(() -> new VaultEntryAbsentException(entryId));
    }

    private VaultEntry requireHeldBy(long entryId, Principal caller) {
        VaultEntry entry = requireEntry(entryId);
        if (!entry.isHeldBy(caller)) {
            throw new InvalidAuthTokenException(entryId, caller);
        }
        return entry;
    }

    private <T> T locked(Supplier<T> operation) {
        lock.lock();
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }
}
