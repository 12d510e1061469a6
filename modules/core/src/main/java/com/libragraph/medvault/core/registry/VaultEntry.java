package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.ClassificationTags;
import com.libragraph.medvault.types.Principal;

/**
 * Immutable snapshot of one catalog record.
 *
 * <p>{@code entryId} and {@code creationTimestamp} are fixed at creation; the other fields
 * change only by producing a new snapshot through {@link #withAuthority} or
 * {@link #withMetadata}.
 */
public record VaultEntry(
        long entryId,
        String patientHashCode,
        Principal medicalAuthority,
        long payloadByteSize,
        long creationTimestamp,
        String diagnosticNotes,
        ClassificationTags classificationTags
) {

    public static VaultEntry create(long entryId, EntryDraft draft, Principal authority, long creationTimestamp) {
        return new VaultEntry(entryId, draft.patientHashCode(), authority, draft.payloadByteSize(),
                creationTimestamp, draft.diagnosticNotes(), draft.classificationTags());
    }

    public VaultEntry withAuthority(Principal newAuthority) {
        return new VaultEntry(entryId, patientHashCode, newAuthority, payloadByteSize,
                creationTimestamp, diagnosticNotes, classificationTags);
    }

    public VaultEntry withMetadata(EntryDraft draft) {
        return new VaultEntry(entryId, draft.patientHashCode(), medicalAuthority, draft.payloadByteSize(),
                creationTimestamp, draft.diagnosticNotes(), draft.classificationTags());
    }

    public boolean isHeldBy(Principal principal) {
        return medicalAuthority.equals(principal);
    }
}
