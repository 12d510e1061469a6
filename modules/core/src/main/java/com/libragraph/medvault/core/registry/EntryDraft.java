package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.ClassificationTags;

/**
 * Caller-supplied metadata for creating or rewriting a vault entry. Unvalidated until
 * passed through {@link EntryFieldRules#check(EntryDraft)}.
 */
public record EntryDraft(
        String patientHashCode,
        long payloadByteSize,
        String diagnosticNotes,
        ClassificationTags classificationTags
) {

    public EntryDraft {
        if (classificationTags == null) {
            classificationTags = new ClassificationTags(null);
        }
    }
}
