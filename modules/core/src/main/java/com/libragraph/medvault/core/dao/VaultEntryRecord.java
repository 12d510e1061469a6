package com.libragraph.medvault.core.dao;

import com.libragraph.medvault.core.registry.VaultEntry;
import com.libragraph.medvault.types.ClassificationTags;
import com.libragraph.medvault.types.Principal;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record VaultEntryRecord(
        @ColumnName("entry_id") long entryId,
        @ColumnName("patient_hash_code") String patientHashCode,
        @ColumnName("medical_authority") String medicalAuthority,
        @ColumnName("payload_byte_size") long payloadByteSize,
        @ColumnName("creation_timestamp") long creationTimestamp,
        @ColumnName("diagnostic_notes") String diagnosticNotes,
        @ColumnName("classification_tags") ClassificationTags classificationTags
) {

    public VaultEntry toEntry() {
        return new VaultEntry(entryId, patientHashCode, Principal.of(medicalAuthority),
                payloadByteSize, creationTimestamp, diagnosticNotes, classificationTags);
    }
}
