package com.libragraph.medvault.core.dao;

import com.libragraph.medvault.types.ClassificationTags;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

/**
 * Needs the tag codecs registered by {@link com.libragraph.medvault.core.db.JdbiProducer#configure}.
 */
@RegisterConstructorMapper(VaultEntryRecord.class)
public interface VaultEntryDao {

    @SqlUpdate("INSERT INTO vault_entry (entry_id, patient_hash_code, medical_authority, payload_byte_size, " +
            "creation_timestamp, diagnostic_notes, classification_tags) " +
            "VALUES (:entryId, :patientHashCode, :medicalAuthority, :payloadByteSize, " +
            ":creationTimestamp, :diagnosticNotes, :classificationTags)")
    void insert(@Bind("entryId") long entryId,
                @Bind("patientHashCode") String patientHashCode,
                @Bind("medicalAuthority") String medicalAuthority,
                @Bind("payloadByteSize") long payloadByteSize,
                @Bind("creationTimestamp") long creationTimestamp,
                @Bind("diagnosticNotes") String diagnosticNotes,
                @Bind("classificationTags") ClassificationTags classificationTags);

    @SqlUpdate("UPDATE vault_entry SET patient_hash_code = :patientHashCode, " +
            "medical_authority = :medicalAuthority, payload_byte_size = :payloadByteSize, " +
            "diagnostic_notes = :diagnosticNotes, classification_tags = :classificationTags " +
            "WHERE entry_id = :entryId")
    int update(@Bind("entryId") long entryId,
               @Bind("patientHashCode") String patientHashCode,
               @Bind("medicalAuthority") String medicalAuthority,
               @Bind("payloadByteSize") long payloadByteSize,
               @Bind("diagnosticNotes") String diagnosticNotes,
               @Bind("classificationTags") ClassificationTags classificationTags);

    @SqlQuery("SELECT * FROM vault_entry WHERE entry_id = :entryId")
    Optional<VaultEntryRecord> findById(@Bind("entryId") long entryId);

    @SqlQuery("SELECT COUNT(*) FROM vault_entry WHERE entry_id = :entryId")
    int countById(@Bind("entryId") long entryId);
}
