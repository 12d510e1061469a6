package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.ClassificationTags;

import java.util.List;

/**
 * Field validation shared by entry creation and metadata rewrites.
 *
 * <p>Rules run in a fixed order (patient hash, payload size, notes, tags) and the first
 * violation is thrown. Strings must be non-empty ASCII within their length bound and may
 * not contain NUL; {@code null} counts as empty.
 */
public final class EntryFieldRules {

    public static final int MAX_PATIENT_HASH_LENGTH = 64;
    public static final int MAX_DIAGNOSTIC_NOTES_LENGTH = 128;
    public static final long PAYLOAD_SIZE_LIMIT = 1_000_000_000L;

    private EntryFieldRules() {
    }

    public static void check(EntryDraft draft) {
        if (!isAsciiWithin(draft.patientHashCode(), MAX_PATIENT_HASH_LENGTH)) {
            throw new CorruptedIdFormatException("patient_hash_code", MAX_PATIENT_HASH_LENGTH);
        }
        long size = draft.payloadByteSize();
        if (size <= 0 || size >= PAYLOAD_SIZE_LIMIT) {
            throw new OversizedPayloadException(size, PAYLOAD_SIZE_LIMIT);
        }
        if (!isAsciiWithin(draft.diagnosticNotes(), MAX_DIAGNOSTIC_NOTES_LENGTH)) {
            throw new CorruptedIdFormatException("diagnostic_notes", MAX_DIAGNOSTIC_NOTES_LENGTH);
        }
        checkTags(draft.classificationTags());
    }

    static void checkTags(ClassificationTags tags) {
        int count = tags.size();
        if (count < ClassificationTags.MIN_COUNT || count > ClassificationTags.MAX_COUNT) {
            throw new ForbiddenTagTypeException("Tag count must be " + ClassificationTags.MIN_COUNT
                    + ".." + ClassificationTags.MAX_COUNT + ", got: " + count);
        }
        List<String> values = tags.values();
        for (int i = 0; i < values.size(); i++) {
            if (!isAsciiWithin(values.get(i), ClassificationTags.MAX_TAG_LENGTH)) {
                throw new ForbiddenTagTypeException("Tag " + i + " must be 1.."
                        + ClassificationTags.MAX_TAG_LENGTH + " ASCII characters");
            }
        }
    }

    static boolean isAsciiWithin(String value, int maxLength) {
        if (value == null || value.isEmpty() || value.length() > maxLength) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == 0 || c > 0x7F) {
                return false;
            }
        }
        return true;
    }
}
