package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.VaultErrorKind;

/**
 * Thrown when a string field is empty, too long, or not ASCII.
 */
public class CorruptedIdFormatException extends VaultRegistryException {

    private final String field;

    public CorruptedIdFormatException(String field, int maxLength) {
        super(VaultErrorKind.CORRUPTED_ID_FORMAT,
                "Field '" + field + "' must be 1.." + maxLength + " ASCII characters");
        this.field = field;
    }

    public String field() {
        return field;
    }
}
