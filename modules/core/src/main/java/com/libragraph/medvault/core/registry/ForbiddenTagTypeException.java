package com.libragraph.medvault.core.registry;

import com.libragraph.medvault.types.VaultErrorKind;

/**
 * Thrown when the tag list has the wrong number of tags or a tag that is empty,
 * too long, or not ASCII.
 */
public class ForbiddenTagTypeException extends VaultRegistryException {

    public ForbiddenTagTypeException(String message) {
        super(VaultErrorKind.FORBIDDEN_TAG_TYPE, message);
    }
}
