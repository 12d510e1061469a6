package com.libragraph.medvault.types;

import java.util.Objects;

/**
 * Authenticated identity acting on, or recorded against, a vault entry.
 *
 * <p>Opaque to the registry: two principals are the same identity iff their ids are equal.
 */
public record Principal(String id) {

    public Principal {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Principal id must not be blank");
        }
        if (id.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Principal id must not contain NUL");
        }
    }

    public static Principal of(String id) {
        return new Principal(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
