package com.libragraph.medvault.types;

/**
 * Failure kinds reported by the vault registry. Codes are stable and never reused.
 */
public enum VaultErrorKind {
    CORRUPTED_ID_FORMAT(100, "corrupted-id-format"),
    OVERSIZED_PAYLOAD(101, "oversized-payload"),
    FORBIDDEN_TAG_TYPE(102, "forbidden-tag-type"),
    VAULT_ENTRY_ABSENT(103, "vault-entry-absent"),
    INVALID_AUTH_TOKEN(104, "invalid-auth-token"),
    PERMISSION_BREACH(105, "permission-breach"),
    DUPLICATE_VAULT_ENTRY(106, "duplicate-vault-entry");

    private final int code;
    private final String label;

    VaultErrorKind(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static VaultErrorKind fromCode(int code) {
        for (VaultErrorKind k : values()) {
            if (k.code == code) return k;
        }
        throw new IllegalArgumentException("Unknown VaultErrorKind code: " + code);
    }
}
