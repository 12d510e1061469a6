package com.libragraph.medvault.types;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class VaultErrorKindTest {

    @Test
    void codesAreUnique() {
        assertThat(Arrays.stream(VaultErrorKind.values()).map(VaultErrorKind::code))
                .doesNotHaveDuplicates();
    }

    @Test
    void fromCodeResolvesEveryKind() {
        for (VaultErrorKind kind : VaultErrorKind.values()) {
            assertThat(VaultErrorKind.fromCode(kind.code())).isEqualTo(kind);
        }
    }

    @Test
    void fromCodeRejectsUnknown() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> VaultErrorKind.fromCode(999))
                .withMessageContaining("999");
    }
}
