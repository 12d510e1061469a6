package com.libragraph.medvault.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PrincipalTest {

    @Test
    void equalIdsAreTheSameIdentity() {
        assertThat(Principal.of("SP2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7"))
                .isEqualTo(new Principal("SP2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7"));
    }

    @Test
    void toStringIsTheBareId() {
        assertThat(Principal.of("dr-house").toString()).isEqualTo("dr-house");
    }

    @Test
    void rejectsNullId() {
        assertThatNullPointerException()
                .isThrownBy(() -> new Principal(null));
    }

    @Test
    void rejectsBlankId() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Principal.of("   "))
                .withMessageContaining("blank");
    }

    @Test
    void rejectsNulInId() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Principal.of("clinic\u0000north"))
                .withMessageContaining("NUL");
    }

    @Test
    void acceptsLongIds() {
        assertThat(Principal.of("p".repeat(300)).id()).hasSize(300);
    }
}
