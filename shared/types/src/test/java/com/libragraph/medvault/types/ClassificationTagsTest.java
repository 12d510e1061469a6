package com.libragraph.medvault.types;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClassificationTagsTest {

    @Test
    void keepsInsertionOrder() {
        var tags = ClassificationTags.of("radiology", "cardiology", "acute");
        assertThat(tags.values()).containsExactly("radiology", "cardiology", "acute");
        assertThat(tags.size()).isEqualTo(3);
    }

    @Test
    void copiesOnConstruction() {
        List<String> source = new ArrayList<>(List.of("lab"));
        var tags = new ClassificationTags(source);

        source.add("mutated");
        assertThat(tags.values()).containsExactly("lab");
    }

    @Test
    void valuesAreUnmodifiable() {
        var tags = ClassificationTags.of("lab");
        assertThatThrownBy(() -> tags.values().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullListBecomesEmpty() {
        assertThat(new ClassificationTags(null).isEmpty()).isTrue();
    }

    @Test
    void nullElementsArePreservedForValidation() {
        var tags = ClassificationTags.of("lab", null);
        assertThat(tags.values()).containsExactly("lab", null);
    }
}
