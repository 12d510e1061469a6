package com.libragraph.medvault.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable list of category labels attached to a vault entry.
 *
 * <p>Holds whatever it is given (null elements included) so that the registry's field rules,
 * not this type, decide what is acceptable. Bounds are published here for those rules.
 */
public record ClassificationTags(List<String> values) {

    public static final int MIN_COUNT = 1;
    public static final int MAX_COUNT = 10;
    public static final int MAX_TAG_LENGTH = 32;

    public ClassificationTags {
        values = values == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static ClassificationTags of(String... tags) {
        return new ClassificationTags(tags == null ? null : Arrays.asList(tags));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
