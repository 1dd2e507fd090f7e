package io.github.jbellis.testdigest.truncation;

import java.util.Arrays;
import java.util.Locale;

public enum ContentType {
    TEXT, JSON, CODE, ERROR, TEST, LOG, MARKDOWN;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup; anything unrecognised is plain text.
     */
    public static ContentType fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id().equalsIgnoreCase(id.trim()))
                .findFirst()
                .orElse(TEXT);
    }
}
