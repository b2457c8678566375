package org.hpn.model;

import java.util.Locale;

/**
 * Arc kinds and how each one takes part in enablement and firing.
 */
public enum ArcKind {
    NORMAL("normal"),       // consumes on input, produces on output
    TEST("test"),           // requires tokens >= weight, never consumes
    INHIBITOR("inhibitor"); // disables while tokens >= weight

    private final String tag;

    ArcKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Parse an arc kind tag. Null or blank means normal.
     *
     * @throws IllegalArgumentException for an unknown tag
     */
    public static ArcKind fromTag(String tag) {
        if (tag == null || tag.trim().isEmpty()) {
            return NORMAL;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ArcKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return kind;
            }
        }
        // "read" is the usual synonym for a test arc
        if ("read".equals(normalized)) {
            return TEST;
        }
        throw new IllegalArgumentException("Unknown arc kind: " + tag);
    }
}
