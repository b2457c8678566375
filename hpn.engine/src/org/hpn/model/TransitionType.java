package org.hpn.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Declared firing semantics of a transition.
 */
public enum TransitionType {
    IMMEDIATE("immediate"),
    TIMED("timed"),
    STOCHASTIC("stochastic"),
    CONTINUOUS("continuous");

    // A transition that declares no type is continuous
    public static final TransitionType DEFAULT = CONTINUOUS;

    private final String tag;

    TransitionType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Look up a type by its tag, case-insensitively.
     *
     * @return the matching type, {@link #DEFAULT} for a null or blank tag,
     *         or null when the tag names no supported type
     */
    public static TransitionType lookup(String tag) {
        if (tag == null || tag.trim().isEmpty()) {
            return DEFAULT;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (TransitionType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    public static List<String> supportedTags() {
        List<String> tags = new ArrayList<>();
        for (TransitionType type : values()) {
            tags.add(type.tag);
        }
        return tags;
    }
}
