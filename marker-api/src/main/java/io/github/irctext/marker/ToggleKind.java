package io.github.irctext.marker;

import org.jetbrains.annotations.Nullable;

/**
 * Boolean style flags flipped by toggle markers. Declaration order is the canonical emission order used when a run of
 * markers is rewritten.
 */
public enum ToggleKind {
    ITALICS(ControlCode.ITALICS),
    BOLD(ControlCode.BOLD),
    UNDERLINE(ControlCode.UNDERLINE),
    REVERSE(ControlCode.REVERSE);

    private final char code;

    ToggleKind(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /** Returns the kind for a reserved toggle character, or null for any other character. */
    public static @Nullable ToggleKind fromCode(char c) {
        for (ToggleKind kind : values()) {
            if (kind.code == c) {
                return kind;
            }
        }
        return null;
    }
}
