package io.github.irctext.util;

import java.util.List;

/** Stable per-nickname colors, so the same speaker is always drawn in the same color. */
public final class NickColors {

    // Extended palette entries, shifted down by 16 into the basic 0-15 range
    private static final List<Integer> PALETTE = List.of(19, 20, 22, 24, 25, 26, 27, 28, 29);
    private static final int PALETTE_SHIFT = 16;

    private NickColors() {}

    /** Color index for {@code nick}; a pure function of the nickname's codepoints. */
    public static int colorFor(String nick) {
        long sum = nick.codePoints().asLongStream().sum();
        return PALETTE.get((int) (sum % PALETTE.size())) - PALETTE_SHIFT;
    }
}
