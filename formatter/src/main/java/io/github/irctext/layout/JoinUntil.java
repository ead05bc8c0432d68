package io.github.irctext.layout;

import io.github.irctext.marker.DisplayWidth;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToIntFunction;
import org.jetbrains.annotations.Nullable;

/**
 * Packs as many leading parts as fit under a size ceiling into one separator-joined string. Parts are never reordered
 * and a rejected part ends the scan.
 */
public final class JoinUntil {

    private JoinUntil() {}

    /** Joins every part; empty when {@code parts} is empty. */
    public static Optional<String> joinUntil(String separator, Iterable<String> parts) {
        return joinUntil(separator, parts, Integer.MAX_VALUE, DisplayWidth::displayWidth);
    }

    /** Joins under a ceiling measured in display width. */
    public static Optional<String> joinUntil(String separator, Iterable<String> parts, int ceiling) {
        return joinUntil(separator, parts, ceiling, DisplayWidth::displayWidth);
    }

    /**
     * Joins leading {@code parts} with {@code separator} while {@code measure} of the joined result stays within
     * {@code ceiling}. {@code measure} is assumed to grow monotonically with appended text.
     *
     * @return the longest feasible prefix, or empty if there are no parts or the first part alone exceeds the ceiling
     */
    public static Optional<String> joinUntil(
            String separator, Iterable<String> parts, int ceiling, ToIntFunction<String> measure) {
        Objects.requireNonNull(separator, "separator");
        Objects.requireNonNull(parts, "parts");
        Objects.requireNonNull(measure, "measure");
        if (ceiling < 0) {
            throw new IllegalArgumentException("ceiling must not be negative: " + ceiling);
        }

        @Nullable String result = null;
        for (String part : parts) {
            String candidate = result == null ? part : result + separator + part;
            if (measure.applyAsInt(candidate) > ceiling) {
                break;
            }
            result = candidate;
        }
        return Optional.ofNullable(result);
    }
}
