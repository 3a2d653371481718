package com.ringlist.api;

import java.util.Objects;

/**
 * Layout of the textual form of a ring list.
 *
 * A list renders as each value followed by {@code delimiter}, then
 * {@code endMarker}, then {@code terminator}. With {@link #DEFAULT} the values
 * a, b, c added in that order render as {@code "c -> b -> a -> (sentinel)\n"}.
 *
 * @param delimiter  Appended after every rendered value.
 * @param endMarker  Stands for the sentinel at the end of the sequence.
 * @param terminator Appended after the end marker.
 */
public record RingFormat(String delimiter, String endMarker, String terminator) {

    public static final RingFormat DEFAULT = new RingFormat(" -> ", "(sentinel)", "\n");

    public RingFormat {
        Objects.requireNonNull(delimiter, "delimiter");
        Objects.requireNonNull(endMarker, "endMarker");
        Objects.requireNonNull(terminator, "terminator");
    }

    public RingFormat withDelimiter(String delimiter) {
        return new RingFormat(delimiter, endMarker, terminator);
    }

    public RingFormat withEndMarker(String endMarker) {
        return new RingFormat(delimiter, endMarker, terminator);
    }

    public RingFormat withTerminator(String terminator) {
        return new RingFormat(delimiter, endMarker, terminator);
    }
}
