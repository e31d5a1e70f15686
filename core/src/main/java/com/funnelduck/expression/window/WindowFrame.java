package com.funnelduck.expression.window;

import java.util.Objects;

/**
 * A ROWS window frame: {@code ROWS BETWEEN <start> AND <end>}.
 *
 * <p>Only row frames are modeled. Offsets count physical rows relative to the
 * current row in the window ordering.
 */
public final class WindowFrame {

    private final FrameBoundary start;
    private final FrameBoundary end;

    public WindowFrame(FrameBoundary start, FrameBoundary end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
    }

    public FrameBoundary start() {
        return start;
    }

    public FrameBoundary end() {
        return end;
    }

    /**
     * Frame covering every row before the current one, stopping {@code offset} rows back.
     * An offset of 0 includes the current row.
     */
    public static WindowFrame unboundedPrecedingTo(int offset) {
        return new WindowFrame(FrameBoundary.unboundedPreceding(), FrameBoundary.preceding(offset));
    }

    /**
     * Frame holding exactly the row {@code offset} rows before the current one.
     */
    public static WindowFrame exactlyPreceding(int offset) {
        return new WindowFrame(FrameBoundary.preceding(offset), FrameBoundary.preceding(offset));
    }

    @Override
    public String toString() {
        return "ROWS BETWEEN " + start + " AND " + end;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowFrame)) return false;
        WindowFrame that = (WindowFrame) obj;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    /**
     * One end of a frame.
     *
     * @param kind the boundary kind
     * @param offset the row offset, only meaningful for PRECEDING and FOLLOWING
     */
    public record FrameBoundary(Kind kind, int offset) {

        public enum Kind {
            UNBOUNDED_PRECEDING,
            PRECEDING,
            CURRENT_ROW,
            FOLLOWING,
            UNBOUNDED_FOLLOWING
        }

        public FrameBoundary {
            Objects.requireNonNull(kind, "kind must not be null");
            if (offset < 0) {
                throw new IllegalArgumentException("frame offset must not be negative: " + offset);
            }
        }

        public static FrameBoundary unboundedPreceding() {
            return new FrameBoundary(Kind.UNBOUNDED_PRECEDING, 0);
        }

        public static FrameBoundary unboundedFollowing() {
            return new FrameBoundary(Kind.UNBOUNDED_FOLLOWING, 0);
        }

        public static FrameBoundary currentRow() {
            return new FrameBoundary(Kind.CURRENT_ROW, 0);
        }

        public static FrameBoundary preceding(int offset) {
            return offset == 0 ? currentRow() : new FrameBoundary(Kind.PRECEDING, offset);
        }

        public static FrameBoundary following(int offset) {
            return offset == 0 ? currentRow() : new FrameBoundary(Kind.FOLLOWING, offset);
        }

        @Override
        public String toString() {
            return switch (kind) {
                case UNBOUNDED_PRECEDING -> "UNBOUNDED PRECEDING";
                case PRECEDING -> offset + " PRECEDING";
                case CURRENT_ROW -> "CURRENT ROW";
                case FOLLOWING -> offset + " FOLLOWING";
                case UNBOUNDED_FOLLOWING -> "UNBOUNDED FOLLOWING";
            };
        }
    }
}
