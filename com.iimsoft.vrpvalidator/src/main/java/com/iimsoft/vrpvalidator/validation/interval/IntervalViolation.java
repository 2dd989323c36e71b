package com.iimsoft.vrpvalidator.validation.interval;

import com.iimsoft.vrpvalidator.domain.TimeWindow;

import java.util.Objects;

/**
 * A problem found in one time window list. Indices refer to the caller's list order.
 */
public final class IntervalViolation {

    public enum Kind {
        /** 端点为空或不是合法的 RFC3339 时间 */
        MALFORMED,
        /** start 不早于 end */
        INVERTED,
        /** 两个合法时间窗有公共时刻（半开区间语义） */
        OVERLAP
    }

    private final Kind kind;
    private final int index;
    private final int otherIndex;
    private final TimeWindow window;
    private final TimeWindow otherWindow;

    private IntervalViolation(Kind kind, int index, TimeWindow window, int otherIndex, TimeWindow otherWindow) {
        this.kind = kind;
        this.index = index;
        this.window = window;
        this.otherIndex = otherIndex;
        this.otherWindow = otherWindow;
    }

    static IntervalViolation malformed(int index, TimeWindow window) {
        return new IntervalViolation(Kind.MALFORMED, index, window, -1, null);
    }

    static IntervalViolation inverted(int index, TimeWindow window) {
        return new IntervalViolation(Kind.INVERTED, index, window, -1, null);
    }

    static IntervalViolation overlap(int index, TimeWindow window, int otherIndex, TimeWindow otherWindow) {
        if (otherIndex < index) {
            return new IntervalViolation(Kind.OVERLAP, otherIndex, otherWindow, index, window);
        }
        return new IntervalViolation(Kind.OVERLAP, index, window, otherIndex, otherWindow);
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    /** Second window of an overlap, -1 for the other kinds. */
    public int getOtherIndex() {
        return otherIndex;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public TimeWindow getOtherWindow() {
        return otherWindow;
    }

    public String describe() {
        switch (kind) {
            case MALFORMED:
                return "time window #" + index + " " + window + " is not a pair of RFC3339 timestamps";
            case INVERTED:
                return "time window #" + index + " " + window + " does not end after it starts";
            default:
                return "time windows #" + index + " " + window + " and #" + otherIndex + " " + otherWindow + " overlap";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalViolation)) return false;
        IntervalViolation that = (IntervalViolation) o;
        return index == that.index && otherIndex == that.otherIndex && kind == that.kind
                && Objects.equals(window, that.window) && Objects.equals(otherWindow, that.otherWindow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index, otherIndex, window, otherWindow);
    }

    @Override
    public String toString() {
        return kind + ": " + describe();
    }
}
