package com.iimsoft.vrpvalidator.domain;

import java.util.Objects;

/**
 * A time window as it was read from the problem document.
 *
 * Both endpoints are kept as raw RFC3339 text: parsing is part of validation,
 * so a malformed value must survive until the interval checker sees it.
 */
public final class TimeWindow {

    private final String start;
    private final String end;

    public TimeWindow(String start, String end) {
        this.start = start;
        this.end = end;
    }

    public static TimeWindow of(String start, String end) {
        return new TimeWindow(start, end);
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeWindow)) return false;
        TimeWindow that = (TimeWindow) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
