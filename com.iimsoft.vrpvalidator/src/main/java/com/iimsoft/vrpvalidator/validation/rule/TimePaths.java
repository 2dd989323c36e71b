package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.validation.interval.IntervalViolation;

final class TimePaths {

    private TimePaths() {
    }

    /** times[i] for a single window, "times[i], times[j]" for an overlapping pair. */
    static String of(String timesPath, IntervalViolation v) {
        String first = timesPath + "[" + v.getIndex() + "]";
        if (v.getKind() == IntervalViolation.Kind.OVERLAP) {
            return first + ", " + timesPath + "[" + v.getOtherIndex() + "]";
        }
        return first;
    }
}
