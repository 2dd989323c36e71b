package com.iimsoft.vrpvalidator.validation;

/**
 * Stable codes of the problem definition checks. Codes are part of the output contract
 * and must never be renumbered.
 */
public enum ErrorCode {
    E1000("duplicated job ids", "make job ids unique"),
    E1001("invalid job task demand",
            "correct job task demand so that the sum of pickup demand equals the sum of delivery demand"),
    E1002("invalid time windows in jobs",
            "use RFC3339 timestamps, make every window end after it starts and remove overlapping windows"),
    E1003("duplicated vehicle type ids", "make vehicle type ids unique"),
    E1004("duplicated vehicle ids", "make vehicle ids unique across all vehicle types"),
    E1005("invalid vehicle shift time",
            "use RFC3339 timestamps, make every shift window end after it starts and remove overlapping windows");

    private final String title;
    private final String action;

    ErrorCode(String title, String action) {
        this.title = title;
        this.action = action;
    }

    public String getTitle() {
        return title;
    }

    /** 建议的修正动作，调用方可以直接展示。 */
    public String getAction() {
        return action;
    }
}
