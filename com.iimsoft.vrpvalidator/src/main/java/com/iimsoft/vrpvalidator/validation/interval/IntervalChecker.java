package com.iimsoft.vrpvalidator.validation.interval;

import com.iimsoft.vrpvalidator.domain.TimeWindow;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 时间窗列表的通用校验，作业时间窗和车辆班次共用同一实现。
 *
 * 规则：
 * 1) 每个时间窗的两个端点都必须能按 RFC3339（必须带时区偏移）解析；
 * 2) start 必须严格早于 end；
 * 3) 合法的时间窗之间不能重叠。
 *
 * 区间按半开 [start, end) 处理：前一个的 end 等于后一个的 start 不算重叠。
 * 不合法的时间窗不参与重叠检查。
 */
public final class IntervalChecker {

    /** RFC3339：秒必填，小数秒可选，时区偏移必填（Z 或 ±HH:MM），T/Z 不区分大小写。 */
    private static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Overlaps are reported pairwise against the window with the latest end seen so far, so every
     * overlapping window is named at least once, but not every overlapping pair is listed:
     * in A[10,14) B[12,16) C[13,15) the pairs A-B and B-C are reported, A-C is not.
     *
     * @param windows time windows in caller order, may be null or contain nulls
     * @return violations: per-window problems in list order, then overlaps in start order
     */
    public List<IntervalViolation> check(List<TimeWindow> windows) {
        List<IntervalViolation> violations = new ArrayList<>();
        if (windows == null || windows.isEmpty()) {
            return violations;
        }

        List<ParsedWindow> valid = new ArrayList<>();
        for (int i = 0; i < windows.size(); i++) {
            TimeWindow window = windows.get(i);
            Instant start = window == null ? null : parse(window.getStart());
            Instant end = window == null ? null : parse(window.getEnd());
            if (start == null || end == null) {
                violations.add(IntervalViolation.malformed(i, window));
            } else if (!start.isBefore(end)) {
                violations.add(IntervalViolation.inverted(i, window));
            } else {
                valid.add(new ParsedWindow(i, window, start, end));
            }
        }

        // 按 start 排序（相同 start 保持原顺序），扫描时记住 end 最晚的那个，
        // 这样被一个长时间窗完整包含的短时间窗也能被发现。
        valid.sort(Comparator.comparing((ParsedWindow w) -> w.start).thenComparingInt(w -> w.index));
        ParsedWindow latest = null;
        for (ParsedWindow current : valid) {
            if (latest != null && current.start.isBefore(latest.end)) {
                violations.add(IntervalViolation.overlap(latest.index, latest.window, current.index, current.window));
            }
            if (latest == null || current.end.isAfter(latest.end)) {
                latest = current;
            }
        }
        return violations;
    }

    /**
     * Parses one RFC3339 timestamp.
     *
     * @return the instant, or null when the text is missing or not a valid timestamp with offset
     */
    static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text.trim(), RFC3339).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static final class ParsedWindow {
        private final int index;
        private final TimeWindow window;
        private final Instant start;
        private final Instant end;

        private ParsedWindow(int index, TimeWindow window, Instant start, Instant end) {
            this.index = index;
            this.window = window;
            this.start = start;
            this.end = end;
        }
    }
}
