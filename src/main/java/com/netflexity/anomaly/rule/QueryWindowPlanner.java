package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.BuilderQuery;
import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.model.PanelType;
import com.netflexity.anomaly.model.QueryRangeParams;
import com.netflexity.anomaly.model.StepIntervals;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Derives the current and seasonal baseline windows of an evaluation.
 *
 * Planning is a pure function of its arguments: the passed composite query is
 * never modified and every window receives its own deep copy.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class QueryWindowPlanner {

    public static final Duration DEFAULT_EVAL_WINDOW = Duration.ofMinutes(5);

    static final Duration SEASON_OFFSET = Duration.ofHours(166);
    static final Duration SEASON_PADDING = Duration.ofHours(2);
    static final Duration WEEK = Duration.ofDays(7);

    private static final long MINUTE_MILLIS = 60_000L;

    /**
     * Plan the windows for an evaluation at {@code ts}.
     *
     * @param query      the rule's composite query, left untouched
     * @param evalWindow evaluated window length, five minutes when null or zero
     * @param evalDelay  shift into the past, none when null
     * @param ts         evaluation timestamp
     */
    public AnomalyWindows plan(CompositeQuery query, Duration evalWindow, Duration evalDelay, Instant ts) {
        Duration window = evalWindow == null || evalWindow.isZero() || evalWindow.isNegative()
                ? DEFAULT_EVAL_WINDOW : evalWindow;
        Duration delay = evalDelay == null ? Duration.ZERO : evalDelay;

        long end = floorToMinute(ts.toEpochMilli() - delay.toMillis());
        long start = floorToMinute(ts.toEpochMilli() - window.toMillis() - delay.toMillis());

        long priorStart = start - SEASON_OFFSET.toMillis() - SEASON_PADDING.toMillis();
        long priorEnd = end - SEASON_OFFSET.toMillis() + SEASON_PADDING.toMillis();

        long weekStart = start - WEEK.toMillis();
        long priorWeekStart = weekStart - WEEK.toMillis();

        AnomalyWindows windows = new AnomalyWindows(
                window(query, start, end),
                window(query, priorStart, priorEnd),
                window(query, weekStart, end),
                window(query, priorWeekStart, weekStart));

        log.debug("Planned windows at {}: current=[{}, {}] priorPeriod=[{}, {}] currentWeek=[{}, {}] priorWeek=[{}, {}]",
                ts, start, end, priorStart, priorEnd, weekStart, end, priorWeekStart, weekStart);
        return windows;
    }

    private QueryRangeParams window(CompositeQuery query, long start, long end) {
        long step = Math.max(StepIntervals.minAllowedStepInterval(start, end), StepIntervals.MIN_ALERT_STEP_SECONDS);

        CompositeQuery copy = query.deepCopy();
        copy.setPanelType(PanelType.GRAPH);
        for (BuilderQuery builderQuery : copy.getBuilderQueries().values()) {
            if (builderQuery.getStepInterval() < step) {
                builderQuery.setStepInterval(step);
            }
        }

        return QueryRangeParams.builder()
                .start(start)
                .end(end)
                .step(step)
                .compositeQuery(copy)
                .build();
    }

    static long floorToMinute(long millis) {
        return millis - Math.floorMod(millis, MINUTE_MILLIS);
    }
}
