package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.Point;
import com.netflexity.anomaly.model.QueryResult;
import com.netflexity.anomaly.model.Series;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Scores series against a seasonal baseline.
 *
 * The expected value of a point is {@code avg(priorPeriod) + avg(currentWeek) - avg(priorWeek)}
 * and its score is the deviation from that value in units of the current week's
 * standard deviation. Series whose baseline has no spread are not scored.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class AnomalyScorer {

    public double average(List<Point> points) {
        if (points.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0;
        for (Point point : points) {
            sum += point.getValue();
        }
        return sum / points.size();
    }

    /**
     * Population standard deviation
     */
    public double stdDev(List<Point> points) {
        if (points.isEmpty()) {
            return Double.NaN;
        }
        double avg = average(points);
        double sum = 0;
        for (Point point : points) {
            sum += Math.pow(point.getValue() - avg, 2);
        }
        return Math.sqrt(sum / points.size());
    }

    public double expectedValue(Series priorPeriod, Series currentWeek, Series priorWeek) {
        return average(priorPeriod.timedPoints())
                + average(currentWeek.timedPoints())
                - average(priorWeek.timedPoints());
    }

    public double score(Series priorPeriod, Series currentWeek, Series priorWeek, double value) {
        return (value - expectedValue(priorPeriod, currentWeek, priorWeek)) / stdDev(currentWeek.timedPoints());
    }

    /**
     * Whether {@code current} should alert under the given comparison
     */
    public boolean shouldAlert(Series current, Series priorPeriod, Series currentWeek, Series priorWeek,
                               CompareOp compareOp, MatchType matchType, double target) {
        return evaluate(current, priorPeriod, currentWeek, priorWeek, compareOp, matchType, target).isShouldAlert();
    }

    public ScoreDecision evaluate(Series current, Series priorPeriod, Series currentWeek, Series priorWeek,
                                  CompareOp compareOp, MatchType matchType, double target) {
        if (current == null || priorPeriod == null || currentWeek == null || priorWeek == null) {
            return ScoreDecision.unscored();
        }

        List<Point> points = current.timedPoints();
        if (points.isEmpty()
                || priorPeriod.timedPoints().isEmpty()
                || currentWeek.timedPoints().isEmpty()
                || priorWeek.timedPoints().isEmpty()) {
            return ScoreDecision.unscored();
        }

        double expected = expectedValue(priorPeriod, currentWeek, priorWeek);
        double deviation = stdDev(currentWeek.timedPoints());
        if (deviation == 0 || !Double.isFinite(deviation) || !Double.isFinite(expected)) {
            log.debug("Baseline of series {} has no usable spread (stddev={}, expected={})",
                    current.getLabels(), deviation, expected);
            return ScoreDecision.unscored();
        }

        return switch (matchType) {
            case AT_LEAST_ONCE -> atLeastOnce(points, expected, deviation, compareOp, target);
            case ALL_THE_TIMES -> allTheTimes(points, expected, deviation, compareOp, target);
            case ON_AVERAGE -> onAverage(points, expected, deviation, compareOp, target);
            case IN_TOTAL -> inTotal(points, expected, deviation, compareOp, target);
            case NONE -> ScoreDecision.noMatch(lastScore(points, expected, deviation));
        };
    }

    /**
     * Series of {@code result} with the same label set as {@code series}, or null
     */
    public Series findMatching(QueryResult result, Series series) {
        if (result == null || result.getSeries() == null) {
            return null;
        }
        long fingerprint = Labels.fromMap(series.getLabels()).hash();
        for (Series candidate : result.getSeries()) {
            if (Labels.fromMap(candidate.getLabels()).hash() == fingerprint) {
                return candidate;
            }
        }
        return null;
    }

    private ScoreDecision atLeastOnce(List<Point> points, double expected, double deviation,
                                      CompareOp compareOp, double target) {
        for (Point point : points) {
            double score = (point.getValue() - expected) / deviation;
            if (compareOp.matches(score, target)) {
                return ScoreDecision.match(score);
            }
        }
        return ScoreDecision.noMatch(lastScore(points, expected, deviation));
    }

    private ScoreDecision allTheTimes(List<Point> points, double expected, double deviation,
                                      CompareOp compareOp, double target) {
        double score = Double.NaN;
        for (Point point : points) {
            score = (point.getValue() - expected) / deviation;
            if (!compareOp.matches(score, target)) {
                return ScoreDecision.noMatch(score);
            }
        }
        return ScoreDecision.match(score);
    }

    private ScoreDecision onAverage(List<Point> points, double expected, double deviation,
                                    CompareOp compareOp, double target) {
        double sum = 0;
        int count = 0;
        for (Point point : points) {
            if (!Double.isFinite(point.getValue())) {
                continue;
            }
            sum += (point.getValue() - expected) / deviation;
            count++;
        }
        if (count == 0) {
            return ScoreDecision.noMatch(Double.NaN);
        }
        double avg = sum / count;
        return compareOp.matches(avg, target) ? ScoreDecision.match(avg) : ScoreDecision.noMatch(avg);
    }

    private ScoreDecision inTotal(List<Point> points, double expected, double deviation,
                                  CompareOp compareOp, double target) {
        double sum = 0;
        int count = 0;
        for (Point point : points) {
            if (!Double.isFinite(point.getValue())) {
                continue;
            }
            sum += (point.getValue() - expected) / deviation;
            count++;
        }
        if (count == 0) {
            return ScoreDecision.noMatch(Double.NaN);
        }
        return compareOp.matches(sum, target) ? ScoreDecision.match(sum) : ScoreDecision.noMatch(sum);
    }

    private double lastScore(List<Point> points, double expected, double deviation) {
        return (points.get(points.size() - 1).getValue() - expected) / deviation;
    }
}
