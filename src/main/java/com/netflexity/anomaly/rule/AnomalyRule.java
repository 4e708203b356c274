package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.history.EvaluationRecorder;
import com.netflexity.anomaly.link.LinkRequest;
import com.netflexity.anomaly.link.RelatedLinks;
import com.netflexity.anomaly.link.SourceUrls;
import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.model.QueryRangeParams;
import com.netflexity.anomaly.model.QueryRangeResponse;
import com.netflexity.anomaly.model.QueryResult;
import com.netflexity.anomaly.model.Series;
import com.netflexity.anomaly.template.TemplateData;
import com.netflexity.anomaly.template.TemplateExpander;
import com.netflexity.anomaly.template.TemplateExpansionException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple4;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Seasonal anomaly alert rule.
 *
 * Each call to {@link #eval(EvaluationContext, Instant)} plans the current and
 * baseline windows, queries them concurrently, scores every current series
 * against its baselines and applies the matching series to the rule's active
 * alert table. {@link #sendAlerts(Instant, Duration, Duration, NotifyFunc)}
 * hands the alerts that are due to a notifier.
 *
 * Evaluations of one rule are serialized. Alert state, health and the last
 * error are guarded by a separate state lock that is never held while waiting
 * on the backend; readers receive copies.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class AnomalyRule {

    static final String NO_DATA_PREFIX = "[No data] ";

    private static final DateTimeFormatter LAST_SEEN_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final RuleDefinition definition;
    private final RuleCondition condition;
    private final RuleOptions options;
    private final Labels ruleLabels;
    private final Labels ruleAnnotations;
    private final String generatorUrl;

    private final Querier querier;
    private final QueryWindowPlanner planner = new QueryWindowPlanner();
    private final TemporalityResolver temporalityResolver;
    private final AnomalyScorer scorer = new AnomalyScorer();
    private final TemplateExpander templateExpander;
    private final RelatedLinks relatedLinks;
    private final EvaluationRecorder recorder;
    private final ObjectMapper objectMapper;

    private final ReentrantLock evaluationLock = new ReentrantLock();
    private final ReentrantLock stateLock = new ReentrantLock();

    // guarded by stateLock
    private final AlertStateMachine stateMachine;
    private RuleHealth health = RuleHealth.UNKNOWN;
    private String lastError;
    private Duration evaluationDuration = Duration.ZERO;
    private Instant evaluationTimestamp;
    private Instant lastTimestampWithDatapoints;

    public AnomalyRule(RuleDefinition definition, RuleOptions options, RuleDependencies dependencies)
            throws InvalidRuleException {
        if (definition == null) {
            throw new InvalidRuleException("rule definition is required");
        }
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new InvalidRuleException("rule id is required");
        }
        if (definition.getAlertName() == null || definition.getAlertName().isBlank()) {
            throw new InvalidRuleException("alert name is required for rule " + definition.getId());
        }
        if (definition.getCondition() == null) {
            throw new InvalidRuleException("no rule condition for rule " + definition.getId());
        }
        definition.getCondition().validate();

        this.definition = definition;
        this.condition = definition.getCondition();
        this.options = options == null ? RuleOptions.defaults() : options;
        this.ruleLabels = Labels.fromMap(definition.getLabels());
        this.ruleAnnotations = Labels.fromMap(definition.getAnnotations());
        this.generatorUrl = SourceUrls.generatorUrl(definition.getSource(), definition.getId());

        this.querier = dependencies.getQuerier();
        this.temporalityResolver = new TemporalityResolver(dependencies.getMetadataSource(),
                dependencies.getTemporalityCache() != null ? dependencies.getTemporalityCache() : new TemporalityCache());
        this.templateExpander = dependencies.getTemplateExpander();
        this.relatedLinks = dependencies.getRelatedLinks() != null ? dependencies.getRelatedLinks() : RelatedLinks.none();
        this.recorder = dependencies.getRecorder();
        this.objectMapper = dependencies.getObjectMapper() != null
                ? dependencies.getObjectMapper() : new ObjectMapper().findAndRegisterModules();
        this.stateMachine = new AlertStateMachine(definition.getId(), definition.getAlertName(),
                definition.getHoldDuration(), objectMapper);
    }

    public String getId() {
        return definition.getId();
    }

    public String getName() {
        return definition.getAlertName();
    }

    public RuleDefinition getDefinition() {
        return definition;
    }

    public RuleCondition getCondition() {
        return condition;
    }

    public String getGeneratorUrl() {
        return generatorUrl;
    }

    public Duration getEvalWindow() {
        Duration window = definition.getEvalWindow();
        return window == null || window.isZero() ? QueryWindowPlanner.DEFAULT_EVAL_WINDOW : window;
    }

    public Duration getFrequency() {
        Duration frequency = definition.getFrequency();
        return frequency == null || frequency.isZero() ? Duration.ofMinutes(1) : frequency;
    }

    public List<String> getPreferredChannels() {
        return definition.getPreferredChannels() == null ? List.of() : List.copyOf(definition.getPreferredChannels());
    }

    /**
     * Evaluate the rule at {@code ts}.
     *
     * @return number of alerts in the table that stem from scored series
     * @throws RuleEvaluationException when the tick is aborted; the alert table is then unchanged
     */
    public int eval(EvaluationContext ctx, Instant ts) throws RuleEvaluationException {
        evaluationLock.lock();
        try {
            long started = System.nanoTime();
            try {
                Observation observation = buildAndRunQuery(ctx, ts);
                Map<Long, Alert> matched = buildAlerts(observation, ts);

                TransitionResult result;
                int count;
                stateLock.lock();
                try {
                    ctx.checkActive("state transition");
                    if (observation.isHasData()) {
                        lastTimestampWithDatapoints = ts;
                    }
                    result = stateMachine.apply(matched, ts);
                    count = (int) stateMachine.count(alert -> !alert.isMissing());
                } finally {
                    stateLock.unlock();
                }

                if (recorder != null) {
                    recorder.persist(ctx, getId(), result.getHistory());
                }

                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                recordOutcome(ts, elapsed, RuleHealth.GOOD, null);
                if (recorder != null) {
                    recorder.recordSuccess(getId(), elapsed);
                }
                log.info("Rule {} evaluated at {}: {} alerts matched, {} tracked, state {}",
                        getName(), ts, matched.size(), count, result.getCurrentState());
                return count;

            } catch (RuleEvaluationException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                recordOutcome(ts, elapsed, RuleHealth.BAD, e.getMessage());
                if (recorder != null) {
                    recorder.recordFailure(getId(), e, elapsed);
                }
                log.error("Evaluation of rule {} failed ({}): {}", getName(), e.getKind(), e.getMessage());
                throw e;
            }
        } finally {
            evaluationLock.unlock();
        }
    }

    /**
     * Hand every alert due for delivery to {@code notify}.
     *
     * @param ts          current time
     * @param resendDelay minimum time between two deliveries of an unchanged alert
     * @param interval    evaluation interval of the rule
     * @param notify      receiver of the snapshots
     */
    public void sendAlerts(Instant ts, Duration resendDelay, Duration interval, NotifyFunc notify) {
        Duration validity = resendDelay.compareTo(interval) >= 0 ? resendDelay : interval;
        List<Alert> due = new ArrayList<>();

        stateLock.lock();
        try {
            stateMachine.forEach(alert -> {
                if (options.isSendAlways() || alert.needsSending(ts, resendDelay)) {
                    alert.setLastSentAt(ts);
                    alert.setValidUntil(ts.plus(validity.multipliedBy(4)));
                    due.add(alert.copy());
                }
            });
        } finally {
            stateLock.unlock();
        }

        if (due.isEmpty()) {
            return;
        }
        log.debug("Sending {} alerts of rule {}", due.size(), getName());
        notify.notify("", due);
    }

    /**
     * Aggregate state: the most severe state of any tracked alert
     */
    public AlertState getState() {
        stateLock.lock();
        try {
            return stateMachine.aggregateState();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Copies of every tracked alert, resolved ones included
     */
    public List<Alert> currentAlerts() {
        stateLock.lock();
        try {
            return stateMachine.snapshot();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Copies of tracked alerts that are not resolved
     */
    public List<Alert> activeAlerts() {
        stateLock.lock();
        try {
            return stateMachine.unresolvedSnapshot();
        } finally {
            stateLock.unlock();
        }
    }

    public RuleHealth getHealth() {
        stateLock.lock();
        try {
            return health;
        } finally {
            stateLock.unlock();
        }
    }

    public String getLastError() {
        stateLock.lock();
        try {
            return lastError;
        } finally {
            stateLock.unlock();
        }
    }

    public Duration getEvaluationDuration() {
        stateLock.lock();
        try {
            return evaluationDuration;
        } finally {
            stateLock.unlock();
        }
    }

    public Instant getEvaluationTimestamp() {
        stateLock.lock();
        try {
            return evaluationTimestamp;
        } finally {
            stateLock.unlock();
        }
    }

    private void recordOutcome(Instant ts, Duration elapsed, RuleHealth outcome, String error) {
        stateLock.lock();
        try {
            health = outcome;
            lastError = error;
            evaluationDuration = elapsed;
            evaluationTimestamp = ts;
        } finally {
            stateLock.unlock();
        }
    }

    private Observation buildAndRunQuery(EvaluationContext ctx, Instant ts) throws RuleEvaluationException {
        CompositeQuery query = condition.getCompositeQuery();
        if (query == null) {
            throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.CONFIGURATION, "no rule condition");
        }

        AnomalyWindows windows = planner.plan(query, getEvalWindow(), options.getEvalDelay(), ts);
        temporalityResolver.resolve(ctx, windows);

        Map<String, AttributeKey> keys = Map.of();
        Tuple4<QueryRangeResponse, QueryRangeResponse, QueryRangeResponse, QueryRangeResponse> responses = ctx.await(
                Mono.zip(
                        querier.queryRange(windows.getCurrent(), keys),
                        querier.queryRange(windows.getPriorPeriod(), keys),
                        querier.queryRange(windows.getCurrentWeek(), keys),
                        querier.queryRange(windows.getPriorWeek(), keys)),
                "anomaly window queries");
        logWarnings(responses.getT1());

        String selected = condition.selectedQueryName();
        QueryResult current = responses.getT1().find(selected).orElse(null);
        QueryResult priorPeriod = responses.getT2().find(selected).orElse(null);
        QueryResult currentWeek = responses.getT3().find(selected).orElse(null);
        QueryResult priorWeek = responses.getT4().find(selected).orElse(null);

        boolean hasData = current != null && current.getSeries() != null && !current.getSeries().isEmpty();
        Instant lastSeen = hasData ? ts : lastSeen();

        if (condition.isAlertOnAbsent()
                && (lastSeen == null || lastSeen.plus(Duration.ofMinutes(condition.getAbsentFor())).isBefore(ts))) {
            log.info("No data found for rule {} since {}", getId(), lastSeen);
            Labels.Builder labels = Labels.builder();
            if (lastSeen != null) {
                labels.set(Labels.LAST_SEEN, LAST_SEEN_FORMAT.format(lastSeen));
            }
            Sample missing = Sample.builder()
                    .metric(labels.build())
                    .missing(true)
                    .build();
            return new Observation(List.of(missing), hasData, windows.getCurrent());
        }

        List<Sample> samples = new ArrayList<>();
        ScoreDecision firstDecision = null;
        Series firstSeries = null;
        if (hasData) {
            for (Series series : current.getSeries()) {
                ScoreDecision decision = scorer.evaluate(series,
                        scorer.findMatching(priorPeriod, series),
                        scorer.findMatching(currentWeek, series),
                        scorer.findMatching(priorWeek, series),
                        condition.getCompareOp(), condition.getMatchType(), condition.targetValue());
                if (firstDecision == null && decision.isScored()) {
                    firstDecision = decision;
                    firstSeries = series;
                }
                if (decision.isShouldAlert()) {
                    Labels labels = Labels.fromMap(series.getLabels());
                    samples.add(Sample.builder()
                            .metric(labels)
                            .metricOrig(labels)
                            .value(decision.getValue())
                            .build());
                }
            }
        }

        if (samples.isEmpty() && options.isSendUnmatched() && firstDecision != null) {
            Labels labels = Labels.fromMap(firstSeries.getLabels());
            samples.add(Sample.builder()
                    .metric(labels)
                    .metricOrig(labels)
                    .value(firstDecision.getValue())
                    .build());
        }
        return new Observation(samples, hasData, windows.getCurrent());
    }

    private Map<Long, Alert> buildAlerts(Observation observation, Instant ts) throws RuleEvaluationException {
        Map<Long, Alert> alerts = new LinkedHashMap<>();
        String threshold = TemplateData.format(condition.targetValue());
        String host = SourceUrls.host(definition.getSource());

        for (Sample sample : observation.getSamples()) {
            TemplateData data = new TemplateData(sample.getMetric().toMap(), TemplateData.format(sample.getValue()), threshold);

            Labels.Builder labels = sample.getMetric().toBuilder().del(Labels.METRIC_NAME, Labels.TEMPORALITY);
            Labels resultLabels = sample.getMetricOrig().toBuilder().del(Labels.METRIC_NAME, Labels.TEMPORALITY).build();
            for (Labels.Label label : ruleLabels) {
                labels.set(label.getName(), expand(label.getValue(), data));
            }
            labels.set(Labels.ALERT_NAME, sample.isMissing() ? NO_DATA_PREFIX + getName() : getName());
            labels.set(Labels.RULE_ID, getId());
            labels.set(Labels.RULE_SOURCE, generatorUrl);

            Labels.Builder annotations = Labels.builder();
            for (Labels.Label annotation : ruleAnnotations) {
                annotations.set(Labels.normalizeName(annotation.getName()), expand(annotation.getValue(), data));
            }
            relatedLinks.annotationFor(definition.getAlertType(), LinkRequest.builder()
                            .host(host)
                            .start(observation.getWindow().getStart())
                            .end(observation.getWindow().getEnd())
                            .selectedQuery(condition.selectedQueryName())
                            .compositeQuery(condition.getCompositeQuery())
                            .seriesLabels(sample.getMetricOrig())
                            .build())
                    .ifPresent(link -> annotations.set(link.getName(), link.getValue()));

            Labels alertLabels = labels.build();
            long fingerprint = alertLabels.hash();
            if (alerts.containsKey(fingerprint)) {
                log.error("The alert query of rule {} returns duplicate records: {}", getId(), alertLabels);
                throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.DUPLICATE_RESULT,
                        "duplicate alert found, vector contains metrics with the same labelset after applying alert labels");
            }

            Alert alert = new Alert();
            alert.setState(AlertState.PENDING);
            alert.setLabels(alertLabels);
            alert.setQueryResultLabels(resultLabels);
            alert.setAnnotations(annotations.build());
            alert.setActiveAt(ts);
            alert.setValue(sample.getValue());
            alert.setGeneratorUrl(generatorUrl);
            alert.setReceivers(new ArrayList<>(getPreferredChannels()));
            alert.setMissing(sample.isMissing());
            alerts.put(fingerprint, alert);
        }
        return alerts;
    }

    private String expand(String template, TemplateData data) {
        if (templateExpander == null) {
            return template;
        }
        try {
            return templateExpander.expand(template, data);
        } catch (TemplateExpansionException e) {
            log.error("Expanding alert template of rule {} failed: {}", getId(), e.getMessage());
            return "<error expanding template: " + e.getMessage() + ">";
        }
    }

    private Instant lastSeen() {
        stateLock.lock();
        try {
            return lastTimestampWithDatapoints;
        } finally {
            stateLock.unlock();
        }
    }

    private void logWarnings(QueryRangeResponse response) {
        if (response.getWarnings() != null && !response.getWarnings().isEmpty()) {
            log.warn("Query warnings for rule {}: {}", getId(), response.getWarnings());
        }
    }

    @Override
    public String toString() {
        try {
            return objectMapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            return "error marshaling alerting rule: " + e.getMessage();
        }
    }

    /**
     * What the backend returned for one tick
     */
    @lombok.Value
    private static class Observation {
        List<Sample> samples;
        boolean hasData;
        QueryRangeParams window;
    }
}
