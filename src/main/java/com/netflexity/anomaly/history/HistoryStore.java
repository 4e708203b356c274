package com.netflexity.anomaly.history;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Persistent store for rule state history.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public interface HistoryStore {

    Mono<Void> addRuleStateHistory(List<RuleStateHistory> records);
}
