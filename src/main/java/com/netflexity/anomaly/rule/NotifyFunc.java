package com.netflexity.anomaly.rule;

import java.util.List;

/**
 * Receives alert snapshots that are due for delivery.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@FunctionalInterface
public interface NotifyFunc {

    void notify(String groupKey, List<Alert> alerts);
}
