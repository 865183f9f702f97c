package io.fullerstack.ses.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Partition of one cycle's reputation metrics into CRITICAL, WARNING and OK.
 * Every metric that had data appears in exactly one list.
 */
public record ReputationVerdict(
    List<MetricPoint> critical,
    List<MetricPoint> warning,
    List<MetricPoint> ok
) {

    public ReputationVerdict {
        critical = List.copyOf(critical);
        warning = List.copyOf(warning);
        ok = List.copyOf(ok);
    }

    /**
     * Overall status: the most severe non-empty bucket.
     */
    public Status status() {
        if (!critical.isEmpty()) {
            return Status.CRITICAL;
        }
        if (!warning.isEmpty()) {
            return Status.WARNING;
        }
        return Status.OK;
    }

    /**
     * Metrics that breached any threshold, critical ones first.
     */
    public List<MetricPoint> danger() {
        List<MetricPoint> danger = new ArrayList<>(critical.size() + warning.size());
        danger.addAll(critical);
        danger.addAll(warning);
        return List.copyOf(danger);
    }

    public int size() {
        return critical.size() + warning.size() + ok.size();
    }

    /**
     * @return true when no metric had any data this cycle
     */
    public boolean isEmpty() {
        return size() == 0;
    }
}
