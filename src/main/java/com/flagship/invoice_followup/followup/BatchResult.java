package com.flagship.invoice_followup.followup;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-outcome tally of one dispatch batch.
 */
public final class BatchResult {

    private final Map<DispatchOutcome, Integer> counts;
    private final int total;

    private BatchResult(Map<DispatchOutcome, Integer> counts, int total) {
        this.counts = Collections.unmodifiableMap(counts);
        this.total = total;
    }

    public static BatchResult of(List<DispatchOutcome> outcomes) {
        Map<DispatchOutcome, Integer> counts = new EnumMap<>(DispatchOutcome.class);
        for (DispatchOutcome outcome : outcomes) {
            counts.merge(outcome, 1, Integer::sum);
        }
        return new BatchResult(counts, outcomes.size());
    }

    public int count(DispatchOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int getTotal() {
        return total;
    }

    public Map<DispatchOutcome, Integer> getCounts() {
        return counts;
    }

    @Override
    public String toString() {
        return "BatchResult{total=" + total + ", counts=" + counts + "}";
    }
}
