package at.sv.suggest.mining;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts states in the order they are first seen. On equal counts the state seen first is the majority, which keeps
 * mining results reproducible for the same input order.
 */
final class StateTally {

    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private int total;

    void add(String state) {
        counts.merge(state, 1, Integer::sum);
        total++;
    }

    int total() {
        return total;
    }

    boolean isEmpty() {
        return total == 0;
    }

    /**
     * @return the most frequent state, or null if nothing was counted
     */
    Majority majority() {
        String bestState = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                bestState = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        if (bestState == null) {
            return null;
        }
        return new Majority(bestState, bestCount, total);
    }

    record Majority(String state, int count, int total) {
        double confidence() {
            return (double) count / total;
        }
    }
}
