package com.purchasingpower.fullcycle.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts of the states a run passed through, for the final report.
 */
public class RunStatistics {

    private final Map<String, Integer> stateVisits = new LinkedHashMap<>();
    private int transitions;

    public void recordState(String stateName) {
        stateVisits.merge(stateName, 1, Integer::sum);
        transitions++;
    }

    public Map<String, Integer> getStateVisits() {
        return Collections.unmodifiableMap(stateVisits);
    }

    public int getTransitions() {
        return transitions;
    }
}
