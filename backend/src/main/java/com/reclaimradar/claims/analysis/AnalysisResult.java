package com.reclaimradar.claims.analysis;

import java.util.Map;

/**
 * Claims created by one analysis run, per pass name (in pass order). A pass that failed reports 0 and is listed
 * in failedPasses.
 */
public record AnalysisResult(int totalCreated, Map<String, Integer> createdByPass, Map<String, String> failedPasses) {

    public boolean hasFailures() {
        return !failedPasses.isEmpty();
    }
}
