package com.z254.butterfly.triage.correlation;

/**
 * Outcome of one correlation mining run for a workspace.
 *
 * @param eventsScanned events in the lookback window
 * @param pairsCounted  distinct ordered key pairs seen inside the follow window
 * @param rulesUpserted rules that met support and confidence and were stored
 * @param skipped       true when the window held too few events to mine
 */
public record MiningSummary(int eventsScanned, int pairsCounted, int rulesUpserted, boolean skipped) {

    public static MiningSummary skipped(int eventsScanned) {
        return new MiningSummary(eventsScanned, 0, 0, true);
    }
}
