package org.wff.generator;

import java.util.EnumMap;
import java.util.Map;

/**
 * STATISTICHE DI GENERAZIONE - Contatori cumulativi del generatore
 *
 * Tentativi, problemi prodotti, scarti per motivo e dimensione dell'ultimo piano.
 */
public class GenerationStatistics {

    /** Motivi per cui un tentativo viene scartato */
    public enum FailureReason {
        UNSOLVED_PLAN,      // la fase 2 non ha trovato un riempimento coerente
        NO_PREMISES,
        CONTRADICTION,      // asserzioni atomiche opposte tra le premesse
        TRIVIAL_GOAL        // l'obiettivo compare tra le premesse
    }

    private int attempts = 0;
    private int generatedProblems = 0;
    private int exhaustedRuns = 0;
    private int lastPlanSize = 0;
    private final Map<FailureReason, Integer> failures = new EnumMap<>(FailureReason.class);

    //region AGGIORNAMENTO

    void recordAttempt(int planSize) {
        attempts++;
        lastPlanSize = planSize;
    }

    void recordFailure(FailureReason reason) {
        failures.merge(reason, 1, Integer::sum);
    }

    void recordSuccess() {
        generatedProblems++;
    }

    void recordExhaustion() {
        exhaustedRuns++;
    }

    public void reset() {
        attempts = 0;
        generatedProblems = 0;
        exhaustedRuns = 0;
        lastPlanSize = 0;
        failures.clear();
    }

    //endregion

    //region ACCESSORS

    public int getAttempts() {
        return attempts;
    }

    public int getGeneratedProblems() {
        return generatedProblems;
    }

    /** Chiamate a generate concluse senza problema */
    public int getExhaustedRuns() {
        return exhaustedRuns;
    }

    public int getLastPlanSize() {
        return lastPlanSize;
    }

    public int getFailures(FailureReason reason) {
        return failures.getOrDefault(reason, 0);
    }

    public double getSuccessRate() {
        return attempts > 0 ? (double) generatedProblems / attempts : 0.0;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("=====================[ STATISTICHE GENERAZIONE ]=====================\n");
        output.append("    Tentativi:          ").append(attempts).append("\n");
        output.append("    Problemi generati:  ").append(generatedProblems).append("\n");
        for (FailureReason reason : FailureReason.values()) {
            int count = getFailures(reason);
            if (count > 0) {
                output.append("    Scarti ").append(reason).append(": ").append(count).append("\n");
            }
        }
        if (exhaustedRuns > 0) {
            output.append("    Generazioni fallite: ").append(exhaustedRuns).append("\n");
        }
        output.append("    Ultimo piano:       ").append(lastPlanSize).append(" nodi\n");
        output.append("=====================================================================\n");
        return output.toString();
    }
}
