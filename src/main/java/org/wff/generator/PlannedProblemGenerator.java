package org.wff.generator;

import org.wff.parser.WffParser;
import org.wff.proof.Problem;
import org.wff.rules.Application;
import org.wff.support.Formula;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * GENERATORE DI PROBLEMI PIANIFICATO - Problemi risolvibili a difficoltà data
 *
 * Ogni tentativo costruisce un piano (fase 1), lo risolve top-down (fase 2) e
 * sottopone il problema ai filtri globali:
 * - nessuna asserzione atomica opposta tra le premesse
 * - obiettivo assente dalle premesse
 * - premesse ridotte a quelle usate dall'albero di derivazione
 *
 * Un tentativo fallito si ripete da capo con un nuovo piano; dopo
 * MAX_GENERATION_ATTEMPTS tentativi il generatore restituisce null.
 */
public class PlannedProblemGenerator {

    private static final Logger LOGGER = Logger.getLogger(PlannedProblemGenerator.class.getName());

    private static final int MAX_GENERATION_ATTEMPTS = 50;

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Random random;
    private final ProofPlanner planner;
    private final PlanSolver solver;
    private final GenerationStatistics statistics = new GenerationStatistics();

    public PlannedProblemGenerator() {
        this(new Random());
    }

    /**
     * @param random sorgente di casualità, fissarne il seme rende la generazione riproducibile
     */
    public PlannedProblemGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Sorgente di casualità non può essere null");
        }
        this.random = random;
        this.planner = new ProofPlanner(random);
        this.solver = new PlanSolver(random);
    }

    /**
     * @param difficulty budget di passi del piano (valori minori di 1 valgono 1)
     * @return problema valido oppure null se il budget di tentativi è esaurito
     */
    public Problem generate(int difficulty) {
        for (int attempt = 1; attempt <= MAX_GENERATION_ATTEMPTS; attempt++) {
            ProofPlan plan = planner.plan(difficulty);
            statistics.recordAttempt(plan.size());

            Application derivation = solver.solve(plan, VarLists.create(random));
            if (derivation == null) {
                reject(attempt, GenerationStatistics.FailureReason.UNSOLVED_PLAN);
                continue;
            }

            List<Formula> premises = derivation.leafPremises();
            Formula goal = derivation.getConclusion();

            if (premises.isEmpty()) {
                reject(attempt, GenerationStatistics.FailureReason.NO_PREMISES);
                continue;
            }
            if (AtomicAssertions.hasContradiction(premises)) {
                reject(attempt, GenerationStatistics.FailureReason.CONTRADICTION);
                continue;
            }
            if (containsNormalized(premises, goal)) {
                reject(attempt, GenerationStatistics.FailureReason.TRIVIAL_GOAL);
                continue;
            }

            statistics.recordSuccess();
            String id = "gen_" + System.currentTimeMillis() + "_" + SEQUENCE.incrementAndGet();
            Problem problem = new Problem(id, "Problema generato", premises, goal, plan.size(), derivation);
            LOGGER.info("Problema generato al tentativo " + attempt + ": " + problem);
            return problem;
        }

        statistics.recordExhaustion();
        LOGGER.warning("Nessun problema valido dopo " + MAX_GENERATION_ATTEMPTS + " tentativi (difficoltà " + difficulty + ")");
        return null;
    }

    public GenerationStatistics getStatistics() {
        return statistics;
    }

    private void reject(int attempt, GenerationStatistics.FailureReason reason) {
        statistics.recordFailure(reason);
        LOGGER.fine(() -> "Tentativo " + attempt + " scartato: " + reason);
    }

    private static boolean containsNormalized(List<Formula> premises, Formula goal) {
        Formula normalizedGoal = WffParser.normalize(goal);
        for (Formula premise : premises) {
            if (WffParser.normalize(premise).equals(normalizedGoal)) return true;
        }
        return false;
    }
}
