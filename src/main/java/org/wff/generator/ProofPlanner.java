package org.wff.generator;

import org.wff.rules.FormulaShape;
import org.wff.rules.InferenceRule;
import org.wff.rules.InferenceRuleEngine;
import org.wff.rules.RuleStrategy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

/**
 * PIANIFICATORE - Fase 1 della generazione: costruzione dello scheletro
 *
 * ALGORITMO:
 * 1. Coda di lavoro inizializzata con l'obiettivo (vincolo ANY)
 * 2. Per ogni nodo estratto si sceglie una regola pesata a caso tra quelle la
 *    cui forma di conclusione soddisfa il vincolo e il cui numero di premesse
 *    non supera il budget residuo; il budget cala di uno per nodo elaborato
 * 3. Si crea un figlio per ogni forma di premessa della regola
 * 4. Con probabilità BRANCHING_CHANCE tutti i figli tornano in coda
 *    (albero ampio), altrimenti solo uno in testa e gli altri diventano foglie
 *    (catena profonda)
 * 5. Budget esaurito o nessuna regola compatibile: il nodo è una foglia ASSUMPTION
 */
public class ProofPlanner {

    private static final Logger LOGGER = Logger.getLogger(ProofPlanner.class.getName());

    private static final double BRANCHING_CHANCE = 0.3;

    private static final Map<InferenceRule, Double> RULE_WEIGHTS = new EnumMap<>(InferenceRule.class);

    static {
        RULE_WEIGHTS.put(InferenceRule.MODUS_PONENS, 1.0);
        RULE_WEIGHTS.put(InferenceRule.MODUS_TOLLENS, 1.0);
        RULE_WEIGHTS.put(InferenceRule.HYPOTHETICAL_SYLLOGISM, 1.0);
        RULE_WEIGHTS.put(InferenceRule.DISJUNCTIVE_SYLLOGISM, 1.0);
        RULE_WEIGHTS.put(InferenceRule.CONSTRUCTIVE_DILEMMA, 0.6);
        RULE_WEIGHTS.put(InferenceRule.ABSORPTION, 0.5);
        RULE_WEIGHTS.put(InferenceRule.SIMPLIFICATION, 0.8);
        RULE_WEIGHTS.put(InferenceRule.CONJUNCTION, 0.8);
        RULE_WEIGHTS.put(InferenceRule.ADDITION, 0.5);
    }

    private final Random random;

    public ProofPlanner(Random random) {
        this.random = random;
    }

    /**
     * @param difficulty budget di passi (valori minori di 1 valgono 1)
     * @return piano con almeno un passo di inferenza
     */
    public ProofPlan plan(int difficulty) {
        ProofPlan plan = new ProofPlan();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(ProofPlan.GOAL);
        int budget = Math.max(1, difficulty);

        while (!queue.isEmpty()) {
            PlanNode node = plan.node(queue.pollFirst());
            if (budget <= 0) {
                continue;   // resta ASSUMPTION
            }

            RuleStrategy strategy = drawRule(node.getConstraint(), budget);
            budget--;
            if (strategy == null) {
                continue;
            }

            List<Integer> children = new ArrayList<>();
            for (FormulaShape shape : strategy.premiseShapes()) {
                children.add(plan.addNode(shape, node.getId()));
            }
            node.assignRule(strategy.rule(), children);

            List<Integer> shuffled = new ArrayList<>(children);
            Collections.shuffle(shuffled, random);
            if (shuffled.size() > 1 && random.nextDouble() < BRANCHING_CHANCE) {
                queue.addAll(shuffled);
            } else {
                // gli altri figli restano foglie
                queue.addFirst(shuffled.get(0));
            }
        }

        LOGGER.fine(() -> "Piano generato (" + plan.size() + " nodi):\n" + plan.render());
        return plan;
    }

    private RuleStrategy drawRule(FormulaShape constraint, int budget) {
        List<RuleStrategy> candidates = new ArrayList<>();
        double totalWeight = 0;
        for (RuleStrategy strategy : InferenceRuleEngine.strategies()) {
            if (constraint.acceptsConclusionShape(strategy.conclusionShape()) && strategy.premiseCount() <= budget) {
                candidates.add(strategy);
                totalWeight += RULE_WEIGHTS.get(strategy.rule());
            }
        }
        if (candidates.isEmpty()) return null;

        double ticket = random.nextDouble() * totalWeight;
        for (RuleStrategy strategy : candidates) {
            ticket -= RULE_WEIGHTS.get(strategy.rule());
            if (ticket < 0) return strategy;
        }
        return candidates.get(candidates.size() - 1);
    }
}
