package org.wff.generator;

import org.wff.parser.FormulaBuilder;
import org.wff.parser.FormulaNode;
import org.wff.rules.Application;
import org.wff.rules.FormulaShape;
import org.wff.rules.RuleStrategy;
import org.wff.rules.InferenceRuleEngine;
import org.wff.support.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RISOLUTORE DEL PIANO - Fase 2 della generazione: riempimento top-down
 *
 * Ogni nodo riceve dal padre la formula concreta che deve concludere:
 * - obiettivo: formula campionata dalla sua regola
 * - nodo interno: il motore all'indietro propone liste di premesse, ogni
 *   figlio viene risolto sulla premessa corrispondente e il motore in avanti
 *   conferma che la regola deriva davvero la conclusione
 * - foglia: le sue asserzioni atomiche devono essere compatibili con quelle
 *   già impegnate nel tentativo
 *
 * Ogni ramo lavora su una copia del pool di variabili e la riversa nel pool
 * del chiamante solo in caso di successo: i rami falliti non lasciano traccia.
 *
 * LIMITI DI RICERCA:
 * - ogni nodo prova al massimo NODE_RETRY_BUDGET candidati
 * - l'intera chiamata a solve espande al massimo SOLVE_EXPANSION_BUDGET
 *   candidati, condivisi tra tutti i nodi e tutti i campionamenti dell'obiettivo
 *
 * Nessuna premessa proposta può coincidere con la conclusione del nodo o di un
 * suo antenato: altrimenti un sotto-albero dimostrerebbe già un passo successivo
 * e la derivazione si accorcerebbe.
 */
public class PlanSolver {

    private static final Logger LOGGER = Logger.getLogger(PlanSolver.class.getName());

    private static final int NODE_RETRY_BUDGET = 10;
    private static final int SOLVE_EXPANSION_BUDGET = 1000;

    private final Random random;

    public PlanSolver(Random random) {
        this.random = random;
    }

    /**
     * @param plan piano della fase 1
     * @param vars pool del tentativo, aggiornato solo in caso di successo
     * @return albero di derivazione con radice nell'obiettivo, null se il piano non è
     *         risolvibile entro il budget di espansioni
     */
    public Application solve(ProofPlan plan, VarLists vars) {
        PlanNode goal = plan.goal();
        if (goal.isLeaf()) {
            return null;
        }

        SearchBudget budget = new SearchBudget(SOLVE_EXPANSION_BUDGET);
        RuleStrategy strategy = InferenceRuleEngine.strategyFor(goal.getRule());
        for (int attempt = 0; attempt < NODE_RETRY_BUDGET && !budget.isExhausted(); attempt++) {
            FormulaNode target = strategy.sampleConclusion(vars.getAlphabet(), random);
            VarLists branch = vars.copy();

            Application derivation = solveNode(plan, goal, target, branch, Set.of(), budget, 0);
            if (derivation != null) {
                vars.commit(branch);
                return derivation;
            }
        }
        if (budget.isExhausted()) {
            LOGGER.fine(() -> "Budget di " + SOLVE_EXPANSION_BUDGET + " espansioni esaurito");
        }
        return null;
    }

    private Application solveNode(ProofPlan plan, PlanNode node, FormulaNode target, VarLists vars,
                                  Set<FormulaNode> ancestors, SearchBudget budget, int depth) {
        LOGGER.finest(() -> "  ".repeat(depth) + "-> " + node + " cerca " + target);

        if (node.isLeaf()) {
            return solveLeaf(target, vars);
        }

        Set<FormulaNode> forbidden = new HashSet<>(ancestors);
        forbidden.add(target);

        RuleStrategy strategy = InferenceRuleEngine.strategyFor(node.getRule());
        List<List<FormulaNode>> candidates =
                new ArrayList<>(strategy.premisesFor(target, vars.poolExcluding(target.variables())));
        Collections.shuffle(candidates, random);

        int tries = 0;
        for (List<FormulaNode> candidate : candidates) {
            if (tries++ >= NODE_RETRY_BUDGET || !budget.consume()) break;
            if (!fitsChildren(plan, node, candidate) || revisits(candidate, forbidden)) continue;

            VarLists branch = vars.copy();
            List<Application> children = new ArrayList<>();
            for (int i = 0; i < candidate.size(); i++) {
                PlanNode child = plan.node(node.getChildren().get(i));
                Application solved = solveNode(plan, child, candidate.get(i), branch, forbidden, budget, depth + 1);
                if (solved == null) break;
                children.add(solved);
            }
            if (children.size() != candidate.size() || !confirms(strategy, candidate, target)) {
                continue;
            }

            vars.commit(branch);
            List<Formula> premises = new ArrayList<>();
            for (FormulaNode premise : candidate) {
                premises.add(FormulaBuilder.toFormula(premise));
            }
            LOGGER.finest(() -> "  ".repeat(depth) + "<- " + node + " risolto con " + premises);
            return new Application(FormulaBuilder.toFormula(target), strategy.rule(), premises, children);
        }

        LOGGER.finest(() -> "  ".repeat(depth) + "<- " + node + " fallito per " + target);
        return null;
    }

    private Application solveLeaf(FormulaNode target, VarLists vars) {
        VarLists branch = vars.copy();
        for (FormulaNode assertion : AtomicAssertions.of(target)) {
            if (branch.useAtomicAssertion(assertion) == null) {
                return null;
            }
        }
        vars.commit(branch);
        return Application.assumption(FormulaBuilder.toFormula(target));
    }

    private static boolean fitsChildren(ProofPlan plan, PlanNode node, List<FormulaNode> candidate) {
        List<Integer> children = node.getChildren();
        if (children.size() != candidate.size()) return false;

        for (int i = 0; i < candidate.size(); i++) {
            FormulaShape shape = plan.node(children.get(i)).getConstraint();
            if (!shape.matches(candidate.get(i))) return false;
        }
        return true;
    }

    private static boolean revisits(List<FormulaNode> candidate, Set<FormulaNode> forbidden) {
        for (FormulaNode premise : candidate) {
            if (forbidden.contains(premise)) return true;
        }
        return false;
    }

    /** Il motore in avanti deriva davvero il bersaglio dalle premesse proposte? */
    private static boolean confirms(RuleStrategy strategy, List<FormulaNode> premises, FormulaNode target) {
        Formula expected = FormulaBuilder.toFormula(target);
        for (Application application : strategy.deriveToward(premises, target)) {
            if (application.getConclusion().equals(expected)) return true;
        }
        return false;
    }

    /** Espansioni residue di una chiamata a solve, condivise da tutta la ricorsione */
    private static final class SearchBudget {
        private int remaining;

        SearchBudget(int remaining) {
            this.remaining = remaining;
        }

        boolean consume() {
            if (remaining <= 0) return false;
            remaining--;
            return true;
        }

        boolean isExhausted() {
            return remaining <= 0;
        }
    }
}
