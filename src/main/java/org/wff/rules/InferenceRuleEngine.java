package org.wff.rules;

import org.wff.parser.FormulaBuilder;
import org.wff.parser.FormulaNode;
import org.wff.parser.WffParser;
import org.wff.rules.strategies.Absorption;
import org.wff.rules.strategies.Addition;
import org.wff.rules.strategies.Conjunction;
import org.wff.rules.strategies.ConstructiveDilemma;
import org.wff.rules.strategies.DisjunctiveSyllogism;
import org.wff.rules.strategies.HypotheticalSyllogism;
import org.wff.rules.strategies.ModusPonens;
import org.wff.rules.strategies.ModusTollens;
import org.wff.rules.strategies.Simplification;
import org.wff.support.Formula;
import org.wff.support.LogicTile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * MOTORE DELLE REGOLE DI INFERENZA - Facciata a livello di formule
 *
 * Traduce formule in alberi, delega alla strategia della regola e riporta i
 * risultati in forma canonica.
 *
 * CONTRATTI:
 * - possibleConclusions: tutte le applicazioni in avanti della regola
 * - premiseShapesForConclusion: liste di premesse che derivano il bersaglio
 * - isValidInference: la conclusione normalizzata è tra quelle derivabili
 *
 * Premesse non ben formate vengono ignorate; ASSUMPTION non deriva nulla.
 */
public final class InferenceRuleEngine {

    private static final Logger LOGGER = Logger.getLogger(InferenceRuleEngine.class.getName());

    private static final Map<InferenceRule, RuleStrategy> STRATEGIES = new EnumMap<>(InferenceRule.class);

    static {
        register(new ModusPonens());
        register(new ModusTollens());
        register(new HypotheticalSyllogism());
        register(new DisjunctiveSyllogism());
        register(new ConstructiveDilemma());
        register(new Absorption());
        register(new Simplification());
        register(new Conjunction());
        register(new Addition());
    }

    private static void register(RuleStrategy strategy) {
        STRATEGIES.put(strategy.rule(), strategy);
    }

    private InferenceRuleEngine() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region ACCESSO ALLE STRATEGIE

    /**
     * @throws IllegalArgumentException per ASSUMPTION o null
     */
    public static RuleStrategy strategyFor(InferenceRule rule) {
        RuleStrategy strategy = rule == null ? null : STRATEGIES.get(rule);
        if (strategy == null) {
            throw new IllegalArgumentException("Nessuna strategia per la regola: " + rule);
        }
        return strategy;
    }

    /** Strategie delle nove regole, nell'ordine dell'enumerazione */
    public static List<RuleStrategy> strategies() {
        return Collections.unmodifiableList(new ArrayList<>(STRATEGIES.values()));
    }

    //endregion

    //region CONTRATTI PUBBLICI

    /**
     * Conclusioni derivabili in avanti senza conoscere un bersaglio.
     *
     * L'Addizione combina solo premesse già presenti: da [p] da sola non produce
     * nulla, perché il disgiunto libero non è determinato. Le liste proposte da
     * {@link #premiseShapesForConclusion} vanno quindi verificate con
     * {@link #isValidInference}, che istanzia il disgiunto dal bersaglio.
     */
    public static List<Application> possibleConclusions(InferenceRule rule, List<Formula> premises) {
        if (rule == null || !rule.isInference()) return List.of();

        List<FormulaNode> trees = parseAll(premises);
        return distinct(strategyFor(rule).derive(trees));
    }

    public static List<List<Formula>> premiseShapesForConclusion(InferenceRule rule, Formula target, List<LogicTile> pool) {
        if (rule == null || !rule.isInference()) return List.of();

        FormulaNode targetTree = WffParser.parse(target);
        if (targetTree == null) return List.of();

        List<List<Formula>> result = new ArrayList<>();
        for (List<FormulaNode> candidate : strategyFor(rule).premisesFor(targetTree, pool)) {
            List<Formula> formulas = new ArrayList<>(candidate.size());
            for (FormulaNode premise : candidate) {
                formulas.add(FormulaBuilder.toFormula(premise));
            }
            result.add(formulas);
        }
        return result;
    }

    public static boolean isValidInference(InferenceRule rule, List<Formula> premises, Formula conclusion) {
        if (rule == null || !rule.isInference()) return false;

        FormulaNode target = WffParser.parse(conclusion);
        if (target == null) {
            LOGGER.finest(() -> "Conclusione non ben formata: " + conclusion);
            return false;
        }

        Formula canonical = FormulaBuilder.toFormula(target);
        for (Application application : strategyFor(rule).deriveToward(parseAll(premises), target)) {
            if (application.getConclusion().equals(canonical)) {
                return true;
            }
        }
        LOGGER.finest(() -> rule.getAbbreviation() + " non deriva " + conclusion + " da " + premises);
        return false;
    }

    //endregion

    private static List<FormulaNode> parseAll(List<Formula> premises) {
        List<FormulaNode> trees = new ArrayList<>();
        if (premises == null) return trees;

        for (Formula premise : premises) {
            FormulaNode tree = WffParser.parse(premise);
            if (tree != null) {
                trees.add(tree);
            } else {
                LOGGER.finest(() -> "Premessa ignorata perché non ben formata: " + premise);
            }
        }
        return trees;
    }

    private static List<Application> distinct(List<Application> applications) {
        return new ArrayList<>(new LinkedHashSet<>(applications));
    }
}
