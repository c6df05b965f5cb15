package org.wff.rules;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.wff.LogicTestBase;
import org.wff.parser.FormulaBuilder;
import org.wff.parser.FormulaNode;
import org.wff.parser.WffParser;
import org.wff.support.Formula;
import org.wff.support.LogicTile;
import org.wff.support.Tiles;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InferenceRuleEngineTest extends LogicTestBase {

    //region DERIVAZIONE IN AVANTI

    @Test
    void modusPonens() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS, fs("p -> q", "p"), f("q")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS, fs("p", "p -> q"), f("q")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS, fs("p -> q", "q"), f("p")));
    }

    @Test
    void modusTollens() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_TOLLENS, fs("p -> q", "~q"), f("~p")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_TOLLENS, fs("p -> ~q", "~~q"), f("~p")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_TOLLENS, fs("p -> q", "~p"), f("~q")));
    }

    @Test
    void hypotheticalSyllogism() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.HYPOTHETICAL_SYLLOGISM,
                fs("p -> q", "q -> r"), f("p -> r")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.HYPOTHETICAL_SYLLOGISM,
                fs("p -> q", "r -> s"), f("p -> s")));
    }

    @Test
    void disjunctiveSyllogismEliminatesEitherSide() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.DISJUNCTIVE_SYLLOGISM, fs("p | q", "~p"), f("q")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.DISJUNCTIVE_SYLLOGISM, fs("p | q", "~q"), f("p")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.DISJUNCTIVE_SYLLOGISM, fs("p | q", "p"), f("q")));
    }

    @Test
    void constructiveDilemma() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.CONSTRUCTIVE_DILEMMA,
                fs("(p -> q) & (r -> s)", "p | r"), f("q | s")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.CONSTRUCTIVE_DILEMMA,
                fs("(p -> q) & (r -> s)", "r | p"), f("q | s")));
    }

    @Test
    void absorption() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.ABSORPTION, fs("p -> q"), f("p -> (p & q)")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.ABSORPTION, fs("p -> q"), f("p -> p & q")));
    }

    @Test
    void simplificationKeepsEitherConjunct() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.SIMPLIFICATION, fs("p & q"), f("p")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.SIMPLIFICATION, fs("p & q"), f("q")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.SIMPLIFICATION, fs("p | q"), f("p")));
    }

    @Test
    void conjunctionInBothOrders() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.CONJUNCTION, fs("p", "q"), f("p & q")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.CONJUNCTION, fs("p", "q"), f("q & p")));
    }

    @Test
    void additionTowardAnArbitraryDisjunct() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.ADDITION, fs("p"), f("p | (q -> r)")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.ADDITION, fs("p"), f("s | p")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.ADDITION, fs("p"), f("q | r")));
    }

    @Test
    void additionNeedsTheTargetToFixTheFreeDisjunct() {
        assertTrue(InferenceRuleEngine.possibleConclusions(InferenceRule.ADDITION, fs("p")).isEmpty());

        List<List<Formula>> candidates = InferenceRuleEngine.premiseShapesForConclusion(
                InferenceRule.ADDITION, f("p | q"), Tiles.PROBLEM_VARIABLES);
        assertEquals(List.of(List.of(n("p")), List.of(n("q"))), candidates);
        for (List<Formula> premises : candidates) {
            assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.ADDITION, premises, f("p | q")));
        }
    }

    @Test
    void possibleConclusionsOfModusPonens() {
        List<Application> conclusions = InferenceRuleEngine.possibleConclusions(InferenceRule.MODUS_PONENS,
                fs("p -> q", "p", "q -> r"));

        Set<Formula> formulas = new LinkedHashSet<>();
        for (Application application : conclusions) formulas.add(application.getConclusion());
        assertEquals(Set.of(n("q")), formulas);
        assertEquals(InferenceRule.MODUS_PONENS, conclusions.get(0).getRule());
    }

    @Test
    void surfaceParenthesesDoNotMatter() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS,
                fs("((p & q) -> (r))", "(p & q)"), f("r")));
    }

    @Test
    void assumptionDerivesNothing() {
        assertTrue(InferenceRuleEngine.possibleConclusions(InferenceRule.ASSUMPTION, fs("p")).isEmpty());
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.ASSUMPTION, fs("p"), f("p")));
        assertThrows(IllegalArgumentException.class, () -> InferenceRuleEngine.strategyFor(InferenceRule.ASSUMPTION));
    }

    @Test
    void unparseablePremisesAreIgnored() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS,
                fs("p -> q", "p &", "p"), f("q")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS, fs("p -> q", "p"), f("q &")));
    }

    //endregion

    //region CORRETTEZZA E COMPLETEZZA

    @ParameterizedTest
    @EnumSource(value = InferenceRule.class, names = "ASSUMPTION", mode = EnumSource.Mode.EXCLUDE)
    void backwardPremisesAreAcceptedForwardAndEntailTheTarget(InferenceRule rule) {
        RuleStrategy strategy = InferenceRuleEngine.strategyFor(rule);
        Random random = new Random(42);

        for (int round = 0; round < 20; round++) {
            FormulaNode target = strategy.sampleConclusion(Tiles.PROBLEM_VARIABLES, random);
            assertTrue(strategy.conclusionShape().matches(target), rule + " " + target);

            List<List<Formula>> candidates = InferenceRuleEngine.premiseShapesForConclusion(
                    rule, formula(target), Tiles.PROBLEM_VARIABLES);
            assertFalse(candidates.isEmpty(), rule + " senza premesse per " + target);

            for (List<Formula> premises : candidates) {
                assertEquals(rule.getPremiseCount(), premises.size());
                assertTrue(InferenceRuleEngine.isValidInference(rule, premises, formula(target)),
                        rule + ": " + premises + " ⊬ " + target);
                assertTrue(entails(premises, target), rule + ": " + premises + " non implica " + target);
            }
        }
    }

    @ParameterizedTest
    @EnumSource(value = InferenceRule.class, names = "ASSUMPTION", mode = EnumSource.Mode.EXCLUDE)
    void forwardConclusionsAreSound(InferenceRule rule) {
        List<Formula> premises = fs("p -> q", "p", "~q", "p | r", "~r", "(p -> q) & (r -> s)", "q -> s", "p & s");

        for (Application application : InferenceRuleEngine.possibleConclusions(rule, premises)) {
            assertEquals(rule.getPremiseCount(), application.getPremises().size());
            assertTrue(entails(application.getPremises(), WffParser.parse(application.getConclusion())),
                    application.toString());
        }
    }

    @Test
    void backwardPremisesAvoidTheTargetVariables() {
        List<List<Formula>> candidates = InferenceRuleEngine.premiseShapesForConclusion(
                InferenceRule.MODUS_PONENS, f("q"), List.of(Tiles.variable('p'), Tiles.variable('q')));

        assertEquals(List.of(List.of(n("p -> q"), n("p")), List.of(n("~p -> q"), n("~p"))), candidates);
    }

    @Test
    void backwardRequiresTheConclusionShape() {
        assertTrue(InferenceRuleEngine.premiseShapesForConclusion(
                InferenceRule.MODUS_TOLLENS, f("p"), Tiles.PROBLEM_VARIABLES).isEmpty());
        assertTrue(InferenceRuleEngine.premiseShapesForConclusion(
                InferenceRule.ABSORPTION, f("p -> q"), Tiles.PROBLEM_VARIABLES).isEmpty());
        assertTrue(InferenceRuleEngine.premiseShapesForConclusion(
                InferenceRule.CONJUNCTION, f("p | q"), Tiles.PROBLEM_VARIABLES).isEmpty());
    }

    //endregion

    //region SUPPORTO

    private static Formula formula(FormulaNode node) {
        return FormulaBuilder.toFormula(node);
    }

    /** Conseguenza semantica verificata con la tavola di verità */
    private static boolean entails(List<Formula> premises, FormulaNode conclusion) {
        List<FormulaNode> trees = new ArrayList<>();
        Set<LogicTile> variables = new LinkedHashSet<>(conclusion.variables());
        for (Formula premise : premises) {
            FormulaNode tree = WffParser.parse(premise);
            trees.add(tree);
            variables.addAll(tree.variables());
        }

        List<LogicTile> ordered = new ArrayList<>(variables);
        for (int mask = 0; mask < (1 << ordered.size()); mask++) {
            Map<LogicTile, Boolean> valuation = new HashMap<>();
            for (int i = 0; i < ordered.size(); i++) {
                valuation.put(ordered.get(i), (mask & (1 << i)) != 0);
            }

            boolean premisesHold = true;
            for (FormulaNode tree : trees) premisesHold &= evaluate(tree, valuation);
            if (premisesHold && !evaluate(conclusion, valuation)) {
                return false;
            }
        }
        return true;
    }

    private static boolean evaluate(FormulaNode node, Map<LogicTile, Boolean> valuation) {
        if (node.isVariable()) return valuation.get(node.getTile());
        if (node.isNegation()) return !evaluate(node.getChild(), valuation);

        boolean left = evaluate(node.getLeft(), valuation);
        boolean right = evaluate(node.getRight(), valuation);
        if (node.isConjunction()) return left && right;
        if (node.isDisjunction()) return left || right;
        if (node.isImplication()) return !left || right;
        return left == right;
    }

    //endregion
}
