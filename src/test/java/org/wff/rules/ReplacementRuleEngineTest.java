package org.wff.rules;

import org.junit.jupiter.api.Test;
import org.wff.LogicTestBase;

import static org.junit.jupiter.api.Assertions.*;

class ReplacementRuleEngineTest extends LogicTestBase {

    private boolean valid(ReplacementRule rule, String from, String to) {
        return ReplacementRuleEngine.isValidReplacement(rule, f(from), f(to));
    }

    @Test
    void deMorganInBothDirections() {
        assertTrue(valid(ReplacementRule.DE_MORGAN, "~(p & q)", "~p | ~q"));
        assertTrue(valid(ReplacementRule.DE_MORGAN, "~p & ~q", "~(p | q)"));
        assertFalse(valid(ReplacementRule.DE_MORGAN, "~(p & q)", "~p & ~q"));
    }

    @Test
    void commutationAndAssociation() {
        assertTrue(valid(ReplacementRule.COMMUTATION, "p | q", "q | p"));
        assertTrue(valid(ReplacementRule.ASSOCIATION, "(p & q) & r", "p & (q & r)"));
        assertTrue(valid(ReplacementRule.ASSOCIATION, "p | (q | r)", "(p | q) | r"));
        assertFalse(valid(ReplacementRule.COMMUTATION, "p -> q", "q -> p"));
    }

    @Test
    void rewritesApplyInsideSubformulas() {
        assertTrue(valid(ReplacementRule.COMMUTATION, "r -> (p & q)", "r -> (q & p)"));
        assertTrue(valid(ReplacementRule.DOUBLE_NEGATION, "p -> q", "p -> ~~q"));
        assertTrue(valid(ReplacementRule.DOUBLE_NEGATION, "~~p & q", "p & q"));
    }

    @Test
    void distribution() {
        assertTrue(valid(ReplacementRule.DISTRIBUTION, "p & (q | r)", "(p & q) | (p & r)"));
        assertTrue(valid(ReplacementRule.DISTRIBUTION, "(p | q) & (p | r)", "p | (q & r)"));
    }

    @Test
    void conditionalEquivalences() {
        assertTrue(valid(ReplacementRule.TRANSPOSITION, "p -> q", "~q -> ~p"));
        assertTrue(valid(ReplacementRule.MATERIAL_IMPLICATION, "p -> q", "~p | q"));
        assertTrue(valid(ReplacementRule.MATERIAL_IMPLICATION, "~p | q", "p -> q"));
        assertTrue(valid(ReplacementRule.MATERIAL_EQUIVALENCE, "p <-> q", "(p -> q) & (q -> p)"));
        assertTrue(valid(ReplacementRule.MATERIAL_EQUIVALENCE, "(p & q) | (~p & ~q)", "p <-> q"));
        assertTrue(valid(ReplacementRule.EXPORTATION, "(p & q) -> r", "p -> (q -> r)"));
        assertTrue(valid(ReplacementRule.EXPORTATION, "p -> (q -> r)", "(p & q) -> r"));
    }

    @Test
    void tautology() {
        assertTrue(valid(ReplacementRule.TAUTOLOGY, "p", "p | p"));
        assertTrue(valid(ReplacementRule.TAUTOLOGY, "q & q", "q"));
        assertFalse(valid(ReplacementRule.TAUTOLOGY, "p & q", "p"));
    }

    @Test
    void malformedOrMissingInputsAreRejected() {
        assertFalse(valid(ReplacementRule.COMMUTATION, "p & ", "p"));
        assertFalse(ReplacementRuleEngine.isValidReplacement(null, f("p & q"), f("q & p")));
    }

    @Test
    void abbreviationLookup() {
        assertEquals(ReplacementRule.DE_MORGAN, ReplacementRule.fromAbbreviation("DM"));
        assertEquals(InferenceRule.MODUS_PONENS, InferenceRule.fromAbbreviation("MP"));
    }
}
