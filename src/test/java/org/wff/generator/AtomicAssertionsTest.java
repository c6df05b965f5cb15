package org.wff.generator;

import org.junit.jupiter.api.Test;
import org.wff.LogicTestBase;
import org.wff.support.Tiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AtomicAssertionsTest extends LogicTestBase {

    @Test
    void collectsLiteralsInOrder() {
        assertEquals(List.of(n("p"), n("~q"), n("r")), AtomicAssertions.of(f("(p -> ~q) & (r | p)")));
    }

    @Test
    void doubleNegationAssertsTheInnerLiteral() {
        assertEquals(List.of(n("~p")), AtomicAssertions.of(f("~~p")));
    }

    @Test
    void malformedFormulaHasNoAssertions() {
        assertTrue(AtomicAssertions.of(f("p &")).isEmpty());
    }

    @Test
    void baseVariable() {
        assertEquals(Tiles.variable('q'), AtomicAssertions.baseVariable(tree("~q")));
        assertEquals(Tiles.variable('p'), AtomicAssertions.baseVariable(tree("p")));
        assertThrows(IllegalArgumentException.class, () -> AtomicAssertions.baseVariable(tree("p & q")));
    }

    @Test
    void detectsOppositeLiteralsAcrossPremises() {
        assertTrue(AtomicAssertions.hasContradiction(fs("p -> q", "~q")));
        assertTrue(AtomicAssertions.hasContradiction(fs("p & ~p")));
        assertFalse(AtomicAssertions.hasContradiction(fs("p -> ~q", "~~q")));
        assertFalse(AtomicAssertions.hasContradiction(fs("p -> q", "q | r")));
    }
}
