package org.wff.generator;

import org.junit.jupiter.api.Test;
import org.wff.LogicTestBase;
import org.wff.support.LogicTile;
import org.wff.support.Tiles;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VarListsTest extends LogicTestBase {

    private static final LogicTile P = Tiles.variable('p');
    private static final LogicTile Q = Tiles.variable('q');

    @Test
    void newPoolHasTheWholeAlphabetAvailable() {
        VarLists vars = VarLists.create(new Random(1));

        assertEquals(Set.copyOf(Tiles.PROBLEM_VARIABLES), Set.copyOf(vars.getAvailableVariables()));
        assertTrue(vars.getUsedAssertions().isEmpty());
    }

    @Test
    void claimingAnAssertionConsumesItsVariable() {
        VarLists vars = VarLists.create(new Random(1));

        assertEquals(tree("~p"), vars.useAtomicAssertion(tree("~p")));
        assertFalse(vars.getAvailableVariables().contains(P));
        assertEquals(List.of(tree("~p")), vars.getUsedAssertions());
    }

    @Test
    void repeatingAnAssertionIsAllowed() {
        VarLists vars = VarLists.create(new Random(1));
        vars.useAtomicAssertion(tree("q"));

        assertEquals(tree("q"), vars.useAtomicAssertion(tree("q")));
        assertEquals(1, vars.getUsedAssertions().size());
    }

    @Test
    void opposingAssertionIsRejected() {
        VarLists vars = VarLists.create(new Random(1));
        vars.useAtomicAssertion(tree("p"));

        assertNull(vars.useAtomicAssertion(tree("~p")));
        assertNull(vars.useAtomicAssertion(n("~p")));
    }

    @Test
    void variablesOutsideTheAlphabetAreRejected() {
        VarLists vars = VarLists.create(new Random(1));
        assertNull(vars.useAtomicAssertion(tree("a")));
    }

    @Test
    void formulaOverloadRequiresALiteral() {
        VarLists vars = VarLists.create(new Random(1));
        assertEquals(n("r"), vars.useAtomicAssertion(f("(r)")));
        assertThrows(IllegalArgumentException.class, () -> vars.useAtomicAssertion(f("p & q")));
    }

    @Test
    void copiesAreIsolatedUntilCommitted() {
        VarLists vars = VarLists.create(new Random(1));
        VarLists branch = vars.copy();
        branch.useAtomicAssertion(tree("q"));

        assertTrue(vars.getAvailableVariables().contains(Q));
        assertTrue(vars.getUsedAssertions().isEmpty());

        vars.commit(branch);
        assertFalse(vars.getAvailableVariables().contains(Q));
        assertEquals(List.of(tree("q")), vars.getUsedAssertions());
    }

    @Test
    void commitRejectsForeignPools() {
        VarLists vars = VarLists.create(new Random(1));
        VarLists other = VarLists.create(List.of(P, Q), new Random(1));

        assertThrows(IllegalStateException.class, () -> vars.commit(other));
    }

    @Test
    void poolFallsBackToTheAlphabetWhenExhausted() {
        VarLists vars = VarLists.create(List.of(P, Q), new Random(1));
        assertEquals(List.of(Q), vars.poolExcluding(List.of(P)));

        vars.useAtomicAssertion(tree("p"));
        vars.useAtomicAssertion(tree("q"));
        assertTrue(vars.getAvailableVariables().isEmpty());
        assertEquals(List.of(P, Q), vars.poolExcluding(List.of()));
        assertEquals(List.of(Q), vars.poolExcluding(Set.of(P)));
    }
}
