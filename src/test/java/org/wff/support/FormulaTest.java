package org.wff.support;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTest {

    @Test
    void readsCanonicalSymbolsIgnoringWhitespace() {
        Formula formula = Formula.of("(p → q) ∧ ¬r");

        assertEquals(List.of(Tiles.LEFT_PAREN, Tiles.variable('p'), Tiles.IMPLIES, Tiles.variable('q'),
                Tiles.RIGHT_PAREN, Tiles.AND, Tiles.NOT, Tiles.variable('r')), formula.getTiles());
        assertEquals("(p→q)∧¬r", formula.toString());
    }

    @Test
    void equalityIsSurfaceEquality() {
        assertEquals(Formula.of("p∧q"), Formula.of("p ∧ q"));
        assertNotEquals(Formula.of("(p∧q)"), Formula.of("p∧q"));
    }

    @Test
    void rejectsUnknownSymbols() {
        assertThrows(IllegalArgumentException.class, () -> Formula.of("p & q"));
        assertThrows(IllegalArgumentException.class, () -> Formula.of("p1"));
    }

    @Test
    void tilesAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new LogicTile("pq", SymbolType.VARIABLE));
        assertThrows(IllegalArgumentException.class, () -> new LogicTile("", SymbolType.BINARY_OPERATOR));
        assertThrows(IllegalArgumentException.class, () -> new LogicTile("p", null));
        assertEquals(Tiles.variable('x'), new LogicTile("x", SymbolType.VARIABLE));
    }

    @Test
    void catalogLookup() {
        assertSame(Tiles.IFF, Tiles.fromSymbol("↔"));
        assertNull(Tiles.fromSymbol("&"));
        assertEquals(52, Tiles.ALL_VARIABLES.size());
        assertEquals(8, Tiles.PROBLEM_VARIABLES.size());
        assertEquals(Tiles.variable('p'), Tiles.PROBLEM_VARIABLES.get(0));
        assertEquals(Tiles.variable('w'), Tiles.PROBLEM_VARIABLES.get(7));
    }

    @Test
    void emptyFormula() {
        Formula empty = Formula.of("");
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
    }
}
