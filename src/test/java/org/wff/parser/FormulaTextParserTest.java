package org.wff.parser;

import org.junit.jupiter.api.Test;
import org.wff.support.Formula;

import static org.junit.jupiter.api.Assertions.*;
import static org.wff.parser.FormulaBuilder.and;
import static org.wff.parser.FormulaBuilder.iff;
import static org.wff.parser.FormulaBuilder.implies;
import static org.wff.parser.FormulaBuilder.not;
import static org.wff.parser.FormulaBuilder.or;
import static org.wff.parser.FormulaBuilder.var;

class FormulaTextParserTest {

    private final FormulaTextParser parser = new FormulaTextParser();

    @Test
    void translatesAsciiAliasesToCanonicalTiles() {
        assertEquals(Formula.of("(p→q)∧¬r∨(s↔t)"), parser.toFormula("(p -> q) & ~r | (s <-> t)"));
        assertEquals(Formula.of("¬p"), parser.toFormula("!p"));
        assertEquals(Formula.of("p∧q"), parser.toFormula("p ∧ q"));
    }

    @Test
    void preservesSurfaceIncludingMalformedInput() {
        assertEquals(Formula.of("((p))"), parser.toFormula("((p))"));
        assertEquals(Formula.of("p∧∧"), parser.toFormula("p & &"));
    }

    @Test
    void lexicalErrorsAreReported() {
        assertNull(parser.toFormula("p # q"));
        assertNotNull(parser.getLastErrorMessage());
    }

    @Test
    void parseBuildsTheSameTreeAsTheTileParser() {
        String[] samples = {"p | q & r", "p -> q -> r", "~(p & q) <-> ~p | ~q", "(p -> q) & (r -> s)", "p & q & r"};
        for (String sample : samples) {
            assertEquals(WffParser.parse(parser.toFormula(sample)), parser.parse(sample), sample);
        }
    }

    @Test
    void parseHandlesEveryConnective() {
        assertEquals(iff(implies(var('p'), var('q')), or(not(var('r')), and(var('s'), var('t')))),
                parser.parse("(p -> q) <-> ~r | s & t"));
    }

    @Test
    void syntaxErrorsReturnNullWithMessage() {
        assertNull(parser.parse("p & "));
        assertNotNull(parser.getLastErrorMessage());

        assertNull(parser.parse("(p | q"));
        assertNotNull(parser.getLastErrorMessage());

        assertNull(parser.parse("   "));
        assertNotNull(parser.parse("p"));
        assertNull(parser.getLastErrorMessage());
    }
}
