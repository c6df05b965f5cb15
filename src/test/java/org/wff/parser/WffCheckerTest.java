package org.wff.parser;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.wff.LogicTestBase;
import org.wff.support.Formula;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WffCheckerTest extends LogicTestBase {

    @ParameterizedTest
    @ValueSource(strings = {
            "p", "~p", "~~~p", "p & q", "p | q & r", "(p -> q) -> r", "p <-> q -> r", "((p))",
            "~(p & ~(q | r))", "(p & q) | (~p & ~q)",
            "", "p q", "p &", "(p", "p)", "()", "~", "p ~ q", "(p & q))", "-> p", "p -> -> q", ")p("
    })
    void agreesWithTheParser(String text) {
        Formula formula = f(text);
        assertEquals(WffParser.parse(formula) != null, WffChecker.isWff(formula), text);
    }
}
