package org.wff;

import org.junit.jupiter.api.Test;
import org.wff.proof.Problem;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProblemTextFormatterTest extends LogicTestBase {

    @Test
    void writesAsciiFormulasThatReadBackUnchanged() {
        Problem problem = new Problem("gen_1", "Problema generato", fs("(p -> q) & ~r", "p <-> s"), f("q | r"), 2);

        String text = ProblemTextFormatter.format("GENERATED", List.of(problem));

        assertEquals("Problem Group: GENERATED\n\n"
                + "Problem: gen_1\n"
                + "Premises:\n"
                + "(p -> q) & ~r\n"
                + "p <-> s\n"
                + "Goal:\n"
                + "q | r\n", text);
        assertEquals(problem.getPremises().get(0), f(ProblemTextFormatter.toAscii(problem.getPremises().get(0))));
    }
}
