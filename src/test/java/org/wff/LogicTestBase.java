package org.wff;

import org.wff.parser.FormulaNode;
import org.wff.parser.FormulaTextParser;
import org.wff.parser.WffParser;
import org.wff.proof.Justification;
import org.wff.proof.Proof;
import org.wff.proof.ProofLine;
import org.wff.support.Formula;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Supporto comune ai test: formule e dimostrazioni scritte con gli alias ASCII.
 */
public abstract class LogicTestBase {

    private final FormulaTextParser textParser = new FormulaTextParser();

    /** Formula con la superficie del testo, es. f("(p -> q) & ~r") */
    protected Formula f(String text) {
        Formula formula = textParser.toFormula(text);
        assertNotNull(formula, "Testo non riconosciuto: " + text);
        return formula;
    }

    protected List<Formula> fs(String... texts) {
        List<Formula> result = new ArrayList<>();
        for (String text : texts) result.add(f(text));
        return result;
    }

    /** Forma canonica del testo */
    protected Formula n(String text) {
        return WffParser.normalize(f(text));
    }

    protected FormulaNode tree(String text) {
        FormulaNode node = WffParser.parse(f(text));
        assertNotNull(node, "Formula non ben formata: " + text);
        return node;
    }

    protected static Line line(String formula, Justification justification) {
        return new Line(formula, justification, 0);
    }

    protected static Line line(String formula, Justification justification, int depth) {
        return new Line(formula, justification, depth);
    }

    /** Numerazione consecutiva a partire da 1 */
    protected Proof proof(Line... lines) {
        List<ProofLine> result = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            result.add(new ProofLine(i + 1, f(lines[i].formula), lines[i].justification, lines[i].depth));
        }
        return new Proof(result);
    }

    /** Riga ancora da numerare */
    protected static final class Line {
        private final String formula;
        private final Justification justification;
        private final int depth;

        Line(String formula, Justification justification, int depth) {
            this.formula = formula;
            this.justification = justification;
            this.depth = depth;
        }
    }
}
