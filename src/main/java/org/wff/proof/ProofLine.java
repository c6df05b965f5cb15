package org.wff.proof;

import org.wff.support.Formula;

import java.util.Objects;

/**
 * Riga di dimostrazione: numero (da 1), formula, giustificazione e profondità
 * di annidamento (0 = livello principale).
 */
public final class ProofLine {

    private final int lineNumber;
    private final Formula formula;
    private final Justification justification;
    private final int depth;

    public ProofLine(int lineNumber, Formula formula, Justification justification, int depth) {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("Numero di riga deve essere positivo: " + lineNumber);
        }
        if (formula == null || justification == null) {
            throw new IllegalArgumentException("Formula e giustificazione della riga " + lineNumber + " sono obbligatorie");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Profondità negativa alla riga " + lineNumber);
        }
        this.lineNumber = lineNumber;
        this.formula = formula;
        this.justification = justification;
        this.depth = depth;
    }

    public ProofLine(int lineNumber, Formula formula, Justification justification) {
        this(lineNumber, formula, justification, 0);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public Formula getFormula() {
        return formula;
    }

    public Justification getJustification() {
        return justification;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ProofLine other = (ProofLine) obj;
        return lineNumber == other.lineNumber && depth == other.depth
                && formula.equals(other.formula) && justification.equals(other.justification);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, formula, justification, depth);
    }

    @Override
    public String toString() {
        return lineNumber + ". " + "  ".repeat(depth) + formula + "    " + justification.displayText();
    }
}
