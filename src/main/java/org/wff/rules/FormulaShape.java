package org.wff.rules;

import org.wff.parser.FormulaNode;

/**
 * Vincolo strutturale sulla forma di una formula, usato dal pianificatore per
 * descrivere cosa deve contenere un nodo senza fissarne le variabili.
 */
public enum FormulaShape {
    ANY,
    IS_IMPLICATION,
    IS_CONJUNCTION,
    IS_DISJUNCTION,
    IS_NEGATION,
    IS_ATOMIC;      // letterale: variabile o variabile negata

    public boolean matches(FormulaNode node) {
        if (node == null) return false;
        return switch (this) {
            case ANY -> true;
            case IS_IMPLICATION -> node.isImplication();
            case IS_CONJUNCTION -> node.isConjunction();
            case IS_DISJUNCTION -> node.isDisjunction();
            case IS_NEGATION -> node.isNegation();
            case IS_ATOMIC -> node.isLiteral();
        };
    }

    /**
     * Una regola che conclude formule di forma {@code conclusionShape} può
     * soddisfare questo vincolo?
     */
    public boolean acceptsConclusionShape(FormulaShape conclusionShape) {
        return this == ANY || conclusionShape == this || conclusionShape == ANY;
    }
}
