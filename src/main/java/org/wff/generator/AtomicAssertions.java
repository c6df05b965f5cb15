package org.wff.generator;

import org.wff.parser.FormulaBuilder;
import org.wff.parser.FormulaNode;
import org.wff.parser.WffParser;
import org.wff.support.Formula;
import org.wff.support.LogicTile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ASSERZIONI ATOMICHE - Letterali affermati da una formula
 *
 * Ogni occorrenza di variabile produce un'asserzione: negata se il nodo padre
 * è una negazione, positiva altrimenti. Es. (¬p∧q)∨r → [¬p, q, r];
 * ¬(p∧q)∨r → [p, q, r].
 *
 * È un controllo sintattico: due premesse sono considerate in conflitto solo
 * se affermano la stessa variabile con polarità opposte.
 */
public final class AtomicAssertions {

    private AtomicAssertions() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return letterali distinti della formula, in ordine di occorrenza
     */
    public static List<FormulaNode> of(FormulaNode tree) {
        Set<FormulaNode> result = new LinkedHashSet<>();
        collect(tree, null, result);
        return new ArrayList<>(result);
    }

    /**
     * @return letterali in forma canonica, lista vuota se la formula non è ben formata
     */
    public static List<Formula> of(Formula formula) {
        FormulaNode tree = WffParser.parse(formula);
        if (tree == null) return List.of();

        List<Formula> result = new ArrayList<>();
        for (FormulaNode literal : of(tree)) {
            result.add(FormulaBuilder.toFormula(literal));
        }
        return result;
    }

    /**
     * @param literal variabile o variabile negata
     * @return la variabile sottostante
     */
    public static LogicTile baseVariable(FormulaNode literal) {
        if (literal == null || !literal.isLiteral()) {
            throw new IllegalArgumentException("Asserzione atomica non valida: " + literal);
        }
        return literal.isVariable() ? literal.getTile() : literal.getChild().getTile();
    }

    /**
     * Le premesse affermano qualche variabile sia positiva che negata?
     */
    public static boolean hasContradiction(List<Formula> premises) {
        Set<FormulaNode> asserted = new HashSet<>();
        for (Formula premise : premises) {
            FormulaNode tree = WffParser.parse(premise);
            if (tree != null) asserted.addAll(of(tree));
        }
        for (FormulaNode literal : asserted) {
            if (literal.isVariable() && asserted.contains(FormulaBuilder.not(literal))) {
                return true;
            }
        }
        return false;
    }

    private static void collect(FormulaNode node, FormulaNode parent, Set<FormulaNode> result) {
        switch (node.getType()) {
            case VARIABLE -> result.add(parent != null && parent.isNegation() ? parent : node);
            case UNARY -> collect(node.getChild(), node, result);
            case BINARY -> {
                collect(node.getLeft(), node, result);
                collect(node.getRight(), node, result);
            }
        }
    }
}
