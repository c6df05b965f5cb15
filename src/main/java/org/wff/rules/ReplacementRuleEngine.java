package org.wff.rules;

import org.wff.parser.FormulaNode;
import org.wff.parser.WffParser;
import org.wff.support.Formula;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

import static org.wff.parser.FormulaBuilder.and;
import static org.wff.parser.FormulaBuilder.iff;
import static org.wff.parser.FormulaBuilder.implies;
import static org.wff.parser.FormulaBuilder.not;
import static org.wff.parser.FormulaBuilder.or;

/**
 * MOTORE DI RIMPIAZZAMENTO - Riscritture in un passo secondo le equivalenze
 *
 * Per ogni regola calcola tutti gli alberi ottenibili applicando l'equivalenza
 * una sola volta, in una delle due direzioni, in una qualunque posizione.
 *
 * EQUIVALENZE:
 * - DM: ¬(P∧Q) ≡ ¬P∨¬Q, ¬(P∨Q) ≡ ¬P∧¬Q
 * - Comm: P∧Q ≡ Q∧P, P∨Q ≡ Q∨P
 * - Assoc: (P∧Q)∧R ≡ P∧(Q∧R), idem per ∨
 * - Dist: P∧(Q∨R) ≡ (P∧Q)∨(P∧R), P∨(Q∧R) ≡ (P∨Q)∧(P∨R)
 * - DN: P ≡ ¬¬P
 * - Trans: P→Q ≡ ¬Q→¬P
 * - MI: P→Q ≡ ¬P∨Q
 * - ME: P↔Q ≡ (P→Q)∧(Q→P), P↔Q ≡ (P∧Q)∨(¬P∧¬Q)
 * - Exp: (P∧Q)→R ≡ P→(Q→R)
 * - Taut: P ≡ P∨P, P ≡ P∧P
 */
public final class ReplacementRuleEngine {

    private static final Logger LOGGER = Logger.getLogger(ReplacementRuleEngine.class.getName());

    private ReplacementRuleEngine() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static boolean isValidReplacement(ReplacementRule rule, Formula premise, Formula conclusion) {
        FormulaNode source = WffParser.parse(premise);
        FormulaNode target = WffParser.parse(conclusion);
        if (rule == null || source == null || target == null) return false;

        boolean valid = rewrites(rule, source).contains(target);
        if (!valid) {
            LOGGER.finest(() -> rule.getAbbreviation() + " non trasforma " + premise + " in " + conclusion);
        }
        return valid;
    }

    /**
     * @return alberi ottenibili con una sola applicazione della regola
     */
    public static Set<FormulaNode> rewrites(ReplacementRule rule, FormulaNode tree) {
        Set<FormulaNode> result = new LinkedHashSet<>();
        rewriteRoot(rule, tree, result);

        switch (tree.getType()) {
            case UNARY -> {
                for (FormulaNode child : rewrites(rule, tree.getChild())) {
                    result.add(FormulaNode.unary(tree.getOperator(), child));
                }
            }
            case BINARY -> {
                for (FormulaNode left : rewrites(rule, tree.getLeft())) {
                    result.add(FormulaNode.binary(tree.getOperator(), left, tree.getRight()));
                }
                for (FormulaNode right : rewrites(rule, tree.getRight())) {
                    result.add(FormulaNode.binary(tree.getOperator(), tree.getLeft(), right));
                }
            }
            case VARIABLE -> {
                // nessuna sotto-formula
            }
        }
        return result;
    }

    //region RISCRITTURE ALLA RADICE

    private static void rewriteRoot(ReplacementRule rule, FormulaNode n, Set<FormulaNode> out) {
        switch (rule) {
            case DE_MORGAN -> deMorgan(n, out);
            case COMMUTATION -> {
                if (n.isConjunction()) out.add(and(n.getRight(), n.getLeft()));
                if (n.isDisjunction()) out.add(or(n.getRight(), n.getLeft()));
            }
            case ASSOCIATION -> association(n, out);
            case DISTRIBUTION -> distribution(n, out);
            case DOUBLE_NEGATION -> {
                out.add(not(not(n)));
                if (n.isNegation() && n.getChild().isNegation()) out.add(n.getChild().getChild());
            }
            case TRANSPOSITION -> {
                if (n.isImplication()) {
                    out.add(implies(not(n.getRight()), not(n.getLeft())));
                    if (n.getLeft().isNegation() && n.getRight().isNegation()) {
                        out.add(implies(n.getRight().getChild(), n.getLeft().getChild()));
                    }
                }
            }
            case MATERIAL_IMPLICATION -> {
                if (n.isImplication()) out.add(or(not(n.getLeft()), n.getRight()));
                if (n.isDisjunction() && n.getLeft().isNegation()) out.add(implies(n.getLeft().getChild(), n.getRight()));
            }
            case MATERIAL_EQUIVALENCE -> materialEquivalence(n, out);
            case EXPORTATION -> {
                if (n.isImplication() && n.getLeft().isConjunction()) {
                    out.add(implies(n.getLeft().getLeft(), implies(n.getLeft().getRight(), n.getRight())));
                }
                if (n.isImplication() && n.getRight().isImplication()) {
                    out.add(implies(and(n.getLeft(), n.getRight().getLeft()), n.getRight().getRight()));
                }
            }
            case TAUTOLOGY -> {
                out.add(or(n, n));
                out.add(and(n, n));
                if ((n.isDisjunction() || n.isConjunction()) && n.getLeft().equals(n.getRight())) out.add(n.getLeft());
            }
        }
    }

    private static void deMorgan(FormulaNode n, Set<FormulaNode> out) {
        if (n.isNegation()) {
            FormulaNode inner = n.getChild();
            if (inner.isConjunction()) out.add(or(not(inner.getLeft()), not(inner.getRight())));
            if (inner.isDisjunction()) out.add(and(not(inner.getLeft()), not(inner.getRight())));
        }
        if ((n.isDisjunction() || n.isConjunction()) && n.getLeft().isNegation() && n.getRight().isNegation()) {
            FormulaNode p = n.getLeft().getChild();
            FormulaNode q = n.getRight().getChild();
            out.add(n.isDisjunction() ? not(and(p, q)) : not(or(p, q)));
        }
    }

    private static void association(FormulaNode n, Set<FormulaNode> out) {
        if (n.isConjunction()) {
            if (n.getLeft().isConjunction()) {
                out.add(and(n.getLeft().getLeft(), and(n.getLeft().getRight(), n.getRight())));
            }
            if (n.getRight().isConjunction()) {
                out.add(and(and(n.getLeft(), n.getRight().getLeft()), n.getRight().getRight()));
            }
        }
        if (n.isDisjunction()) {
            if (n.getLeft().isDisjunction()) {
                out.add(or(n.getLeft().getLeft(), or(n.getLeft().getRight(), n.getRight())));
            }
            if (n.getRight().isDisjunction()) {
                out.add(or(or(n.getLeft(), n.getRight().getLeft()), n.getRight().getRight()));
            }
        }
    }

    private static void distribution(FormulaNode n, Set<FormulaNode> out) {
        // P∧(Q∨R) -> (P∧Q)∨(P∧R) e P∨(Q∧R) -> (P∨Q)∧(P∨R)
        if (n.isConjunction() && n.getRight().isDisjunction()) {
            FormulaNode p = n.getLeft();
            out.add(or(and(p, n.getRight().getLeft()), and(p, n.getRight().getRight())));
        }
        if (n.isDisjunction() && n.getRight().isConjunction()) {
            FormulaNode p = n.getLeft();
            out.add(and(or(p, n.getRight().getLeft()), or(p, n.getRight().getRight())));
        }
        // direzione inversa: fattore comune a sinistra
        if (n.isDisjunction() && n.getLeft().isConjunction() && n.getRight().isConjunction()
                && n.getLeft().getLeft().equals(n.getRight().getLeft())) {
            out.add(and(n.getLeft().getLeft(), or(n.getLeft().getRight(), n.getRight().getRight())));
        }
        if (n.isConjunction() && n.getLeft().isDisjunction() && n.getRight().isDisjunction()
                && n.getLeft().getLeft().equals(n.getRight().getLeft())) {
            out.add(or(n.getLeft().getLeft(), and(n.getLeft().getRight(), n.getRight().getRight())));
        }
    }

    private static void materialEquivalence(FormulaNode n, Set<FormulaNode> out) {
        if (n.isBiconditional()) {
            FormulaNode p = n.getLeft();
            FormulaNode q = n.getRight();
            out.add(and(implies(p, q), implies(q, p)));
            out.add(or(and(p, q), and(not(p), not(q))));
        }
        if (n.isConjunction() && n.getLeft().isImplication() && n.getRight().isImplication()) {
            FormulaNode first = n.getLeft();
            FormulaNode second = n.getRight();
            if (first.getLeft().equals(second.getRight()) && first.getRight().equals(second.getLeft())) {
                out.add(iff(first.getLeft(), first.getRight()));
            }
        }
        if (n.isDisjunction() && n.getLeft().isConjunction() && n.getRight().isConjunction()) {
            FormulaNode both = n.getLeft();
            FormulaNode neither = n.getRight();
            if (neither.getLeft().equals(not(both.getLeft())) && neither.getRight().equals(not(both.getRight()))) {
                out.add(iff(both.getLeft(), both.getRight()));
            }
        }
    }

    //endregion
}
