package org.wff.rules.strategies;

import org.wff.parser.FormulaNode;
import org.wff.rules.Application;
import org.wff.rules.FormulaShape;
import org.wff.rules.InferenceRule;
import org.wff.support.LogicTile;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.wff.parser.FormulaBuilder.implies;
import static org.wff.parser.FormulaBuilder.not;
import static org.wff.parser.FormulaBuilder.var;

/**
 * MODUS TOLLENS - (P→Q), ¬Q ⊢ ¬P
 */
public class ModusTollens extends AbstractRuleStrategy {

    public ModusTollens() {
        super(InferenceRule.MODUS_TOLLENS, FormulaShape.IS_NEGATION, FormulaShape.IS_IMPLICATION, FormulaShape.IS_NEGATION);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            FormulaNode conditional = premises.get(i);
            if (!conditional.isImplication()) continue;

            for (int j = 0; j < premises.size(); j++) {
                FormulaNode denial = premises.get(j);
                if (i != j && denial.isNegation() && denial.getChild().equals(conditional.getRight())) {
                    result.add(application(not(conditional.getLeft()), conditional, denial));
                }
            }
        }
        return result;
    }

    /**
     * Bersaglio ¬P: [(P→A), ¬A]. Con A negato la premessa diventa ¬¬a, l'unica
     * variante che supera il controllo di consistenza sugli atomi.
     */
    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        if (!target.isNegation()) return List.of();

        List<List<FormulaNode>> result = new ArrayList<>();
        for (LogicTile variable : freshVariables(target, pool)) {
            for (boolean negated : new boolean[]{false, true}) {
                FormulaNode consequent = literal(variable, negated);
                result.add(List.of(implies(target.getChild(), consequent), not(consequent)));
            }
        }
        return result;
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        return not(var(draw(pool, 1, random).get(0)));
    }
}
