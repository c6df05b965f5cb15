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

/**
 * MODUS PONENS - (P→Q), P ⊢ Q
 */
public class ModusPonens extends AbstractRuleStrategy {

    public ModusPonens() {
        super(InferenceRule.MODUS_PONENS, FormulaShape.ANY, FormulaShape.IS_IMPLICATION, FormulaShape.IS_ATOMIC);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            FormulaNode conditional = premises.get(i);
            if (!conditional.isImplication()) continue;

            for (int j = 0; j < premises.size(); j++) {
                if (i != j && premises.get(j).equals(conditional.getLeft())) {
                    result.add(application(conditional.getRight(), conditional, premises.get(j)));
                }
            }
        }
        return result;
    }

    /**
     * Qualunque bersaglio C: [(A→C), A] per ogni atomo fresco A, in entrambe le polarità.
     */
    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        List<List<FormulaNode>> result = new ArrayList<>();
        for (LogicTile variable : freshVariables(target, pool)) {
            for (boolean negated : new boolean[]{false, true}) {
                FormulaNode antecedent = literal(variable, negated);
                result.add(List.of(implies(antecedent, target), antecedent));
            }
        }
        return result;
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        return randomLiteral(pool, random);
    }
}
