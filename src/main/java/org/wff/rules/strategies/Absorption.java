package org.wff.rules.strategies;

import org.wff.parser.FormulaNode;
import org.wff.rules.Application;
import org.wff.rules.FormulaShape;
import org.wff.rules.InferenceRule;
import org.wff.support.LogicTile;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.wff.parser.FormulaBuilder.and;
import static org.wff.parser.FormulaBuilder.implies;
import static org.wff.parser.FormulaBuilder.var;

/**
 * ASSORBIMENTO - (P→Q) ⊢ P→(P∧Q)
 */
public class Absorption extends AbstractRuleStrategy {

    public Absorption() {
        super(InferenceRule.ABSORPTION, FormulaShape.IS_IMPLICATION, FormulaShape.IS_IMPLICATION);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (FormulaNode premise : premises) {
            if (premise.isImplication()) {
                FormulaNode antecedent = premise.getLeft();
                result.add(application(implies(antecedent, and(antecedent, premise.getRight())), premise));
            }
        }
        return result;
    }

    /** Solo bersagli della forma P→(P∧Q) */
    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        if (!target.isImplication()) return List.of();
        FormulaNode consequent = target.getRight();
        if (!consequent.isConjunction() || !consequent.getLeft().equals(target.getLeft())) return List.of();

        return List.of(List.of(implies(target.getLeft(), consequent.getRight())));
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        List<LogicTile> drawn = draw(pool, 2, random);
        FormulaNode antecedent = var(drawn.get(0));
        return implies(antecedent, and(antecedent, var(drawn.get(1))));
    }
}
