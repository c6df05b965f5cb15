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
import static org.wff.parser.FormulaBuilder.var;

/**
 * SILLOGISMO IPOTETICO - (P→Q), (Q→R) ⊢ P→R
 */
public class HypotheticalSyllogism extends AbstractRuleStrategy {

    public HypotheticalSyllogism() {
        super(InferenceRule.HYPOTHETICAL_SYLLOGISM, FormulaShape.IS_IMPLICATION,
                FormulaShape.IS_IMPLICATION, FormulaShape.IS_IMPLICATION);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            FormulaNode first = premises.get(i);
            if (!first.isImplication()) continue;

            for (int j = 0; j < premises.size(); j++) {
                FormulaNode second = premises.get(j);
                if (i != j && second.isImplication() && first.getRight().equals(second.getLeft())) {
                    result.add(application(implies(first.getLeft(), second.getRight()), first, second));
                }
            }
        }
        return result;
    }

    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        if (!target.isImplication()) return List.of();

        List<List<FormulaNode>> result = new ArrayList<>();
        for (LogicTile variable : freshVariables(target, pool)) {
            FormulaNode middle = var(variable);
            result.add(List.of(implies(target.getLeft(), middle), implies(middle, target.getRight())));
        }
        return result;
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        List<LogicTile> drawn = draw(pool, 2, random);
        return implies(var(drawn.get(0)), var(drawn.get(1)));
    }
}
