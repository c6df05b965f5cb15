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
import static org.wff.parser.FormulaBuilder.var;

/**
 * SEMPLIFICAZIONE - (P∧Q) ⊢ P, (P∧Q) ⊢ Q
 */
public class Simplification extends AbstractRuleStrategy {

    public Simplification() {
        super(InferenceRule.SIMPLIFICATION, FormulaShape.ANY, FormulaShape.IS_CONJUNCTION);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (FormulaNode premise : premises) {
            if (premise.isConjunction()) {
                result.add(application(premise.getLeft(), premise));
                result.add(application(premise.getRight(), premise));
            }
        }
        return result;
    }

    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        List<List<FormulaNode>> result = new ArrayList<>();
        for (LogicTile variable : freshVariables(target, pool)) {
            result.add(List.of(and(target, var(variable))));
            result.add(List.of(and(var(variable), target)));
        }
        return result;
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        return randomLiteral(pool, random);
    }
}
