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

/**
 * CONGIUNZIONE - P, Q ⊢ P∧Q (e Q∧P)
 */
public class Conjunction extends AbstractRuleStrategy {

    public Conjunction() {
        super(InferenceRule.CONJUNCTION, FormulaShape.IS_CONJUNCTION, FormulaShape.ANY, FormulaShape.ANY);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            for (int j = i + 1; j < premises.size(); j++) {
                FormulaNode first = premises.get(i);
                FormulaNode second = premises.get(j);
                result.add(application(and(first, second), first, second));
                result.add(application(and(second, first), second, first));
            }
        }
        return result;
    }

    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        if (!target.isConjunction()) return List.of();
        return List.of(List.of(target.getLeft(), target.getRight()));
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        List<LogicTile> drawn = draw(pool, 2, random);
        return and(literal(drawn.get(0), random.nextBoolean()), literal(drawn.get(1), random.nextBoolean()));
    }
}
