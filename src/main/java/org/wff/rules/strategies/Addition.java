package org.wff.rules.strategies;

import org.wff.parser.FormulaNode;
import org.wff.rules.Application;
import org.wff.rules.FormulaShape;
import org.wff.rules.InferenceRule;
import org.wff.support.LogicTile;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.wff.parser.FormulaBuilder.or;
import static org.wff.parser.FormulaBuilder.var;

/**
 * ADDIZIONE - P ⊢ P∨Q per qualunque Q
 *
 * In avanti senza bersaglio Q viene preso tra le altre premesse; con un
 * bersaglio noto Q è il suo disgiunto libero.
 */
public class Addition extends AbstractRuleStrategy {

    public Addition() {
        super(InferenceRule.ADDITION, FormulaShape.IS_DISJUNCTION, FormulaShape.ANY);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            for (int j = 0; j < premises.size(); j++) {
                if (i != j) {
                    result.add(application(or(premises.get(i), premises.get(j)), premises.get(i)));
                }
            }
        }
        return result;
    }

    @Override
    public List<Application> deriveToward(List<FormulaNode> premises, FormulaNode target) {
        List<Application> result = derive(premises);
        if (target == null || !target.isDisjunction()) return result;

        for (FormulaNode premise : premises) {
            if (premise.equals(target.getLeft()) || premise.equals(target.getRight())) {
                result.add(application(target, premise));
            }
        }
        return result;
    }

    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        if (!target.isDisjunction()) return List.of();
        return List.of(List.of(target.getLeft()), List.of(target.getRight()));
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        List<LogicTile> drawn = draw(pool, 2, random);
        return or(var(drawn.get(0)), var(drawn.get(1)));
    }
}
