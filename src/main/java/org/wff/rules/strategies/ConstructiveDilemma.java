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
import static org.wff.parser.FormulaBuilder.or;
import static org.wff.parser.FormulaBuilder.var;

/**
 * DILEMMA COSTRUTTIVO - (P→Q)∧(R→S), (P∨R) ⊢ Q∨S
 *
 * Le due implicazioni devono stare nella stessa congiunzione; la disgiunzione
 * deve citarne gli antecedenti nello stesso ordine.
 */
public class ConstructiveDilemma extends AbstractRuleStrategy {

    public ConstructiveDilemma() {
        super(InferenceRule.CONSTRUCTIVE_DILEMMA, FormulaShape.IS_DISJUNCTION,
                FormulaShape.IS_CONJUNCTION, FormulaShape.IS_DISJUNCTION);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            FormulaNode pair = premises.get(i);
            if (!pair.isConjunction() || !pair.getLeft().isImplication() || !pair.getRight().isImplication()) {
                continue;
            }
            FormulaNode first = pair.getLeft();
            FormulaNode second = pair.getRight();

            for (int j = 0; j < premises.size(); j++) {
                FormulaNode cases = premises.get(j);
                if (i != j && cases.isDisjunction()
                        && cases.getLeft().equals(first.getLeft())
                        && cases.getRight().equals(second.getLeft())) {
                    result.add(application(or(first.getRight(), second.getRight()), pair, cases));
                }
            }
        }
        return result;
    }

    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        if (!target.isDisjunction()) return List.of();

        List<LogicTile> fresh = freshVariables(target, pool);
        List<List<FormulaNode>> result = new ArrayList<>();
        for (LogicTile a : fresh) {
            for (LogicTile b : fresh) {
                if (a.equals(b)) continue;
                FormulaNode conditionals = and(implies(var(a), target.getLeft()), implies(var(b), target.getRight()));
                result.add(List.of(conditionals, or(var(a), var(b))));
            }
        }
        return result;
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        List<LogicTile> drawn = draw(pool, 2, random);
        return or(var(drawn.get(0)), var(drawn.get(1)));
    }
}
