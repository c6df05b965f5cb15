package org.wff.rules.strategies;

import org.wff.parser.FormulaNode;
import org.wff.rules.Application;
import org.wff.rules.FormulaShape;
import org.wff.rules.InferenceRule;
import org.wff.support.LogicTile;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.wff.parser.FormulaBuilder.not;
import static org.wff.parser.FormulaBuilder.or;

/**
 * SILLOGISMO DISGIUNTIVO - (P∨Q), ¬P ⊢ Q oppure (P∨Q), ¬Q ⊢ P
 */
public class DisjunctiveSyllogism extends AbstractRuleStrategy {

    public DisjunctiveSyllogism() {
        super(InferenceRule.DISJUNCTIVE_SYLLOGISM, FormulaShape.ANY, FormulaShape.IS_DISJUNCTION, FormulaShape.IS_NEGATION);
    }

    @Override
    public List<Application> derive(List<FormulaNode> premises) {
        List<Application> result = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            FormulaNode disjunction = premises.get(i);
            if (!disjunction.isDisjunction()) continue;

            for (int j = 0; j < premises.size(); j++) {
                FormulaNode denial = premises.get(j);
                if (i == j || !denial.isNegation()) continue;

                FormulaNode denied = denial.getChild();
                if (denied.equals(disjunction.getLeft())) {
                    result.add(application(disjunction.getRight(), disjunction, denial));
                }
                if (denied.equals(disjunction.getRight())) {
                    result.add(application(disjunction.getLeft(), disjunction, denial));
                }
            }
        }
        return result;
    }

    /**
     * Bersaglio C: [(C∨A), ¬A] e [(A∨C), ¬A] per ogni atomo fresco A in entrambe le polarità.
     */
    @Override
    public List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool) {
        List<List<FormulaNode>> result = new ArrayList<>();
        for (LogicTile variable : freshVariables(target, pool)) {
            for (boolean negated : new boolean[]{false, true}) {
                FormulaNode alternative = literal(variable, negated);
                result.add(List.of(or(target, alternative), not(alternative)));
                result.add(List.of(or(alternative, target), not(alternative)));
            }
        }
        return result;
    }

    @Override
    public FormulaNode sampleConclusion(List<LogicTile> pool, Random random) {
        return randomLiteral(pool, random);
    }
}
