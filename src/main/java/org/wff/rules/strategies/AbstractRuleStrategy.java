package org.wff.rules.strategies;

import org.wff.parser.FormulaBuilder;
import org.wff.parser.FormulaNode;
import org.wff.rules.Application;
import org.wff.rules.FormulaShape;
import org.wff.rules.InferenceRule;
import org.wff.rules.RuleStrategy;
import org.wff.support.Formula;
import org.wff.support.LogicTile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Base comune delle strategie: metadati della regola e primitive per costruire
 * applicazioni e scegliere atomi freschi.
 */
public abstract class AbstractRuleStrategy implements RuleStrategy {

    private final InferenceRule rule;
    private final List<FormulaShape> premiseShapes;
    private final FormulaShape conclusionShape;

    protected AbstractRuleStrategy(InferenceRule rule, FormulaShape conclusionShape, FormulaShape... premiseShapes) {
        this.rule = rule;
        this.conclusionShape = conclusionShape;
        this.premiseShapes = List.of(premiseShapes);
    }

    @Override
    public InferenceRule rule() {
        return rule;
    }

    @Override
    public List<FormulaShape> premiseShapes() {
        return premiseShapes;
    }

    @Override
    public FormulaShape conclusionShape() {
        return conclusionShape;
    }

    //region PRIMITIVE

    /** Applicazione con conclusione e premesse in forma canonica */
    protected Application application(FormulaNode conclusion, FormulaNode... premises) {
        List<Formula> premiseFormulas = new ArrayList<>(premises.length);
        for (FormulaNode premise : premises) {
            premiseFormulas.add(FormulaBuilder.toFormula(premise));
        }
        return new Application(FormulaBuilder.toFormula(conclusion), rule, premiseFormulas);
    }

    /** Variabili del pool che non compaiono nel bersaglio */
    protected static List<LogicTile> freshVariables(FormulaNode target, List<LogicTile> pool) {
        Set<LogicTile> used = target.variables();
        List<LogicTile> fresh = new ArrayList<>();
        for (LogicTile variable : pool) {
            if (!used.contains(variable) && !fresh.contains(variable)) {
                fresh.add(variable);
            }
        }
        return fresh;
    }

    /**
     * @return {@code count} variabili distinte estratte a caso dal pool
     * @throws IllegalArgumentException se il pool non ne contiene abbastanza
     */
    protected static List<LogicTile> draw(List<LogicTile> pool, int count, Random random) {
        List<LogicTile> distinct = new ArrayList<>();
        for (LogicTile variable : pool) {
            if (!distinct.contains(variable)) distinct.add(variable);
        }
        if (distinct.size() < count) {
            throw new IllegalArgumentException("Servono " + count + " variabili distinte, disponibili " + distinct.size());
        }
        Collections.shuffle(distinct, random);
        return distinct.subList(0, count);
    }

    protected static FormulaNode literal(LogicTile variable, boolean negated) {
        FormulaNode atom = FormulaBuilder.var(variable);
        return negated ? FormulaBuilder.not(atom) : atom;
    }

    protected static FormulaNode randomLiteral(List<LogicTile> pool, Random random) {
        return literal(draw(pool, 1, random).get(0), random.nextBoolean());
    }

    //endregion

    @Override
    public String toString() {
        return rule.getDisplayName();
    }
}
