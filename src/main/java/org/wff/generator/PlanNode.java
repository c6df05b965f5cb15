package org.wff.generator;

import org.wff.rules.FormulaShape;
import org.wff.rules.InferenceRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Nodo del piano: vincolo di forma ereditato dal padre, regola scelta
 * (ASSUMPTION per le foglie) e indici dei figli nell'arena del {@link ProofPlan}.
 * Non contiene formule concrete.
 */
public final class PlanNode {

    private final int id;
    private final int parent;
    private final FormulaShape constraint;
    private InferenceRule rule = InferenceRule.ASSUMPTION;
    private final List<Integer> children = new ArrayList<>();

    PlanNode(int id, int parent, FormulaShape constraint) {
        this.id = id;
        this.parent = parent;
        this.constraint = constraint;
    }

    public int getId() {
        return id;
    }

    /** @return indice del padre, -1 per l'obiettivo */
    public int getParent() {
        return parent;
    }

    public FormulaShape getConstraint() {
        return constraint;
    }

    public InferenceRule getRule() {
        return rule;
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return rule == InferenceRule.ASSUMPTION;
    }

    void assignRule(InferenceRule rule, List<Integer> childIds) {
        this.rule = rule;
        children.clear();
        children.addAll(childIds);
    }

    @Override
    public String toString() {
        return "#" + id + " [" + rule.getAbbreviation() + "] " + constraint;
    }
}
