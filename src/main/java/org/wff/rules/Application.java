package org.wff.rules;

import org.wff.support.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * APPLICAZIONE - Risultato dell'attivazione di una regola
 *
 * Conclusione, regola usata, premesse consumate e (solo per il generatore) le
 * applicazioni figlie che hanno prodotto quelle premesse. Le applicazioni
 * prodotte dal motore non hanno figli; il generatore costruisce invece un
 * albero di derivazione le cui foglie sono applicazioni ASSUMPTION.
 */
public final class Application {

    private final Formula conclusion;
    private final InferenceRule rule;
    private final List<Formula> premises;
    private final List<Application> children;

    public Application(Formula conclusion, InferenceRule rule, List<Formula> premises, List<Application> children) {
        if (conclusion == null || rule == null) {
            throw new IllegalArgumentException("Conclusione e regola dell'applicazione non possono essere null");
        }
        this.conclusion = conclusion;
        this.rule = rule;
        this.premises = Collections.unmodifiableList(new ArrayList<>(premises == null ? List.of() : premises));
        this.children = Collections.unmodifiableList(new ArrayList<>(children == null ? List.of() : children));
    }

    public Application(Formula conclusion, InferenceRule rule, List<Formula> premises) {
        this(conclusion, rule, premises, List.of());
    }

    /** Foglia dell'albero di derivazione: formula assunta come premessa del problema */
    public static Application assumption(Formula formula) {
        return new Application(formula, InferenceRule.ASSUMPTION, List.of(), List.of());
    }

    public Formula getConclusion() {
        return conclusion;
    }

    public InferenceRule getRule() {
        return rule;
    }

    public List<Formula> getPremises() {
        return premises;
    }

    public List<Application> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return rule == InferenceRule.ASSUMPTION;
    }

    /**
     * @return numero di passi di inferenza (nodi non foglia) dell'albero
     */
    public int countSteps() {
        if (isLeaf()) return 0;
        int steps = 1;
        for (Application child : children) {
            steps += child.countSteps();
        }
        return steps;
    }

    /**
     * Premesse effettivamente usate dall'albero: conclusioni distinte delle
     * foglie ASSUMPTION, in ordine di visita.
     */
    public List<Formula> leafPremises() {
        Set<Formula> result = new LinkedHashSet<>();
        collectLeaves(this, result);
        return new ArrayList<>(result);
    }

    private static void collectLeaves(Application application, Set<Formula> result) {
        if (application.isLeaf()) {
            result.add(application.conclusion);
            return;
        }
        for (Application child : application.children) {
            collectLeaves(child, result);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Application other = (Application) obj;
        return conclusion.equals(other.conclusion)
                && rule == other.rule
                && premises.equals(other.premises)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conclusion, rule, premises, children);
    }

    @Override
    public String toString() {
        return premises + " ⊢ " + conclusion + " [" + rule.getAbbreviation() + "]";
    }
}
