package org.wff.proof;

import org.wff.rules.Application;
import org.wff.support.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * PROBLEMA - Premesse, obiettivo e difficoltà di un esercizio
 *
 * Le premesse sono un insieme ordinato (i duplicati vengono scartati).
 * La derivazione è presente solo per i problemi generati e permette di
 * ricostruire una soluzione.
 */
public final class Problem {

    private final String id;
    private final String name;
    private final List<Formula> premises;
    private final Formula conclusion;
    private final int difficulty;
    private final Application derivation;

    public Problem(String id, String name, List<Formula> premises, Formula conclusion,
                   int difficulty, Application derivation) {
        if (id == null || premises == null || conclusion == null) {
            throw new IllegalArgumentException("Identificativo, premesse e obiettivo del problema sono obbligatori");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.premises = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(premises)));
        this.conclusion = conclusion;
        this.difficulty = difficulty;
        this.derivation = derivation;
    }

    public Problem(String id, String name, List<Formula> premises, Formula conclusion, int difficulty) {
        this(id, name, premises, conclusion, difficulty, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Formula> getPremises() {
        return premises;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    public int getDifficulty() {
        return difficulty;
    }

    /** @return radice dell'albero di derivazione, null per problemi non generati */
    public Application getDerivation() {
        return derivation;
    }

    @Override
    public String toString() {
        return name + ": " + premises + " ⊢ " + conclusion + " (difficoltà " + difficulty + ")";
    }
}
