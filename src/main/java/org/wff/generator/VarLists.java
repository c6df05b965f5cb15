package org.wff.generator;

import org.wff.parser.FormulaBuilder;
import org.wff.parser.FormulaNode;
import org.wff.parser.WffParser;
import org.wff.support.Formula;
import org.wff.support.LogicTile;
import org.wff.support.Tiles;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * POOL DELLE VARIABILI - Stato di lavoro di un tentativo di generazione
 *
 * Partiziona l'alfabeto in variabili disponibili e asserzioni atomiche già
 * impegnate (una variabile o la sua negazione). Ogni variabile compare in una
 * sola polarità in tutto il problema in costruzione.
 *
 * CICLO DI VITA:
 * - create: un pool nuovo per tentativo
 * - copy: copia privata per ogni ramo speculativo
 * - commit: solo un ramo riuscito riversa la sua copia nel pool del chiamante
 */
public final class VarLists {

    private static final Logger LOGGER = Logger.getLogger(VarLists.class.getName());

    private final List<LogicTile> alphabet;
    private final List<LogicTile> available;
    private final List<FormulaNode> used;

    private VarLists(List<LogicTile> alphabet, List<LogicTile> available, List<FormulaNode> used) {
        this.alphabet = alphabet;
        this.available = available;
        this.used = used;
    }

    /** Pool nuovo sull'alfabeto del generatore (p..w), in ordine casuale */
    public static VarLists create(Random random) {
        return create(Tiles.PROBLEM_VARIABLES, random);
    }

    public static VarLists create(List<LogicTile> alphabet, Random random) {
        if (alphabet == null || alphabet.isEmpty()) {
            throw new IllegalArgumentException("Alfabeto delle variabili non può essere vuoto");
        }
        List<LogicTile> shuffled = new ArrayList<>(alphabet);
        Collections.shuffle(shuffled, random);
        return new VarLists(List.copyOf(alphabet), shuffled, new ArrayList<>());
    }

    public VarLists copy() {
        return new VarLists(alphabet, new ArrayList<>(available), new ArrayList<>(used));
    }

    /**
     * Adotta lo stato di una copia riuscita.
     *
     * @throws IllegalStateException se la copia proviene da un alfabeto diverso
     */
    public void commit(VarLists branch) {
        if (branch == null || !new HashSet<>(alphabet).equals(new HashSet<>(branch.alphabet))) {
            throw new IllegalStateException("Commit di un pool con alfabeto diverso");
        }
        available.clear();
        available.addAll(branch.available);
        used.clear();
        used.addAll(branch.used);
    }

    //region ASSERZIONI ATOMICHE

    /**
     * Impegna un'asserzione atomica.
     *
     * @param assertion letterale da impegnare
     * @return l'asserzione se compatibile, null se contraddice un'asserzione
     *         impegnata o se la variabile non appartiene al pool
     */
    public FormulaNode useAtomicAssertion(FormulaNode assertion) {
        LogicTile variable = AtomicAssertions.baseVariable(assertion);

        for (FormulaNode committed : used) {
            if (AtomicAssertions.baseVariable(committed).equals(variable) && !committed.equals(assertion)) {
                LOGGER.finest(() -> "Conflitto: " + assertion + " contraddice " + committed);
                return null;
            }
        }
        if (used.contains(assertion)) {
            return assertion;
        }
        if (available.remove(variable)) {
            used.add(assertion);
            return assertion;
        }
        // variabile estranea all'alfabeto
        return null;
    }

    public Formula useAtomicAssertion(Formula assertion) {
        FormulaNode tree = WffParser.parse(assertion);
        if (tree == null || !tree.isLiteral()) {
            throw new IllegalArgumentException("Asserzione atomica non valida: " + assertion);
        }
        return useAtomicAssertion(tree) == null ? null : FormulaBuilder.toFormula(tree);
    }

    //endregion

    //region ACCESSORS

    public List<LogicTile> getAvailableVariables() {
        return Collections.unmodifiableList(available);
    }

    public List<FormulaNode> getUsedAssertions() {
        return Collections.unmodifiableList(used);
    }

    public List<LogicTile> getAlphabet() {
        return alphabet;
    }

    /**
     * Variabili da cui estrarre atomi freschi: le disponibili, oppure l'intero
     * alfabeto quando sono esaurite. Le variabili escluse vengono sempre scartate.
     */
    public List<LogicTile> poolExcluding(Collection<LogicTile> excluded) {
        List<LogicTile> source = available.isEmpty() ? alphabet : available;
        List<LogicTile> pool = new ArrayList<>();
        for (LogicTile variable : source) {
            if (!excluded.contains(variable)) pool.add(variable);
        }
        return pool;
    }

    //endregion

    @Override
    public String toString() {
        return "disponibili=" + available + " impegnate=" + used;
    }
}
