package org.wff.rules;

import org.wff.parser.FormulaNode;
import org.wff.support.LogicTile;

import java.util.List;
import java.util.Random;

/**
 * STRATEGIA DI REGOLA - Le due direzioni di una regola di inferenza
 *
 * Ogni regola espone due funzioni pure e indipendenti:
 * - derive: modalità in avanti, dalle premesse a tutte le conclusioni ottenibili
 * - premisesFor: modalità all'indietro, da una conclusione desiderata alle
 *   liste di premesse che la produrrebbero
 *
 * Le forme di premesse e conclusione guidano la pianificazione del generatore.
 * Il confronto tra sotto-formule è sempre strutturale (uguaglianza di alberi).
 */
public interface RuleStrategy {

    InferenceRule rule();

    /** Forma richiesta per ciascuna premessa, nell'ordine di {@link #premisesFor} */
    List<FormulaShape> premiseShapes();

    FormulaShape conclusionShape();

    default int premiseCount() {
        return premiseShapes().size();
    }

    /**
     * Modalità in avanti.
     *
     * @param premises alberi delle premesse disponibili (non null)
     * @return tutte le applicazioni della regola, senza figli
     */
    List<Application> derive(List<FormulaNode> premises);

    /**
     * Come {@link #derive} ma con la conclusione cercata nota: le regole con
     * operandi liberi (Addition) li istanziano dal bersaglio.
     */
    default List<Application> deriveToward(List<FormulaNode> premises, FormulaNode target) {
        return derive(premises);
    }

    /**
     * Modalità all'indietro.
     *
     * @param target conclusione da ottenere
     * @param pool variabili utilizzabili come atomi freschi
     * @return liste di premesse che derivano il bersaglio (vuota se la forma non è compatibile)
     */
    List<List<FormulaNode>> premisesFor(FormulaNode target, List<LogicTile> pool);

    /**
     * Conclusione concreta della forma prodotta dalla regola, usata come
     * obiettivo di un problema generato.
     */
    FormulaNode sampleConclusion(List<LogicTile> pool, Random random);
}
