package org.wff.proof;

import org.wff.parser.WffParser;
import org.wff.rules.Application;
import org.wff.support.Formula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Ricostruisce una dimostrazione dall'albero di derivazione di un problema
 * generato: prima le premesse, poi le applicazioni in post-ordine come righe
 * di inferenza. Una formula già presente riusa la sua riga; se l'obiettivo
 * non è l'ultima riga emessa viene reiterato in fondo.
 */
public final class DerivationReplayer {

    private static final Logger LOGGER = Logger.getLogger(DerivationReplayer.class.getName());

    private DerivationReplayer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @throws IllegalArgumentException se il problema non ha una derivazione
     * @throws IllegalStateException se una foglia della derivazione non è tra le premesse
     */
    public static Proof replay(Problem problem) {
        if (problem == null || problem.getDerivation() == null) {
            throw new IllegalArgumentException("Il problema non contiene un albero di derivazione");
        }

        List<ProofLine> lines = new ArrayList<>();
        Map<Formula, Integer> lineOf = new HashMap<>();

        for (Formula premise : problem.getPremises()) {
            int number = lines.size() + 1;
            lines.add(new ProofLine(number, premise, Justification.premise()));
            lineOf.putIfAbsent(WffParser.normalize(premise), number);
        }

        emit(problem.getDerivation(), lines, lineOf);

        // l'obiettivo già derivato in precedenza viene riportato in fondo
        Formula goal = WffParser.normalize(problem.getDerivation().getConclusion());
        if (!WffParser.normalize(lines.get(lines.size() - 1).getFormula()).equals(goal)) {
            int number = lines.size() + 1;
            lines.add(new ProofLine(number, problem.getDerivation().getConclusion(),
                    Justification.reiteration(lineOf.get(goal))));
        }

        Proof proof = new Proof(lines);
        LOGGER.fine(() -> "Derivazione ricostruita in " + proof.size() + " righe per " + problem.getId());
        return proof;
    }

    private static void emit(Application application, List<ProofLine> lines, Map<Formula, Integer> lineOf) {
        Formula conclusion = WffParser.normalize(application.getConclusion());

        if (application.isLeaf()) {
            if (!lineOf.containsKey(conclusion)) {
                throw new IllegalStateException("Foglia della derivazione assente dalle premesse: " + conclusion);
            }
            return;
        }

        for (Application child : application.getChildren()) {
            emit(child, lines, lineOf);
        }
        if (lineOf.containsKey(conclusion)) return;

        List<Integer> references = new ArrayList<>();
        for (Formula premise : application.getPremises()) {
            Integer reference = lineOf.get(WffParser.normalize(premise));
            if (reference == null) {
                throw new IllegalStateException("Premessa " + premise + " non ancora derivata per " + application);
            }
            references.add(reference);
        }

        int number = lines.size() + 1;
        lines.add(new ProofLine(number, application.getConclusion(),
                Justification.inference(application.getRule(), references)));
        lineOf.put(conclusion, number);
    }
}
