package org.wff.proof;

import org.wff.parser.FormulaBuilder;
import org.wff.parser.FormulaNode;
import org.wff.parser.WffParser;
import org.wff.rules.InferenceRule;
import org.wff.rules.InferenceRuleEngine;
import org.wff.rules.ReplacementRuleEngine;
import org.wff.support.Formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * VALIDATORE DI DIMOSTRAZIONI - Macchina a stati sulle righe di una dimostrazione
 *
 * STATO:
 * - profondità della riga precedente
 * - pila di ambiti: uno per il livello principale e uno per ogni
 *   sotto-dimostrazione aperta, ciascuno con le righe che contiene
 * - alberi delle righe già accettate
 *
 * SCOPE:
 * Una riga è referenziabile se precede la riga corrente e appartiene a un
 * ambito ancora aperto. Chiudere una sotto-dimostrazione (II o RAA) scarta il
 * suo ambito: le sue righe, assunzione compresa, non sono più citabili.
 *
 * PROFONDITÀ:
 * - aumenta di uno solo con un'assunzione, e un'assunzione apre sempre un livello
 * - diminuisce di uno solo con una giustificazione di chiusura
 *
 * Il primo errore interrompe la validazione e viene restituito con la sua riga.
 */
public class ProofValidator {

    private static final Logger LOGGER = Logger.getLogger(ProofValidator.class.getName());

    //region PUNTI DI INGRESSO

    /**
     * @param proof dimostrazione da verificare (non null)
     * @return esito con il primo errore incontrato
     */
    public ValidationResult validate(Proof proof) {
        if (proof == null) {
            throw new IllegalArgumentException("Dimostrazione da validare non può essere null");
        }

        Deque<Scope> scopes = new ArrayDeque<>();
        scopes.push(new Scope(0));
        Map<Integer, FormulaNode> proven = new HashMap<>();
        int previousDepth = 0;

        List<ProofLine> lines = proof.getLines();
        for (int i = 0; i < lines.size(); i++) {
            ProofLine line = lines.get(i);
            int number = line.getLineNumber();

            if (number != i + 1) {
                return fail(number, "Numerazione non consecutiva: attesa riga " + (i + 1));
            }

            FormulaNode tree = WffParser.parse(line.getFormula());
            if (tree == null) {
                return fail(number, "La formula '" + line.getFormula() + "' non è ben formata");
            }

            ValidationResult depthCheck = checkDepth(line, previousDepth, scopes);
            if (depthCheck != null) return depthCheck;

            ValidationResult justificationCheck = checkJustification(line, tree, scopes, proven);
            if (justificationCheck != null) return justificationCheck;

            // l'assunzione appartiene all'ambito che apre, la chiusura a quello esterno
            Justification.Kind kind = line.getJustification().getKind();
            if (kind == Justification.Kind.ASSUMPTION) {
                scopes.push(new Scope(number));
            } else if (line.getJustification().isClosing()) {
                scopes.pop();
            }
            scopes.peek().lines.add(number);
            proven.put(number, tree);
            previousDepth = line.getDepth();

            LOGGER.finest(() -> "Riga accettata: " + line);
        }

        LOGGER.fine(() -> "Dimostrazione valida di " + lines.size() + " righe");
        return ValidationResult.success();
    }

    /**
     * Verifica che la dimostrazione risolva il problema: valida, con premesse
     * tratte dal problema e ultima riga al livello principale uguale all'obiettivo.
     */
    public ValidationResult checkSolution(Problem problem, Proof proof) {
        ValidationResult result = validate(proof);
        if (!result.isValid()) return result;

        if (proof.isEmpty()) {
            return ValidationResult.failure(null, "La dimostrazione è vuota");
        }

        Set<Formula> allowedPremises = new HashSet<>();
        for (Formula premise : problem.getPremises()) {
            allowedPremises.add(WffParser.normalize(premise));
        }
        for (ProofLine line : proof.getLines()) {
            if (line.getJustification().getKind() == Justification.Kind.PREMISE
                    && !allowedPremises.contains(WffParser.normalize(line.getFormula()))) {
                return fail(line.getLineNumber(), "La premessa '" + line.getFormula() + "' non appartiene al problema");
            }
        }

        ProofLine last = proof.lastLine();
        if (last.getDepth() != 0) {
            return fail(last.getLineNumber(), "La dimostrazione termina dentro una sotto-dimostrazione aperta");
        }
        if (!WffParser.normalize(last.getFormula()).equals(WffParser.normalize(problem.getConclusion()))) {
            return fail(last.getLineNumber(), "L'ultima riga non coincide con l'obiettivo " + problem.getConclusion());
        }

        LOGGER.info("Soluzione corretta per il problema " + problem.getId());
        return ValidationResult.success();
    }

    //endregion

    //region CONTROLLI

    private ValidationResult checkDepth(ProofLine line, int previousDepth, Deque<Scope> scopes) {
        int depth = line.getDepth();
        int number = line.getLineNumber();
        Justification justification = line.getJustification();

        if (justification.getKind() == Justification.Kind.ASSUMPTION) {
            if (depth != previousDepth + 1) {
                return fail(number, "Un'assunzione deve aprire una nuova sotto-dimostrazione (profondità attesa "
                        + (previousDepth + 1) + ")");
            }
            return null;
        }

        if (justification.isClosing()) {
            if (scopes.size() < 2 || depth != previousDepth - 1) {
                return fail(number, "La chiusura di una sotto-dimostrazione deve ridurre la profondità di uno");
            }
            return null;
        }

        if (depth > previousDepth) {
            return fail(number, "La profondità può aumentare solo con un'assunzione");
        }
        if (depth < previousDepth) {
            return fail(number, "La profondità può diminuire solo chiudendo una sotto-dimostrazione (II o RAA)");
        }
        return null;
    }

    private ValidationResult checkJustification(ProofLine line, FormulaNode tree,
                                                Deque<Scope> scopes, Map<Integer, FormulaNode> proven) {
        int number = line.getLineNumber();
        Justification justification = line.getJustification();

        switch (justification.getKind()) {
            case PREMISE -> {
                if (line.getDepth() != 0) {
                    return fail(number, "Le premesse sono ammesse solo al livello principale");
                }
            }
            case ASSUMPTION -> {
                // profondità già verificata
            }
            case INFERENCE -> {
                return checkInference(line, scopes, proven);
            }
            case REPLACEMENT -> {
                int reference = justification.getLineReferences().get(0);
                if (!inScope(reference, scopes)) {
                    return fail(number, "La riga " + reference + " non è nello scope corrente");
                }
                Formula source = FormulaBuilder.toFormula(proven.get(reference));
                if (!ReplacementRuleEngine.isValidReplacement(justification.getReplacementRule(), source, line.getFormula())) {
                    return fail(number, "La regola " + justification.getReplacementRule().getAbbreviation()
                            + " non trasforma la riga " + reference + " in questa formula");
                }
            }
            case IMPLICATION_INTRODUCTION, REDUCTIO_AD_ABSURDUM -> {
                return checkClosing(line, tree, scopes.peek(), proven);
            }
            case REITERATION -> {
                int reference = justification.getLineReferences().get(0);
                if (!inScope(reference, scopes)) {
                    return fail(number, "La riga " + reference + " non è nello scope corrente");
                }
                if (!proven.get(reference).equals(tree)) {
                    return fail(number, "La reiterazione deve riportare esattamente la riga " + reference);
                }
            }
        }
        return null;
    }

    private ValidationResult checkInference(ProofLine line, Deque<Scope> scopes, Map<Integer, FormulaNode> proven) {
        int number = line.getLineNumber();
        Justification justification = line.getJustification();
        InferenceRule rule = justification.getInferenceRule();
        List<Integer> references = justification.getLineReferences();

        if (references.size() != rule.getPremiseCount()) {
            return fail(number, rule.getDisplayName() + " richiede " + rule.getPremiseCount()
                    + " righe, citate " + references.size());
        }

        List<Formula> premises = new ArrayList<>();
        for (int reference : references) {
            if (!inScope(reference, scopes)) {
                return fail(number, "La riga " + reference + " non è nello scope corrente");
            }
            premises.add(FormulaBuilder.toFormula(proven.get(reference)));
        }

        if (!InferenceRuleEngine.isValidInference(rule, premises, line.getFormula())) {
            return fail(number, rule.getDisplayName() + " non permette di derivare '" + line.getFormula()
                    + "' dalle righe " + references);
        }
        return null;
    }

    private ValidationResult checkClosing(ProofLine line, FormulaNode tree, Scope innermost,
                                          Map<Integer, FormulaNode> proven) {
        int number = line.getLineNumber();
        Justification justification = line.getJustification();
        int start = justification.getSubproofStart();
        int end = justification.getSubproofEnd();

        if (start != innermost.assumptionLine) {
            return fail(number, "La sotto-dimostrazione da chiudere inizia alla riga " + innermost.assumptionLine
                    + ", non alla riga " + start);
        }
        if (end != number - 1) {
            return fail(number, "La sotto-dimostrazione deve terminare alla riga precedente (" + (number - 1) + ")");
        }

        FormulaNode assumption = proven.get(start);
        FormulaNode last = proven.get(end);

        if (justification.getKind() == Justification.Kind.IMPLICATION_INTRODUCTION) {
            if (!tree.equals(FormulaBuilder.implies(assumption, last))) {
                return fail(number, "Introduzione dell'implicazione: attesa "
                        + FormulaBuilder.toFormula(FormulaBuilder.implies(assumption, last)));
            }
            return null;
        }

        if (justification.getContradictionLine() != end) {
            return fail(number, "La contraddizione deve essere l'ultima riga della sotto-dimostrazione (" + end + ")");
        }
        if (!isContradiction(last)) {
            return fail(number, "La riga " + end + " non è una contraddizione della forma X∧¬X");
        }
        if (!tree.equals(FormulaBuilder.not(assumption))) {
            return fail(number, "Riduzione all'assurdo: attesa la negazione dell'assunzione "
                    + FormulaBuilder.toFormula(FormulaBuilder.not(assumption)));
        }
        return null;
    }

    //endregion

    //region SUPPORTO

    private static boolean isContradiction(FormulaNode node) {
        if (!node.isConjunction()) return false;
        FormulaNode left = node.getLeft();
        FormulaNode right = node.getRight();
        return right.equals(FormulaBuilder.not(left)) || left.equals(FormulaBuilder.not(right));
    }

    private static boolean inScope(int reference, Deque<Scope> scopes) {
        for (Scope scope : scopes) {
            if (scope.lines.contains(reference)) return true;
        }
        return false;
    }

    private static ValidationResult fail(int line, String message) {
        LOGGER.fine(() -> "Riga " + line + " rifiutata: " + message);
        return ValidationResult.failure(line, message);
    }

    /** Ambito aperto: riga dell'assunzione (0 per il livello principale) e righe contenute */
    private static final class Scope {
        private final int assumptionLine;
        private final Set<Integer> lines = new HashSet<>();

        Scope(int assumptionLine) {
            this.assumptionLine = assumptionLine;
        }
    }

    //endregion
}
