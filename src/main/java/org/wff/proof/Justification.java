package org.wff.proof;

import org.wff.rules.InferenceRule;
import org.wff.rules.ReplacementRule;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * GIUSTIFICAZIONE - Motivo per cui una riga di dimostrazione è ammessa
 *
 * Unione etichettata distinta da {@link Kind}; i campi non pertinenti al tipo
 * restano null. Le righe referenziate devono essere nello scope della riga
 * giustificata (verificato da {@link ProofValidator}).
 */
public final class Justification {

    public enum Kind {
        PREMISE,
        ASSUMPTION,
        INFERENCE,
        REPLACEMENT,
        IMPLICATION_INTRODUCTION,
        REDUCTIO_AD_ABSURDUM,
        REITERATION
    }

    private final Kind kind;
    private final InferenceRule inferenceRule;
    private final ReplacementRule replacementRule;
    private final List<Integer> lineReferences;
    private final Integer subproofStart;
    private final Integer subproofEnd;
    private final Integer contradictionLine;

    private Justification(Kind kind, InferenceRule inferenceRule, ReplacementRule replacementRule,
                          List<Integer> lineReferences, Integer subproofStart, Integer subproofEnd,
                          Integer contradictionLine) {
        this.kind = kind;
        this.inferenceRule = inferenceRule;
        this.replacementRule = replacementRule;
        this.lineReferences = List.copyOf(lineReferences);
        this.subproofStart = subproofStart;
        this.subproofEnd = subproofEnd;
        this.contradictionLine = contradictionLine;
    }

    //region FABBRICHE

    public static Justification premise() {
        return new Justification(Kind.PREMISE, null, null, List.of(), null, null, null);
    }

    public static Justification assumption() {
        return new Justification(Kind.ASSUMPTION, null, null, List.of(), null, null, null);
    }

    public static Justification inference(InferenceRule rule, List<Integer> lines) {
        if (rule == null || !rule.isInference()) {
            throw new IllegalArgumentException("Regola di inferenza non valida: " + rule);
        }
        if (lines == null || lines.contains(null)) {
            throw new IllegalArgumentException("Righe referenziate mancanti per " + rule.getAbbreviation());
        }
        return new Justification(Kind.INFERENCE, rule, null, lines, null, null, null);
    }

    public static Justification inference(InferenceRule rule, Integer... lines) {
        return inference(rule, List.of(lines));
    }

    public static Justification replacement(ReplacementRule rule, int line) {
        if (rule == null) {
            throw new IllegalArgumentException("Regola di rimpiazzamento non può essere null");
        }
        return new Justification(Kind.REPLACEMENT, null, rule, List.of(line), null, null, null);
    }

    public static Justification implicationIntroduction(int start, int end) {
        return new Justification(Kind.IMPLICATION_INTRODUCTION, null, null, List.of(), start, end, null);
    }

    public static Justification reductioAdAbsurdum(int start, int end, int contradictionLine) {
        return new Justification(Kind.REDUCTIO_AD_ABSURDUM, null, null, List.of(), start, end, contradictionLine);
    }

    public static Justification reiteration(int line) {
        return new Justification(Kind.REITERATION, null, null, List.of(line), null, null, null);
    }

    //endregion

    public Kind getKind() {
        return kind;
    }

    public InferenceRule getInferenceRule() {
        return inferenceRule;
    }

    public ReplacementRule getReplacementRule() {
        return replacementRule;
    }

    /** Righe citate da Inference, Replacement e Reiteration */
    public List<Integer> getLineReferences() {
        return lineReferences;
    }

    public Integer getSubproofStart() {
        return subproofStart;
    }

    public Integer getSubproofEnd() {
        return subproofEnd;
    }

    public Integer getContradictionLine() {
        return contradictionLine;
    }

    /** La giustificazione chiude una sotto-dimostrazione? */
    public boolean isClosing() {
        return kind == Kind.IMPLICATION_INTRODUCTION || kind == Kind.REDUCTIO_AD_ABSURDUM;
    }

    /**
     * Testo da mostrare accanto alla riga, es. "1,2: MP", "3-5 II", "R 2".
     */
    public String displayText() {
        return switch (kind) {
            case PREMISE -> "Premise";
            case ASSUMPTION -> "Assumption";
            case INFERENCE -> joinLines() + ": " + inferenceRule.getAbbreviation();
            case REPLACEMENT -> joinLines() + ": " + replacementRule.getAbbreviation();
            case IMPLICATION_INTRODUCTION -> subproofStart + "-" + subproofEnd + " II";
            case REDUCTIO_AD_ABSURDUM -> subproofStart + "-" + subproofEnd + " RAA (" + contradictionLine + ")";
            case REITERATION -> "R " + lineReferences.get(0);
        };
    }

    private String joinLines() {
        return lineReferences.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Justification other = (Justification) obj;
        return kind == other.kind
                && inferenceRule == other.inferenceRule
                && replacementRule == other.replacementRule
                && lineReferences.equals(other.lineReferences)
                && Objects.equals(subproofStart, other.subproofStart)
                && Objects.equals(subproofEnd, other.subproofEnd)
                && Objects.equals(contradictionLine, other.contradictionLine);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, inferenceRule, replacementRule, lineReferences,
                subproofStart, subproofEnd, contradictionLine);
    }

    @Override
    public String toString() {
        return displayText();
    }
}
