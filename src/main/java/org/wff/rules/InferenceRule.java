package org.wff.rules;

/**
 * Regole di inferenza del sistema deduttivo (insieme chiuso) più il marcatore
 * sintetico ASSUMPTION, usato solo dal generatore per le foglie del piano.
 */
public enum InferenceRule {
    MODUS_PONENS("Modus Ponens", "MP", 2),
    MODUS_TOLLENS("Modus Tollens", "MT", 2),
    HYPOTHETICAL_SYLLOGISM("Hypothetical Syllogism", "HS", 2),
    DISJUNCTIVE_SYLLOGISM("Disjunctive Syllogism", "DS", 2),
    CONSTRUCTIVE_DILEMMA("Constructive Dilemma", "CD", 2),
    ABSORPTION("Absorption", "Abs", 1),
    SIMPLIFICATION("Simplification", "Simp", 1),
    CONJUNCTION("Conjunction", "Conj", 2),
    ADDITION("Addition", "Add", 1),
    ASSUMPTION("Assumption", "Assume", 0);

    private final String displayName;
    private final String abbreviation;
    private final int premiseCount;

    InferenceRule(String displayName, String abbreviation, int premiseCount) {
        this.displayName = displayName;
        this.abbreviation = abbreviation;
        this.premiseCount = premiseCount;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    /** Numero di righe referenziate richieste da una giustificazione con questa regola */
    public int getPremiseCount() {
        return premiseCount;
    }

    /** @return false solo per il marcatore ASSUMPTION */
    public boolean isInference() {
        return this != ASSUMPTION;
    }

    /**
     * @return regola con l'abbreviazione indicata (senza distinzione di maiuscole), null se assente
     */
    public static InferenceRule fromAbbreviation(String abbreviation) {
        for (InferenceRule rule : values()) {
            if (rule.abbreviation.equalsIgnoreCase(abbreviation)) return rule;
        }
        return null;
    }
}
