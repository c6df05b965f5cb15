package org.wff.rules;

/**
 * Regole di rimpiazzamento: equivalenze logiche applicabili in entrambe le
 * direzioni a una qualunque sotto-formula di una singola riga.
 */
public enum ReplacementRule {
    DE_MORGAN("De Morgan's Theorem", "DM"),
    COMMUTATION("Commutation", "Comm"),
    ASSOCIATION("Association", "Assoc"),
    DISTRIBUTION("Distribution", "Dist"),
    DOUBLE_NEGATION("Double Negation", "DN"),
    TRANSPOSITION("Transposition", "Trans"),
    MATERIAL_IMPLICATION("Material Implication", "MI"),
    MATERIAL_EQUIVALENCE("Material Equivalence", "ME"),
    EXPORTATION("Exportation", "Exp"),
    TAUTOLOGY("Tautology", "Taut");

    private final String displayName;
    private final String abbreviation;

    ReplacementRule(String displayName, String abbreviation) {
        this.displayName = displayName;
        this.abbreviation = abbreviation;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public static ReplacementRule fromAbbreviation(String abbreviation) {
        for (ReplacementRule rule : values()) {
            if (rule.abbreviation.equalsIgnoreCase(abbreviation)) return rule;
        }
        return null;
    }
}
