package org.wff.support;

/**
 * Categorie logiche dei simboli (tessere) che compongono una formula.
 * Il parser e il validatore ragionano esclusivamente su queste categorie,
 * mai sul simbolo grafico.
 */
public enum SymbolType {
    VARIABLE,           // Proposizioni atomiche: p, q, r, ...
    UNARY_OPERATOR,     // Negazione: ¬
    BINARY_OPERATOR,    // Connettivi binari: ∧, ∨, →, ↔
    LEFT_PAREN,         // Parentesi aperta '('
    RIGHT_PAREN         // Parentesi chiusa ')'
}
