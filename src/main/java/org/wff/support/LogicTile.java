package org.wff.support;

import java.util.Objects;

/**
 * TESSERA LOGICA - Singolo simbolo di una formula con la sua categoria
 *
 * Valore immutabile: due tessere sono uguali se hanno lo stesso simbolo e lo
 * stesso tipo. Le variabili sono sempre una singola lettera ASCII (a-z, A-Z).
 */
public final class LogicTile {

    /** Rappresentazione testuale della tessera ("p", "¬", "∧", "(", ...) */
    private final String symbol;

    /** Categoria logica usata da parser e validatori */
    private final SymbolType type;

    /**
     * Costruisce una tessera validandone la coerenza simbolo-tipo.
     *
     * @param symbol simbolo grafico (non null, non vuoto)
     * @param type categoria logica (non null)
     * @throws IllegalArgumentException se simbolo o tipo non validi
     */
    public LogicTile(String symbol, SymbolType type) {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("Simbolo della tessera non può essere null o vuoto");
        }
        if (type == null) {
            throw new IllegalArgumentException("Tipo della tessera non può essere null");
        }
        if (type == SymbolType.VARIABLE && !isVariableSymbol(symbol)) {
            throw new IllegalArgumentException("Variabile non valida (attesa una lettera): " + symbol);
        }

        this.symbol = symbol;
        this.type = type;
    }

    private static boolean isVariableSymbol(String symbol) {
        if (symbol.length() != 1) return false;
        char c = symbol.charAt(0);
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public String getSymbol() {
        return symbol;
    }

    public SymbolType getType() {
        return type;
    }

    public boolean isVariable() {
        return type == SymbolType.VARIABLE;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        LogicTile other = (LogicTile) obj;
        return symbol.equals(other.symbol) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, type);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
