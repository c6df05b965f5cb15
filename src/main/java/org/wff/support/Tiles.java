package org.wff.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CATALOGO TESSERE - Insieme chiuso dei simboli disponibili
 *
 * Contiene gli operatori canonici, le parentesi e l'alfabeto delle variabili.
 * Il generatore di problemi usa solo il sottoinsieme {@link #PROBLEM_VARIABLES}
 * (p..w), mentre il parser accetta qualunque lettera.
 */
public final class Tiles {

    //region OPERATORI E PARENTESI

    public static final LogicTile NOT = new LogicTile("¬", SymbolType.UNARY_OPERATOR);
    public static final LogicTile AND = new LogicTile("∧", SymbolType.BINARY_OPERATOR);
    public static final LogicTile OR = new LogicTile("∨", SymbolType.BINARY_OPERATOR);
    public static final LogicTile IMPLIES = new LogicTile("→", SymbolType.BINARY_OPERATOR);
    public static final LogicTile IFF = new LogicTile("↔", SymbolType.BINARY_OPERATOR);

    public static final LogicTile LEFT_PAREN = new LogicTile("(", SymbolType.LEFT_PAREN);
    public static final LogicTile RIGHT_PAREN = new LogicTile(")", SymbolType.RIGHT_PAREN);

    public static final List<LogicTile> OPERATORS = List.of(NOT, AND, OR, IMPLIES, IFF);

    //endregion

    //region VARIABILI

    /** Tutte le lettere a-z, A-Z come variabili proposizionali */
    public static final List<LogicTile> ALL_VARIABLES;

    /** Alfabeto ristretto usato dal generatore di problemi */
    public static final List<LogicTile> PROBLEM_VARIABLES;

    public static final List<LogicTile> ALL_TILES;

    private static final Map<String, LogicTile> BY_SYMBOL;

    static {
        List<LogicTile> variables = new ArrayList<>();
        for (char c = 'a'; c <= 'z'; c++) variables.add(new LogicTile(String.valueOf(c), SymbolType.VARIABLE));
        for (char c = 'A'; c <= 'Z'; c++) variables.add(new LogicTile(String.valueOf(c), SymbolType.VARIABLE));
        ALL_VARIABLES = Collections.unmodifiableList(variables);

        List<LogicTile> problemVariables = new ArrayList<>();
        for (char c = 'p'; c <= 'w'; c++) problemVariables.add(new LogicTile(String.valueOf(c), SymbolType.VARIABLE));
        PROBLEM_VARIABLES = Collections.unmodifiableList(problemVariables);

        List<LogicTile> all = new ArrayList<>(ALL_VARIABLES);
        all.addAll(OPERATORS);
        all.add(LEFT_PAREN);
        all.add(RIGHT_PAREN);
        ALL_TILES = Collections.unmodifiableList(all);

        Map<String, LogicTile> bySymbol = new HashMap<>();
        for (LogicTile tile : ALL_TILES) {
            bySymbol.put(tile.getSymbol(), tile);
        }
        BY_SYMBOL = Collections.unmodifiableMap(bySymbol);
    }

    //endregion

    private Tiles() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param letter lettera ASCII
     * @return tessera variabile corrispondente
     * @throws IllegalArgumentException se il carattere non è una lettera
     */
    public static LogicTile variable(char letter) {
        return new LogicTile(String.valueOf(letter), SymbolType.VARIABLE);
    }

    /**
     * Cerca la tessera canonica per un simbolo.
     *
     * @return tessera trovata oppure null se il simbolo non appartiene al catalogo
     */
    public static LogicTile fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }
}
