package org.wff.parser;

import org.wff.support.LogicTile;
import org.wff.support.SymbolType;
import org.wff.support.Tiles;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * NODO DELL'ALBERO SINTATTICO - Rappresentazione strutturale di una formula
 *
 * Unione etichettata con tre varianti, distinte da {@link Type}:
 * - VARIABLE: foglia con la tessera della variabile
 * - UNARY: operatore unario (negazione) con un figlio
 * - BINARY: connettivo binario con figlio sinistro e destro
 *
 * L'uguaglianza è strutturale e ricorsiva: è la base di ogni confronto
 * "stessa formula" nel motore delle regole, nel validatore e nel generatore.
 * I nodi sono immutabili e possono essere condivisi tra alberi diversi.
 */
public final class FormulaNode {

    //region TIPI E STRUTTURA DATI

    public enum Type {
        VARIABLE,
        UNARY,
        BINARY
    }

    private final Type type;

    /** Tessera della variabile (VARIABLE) oppure dell'operatore (UNARY, BINARY) */
    private final LogicTile tile;

    /** Figlio unico (UNARY) oppure figlio sinistro (BINARY) */
    private final FormulaNode left;

    /** Figlio destro (solo BINARY) */
    private final FormulaNode right;

    /** Hash precalcolato: gli alberi vengono usati intensivamente in set e mappe */
    private final int hash;

    private FormulaNode(Type type, LogicTile tile, FormulaNode left, FormulaNode right) {
        this.type = type;
        this.tile = tile;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, tile, left, right);
    }

    //endregion

    //region COSTRUTTORI STATICI

    public static FormulaNode variable(LogicTile tile) {
        if (tile == null || tile.getType() != SymbolType.VARIABLE) {
            throw new IllegalArgumentException("Nodo variabile richiede una tessera VARIABLE: " + tile);
        }
        return new FormulaNode(Type.VARIABLE, tile, null, null);
    }

    public static FormulaNode unary(LogicTile operator, FormulaNode child) {
        if (operator == null || operator.getType() != SymbolType.UNARY_OPERATOR) {
            throw new IllegalArgumentException("Nodo unario richiede un operatore unario: " + operator);
        }
        if (child == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new FormulaNode(Type.UNARY, operator, child, null);
    }

    public static FormulaNode binary(LogicTile operator, FormulaNode left, FormulaNode right) {
        if (operator == null || operator.getType() != SymbolType.BINARY_OPERATOR) {
            throw new IllegalArgumentException("Nodo binario richiede un operatore binario: " + operator);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi del connettivo " + operator + " non possono essere null");
        }
        return new FormulaNode(Type.BINARY, operator, left, right);
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /** @return tessera della variabile (solo VARIABLE) */
    public LogicTile getTile() {
        return type == Type.VARIABLE ? tile : null;
    }

    /** @return operatore (UNARY o BINARY), null per le variabili */
    public LogicTile getOperator() {
        return type == Type.VARIABLE ? null : tile;
    }

    /** @return operando della negazione (solo UNARY) */
    public FormulaNode getChild() {
        return type == Type.UNARY ? left : null;
    }

    public FormulaNode getLeft() {
        return type == Type.BINARY ? left : null;
    }

    public FormulaNode getRight() {
        return type == Type.BINARY ? right : null;
    }

    //endregion

    //region PREDICATI STRUTTURALI

    public boolean isVariable() {
        return type == Type.VARIABLE;
    }

    public boolean isNegation() {
        return type == Type.UNARY && Tiles.NOT.equals(tile);
    }

    public boolean isImplication() {
        return isBinary(Tiles.IMPLIES);
    }

    public boolean isConjunction() {
        return isBinary(Tiles.AND);
    }

    public boolean isDisjunction() {
        return isBinary(Tiles.OR);
    }

    public boolean isBiconditional() {
        return isBinary(Tiles.IFF);
    }

    /**
     * Letterale: variabile oppure negazione diretta di una variabile.
     */
    public boolean isLiteral() {
        return isVariable() || (isNegation() && left.isVariable());
    }

    private boolean isBinary(LogicTile operator) {
        return type == Type.BINARY && operator.equals(tile);
    }

    /**
     * @return variabili che compaiono nell'albero, in ordine di prima occorrenza
     */
    public Set<LogicTile> variables() {
        Set<LogicTile> result = new LinkedHashSet<>();
        collectVariables(this, result);
        return result;
    }

    private static void collectVariables(FormulaNode node, Set<LogicTile> result) {
        switch (node.type) {
            case VARIABLE -> result.add(node.tile);
            case UNARY -> collectVariables(node.left, result);
            case BINARY -> {
                collectVariables(node.left, result);
                collectVariables(node.right, result);
            }
        }
    }

    /**
     * @return numero di nodi dell'albero
     */
    public int size() {
        return switch (type) {
            case VARIABLE -> 1;
            case UNARY -> 1 + left.size();
            case BINARY -> 1 + left.size() + right.size();
        };
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        FormulaNode other = (FormulaNode) obj;
        return hash == other.hash
                && type == other.type
                && tile.equals(other.tile)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Forma canonica con parentesizzazione minima.
     */
    @Override
    public String toString() {
        return FormulaBuilder.toFormula(this).toString();
    }
}
