package org.wff.parser;

import org.wff.support.Formula;
import org.wff.support.LogicTile;
import org.wff.support.SymbolType;
import org.wff.support.Tiles;

import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER WFF - Discesa ricorsiva a precedenza su sequenze di tessere
 *
 * GRAMMATICA (dalla precedenza più bassa alla più alta):
 * - implicazione := disgiunzione [ (→ | ↔) implicazione ]     associativa a destra
 * - disgiunzione := congiunzione { ∨ congiunzione }             associativa a sinistra
 * - congiunzione := unario { ∧ unario }                         associativa a sinistra
 * - unario       := ¬ unario | ( implicazione ) | variabile
 *
 * Il parsing fallisce restituendo null, mai con eccezione: input vuoto,
 * parentesi non bilanciate, simboli residui, operatori senza operandi.
 */
public final class WffParser {

    private static final Logger LOGGER = Logger.getLogger(WffParser.class.getName());

    private WffParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTI DI INGRESSO

    /**
     * @param formula sequenza di tessere (null ammesso)
     * @return albero sintattico oppure null se la formula non è ben formata
     */
    public static FormulaNode parse(Formula formula) {
        if (formula == null || formula.isEmpty()) {
            return null;
        }
        Cursor cursor = new Cursor(formula.getTiles());
        FormulaNode tree = cursor.parseImplication();

        if (tree == null || !cursor.atEnd()) {
            LOGGER.finest(() -> "Formula non ben formata: " + formula);
            return null;
        }
        return tree;
    }

    /**
     * Forma canonica: parsing seguito da rendering a parentesizzazione minima.
     * Una formula non ben formata viene restituita invariata.
     */
    public static Formula normalize(Formula formula) {
        FormulaNode tree = parse(formula);
        return tree == null ? formula : FormulaBuilder.toFormula(tree);
    }

    //endregion

    //region DISCESA RICORSIVA

    /** Stato di scansione: una istanza per invocazione di parse */
    private static final class Cursor {
        private final List<LogicTile> tiles;
        private int position;

        Cursor(List<LogicTile> tiles) {
            this.tiles = tiles;
        }

        boolean atEnd() {
            return position >= tiles.size();
        }

        private LogicTile peek() {
            return atEnd() ? null : tiles.get(position);
        }

        FormulaNode parseImplication() {
            FormulaNode left = parseDisjunction();
            if (left == null) return null;

            LogicTile next = peek();
            if (Tiles.IMPLIES.equals(next) || Tiles.IFF.equals(next)) {
                position++;
                FormulaNode right = parseImplication();
                return right == null ? null : FormulaNode.binary(next, left, right);
            }
            return left;
        }

        private FormulaNode parseDisjunction() {
            FormulaNode left = parseConjunction();
            while (left != null && Tiles.OR.equals(peek())) {
                position++;
                FormulaNode right = parseConjunction();
                left = right == null ? null : FormulaNode.binary(Tiles.OR, left, right);
            }
            return left;
        }

        private FormulaNode parseConjunction() {
            FormulaNode left = parseUnary();
            while (left != null && Tiles.AND.equals(peek())) {
                position++;
                FormulaNode right = parseUnary();
                left = right == null ? null : FormulaNode.binary(Tiles.AND, left, right);
            }
            return left;
        }

        private FormulaNode parseUnary() {
            LogicTile next = peek();
            if (next == null) return null;

            switch (next.getType()) {
                case UNARY_OPERATOR -> {
                    position++;
                    FormulaNode child = parseUnary();
                    return child == null ? null : FormulaNode.unary(next, child);
                }
                case LEFT_PAREN -> {
                    position++;
                    FormulaNode inner = parseImplication();
                    if (inner == null || peek() == null || peek().getType() != SymbolType.RIGHT_PAREN) {
                        return null;
                    }
                    position++;
                    return inner;
                }
                case VARIABLE -> {
                    position++;
                    return FormulaNode.variable(next);
                }
                default -> {
                    return null;
                }
            }
        }
    }

    //endregion
}
