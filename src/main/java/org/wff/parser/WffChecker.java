package org.wff.parser;

import org.wff.support.Formula;
import org.wff.support.LogicTile;
import org.wff.support.SymbolType;
import org.wff.support.Tiles;

import java.util.List;

/**
 * Riconoscitore della grammatica WFF che non costruisce alberi.
 * Accetta esattamente le formule che {@link WffParser#parse} accetta; serve
 * come filtro economico prima di parsing e validazione.
 */
public final class WffChecker {

    private WffChecker() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static boolean isWff(Formula formula) {
        if (formula == null || formula.isEmpty()) return false;

        List<LogicTile> tiles = formula.getTiles();
        int end = acceptImplication(tiles, 0);
        return end == tiles.size();
    }

    // Ogni metodo restituisce la posizione dopo il costrutto riconosciuto, -1 se assente

    private static int acceptImplication(List<LogicTile> tiles, int position) {
        int next = acceptDisjunction(tiles, position);
        if (next < 0) return -1;
        if (next < tiles.size() && isArrow(tiles.get(next))) {
            return acceptImplication(tiles, next + 1);
        }
        return next;
    }

    private static int acceptDisjunction(List<LogicTile> tiles, int position) {
        int next = acceptConjunction(tiles, position);
        while (next >= 0 && next < tiles.size() && Tiles.OR.equals(tiles.get(next))) {
            next = acceptConjunction(tiles, next + 1);
        }
        return next;
    }

    private static int acceptConjunction(List<LogicTile> tiles, int position) {
        int next = acceptUnary(tiles, position);
        while (next >= 0 && next < tiles.size() && Tiles.AND.equals(tiles.get(next))) {
            next = acceptUnary(tiles, next + 1);
        }
        return next;
    }

    private static int acceptUnary(List<LogicTile> tiles, int position) {
        // le negazioni consecutive non richiedono ricorsione
        while (position < tiles.size() && tiles.get(position).getType() == SymbolType.UNARY_OPERATOR) {
            position++;
        }
        if (position >= tiles.size()) return -1;

        SymbolType type = tiles.get(position).getType();
        if (type == SymbolType.VARIABLE) {
            return position + 1;
        }
        if (type == SymbolType.LEFT_PAREN) {
            int inner = acceptImplication(tiles, position + 1);
            if (inner < 0 || inner >= tiles.size() || tiles.get(inner).getType() != SymbolType.RIGHT_PAREN) {
                return -1;
            }
            return inner + 1;
        }
        return -1;
    }

    private static boolean isArrow(LogicTile tile) {
        return Tiles.IMPLIES.equals(tile) || Tiles.IFF.equals(tile);
    }
}
