package org.wff;

import org.wff.proof.Problem;
import org.wff.support.Formula;
import org.wff.support.LogicTile;
import org.wff.support.Tiles;

import java.util.List;
import java.util.Map;

/**
 * Scrive i problemi nel formato testuale dei problemi personalizzati:
 * direttive "Problem Group:", "Problem:", "Premises:", "Goal:" seguite da
 * formule con alias ASCII (~ & | -> <->), una per riga.
 */
public final class ProblemTextFormatter {

    private static final Map<LogicTile, String> ASCII_ALIASES = Map.of(
            Tiles.NOT, "~",
            Tiles.AND, " & ",
            Tiles.OR, " | ",
            Tiles.IMPLIES, " -> ",
            Tiles.IFF, " <-> "
    );

    private ProblemTextFormatter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static String format(String group, List<Problem> problems) {
        StringBuilder output = new StringBuilder();
        output.append("Problem Group: ").append(group).append('\n');
        for (Problem problem : problems) {
            output.append('\n');
            output.append("Problem: ").append(problem.getId()).append('\n');
            output.append("Premises:\n");
            for (Formula premise : problem.getPremises()) {
                output.append(toAscii(premise)).append('\n');
            }
            output.append("Goal:\n");
            output.append(toAscii(problem.getConclusion())).append('\n');
        }
        return output.toString();
    }

    /**
     * @return formula con gli operatori sostituiti dai loro alias ASCII
     */
    public static String toAscii(Formula formula) {
        StringBuilder text = new StringBuilder();
        for (LogicTile tile : formula.getTiles()) {
            text.append(ASCII_ALIASES.getOrDefault(tile, tile.getSymbol()));
        }
        return text.toString();
    }
}
