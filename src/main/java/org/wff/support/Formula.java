package org.wff.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FORMULA - Sequenza ordinata di tessere così come composta dall'utente
 *
 * L'uguaglianza è superficiale: due formule sono uguali solo se le sequenze di
 * tessere coincidono, parentesi comprese. Per confronti logici (stessa struttura)
 * occorre normalizzare con {@code WffParser.normalize} oppure confrontare gli
 * alberi sintattici.
 */
public final class Formula {

    private final List<LogicTile> tiles;

    /**
     * @param tiles tessere della formula (copiate, non null, senza elementi null)
     * @throws IllegalArgumentException se la lista è null o contiene null
     */
    public Formula(List<LogicTile> tiles) {
        if (tiles == null) {
            throw new IllegalArgumentException("Lista tessere non può essere null");
        }
        if (tiles.contains(null)) {
            throw new IllegalArgumentException("Lista tessere non può contenere elementi null");
        }
        this.tiles = Collections.unmodifiableList(new ArrayList<>(tiles));
    }

    /**
     * Costruisce una formula dal testo in simboli canonici (es. "(p→q)∧¬r").
     * Gli spazi vengono ignorati.
     *
     * @param text testo con soli simboli del catalogo {@link Tiles}
     * @return formula corrispondente (eventualmente non ben formata)
     * @throws IllegalArgumentException se il testo contiene simboli sconosciuti
     */
    public static Formula of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }
        List<LogicTile> result = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) continue;

            LogicTile tile = Tiles.fromSymbol(String.valueOf(c));
            if (tile == null) {
                throw new IllegalArgumentException("Simbolo sconosciuto '" + c + "' in: " + text);
            }
            result.add(tile);
        }
        return new Formula(result);
    }

    public static Formula of(LogicTile... tiles) {
        return new Formula(List.of(tiles));
    }

    public List<LogicTile> getTiles() {
        return tiles;
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return tiles.equals(((Formula) obj).tiles);
    }

    @Override
    public int hashCode() {
        return tiles.hashCode();
    }

    /**
     * @return concatenazione dei simboli, senza separatori
     */
    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        for (LogicTile tile : tiles) {
            text.append(tile.getSymbol());
        }
        return text.toString();
    }
}
