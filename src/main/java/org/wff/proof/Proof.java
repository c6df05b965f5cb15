package org.wff.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sequenza ordinata di righe. Nessun controllo semantico in costruzione:
 * la correttezza è responsabilità di {@link ProofValidator}.
 */
public final class Proof {

    private final List<ProofLine> lines;

    public Proof(List<ProofLine> lines) {
        if (lines == null || lines.contains(null)) {
            throw new IllegalArgumentException("Le righe della dimostrazione non possono essere null");
        }
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public List<ProofLine> getLines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /** @return ultima riga, null se vuota */
    public ProofLine lastLine() {
        return lines.isEmpty() ? null : lines.get(lines.size() - 1);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return lines.equals(((Proof) obj).lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        for (ProofLine line : lines) {
            text.append(line).append('\n');
        }
        return text.toString();
    }
}
