package org.wff.proof;

import org.junit.jupiter.api.Test;
import org.wff.LogicTestBase;
import org.wff.rules.Application;
import org.wff.rules.InferenceRule;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DerivationReplayerTest extends LogicTestBase {

    @Test
    void replaysPremisesThenInferencesInPostOrder() {
        // r da (p→q), p, (q→r): MP su MP
        Application inner = new Application(n("q"), InferenceRule.MODUS_PONENS, List.of(n("p -> q"), n("p")),
                List.of(Application.assumption(n("p -> q")), Application.assumption(n("p"))));
        Application root = new Application(n("r"), InferenceRule.MODUS_PONENS, List.of(n("q -> r"), n("q")),
                List.of(Application.assumption(n("q -> r")), inner));

        Problem problem = new Problem("d1", "Catena", root.leafPremises(), n("r"), 2, root);
        Proof proof = DerivationReplayer.replay(problem);

        assertEquals(5, proof.size());
        assertEquals(Justification.Kind.PREMISE, proof.getLines().get(2).getJustification().getKind());
        assertEquals(n("q"), proof.getLines().get(3).getFormula());
        assertEquals(n("r"), proof.lastLine().getFormula());
        assertEquals(InferenceRule.MODUS_PONENS, proof.lastLine().getJustification().getInferenceRule());

        assertTrue(new ProofValidator().checkSolution(problem, proof).isValid());
    }

    @Test
    void repeatedFormulasReuseTheirLine() {
        Application simp = new Application(n("p"), InferenceRule.SIMPLIFICATION, List.of(n("p & q")),
                List.of(Application.assumption(n("p & q"))));
        Application root = new Application(n("p & p"), InferenceRule.CONJUNCTION, List.of(n("p"), n("p")),
                List.of(simp, simp));

        Problem problem = new Problem("d2", "Riuso", root.leafPremises(), n("p & p"), 2, root);
        Proof proof = DerivationReplayer.replay(problem);

        assertEquals(3, proof.size());
        assertEquals(List.of(2, 2), proof.lastLine().getJustification().getLineReferences());
        assertTrue(new ProofValidator().validate(proof).isValid());
    }

    @Test
    void goalDerivedEarlierIsReiteratedAtTheEnd() {
        // u∧t da Conj(u, t) con u da Simp(r∧u), poi di nuovo u per Simp
        Application inner = new Application(n("u"), InferenceRule.SIMPLIFICATION, List.of(n("r & u")),
                List.of(Application.assumption(n("r & u"))));
        Application pair = new Application(n("u & t"), InferenceRule.CONJUNCTION, List.of(n("u"), n("t")),
                List.of(inner, Application.assumption(n("t"))));
        Application root = new Application(n("u"), InferenceRule.SIMPLIFICATION, List.of(n("u & t")),
                List.of(pair));

        Problem problem = new Problem("d5", "Ridondante", root.leafPremises(), n("u"), 3, root);
        Proof proof = DerivationReplayer.replay(problem);

        assertEquals(5, proof.size());
        assertEquals(Justification.reiteration(3), proof.lastLine().getJustification());
        assertEquals(n("u"), proof.lastLine().getFormula());
        assertTrue(new ProofValidator().checkSolution(problem, proof).isValid());
    }

    @Test
    void problemsWithoutDerivationCannotBeReplayed() {
        Problem problem = new Problem("d3", "Manuale", fs("p"), f("p"), 1);
        assertThrows(IllegalArgumentException.class, () -> DerivationReplayer.replay(problem));
    }

    @Test
    void leavesMustBePremises() {
        Application root = new Application(n("p | q"), InferenceRule.ADDITION, List.of(n("p")),
                List.of(Application.assumption(n("p"))));
        Problem problem = new Problem("d4", "Incompleto", fs("r"), n("p | q"), 1, root);

        assertThrows(IllegalStateException.class, () -> DerivationReplayer.replay(problem));
    }
}
