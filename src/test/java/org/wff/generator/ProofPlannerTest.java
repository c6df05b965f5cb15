package org.wff.generator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.wff.rules.InferenceRule;
import org.wff.rules.InferenceRuleEngine;
import org.wff.rules.RuleStrategy;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ProofPlannerTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 5, 8, 10})
    void plansRespectBudgetAndShapes(int difficulty) {
        for (long seed = 0; seed < 50; seed++) {
            ProofPlan plan = new ProofPlanner(new Random(seed)).plan(difficulty);

            assertFalse(plan.goal().isLeaf(), "l'obiettivo deve avere una regola");

            int steps = 0;
            for (PlanNode node : plan.nodes()) {
                if (node.isLeaf()) {
                    assertTrue(node.getChildren().isEmpty());
                    continue;
                }
                steps++;
                RuleStrategy strategy = InferenceRuleEngine.strategyFor(node.getRule());
                assertTrue(node.getConstraint().acceptsConclusionShape(strategy.conclusionShape()), node.toString());
                assertEquals(node.getRule().getPremiseCount(), node.getChildren().size());

                for (int i = 0; i < node.getChildren().size(); i++) {
                    PlanNode child = plan.node(node.getChildren().get(i));
                    assertEquals(node.getId(), child.getParent());
                    assertEquals(strategy.premiseShapes().get(i), child.getConstraint());
                }
            }
            assertTrue(steps <= Math.max(1, difficulty), "passi oltre il budget: " + steps);
        }
    }

    @Test
    void difficultyOneUsesASinglePremiseRule() {
        for (long seed = 0; seed < 30; seed++) {
            ProofPlan plan = new ProofPlanner(new Random(seed)).plan(1);

            assertEquals(2, plan.size());
            assertEquals(1, plan.goal().getRule().getPremiseCount());
            assertEquals(InferenceRule.ASSUMPTION, plan.node(1).getRule());
        }
    }

    @Test
    void renderShowsEveryNode() {
        ProofPlan plan = new ProofPlanner(new Random(7)).plan(4);
        String rendered = plan.render();

        assertEquals(plan.size(), rendered.lines().count());
        assertTrue(rendered.startsWith("└── #0"));
        assertFalse(plan.leaves().isEmpty());
    }
}
