package org.wff.generator;

import org.wff.rules.FormulaShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PIANO DI DIMOSTRAZIONE - Scheletro astratto prodotto dalla fase 1
 *
 * Arena di nodi con riferimenti per indice: l'obiettivo ha indice 0, ogni
 * nodo conosce padre e figli tramite il loro indice. Gli archi vanno sempre
 * da un nodo a nodi creati dopo di lui, quindi il grafo è aciclico per
 * costruzione.
 */
public final class ProofPlan {

    public static final int GOAL = 0;

    private final List<PlanNode> nodes = new ArrayList<>();

    ProofPlan() {
        addNode(FormulaShape.ANY, -1);
    }

    int addNode(FormulaShape constraint, int parent) {
        int id = nodes.size();
        nodes.add(new PlanNode(id, parent, constraint));
        return id;
    }

    public PlanNode node(int id) {
        return nodes.get(id);
    }

    public PlanNode goal() {
        return nodes.get(GOAL);
    }

    public List<PlanNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    /** Nodi ASSUMPTION: diventeranno le premesse del problema */
    public List<PlanNode> leaves() {
        List<PlanNode> result = new ArrayList<>();
        for (PlanNode node : nodes) {
            if (node.isLeaf()) result.add(node);
        }
        return result;
    }

    /**
     * @return albero ASCII del piano, per i log
     */
    public String render() {
        StringBuilder output = new StringBuilder();
        render(goal(), "", true, output);
        return output.toString();
    }

    private void render(PlanNode node, String prefix, boolean tail, StringBuilder output) {
        output.append(prefix).append(tail ? "└── " : "├── ").append(node).append('\n');
        List<Integer> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            render(nodes.get(children.get(i)), prefix + (tail ? "    " : "│   "), i == children.size() - 1, output);
        }
    }
}
