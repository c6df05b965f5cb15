package org.wff.parser;

import org.wff.support.Formula;
import org.wff.support.LogicTile;
import org.wff.support.Tiles;

import java.util.ArrayList;
import java.util.List;

/**
 * COSTRUTTORE FORMULE - Fabbrica di alberi e renderer a parentesizzazione minima
 *
 * Il renderer produce la forma canonica di un albero: nessuna parentesi al
 * livello più esterno, parentesi su un figlio solo quando la sua precedenza è
 * inferiore a quella del padre oppure quando, a parità di precedenza,
 * l'associatività non ricostruirebbe lo stesso albero.
 *
 * PRECEDENZE:
 * - 1: implicazione, biimplicazione (associative a destra)
 * - 2: disgiunzione (associativa a sinistra)
 * - 3: congiunzione (associativa a sinistra)
 */
public final class FormulaBuilder {

    private FormulaBuilder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region FABBRICHE DI NODI

    public static FormulaNode var(char letter) {
        return FormulaNode.variable(Tiles.variable(letter));
    }

    public static FormulaNode var(LogicTile tile) {
        return FormulaNode.variable(tile);
    }

    public static FormulaNode not(FormulaNode child) {
        return FormulaNode.unary(Tiles.NOT, child);
    }

    public static FormulaNode and(FormulaNode left, FormulaNode right) {
        return FormulaNode.binary(Tiles.AND, left, right);
    }

    public static FormulaNode or(FormulaNode left, FormulaNode right) {
        return FormulaNode.binary(Tiles.OR, left, right);
    }

    public static FormulaNode implies(FormulaNode left, FormulaNode right) {
        return FormulaNode.binary(Tiles.IMPLIES, left, right);
    }

    public static FormulaNode iff(FormulaNode left, FormulaNode right) {
        return FormulaNode.binary(Tiles.IFF, left, right);
    }

    //endregion

    //region FABBRICHE A LIVELLO DI FORMULA

    public static Formula fNeg(Formula formula) {
        return toFormula(not(require(formula)));
    }

    public static Formula fAnd(Formula left, Formula right) {
        return toFormula(and(require(left), require(right)));
    }

    public static Formula fOr(Formula left, Formula right) {
        return toFormula(or(require(left), require(right)));
    }

    public static Formula fImplies(Formula left, Formula right) {
        return toFormula(implies(require(left), require(right)));
    }

    private static FormulaNode require(Formula formula) {
        FormulaNode tree = WffParser.parse(formula);
        if (tree == null) {
            throw new IllegalArgumentException("Formula non ben formata: " + formula);
        }
        return tree;
    }

    //endregion

    //region RENDERING

    /**
     * Rende l'albero nella sua forma canonica.
     *
     * @param node albero sintattico (non null)
     * @return formula a parentesizzazione minima
     */
    public static Formula toFormula(FormulaNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Albero sintattico non può essere null");
        }
        List<LogicTile> tiles = new ArrayList<>();
        render(node, tiles);
        return new Formula(tiles);
    }

    private static void render(FormulaNode node, List<LogicTile> out) {
        switch (node.getType()) {
            case VARIABLE -> out.add(node.getTile());
            case UNARY -> {
                out.add(node.getOperator());
                FormulaNode child = node.getChild();
                renderWrapped(child, child.getType() == FormulaNode.Type.BINARY, out);
            }
            case BINARY -> {
                LogicTile operator = node.getOperator();
                int precedence = precedence(operator);
                boolean rightAssociative = precedence == 1;

                FormulaNode left = node.getLeft();
                int leftPrecedence = precedenceOf(left);
                renderWrapped(left,
                        leftPrecedence < precedence || (leftPrecedence == precedence && rightAssociative), out);

                out.add(operator);

                FormulaNode right = node.getRight();
                int rightPrecedence = precedenceOf(right);
                renderWrapped(right,
                        rightPrecedence < precedence || (rightPrecedence == precedence && !rightAssociative), out);
            }
        }
    }

    private static void renderWrapped(FormulaNode node, boolean parenthesize, List<LogicTile> out) {
        if (parenthesize) out.add(Tiles.LEFT_PAREN);
        render(node, out);
        if (parenthesize) out.add(Tiles.RIGHT_PAREN);
    }

    /** Variabili e negazioni legano più di qualunque connettivo binario */
    private static int precedenceOf(FormulaNode node) {
        return node.getType() == FormulaNode.Type.BINARY ? precedence(node.getOperator()) : Integer.MAX_VALUE;
    }

    static int precedence(LogicTile operator) {
        if (Tiles.AND.equals(operator)) return 3;
        if (Tiles.OR.equals(operator)) return 2;
        if (Tiles.IMPLIES.equals(operator) || Tiles.IFF.equals(operator)) return 1;
        throw new IllegalArgumentException("Operatore binario sconosciuto: " + operator);
    }

    //endregion
}
