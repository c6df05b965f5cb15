package org.wff.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.wff.antlr.LogicFormulaBaseVisitor;
import org.wff.antlr.LogicFormulaLexer;
import org.wff.antlr.LogicFormulaParser;
import org.wff.antlr.LogicFormulaParser.AtomicContext;
import org.wff.antlr.LogicFormulaParser.ConjunctionContext;
import org.wff.antlr.LogicFormulaParser.DisjunctionContext;
import org.wff.antlr.LogicFormulaParser.FormulaContext;
import org.wff.antlr.LogicFormulaParser.ImplicationContext;
import org.wff.antlr.LogicFormulaParser.NotContext;
import org.wff.antlr.LogicFormulaParser.ParContext;
import org.wff.antlr.LogicFormulaParser.VarContext;
import org.wff.support.Formula;
import org.wff.support.LogicTile;
import org.wff.support.Tiles;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER TESTUALE - Front end ASCII/Unicode basato sulla grammatica ANTLR LogicFormula
 *
 * Accetta sia i simboli canonici (¬ ∧ ∨ → ↔) sia gli alias ASCII usati nei file
 * di problemi personalizzati (~ ! & | -> <->).
 *
 * DUE MODALITÀ:
 * - toFormula: traduzione 1:1 dei token in tessere canoniche, la superficie
 *   (parentesi comprese) è preservata e la formula può non essere ben formata
 * - parse: visita dell'albero ANTLR e costruzione del FormulaNode, con le
 *   stesse precedenze di {@link WffParser}
 *
 * Gli errori non generano eccezioni: il risultato è null e il primo messaggio
 * di errore resta disponibile in {@link #getLastErrorMessage()}.
 */
public class FormulaTextParser extends LogicFormulaBaseVisitor<FormulaNode> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTextParser.class.getName());

    private String lastErrorMessage;

    //region PUNTI DI INGRESSO

    /**
     * @param text testo della formula
     * @return formula con tessere canoniche, null in caso di errore lessicale
     */
    public Formula toFormula(String text) {
        lastErrorMessage = null;
        if (text == null) {
            lastErrorMessage = "Testo della formula mancante";
            return null;
        }

        ErrorCollector errors = new ErrorCollector();
        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        List<LogicTile> tiles = new ArrayList<>();
        for (Token token = lexer.nextToken(); token.getType() != Token.EOF; token = lexer.nextToken()) {
            tiles.add(toTile(token));
        }

        if (errors.firstMessage != null) {
            lastErrorMessage = errors.firstMessage;
            LOGGER.fine(() -> "Errore lessicale in '" + text + "': " + lastErrorMessage);
            return null;
        }
        return new Formula(tiles);
    }

    /**
     * @param text testo della formula
     * @return albero sintattico, null se il testo non è una WFF
     */
    public FormulaNode parse(String text) {
        lastErrorMessage = null;
        if (text == null || text.isBlank()) {
            lastErrorMessage = "Formula vuota";
            return null;
        }

        ErrorCollector errors = new ErrorCollector();
        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        FormulaContext tree = parser.formula();
        if (errors.firstMessage != null) {
            lastErrorMessage = errors.firstMessage;
            LOGGER.fine(() -> "Errore sintattico in '" + text + "': " + lastErrorMessage);
            return null;
        }
        return visit(tree);
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }

    //endregion

    //region VISITOR

    @Override
    public FormulaNode visitFormula(FormulaContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public FormulaNode visitImplication(ImplicationContext ctx) {
        FormulaNode antecedent = visit(ctx.disjunction());
        if (ctx.implication() == null) {
            return antecedent;
        }
        // associatività a destra garantita dalla ricorsione della grammatica
        FormulaNode consequent = visit(ctx.implication());
        return ctx.IFF() != null
                ? FormulaBuilder.iff(antecedent, consequent)
                : FormulaBuilder.implies(antecedent, consequent);
    }

    @Override
    public FormulaNode visitDisjunction(DisjunctionContext ctx) {
        FormulaNode result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = FormulaBuilder.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public FormulaNode visitConjunction(ConjunctionContext ctx) {
        FormulaNode result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = FormulaBuilder.and(result, visit(ctx.negation(i)));
        }
        return result;
    }

    @Override
    public FormulaNode visitNot(NotContext ctx) {
        return FormulaBuilder.not(visit(ctx.negation()));
    }

    @Override
    public FormulaNode visitAtomic(AtomicContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public FormulaNode visitPar(ParContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public FormulaNode visitVar(VarContext ctx) {
        return FormulaBuilder.var(ctx.VARIABLE().getText().charAt(0));
    }

    //endregion

    //region SUPPORTO

    private static LogicTile toTile(Token token) {
        return switch (token.getType()) {
            case LogicFormulaLexer.NOT -> Tiles.NOT;
            case LogicFormulaLexer.AND -> Tiles.AND;
            case LogicFormulaLexer.OR -> Tiles.OR;
            case LogicFormulaLexer.IMPLIES -> Tiles.IMPLIES;
            case LogicFormulaLexer.IFF -> Tiles.IFF;
            case LogicFormulaLexer.LPAR -> Tiles.LEFT_PAREN;
            case LogicFormulaLexer.RPAR -> Tiles.RIGHT_PAREN;
            case LogicFormulaLexer.VARIABLE -> Tiles.variable(token.getText().charAt(0));
            default -> throw new IllegalStateException("Token inatteso: " + token.getText());
        };
    }

    /** Registra solo il primo errore, sia lessicale che sintattico */
    private static final class ErrorCollector extends BaseErrorListener {
        private String firstMessage;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            if (firstMessage == null) {
                firstMessage = "Posizione " + (charPositionInLine + 1) + ": " + msg;
            }
        }
    }

    //endregion
}
