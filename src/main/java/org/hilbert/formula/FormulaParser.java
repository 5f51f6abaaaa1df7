package org.hilbert.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.hilbert.parser.LogicFormulaBaseVisitor;
import org.hilbert.parser.LogicFormulaLexer;
import org.hilbert.parser.LogicFormulaParser;
import org.hilbert.parser.LogicFormulaParser.FormulaContext;
import org.hilbert.parser.LogicFormulaParser.IdContext;
import org.hilbert.parser.LogicFormulaParser.ImpliesContext;
import org.hilbert.parser.LogicFormulaParser.NotContext;
import org.hilbert.parser.LogicFormulaParser.ParContext;
import org.hilbert.parser.LogicFormulaParser.VarContext;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa un visitor sulla grammatica LogicFormula trasformando l'albero di parsing
 * nel modello immutabile {¬, →}.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Implicazione ({@code →} oppure {@code ->}): associativa a destra, A → B → C ~ A → (B → C)
 * - Negazione ({@code ¬}, {@code !}, {@code ~}): unaria, associativa a destra
 * - Variabili atomiche ed espressioni tra parentesi
 *
 * GESTIONE ERRORI:
 * - Ogni errore lessicale o sintattico interrompe il parsing con {@link FormulaParseException}
 * - Nessun recupero: il testo è accettato per intero oppure rifiutato
 */
public class FormulaParser extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Esegue la pipeline completa Lexing -> Parsing -> Visitor.
     *
     * @param text formula in notazione infissa
     * @return formula corrispondente
     * @throws FormulaParseException se il testo non è una formula ben formata
     */
    public static Formula parse(String text) {
        if (text == null) {
            throw new FormulaParseException("null", 0, 0, "testo assente");
        }

        ThrowingErrorListener errorListener = new ThrowingErrorListener(text);

        CharStream input = CharStreams.fromString(text);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaParser().visit(tree);

        LOGGER.finest("Formula analizzata: " + formula);
        return formula;
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.implication());
    }

    //endregion

    //region IMPLICAZIONI

    /**
     * A → B con ricorsione a destra per l'associatività.
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.negation());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }
        Formula consequent = visit(ctx.implication());
        return new Implies(antecedent, consequent);
    }

    //endregion

    //region NEGAZIONI, ATOMI E PARENTESI

    @Override
    public Formula visitNot(NotContext ctx) {
        return new Not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        return new Atom(ctx.IDENTIFIER().getText());
    }

    //endregion

    /**
     * Listener ANTLR che converte il primo errore segnalato in eccezione.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String text;

        ThrowingErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new FormulaParseException(text, line, charPositionInLine, msg);
        }
    }
}
