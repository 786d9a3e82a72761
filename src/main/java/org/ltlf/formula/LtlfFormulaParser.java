package org.ltlf.formula;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.ltlf.parser.LtlfBaseVisitor;
import org.ltlf.parser.LtlfLexer;
import org.ltlf.parser.LtlfParser;
import org.ltlf.parser.LtlfParser.AlwaysContext;
import org.ltlf.parser.LtlfParser.BeforeContext;
import org.ltlf.parser.LtlfParser.ConjunctionContext;
import org.ltlf.parser.LtlfParser.DisjunctionContext;
import org.ltlf.parser.LtlfParser.EndContext;
import org.ltlf.parser.LtlfParser.EquivalenceContext;
import org.ltlf.parser.LtlfParser.EventuallyContext;
import org.ltlf.parser.LtlfParser.FalseContext;
import org.ltlf.parser.LtlfParser.FormulaContext;
import org.ltlf.parser.LtlfParser.HistoricallyContext;
import org.ltlf.parser.LtlfParser.ImplicationContext;
import org.ltlf.parser.LtlfParser.InitContext;
import org.ltlf.parser.LtlfParser.LastContext;
import org.ltlf.parser.LtlfParser.NextContext;
import org.ltlf.parser.LtlfParser.NotContext;
import org.ltlf.parser.LtlfParser.OnceContext;
import org.ltlf.parser.LtlfParser.ParenthesizedContext;
import org.ltlf.parser.LtlfParser.PrimaryContext;
import org.ltlf.parser.LtlfParser.QuotedContext;
import org.ltlf.parser.LtlfParser.ReleaseContext;
import org.ltlf.parser.LtlfParser.SinceContext;
import org.ltlf.parser.LtlfParser.SymbolContext;
import org.ltlf.parser.LtlfParser.TriggerContext;
import org.ltlf.parser.LtlfParser.TrueContext;
import org.ltlf.parser.LtlfParser.UntilContext;
import org.ltlf.parser.LtlfParser.WeakBeforeContext;
import org.ltlf.parser.LtlfParser.WeakNextContext;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LTLf - Convertitore da albero sintattico ANTLR a {@link LtlfFormula}
 *
 * Ogni livello di precedenza della grammatica produce una lista di operandi:
 * con un solo elemento il livello è trasparente, altrimenti diventa un nodo n-ario
 * dell'operatore corrispondente.
 *
 * OPERATORI (precedenza crescente):
 * - Equivalenza (<->, <=>)
 * - Implicazione (->, =>), annidata a sinistra
 * - Disgiunzione (|, ||) e congiunzione (&, &&)
 * - U, R, S, T, annidati a destra
 * - Unari: G, F, X, WX, Y, WY, O, H, ! (o ~)
 * - Atomi: simboli minuscoli, simboli tra virgolette, true/tt, false/ff, last, end, init
 *
 * Gli errori sintattici non vengono recuperati: il primo errore solleva
 * {@link FormulaSyntaxException}.
 */
public class LtlfFormulaParser extends LtlfBaseVisitor<LtlfFormula> {

    private static final Logger LOGGER = Logger.getLogger(LtlfFormulaParser.class.getName());

    /**
     * Legge una formula dalla sua forma testuale.
     *
     * @param text testo della formula
     * @return formula corrispondente
     * @throws FormulaSyntaxException se il testo non è una formula valida
     */
    public static LtlfFormula parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        LtlfLexer lexer = new LtlfLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        LtlfParser parser = new LtlfParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        LtlfFormula formula = new LtlfFormulaParser().visit(parser.formula());
        LOGGER.fine(() -> "Formula letta: " + formula);
        return formula;
    }

    //region LIVELLI DI PRECEDENZA

    @Override
    public LtlfFormula visitFormula(FormulaContext ctx) {
        return visit(ctx.equivalence());
    }

    @Override
    public LtlfFormula visitEquivalence(EquivalenceContext ctx) {
        return collect(LtlfFormula.Type.EQUIVALENCE, ctx.implication());
    }

    @Override
    public LtlfFormula visitImplication(ImplicationContext ctx) {
        return collect(LtlfFormula.Type.IMPLIES, ctx.disjunction());
    }

    @Override
    public LtlfFormula visitDisjunction(DisjunctionContext ctx) {
        return collect(LtlfFormula.Type.OR, ctx.conjunction());
    }

    @Override
    public LtlfFormula visitConjunction(ConjunctionContext ctx) {
        return collect(LtlfFormula.Type.AND, ctx.until());
    }

    @Override
    public LtlfFormula visitUntil(UntilContext ctx) {
        return collect(LtlfFormula.Type.UNTIL, ctx.release());
    }

    @Override
    public LtlfFormula visitRelease(ReleaseContext ctx) {
        return collect(LtlfFormula.Type.RELEASE, ctx.since());
    }

    @Override
    public LtlfFormula visitSince(SinceContext ctx) {
        return collect(LtlfFormula.Type.SINCE, ctx.trigger());
    }

    @Override
    public LtlfFormula visitTrigger(TriggerContext ctx) {
        return collect(LtlfFormula.Type.TRIGGER, ctx.unary());
    }

    private LtlfFormula collect(LtlfFormula.Type type, List<? extends ParserRuleContext> children) {
        if (children.size() == 1) {
            return visit(children.get(0));
        }
        List<LtlfFormula> operands = new ArrayList<>(children.size());
        for (ParserRuleContext child : children) {
            operands.add(visit(child));
        }
        return LtlfFormula.nary(type, operands);
    }

    //endregion

    //region OPERATORI UNARI

    @Override
    public LtlfFormula visitAlways(AlwaysContext ctx) {
        return LtlfFormula.always(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitEventually(EventuallyContext ctx) {
        return LtlfFormula.eventually(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitNext(NextContext ctx) {
        return LtlfFormula.next(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitWeakNext(WeakNextContext ctx) {
        return LtlfFormula.weakNext(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitBefore(BeforeContext ctx) {
        return LtlfFormula.before(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitWeakBefore(WeakBeforeContext ctx) {
        return LtlfFormula.weakBefore(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitOnce(OnceContext ctx) {
        return LtlfFormula.once(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitHistorically(HistoricallyContext ctx) {
        return LtlfFormula.historically(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitNot(NotContext ctx) {
        return LtlfFormula.not(visit(ctx.unary()));
    }

    @Override
    public LtlfFormula visitPrimary(PrimaryContext ctx) {
        return visit(ctx.atom());
    }

    //endregion

    //region ATOMI

    @Override
    public LtlfFormula visitParenthesized(ParenthesizedContext ctx) {
        return visit(ctx.equivalence());
    }

    @Override
    public LtlfFormula visitTrue(TrueContext ctx) {
        return LtlfFormula.TRUE;
    }

    @Override
    public LtlfFormula visitFalse(FalseContext ctx) {
        return LtlfFormula.FALSE;
    }

    @Override
    public LtlfFormula visitLast(LastContext ctx) {
        return LtlfFormula.LAST;
    }

    @Override
    public LtlfFormula visitEnd(EndContext ctx) {
        return LtlfFormula.END;
    }

    @Override
    public LtlfFormula visitInit(InitContext ctx) {
        return LtlfFormula.INIT;
    }

    @Override
    public LtlfFormula visitSymbol(SymbolContext ctx) {
        return LtlfFormula.atom(ctx.SYMBOL().getText());
    }

    @Override
    public LtlfFormula visitQuoted(QuotedContext ctx) {
        return LtlfFormula.atom(ctx.QUOTED().getText());
    }

    //endregion
}
