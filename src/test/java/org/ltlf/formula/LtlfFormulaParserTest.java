package org.ltlf.formula;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.ltlf.formula.LtlfFormula.always;
import static org.ltlf.formula.LtlfFormula.and;
import static org.ltlf.formula.LtlfFormula.atom;
import static org.ltlf.formula.LtlfFormula.equivalence;
import static org.ltlf.formula.LtlfFormula.eventually;
import static org.ltlf.formula.LtlfFormula.implies;
import static org.ltlf.formula.LtlfFormula.next;
import static org.ltlf.formula.LtlfFormula.not;
import static org.ltlf.formula.LtlfFormula.or;
import static org.ltlf.formula.LtlfFormula.release;
import static org.ltlf.formula.LtlfFormula.since;
import static org.ltlf.formula.LtlfFormula.until;
import static org.ltlf.formula.LtlfFormulaParser.parse;

public class LtlfFormulaParserTest {

    private final LtlfFormula a = atom("a");
    private final LtlfFormula b = atom("b");
    private final LtlfFormula c = atom("c");

    @Test
    public void binaryOperatorsAreCollectedAsLists() {
        assertEquals(until(a, b), parse("a U b"));
        assertEquals(until(a, b, c), parse("a U b U c"));
        assertEquals(until(until(a, b), c), parse("(a U b) U c"));
        assertEquals(implies(a, b, c), parse("a -> b -> c"));
        assertEquals(and(a, b, c), parse("a & b & c"));
    }

    @Test
    public void precedenceFromLowestToHighest() {
        assertEquals(or(and(a, b), c), parse("a & b | c"));
        assertEquals(equivalence(implies(a, b), c), parse("a -> b <-> c"));
        assertEquals(and(until(a, b), c), parse("a U b & c"));
        assertEquals(until(release(a, b), c), parse("a R b U c"));
        assertEquals(release(since(a, b), c), parse("a S b R c"));
        assertEquals(and(not(a), b), parse("!a & b"));
        assertEquals(until(next(a), b), parse("X a U b"));
    }

    @Test
    public void unaryOperators() {
        assertEquals(always(eventually(a)), parse("G F a"));
        assertEquals(LtlfFormula.weakNext(a), parse("WX a"));
        assertEquals(LtlfFormula.before(a), parse("Y a"));
        assertEquals(LtlfFormula.weakBefore(a), parse("WY a"));
        assertEquals(LtlfFormula.once(LtlfFormula.historically(a)), parse("O H a"));
        assertEquals(LtlfFormula.trigger(a, b), parse("a T b"));
    }

    @Test
    public void constantsMarkersAndSymbols() {
        assertEquals(LtlfFormula.TRUE, parse("tt"));
        assertEquals(LtlfFormula.TRUE, parse("true"));
        assertEquals(LtlfFormula.FALSE, parse("ff"));
        assertEquals(LtlfFormula.LAST, parse("last"));
        assertEquals(LtlfFormula.END, parse("end"));
        assertEquals(LtlfFormula.INIT, parse("init"));
        assertEquals(atom("last_seen"), parse("last_seen"));
        assertEquals(atom("\"door open\""), parse("\"door open\""));
    }

    @Test
    public void alternativeConnectiveSpellings() {
        assertEquals(parse("a & b | !c"), parse("a && b || ~c"));
        assertEquals(parse("a -> b"), parse("a => b"));
        assertEquals(parse("a <-> b"), parse("a <=> b"));
    }

    @Test
    public void canonicalTextIsReadBack() {
        List<LtlfFormula> formulas = List.of(
                until(a, b, c),
                implies(and(a, not(b)), next(c)),
                equivalence(a, LtlfFormula.weakNext(b), release(c, a)),
                always(or(LtlfFormula.LAST, eventually(LtlfFormula.INIT))),
                since(LtlfFormula.weakBefore(a), LtlfFormula.trigger(b, LtlfFormula.END)),
                not(not(LtlfFormula.once(LtlfFormula.historically(LtlfFormula.FALSE)))));
        for (LtlfFormula formula : formulas) {
            assertEquals(formula.toString(), formula, parse(formula.toString()));
        }
    }

    @Test
    public void syntaxErrorsCarryPosition() {
        for (String text : List.of("a &", "(a U b", "a b", "A", "a ? b", "")) {
            try {
                parse(text);
                fail("Testo accettato: " + text);
            } catch (FormulaSyntaxException e) {
                assertEquals(1, e.getLine());
                assertTrue(e.getColumn() >= 0);
            }
        }
    }
}
