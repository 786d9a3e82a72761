package org.ltlf.mona;

import org.junit.Test;
import org.ltlf.formula.LtlfFormula;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.ltlf.formula.LtlfFormula.and;
import static org.ltlf.formula.LtlfFormula.atom;
import static org.ltlf.formula.LtlfFormula.before;
import static org.ltlf.formula.LtlfFormula.implies;
import static org.ltlf.formula.LtlfFormula.next;
import static org.ltlf.formula.LtlfFormula.not;
import static org.ltlf.formula.LtlfFormula.until;
import static org.ltlf.formula.LtlfFormula.weakNext;

/**
 * Testo esatto prodotto dalle due codifiche.
 */
public class MonaEncoderTest {

    private final LtlfFormula a = atom("a");
    private final LtlfFormula b = atom("b");

    @Test
    public void atomsBecomeMembership() {
        assertEquals("(0 in A)", MonaEncoder.encode(a));
        assertEquals("(max($) in A)", MonaEncoder.encode(a, Position.LAST));
        assertEquals("(0 in A_p)", MonaEncoder.encodePrimed(a));
    }

    @Test
    public void booleanConnectives() {
        assertEquals("~((0 in A))", MonaEncoder.encode(not(a)));
        assertEquals("((0 in A) & (0 in B))", MonaEncoder.encode(and(a, b)));
        assertEquals("((0 in A) => (0 in B))", MonaEncoder.encode(implies(a, b)));
        assertEquals("(((0 in A) => (0 in B)) => (0 in A))", MonaEncoder.encode(implies(a, b, a)));
        assertEquals("((0 in A) <=> (0 in B))", MonaEncoder.encode(LtlfFormula.equivalence(a, b)));
    }

    @Test
    public void primedNegationAndImplicationUseBothValuations() {
        assertEquals("(~(0 in A_p) & ~(0 in A))", MonaEncoder.encodePrimed(not(a)));
        assertEquals("(((0 in A) => (0 in B)) & ((0 in A_p) => (0 in B_p)))", MonaEncoder.encodePrimed(implies(a, b)));
    }

    @Test
    public void nextIntroducesFreshVariable() {
        assertEquals("(ex1 v_1: v_1=1 & (v_1 in A))", MonaEncoder.encode(next(a)));
        assertEquals("(ex1 v_1: v_1=1 & (ex1 v_2: v_2=v_1+1 & (v_2 in A)))", MonaEncoder.encode(next(next(a))));
        assertEquals("((0 = max($)) | (ex1 v_1: v_1=1 & (v_1 in A)))", MonaEncoder.encode(weakNext(a)));
    }

    @Test
    public void untilTemplate() {
        assertEquals("(ex1 v_1: 0<=v_1&v_1<=max($) & (v_1 in B) & (all1 v_2: 0<=v_2&v_2<v_1 => (v_2 in A)))",
                MonaEncoder.encode(until(a, b)));
    }

    @Test
    public void markers() {
        assertEquals("(0 = max($))", MonaEncoder.encode(LtlfFormula.LAST));
        assertEquals("(max($) = 0)", MonaEncoder.encode(LtlfFormula.INIT, Position.LAST));
        assertEquals("(all1 v_1: 0<=v_1&v_1<=max($) => false)", MonaEncoder.encode(LtlfFormula.END));
        assertEquals("true", MonaEncoder.encode(LtlfFormula.TRUE));
    }

    @Test
    public void pastOperatorsAtTraceBoundaries() {
        assertEquals("false", MonaEncoder.encode(before(a)));
        assertEquals("true", MonaEncoder.encode(LtlfFormula.weakBefore(a)));
        assertEquals("(ex1 v_1: v_1+1=max($) & max($)>0 & (v_1 in A))", MonaEncoder.encode(before(a), Position.LAST));
        assertEquals("(0 in B)", MonaEncoder.encode(LtlfFormula.since(a, b)));
        assertEquals("(0 in A)", MonaEncoder.encode(LtlfFormula.once(a)));
    }

    @Test
    public void nestedPastUsesPredecessorOfBoundVariable() {
        String encoding = MonaEncoder.encode(next(before(a)));
        assertEquals("(ex1 v_1: v_1=1 & (ex1 v_2: v_2+1=v_1 & (v_2 in A)))", encoding);
    }

    @Test
    public void variableSuccessor() {
        assertEquals(Position.variable("v_1"), VariableNames.next(Position.INITIAL));
        assertEquals(Position.variable("v_1"), VariableNames.next(Position.LAST));
        assertEquals(Position.variable("v_10"), VariableNames.next(Position.variable("v_9")));
    }

    @Test(expected = EncodingException.class)
    public void foreignVariableNameIsRejected() {
        MonaEncoder.encode(next(a), Position.variable("x"));
    }

    @Test
    public void deepFormulaIsEncodedWithoutRecursion() {
        LtlfFormula formula = a;
        for (int i = 0; i < 5_000; i++) {
            formula = next(formula);
        }
        String encoding = MonaEncoder.encode(formula);
        assertTrue(encoding.endsWith("(v_5000 in A)" + ")".repeat(5_000)));
    }
}
