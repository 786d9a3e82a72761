package org.ltlf.formula;

import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.ltlf.formula.LtlfFormula.and;
import static org.ltlf.formula.LtlfFormula.atom;
import static org.ltlf.formula.LtlfFormula.implies;
import static org.ltlf.formula.LtlfFormula.next;
import static org.ltlf.formula.LtlfFormula.not;
import static org.ltlf.formula.LtlfFormula.or;
import static org.ltlf.formula.LtlfFormula.quoted;
import static org.ltlf.formula.LtlfFormula.release;
import static org.ltlf.formula.LtlfFormula.until;
import static org.ltlf.formula.LtlfFormula.weakNext;

public class LtlfFormulaTest {

    private final LtlfFormula a = atom("a");
    private final LtlfFormula b = atom("b");
    private final LtlfFormula c = atom("c");

    //region NOMI E ARIETÀ

    @Test
    public void atomNamesAcceptWordCharactersAndQuotedText() {
        assertEquals("a_1", atom("a_1").toString());
        assertEquals("Door", atom("Door").toString());
        assertEquals("\"x y\"", atom("\"x y\"").toString());
    }

    @Test
    public void invalidAtomNamesAreRejected() {
        for (String name : List.of("a-b", "", "a b", "x\"")) {
            try {
                atom(name);
                fail("Nome accettato: " + name);
            } catch (FormulaNamingException e) {
                assertTrue(e.getMessage().contains(name));
            }
        }
    }

    @Test(expected = FormulaArityException.class)
    public void conjunctionNeedsTwoOperands() {
        and(a);
    }

    @Test(expected = FormulaArityException.class)
    public void untilNeedsTwoOperands() {
        LtlfFormula.nary(LtlfFormula.Type.UNTIL, List.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unaryFactoryRejectsBinaryType() {
        LtlfFormula.unary(LtlfFormula.Type.AND, a);
    }

    //endregion

    //region UGUAGLIANZA

    @Test
    public void structurallyEqualFormulasAreEqual() {
        LtlfFormula first = until(and(a, b), next(c));
        LtlfFormula second = until(and(atom("a"), atom("b")), next(atom("c")));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        Set<LtlfFormula> set = new HashSet<>(List.of(first, second));
        assertEquals(1, set.size());
    }

    @Test
    public void operandOrderAndOperatorMatter() {
        assertNotEquals(and(a, b), and(b, a));
        assertNotEquals(until(a, b), release(a, b));
        assertNotEquals(next(a), weakNext(a));
        assertNotEquals(until(a, b, c), until(until(a, b), c));
    }

    @Test
    public void deepFormulasCompareWithoutRecursion() {
        LtlfFormula left = a;
        LtlfFormula right = atom("a");
        for (int i = 0; i < 100_000; i++) {
            left = next(left);
            right = next(right);
        }
        assertEquals(left, right);
        assertNotEquals(left, next(right));
        assertEquals(100_001L, left.size());
    }

    //endregion

    //region ETICHETTE

    @Test
    public void labelsAreCollectedInDiscoveryOrder() {
        LtlfFormula formula = and(or(b, a), not(a), until(c, LtlfFormula.LAST));
        assertEquals(List.of("b", "a", "c"), names(formula.findLabels()));
    }

    @Test
    public void constantsAndMarkersAreNotLabels() {
        LtlfFormula formula = and(LtlfFormula.TRUE, LtlfFormula.INIT, or(LtlfFormula.END, LtlfFormula.FALSE));
        assertTrue(formula.findLabels().isEmpty());
    }

    @Test
    public void labelsOfSharedSubformulaAreVisitedOnce() {
        LtlfFormula shared = until(a, b);
        LtlfFormula formula = shared;
        for (int i = 0; i < 60; i++) {
            formula = and(formula, formula);
        }
        assertEquals(List.of("a", "b"), names(formula.findLabels()));
    }

    //endregion

    //region FORMULE CITATE

    @Test
    public void quotedFormulaIsAnAtom() {
        LtlfFormula formula = quoted(until(a, b));

        assertTrue(formula.isAtomic());
        assertEquals("\"(a U b)\"", formula.toString());
        assertEquals(AtomSymbol.Kind.QUOTED, formula.atom.kind());
        assertEquals(until(a, b), formula.atom.quotedFormula());
        assertEquals(Set.of(formula.atom), formula.findLabels());
    }

    @Test
    public void quotedFormulasCompareByContent() {
        assertEquals(quoted(until(a, b)), quoted(until(atom("a"), atom("b"))));
        assertNotEquals(quoted(until(a, b)), quoted(release(a, b)));
        assertNotEquals(quoted(a), a);
    }

    //endregion

    //region ACCESSO STRUTTURALE E RAPPRESENTAZIONE

    @Test
    public void nestedViewsOfNaryOperators() {
        assertEquals(until(b, c), until(a, b, c).rest());
        assertEquals(b, until(a, b).rest());
        assertEquals(implies(a, b), implies(a, b, c).premise());
        assertEquals(c, implies(a, b, c).lastOperand());
        assertSame(a, until(a, b, c).first());
    }

    @Test(expected = IllegalStateException.class)
    public void operandOfBinaryNodeIsRejected() {
        and(a, b).operand();
    }

    @Test
    public void canonicalRendering() {
        assertEquals("X(a)", next(a).toString());
        assertEquals("WX(a)", weakNext(a).toString());
        assertEquals("!(a)", not(a).toString());
        assertEquals("(a U b U c)", until(a, b, c).toString());
        assertEquals("((a & b) -> c)", implies(and(a, b), c).toString());
        assertEquals("G(F(last))", LtlfFormula.always(LtlfFormula.eventually(LtlfFormula.LAST)).toString());
    }

    @Test
    public void pastOperatorsAreMarked() {
        assertTrue(LtlfFormula.Type.SINCE.isPast());
        assertTrue(LtlfFormula.Type.WEAK_BEFORE.isPast());
        assertFalse(LtlfFormula.Type.UNTIL.isPast());
        assertFalse(LtlfFormula.Type.NOT.isPast());
    }

    //endregion

    private static List<String> names(Set<AtomSymbol> labels) {
        return labels.stream().map(AtomSymbol::toString).toList();
    }
}
