package org.ltlf.optionalfeatures;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.ltlf.formula.AtomSymbol;
import org.ltlf.formula.LtlfFormula;
import org.ltlf.formula.TraceSemantics;
import org.ltlf.mona.MonaProgram;
import org.ltlf.solver.BoundedMonaChecker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.ltlf.formula.LtlfFormula.LAST;
import static org.ltlf.formula.LtlfFormula.always;
import static org.ltlf.formula.LtlfFormula.and;
import static org.ltlf.formula.LtlfFormula.atom;
import static org.ltlf.formula.LtlfFormula.equivalence;
import static org.ltlf.formula.LtlfFormula.implies;
import static org.ltlf.formula.LtlfFormula.next;
import static org.ltlf.formula.LtlfFormula.not;
import static org.ltlf.formula.LtlfFormula.or;
import static org.ltlf.formula.LtlfFormula.until;
import static org.ltlf.formula.LtlfFormulaParser.parse;

public class TseitinClausifierTest {

    private static final List<String> PROPOSITIONS = List.of("a", "b");

    private final LtlfFormula a = atom("a");
    private final LtlfFormula b = atom("b");

    @Rule
    public Timeout globalTimeout = Timeout.seconds(120);

    @Test
    public void atomicFormulaNeedsNoConstraints() {
        ClausifiedFormula result = TseitinClausifier.clausify(a);

        assertSame(a, result.root());
        assertTrue(result.constraints().isEmpty());
        assertTrue(result.freshVariables().isEmpty());
        assertEquals(a, result.toFormula());
    }

    @Test
    public void untilIsUnfoldedThroughNext() {
        ClausifiedFormula result = TseitinClausifier.clausify(until(a, b));
        LtlfFormula t0 = fresh("t", 0);
        LtlfFormula t1 = fresh("t", 1);

        assertEquals(t0, result.root());
        assertEquals(List.of(t0, t1), result.freshVariables());
        assertEquals(List.of(
                always(equivalence(t1, next(t0))),
                always(implies(LAST, not(t1))),
                always(equivalence(t0, or(b, and(a, t1))))),
                new ArrayList<>(result.constraints()));
    }

    @Test
    public void weakOperatorsGetPositiveBoundary() {
        ClausifiedFormula result = TseitinClausifier.clausify(LtlfFormula.weakBefore(a));
        LtlfFormula t0 = fresh("t", 0);

        assertTrue(result.constraints().contains(always(equivalence(t0, LtlfFormula.weakBefore(a)))));
        assertTrue(result.constraints().contains(always(implies(LtlfFormula.INIT, t0))));
    }

    //region CONDIVISIONE

    @Test
    public void sharedSubformulaIsDefinedOnce() {
        LtlfFormula formula = until(a, b);
        int depth = 30;
        for (int i = 0; i < depth; i++) {
            formula = and(formula, formula);
        }

        ClausifiedFormula result = TseitinClausifier.clausify(formula);

        assertEquals(depth + 3, result.constraints().size());
        assertEquals(depth + 2, result.freshVariables().size());
    }

    @Test
    public void structurallyEqualCopiesAreMerged() {
        LtlfFormula formula = and(until(atom("a"), atom("b")), until(atom("a"), atom("b")));
        ClausifiedFormula result = TseitinClausifier.clausify(formula);

        assertEquals(4, result.constraints().size());
        assertEquals(3, result.freshVariables().size());
    }

    @Test
    public void clausificationIsDeterministic() {
        LtlfFormula formula = parse("G (a -> F b) & (a S !b)");
        ClausifiedFormula first = TseitinClausifier.clausify(formula);
        ClausifiedFormula second = TseitinClausifier.clausify(formula);

        assertEquals(first.root(), second.root());
        assertEquals(new ArrayList<>(first.constraints()), new ArrayList<>(second.constraints()));
    }

    //endregion

    //region VARIABILI FRESCHE

    @Test
    public void prefixAvoidsExistingLabels() {
        assertEquals("t", TseitinClausifier.choosePrefix(and(a, atom("tx"))));
        assertEquals("tt", TseitinClausifier.choosePrefix(and(a, atom("t0"))));
        assertEquals("ttt", TseitinClausifier.choosePrefix(and(atom("t1"), atom("tt5"))));
        assertEquals("tt", TseitinClausifier.choosePrefix(and(a, atom("T0"))));
    }

    @Test
    public void upperCaseLabelKeepsSatisfiability() {
        LtlfFormula formula = and(not(atom("T0")), a);
        ClausifiedFormula result = TseitinClausifier.clausify(formula);
        BoundedMonaChecker checker = new BoundedMonaChecker(3);

        MonaProgram clausified = MonaProgram.of(result.toFormula());
        assertFalse(clausified.variables().contains("T1"));
        assertEquals(checker.check(MonaProgram.of(formula)).isSatisfiable(), checker.check(clausified).isSatisfiable());
        assertTrue(checker.check(clausified).isSatisfiable());
    }

    @Test
    public void freshVariablesUseChosenPrefix() {
        ClausifiedFormula result = TseitinClausifier.clausify(next(and(atom("t0"), b)));
        for (LtlfFormula variable : result.freshVariables()) {
            assertTrue(variable.toString(), variable.toString().startsWith("tt"));
            assertEquals(AtomSymbol.Kind.FRESH, variable.atom.kind());
        }
    }

    //endregion

    //region EQUISODDISFACIBILITÀ

    @Test
    public void clausifiedFormulaIsEquisatisfiableOnEveryTrace() {
        for (String text : List.of(
                "a U b",
                "a R !b",
                "!(a & X b)",
                "F a | Y b",
                "a S b",
                "H (a | b)",
                "a -> WX b",
                "(a U b) & !(a U b)")) {
            LtlfFormula formula = parse(text);
            ClausifiedFormula result = TseitinClausifier.clausify(formula);
            LtlfFormula clausified = result.toFormula();
            List<String> fresh = new ArrayList<>();
            result.freshVariables().forEach(variable -> fresh.add(variable.toString()));

            for (List<Set<String>> trace : TraceSemantics.traces(PROPOSITIONS, 3)) {
                assertEquals(text + " su " + trace, TraceSemantics.holds(formula, trace),
                        hasExtension(clausified, trace, fresh));
            }
        }
    }

    //endregion

    private static boolean hasExtension(LtlfFormula formula, List<Set<String>> trace, List<String> fresh) {
        int bits = trace.size() * fresh.size();
        for (long code = 0; code < (1L << bits); code++) {
            List<Set<String>> extended = new ArrayList<>(trace.size());
            for (int i = 0; i < trace.size(); i++) {
                Set<String> state = new HashSet<>(trace.get(i));
                for (int v = 0; v < fresh.size(); v++) {
                    if ((code & (1L << (i * fresh.size() + v))) != 0) {
                        state.add(fresh.get(v));
                    }
                }
                extended.add(state);
            }
            if (TraceSemantics.holds(formula, extended)) {
                return true;
            }
        }
        return false;
    }

    private static LtlfFormula fresh(String prefix, int index) {
        return LtlfFormula.atom(AtomSymbol.fresh(prefix, index));
    }
}
