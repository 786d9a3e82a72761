package org.ltlf.mona;

import org.junit.Test;
import org.ltlf.formula.LtlfFormula;
import org.ltlf.solver.BoundedMonaChecker;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.ltlf.formula.LtlfFormula.and;
import static org.ltlf.formula.LtlfFormula.atom;
import static org.ltlf.formula.LtlfFormula.not;
import static org.ltlf.formula.LtlfFormula.quoted;
import static org.ltlf.formula.LtlfFormula.until;

public class MonaProgramTest {

    private final LtlfFormula a = atom("a");
    private final LtlfFormula b = atom("b");
    private final BoundedMonaChecker checker = new BoundedMonaChecker(3);

    @Test
    public void programLayout() {
        MonaProgram program = MonaProgram.of(until(a, b));
        assertEquals("#(a U b);\n"
                + "m2l-str;\n"
                + "var2 A, B;\n"
                + MonaEncoder.encode(until(a, b)) + ";\n", program.toString());
    }

    @Test
    public void programWithoutPropositionsHasNoDeclaration() {
        assertEquals("#true;\nm2l-str;\ntrue;\n", MonaProgram.of(LtlfFormula.TRUE).toString());
    }

    @Test
    public void variablesAreSortedAndUpperCased() {
        MonaProgram program = MonaProgram.of(LtlfFormula.and(atom("zeta"), atom("Beta"), atom("alpha")));
        assertEquals(List.of("ALPHA", "BETA", "ZETA"), List.copyOf(program.variables()));
    }

    @Test
    public void pastFormulaAtLastPosition() {
        MonaProgram program = MonaProgram.of(LtlfFormula.once(a), Position.LAST);
        assertEquals("(ex1 v_1: 0<=v_1&v_1<=max($) & (v_1 in A))", program.body());
        assertTrue(checker.check(program).isSatisfiable());
    }

    @Test
    public void sharedHelpers() {
        assertEquals("A_p, B_p", MonaProgram.primedList(List.of("A", "B")));
        assertEquals(List.of("A", "A_p", "B", "B_p"), MonaProgram.withPrimes(List.of("A", "B")));
        assertEquals("((A_p sub A) & (B_p sub B))", MonaProgram.primeConstraint(List.of("A", "B")));
    }

    //region NOMI DELLE VARIABILI

    @Test
    public void labelsDifferingOnlyInCaseStayDistinct() {
        MonaProgram program = MonaProgram.of(and(a, not(atom("A"))));
        assertEquals(List.of("A", "A_1"), List.copyOf(program.variables()));
        assertEquals("((0 in A_1) & ~((0 in A)))", program.body());
        assertTrue(checker.check(program).isSatisfiable());
    }

    @Test
    public void quotedFormulaIsDeclaredAsValidIdentifier() {
        MonaProgram program = MonaProgram.of(and(quoted(until(a, b)), not(a)));
        assertEquals(List.of("A", "A_U_B"), List.copyOf(program.variables()));
        assertTrue(program.toString().contains("var2 A, A_U_B;\n"));
        assertTrue(checker.check(program).isSatisfiable());
    }

    @Test
    public void unusualNamesAreDeclarable() {
        MonaProgram program = MonaProgram.stableModels(and(atom("\"x y\""), atom("1a")));
        assertEquals(List.of("Q1A", "X_Y"), List.copyOf(program.variables()));
        assertTrue(checker.check(program).isSatisfiable());
    }

    //endregion

    //region MODELLI STABILI

    @Test
    public void stableModelsProgramLayout() {
        MonaProgram program = MonaProgram.stableModels(a);
        assertEquals("(0 in A) & ~(ex2 A_p: ((A_p sub A)) & ((A_p ~= A)) & (0 in A_p))", program.body());
        assertEquals(List.of("A"), List.copyOf(program.variables()));
    }

    @Test
    public void atomHasStableModel() {
        assertTrue(checker.check(MonaProgram.stableModels(a)).isSatisfiable());
    }

    @Test
    public void doubleNegationHasNoStableModel() {
        assertTrue(checker.check(MonaProgram.stableModels(not(not(a)))).isUnsatisfiable());
    }

    @Test
    public void choiceRuleHasStableModels() {
        LtlfFormula choice = LtlfFormula.or(a, not(a));
        assertTrue(checker.check(MonaProgram.stableModels(choice)).isSatisfiable());
    }

    @Test
    public void formulaWithoutPropositionsIsItsOwnStableModelProgram() {
        MonaProgram program = MonaProgram.stableModels(LtlfFormula.LAST);
        assertEquals("(0 = max($))", program.body());
        assertTrue(program.variables().isEmpty());
    }

    //endregion
}
