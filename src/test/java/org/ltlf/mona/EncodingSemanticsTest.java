package org.ltlf.mona;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.ltlf.formula.LtlfFormula;
import org.ltlf.formula.TraceSemantics;
import org.ltlf.solver.BoundedMonaChecker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.ltlf.formula.LtlfFormulaParser.parse;

/**
 * Le codifiche diretta e primata, valutate dal verificatore limitato, coincidono con
 * la semantica su tracce finite in ogni posizione di partenza supportata.
 */
@RunWith(Parameterized.class)
public class EncodingSemanticsTest {

    private static final List<String> PROPOSITIONS = List.of("a", "b");

    @Rule
    public Timeout globalTimeout = Timeout.seconds(120);

    @Parameters(name = "{0}")
    public static Collection<Object[]> data() {
        List<Object[]> data = new ArrayList<>();
        for (String text : List.of(
                "a",
                "!a & b",
                "a | !(b & a)",
                "a -> b",
                "a -> b -> a",
                "a <-> b",
                "a <-> b <-> a",
                "!!a",
                "X a",
                "WX (a | X b)",
                "X WX a",
                "F a",
                "G (a -> X b)",
                "a U b",
                "a U b U a",
                "!(a U !b)",
                "a R b",
                "X (a R (b | last))",
                "F (last & a)",
                "G end | init",
                "Y a",
                "WY a",
                "X Y a",
                "a S b",
                "a S b S a",
                "a T b",
                "O (a & WY b)",
                "H (a -> Y b)",
                "G (b -> O a)",
                "F (a S !b)")) {
            data.add(new Object[]{text, parse(text)});
        }
        return data;
    }

    @Parameter(0)
    public String text;

    @Parameter(1)
    public LtlfFormula formula;

    private final BoundedMonaChecker checker = new BoundedMonaChecker(4);

    @Test
    public void directEncodingAtFirstPosition() {
        MonaProgram program = MonaProgram.of(formula);
        for (List<Set<String>> trace : TraceSemantics.traces(PROPOSITIONS, 4)) {
            Map<String, Set<Integer>> valuation = TraceSemantics.valuation(trace, PROPOSITIONS, "");
            assertEquals("traccia " + trace, TraceSemantics.holds(formula, trace, 0),
                    checker.evaluate(program, trace.size(), declaredOnly(program, valuation)));
        }
    }

    @Test
    public void directEncodingAtLastPosition() {
        MonaProgram program = MonaProgram.of(formula, Position.LAST);
        for (List<Set<String>> trace : TraceSemantics.traces(PROPOSITIONS, 4)) {
            Map<String, Set<Integer>> valuation = TraceSemantics.valuation(trace, PROPOSITIONS, "");
            assertEquals("traccia " + trace, TraceSemantics.holds(formula, trace, trace.size() - 1),
                    checker.evaluate(program, trace.size(), declaredOnly(program, valuation)));
        }
    }

    @Test
    public void primedEncodingMatchesHereAndThereSemantics() {
        Collection<String> names = MonaSymbolTable.of(formula).names();
        for (Position position : List.of(Position.INITIAL, Position.LAST)) {
            MonaProgram program = new MonaProgram(text, MonaProgram.withPrimes(names),
                    MonaEncoder.encodePrimed(formula, position));

            for (List<Set<String>> there : TraceSemantics.traces(PROPOSITIONS, 3)) {
                int index = position.isInitial() ? 0 : there.size() - 1;
                for (List<Set<String>> here : TraceSemantics.subTraces(there)) {
                    Map<String, Set<Integer>> valuation = new HashMap<>(TraceSemantics.valuation(there, PROPOSITIONS, ""));
                    valuation.putAll(TraceSemantics.valuation(here, PROPOSITIONS, "_p"));

                    assertEquals("here " + here + " there " + there + " in " + position,
                            TraceSemantics.holdsPrimed(formula, here, there, index),
                            checker.evaluate(program, there.size(), declaredOnly(program, valuation)));
                }
            }
        }
    }

    /** Il verificatore rifiuta variabili non dichiarate: si tengono solo quelle della formula */
    private static Map<String, Set<Integer>> declaredOnly(MonaProgram program, Map<String, Set<Integer>> valuation) {
        Map<String, Set<Integer>> result = new HashMap<>(valuation);
        result.keySet().retainAll(program.variables());
        return result;
    }
}
