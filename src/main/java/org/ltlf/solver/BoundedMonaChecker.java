package org.ltlf.solver;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.ltlf.formula.SyntaxErrorListener;
import org.ltlf.mona.MonaProgram;
import org.ltlf.mona.parser.MonaBaseVisitor;
import org.ltlf.mona.parser.MonaLexer;
import org.ltlf.mona.parser.MonaParser;
import org.ltlf.mona.parser.MonaParser.BiimplicationContext;
import org.ltlf.mona.parser.MonaParser.ComparisonContext;
import org.ltlf.mona.parser.MonaParser.ConjunctionContext;
import org.ltlf.mona.parser.MonaParser.ConstantContext;
import org.ltlf.mona.parser.MonaParser.DeclarationContext;
import org.ltlf.mona.parser.MonaParser.DisjunctionContext;
import org.ltlf.mona.parser.MonaParser.FalseContext;
import org.ltlf.mona.parser.MonaParser.GroupContext;
import org.ltlf.mona.parser.MonaParser.ImplicationContext;
import org.ltlf.mona.parser.MonaParser.MaximumContext;
import org.ltlf.mona.parser.MonaParser.MembershipContext;
import org.ltlf.mona.parser.MonaParser.NegationContext;
import org.ltlf.mona.parser.MonaParser.ProgramContext;
import org.ltlf.mona.parser.MonaParser.QuantifiedContext;
import org.ltlf.mona.parser.MonaParser.SubsetContext;
import org.ltlf.mona.parser.MonaParser.SuccessorContext;
import org.ltlf.mona.parser.MonaParser.TermContext;
import org.ltlf.mona.parser.MonaParser.TrueContext;
import org.ltlf.mona.parser.MonaParser.VariableContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * VERIFICATORE LIMITATO - Valutazione diretta di programmi MONA su stringhe corte
 *
 * Interpreta il sottoinsieme di M2L-Str prodotto dagli encoder: per ogni lunghezza
 * {@code 1..maxLength} e ogni valutazione delle variabili dichiarate con {@code var2}
 * valuta il corpo del programma. L'esito è relativo al limite: VALID e UNSATISFIABLE
 * valgono per le stringhe esplorate, non in assoluto.
 *
 * L'output imita quello di MONA, quindi i marcatori riconosciuti da {@link MonaRunner}
 * valgono anche qui. Un'istanza conserva solo l'ultimo programma analizzato e non è thread-safe.
 */
public final class BoundedMonaChecker {

    private static final Logger LOGGER = Logger.getLogger(BoundedMonaChecker.class.getName());

    /** Limite sui bit di una valutazione completa (lunghezza per numero di variabili) */
    private static final int MAX_VALUATION_BITS = 24;

    private final int maxLength;

    /** Ultimo programma analizzato: le valutazioni ripetute dello stesso testo non lo rianalizzano */
    private String lastText;
    private ProgramContext lastProgram;

    /**
     * @param maxLength lunghezza massima delle stringhe esplorate (almeno 1)
     */
    public BoundedMonaChecker(int maxLength) {
        if (maxLength < 1 || maxLength > MAX_VALUATION_BITS) {
            throw new IllegalArgumentException("Lunghezza massima fuori dall'intervallo 1.." + MAX_VALUATION_BITS + ": " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public MonaResult check(MonaProgram program) {
        return check(program.toString());
    }

    /**
     * Esplora tutte le interpretazioni entro il limite.
     *
     * @return VALID se nessun controesempio, UNSATISFIABLE se nessun esempio, altrimenti SATISFIABLE
     */
    public MonaResult check(String programText) {
        long start = System.nanoTime();
        ProgramContext program = parse(programText);
        List<String> variables = declaredVariables(program);

        String example = null;
        String counterExample = null;

        for (int length = 1; length <= maxLength && (example == null || counterExample == null); length++) {
            int bits = length * variables.size();
            if (bits > MAX_VALUATION_BITS) {
                LOGGER.warning("Esplorazione interrotta alla lunghezza " + length + ": troppe valutazioni");
                break;
            }

            long mask = (1L << length) - 1;
            for (long code = 0; code < (1L << bits); code++) {
                Map<String, Long> valuation = new HashMap<>();
                for (int i = 0; i < variables.size(); i++) {
                    valuation.put(variables.get(i), (code >> (i * length)) & mask);
                }

                boolean holds = new Evaluator(length, valuation).visit(program.formula());
                if (holds && example == null) {
                    example = describe(length, variables, valuation);
                } else if (!holds && counterExample == null) {
                    counterExample = describe(length, variables, valuation);
                }
                if (example != null && counterExample != null) {
                    break;
                }
            }
        }

        MonaVerdict verdict;
        StringBuilder output = new StringBuilder();
        if (counterExample == null) {
            verdict = MonaVerdict.VALID;
            output.append("Formula is valid (lunghezza <= ").append(maxLength).append(")\n");
        } else if (example == null) {
            verdict = MonaVerdict.UNSATISFIABLE;
            output.append("Formula is unsatisfiable (lunghezza <= ").append(maxLength).append(")\n");
        } else {
            verdict = MonaVerdict.SATISFIABLE;
            output.append("A counter-example of least length ").append(counterExample).append('\n');
            output.append("A satisfying example of least length ").append(example).append('\n');
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        LOGGER.fine(() -> "Verifica limitata: " + verdict + " in " + elapsed.toMillis() + " ms");
        return new MonaResult(verdict, output.toString(), elapsed);
    }

    /**
     * Valuta il programma su una sola interpretazione.
     *
     * @param length lunghezza della stringa
     * @param valuation posizioni in cui vale ciascuna variabile dichiarata (le assenti sono vuote)
     * @throws IllegalArgumentException se la valutazione nomina variabili non dichiarate
     */
    public boolean evaluate(String programText, int length, Map<String, Set<Integer>> valuation) {
        if (length < 1) {
            throw new IllegalArgumentException("Lunghezza deve essere almeno 1: " + length);
        }
        ProgramContext program = parse(programText);
        List<String> variables = declaredVariables(program);

        Map<String, Long> masks = new HashMap<>();
        for (String variable : variables) {
            masks.put(variable, 0L);
        }
        for (Map.Entry<String, Set<Integer>> entry : valuation.entrySet()) {
            if (!masks.containsKey(entry.getKey())) {
                throw new IllegalArgumentException("Variabile non dichiarata nel programma: " + entry.getKey());
            }
            long mask = 0L;
            for (int position : entry.getValue()) {
                if (position >= 0 && position < length) {
                    mask |= 1L << position;
                }
            }
            masks.put(entry.getKey(), mask);
        }
        return new Evaluator(length, masks).visit(program.formula());
    }

    public boolean evaluate(MonaProgram program, int length, Map<String, Set<Integer>> valuation) {
        return evaluate(program.toString(), length, valuation);
    }

    //region PARSING

    private ProgramContext parse(String programText) {
        if (programText.equals(lastText)) {
            return lastProgram;
        }
        MonaLexer lexer = new MonaLexer(CharStreams.fromString(programText));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        MonaParser parser = new MonaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);
        ProgramContext program = parser.program();

        lastText = programText;
        lastProgram = program;
        return program;
    }

    private static List<String> declaredVariables(ProgramContext program) {
        Set<String> names = new LinkedHashSet<>();
        for (DeclarationContext declaration : program.declaration()) {
            for (TerminalNode name : declaration.IDENT()) {
                names.add(name.getText());
            }
        }
        return new ArrayList<>(names);
    }

    private static String describe(int length, List<String> variables, Map<String, Long> valuation) {
        StringBuilder text = new StringBuilder("(" + length + ") is:");
        for (String variable : variables) {
            StringJoiner positions = new StringJoiner(",", "{", "}");
            long mask = valuation.get(variable);
            for (int i = 0; i < length; i++) {
                if ((mask & (1L << i)) != 0) {
                    positions.add(Integer.toString(i));
                }
            }
            text.append("\n").append(variable).append(" = ").append(positions);
        }
        return text.toString();
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valutazione di una formula MONA su una stringa di lunghezza fissata.
     */
    private static final class Evaluator extends MonaBaseVisitor<Boolean> {

        private final int length;
        private final Map<String, Integer> firstOrder = new HashMap<>();
        private final Map<String, Long> secondOrder;

        Evaluator(int length, Map<String, Long> valuation) {
            this.length = length;
            this.secondOrder = new HashMap<>(valuation);
        }

        @Override
        public Boolean visitNegation(NegationContext ctx) {
            return !visit(ctx.formula());
        }

        @Override
        public Boolean visitConjunction(ConjunctionContext ctx) {
            return visit(ctx.formula(0)) && visit(ctx.formula(1));
        }

        @Override
        public Boolean visitDisjunction(DisjunctionContext ctx) {
            return visit(ctx.formula(0)) || visit(ctx.formula(1));
        }

        @Override
        public Boolean visitImplication(ImplicationContext ctx) {
            return !visit(ctx.formula(0)) || visit(ctx.formula(1));
        }

        @Override
        public Boolean visitBiimplication(BiimplicationContext ctx) {
            return visit(ctx.formula(0)).equals(visit(ctx.formula(1)));
        }

        @Override
        public Boolean visitQuantified(QuantifiedContext ctx) {
            List<String> names = new ArrayList<>();
            for (TerminalNode name : ctx.IDENT()) {
                names.add(name.getText());
            }
            boolean existential = ctx.quantifier().EX1() != null || ctx.quantifier().EX2() != null;
            boolean secondOrderVariables = ctx.quantifier().EX2() != null || ctx.quantifier().ALL2() != null;
            return quantify(names, 0, existential, secondOrderVariables, ctx);
        }

        private boolean quantify(List<String> names, int index, boolean existential,
                                 boolean secondOrderVariables, QuantifiedContext ctx) {
            if (index == names.size()) {
                return visit(ctx.formula());
            }

            String name = names.get(index);
            long domain = secondOrderVariables ? 1L << length : length;
            Integer previousPosition = firstOrder.get(name);
            Long previousSet = secondOrder.get(name);

            boolean result = !existential;
            for (long value = 0; value < domain; value++) {
                if (secondOrderVariables) {
                    secondOrder.put(name, value);
                } else {
                    firstOrder.put(name, (int) value);
                }
                boolean inner = quantify(names, index + 1, existential, secondOrderVariables, ctx);
                if (inner == existential) {
                    result = existential;
                    break;
                }
            }

            restore(firstOrder, name, previousPosition);
            restore(secondOrder, name, previousSet);
            return result;
        }

        private static <V> void restore(Map<String, V> bindings, String name, V previous) {
            if (previous == null) {
                bindings.remove(name);
            } else {
                bindings.put(name, previous);
            }
        }

        @Override
        public Boolean visitComparison(ComparisonContext ctx) {
            TermContext left = ctx.term(0);
            TermContext right = ctx.term(1);

            if (isSet(left) && isSet(right)) {
                boolean equal = secondOrder.get(left.getText()).equals(secondOrder.get(right.getText()));
                if (ctx.comparator().EQ() != null) return equal;
                if (ctx.comparator().NEQ() != null) return !equal;
                throw new IllegalArgumentException("Confronto non ammesso tra insiemi: " + ctx.getText());
            }

            int a = value(left);
            int b = value(right);
            if (ctx.comparator().EQ() != null) return a == b;
            if (ctx.comparator().NEQ() != null) return a != b;
            if (ctx.comparator().LT() != null) return a < b;
            if (ctx.comparator().LE() != null) return a <= b;
            if (ctx.comparator().GT() != null) return a > b;
            return a >= b;
        }

        @Override
        public Boolean visitMembership(MembershipContext ctx) {
            int position = value(ctx.term());
            Long set = secondOrder.get(ctx.IDENT().getText());
            if (set == null) {
                throw new IllegalArgumentException("Variabile del secondo ordine non vincolata: " + ctx.IDENT().getText());
            }
            return position >= 0 && position < length && (set & (1L << position)) != 0;
        }

        @Override
        public Boolean visitSubset(SubsetContext ctx) {
            Long subset = secondOrder.get(ctx.IDENT(0).getText());
            Long superset = secondOrder.get(ctx.IDENT(1).getText());
            if (subset == null || superset == null) {
                throw new IllegalArgumentException("Variabile del secondo ordine non vincolata: " + ctx.getText());
            }
            return (subset & ~superset) == 0;
        }

        @Override
        public Boolean visitTrue(TrueContext ctx) {
            return true;
        }

        @Override
        public Boolean visitFalse(FalseContext ctx) {
            return false;
        }

        @Override
        public Boolean visitGroup(GroupContext ctx) {
            return visit(ctx.formula());
        }

        private boolean isSet(TermContext term) {
            return term instanceof VariableContext && secondOrder.containsKey(term.getText())
                    && !firstOrder.containsKey(term.getText());
        }

        private int value(TermContext term) {
            if (term instanceof SuccessorContext) {
                SuccessorContext successor = (SuccessorContext) term;
                return value(successor.term()) + Integer.parseInt(successor.NUMBER().getText());
            }
            if (term instanceof ConstantContext) {
                return Integer.parseInt(term.getText());
            }
            if (term instanceof MaximumContext) {
                return length - 1;
            }
            Integer position = firstOrder.get(term.getText());
            if (position == null) {
                throw new IllegalArgumentException("Variabile del primo ordine non vincolata: " + term.getText());
            }
            return position;
        }
    }

    //endregion
}
