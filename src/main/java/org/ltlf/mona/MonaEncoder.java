package org.ltlf.mona;

import org.ltlf.formula.FormulaWalker;
import org.ltlf.formula.FormulaWalker.Step;
import org.ltlf.formula.LtlfFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * CODIFICATORE MONA - Traduzione di formule LTLf/PLTLf in formule M2L-Str
 *
 * La formula viene valutata in una posizione {@code v} della traccia: ogni proposizione
 * {@code p} diventa la variabile del secondo ordine {@code P} assegnata da
 * {@link MonaSymbolTable} e l'atomo l'appartenenza {@code (v in P)}. Gli operatori
 * temporali introducono quantificatori del primo ordine sulle variabili
 * {@code v_1, v_2, ...} generate da {@link VariableNames}.
 *
 * MODALITÀ:
 * - DIRECT: codifica classica
 * - PRIMED: codifica shifted usata per l'equivalenza forte, legge le copie primate
 *   {@code P_p} delle proposizioni; negazione, implicazione ed equivalenza combinano
 *   la codifica primata con quella diretta
 *
 * La traduzione usa uno stack esplicito: la profondità della formula non è limitata
 * dallo stack delle chiamate.
 */
public final class MonaEncoder {

    /** Modalità di lettura delle proposizioni */
    public enum Valuation {
        DIRECT,
        PRIMED
    }

    private record Task(LtlfFormula formula, Position position, Valuation valuation) {
    }

    private MonaEncoder() {
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Codifica diretta nella prima posizione.
     */
    public static String encode(LtlfFormula formula) {
        return encode(formula, Position.INITIAL);
    }

    public static String encode(LtlfFormula formula, Position position) {
        return encode(formula, position, MonaSymbolTable.of(formula));
    }

    /**
     * Codifica diretta con i nomi di una tabella condivisa con altre formule.
     */
    public static String encode(LtlfFormula formula, Position position, MonaSymbolTable symbols) {
        return FormulaWalker.walk(new Task(formula, position, Valuation.DIRECT), task -> expand(task, symbols));
    }

    /**
     * Codifica primata nella prima posizione.
     */
    public static String encodePrimed(LtlfFormula formula) {
        return encodePrimed(formula, Position.INITIAL);
    }

    public static String encodePrimed(LtlfFormula formula, Position position) {
        return encodePrimed(formula, position, MonaSymbolTable.of(formula));
    }

    public static String encodePrimed(LtlfFormula formula, Position position, MonaSymbolTable symbols) {
        return FormulaWalker.walk(new Task(formula, position, Valuation.PRIMED), task -> expand(task, symbols));
    }

    //endregion

    private static Step<Task, String> expand(Task task, MonaSymbolTable symbols) {
        LtlfFormula f = task.formula();
        Position v = task.position();
        Valuation mode = task.valuation();

        return switch (f.type) {
            case ATOM -> Step.leaf("(" + v + " in " + (mode == Valuation.PRIMED
                    ? symbols.primedName(f.atom) : symbols.name(f.atom)) + ")");
            case TRUE -> Step.leaf("true");
            case FALSE -> Step.leaf("false");
            case LAST -> Step.leaf("(" + v + " = max($))");
            case INIT -> Step.leaf("(" + v + " = 0)");
            case END -> {
                Position a = VariableNames.next(v);
                yield Step.leaf("(all1 " + a + ": " + v + "<=" + a + "&" + a + "<=max($) => false)");
            }

            case NOT -> mode == Valuation.DIRECT
                    ? Step.single(new Task(f.operand(), v, mode), inner -> "~(" + inner + ")")
                    : Step.of(List.of(new Task(f.operand(), v, Valuation.PRIMED), new Task(f.operand(), v, Valuation.DIRECT)),
                        parts -> "(~" + parts.get(0) + " & ~" + parts.get(1) + ")");
            case AND -> Step.of(tasks(f.operands, v, mode), parts -> join(parts, " & "));
            case OR -> Step.of(tasks(f.operands, v, mode), parts -> join(parts, " | "));
            case IMPLIES -> connective(f, v, mode, MonaEncoder::implicationChain);
            case EQUIVALENCE -> connective(f, v, mode, MonaEncoder::equivalenceChain);

            case NEXT -> Step.single(new Task(f.operand(), VariableNames.next(v), mode), inner -> next(v, inner));
            case WEAK_NEXT -> Step.single(new Task(f.operand(), VariableNames.next(v), mode),
                    inner -> "((" + v + " = max($)) | " + next(v, inner) + ")");
            case UNTIL -> {
                Position e = VariableNames.next(v);
                Position a = VariableNames.next(e);
                yield Step.of(List.of(new Task(f.rest(), e, mode), new Task(f.first(), a, mode)),
                        parts -> "(ex1 " + e + ": " + v + "<=" + e + "&" + e + "<=max($) & " + parts.get(0)
                                + " & (all1 " + a + ": " + v + "<=" + a + "&" + a + "<" + e + " => " + parts.get(1) + "))");
            }
            case RELEASE -> {
                Position a = VariableNames.next(v);
                Position e = VariableNames.next(a);
                yield Step.of(List.of(new Task(f.rest(), a, mode), new Task(f.first(), e, mode)),
                        parts -> "(all1 " + a + ": (" + v + "<=" + a + "&" + a + "<=max($)) => (" + parts.get(0)
                                + " | (ex1 " + e + ": " + v + "<=" + e + "&" + e + "<" + a + " & " + parts.get(1) + ")))");
            }
            case EVENTUALLY -> {
                Position e = VariableNames.next(v);
                yield Step.single(new Task(f.operand(), e, mode),
                        inner -> "(ex1 " + e + ": " + v + "<=" + e + "&" + e + "<=max($) & " + inner + ")");
            }
            case ALWAYS -> {
                Position a = VariableNames.next(v);
                yield Step.single(new Task(f.operand(), a, mode),
                        inner -> "(all1 " + a + ": " + v + "<=" + a + "&" + a + "<=max($) => " + inner + ")");
            }

            case BEFORE -> v.isInitial()
                    ? Step.leaf("false")
                    : Step.single(new Task(f.operand(), VariableNames.next(v), mode), inner -> before(v, inner));
            case WEAK_BEFORE -> v.isInitial()
                    ? Step.leaf("true")
                    : Step.single(new Task(f.operand(), VariableNames.next(v), mode),
                        inner -> "((" + v + " = 0) | " + before(v, inner) + ")");
            case SINCE -> {
                if (v.isInitial()) {
                    yield Step.single(new Task(f.rest(), v, mode), inner -> inner);
                }
                Position e = VariableNames.next(v);
                Position a = VariableNames.next(e);
                yield Step.of(List.of(new Task(f.rest(), e, mode), new Task(f.first(), a, mode)),
                        parts -> "(ex1 " + e + ": 0<=" + e + "&" + e + "<=" + v + " & " + parts.get(0)
                                + " & (all1 " + a + ": " + e + "<" + a + "&" + a + "<=" + v + " => " + parts.get(1) + "))");
            }
            case TRIGGER -> {
                if (v.isInitial()) {
                    yield Step.single(new Task(f.rest(), v, mode), inner -> inner);
                }
                Position e = VariableNames.next(v);
                Position a = VariableNames.next(e);
                yield Step.of(List.of(new Task(f.rest(), e, mode), new Task(f.first(), a, mode)),
                        parts -> "(all1 " + e + ": 0<=" + e + "&" + e + "<=" + v + " => (" + parts.get(0)
                                + " | (ex1 " + a + ": " + e + "<" + a + "&" + a + "<=" + v + " & " + parts.get(1) + ")))");
            }
            case ONCE -> {
                if (v.isInitial()) {
                    yield Step.single(new Task(f.operand(), v, mode), inner -> inner);
                }
                Position e = VariableNames.next(v);
                yield Step.single(new Task(f.operand(), e, mode),
                        inner -> "(ex1 " + e + ": 0<=" + e + "&" + e + "<=" + v + " & " + inner + ")");
            }
            case HISTORICALLY -> {
                if (v.isInitial()) {
                    yield Step.single(new Task(f.operand(), v, mode), inner -> inner);
                }
                Position a = VariableNames.next(v);
                yield Step.single(new Task(f.operand(), a, mode),
                        inner -> "(all1 " + a + ": 0<=" + a + "&" + a + "<=" + v + " => " + inner + ")");
            }
        };
    }

    //region SUPPORTO

    /**
     * Implicazione ed equivalenza: nella modalità primata la catena diretta
     * e quella primata sono richieste entrambe.
     */
    private static Step<Task, String> connective(LtlfFormula f, Position v, Valuation mode,
                                                 Function<List<String>, String> chain) {
        if (mode == Valuation.DIRECT) {
            return Step.of(tasks(f.operands, v, Valuation.DIRECT), chain);
        }
        int n = f.operands.size();
        List<Task> children = new ArrayList<>(tasks(f.operands, v, Valuation.DIRECT));
        children.addAll(tasks(f.operands, v, Valuation.PRIMED));
        return Step.of(children, parts -> "(" + chain.apply(parts.subList(0, n))
                + " & " + chain.apply(parts.subList(n, 2 * n)) + ")");
    }

    /** {@code a -> b -> c} letto come {@code ((a => b) => c)} */
    private static String implicationChain(List<String> parts) {
        String result = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            result = "(" + result + " => " + parts.get(i) + ")";
        }
        return result;
    }

    /** Equivalenza n-aria come congiunzione di equivalenze tra operandi consecutivi */
    private static String equivalenceChain(List<String> parts) {
        if (parts.size() == 2) {
            return "(" + parts.get(0) + " <=> " + parts.get(1) + ")";
        }
        List<String> pairs = new ArrayList<>(parts.size() - 1);
        for (int i = 0; i + 1 < parts.size(); i++) {
            pairs.add("(" + parts.get(i) + " <=> " + parts.get(i + 1) + ")");
        }
        return join(pairs, " & ");
    }

    private static String next(Position v, String inner) {
        Position e = VariableNames.next(v);
        String successor = v.isInitial() ? "1" : v + "+1";
        return "(ex1 " + e + ": " + e + "=" + successor + " & " + inner + ")";
    }

    /**
     * Posizione precedente espressa come {@code e+1=v}: nessuna sottrazione,
     * che in MONA è troncata a zero.
     */
    private static String before(Position v, String inner) {
        Position e = VariableNames.next(v);
        if (v.isLast()) {
            return "(ex1 " + e + ": " + e + "+1=max($) & max($)>0 & " + inner + ")";
        }
        return "(ex1 " + e + ": " + e + "+1=" + v + " & " + inner + ")";
    }

    private static String join(List<String> parts, String separator) {
        StringJoiner joiner = new StringJoiner(separator, "(", ")");
        parts.forEach(joiner::add);
        return joiner.toString();
    }

    private static List<Task> tasks(List<LtlfFormula> operands, Position v, Valuation mode) {
        List<Task> result = new ArrayList<>(operands.size());
        for (LtlfFormula operand : operands) {
            result.add(new Task(operand, v, mode));
        }
        return result;
    }

    //endregion
}
