package org.ltlf.mona;

import org.ltlf.formula.LtlfFormula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Programma MONA completo: commento con la formula sorgente, intestazione
 * {@code m2l-str;}, dichiarazione delle variabili libere del secondo ordine e corpo.
 *
 * <pre>
 * #(a U b);
 * m2l-str;
 * var2 A, B;
 * (ex1 v_1: 0&lt;=v_1&amp;v_1&lt;=max($) &amp; ...);
 * </pre>
 *
 * La riga {@code var2} è omessa quando la formula non contiene proposizioni.
 */
public final class MonaProgram {

    private static final Logger LOGGER = Logger.getLogger(MonaProgram.class.getName());

    public static final String HEADER = "m2l-str";

    private final String comment;
    private final SortedSet<String> variables;
    private final String body;

    MonaProgram(String comment, Collection<String> variables, String body) {
        this.comment = comment;
        this.variables = Collections.unmodifiableSortedSet(new TreeSet<>(variables));
        this.body = body;
    }

    //region FACTORY

    /**
     * Programma che verifica la formula nella prima posizione.
     */
    public static MonaProgram of(LtlfFormula formula) {
        return of(formula, Position.INITIAL);
    }

    /**
     * Programma che verifica la formula nella posizione indicata
     * (tipicamente {@link Position#LAST} per formule del passato).
     */
    public static MonaProgram of(LtlfFormula formula, Position position) {
        MonaSymbolTable symbols = MonaSymbolTable.of(formula);
        MonaProgram program = new MonaProgram(formula.toString(), symbols.names(),
                MonaEncoder.encode(formula, position, symbols));
        LOGGER.fine(() -> "Programma MONA generato con " + program.variables.size() + " variabili");
        return program;
    }

    /**
     * Programma dei modelli stabili: i modelli della formula per cui nessuna
     * valutazione primata strettamente più piccola soddisfa la codifica shifted.
     */
    public static MonaProgram stableModels(LtlfFormula formula) {
        MonaSymbolTable symbols = MonaSymbolTable.of(formula);
        SortedSet<String> names = symbols.names();
        String direct = MonaEncoder.encode(formula, Position.INITIAL, symbols);
        if (names.isEmpty()) {
            return new MonaProgram(formula.toString(), names, direct);
        }

        String body = direct + " & ~(ex2 " + primedList(names) + ": "
                + primeConstraint(names) + " & " + strictlySmaller(names) + " & "
                + MonaEncoder.encodePrimed(formula, Position.INITIAL, symbols) + ")";
        return new MonaProgram(formula.toString(), names, body);
    }

    //endregion

    //region ACCESSO

    public String comment() {
        return comment;
    }

    /** Variabili libere del secondo ordine, in ordine alfabetico */
    public SortedSet<String> variables() {
        return variables;
    }

    public String body() {
        return body;
    }

    /**
     * Testo completo del programma.
     */
    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        text.append('#').append(comment).append(";\n");
        text.append(HEADER).append(";\n");
        if (!variables.isEmpty()) {
            text.append("var2 ").append(String.join(", ", variables)).append(";\n");
        }
        text.append(body).append(";\n");
        return text.toString();
    }

    //endregion

    //region SUPPORTO CONDIVISO

    /** {@code A_p, B_p} */
    static String primedList(Collection<String> names) {
        StringJoiner joiner = new StringJoiner(", ");
        names.forEach(name -> joiner.add(MonaSymbolTable.primed(name)));
        return joiner.toString();
    }

    /** {@code A, A_p, B, B_p} */
    static List<String> withPrimes(Collection<String> names) {
        List<String> result = new ArrayList<>(names.size() * 2);
        for (String name : names) {
            result.add(name);
            result.add(MonaSymbolTable.primed(name));
        }
        return result;
    }

    /** {@code ((A_p sub A) & (B_p sub B))} */
    static String primeConstraint(Collection<String> names) {
        StringJoiner joiner = new StringJoiner(" & ", "(", ")");
        names.forEach(name -> joiner.add("(" + MonaSymbolTable.primed(name) + " sub " + name + ")"));
        return joiner.toString();
    }

    /** {@code ((A_p ~= A) | (B_p ~= B))} */
    private static String strictlySmaller(Collection<String> names) {
        StringJoiner joiner = new StringJoiner(" | ", "(", ")");
        names.forEach(name -> joiner.add("(" + MonaSymbolTable.primed(name) + " ~= " + name + ")"));
        return joiner.toString();
    }

    //endregion
}
