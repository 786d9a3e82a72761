package org.ltlf.formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Visita post-order con stack esplicito.
 *
 * Ogni compito {@code T} viene espanso in un {@link Step}: la lista dei compiti figli
 * da risolvere e la funzione che combina i loro risultati. La visita non usa la
 * ricorsione del linguaggio, quindi la profondità delle formule è limitata solo
 * dalla memoria disponibile.
 *
 * Con {@link #walkShared} i risultati vengono memorizzati per compito, così un
 * sottotermine condiviso (DAG) viene elaborato una volta sola.
 *
 * @param <T> tipo del compito (formula più eventuale contesto)
 * @param <R> tipo del risultato
 */
public final class FormulaWalker<T, R> {

    /**
     * Strategia di espansione di un compito.
     */
    @FunctionalInterface
    public interface Expander<T, R> {
        Step<T, R> expand(T task);
    }

    /**
     * Passo di espansione: figli da visitare e combinatore dei loro risultati.
     */
    public static final class Step<T, R> {

        private final List<T> children;
        private final Function<List<R>, R> combiner;

        private Step(List<T> children, Function<List<R>, R> combiner) {
            this.children = children;
            this.combiner = combiner;
        }

        /** Passo senza figli con risultato già noto */
        public static <T, R> Step<T, R> leaf(R value) {
            return new Step<>(List.of(), results -> value);
        }

        /** Passo con un solo figlio */
        public static <T, R> Step<T, R> single(T child, Function<R, R> combiner) {
            return new Step<>(List.of(child), results -> combiner.apply(results.get(0)));
        }

        /** Passo con più figli, risultati passati nello stesso ordine */
        public static <T, R> Step<T, R> of(List<T> children, Function<List<R>, R> combiner) {
            return new Step<>(List.copyOf(children), combiner);
        }
    }

    /** Stato di un compito sullo stack */
    private static final class Frame<T, R> {
        final T task;
        final Step<T, R> step;
        final List<R> results;
        int next;

        Frame(T task, Step<T, R> step) {
            this.task = task;
            this.step = step;
            this.results = new ArrayList<>(step.children.size());
        }
    }

    private final Expander<T, R> expander;
    private final Map<T, R> memo;

    private FormulaWalker(Expander<T, R> expander, boolean shared) {
        this.expander = expander;
        this.memo = shared ? new HashMap<>() : null;
    }

    /**
     * Visita senza memorizzazione dei risultati intermedi.
     */
    public static <T, R> R walk(T root, Expander<T, R> expander) {
        return new FormulaWalker<>(expander, false).run(root);
    }

    /**
     * Visita con memorizzazione per compito: i compiti uguali vengono risolti una volta.
     */
    public static <T, R> R walkShared(T root, Expander<T, R> expander) {
        return new FormulaWalker<>(expander, true).run(root);
    }

    private R run(T root) {
        Deque<Frame<T, R>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(root, expander.expand(root)));
        R result = null;

        while (!stack.isEmpty()) {
            Frame<T, R> frame = stack.peek();

            if (frame.next < frame.step.children.size()) {
                T child = frame.step.children.get(frame.next++);
                R cached = memo != null ? memo.get(child) : null;
                if (cached != null) {
                    frame.results.add(cached);
                } else {
                    stack.push(new Frame<>(child, expander.expand(child)));
                }
                continue;
            }

            stack.pop();
            R value = frame.step.combiner.apply(frame.results);
            if (memo != null) {
                memo.put(frame.task, value);
            }

            if (stack.isEmpty()) {
                result = value;
            } else {
                stack.peek().results.add(value);
            }
        }
        return result;
    }
}
