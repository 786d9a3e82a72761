package org.ltlf.solver;

import java.time.Duration;

/**
 * Risultato di una verifica: esito, testo prodotto dal verificatore e tempo impiegato.
 */
public final class MonaResult {

    private final MonaVerdict verdict;
    private final String output;
    private final Duration elapsed;

    public MonaResult(MonaVerdict verdict, String output, Duration elapsed) {
        if (verdict == null) {
            throw new IllegalArgumentException("Esito non può essere null");
        }
        this.verdict = verdict;
        this.output = output == null ? "" : output;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public MonaVerdict getVerdict() {
        return verdict;
    }

    public String getOutput() {
        return output;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    /** Valida o soddisfacibile */
    public boolean isSatisfiable() {
        return verdict != MonaVerdict.UNSATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return verdict == MonaVerdict.UNSATISFIABLE;
    }

    @Override
    public String toString() {
        return verdict + " (" + elapsed.toMillis() + " ms)";
    }
}
