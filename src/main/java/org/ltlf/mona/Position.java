package org.ltlf.mona;

import java.util.Objects;

/**
 * Posizione di valutazione nella traccia: la prima posizione {@code 0},
 * l'ultima {@code max($)} oppure una variabile del primo ordine.
 */
public final class Position {

    public enum Kind {
        INITIAL,
        LAST,
        VARIABLE
    }

    public static final Position INITIAL = new Position(Kind.INITIAL, "0");
    public static final Position LAST = new Position(Kind.LAST, "max($)");

    private final Kind kind;
    private final String text;

    private Position(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    /**
     * Variabile del primo ordine con il nome indicato.
     */
    public static Position variable(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome di variabile non può essere null o vuoto");
        }
        return new Position(Kind.VARIABLE, name);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isInitial() {
        return kind == Kind.INITIAL;
    }

    public boolean isLast() {
        return kind == Kind.LAST;
    }

    public boolean isVariable() {
        return kind == Kind.VARIABLE;
    }

    /** Testo MONA della posizione */
    public String text() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Position)) return false;
        Position other = (Position) obj;
        return kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
