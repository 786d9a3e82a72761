package org.ltlf.formula;

import java.util.regex.Pattern;

/**
 * Simbolo atomico di una formula LTLf.
 *
 * Un simbolo può essere:
 * • NAME: nome di proposizione (caratteri di parola oppure stringa tra virgolette)
 * • QUOTED: formula "citata", usata a sua volta come simbolo atomico
 * • FRESH: variabile sintetica introdotta dalla clausificazione di Tseitin
 *
 * Per i simboli QUOTED la rappresentazione testuale è calcolata una sola volta
 * al momento della citazione, mentre uguaglianza e hash delegano alla formula
 * citata e non alla stringa in cache.
 */
public final class AtomSymbol implements Comparable<AtomSymbol> {

    /** Convenzione di naming per le proposizioni */
    private static final Pattern NAME_PATTERN = Pattern.compile("(\\w+)|(\".*\")");

    public enum Kind {
        NAME,
        QUOTED,
        FRESH
    }

    private final Kind kind;
    private final String text;
    private final LtlfFormula quoted;

    private AtomSymbol(Kind kind, String text, LtlfFormula quoted) {
        this.kind = kind;
        this.text = text;
        this.quoted = quoted;
    }

    //region FACTORY

    /**
     * Crea un simbolo da un nome di proposizione.
     *
     * @param name nome conforme a {@code (\w+)|(".*")}
     * @throws FormulaNamingException se il nome non rispetta la convenzione
     */
    public static AtomSymbol name(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new FormulaNamingException(name);
        }
        return new AtomSymbol(Kind.NAME, name, null);
    }

    /**
     * Cita una formula per usarla come simbolo atomico.
     */
    public static AtomSymbol quote(LtlfFormula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da citare non può essere null");
        }
        return new AtomSymbol(Kind.QUOTED, "\"" + formula + "\"", formula);
    }

    /**
     * Variabile fresca della clausificazione: {@code prefix + index}.
     */
    public static AtomSymbol fresh(String prefix, int index) {
        String name = prefix + index;
        if (index < 0 || !NAME_PATTERN.matcher(name).matches()) {
            throw new FormulaNamingException(name);
        }
        return new AtomSymbol(Kind.FRESH, name, null);
    }

    //endregion

    public Kind kind() {
        return kind;
    }

    /**
     * Formula citata (solo per simboli QUOTED, altrimenti null).
     */
    public LtlfFormula quotedFormula() {
        return quoted;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AtomSymbol)) return false;

        AtomSymbol other = (AtomSymbol) obj;
        if (kind != other.kind) return false;
        return kind == Kind.QUOTED ? quoted.equals(other.quoted) : text.equals(other.text);
    }

    @Override
    public int hashCode() {
        int result = kind.ordinal();
        return 31 * result + (kind == Kind.QUOTED ? quoted.hashCode() : text.hashCode());
    }

    @Override
    public int compareTo(AtomSymbol other) {
        int byText = text.compareTo(other.text);
        return byText != 0 ? byText : kind.compareTo(other.kind);
    }

    @Override
    public String toString() {
        return text;
    }
}
