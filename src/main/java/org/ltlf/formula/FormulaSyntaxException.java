package org.ltlf.formula;

/**
 * Errore sintattico rilevato durante il parsing di un testo (formula LTLf o programma MONA).
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public FormulaSyntaxException(int line, int column, String message) {
        super("Errore di sintassi alla riga " + line + ", colonna " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
