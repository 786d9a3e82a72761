package org.ltlf.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Listener ANTLR che trasforma il primo errore di lexing o parsing in
 * {@link FormulaSyntaxException}, invece di stampare su stderr e recuperare.
 */
public final class SyntaxErrorListener extends BaseErrorListener {

    public static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    private SyntaxErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        throw new FormulaSyntaxException(line, charPositionInLine, msg);
    }
}
