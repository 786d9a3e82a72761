package org.ltlf.mona;

/**
 * Errore di codifica: la posizione corrente non permette di derivare
 * il nome della prossima variabile vincolata.
 */
public class EncodingException extends IllegalStateException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
