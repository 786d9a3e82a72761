package org.ltlf.mona;

/**
 * Generatore dei nomi delle variabili vincolate del primo ordine.
 *
 * Il nome successivo dipende solo dalla posizione corrente:
 * da {@code 0} o {@code max($)} si ottiene {@code v_1}, da {@code v_k} si ottiene {@code v_(k+1)}.
 * Ogni quantificatore annidato usa quindi un nome diverso da quelli che lo racchiudono.
 */
public final class VariableNames {

    public static final String PREFIX = "v_";

    private VariableNames() {
    }

    /**
     * @throws EncodingException se la posizione è una variabile fuori dallo schema {@code v_k}
     */
    public static Position next(Position current) {
        if (!current.isVariable()) {
            return Position.variable(PREFIX + 1);
        }

        String name = current.text();
        if (!name.startsWith(PREFIX)) {
            throw new EncodingException("Impossibile derivare la variabile successiva da: " + name);
        }
        try {
            int index = Integer.parseInt(name.substring(PREFIX.length()));
            return Position.variable(PREFIX + (index + 1));
        } catch (NumberFormatException e) {
            throw new EncodingException("Indice non numerico nella variabile: " + name, e);
        }
    }
}
