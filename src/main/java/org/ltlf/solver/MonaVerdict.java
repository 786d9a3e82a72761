package org.ltlf.solver;

/**
 * Esito di MONA su un programma.
 */
public enum MonaVerdict {
    VALID,          // vera in ogni interpretazione
    SATISFIABLE,    // vera in almeno una interpretazione
    UNSATISFIABLE   // falsa in ogni interpretazione
}
