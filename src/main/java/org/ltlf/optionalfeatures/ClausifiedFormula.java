package org.ltlf.optionalfeatures;

import org.ltlf.formula.LtlfFormula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Risultato della clausificazione: vincoli globali {@code G(t <-> ...)},
 * letterale radice e variabili fresche introdotte.
 *
 * La formula complessiva {@link #toFormula()} è equisoddisfacibile con la sorgente.
 */
public final class ClausifiedFormula {

    private final LtlfFormula source;
    private final LtlfFormula root;
    private final Set<LtlfFormula> constraints;
    private final List<LtlfFormula> freshVariables;

    ClausifiedFormula(LtlfFormula source, LtlfFormula root, Set<LtlfFormula> constraints,
                      List<LtlfFormula> freshVariables) {
        this.source = source;
        this.root = root;
        this.constraints = Collections.unmodifiableSet(new LinkedHashSet<>(constraints));
        this.freshVariables = List.copyOf(freshVariables);
    }

    public LtlfFormula source() {
        return source;
    }

    /** Letterale che rappresenta la formula sorgente nella prima posizione */
    public LtlfFormula root() {
        return root;
    }

    /** Vincoli nell'ordine di generazione, senza duplicati */
    public Set<LtlfFormula> constraints() {
        return constraints;
    }

    /** Variabili fresche nell'ordine di allocazione */
    public List<LtlfFormula> freshVariables() {
        return freshVariables;
    }

    /**
     * Congiunzione dei vincoli e della radice; la sola radice se non ci sono vincoli.
     */
    public LtlfFormula toFormula() {
        if (constraints.isEmpty()) {
            return root;
        }
        List<LtlfFormula> conjuncts = new ArrayList<>(constraints);
        conjuncts.add(root);
        return LtlfFormula.and(conjuncts);
    }

    /**
     * Riepilogo testuale della conversione.
     */
    public String summary() {
        return "Clausificazione: " + freshVariables.size() + " variabili fresche, "
                + constraints.size() + " vincoli, radice " + root;
    }
}
