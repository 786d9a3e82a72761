package org.ltlf.optionalfeatures;

import org.ltlf.formula.AtomSymbol;
import org.ltlf.formula.LtlfFormula;
import org.ltlf.formula.LtlfFormula.Type;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * TRASFORMAZIONE DI TSEITIN TEMPORALE - Clausificazione equisoddisfacibile di formule LTLf
 *
 * Ogni sottoformula non atomica riceve una variabile fresca {@code t} e un vincolo globale
 * {@code G(t <-> op(figli))}, dove i figli sono sostituiti dai rispettivi letterali.
 * Gli operatori con punto fisso vengono srotolati di un passo:
 *
 * • {@code f1 U f2  ~  f2 | (f1 & X(self))}
 * • {@code f1 R f2  ~  f2 & (f1 | WX(self))}
 * • {@code F f  ~  f | X(self)},  {@code G f  ~  f & WX(self)}
 * • simmetricamente per S, T, O, H con Y e WY
 *
 * X e Y ricevono in più il vincolo sul bordo della traccia:
 * {@code G(last -> !t)} per X, {@code G(last -> t)} per WX,
 * {@code G(init -> !t)} per Y, {@code G(init -> t)} per WY.
 *
 * CONDIVISIONE:
 * • i nodi sono internati in una {@link FormulaArena}
 * • la variabile di un nodo è assegnata alla prima visita, prima dei figli, quindi
 *   il riferimento a X(self) si risolve sulla variabile già assegnata
 * • ogni sottoformula distinta produce i suoi vincoli una sola volta
 *
 * Lo stato vive in un'istanza creata per ogni conversione: chiamate concorrenti
 * non condividono nulla.
 */
public final class TseitinClausifier {

    private static final Logger LOGGER = Logger.getLogger(TseitinClausifier.class.getName());

    /** Prefisso base delle variabili fresche */
    static final String FRESH_PREFIX = "t";

    private static final int ENTER = 0;
    private static final int EXIT = 1;

    //region STATO CONVERSIONE

    private final LtlfFormula source;
    private final String prefix;
    private final FormulaArena arena = new FormulaArena();

    /** Variabile fresca per identificativo di nodo (null se non ancora assegnata) */
    private final List<LtlfFormula> variables = new ArrayList<>();

    private final Set<LtlfFormula> constraints = new LinkedHashSet<>();
    private final List<LtlfFormula> freshVariables = new ArrayList<>();

    //endregion

    private TseitinClausifier(LtlfFormula source) {
        this.source = source;
        this.prefix = choosePrefix(source);
    }

    /**
     * Clausifica la formula.
     *
     * @param formula formula LTLf o PLTLf
     * @return vincoli, radice e variabili fresche
     */
    public static ClausifiedFormula clausify(LtlfFormula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da clausificare non può essere null");
        }
        return new TseitinClausifier(formula).run();
    }

    private ClausifiedFormula run() {
        int rootId = arena.intern(source);

        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{rootId, ENTER});

        while (!stack.isEmpty()) {
            int[] frame = stack.pop();
            int id = frame[0];

            if (frame[1] == EXIT) {
                emit(id);
                continue;
            }
            if (isResolved(id)) {
                continue;
            }

            allocate(id);
            stack.push(new int[]{id, EXIT});
            int[] dependencies = dependencies(id);
            for (int i = dependencies.length - 1; i >= 0; i--) {
                if (!isResolved(dependencies[i])) {
                    stack.push(new int[]{dependencies[i], ENTER});
                }
            }
        }

        ClausifiedFormula result = new ClausifiedFormula(source, literal(rootId), constraints, freshVariables);
        LOGGER.fine(result::summary);
        return result;
    }

    //region VARIABILI FRESCHE

    /**
     * Prefisso che non collide con le etichette della formula: {@code t},
     * allungato con altre {@code t} finché esiste un'etichetta {@code prefisso + cifre}.
     * Il confronto ignora maiuscole e minuscole, come i nomi delle variabili MONA.
     */
    static String choosePrefix(LtlfFormula formula) {
        Set<String> labels = new LinkedHashSet<>();
        for (AtomSymbol label : formula.findLabels()) {
            labels.add(label.toString());
        }

        String candidate = FRESH_PREFIX;
        while (collides(candidate, labels)) {
            candidate = candidate + FRESH_PREFIX;
        }
        return candidate;
    }

    private static boolean collides(String candidate, Set<String> labels) {
        Pattern pattern = Pattern.compile(Pattern.quote(candidate) + "\\d+", Pattern.CASE_INSENSITIVE);
        for (String label : labels) {
            if (pattern.matcher(label).matches()) {
                return true;
            }
        }
        return false;
    }

    private void allocate(int id) {
        LtlfFormula variable = LtlfFormula.atom(AtomSymbol.fresh(prefix, freshVariables.size()));
        freshVariables.add(variable);
        while (variables.size() <= id) {
            variables.add(null);
        }
        variables.set(id, variable);
    }

    private boolean isResolved(int id) {
        return arena.formula(id).isAtomic() || (id < variables.size() && variables.get(id) != null);
    }

    /** Le foglie rappresentano sé stesse, gli altri nodi la loro variabile */
    private LtlfFormula literal(int id) {
        LtlfFormula formula = arena.formula(id);
        return formula.isAtomic() ? formula : variables.get(id);
    }

    //endregion

    //region DIPENDENZE E VINCOLI

    /**
     * Nodi da risolvere prima di emettere il vincolo: operandi, per gli operatori
     * binari primo operando e coda annidata, per i punti fissi il nodo di srotolamento.
     */
    private int[] dependencies(int id) {
        LtlfFormula formula = arena.formula(id);
        return switch (formula.type) {
            case UNTIL, EVENTUALLY -> withUnfolding(id, formula, Type.NEXT);
            case RELEASE, ALWAYS -> withUnfolding(id, formula, Type.WEAK_NEXT);
            case SINCE, ONCE -> withUnfolding(id, formula, Type.BEFORE);
            case TRIGGER, HISTORICALLY -> withUnfolding(id, formula, Type.WEAK_BEFORE);
            default -> arena.children(id);
        };
    }

    private int[] withUnfolding(int id, LtlfFormula formula, Type step) {
        int unfolding = arena.intern(LtlfFormula.unary(step, formula));
        if (formula.type.isUnary()) {
            return new int[]{arena.children(id)[0], unfolding};
        }
        return new int[]{arena.intern(formula.first()), arena.intern(formula.rest()), unfolding};
    }

    private void emit(int id) {
        LtlfFormula formula = arena.formula(id);
        LtlfFormula self = variables.get(id);
        int[] deps = dependencies(id);
        List<LtlfFormula> literals = new ArrayList<>(deps.length);
        for (int dep : deps) {
            literals.add(literal(dep));
        }

        LtlfFormula definition = switch (formula.type) {
            case UNTIL, SINCE -> LtlfFormula.or(literals.get(1), LtlfFormula.and(literals.get(0), literals.get(2)));
            case RELEASE, TRIGGER -> LtlfFormula.and(literals.get(1), LtlfFormula.or(literals.get(0), literals.get(2)));
            case EVENTUALLY, ONCE -> LtlfFormula.or(literals.get(0), literals.get(1));
            case ALWAYS, HISTORICALLY -> LtlfFormula.and(literals.get(0), literals.get(1));
            default -> formula.type.isUnary()
                    ? LtlfFormula.unary(formula.type, literals.get(0))
                    : LtlfFormula.nary(formula.type, literals);
        };
        constraints.add(LtlfFormula.always(LtlfFormula.equivalence(self, definition)));

        switch (formula.type) {
            case NEXT -> constraints.add(boundary(LtlfFormula.LAST, LtlfFormula.not(self)));
            case WEAK_NEXT -> constraints.add(boundary(LtlfFormula.LAST, self));
            case BEFORE -> constraints.add(boundary(LtlfFormula.INIT, LtlfFormula.not(self)));
            case WEAK_BEFORE -> constraints.add(boundary(LtlfFormula.INIT, self));
            default -> {
            }
        }
    }

    /** {@code G(marker -> value)} */
    private static LtlfFormula boundary(LtlfFormula marker, LtlfFormula value) {
        return LtlfFormula.always(LtlfFormula.implies(marker, value));
    }

    //endregion
}
