package org.ltlf.mona;

import org.ltlf.formula.LtlfFormula;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * EQUIVALENZA FORTE - Programma MONA insoddisfacibile se e solo se due formule
 * sono fortemente equivalenti.
 *
 * Due formule sono fortemente equivalenti quando coincidono sia nella codifica diretta
 * sia in quella primata, per ogni valutazione in cui ogni proposizione primata è
 * contenuta nella sua versione non primata ({@code X_p sub X}).
 *
 * Le due formule condividono una sola {@link MonaSymbolTable}, quindi la stessa
 * proposizione riceve lo stesso nome da entrambi i lati.
 *
 * Le proposizioni presenti in una sola delle due formule vengono quantificate
 * esistenzialmente dal lato che le contiene; le proposizioni condivise restano
 * libere e vengono dichiarate insieme alle loro copie primate.
 *
 * CASI SULLE SEGNATURE V1, V2:
 * - SAME: V1 = V2
 * - LEFT_SUBSET: V1 sottoinsieme proprio di V2
 * - RIGHT_SUBSET: V2 sottoinsieme proprio di V1
 * - OVERLAPPING: nessuna delle due contiene l'altra
 */
public final class EquivalenceProgram {

    private static final Logger LOGGER = Logger.getLogger(EquivalenceProgram.class.getName());

    public enum Signature {
        SAME,
        LEFT_SUBSET,
        RIGHT_SUBSET,
        OVERLAPPING
    }

    private final LtlfFormula left;
    private final LtlfFormula right;
    private final Signature signature;
    private final MonaProgram program;

    private EquivalenceProgram(LtlfFormula left, LtlfFormula right, Signature signature, MonaProgram program) {
        this.left = left;
        this.right = right;
        this.signature = signature;
        this.program = program;
    }

    /**
     * Costruisce il programma di equivalenza forte per la coppia di formule.
     */
    public static EquivalenceProgram of(LtlfFormula left, LtlfFormula right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Le formule da confrontare non possono essere null");
        }

        MonaSymbolTable symbols = MonaSymbolTable.of(left, right);
        SortedSet<String> leftNames = symbols.names(left);
        SortedSet<String> rightNames = symbols.names(right);
        Signature signature = classify(leftNames, rightNames);

        String e1 = MonaEncoder.encode(left, Position.INITIAL, symbols);
        String e2 = MonaEncoder.encode(right, Position.INITIAL, symbols);
        String s1 = MonaEncoder.encodePrimed(left, Position.INITIAL, symbols);
        String s2 = MonaEncoder.encodePrimed(right, Position.INITIAL, symbols);

        SortedSet<String> shared = new TreeSet<>(leftNames);
        shared.retainAll(rightNames);
        SortedSet<String> onlyLeft = difference(leftNames, rightNames);
        SortedSet<String> onlyRight = difference(rightNames, leftNames);

        String body = switch (signature) {
            case SAME -> leftNames.isEmpty()
                    ? "~(((" + e1 + ") <=> (" + e2 + ")) & ((" + s1 + ") <=> (" + s2 + ")))"
                    : "~(" + MonaProgram.primeConstraint(leftNames) + " => (((" + e1 + ") <=> (" + e2
                        + ")) & ((" + s1 + ") <=> (" + s2 + "))))";
            case LEFT_SUBSET -> "~(((" + e1 + ") <=> (" + hideDirect(onlyRight, e2) + ")) & (("
                    + guarded(leftNames, s1) + ") <=> (" + hidePrimed(onlyRight, guarded(rightNames, s2)) + ")))";
            case RIGHT_SUBSET -> "~(((" + hideDirect(onlyLeft, e1) + ") <=> (" + e2 + ")) & (("
                    + hidePrimed(onlyLeft, guarded(leftNames, s1)) + ") <=> (" + guarded(rightNames, s2) + ")))";
            case OVERLAPPING -> "~(((" + hideDirect(onlyLeft, e1) + ") <=> (" + hideDirect(onlyRight, e2)
                    + ")) & ((" + hidePrimed(onlyLeft, guarded(leftNames, s1)) + ") <=> ("
                    + hidePrimed(onlyRight, guarded(rightNames, s2)) + ")))";
        };

        String comment = left + " === " + right;
        MonaProgram program = new MonaProgram(comment, MonaProgram.withPrimes(shared), body);
        LOGGER.fine(() -> "Programma di equivalenza (" + signature + ") con " + shared.size() + " proposizioni condivise");
        return new EquivalenceProgram(left, right, signature, program);
    }

    public LtlfFormula left() {
        return left;
    }

    public LtlfFormula right() {
        return right;
    }

    public Signature signature() {
        return signature;
    }

    public MonaProgram toProgram() {
        return program;
    }

    @Override
    public String toString() {
        return program.toString();
    }

    //region SUPPORTO

    static Signature classify(SortedSet<String> leftNames, SortedSet<String> rightNames) {
        if (leftNames.equals(rightNames)) {
            return Signature.SAME;
        }
        if (rightNames.containsAll(leftNames)) {
            return Signature.LEFT_SUBSET;
        }
        if (leftNames.containsAll(rightNames)) {
            return Signature.RIGHT_SUBSET;
        }
        return Signature.OVERLAPPING;
    }

    private static SortedSet<String> difference(SortedSet<String> from, SortedSet<String> removed) {
        SortedSet<String> result = new TreeSet<>(from);
        result.removeAll(removed);
        return result;
    }

    /** Codifica primata sotto il vincolo {@code X_p sub X} (se ci sono proposizioni) */
    private static String guarded(Collection<String> names, String primedEncoding) {
        return names.isEmpty() ? primedEncoding : MonaProgram.primeConstraint(names) + " & " + primedEncoding;
    }

    /** {@code ex2 X: e} sulle sole proposizioni private */
    private static String hideDirect(Collection<String> hidden, String encoding) {
        return "ex2 " + String.join(", ", hidden) + ": " + encoding;
    }

    /** {@code ex2 X, X_p: (s)} sulle proposizioni private e le loro copie primate */
    private static String hidePrimed(Collection<String> hidden, String encoding) {
        return "ex2 " + String.join(", ", MonaProgram.withPrimes(hidden)) + ": (" + encoding + ")";
    }

    //endregion
}
