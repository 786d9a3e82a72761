package org.ltlf.formula;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Rappresentazione immutabile di formule LTLf e PLTLf.
 *
 * Ogni nodo è identificato da tipo, simbolo (solo per ATOM) e lista ordinata di operandi.
 * Uguaglianza e hash sono strutturali: due formule costruite separatamente ma con la
 * stessa struttura sono uguali e possono essere usate come chiavi di mappe e insiemi.
 * L'hash è calcolato alla costruzione, la stringa canonica alla prima richiesta.
 *
 * Gli operatori binari sono n-ari: Until, Release, Since e Trigger si leggono annidati
 * a destra ({@code a U b U c = a U (b U c)}), l'implicazione annidata a sinistra,
 * l'equivalenza come uguaglianza di tutti gli operandi.
 */
public final class LtlfFormula {

    //region TIPI E STRUTTURA DATI

    /** Arità sintattica di un operatore */
    public enum Arity {
        LEAF,
        UNARY,
        NARY
    }

    /**
     * Tipi di nodo. Il simbolo è quello usato dalla forma canonica testuale.
     */
    public enum Type {
        ATOM("", Arity.LEAF),
        TRUE("true", Arity.LEAF),
        FALSE("false", Arity.LEAF),
        LAST("last", Arity.LEAF),       // ultima posizione della traccia
        END("end", Arity.LEAF),         // oltre la fine della traccia
        INIT("init", Arity.LEAF),       // prima posizione della traccia

        NOT("!", Arity.UNARY),
        NEXT("X", Arity.UNARY),
        WEAK_NEXT("WX", Arity.UNARY),
        EVENTUALLY("F", Arity.UNARY),
        ALWAYS("G", Arity.UNARY),
        BEFORE("Y", Arity.UNARY),
        WEAK_BEFORE("WY", Arity.UNARY),
        ONCE("O", Arity.UNARY),
        HISTORICALLY("H", Arity.UNARY),

        AND("&", Arity.NARY),
        OR("|", Arity.NARY),
        IMPLIES("->", Arity.NARY),
        EQUIVALENCE("<->", Arity.NARY),
        UNTIL("U", Arity.NARY),
        RELEASE("R", Arity.NARY),
        SINCE("S", Arity.NARY),
        TRIGGER("T", Arity.NARY);

        private final String symbol;
        private final Arity arity;

        Type(String symbol, Arity arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        public String symbol() {
            return symbol;
        }

        public Arity arity() {
            return arity;
        }

        public boolean isLeaf() {
            return arity == Arity.LEAF;
        }

        public boolean isUnary() {
            return arity == Arity.UNARY;
        }

        public boolean isNary() {
            return arity == Arity.NARY;
        }

        /**
         * Operatori del passato (PLTLf).
         */
        public boolean isPast() {
            return this == BEFORE || this == WEAK_BEFORE || this == ONCE
                    || this == HISTORICALLY || this == SINCE || this == TRIGGER;
        }
    }

    public static final LtlfFormula TRUE = new LtlfFormula(Type.TRUE, null, List.of());
    public static final LtlfFormula FALSE = new LtlfFormula(Type.FALSE, null, List.of());
    public static final LtlfFormula LAST = new LtlfFormula(Type.LAST, null, List.of());
    public static final LtlfFormula END = new LtlfFormula(Type.END, null, List.of());
    public static final LtlfFormula INIT = new LtlfFormula(Type.INIT, null, List.of());

    /** Tipo del nodo */
    public final Type type;

    /** Simbolo (solo per nodi ATOM, altrimenti null) */
    public final AtomSymbol atom;

    /** Operandi in ordine, lista non modificabile (vuota per le foglie) */
    public final List<LtlfFormula> operands;

    private final int hash;
    private volatile String text;

    private LtlfFormula(Type type, AtomSymbol atom, List<LtlfFormula> operands) {
        this.type = type;
        this.atom = atom;
        this.operands = operands;
        this.hash = computeHash(type, atom, operands);
    }

    private static int computeHash(Type type, AtomSymbol atom, List<LtlfFormula> operands) {
        int result = type.ordinal();
        if (atom != null) {
            result = 31 * result + atom.hashCode();
        }
        for (LtlfFormula operand : operands) {
            result = 31 * result + operand.hash;
        }
        return result;
    }

    //endregion

    //region FACTORY

    public static LtlfFormula atom(String name) {
        return new LtlfFormula(Type.ATOM, AtomSymbol.name(name), List.of());
    }

    public static LtlfFormula atom(AtomSymbol symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Simbolo atomico non può essere null");
        }
        return new LtlfFormula(Type.ATOM, symbol, List.of());
    }

    /**
     * Cita una formula come proposizione atomica.
     */
    public static LtlfFormula quoted(LtlfFormula formula) {
        return atom(AtomSymbol.quote(formula));
    }

    /**
     * Costruisce un nodo unario.
     *
     * @throws IllegalArgumentException se il tipo non è unario o l'operando è null
     */
    public static LtlfFormula unary(Type type, LtlfFormula operand) {
        if (type == null || !type.isUnary()) {
            throw new IllegalArgumentException("Tipo non unario: " + type);
        }
        if (operand == null) {
            throw new IllegalArgumentException("Operando di " + type + " non può essere null");
        }
        return new LtlfFormula(type, null, List.of(operand));
    }

    /**
     * Costruisce un nodo n-ario.
     *
     * @throws FormulaArityException se gli operandi sono meno di due
     * @throws IllegalArgumentException se il tipo non è n-ario o un operando è null
     */
    public static LtlfFormula nary(Type type, List<LtlfFormula> operands) {
        if (type == null || !type.isNary()) {
            throw new IllegalArgumentException("Tipo non n-ario: " + type);
        }
        if (operands == null || operands.size() < 2) {
            throw new FormulaArityException(type, operands == null ? 0 : operands.size());
        }
        for (LtlfFormula operand : operands) {
            if (operand == null) {
                throw new IllegalArgumentException("Lista operandi di " + type + " non può contenere null");
            }
        }
        return new LtlfFormula(type, null, List.copyOf(operands));
    }

    public static LtlfFormula not(LtlfFormula operand) {
        return unary(Type.NOT, operand);
    }

    public static LtlfFormula next(LtlfFormula operand) {
        return unary(Type.NEXT, operand);
    }

    public static LtlfFormula weakNext(LtlfFormula operand) {
        return unary(Type.WEAK_NEXT, operand);
    }

    public static LtlfFormula eventually(LtlfFormula operand) {
        return unary(Type.EVENTUALLY, operand);
    }

    public static LtlfFormula always(LtlfFormula operand) {
        return unary(Type.ALWAYS, operand);
    }

    public static LtlfFormula before(LtlfFormula operand) {
        return unary(Type.BEFORE, operand);
    }

    public static LtlfFormula weakBefore(LtlfFormula operand) {
        return unary(Type.WEAK_BEFORE, operand);
    }

    public static LtlfFormula once(LtlfFormula operand) {
        return unary(Type.ONCE, operand);
    }

    public static LtlfFormula historically(LtlfFormula operand) {
        return unary(Type.HISTORICALLY, operand);
    }

    public static LtlfFormula and(LtlfFormula... operands) {
        return nary(Type.AND, List.of(operands));
    }

    public static LtlfFormula and(List<LtlfFormula> operands) {
        return nary(Type.AND, operands);
    }

    public static LtlfFormula or(LtlfFormula... operands) {
        return nary(Type.OR, List.of(operands));
    }

    public static LtlfFormula or(List<LtlfFormula> operands) {
        return nary(Type.OR, operands);
    }

    public static LtlfFormula implies(LtlfFormula... operands) {
        return nary(Type.IMPLIES, List.of(operands));
    }

    public static LtlfFormula equivalence(LtlfFormula... operands) {
        return nary(Type.EQUIVALENCE, List.of(operands));
    }

    public static LtlfFormula until(LtlfFormula... operands) {
        return nary(Type.UNTIL, List.of(operands));
    }

    public static LtlfFormula release(LtlfFormula... operands) {
        return nary(Type.RELEASE, List.of(operands));
    }

    public static LtlfFormula since(LtlfFormula... operands) {
        return nary(Type.SINCE, List.of(operands));
    }

    public static LtlfFormula trigger(LtlfFormula... operands) {
        return nary(Type.TRIGGER, List.of(operands));
    }

    //endregion

    //region ACCESSO STRUTTURALE

    /**
     * Vero per le foglie: atomi, costanti e marcatori di posizione.
     */
    public boolean isAtomic() {
        return type.isLeaf();
    }

    /**
     * Unico operando di un nodo unario.
     */
    public LtlfFormula operand() {
        if (!type.isUnary()) {
            throw new IllegalStateException("operand() richiede un nodo unario, trovato " + type);
        }
        return operands.get(0);
    }

    /**
     * Primo operando di un nodo n-ario.
     */
    public LtlfFormula first() {
        requireNary();
        return operands.get(0);
    }

    /**
     * Coda dell'annidamento a destra: per {@code a U b U c} restituisce {@code b U c},
     * per due soli operandi il secondo operando.
     */
    public LtlfFormula rest() {
        requireNary();
        if (operands.size() == 2) {
            return operands.get(1);
        }
        return new LtlfFormula(type, null, List.copyOf(operands.subList(1, operands.size())));
    }

    /**
     * Premessa dell'annidamento a sinistra: per {@code a -> b -> c} restituisce
     * {@code a -> b}, per due soli operandi il primo operando.
     */
    public LtlfFormula premise() {
        requireNary();
        int size = operands.size();
        if (size == 2) {
            return operands.get(0);
        }
        return new LtlfFormula(type, null, List.copyOf(operands.subList(0, size - 1)));
    }

    /**
     * Ultimo operando di un nodo n-ario.
     */
    public LtlfFormula lastOperand() {
        requireNary();
        return operands.get(operands.size() - 1);
    }

    private void requireNary() {
        if (!type.isNary()) {
            throw new IllegalStateException("Operazione valida solo per nodi n-ari, trovato " + type);
        }
    }

    //endregion

    //region TRASFORMAZIONI

    /**
     * Forma normale negata: le negazioni compaiono solo davanti a foglie,
     * implicazioni ed equivalenze sono eliminate, F e G riscritti in U e R.
     */
    public LtlfFormula toNnf() {
        return NegationNormalForm.toNnf(this);
    }

    /**
     * Negazione con propagazione verso le foglie tramite i duali.
     * La negazione di {@code !(f)} è direttamente {@code f}.
     */
    public LtlfFormula negate() {
        return NegationNormalForm.negate(this);
    }

    /**
     * Verifica che ogni negazione sia applicata a una foglia.
     */
    public boolean isInNnf() {
        Deque<LtlfFormula> pending = new ArrayDeque<>();
        Set<LtlfFormula> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        pending.push(this);
        while (!pending.isEmpty()) {
            LtlfFormula current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (current.type == Type.NOT && !current.operand().isAtomic()) {
                return false;
            }
            current.operands.forEach(pending::push);
        }
        return true;
    }

    /**
     * Simboli atomici che compaiono nella formula, nell'ordine di prima occorrenza
     * da sinistra. Costanti e marcatori di posizione non sono etichette.
     */
    public Set<AtomSymbol> findLabels() {
        Set<AtomSymbol> labels = new LinkedHashSet<>();
        Set<LtlfFormula> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<LtlfFormula> pending = new ArrayDeque<>();
        pending.push(this);

        while (!pending.isEmpty()) {
            LtlfFormula current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (current.type == Type.ATOM) {
                labels.add(current.atom);
            }
            for (int i = current.operands.size() - 1; i >= 0; i--) {
                pending.push(current.operands.get(i));
            }
        }
        return Collections.unmodifiableSet(labels);
    }

    /**
     * Numero di nodi dell'albero (le occorrenze condivise contano ogni volta).
     */
    public long size() {
        FormulaWalker.Expander<LtlfFormula, Long> counter = node -> FormulaWalker.Step.of(node.operands,
                sizes -> 1L + sizes.stream().mapToLong(Long::longValue).sum());
        return FormulaWalker.walkShared(this, counter);
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LtlfFormula)) return false;

        Deque<LtlfFormula[]> pending = new ArrayDeque<>();
        pending.push(new LtlfFormula[]{this, (LtlfFormula) obj});

        while (!pending.isEmpty()) {
            LtlfFormula[] pair = pending.pop();
            LtlfFormula left = pair[0];
            LtlfFormula right = pair[1];
            if (left == right) {
                continue;
            }
            if (left.hash != right.hash || left.type != right.type
                    || left.operands.size() != right.operands.size()) {
                return false;
            }
            if (left.type == Type.ATOM && !left.atom.equals(right.atom)) {
                return false;
            }
            for (int i = 0; i < left.operands.size(); i++) {
                pending.push(new LtlfFormula[]{left.operands.get(i), right.operands.get(i)});
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Forma canonica: {@code X(a)}, {@code !(a)}, {@code (a & b)}, {@code (a U b U c)}.
     * Il risultato è riletto da {@link LtlfFormulaParser} nella stessa formula.
     */
    @Override
    public String toString() {
        String cached = text;
        if (cached == null) {
            cached = FormulaWalker.walk(this, LtlfFormula::render);
            text = cached;
        }
        return cached;
    }

    private static FormulaWalker.Step<LtlfFormula, String> render(LtlfFormula node) {
        if (node.text != null) {
            return FormulaWalker.Step.leaf(node.text);
        }
        return switch (node.type.arity()) {
            case LEAF -> FormulaWalker.Step.leaf(node.type == Type.ATOM ? node.atom.toString() : node.type.symbol());
            case UNARY -> FormulaWalker.Step.single(node.operand(), inner -> node.type.symbol() + "(" + inner + ")");
            case NARY -> FormulaWalker.Step.of(node.operands, parts -> {
                StringJoiner joiner = new StringJoiner(" " + node.type.symbol() + " ", "(", ")");
                parts.forEach(joiner::add);
                return joiner.toString();
            });
        };
    }

    //endregion
}
