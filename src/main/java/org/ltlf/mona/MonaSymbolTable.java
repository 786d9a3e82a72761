package org.ltlf.mona;

import org.ltlf.formula.AtomSymbol;
import org.ltlf.formula.LtlfFormula;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * TABELLA DEI SIMBOLI - Nomi MONA delle proposizioni di un programma
 *
 * Ogni simbolo atomico distinto riceve un identificatore del secondo ordine valido
 * e diverso da tutti gli altri dello stesso programma.
 *
 * COSTRUZIONE DEL NOME:
 * - testo del simbolo in maiuscolo
 * - ogni sequenza di caratteri diversi da lettere, cifre e '_' diventa '_'
 *   ('_' iniziali e finali rimossi)
 * - prefisso {@code Q} se il risultato è vuoto o non inizia con una lettera
 * - suffisso {@code _1, _2, ...} se il nome è già assegnato
 *
 * I simboli sono elaborati nel loro ordine naturale, quindi la tabella non dipende
 * dalla forma della formula. Gli identificatori non contengono minuscole: non
 * possono coincidere con parole chiave MONA, con le variabili {@code v_k} né con
 * le copie primate {@code X_p}.
 */
public final class MonaSymbolTable {

    private static final Logger LOGGER = Logger.getLogger(MonaSymbolTable.class.getName());

    /** Suffisso della copia primata di una variabile del secondo ordine */
    public static final String PRIME_SUFFIX = "_p";

    private static final Pattern ILLEGAL_CHARACTERS = Pattern.compile("[^A-Z0-9_]+");
    private static final Pattern BORDER_UNDERSCORES = Pattern.compile("^_+|_+$");
    private static final String INVALID_START_PREFIX = "Q";

    private final Map<AtomSymbol, String> names;

    private MonaSymbolTable(Map<AtomSymbol, String> names) {
        this.names = Collections.unmodifiableMap(names);
    }

    /**
     * Tabella comune a tutte le proposizioni delle formule indicate.
     */
    public static MonaSymbolTable of(LtlfFormula... formulas) {
        SortedSet<AtomSymbol> labels = new TreeSet<>();
        for (LtlfFormula formula : formulas) {
            labels.addAll(formula.findLabels());
        }

        Map<AtomSymbol, String> names = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (AtomSymbol label : labels) {
            String base = baseName(label);
            String name = base;
            for (int suffix = 1; taken.contains(name); suffix++) {
                name = base + "_" + suffix;
            }
            if (!name.equals(base)) {
                String assigned = name;
                LOGGER.fine(() -> "Nome MONA " + base + " già in uso, " + label + " diventa " + assigned);
            }
            taken.add(name);
            names.put(label, name);
        }
        return new MonaSymbolTable(names);
    }

    /**
     * @throws EncodingException se il simbolo non appartiene alla tabella
     */
    public String name(AtomSymbol symbol) {
        String name = names.get(symbol);
        if (name == null) {
            throw new EncodingException("Simbolo senza nome MONA: " + symbol);
        }
        return name;
    }

    public String primedName(AtomSymbol symbol) {
        return primed(name(symbol));
    }

    /** Tutti gli identificatori, in ordine alfabetico */
    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(names.values()));
    }

    /** Identificatori delle sole proposizioni della formula */
    public SortedSet<String> names(LtlfFormula formula) {
        SortedSet<String> result = new TreeSet<>();
        for (AtomSymbol label : formula.findLabels()) {
            result.add(name(label));
        }
        return Collections.unmodifiableSortedSet(result);
    }

    static String primed(String name) {
        return name + PRIME_SUFFIX;
    }

    static String baseName(AtomSymbol symbol) {
        String upper = symbol.toString().toUpperCase(Locale.ROOT);
        String name = BORDER_UNDERSCORES.matcher(ILLEGAL_CHARACTERS.matcher(upper).replaceAll("_")).replaceAll("");
        if (name.isEmpty() || !Character.isLetter(name.charAt(0))) {
            return INVALID_START_PREFIX + name;
        }
        return name;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
