package org.ltlf;

import org.ltlf.formula.FormulaSyntaxException;
import org.ltlf.formula.LtlfFormula;
import org.ltlf.formula.LtlfFormulaParser;
import org.ltlf.mona.EquivalenceProgram;
import org.ltlf.mona.MonaProgram;
import org.ltlf.mona.Position;
import org.ltlf.optionalfeatures.ClausifiedFormula;
import org.ltlf.optionalfeatures.TseitinClausifier;
import org.ltlf.solver.BoundedMonaChecker;
import org.ltlf.solver.ExternalToolException;
import org.ltlf.solver.MonaResult;
import org.ltlf.solver.MonaRunner;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * TRADUTTORE LTLf/PLTLf → MONA (M2L-Str)
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula LTLf/PLTLf da file di testo (oppure due formule per l'equivalenza)
 * 2. PARSING: notazione infissa → {@link LtlfFormula} (ANTLR)
 * 3. OPZIONI FACOLTATIVE:
 *    - n: forma normale negata prima della codifica
 *    - t: clausificazione di Tseitin temporale
 *    - s: programma dei modelli stabili
 *    - p: formula del passato valutata nell'ultima posizione
 * 4. CODIFICA: programma MONA stampato ed eventualmente salvato in un file .mona
 * 5. VERIFICA (facoltativa): MONA esterno con timeout oppure verificatore limitato interno
 *
 * MODALITÀ OPERATIVE:
 * - Formula singola (-f)
 * - Equivalenza forte (-eq file1 file2): il programma è insoddisfacibile se e solo se
 *   le due formule sono fortemente equivalenti
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    static final String HELP_PARAM = "-h";
    static final String FILE_PARAM = "-f";
    static final String EQUIVALENCE_PARAM = "-eq";
    static final String OUTPUT_PARAM = "-o";
    static final String TIMEOUT_PARAM = "-t";
    static final String OPT_PARAM = "-opt=";
    static final String SOLVE_PARAM = "-solve";
    static final String MONA_PARAM = "-mona";
    static final String BOUND_PARAM = "-bound";

    /**
     * Flag opzioni disponibili
     * */
    static final String OPT_NNF = "n";
    static final String OPT_TSEITIN = "t";
    static final String OPT_STABLE_MODELS = "s";
    static final String OPT_PAST = "p";
    static final String OPT_ALL = "all";

    /**
     * Timeout di default e limiti
     * */
    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int MIN_TIMEOUT_SECONDS = 1;

    /** Estensione dei programmi salvati */
    private static final String MONA_EXTENSION = ".mona";

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del traduttore.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO TRADUTTORE LTLf -> MONA <---");
        configureLogging();

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            TranslatorConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE TRADUTTORE <---");
        }
    }

    private static void configureLogging() {
        try (InputStream configuration = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (configuration != null) {
                LogManager.getLogManager().readConfiguration(configuration);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione del logging non caricata: " + e.getMessage());
        }
    }

    private static void executeMainPipeline(TranslatorConfiguration config) throws IOException, ExternalToolException {
        MonaProgram program = buildProgram(config);

        System.out.println("-->> PROGRAMMA MONA <<--");
        System.out.println(program);

        if (config.outputPath != null) {
            Path written = writeProgram(program, config);
            System.out.println("[I] Programma salvato in: " + written);
        }

        if (config.solve) {
            MonaResult result = solve(program, config);
            displayResult(result, config);
        }
    }

    /**
     * Gestisce errori critici registrandoli e terminando con codice di errore.
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nel traduttore", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PIPELINE DI TRADUZIONE

    /**
     * Costruisce il programma MONA richiesto dalla configurazione.
     *
     * @throws IOException se i file di input non sono leggibili
     * @throws FormulaSyntaxException se una formula non è valida
     */
    static MonaProgram buildProgram(TranslatorConfiguration config) throws IOException {
        if (config.isEquivalenceMode) {
            LtlfFormula left = prepare(readFormula(config.inputPath), config);
            LtlfFormula right = prepare(readFormula(config.secondInputPath), config);
            EquivalenceProgram equivalence = EquivalenceProgram.of(left, right);
            System.out.println("[I] Segnature delle formule: " + equivalence.signature());
            return equivalence.toProgram();
        }

        LtlfFormula formula = prepare(readFormula(config.inputPath), config);

        if (config.useTseitin) {
            ClausifiedFormula clausified = TseitinClausifier.clausify(formula);
            System.out.println("[I] " + clausified.summary());
            formula = clausified.toFormula();
        }

        if (config.useStableModels) {
            return MonaProgram.stableModels(formula);
        }
        return MonaProgram.of(formula, config.usePastEvaluation ? Position.LAST : Position.INITIAL);
    }

    static LtlfFormula prepare(LtlfFormula formula, TranslatorConfiguration config) {
        if (!config.useNnf) {
            return formula;
        }
        LtlfFormula nnf = formula.toNnf();
        System.out.println("[I] Forma normale negata: " + nnf);
        return nnf;
    }

    private static LtlfFormula readFormula(String filePath) throws IOException {
        String content = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
        System.out.println("[I] Formula letta da " + Path.of(filePath).getFileName() + ": " + content);
        return LtlfFormulaParser.parse(content);
    }

    static Path writeProgram(MonaProgram program, TranslatorConfiguration config) throws IOException {
        String fileName = Path.of(config.inputPath).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        if (config.isEquivalenceMode) {
            String other = Path.of(config.secondInputPath).getFileName().toString();
            int otherDot = other.lastIndexOf('.');
            baseName = baseName + "_eq_" + (otherDot > 0 ? other.substring(0, otherDot) : other);
        }

        Path target = Path.of(config.outputPath, baseName + MONA_EXTENSION);
        Files.writeString(target, program.toString(), StandardCharsets.UTF_8);
        return target;
    }

    private static MonaResult solve(MonaProgram program, TranslatorConfiguration config) throws ExternalToolException {
        if (config.bound > 0) {
            System.out.println("Verifica limitata fino alla lunghezza " + config.bound + "...");
            return new BoundedMonaChecker(config.bound).check(program);
        }
        System.out.println("Verifica con " + config.monaExecutable + " (timeout: " + config.timeoutSeconds + "s)...");
        MonaRunner runner = new MonaRunner(config.monaExecutable, Duration.ofSeconds(config.timeoutSeconds));
        return runner.run(program);
    }

    private static void displayResult(MonaResult result, TranslatorConfiguration config) {
        System.out.println("\n-->> RISULTATO <<--");
        System.out.println("Esito: " + result.getVerdict());
        System.out.println("Tempo: " + result.getElapsed().toMillis() + " ms");
        if (config.isEquivalenceMode) {
            System.out.println(result.isUnsatisfiable()
                    ? "[I] Le formule sono fortemente equivalenti"
                    : "[I] Le formule NON sono fortemente equivalenti");
        }
        if (!result.getOutput().isBlank()) {
            System.out.println(result.getOutput().strip());
        }
        System.out.println("====================================\n");
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static TranslatorConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(TranslatorConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE TRADUTTORE <<--");
        if (config.isEquivalenceMode) {
            System.out.println("Modalità: Equivalenza forte");
            System.out.println("Input: " + config.inputPath + ", " + config.secondInputPath);
        } else {
            System.out.println("Modalità: Formula singola");
            System.out.println("Input: " + config.inputPath);
        }

        List<String> activeOpts = new ArrayList<>();
        if (config.useNnf) activeOpts.add("NNF");
        if (config.useTseitin) activeOpts.add("Tseitin");
        if (config.useStableModels) activeOpts.add("Modelli stabili");
        if (config.usePastEvaluation) activeOpts.add("Valutazione nell'ultima posizione");
        System.out.println("Opzioni aggiuntive: " + (activeOpts.isEmpty() ? "Nessuna" : String.join(", ", activeOpts)));

        if (config.solve) {
            System.out.println("Verifica: " + (config.bound > 0
                    ? "limitata (lunghezza <= " + config.bound + ")"
                    : config.monaExecutable + ", timeout " + config.timeoutSeconds + " secondi"));
        }
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Solo console"));
        System.out.println("====================================\n");
    }

    private static void printApplicationHelp() {
        System.out.println("\n===============================================");
        System.out.println("USO: java -jar ltlf2mona.jar [opzioni]\n");
        System.out.println("INPUT:");
        System.out.println("  -f <file>              Formula LTLf/PLTLf da tradurre");
        System.out.println("  -eq <file1> <file2>    Programma di equivalenza forte tra due formule\n");
        System.out.println("OPZIONI:");
        System.out.println("  -o <dir>               Salva il programma in <dir>/<nome>.mona");
        System.out.println("  -opt=<flags>           n=NNF, t=Tseitin, s=modelli stabili, p=passato (ultima posizione), all");
        System.out.println("  -solve                 Verifica il programma");
        System.out.println("  -mona <path>           Eseguibile MONA (default: " + MonaRunner.DEFAULT_EXECUTABLE + ")");
        System.out.println("  -t <sec>               Timeout della verifica (default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -bound <n>             Verifica limitata interna fino alla lunghezza n (implica -solve)");
        System.out.println("  -h                     Mostra questo help\n");
        System.out.println("SINTASSI FORMULE:");
        System.out.println("  &, |, !, ->, <->, X, WX, F, G, U, R, Y, WY, O, H, S, T");
        System.out.println("  true, false, last, end, init, simboli minuscoli o tra virgolette\n");
        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Con -eq sono ammesse solo l'opzione n e la verifica");
        System.out.println("  - Le opzioni s e p sono mutualmente esclusive");
        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione, immutabile.
     */
    static final class TranslatorConfiguration {
        final String inputPath;
        final String secondInputPath;
        final String outputPath;
        final boolean isEquivalenceMode;
        final int timeoutSeconds;
        final boolean useNnf;
        final boolean useTseitin;
        final boolean useStableModels;
        final boolean usePastEvaluation;
        final boolean solve;
        final String monaExecutable;
        final int bound;

        TranslatorConfiguration(String inputPath, String secondInputPath, String outputPath,
                                boolean isEquivalenceMode, int timeoutSeconds, OptionFlags flags,
                                boolean solve, String monaExecutable, int bound) {
            this.inputPath = inputPath;
            this.secondInputPath = secondInputPath;
            this.outputPath = outputPath;
            this.isEquivalenceMode = isEquivalenceMode;
            this.timeoutSeconds = timeoutSeconds;
            this.useNnf = flags.nnf();
            this.useTseitin = flags.tseitin();
            this.useStableModels = flags.stableModels();
            this.usePastEvaluation = flags.past();
            this.solve = solve;
            this.monaExecutable = monaExecutable;
            this.bound = bound;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata (null se è stato richiesto l'help)
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        TranslatorConfiguration parse(String[] args) {
            String inputPath = null;
            String secondInputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isEquivalenceMode = false;
            OptionFlags flags = new OptionFlags(false, false, false, false);
            boolean solve = false;
            String monaExecutable = MonaRunner.DEFAULT_EXECUTABLE;
            int bound = 0;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(isEquivalenceMode || isFileMode);
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case EQUIVALENCE_PARAM -> {
                        validateExclusiveMode(isEquivalenceMode || isFileMode);
                        inputPath = getNextArgument(args, ++i, "due file");
                        secondInputPath = getNextArgument(args, ++i, "due file");
                        validateFileExists(inputPath);
                        validateFileExists(secondInputPath);
                        isEquivalenceMode = true;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case TIMEOUT_PARAM -> timeoutSeconds = parsePositive(getNextArgument(args, ++i, "numero secondi"),
                            MIN_TIMEOUT_SECONDS, "Timeout");

                    case SOLVE_PARAM -> solve = true;

                    case MONA_PARAM -> monaExecutable = getNextArgument(args, ++i, "eseguibile MONA");

                    case BOUND_PARAM -> {
                        bound = parsePositive(getNextArgument(args, ++i, "lunghezza massima"), 1, "Limite");
                        solve = true;
                    }

                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            flags = parseOptionalFlags(args[i].substring(OPT_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -eq (due file)");
            }
            if (flags.stableModels() && flags.past()) {
                throw new IllegalArgumentException("Le opzioni s e p sono mutualmente esclusive");
            }
            if (isEquivalenceMode && (flags.tseitin() || flags.stableModels() || flags.past())) {
                throw new IllegalArgumentException("Con -eq è ammessa solo l'opzione n");
            }

            return new TranslatorConfiguration(inputPath, secondInputPath, outputPath, isEquivalenceMode,
                    timeoutSeconds, flags, solve, monaExecutable, bound);
        }

        private void validateExclusiveMode(boolean alreadySet) {
            if (alreadySet) {
                throw new IllegalArgumentException("Le modalità -f e -eq sono mutualmente esclusive e non ripetibili");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parsePositive(String value, int minimum, String name) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < minimum) {
                    throw new IllegalArgumentException(name + " minimo: " + minimum);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " non valido: " + value);
            }
        }

        /**
         * Converte la stringa di -opt in flag: ogni carattere abilita un'opzione.
         */
        private OptionFlags parseOptionalFlags(String flagsStr) {
            if (flagsStr == null || flagsStr.isBlank()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            if (flagsStr.equals(OPT_ALL)) {
                return new OptionFlags(true, true, false, false);
            }
            for (char flag : flagsStr.toCharArray()) {
                if ("ntsp".indexOf(flag) < 0) {
                    throw new IllegalArgumentException("Flag -opt sconosciuto: " + flag);
                }
            }
            return new OptionFlags(flagsStr.contains(OPT_NNF), flagsStr.contains(OPT_TSEITIN),
                    flagsStr.contains(OPT_STABLE_MODELS), flagsStr.contains(OPT_PAST));
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    /**
     * Flag delle opzioni facoltative.
     */
    record OptionFlags(boolean nnf, boolean tseitin, boolean stableModels, boolean past) {}

    //endregion
}
