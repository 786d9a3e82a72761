package org.ltlf.solver;

import org.ltlf.mona.MonaProgram;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ESECUTORE MONA - Invocazione del verificatore esterno con timeout
 *
 * Il programma viene scritto in un file temporaneo, il cui percorso è aggiunto in coda
 * al comando configurato. Standard output e standard error sono uniti e letti da un
 * executor a thread singolo: l'attesa è limitata dal timeout e allo scadere il processo
 * viene terminato.
 *
 * ESITI RICONOSCIUTI NELL'OUTPUT:
 * - "Formula is valid" → VALID
 * - "Formula is unsatisfiable" → UNSATISFIABLE
 * - "A satisfying example" → SATISFIABLE
 *
 * Ogni altro fallimento diventa una {@link ExternalToolException} con il motivo specifico.
 */
public final class MonaRunner {

    private static final Logger LOGGER = Logger.getLogger(MonaRunner.class.getName());

    public static final String DEFAULT_EXECUTABLE = "mona";

    private static final String VALID_MARKER = "Formula is valid";
    private static final String UNSATISFIABLE_MARKER = "Formula is unsatisfiable";
    private static final String SATISFIABLE_MARKER = "A satisfying example";

    private final List<String> command;
    private final Duration timeout;

    public MonaRunner(String executable, Duration timeout) {
        this(List.of(executable), timeout);
    }

    /**
     * @param command comando e argomenti; il percorso del programma viene aggiunto in coda
     * @param timeout attesa massima per il completamento
     */
    public MonaRunner(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Comando MONA non può essere vuoto");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout deve essere positivo");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    public MonaResult run(MonaProgram program) throws ExternalToolException {
        return run(program.toString());
    }

    /**
     * Esegue il verificatore sul testo del programma.
     *
     * @throws ExternalToolException se il processo non parte, termina con errore,
     *         supera il timeout o produce un output non riconosciuto
     */
    public MonaResult run(String programText) throws ExternalToolException {
        Path file = writeProgram(programText);
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Process process = start(file);
            try {
                Future<String> output = executor.submit(() -> readAll(process.getInputStream()));
                String text = output.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                // l'output è chiuso ma il processo può non essere terminato: resta il tempo residuo
                if (!process.waitFor(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    throw new TimeoutException();
                }

                int exitCode = process.exitValue();
                if (exitCode != 0) {
                    throw new ExternalToolException(ExternalToolException.Reason.NONZERO_EXIT,
                            "MONA terminato con codice " + exitCode + ": " + text.strip());
                }
                return new MonaResult(parseVerdict(text), text, Duration.ofNanos(System.nanoTime() - start));

            } catch (TimeoutException e) {
                process.destroyForcibly();
                LOGGER.warning("Timeout di MONA dopo " + timeout.toMillis() + " ms");
                throw new ExternalToolException(ExternalToolException.Reason.TIMEOUT,
                        "MONA non ha terminato entro " + timeout.toMillis() + " ms", e);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new ExternalToolException(ExternalToolException.Reason.INTERRUPTED,
                        "Attesa di MONA interrotta", e);
            } catch (ExecutionException e) {
                process.destroyForcibly();
                LOGGER.log(Level.SEVERE, "Errore nella lettura dell'output di MONA", e.getCause());
                throw new ExternalToolException(ExternalToolException.Reason.IO_FAILURE,
                        "Lettura dell'output di MONA fallita", e.getCause());
            }
        } finally {
            executor.shutdownNow();
            deleteProgram(file);
        }
    }

    /**
     * Riconosce l'esito nel testo prodotto da MONA.
     *
     * @throws ExternalToolException con motivo UNPARSEABLE_OUTPUT se nessun esito è presente
     */
    static MonaVerdict parseVerdict(String output) throws ExternalToolException {
        if (output.contains(VALID_MARKER)) {
            return MonaVerdict.VALID;
        }
        if (output.contains(UNSATISFIABLE_MARKER)) {
            return MonaVerdict.UNSATISFIABLE;
        }
        if (output.contains(SATISFIABLE_MARKER)) {
            return MonaVerdict.SATISFIABLE;
        }
        throw new ExternalToolException(ExternalToolException.Reason.UNPARSEABLE_OUTPUT,
                "Esito non riconosciuto nell'output di MONA: " + output.strip());
    }

    //region PROCESSO E FILE TEMPORANEI

    private Process start(Path file) throws ExternalToolException {
        List<String> arguments = new ArrayList<>(command);
        arguments.add(file.toString());
        try {
            LOGGER.fine(() -> "Avvio: " + String.join(" ", arguments));
            return new ProcessBuilder(arguments).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ExternalToolException(ExternalToolException.Reason.MISSING_EXECUTABLE,
                    "Impossibile avviare " + command.get(0), e);
        }
    }

    private static Path writeProgram(String programText) throws ExternalToolException {
        try {
            Path file = Files.createTempFile("ltlf2mona", ".mona");
            Files.writeString(file, programText, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new ExternalToolException(ExternalToolException.Reason.IO_FAILURE,
                    "Impossibile scrivere il programma MONA temporaneo", e);
        }
    }

    private static void deleteProgram(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "File temporaneo non rimosso: " + file, e);
        }
    }

    private static String readAll(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    //endregion
}
