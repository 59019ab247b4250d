package org.koa;

import org.koa.encoding.AutomatonEncoder;
import org.koa.encoding.EncodingContext;
import org.koa.encoding.OccurrenceTables;
import org.koa.encoding.VariableSpace;
import org.koa.formula.BooleanFormula;
import org.koa.samples.SampleReader;
import org.koa.samples.SampleSet;
import org.koa.solver.ConstraintSolver;
import org.koa.solver.DimacsWriter;
import org.koa.solver.ModelValue;
import org.koa.solver.Sat4jConstraintSolver;
import org.koa.solver.SolverStatistics;
import org.koa.solver.SolverStatus;
import org.koa.witness.WitnessAutomaton;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
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
 * CODIFICATORE SAT k-OA - Identificazione di automi da esempi positivi e negativi
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. LETTURA: esempi positivi (-p) e negativi (-n) tramite grammatica ANTLR,
 *    alfabeto = unione ordinata dei simboli letti
 * 2. TRADUZIONE: vincolo di determinismo, aggregazione dei positivi nelle tabelle
 *    delle occorrenze, vincolo globale, negazione dei vincoli per stringa dei negativi
 * 3. RISOLUZIONE: trasformazione di Tseitin e verifica con SAT4J sotto timeout;
 *    se SAT viene ricostruito e stampato l'automa testimone
 *
 * ORGANIZZAZIONE DEGLI OUTPUT (con -o):
 * - CNF/: formula completa in formato DIMACS
 * - RESULT/: esito, transizioni del testimone e tempi delle fasi
 *
 * CODICI DI USCITA: 0 esecuzione completata (SAT, UNSAT o timeout), 1 errore, 2 parametri non validi.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String POSITIVE_PARAM = "-p";
    private static final String NEGATIVE_PARAM = "-n";
    private static final String SLOTS_PARAM = "-k";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = Sat4jConstraintSolver.DEFAULT_TIMEOUT_SECONDS;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /**
     * Margine dell'executor oltre il timeout interno di SAT4J
     * */
    static final int SOLVER_GRACE_SECONDS = 1;

    /**
     * Soglie sotto le quali formula e valori delle variabili vengono stampati per intero
     * */
    private static final int VERBOSE_ALPHABET_LIMIT = 3;
    private static final int VERBOSE_SLOTS_LIMIT = 3;

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INVALID_PARAMETERS = 2;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intero flusso dall'analisi dei parametri alla stampa dei risultati.
     *
     * @param args parametri linea di comando forniti dall'utente
     * @return codice di uscita
     */
    static int run(String[] args) {
        System.out.println("---> AVVIO CODIFICATORE SAT k-OA <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_INVALID_PARAMETERS;
            }

            RunConfiguration config;
            try {
                config = new ArgumentParser().parse(args);
            } catch (IllegalArgumentException e) {
                System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
                System.out.println("Usa -h per visualizzare l'help completo.");
                return EXIT_INVALID_PARAMETERS;
            }
            if (config == null) {
                return EXIT_OK; // help mostrato
            }

            displayConfigurationSummary(config);
            executePipeline(config);
            return EXIT_OK;

        } catch (Exception e) {
            handleGlobalError(e);
            return EXIT_ERROR;
        } finally {
            System.out.println("---> FINE ESECUZIONE CODIFICATORE <---");
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Esecuzione interrotta", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
    }

    private static void displayConfigurationSummary(RunConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE CODIFICATORE <<--");
        System.out.println("Esempi positivi: " + config.positivePath);
        System.out.println("Esempi negativi: " + (config.negativePath != null ? config.negativePath : "Nessuno"));
        System.out.println("k: " + config.slots);
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Nessuno"));
        System.out.println("====================================\n");
    }

    //endregion

    //region PIPELINE

    private static void executePipeline(RunConfiguration config) throws IOException, InterruptedException {
        ReadingResult reading = executeReading(config);
        TranslationResult translation = executeTranslation(reading, config);
        SolvingResult solving = executeSolving(reading, translation, config);

        if (config.outputPath != null) {
            saveOutputs(config, reading, translation, solving);
        }
    }

    /**
     * FASE 1 - Lettura dei file di esempi e calcolo dell'alfabeto.
     */
    private static ReadingResult executeReading(RunConfiguration config) throws IOException {
        long start = System.currentTimeMillis();

        SampleSet positives = SampleReader.read(Paths.get(config.positivePath));
        SampleSet negatives = config.negativePath != null
                ? SampleReader.read(Paths.get(config.negativePath))
                : SampleSet.empty();
        List<String> alphabet = SampleSet.mergedAlphabet(positives, negatives);

        long elapsed = System.currentTimeMillis() - start;
        System.out.printf("[I] Fase 1 LETTURA: alfabeto=%d, esempi positivi=%d, esempi negativi=%d, tempo: %.4f s%n",
                alphabet.size(), positives.size(), negatives.size(), elapsed / 1000.0);

        return new ReadingResult(positives, negatives, alphabet, elapsed);
    }

    /**
     * FASE 2 - Costruzione della formula completa.
     */
    private static TranslationResult executeTranslation(ReadingResult reading, RunConfiguration config) {
        long start = System.currentTimeMillis();

        AutomatonEncoder encoder = new AutomatonEncoder();
        encoder.initialize(reading.alphabet, config.slots);
        BooleanFormula formula = encoder.encode(reading.positives.getSamples(), reading.negatives.getSamples());

        long elapsed = System.currentTimeMillis() - start;
        EncodingContext context = encoder.getContext();
        OccurrenceTables tables = context.getTables();

        System.out.println("[I] Tabelle delle occorrenze: totali=" + tables.totalOccurrences()
                + ", distinte=" + tables.distinctKeys());
        System.out.printf("[I] Fase 2 TRADUZIONE: variabili=%d, nodi formula=%d, tempo: %.4f s%n",
                context.getSpace().edgeCount(), formula.size(), elapsed / 1000.0);

        if (isVerbose(context)) {
            System.out.print(tables.dump());
            System.out.println(formula);
        }
        return new TranslationResult(context, formula, elapsed);
    }

    /**
     * FASE 3 - Risoluzione con SAT4J su executor dedicato e timeout.
     */
    private static SolvingResult executeSolving(ReadingResult reading, TranslationResult translation,
                                                RunConfiguration config) throws InterruptedException {
        System.out.println("Risoluzione SAT con SAT4J (timeout: " + config.timeoutSeconds + "s)...");
        long start = System.currentTimeMillis();

        Sat4jConstraintSolver solver = new Sat4jConstraintSolver(translation.context.getSpace().edgeCount());
        solver.setTimeout(config.timeoutSeconds);
        solver.add(translation.formula);

        SolverStatus status = solveWithTimeout(solver, config.timeoutSeconds);
        long elapsed = System.currentTimeMillis() - start;

        WitnessAutomaton witness = null;
        switch (status) {
            case SATISFIABLE -> {
                witness = WitnessAutomaton.fromModel(solver, translation.context);
                System.out.println("[I] SAT");
                System.out.print(witness.describe());
                reportWitnessCheck(witness, reading);
                if (isVerbose(translation.context)) {
                    printVariableValues(solver, translation.context.getSpace());
                }
            }
            case UNSATISFIABLE -> System.out.println("[I] UNSAT");
            case UNKNOWN -> System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
        }

        System.out.printf("[I] Fase 3 RISOLUZIONE: k=%d, alfabeto=%d, tempo: %.4f s%n",
                config.slots, reading.alphabet.size(), elapsed / 1000.0);

        return new SolvingResult(status, witness, solver, elapsed);
    }

    /**
     * Esegue check() su un thread dedicato. L'attesa dura il timeout del solver più
     * {@link #SOLVER_GRACE_SECONDS}; se scade comunque, il worker viene interrotto e
     * atteso per lo stesso margine prima di restituire UNKNOWN.
     *
     * @param solver solver già configurato con il proprio timeout
     * @param timeoutSeconds timeout impostato sul solver
     * @return esito di check(), UNKNOWN se l'executor scade
     */
    static SolverStatus solveWithTimeout(ConstraintSolver solver, int timeoutSeconds)
            throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SolverStatus> future = executor.submit(solver::check);
            return future.get(timeoutSeconds + SOLVER_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            LOGGER.warning("Risoluzione interrotta dal timeout dell'executor");
            executor.shutdownNow();
            if (!executor.awaitTermination(SOLVER_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warning("Il solver non ha risposto all'interruzione");
            }
            return SolverStatus.UNKNOWN;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Errore nella risoluzione SAT", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static void reportWitnessCheck(WitnessAutomaton witness, ReadingResult reading) {
        int accepted = 0;
        for (List<String> sample : reading.positives.getSamples()) {
            if (witness.accepts(sample)) accepted++;
        }
        int rejected = 0;
        for (List<String> sample : reading.negatives.getSamples()) {
            if (!witness.accepts(sample)) rejected++;
        }
        System.out.println("[I] Verifica testimone: positivi accettati " + accepted + "/" + reading.positives.size()
                + ", negativi rifiutati " + rejected + "/" + reading.negatives.size());
    }

    private static void printVariableValues(Sat4jConstraintSolver solver, VariableSpace space) {
        for (int index = 1; index <= space.edgeCount(); index++) {
            ModelValue value = solver.model(index);
            System.out.println(space.formula(index) + " (" + space.decode(index).describe() + "): " + value);
        }
    }

    private static boolean isVerbose(EncodingContext context) {
        return context.getAlphabet().size() < VERBOSE_ALPHABET_LIMIT && context.getSlots() < VERBOSE_SLOTS_LIMIT;
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    private static void saveOutputs(RunConfiguration config, ReadingResult reading,
                                    TranslationResult translation, SolvingResult solving) throws IOException {
        String baseFileName = getBaseFileName(config.positivePath);
        Path outputDir = Paths.get(config.outputPath);

        Path cnfPath = outputDir.resolve("CNF").resolve(baseFileName + ".cnf");
        DimacsWriter.write(solving.solver.getCnf(), List.of(
                "k-OA: alfabeto=" + reading.alphabet + ", k=" + config.slots,
                "variabili del problema 1.." + translation.context.getSpace().edgeCount()), cnfPath);
        System.out.println("[I] Formula CNF salvata: " + cnfPath);

        Path resultDir = outputDir.resolve("RESULT");
        Files.createDirectories(resultDir);
        Path resultPath = resultDir.resolve(baseFileName + ".result");
        Files.writeString(resultPath, buildResultReport(config, reading, translation, solving), StandardCharsets.UTF_8);
        System.out.println("[I] Risultato salvato: " + resultPath);
    }

    private static String buildResultReport(RunConfiguration config, ReadingResult reading,
                                            TranslationResult translation, SolvingResult solving) {
        SolverStatistics statistics = solving.solver.getStatistics();
        StringBuilder sb = new StringBuilder();
        sb.append("=== RISULTATO k-OA ===\n\n");
        sb.append("Esempi positivi: ").append(config.positivePath).append(" (").append(reading.positives.size()).append(")\n");
        sb.append("Esempi negativi: ").append(config.negativePath != null ? config.negativePath : "Nessuno")
                .append(" (").append(reading.negatives.size()).append(")\n");
        sb.append("Alfabeto: ").append(reading.alphabet).append('\n');
        sb.append("k: ").append(config.slots).append("\n\n");

        sb.append("Esito: ").append(solving.status).append('\n');
        if (solving.witness != null) {
            sb.append("\nTransizioni del testimone:\n").append(solving.witness.describe());
        }

        sb.append("\n=== STATISTICHE ===\n");
        sb.append(statistics.format()).append('\n');
        sb.append("Tempo lettura: ").append(reading.elapsedMs).append(" ms\n");
        sb.append("Tempo traduzione: ").append(translation.elapsedMs).append(" ms\n");
        sb.append("Tempo risoluzione: ").append(solving.elapsedMs).append(" ms\n");
        return sb.toString();
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("\n-->> GUIDA CODIFICATORE SAT k-OA <<--\n");
        System.out.println("UTILIZZO:");
        System.out.println("  java -jar koa-sat-encoder.jar -p <file> -k <int> [-n <file>] [-o <dir>] [-t <sec>]\n");
        System.out.println("PARAMETRI:");
        System.out.println("  -p <file>  File degli esempi positivi (obbligatorio)");
        System.out.println("  -n <file>  File degli esempi negativi");
        System.out.println("  -k <int>   Numero di slot per simbolo, almeno 1 (obbligatorio)");
        System.out.println("  -o <dir>   Directory di output per CNF/ e RESULT/");
        System.out.println("  -t <sec>   Timeout della risoluzione (default " + DEFAULT_TIMEOUT_SECONDS
                + ", minimo " + MIN_TIMEOUT_SECONDS + ")");
        System.out.println("  -h         Mostra questa guida\n");
        System.out.println("FORMATO DEGLI ESEMPI:");
        System.out.println("  Un esempio per riga, simboli separati da virgola (es. a,b,b).");
        System.out.println("  Una riga vuota rappresenta la stringa vuota.\n");
        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'esecuzione, immutabile.
     */
    private static class RunConfiguration {
        final String positivePath;
        final String negativePath;
        final int slots;
        final String outputPath;
        final int timeoutSeconds;

        RunConfiguration(String positivePath, String negativePath, int slots, String outputPath, int timeoutSeconds) {
            this.positivePath = positivePath;
            this.negativePath = negativePath;
            this.slots = slots;
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se parametri mancanti o non validi
         */
        RunConfiguration parse(String[] args) {
            String positivePath = null;
            String negativePath = null;
            String outputPath = null;
            Integer slots = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case POSITIVE_PARAM -> {
                        positivePath = getNextArgument(args, ++i, "file");
                        validateFileExists(positivePath);
                    }
                    case NEGATIVE_PARAM -> {
                        negativePath = getNextArgument(args, ++i, "file");
                        validateFileExists(negativePath);
                    }
                    case SLOTS_PARAM -> slots = parseSlots(getNextArgument(args, ++i, "numero di slot"));
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseTimeout(getNextArgument(args, ++i, "numero secondi"));
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (positivePath == null) {
                throw new IllegalArgumentException("Specificare il file degli esempi positivi con -p");
            }
            if (slots == null) {
                throw new IllegalArgumentException("Specificare il numero di slot con -k");
            }
            return new RunConfiguration(positivePath, negativePath, slots, outputPath, timeoutSeconds);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseSlots(String value) {
            try {
                int slots = Integer.parseInt(value);
                if (slots < 1) {
                    throw new IllegalArgumentException("k deve essere almeno 1, ricevuto: " + slots);
                }
                return slots;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore k non valido: " + value);
            }
        }

        private int parseTimeout(String value) {
            try {
                int timeout = Integer.parseInt(value);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + value);
            }
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
     * Esiti delle tre fasi, passati alla fase di salvataggio.
     */
    private static class ReadingResult {
        final SampleSet positives;
        final SampleSet negatives;
        final List<String> alphabet;
        final long elapsedMs;

        ReadingResult(SampleSet positives, SampleSet negatives, List<String> alphabet, long elapsedMs) {
            this.positives = positives;
            this.negatives = negatives;
            this.alphabet = alphabet;
            this.elapsedMs = elapsedMs;
        }
    }

    private static class TranslationResult {
        final EncodingContext context;
        final BooleanFormula formula;
        final long elapsedMs;

        TranslationResult(EncodingContext context, BooleanFormula formula, long elapsedMs) {
            this.context = context;
            this.formula = formula;
            this.elapsedMs = elapsedMs;
        }
    }

    private static class SolvingResult {
        final SolverStatus status;
        final WitnessAutomaton witness;
        final Sat4jConstraintSolver solver;
        final long elapsedMs;

        SolvingResult(SolverStatus status, WitnessAutomaton witness, Sat4jConstraintSolver solver, long elapsedMs) {
            this.status = status;
            this.witness = witness;
            this.solver = solver;
            this.elapsedMs = elapsedMs;
        }
    }

    //endregion
}
