package org.hilbert;

import org.hilbert.axiom.BasisGenerator;
import org.hilbert.axiom.BasisPresets;
import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaParseException;
import org.hilbert.formula.FormulaPrinter;
import org.hilbert.report.BasisFileReader;
import org.hilbert.report.ProofReportWriter;
import org.hilbert.search.ConfigurationException;
import org.hilbert.search.ProofSearchEngine;
import org.hilbert.search.ResourceExhaustedException;
import org.hilbert.search.SearchConfiguration;
import org.hilbert.search.SearchResult;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * GENERATORE DI PROVE NEL SISTEMA DI HILBERT
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: base di formule da file (-b) oppure base predefinita (-p, default {a, (a → a)})
 * 2. ISTANZE: assiomi A1, A2, A3 istanziati con ogni combinazione della base
 * 3. RICERCA: ampliamento in ampiezza per lunghezza crescente con Modus Ponens,
 *    scartando le prove con la stessa sequenza di formule
 * 4. FILTRO: prove di lunghezza almeno 3 che usano Modus Ponens, una sola per teorema
 * 5. OUTPUT: prove migliori e statistiche
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Ricerca prove (default): -b oppure -p, -l, -w, -m, -t, -o
 * - Generazione base (-gen=basis <profondità>): formule su {a, b} fino alla profondità indicata
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RESULT/: prove più semplici per ciascun teorema
 * - STATS/: statistiche della ricerca
 * - BASIS/: basi generate (se si attiva -gen=basis)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    static final String HELP_PARAM = "-h";
    static final String BASIS_PARAM = "-b";
    static final String PRESET_PARAM = "-p";
    static final String LENGTH_PARAM = "-l";
    static final String OUTPUT_PARAM = "-o";
    static final String TIMEOUT_PARAM = "-t";
    static final String WORKERS_PARAM = "-w";
    static final String FRONTIER_PARAM = "-m";
    static final String GEN_PARAM = "-gen=";

    /**
     * Flag generazione disponibili
     * */
    static final String GEN_BASIS = "basis";

    /**
     * Timeout di default e limiti
     * */
    static final int DEFAULT_TIMEOUT_SECONDS = 60;
    static final int MIN_TIMEOUT_SECONDS = 5;

    private static final String DEFAULT_OUTPUT_DIRECTORY = ".";
    static final String DEFAULT_PRESET = "minimal";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Generazione base oppure ricerca con timeout
     * 3. Salvataggio risultati e riepilogo su console
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO GENERATORE DI PROVE HILBERT <---");

        try {
            RunConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE GENERATORE DI PROVE <---");
        }
    }

    private static void executeMainPipeline(RunConfiguration config) throws IOException {
        if (config.isGenerationMode) {
            System.out.println("[I] Modalità: Generazione base");
            generateBasis(config);
        } else {
            System.out.println("[I] Modalità: Ricerca prove");
            processSearch(config);
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata o null se help/errore
     */
    private static RunConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (ConfigurationException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(RunConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE GENERATORE <<--");

        if (config.isGenerationMode) {
            System.out.println("Modalità: Generazione base");
            System.out.println("Profondità massima: " + config.generationDepth);
        } else {
            System.out.println("Modalità: Ricerca prove");
            System.out.println("Base: " + (config.basisPath != null ? config.basisPath : "predefinita " + config.presetName));
            System.out.println("Lunghezza massima: " + config.maxLength);
            System.out.println("Thread: " + config.workerThreads);
            System.out.println("Soglia frontiera: " + config.maxFrontierSize);
            System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        }

        System.out.println("Output: " + config.outputPath);
        System.out.println("====================================\n");
    }

    //endregion

    //region GENERAZIONE BASE

    private static void generateBasis(RunConfiguration config) throws IOException {
        BasisGenerator generator = new BasisGenerator();
        Path file = generator.writeBasisFile(Paths.get(config.outputPath), config.generationDepth);

        System.out.println("[I] Base generata: " + generator.generate(config.generationDepth).size() + " formule");
        System.out.println("File: " + file);
    }

    //endregion

    //region RICERCA CON TIMEOUT

    private static void processSearch(RunConfiguration config) throws IOException {
        SearchConfiguration searchConfiguration;
        try {
            searchConfiguration = buildSearchConfiguration(config);
        } catch (FormulaParseException e) {
            System.out.println("[E] Formula non valida nella base: " + e.getMessage());
            return;
        } catch (ConfigurationException e) {
            System.out.println("[E] Configurazione non valida: " + e.getMessage());
            return;
        }

        System.out.println("Base (dimensione " + searchConfiguration.getBasis().size() + "): "
                + searchConfiguration.getBasis().stream()
                .map(FormulaPrinter::render)
                .collect(Collectors.joining(", ", "[", "]")));

        LocalDateTime startedAt = LocalDateTime.now();
        SearchResult result = executeSearchWithTimeout(searchConfiguration, config.timeoutSeconds);
        if (result == null) {
            return;
        }

        Path resultFile = new ProofReportWriter().write(Paths.get(config.outputPath), result, startedAt);

        System.out.println();
        System.out.println(result.getStatistics().toSummary());
        System.out.println("[I] Teoremi trovati: " + result.size());
        System.out.println("[I] Risultati salvati in: " + resultFile);
    }

    /**
     * Legge la base (file o predefinita) e costruisce la configurazione della ricerca.
     *
     * @throws ConfigurationException se il file di base non contiene formule o i parametri non sono validi
     * @throws FormulaParseException se una riga del file di base non è una formula
     * @throws IOException se il file di base non è leggibile
     */
    static SearchConfiguration buildSearchConfiguration(RunConfiguration config) throws IOException {
        List<Formula> basis;
        if (config.basisPath != null) {
            basis = BasisFileReader.read(Paths.get(config.basisPath));
            if (basis.isEmpty()) {
                throw new ConfigurationException("Il file di base non contiene formule: " + config.basisPath);
            }
        } else {
            basis = BasisPresets.forName(config.presetName);
        }

        return SearchConfiguration.builder()
                .basis(basis)
                .maxLength(config.maxLength)
                .workerThreads(config.workerThreads)
                .maxFrontierSize(config.maxFrontierSize)
                .build();
    }

    /**
     * Esegue la ricerca su un thread dedicato; allo scadere del timeout il thread viene interrotto.
     *
     * @return risultato o null se timeout o frontiera troppo grande
     */
    private static SearchResult executeSearchWithTimeout(SearchConfiguration configuration, int timeoutSeconds) {
        System.out.println("Ricerca fino a lunghezza " + configuration.getMaxLength()
                + " (timeout: " + timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        ProofSearchEngine engine = new ProofSearchEngine(configuration);
        engine.setProgressListener((length, frontierSize, theoremCount) ->
                System.out.println("[I] Lunghezza " + length + ": " + frontierSize
                        + " prove uniche, " + theoremCount + " teoremi finora"));

        try {
            Future<SearchResult> future = executor.submit(engine::search);
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ResourceExhaustedException) {
                System.out.println("[E] " + e.getCause().getMessage());
                System.out.println("Ridurre la base (-b) o la lunghezza massima (-l), oppure alzare la soglia (-m).");
                return null;
            }
            System.out.println("[E] Errore durante la ricerca: " + e.getCause());
            throw new IllegalStateException("Errore nella ricerca delle prove", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Ricerca interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> GENERATORE DI PROVE HILBERT <<::");
        System.out.println("Ricerca esaustiva delle prove più semplici nel sistema A1, A2, A3 + Modus Ponens\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar generatore_hilbert.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. RICERCA PROVE:");
        System.out.println("     -b <file>       Base di formule da file");
        System.out.println("     -p <nome>       Base predefinita: " + String.join(", ", BasisPresets.NAMES)
                + " (default: " + DEFAULT_PRESET + " = {a, (a → a)})");
        System.out.println("     -l <n>          Lunghezza massima delle prove (default: " + SearchConfiguration.DEFAULT_MAX_LENGTH + ")");
        System.out.println("     -w <n>          Thread di lavoro (default: " + SearchConfiguration.DEFAULT_WORKER_THREADS + ")");
        System.out.println("     -m <n>          Soglia massima della frontiera (default: " + SearchConfiguration.DEFAULT_MAX_FRONTIER_SIZE + ")");
        System.out.println("     -t <secondi>    Timeout (min: " + MIN_TIMEOUT_SECONDS + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("     -o <directory>  Directory di output (default: directory corrente)");
        System.out.println();
        System.out.println("  2. GENERAZIONE BASE:");
        System.out.println("     -gen=basis <profondità>  Tutte le formule su {a, b} fino alla profondità (0-" + BasisGenerator.MAX_DEPTH + ")");
        System.out.println("     -o <directory>           Directory output per la base generata");
        System.out.println();
        System.out.println("  3. AIUTO:");
        System.out.println("     -h              Mostra questa guida\n");

        System.out.println("FORMATO FILE DI BASE (-b):");
        System.out.println("  Una formula per riga, righe vuote e commenti (#) ignorati");
        System.out.println("  Negazione: ¬ ! ~    Implicazione: → ->");
        System.out.println("  Esempio: (a -> (!b))\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  # Ricerca con base predefinita");
        System.out.println("  java -jar generatore_hilbert.jar\n");

        System.out.println("  # Ricerca con la base curata a 9 formule, lunghezza 3");
        System.out.println("  java -jar generatore_hilbert.jar -p curated -l 3\n");

        System.out.println("  # Ricerca con base da file, lunghezza 4, 4 thread");
        System.out.println("  java -jar generatore_hilbert.jar -b base.txt -l 4 -w 4 -o ./output/\n");

        System.out.println("  # Generazione base di profondità 1");
        System.out.println("  java -jar generatore_hilbert.jar -gen=basis 1 -o ./output/\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  RESULT/       Prove più semplici per ciascun teorema");
        System.out.println("  STATS/        Statistiche della ricerca");
        System.out.println("  BASIS/        Basi generate\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Il numero di prove cresce molto rapidamente con la lunghezza e la base");
        System.out.println("  - Si conservano solo prove di lunghezza >= 3 che usano Modus Ponens");
        System.out.println("  - Ricerca e generazione sono mutualmente esclusive\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class RunConfiguration {
        final String basisPath;
        final String presetName;
        final String outputPath;
        final int maxLength;
        final int workerThreads;
        final long maxFrontierSize;
        final int timeoutSeconds;
        final boolean isGenerationMode;
        final int generationDepth;

        RunConfiguration(String basisPath, String presetName, String outputPath, int maxLength, int workerThreads,
                         long maxFrontierSize, int timeoutSeconds,
                         boolean isGenerationMode, int generationDepth) {
            this.basisPath = basisPath;
            this.presetName = presetName;
            this.outputPath = outputPath;
            this.maxLength = maxLength;
            this.workerThreads = workerThreads;
            this.maxFrontierSize = maxFrontierSize;
            this.timeoutSeconds = timeoutSeconds;
            this.isGenerationMode = isGenerationMode;
            this.generationDepth = generationDepth;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    static final class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -b <file>: Base di formule (esclusivo con -p e -gen)
         * -p <nome>: Base predefinita (esclusivo con -b e -gen)
         * -gen=basis <profondità>: Generazione base (esclusivo con -b)
         * -l <n>, -w <n>, -m <n>: lunghezza massima, thread, soglia frontiera
         * -o <dir>: Directory output
         * -t <sec>: Timeout in secondi
         *
         * @return configurazione validata (null se help richiesto)
         * @throws ConfigurationException se parametri sintatticamente o semanticamente invalidi
         */
        RunConfiguration parse(String[] args) {
            String basisPath = null;
            String presetName = null;
            String outputPath = DEFAULT_OUTPUT_DIRECTORY;
            int maxLength = SearchConfiguration.DEFAULT_MAX_LENGTH;
            int workerThreads = SearchConfiguration.DEFAULT_WORKER_THREADS;
            long maxFrontierSize = SearchConfiguration.DEFAULT_MAX_FRONTIER_SIZE;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean isGenerationMode = false;
            int generationDepth = 0;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case BASIS_PARAM -> {
                        validateExclusiveMode(isGenerationMode || presetName != null, "base da file");
                        basisPath = getNextArgument(args, ++i, "file");
                        validateFileExists(basisPath);
                    }

                    case PRESET_PARAM -> {
                        validateExclusiveMode(isGenerationMode || basisPath != null, "base predefinita");
                        presetName = parsePresetName(args, ++i);
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case LENGTH_PARAM -> maxLength = parsePositiveInt(args, ++i, "lunghezza massima");
                    case WORKERS_PARAM -> workerThreads = parsePositiveInt(args, ++i, "numero thread");
                    case FRONTIER_PARAM -> maxFrontierSize = parsePositiveLong(args, ++i, "soglia frontiera");
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);

                    default -> {
                        if (args[i].startsWith(GEN_PARAM)) {
                            validateExclusiveMode(basisPath != null || presetName != null, "generazione");
                            generationDepth = parseGenerationDepth(args, i);
                            isGenerationMode = true;
                            i++; // Salta la profondità
                        } else {
                            throw new ConfigurationException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (basisPath == null && presetName == null) {
                presetName = DEFAULT_PRESET;
            }

            return new RunConfiguration(basisPath, presetName, outputPath, maxLength, workerThreads, maxFrontierSize,
                    timeoutSeconds, isGenerationMode, generationDepth);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new ConfigurationException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (-b, -p e -gen sono mutualmente esclusivi)");
            }
        }

        private String parsePresetName(String[] args, int currentIndex) {
            String name = getNextArgument(args, currentIndex, "nome base");
            try {
                BasisPresets.forName(name);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage());
            }
            return name;
        }

        private int parseGenerationDepth(String[] args, int currentIndex) {
            String genType = args[currentIndex].substring(GEN_PARAM.length());
            if (!GEN_BASIS.equals(genType)) {
                throw new ConfigurationException("Tipo generazione non supportato: " + genType +
                        ". Supportati: " + GEN_BASIS);
            }

            String value = getNextArgument(args, currentIndex + 1, "profondità");
            int depth;
            try {
                depth = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Profondità non valida: " + value);
            }

            if (depth < 0 || depth > BasisGenerator.MAX_DEPTH) {
                throw new ConfigurationException("Profondità deve essere tra 0 e " +
                        BasisGenerator.MAX_DEPTH + ", ricevuto: " + depth);
            }
            return depth;
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new ConfigurationException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parsePositiveInt(String[] args, int currentIndex, String argumentType) {
            long value = parsePositiveLong(args, currentIndex, argumentType);
            if (value > Integer.MAX_VALUE) {
                throw new ConfigurationException("Valore " + argumentType + " troppo grande: " + value);
            }
            return (int) value;
        }

        private long parsePositiveLong(String[] args, int currentIndex, String argumentType) {
            String text = getNextArgument(args, currentIndex, argumentType);
            long value;
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Valore " + argumentType + " non valido: " + text);
            }
            if (value < 1) {
                throw new ConfigurationException("Valore " + argumentType + " deve essere positivo, ricevuto: " + value);
            }
            return value;
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            int timeout;
            try {
                timeout = Integer.parseInt(timeoutStr);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Valore timeout non valido: " + timeoutStr);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new ConfigurationException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
            }
            return timeout;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new ConfigurationException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new ConfigurationException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new ConfigurationException("File non leggibile: " + filePath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new ConfigurationException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new ConfigurationException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    //endregion
}
