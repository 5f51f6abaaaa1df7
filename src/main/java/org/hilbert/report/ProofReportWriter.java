package org.hilbert.report;

import org.hilbert.filter.TheoremResult;
import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaPrinter;
import org.hilbert.proof.ProofLine;
import org.hilbert.proof.ProofState;
import org.hilbert.search.SearchConfiguration;
import org.hilbert.search.SearchResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * REPORT DELLE PROVE - Presentazione e salvataggio dei risultati
 *
 * FORMATO DI UNA PROVA:
 * <pre>
 *   1. (a → ((a → a) → a))                       A1 [A=a, B=(a → a)]
 *   ...
 *   5. (a → a)                                   MP (4,3)
 * --------------------
 * </pre>
 * Le formule sono allineate sulla più lunga della prova, gli indici MP sono 1-based.
 *
 * ORGANIZZAZIONE OUTPUT:
 * - RESULT/proof_output.txt: intestazione, riepilogo della ricerca, prove migliori
 * - STATS/search.stats: statistiche dettagliate con tempi
 */
public class ProofReportWriter {

    private static final Logger LOGGER = Logger.getLogger(ProofReportWriter.class.getName());

    public static final String RESULT_DIR = "RESULT";
    public static final String STATS_DIR = "STATS";
    public static final String RESULT_FILE = "proof_output.txt";
    public static final String STATS_FILE = "search.stats";

    private static final String PROOF_SEPARATOR = "-".repeat(20);
    private static final String HEADER_SEPARATOR = "=".repeat(30);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    //region FORMATTAZIONE

    /**
     * @return righe numerate della prova seguite dal separatore
     */
    public String formatProof(ProofState proof) {
        List<ProofLine> lines = proof.lines();
        List<String> formulas = lines.stream()
                .map(line -> FormulaPrinter.render(line.formula()))
                .collect(Collectors.toList());
        int width = formulas.stream().mapToInt(String::length).max().orElse(0);

        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            String formula = formulas.get(i);
            builder.append("  ").append(i + 1).append(". ")
                    .append(formula).append(" ".repeat(width - formula.length()))
                    .append("   ").append(lines.get(i).justification().describe())
                    .append('\n');
        }
        builder.append(PROOF_SEPARATOR).append('\n');
        return builder.toString();
    }

    /**
     * Parte deterministica del report: tutte le prove migliori nell'ordine del risultato.
     */
    public String formatTheorems(SearchResult result) {
        if (result.isEmpty()) {
            return "Nessuna prova di lunghezza 3 o più che usi Modus Ponens.\n";
        }
        StringBuilder builder = new StringBuilder();
        for (TheoremResult theorem : result.getTheorems().values()) {
            builder.append(formatProof(theorem.proof()));
        }
        return builder.toString();
    }

    /**
     * Report completo: intestazione, base, riepilogo, prove.
     */
    public String formatReport(SearchResult result, LocalDateTime startedAt) {
        SearchConfiguration configuration = result.getConfiguration();
        List<Formula> basis = configuration.getBasis();

        StringBuilder builder = new StringBuilder();
        builder.append("Avvio generazione prove: ").append(TIMESTAMP.format(startedAt)).append('\n');
        builder.append("Lunghezza massima: ").append(configuration.getMaxLength()).append('\n');
        builder.append("Dimensione base: ").append(basis.size()).append('\n');
        builder.append(HEADER_SEPARATOR).append("\n\n");

        builder.append("--- Istanze di assioma (lunghezza 1) ---\n");
        builder.append("Base (dimensione ").append(basis.size()).append("): ")
                .append(basis.stream().map(FormulaPrinter::render).collect(Collectors.joining(", ", "[", "]")))
                .append("\n\n");

        builder.append("--- Ricerca fino a lunghezza ").append(configuration.getMaxLength()).append(" ---\n");
        builder.append(result.getStatistics().toSummary()).append('\n');

        builder.append(formatTheorems(result));
        builder.append(String.format("%nTempo totale di esecuzione: %.4f secondi.%n",
                result.getStatistics().getExecutionTimeMs() / 1000.0));
        return builder.toString();
    }

    //endregion

    //region SALVATAGGIO FILE

    /**
     * Salva report e statistiche sotto la directory di output.
     *
     * @return percorso del file dei risultati
     * @throws IOException se errori durante il salvataggio
     */
    public Path write(Path outputDirectory, SearchResult result, LocalDateTime startedAt) throws IOException {
        Path resultDir = outputDirectory.resolve(RESULT_DIR);
        Files.createDirectories(resultDir);
        Path resultFile = resultDir.resolve(RESULT_FILE);

        try (Writer writer = Files.newBufferedWriter(resultFile, StandardCharsets.UTF_8)) {
            writer.write(formatReport(result, startedAt));
        }
        LOGGER.info("Risultati salvati: " + resultFile);

        Path statsDir = outputDirectory.resolve(STATS_DIR);
        Files.createDirectories(statsDir);
        Path statsFile = statsDir.resolve(STATS_FILE);

        try (Writer writer = Files.newBufferedWriter(statsFile, StandardCharsets.UTF_8)) {
            writer.write(result.getConfiguration().toString());
            writer.write('\n');
            writer.write(result.getStatistics().toString());
        }
        LOGGER.info("Statistiche salvate: " + statsFile);

        return resultFile;
    }

    //endregion
}
