package org.hilbert.report;

import org.hilbert.axiom.BasisPresets;
import org.hilbert.formula.FormulaParser;
import org.hilbert.search.ProofSearchEngine;
import org.hilbert.search.SearchConfiguration;
import org.hilbert.search.SearchResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.hilbert.formula.Formula.atom;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProofReportWriterTest {

    private static SearchResult result;

    private final ProofReportWriter writer = new ProofReportWriter();

    @BeforeAll
    public static void search() {
        result = new ProofSearchEngine(SearchConfiguration.builder()
                .basis(List.of(atom("a")))
                .maxLength(3)
                .build()).search();
    }

    @Test
    public void proofLinesAreNumberedAndAligned() {
        String text = writer.formatProof(result.getTheorem(FormulaParser.parse("(a -> a) -> (a -> a)"))
                .orElseThrow().proof());

        String expected = ""
                + "  1. (a → (a → a))                           A1 [A=a, B=a]\n"
                + "  2. ((a → (a → a)) → ((a → a) → (a → a)))   A2 [A=a, B=a, C=a]\n"
                + "  3. ((a → a) → (a → a))                     MP (1,2)\n"
                + "--------------------\n";
        assertEquals(expected, text);
    }

    @Test
    public void everyTheoremIsListed() {
        String text = writer.formatTheorems(result);

        assertEquals(result.size(), text.split("--------------------\n", -1).length - 1);
    }

    @Test
    public void emptyResultIsReported() {
        SearchResult empty = new ProofSearchEngine(SearchConfiguration.builder()
                .basis(BasisPresets.MINIMAL)
                .maxLength(2)
                .build()).search();

        assertTrue(writer.formatTheorems(empty).startsWith("Nessuna prova"));
    }

    @Test
    public void reportAndStatisticsAreWritten(@TempDir Path outputDirectory) throws IOException {
        Path resultFile = writer.write(outputDirectory, result, LocalDateTime.of(2024, 1, 1, 12, 0));

        assertEquals(outputDirectory.resolve("RESULT").resolve("proof_output.txt"), resultFile);
        String report = Files.readString(resultFile, StandardCharsets.UTF_8);
        assertTrue(report.startsWith("Avvio generazione prove: 2024-01-01 12:00:00\n"));
        assertTrue(report.contains("Base (dimensione 1): [a]"));
        assertTrue(report.contains(writer.formatTheorems(result)));
        assertTrue(Files.isRegularFile(outputDirectory.resolve("STATS").resolve("search.stats")));
    }
}
