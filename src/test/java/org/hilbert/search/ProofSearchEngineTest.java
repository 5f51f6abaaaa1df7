package org.hilbert.search;

import org.hilbert.axiom.BasisInstantiator;
import org.hilbert.axiom.BasisPresets;
import org.hilbert.filter.ProofFilter;
import org.hilbert.filter.SymbolLengthScorer;
import org.hilbert.filter.TheoremResult;
import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaParser;
import org.hilbert.proof.ProofLine;
import org.hilbert.proof.ProofState;
import org.hilbert.proof.ProofVerifier;
import org.hilbert.report.ProofReportWriter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.hilbert.formula.Formula.atom;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProofSearchEngineTest {

    @Test
    public void identityNeedsFiveLines() {
        SearchResult result = search(BasisPresets.MINIMAL, 5, 1);

        TheoremResult identity = result.getTheorem(FormulaParser.parse("a -> a")).orElseThrow();

        assertEquals(5, identity.length());
        assertTrue(identity.proof().usesModusPonens());
        assertTrue(identity.proof().lastLine().justification().isModusPonens());
        assertTrue(ProofVerifier.isValid(identity.proof()));

        Set<Formula> expected = Set.of(
                FormulaParser.parse("(a -> ((a -> a) -> a)) -> ((a -> (a -> a)) -> (a -> a))"),
                FormulaParser.parse("a -> ((a -> a) -> a)"),
                FormulaParser.parse("(a -> (a -> a)) -> (a -> a)"),
                FormulaParser.parse("a -> (a -> a)"),
                FormulaParser.parse("a -> a"));
        assertEquals(expected, identity.proof().lines().stream().map(ProofLine::formula).collect(Collectors.toSet()));
    }

    @Test
    public void identityIsNotFoundWithShorterProofs() {
        SearchResult result = search(BasisPresets.MINIMAL, 4, 1);

        assertTrue(result.getTheorem(FormulaParser.parse("a -> a")).isEmpty());
    }

    @Test
    public void lengthThreeTheoremsComeFromOneModusPonens() {
        SearchResult result = search(List.of(atom("a")), 3, 1);

        assertFalse(result.isEmpty());
        assertTrue(result.getTheorem(FormulaParser.parse("(a -> a) -> (a -> a)")).isPresent());
        for (TheoremResult theorem : result.getTheorems().values()) {
            assertEquals(3, theorem.length());
            assertTrue(theorem.proof().lastLine().justification().isModusPonens());
        }
    }

    @Test
    public void resultIsOrderedByLengthThenText() {
        SearchResult result = search(List.of(atom("a")), 4, 1);

        List<TheoremResult> theorems = new ArrayList<>(result.getTheorems().values());
        for (int i = 1; i < theorems.size(); i++) {
            TheoremResult previous = theorems.get(i - 1);
            TheoremResult current = theorems.get(i);
            assertTrue(previous.length() < current.length()
                    || (previous.length() == current.length()
                    && previous.theorem().toString().compareTo(current.theorem().toString()) < 0));
        }
    }

    @Test
    public void retainedProofsPassTheFilterAndCarryTheirScore() {
        SearchResult result = search(List.of(atom("a")), 4, 1);

        for (TheoremResult theorem : result.getTheorems().values()) {
            assertTrue(theorem.length() >= 3);
            assertTrue(theorem.proof().usesModusPonens());
            assertEquals(theorem.proof().symbolLength(), theorem.score());
            assertEquals(theorem.theorem(), theorem.proof().theorem());
        }
    }

    @Test
    public void retainedProofIsSimplestAmongAllProofsOfItsTheorem() {
        List<Formula> basis = List.of(atom("a"), atom("b"));
        SearchResult result = search(basis, 4, 1);

        // Tutte le prove enumerate, livello per livello, senza catalogo
        FrontierExpander expander = new FrontierExpander(new BasisInstantiator(basis).instantiate(),
                new ModusPonensMatcher(), SearchConfiguration.DEFAULT_MAX_FRONTIER_SIZE);
        ProofFilter filter = new ProofFilter();
        SymbolLengthScorer scorer = new SymbolLengthScorer();
        List<ProofState> accepted = new ArrayList<>();

        List<ProofState> level = expander.initialFrontier().frontier();
        for (int length = 2; length <= 4; length++) {
            level = expander.expand(level, length).frontier();
            for (ProofState state : level) {
                if (filter.accepts(state)) {
                    accepted.add(state);
                }
            }
        }

        Map<Formula, Long> minimalScores = new HashMap<>();
        for (ProofState state : accepted) {
            minimalScores.merge(state.theorem(), scorer.score(state), Math::min);
        }
        Map<Formula, Integer> minimalLengths = new HashMap<>();
        for (ProofState state : accepted) {
            if (scorer.score(state) == minimalScores.get(state.theorem())) {
                minimalLengths.merge(state.theorem(), state.length(), Math::min);
            }
        }

        assertEquals(minimalScores.keySet(), result.getTheorems().keySet());
        for (TheoremResult theorem : result.getTheorems().values()) {
            assertEquals(minimalScores.get(theorem.theorem()).longValue(), theorem.score(),
                    theorem.theorem().toString());
            assertEquals(minimalLengths.get(theorem.theorem()).intValue(), theorem.length(),
                    theorem.theorem().toString());
        }
    }

    @Test
    public void lengthTwoCannotUseModusPonensUsefully() {
        SearchResult result = search(BasisPresets.MINIMAL, 2, 1);

        assertTrue(result.isEmpty());
        assertEquals(16 + 256, result.getStatistics().getTotalProofs());
    }

    @Test
    public void emptyBasisGivesEmptyResult() {
        SearchResult result = search(List.of(), 5, 1);

        assertTrue(result.isEmpty());
        assertEquals(0, result.getStatistics().getAxiomInstances());
        assertEquals(1, result.getStatistics().getEmptyFrontierLength());
    }

    @Test
    public void maxLengthOneGivesEmptyResult() {
        SearchResult result = search(BasisPresets.MINIMAL, 1, 1);

        assertTrue(result.isEmpty());
        assertEquals(16, result.getStatistics().getTotalProofs());
    }

    @Test
    public void resultIsIndependentOfThreadCount() {
        ProofReportWriter writer = new ProofReportWriter();

        SearchResult sequential = search(BasisPresets.MINIMAL, 4, 1);
        SearchResult parallel = search(BasisPresets.MINIMAL, 4, 4);
        SearchResult repeated = search(BasisPresets.MINIMAL, 4, 4);

        assertEquals(writer.formatTheorems(sequential), writer.formatTheorems(parallel));
        assertEquals(writer.formatTheorems(parallel), writer.formatTheorems(repeated));
        assertEquals(sequential.getStatistics().toSummary(), parallel.getStatistics().toSummary());
    }

    @Test
    public void statisticsFollowEachLength() {
        SearchResult result = search(List.of(atom("a")), 3, 1);
        SearchStatistics statistics = result.getStatistics();

        assertEquals(3, statistics.getAxiomInstances());
        assertEquals(3, statistics.getLengths().size());
        assertEquals(3, statistics.getLengths().get(0).uniqueProofs());
        assertEquals(9, statistics.getLengths().get(1).uniqueProofs());
        assertEquals(result.size(), statistics.getTheorems());
    }

    @Test
    public void progressIsReportedForEveryLength() {
        List<Integer> lengths = new ArrayList<>();
        ProofSearchEngine engine = new ProofSearchEngine(configuration(List.of(atom("a")), 3, 1));
        engine.setProgressListener((length, frontierSize, theoremCount) -> lengths.add(length));

        engine.search();

        assertEquals(List.of(1, 2, 3), lengths);
    }

    @Test
    public void frontierCeilingStopsTheSearch() {
        SearchConfiguration configuration = SearchConfiguration.builder()
                .basis(BasisPresets.MINIMAL)
                .maxLength(3)
                .maxFrontierSize(100)
                .build();

        ResourceExhaustedException error = assertThrows(ResourceExhaustedException.class,
                () -> new ProofSearchEngine(configuration).search());
        assertEquals(2, error.getLength());
    }

    @Test
    public void interruptedSearchFails() {
        ProofSearchEngine engine = new ProofSearchEngine(configuration(BasisPresets.MINIMAL, 3, 1));

        Thread.currentThread().interrupt();
        try {
            assertThrows(ProofSearchException.class, engine::search);
        } finally {
            Thread.interrupted();
        }
    }

    private static SearchResult search(List<Formula> basis, int maxLength, int threads) {
        return new ProofSearchEngine(configuration(basis, maxLength, threads)).search();
    }

    private static SearchConfiguration configuration(List<Formula> basis, int maxLength, int threads) {
        return SearchConfiguration.builder()
                .basis(basis)
                .maxLength(maxLength)
                .workerThreads(threads)
                .build();
    }
}
