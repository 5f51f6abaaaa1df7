package org.hilbert.search;

import org.hilbert.proof.ModusPonensJustification;
import org.hilbert.proof.ProofLine;
import org.hilbert.proof.ProofState;
import org.hilbert.search.FrontierExpander.LevelExpansion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hilbert.search.SearchFixtures.A1;
import static org.hilbert.search.SearchFixtures.A2;
import static org.hilbert.search.SearchFixtures.A3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FrontierExpanderTest {

    private static final List<ProofLine> AXIOMS = List.of(A1, A2, A3);

    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    public void shutdown() {
        executor.shutdownNow();
    }

    @Test
    public void initialFrontierHasOneProofPerAxiom() {
        LevelExpansion level = expander(100).initialFrontier();

        assertEquals(1, level.length());
        assertEquals(3, level.frontier().size());
        assertEquals(0, level.duplicates());
    }

    @Test
    public void proofsEndingInSameTheoremAreAllKept() {
        FrontierExpander expander = expander(100);

        LevelExpansion level = expander.expand(expander.initialFrontier().frontier(), 2);

        assertEquals(9, level.frontier().size());
        assertEquals(3, level.frontier().stream().filter(state -> state.theorem().equals(A1.formula())).count());
    }

    @Test
    public void repeatedConsequenceIsDiscardedKeepingFirstPair() {
        ProofState parent = ProofState.of(List.of(A1, A1, A2));

        LevelExpansion level = expander(100).expand(List.of(parent), 4);

        // 3 assiomi + MP(1,3) + MP(2,3), le due conseguenze MP hanno la stessa firma
        assertEquals(5, level.candidates());
        assertEquals(4, level.frontier().size());
        assertEquals(1, level.duplicates());
        assertEquals(new ModusPonensJustification(0, 2), level.frontier().get(3).lastLine().justification());
    }

    @Test
    public void parallelExpansionMatchesSequentialOrder() {
        FrontierExpander expander = expander(1_000_000);
        LevelExpansion second = expander.expand(expander.initialFrontier().frontier(), 2);

        LevelExpansion sequential = expander.expand(second.frontier(), 3);
        LevelExpansion parallel = expander.expand(second.frontier(), 3, executor, 3);

        assertEquals(sequential.candidates(), parallel.candidates());
        assertEquals(signatures(sequential), signatures(parallel));
    }

    @Test
    public void parallelExpansionDiscardsDuplicatesAcrossChunks() {
        ProofState parent = ProofState.of(List.of(A1, A1, A2));

        LevelExpansion level = expander(100).expand(List.of(parent, parent), 4, executor, 3);

        assertEquals(10, level.candidates());
        assertEquals(4, level.frontier().size());
    }

    @Test
    public void frontierCeilingIsEnforced() {
        FrontierExpander expander = expander(5);
        List<ProofState> initial = expander.initialFrontier().frontier();

        ResourceExhaustedException error = assertThrows(ResourceExhaustedException.class,
                () -> expander.expand(initial, 2));
        assertEquals(2, error.getLength());
        assertEquals(5, error.getCeiling());
    }

    @Test
    public void parallelFrontierCeilingIsEnforced() {
        FrontierExpander expander = expander(5);
        List<ProofState> initial = expander.initialFrontier().frontier();

        assertThrows(ResourceExhaustedException.class, () -> expander.expand(initial, 2, executor, 3));
    }

    private static FrontierExpander expander(long ceiling) {
        return new FrontierExpander(AXIOMS, new ModusPonensMatcher(), ceiling);
    }

    private static List<Object> signatures(LevelExpansion level) {
        return level.frontier().stream().map(state -> (Object) state.signature()).toList();
    }
}
