package org.hilbert.search;

import org.hilbert.proof.ProofLine;
import org.hilbert.proof.ProofState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * ESPANSORE DI FRONTIERA - Passo N-1 -> N della ricerca in ampiezza
 *
 * Ogni stato di lunghezza N-1 viene esteso in coda con:
 * (a) ciascuna istanza di assioma, nell'ordine dell'istanziatore
 * (b) ciascuna conseguenza Modus Ponens fornita dal matcher
 * Un candidato entra nella frontiera di lunghezza N solo se la sua firma non è
 * già stata raggiunta a quella lunghezza.
 *
 * MODALITÀ PARALLELA:
 * La frontiera precedente è divisa in blocchi contigui. Ogni candidato riceve un
 * ordinale di scoperta (indice del padre, indice locale) e la firma viene
 * reclamata nell'indice condiviso tenendo l'ordinale minimo. Dopo la barriera
 * ogni blocco conserva solo i candidati proprietari della propria firma: la
 * frontiera risultante coincide elemento per elemento con quella sequenziale.
 */
public class FrontierExpander {

    private static final Logger LOGGER = Logger.getLogger(FrontierExpander.class.getName());

    /** Blocchi per thread, per bilanciare padri con numero di conseguenze MP diverso */
    private static final int CHUNKS_PER_WORKER = 4;

    /** Ogni quanti candidati un blocco parallelo controlla la soglia di frontiera */
    private static final int CEILING_CHECK_INTERVAL = 4096;

    private final List<ProofLine> axioms;
    private final ModusPonensMatcher matcher;
    private final long maxFrontierSize;

    public FrontierExpander(List<ProofLine> axioms, ModusPonensMatcher matcher, long maxFrontierSize) {
        this.axioms = List.copyOf(axioms);
        this.matcher = matcher;
        this.maxFrontierSize = maxFrontierSize;
    }

    /**
     * Frontiera e contatori di un livello completato.
     *
     * @param frontier prove uniche della lunghezza, in ordine di scoperta
     * @param candidates candidati generati, duplicati inclusi
     */
    public record LevelExpansion(int length, List<ProofState> frontier, long candidates) {

        public long duplicates() {
            return candidates - frontier.size();
        }
    }

    //region LIVELLO INIZIALE

    /**
     * @return prove di lunghezza 1, una per istanza di assioma
     */
    public LevelExpansion initialFrontier() {
        SignatureIndex index = new SignatureIndex(axioms.size());
        List<ProofState> frontier = new ArrayList<>(axioms.size());

        for (ProofLine axiom : axioms) {
            ProofState state = ProofState.start(axiom);
            if (index.reserveIfAbsent(state.signature())) {
                frontier.add(state);
                checkCeiling(1, frontier.size());
            }
        }
        return new LevelExpansion(1, frontier, axioms.size());
    }

    //endregion

    //region ESPANSIONE SEQUENZIALE

    public LevelExpansion expand(List<ProofState> previous, int length) {
        SignatureIndex index = new SignatureIndex();
        List<ProofState> frontier = new ArrayList<>();
        long candidates = 0;

        for (ProofState parent : previous) {
            checkInterrupted(length);

            for (ProofState candidate : candidatesOf(parent)) {
                candidates++;
                if (index.reserveIfAbsent(candidate.signature())) {
                    frontier.add(candidate);
                    checkCeiling(length, frontier.size());
                }
            }
        }

        LOGGER.fine("Lunghezza " + length + ": " + frontier.size() + " prove uniche da " + candidates + " candidati");
        return new LevelExpansion(length, frontier, candidates);
    }

    //endregion

    //region ESPANSIONE PARALLELA

    /**
     * @param executor pool su cui eseguire i blocchi; la chiamata ritorna dopo la barriera
     * @param workers numero di thread del pool
     */
    public LevelExpansion expand(List<ProofState> previous, int length, ExecutorService executor, int workers) {
        if (previous.isEmpty()) {
            return new LevelExpansion(length, List.of(), 0);
        }

        SignatureIndex index = new SignatureIndex();
        int chunkCount = Math.min(previous.size(), workers * CHUNKS_PER_WORKER);

        // Fase 1: generazione candidati e rivendicazione delle firme
        List<Callable<List<Candidate>>> claimTasks = new ArrayList<>(chunkCount);
        for (int chunk = 0; chunk < chunkCount; chunk++) {
            int start = (int) ((long) chunk * previous.size() / chunkCount);
            int end = (int) ((long) (chunk + 1) * previous.size() / chunkCount);
            claimTasks.add(() -> claimChunk(previous, start, end, length, index));
        }
        List<List<Candidate>> claimed = runAll(executor, claimTasks, length);

        long candidates = 0;
        for (List<Candidate> chunkCandidates : claimed) {
            candidates += chunkCandidates.size();
        }
        checkCeiling(length, index.size());

        // Fase 2: ogni blocco conserva i candidati proprietari della firma
        List<Callable<List<ProofState>>> ownerTasks = new ArrayList<>(chunkCount);
        for (List<Candidate> chunkCandidates : claimed) {
            ownerTasks.add(() -> ownedStates(chunkCandidates, index));
        }
        List<List<ProofState>> owned = runAll(executor, ownerTasks, length);

        List<ProofState> frontier = new ArrayList<>((int) index.size());
        for (List<ProofState> states : owned) {
            frontier.addAll(states);
        }

        LOGGER.fine("Lunghezza " + length + ": " + frontier.size() + " prove uniche da " + candidates
                + " candidati (" + chunkCount + " blocchi)");
        return new LevelExpansion(length, frontier, candidates);
    }

    private List<Candidate> claimChunk(List<ProofState> previous, int start, int end, int length,
                                       SignatureIndex index) {
        List<Candidate> chunkCandidates = new ArrayList<>();

        for (int parentIndex = start; parentIndex < end; parentIndex++) {
            checkInterrupted(length);

            long local = 0;
            for (ProofState candidate : candidatesOf(previous.get(parentIndex))) {
                long ordinal = ((long) parentIndex << 32) | local++;
                index.claim(candidate.signature(), ordinal);
                chunkCandidates.add(new Candidate(candidate, ordinal));

                if (chunkCandidates.size() % CEILING_CHECK_INTERVAL == 0) {
                    checkCeiling(length, index.size());
                }
            }
        }
        return chunkCandidates;
    }

    private static List<ProofState> ownedStates(List<Candidate> chunkCandidates, SignatureIndex index) {
        List<ProofState> states = new ArrayList<>();
        for (Candidate candidate : chunkCandidates) {
            if (index.isOwner(candidate.state().signature(), candidate.ordinal())) {
                states.add(candidate.state());
            }
        }
        return states;
    }

    /**
     * Esegue i compiti e attende che terminino tutti: è la barriera di fine livello.
     */
    private static <T> List<T> runAll(ExecutorService executor, List<Callable<T>> tasks, int length) {
        try {
            List<Future<T>> futures = executor.invokeAll(tasks);
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProofSearchException("Ricerca interrotta durante la lunghezza " + length, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ProofSearchException("Errore nell'espansione della lunghezza " + length, cause);
        }
    }

    private record Candidate(ProofState state, long ordinal) {
    }

    //endregion

    //region SUPPORTO

    /**
     * Estensioni di un padre: prima gli assiomi, poi le conseguenze MP.
     */
    private List<ProofState> candidatesOf(ProofState parent) {
        List<ProofLine> consequences = matcher.match(parent);
        List<ProofState> extensions = new ArrayList<>(axioms.size() + consequences.size());

        for (ProofLine axiom : axioms) {
            extensions.add(parent.extend(axiom));
        }
        for (ProofLine consequence : consequences) {
            extensions.add(parent.extend(consequence));
        }
        return extensions;
    }

    private void checkCeiling(int length, long frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new ResourceExhaustedException(length, frontierSize, maxFrontierSize);
        }
    }

    private static void checkInterrupted(int length) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProofSearchException("Ricerca interrotta durante la lunghezza " + length);
        }
    }

    //endregion
}
