package org.hilbert.search;

import org.hilbert.axiom.BasisInstantiator;
import org.hilbert.filter.ComplexityScorer;
import org.hilbert.filter.ProofFilter;
import org.hilbert.filter.SymbolLengthScorer;
import org.hilbert.filter.TheoremCatalog;
import org.hilbert.filter.TheoremResult;
import org.hilbert.formula.Formula;
import org.hilbert.proof.ProofLine;
import org.hilbert.proof.ProofState;
import org.hilbert.proof.ProofVerifier;
import org.hilbert.search.FrontierExpander.LevelExpansion;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * MOTORE DI RICERCA PROVE - Esplorazione esaustiva limitata in lunghezza
 *
 * PIPELINE:
 * 1. Istanziazione degli schemi A1, A2, A3 sulla base -> frontiera di lunghezza 1
 * 2. Per N = 2..lunghezza massima: espansione della frontiera N-1 con assiomi e
 *    conseguenze MP, deduplicazione per firma a livello N
 * 3. Ogni prova conservata viene offerta al catalogo dei teoremi non appena il
 *    suo livello è completo (barriera), nell'ordine di frontiera
 * 4. Verifica per riesecuzione delle prove migliori (se abilitata)
 *
 * Lo stato di una esecuzione (indici, frontiere, catalogo) è interamente locale
 * alla chiamata {@link #search()}: ricerche indipendenti possono procedere in parallelo.
 *
 * Nessun effetto collaterale oltre al risultato restituito e al listener di avanzamento.
 */
public class ProofSearchEngine {

    private static final Logger LOGGER = Logger.getLogger(ProofSearchEngine.class.getName());

    private final SearchConfiguration configuration;
    private final ComplexityScorer scorer;
    private final ModusPonensMatcher matcher;
    private SearchProgressListener progressListener = SearchProgressListener.NONE;

    public ProofSearchEngine(SearchConfiguration configuration) {
        this(configuration, new SymbolLengthScorer());
    }

    public ProofSearchEngine(SearchConfiguration configuration, ComplexityScorer scorer) {
        if (configuration == null || scorer == null) {
            throw new IllegalArgumentException("Configurazione e punteggio non possono essere null");
        }
        this.configuration = configuration;
        this.scorer = scorer;
        this.matcher = new ModusPonensMatcher();
    }

    public void setProgressListener(SearchProgressListener progressListener) {
        this.progressListener = progressListener != null ? progressListener : SearchProgressListener.NONE;
    }

    //region RICERCA

    /**
     * @return teoremi trovati con la rispettiva prova più semplice
     * @throws ResourceExhaustedException se una frontiera supera la soglia configurata
     * @throws ProofSearchException se il thread viene interrotto
     */
    public SearchResult search() {
        LOGGER.info("=== AVVIO RICERCA PROVE === " + configuration);

        SearchStatistics statistics = new SearchStatistics();
        TheoremCatalog catalog = new TheoremCatalog(scorer, new ProofFilter());

        BasisInstantiator instantiator = new BasisInstantiator(configuration.getBasis());
        List<ProofLine> axioms = instantiator.instantiate();
        statistics.setAxiomInstances(axioms.size(), instantiator.getCombinationsExamined());

        FrontierExpander expander = new FrontierExpander(axioms, matcher, configuration.getMaxFrontierSize());
        ExecutorService executor = configuration.isParallel()
                ? Executors.newFixedThreadPool(configuration.getWorkerThreads())
                : null;

        try {
            LevelExpansion level = expander.initialFrontier();
            completeLevel(level, catalog, statistics);

            for (int length = 2; length <= configuration.getMaxLength(); length++) {
                if (level.frontier().isEmpty()) {
                    LOGGER.warning("Nessuna prova di lunghezza " + (length - 1) + ", ricerca interrotta");
                    statistics.setEmptyFrontierLength(length - 1);
                    break;
                }

                level = executor == null
                        ? expander.expand(level.frontier(), length)
                        : expander.expand(level.frontier(), length, executor, configuration.getWorkerThreads());
                completeLevel(level, catalog, statistics);
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        Map<Formula, TheoremResult> theorems = catalog.results();
        if (configuration.isVerifyResults()) {
            for (TheoremResult result : theorems.values()) {
                ProofVerifier.verify(result.proof());
            }
        }

        statistics.setFilteredProofs(catalog.getAcceptedCount());
        statistics.setTheorems(theorems.size());
        statistics.stopTimer();

        LOGGER.info("Ricerca completata: " + statistics.toCompactString());
        return new SearchResult(configuration, theorems, statistics);
    }

    /**
     * Chiude un livello dopo la barriera: catalogo, statistiche, listener.
     */
    private void completeLevel(LevelExpansion level, TheoremCatalog catalog, SearchStatistics statistics) {
        for (ProofState state : level.frontier()) {
            catalog.offer(state);
        }

        statistics.recordLength(level.length(), level.candidates(), level.duplicates(), level.frontier().size());
        LOGGER.fine("Livello " + level.length() + " completato: " + level.frontier().size() + " prove, "
                + catalog.theoremCount() + " teoremi");

        progressListener.onLengthCompleted(level.length(), level.frontier().size(), catalog.theoremCount());
    }

    //endregion
}
