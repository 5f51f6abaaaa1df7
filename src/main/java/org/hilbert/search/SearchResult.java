package org.hilbert.search;

import org.hilbert.filter.TheoremResult;
import org.hilbert.formula.Formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * RISULTATO DELLA RICERCA - Contenitore immutabile
 *
 * COMPONENTI:
 * - Teoremi: mappa teorema -> miglior prova, ordinata per lunghezza e forma stampata
 * - Statistiche: metriche di esecuzione
 * - Configurazione usata
 */
public class SearchResult {

    private final SearchConfiguration configuration;
    private final Map<Formula, TheoremResult> theorems;
    private final SearchStatistics statistics;

    public SearchResult(SearchConfiguration configuration, Map<Formula, TheoremResult> theorems,
                        SearchStatistics statistics) {
        if (configuration == null || theorems == null) {
            throw new IllegalArgumentException("Configurazione e teoremi non possono essere null");
        }
        this.configuration = configuration;
        this.theorems = Collections.unmodifiableMap(new LinkedHashMap<>(theorems));
        this.statistics = statistics != null ? statistics : new SearchStatistics();
    }

    public SearchConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return mappa non modificabile, iterazione in ordine di presentazione
     */
    public Map<Formula, TheoremResult> getTheorems() {
        return theorems;
    }

    public Optional<TheoremResult> getTheorem(Formula theorem) {
        return Optional.ofNullable(theorems.get(theorem));
    }

    public int size() {
        return theorems.size();
    }

    public boolean isEmpty() {
        return theorems.isEmpty();
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "SearchResult[" + theorems.size() + " teoremi, " + statistics.toCompactString() + "]";
    }
}
