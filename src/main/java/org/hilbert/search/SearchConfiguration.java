package org.hilbert.search;

import org.hilbert.formula.Formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * CONFIGURAZIONE DELLA RICERCA - Parametri immutabili di una esecuzione
 *
 * PARAMETRI:
 * - base: formule di sostituzione per gli schemi (ordine preservato, duplicati rimossi)
 * - lunghezza massima delle prove esplorate (≥ 1)
 * - thread di lavoro per l'espansione di ogni livello (1 = sequenziale)
 * - soglia massima di stati per frontiera
 * - verifica finale delle prove migliori tramite riesecuzione
 *
 * Una base vuota è ammessa: produce un risultato vuoto senza errori.
 */
public final class SearchConfiguration {

    public static final int DEFAULT_MAX_LENGTH = 5;
    public static final int DEFAULT_WORKER_THREADS = 1;
    public static final long DEFAULT_MAX_FRONTIER_SIZE = 5_000_000L;

    private final List<Formula> basis;
    private final int maxLength;
    private final int workerThreads;
    private final long maxFrontierSize;
    private final boolean verifyResults;

    private SearchConfiguration(Builder builder) {
        this.basis = List.copyOf(new LinkedHashSet<>(builder.basis));
        this.maxLength = builder.maxLength;
        this.workerThreads = builder.workerThreads;
        this.maxFrontierSize = builder.maxFrontierSize;
        this.verifyResults = builder.verifyResults;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Formula> getBasis() {
        return basis;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public long getMaxFrontierSize() {
        return maxFrontierSize;
    }

    public boolean isVerifyResults() {
        return verifyResults;
    }

    public boolean isParallel() {
        return workerThreads > 1;
    }

    @Override
    public String toString() {
        return "SearchConfiguration[base=" + basis.size() + " formule, lunghezza max=" + maxLength
                + ", thread=" + workerThreads + ", soglia frontiera=" + maxFrontierSize + "]";
    }

    /**
     * Costruttore fluente, la validazione avviene in {@link #build()}.
     */
    public static final class Builder {

        private final List<Formula> basis = new ArrayList<>();
        private int maxLength = DEFAULT_MAX_LENGTH;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private long maxFrontierSize = DEFAULT_MAX_FRONTIER_SIZE;
        private boolean verifyResults = true;

        private Builder() {
        }

        public Builder basis(List<Formula> formulas) {
            if (formulas == null) {
                throw new ConfigurationException("Base non può essere null");
            }
            basis.clear();
            basis.addAll(formulas);
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder maxFrontierSize(long maxFrontierSize) {
            this.maxFrontierSize = maxFrontierSize;
            return this;
        }

        public Builder verifyResults(boolean verifyResults) {
            this.verifyResults = verifyResults;
            return this;
        }

        /**
         * @throws ConfigurationException se un parametro è fuori intervallo
         */
        public SearchConfiguration build() {
            if (basis.contains(null)) {
                throw new ConfigurationException("Base contiene formule null");
            }
            if (maxLength < 1) {
                throw new ConfigurationException("Lunghezza massima deve essere positiva, ricevuta: " + maxLength);
            }
            if (workerThreads < 1) {
                throw new ConfigurationException("Numero thread deve essere positivo, ricevuto: " + workerThreads);
            }
            if (maxFrontierSize < 1) {
                throw new ConfigurationException("Soglia frontiera deve essere positiva, ricevuta: " + maxFrontierSize);
            }
            return new SearchConfiguration(this);
        }
    }
}
