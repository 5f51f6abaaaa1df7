package org.hilbert.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * STATISTICHE DI RICERCA - Metriche raccolte durante l'esplorazione in ampiezza
 *
 * Raccoglie il numero di istanze di assioma, i contatori per ciascuna lunghezza
 * (candidati, duplicati scartati, prove uniche), i totali del filtro finale e
 * il tempo di esecuzione.
 */
public class SearchStatistics {

    //region CONTATORI

    /** Istanze di assioma uniche (frontiera di lunghezza 1) */
    private int axiomInstances = 0;

    /** Assegnamenti esaminati dall'istanziatore, duplicati inclusi */
    private int axiomCombinations = 0;

    /** Contatori per lunghezza, in ordine crescente */
    private final List<LengthStatistics> lengths = new ArrayList<>();

    /** Prove di lunghezza ≥ 3 che usano Modus Ponens */
    private long filteredProofs = 0;

    /** Teoremi distinti nel risultato */
    private int theorems = 0;

    /** Lunghezza alla quale la ricerca si è fermata per frontiera vuota (0 se mai) */
    private int emptyFrontierLength = 0;

    //endregion

    //region TIMING

    private long executionTimeMs = 0;
    private final long startTime;
    private boolean timerStopped = false;

    //endregion

    /**
     * Contatori di un singolo livello.
     */
    public record LengthStatistics(int length, long candidates, long duplicates, int uniqueProofs) {
    }

    public SearchStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region AGGIORNAMENTO

    public void setAxiomInstances(int instances, int combinations) {
        this.axiomInstances = instances;
        this.axiomCombinations = combinations;
    }

    public void recordLength(int length, long candidates, long duplicates, int uniqueProofs) {
        lengths.add(new LengthStatistics(length, candidates, duplicates, uniqueProofs));
    }

    public void setFilteredProofs(long filteredProofs) {
        this.filteredProofs = filteredProofs;
    }

    public void setTheorems(int theorems) {
        this.theorems = theorems;
    }

    public void setEmptyFrontierLength(int length) {
        this.emptyFrontierLength = length;
    }

    /**
     * Operazione idempotente: chiamate multiple sono sicure.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region LETTURA

    public int getAxiomInstances() {
        return axiomInstances;
    }

    public int getAxiomCombinations() {
        return axiomCombinations;
    }

    public List<LengthStatistics> getLengths() {
        return Collections.unmodifiableList(lengths);
    }

    /** @return prove uniche conservate su tutte le lunghezze */
    public long getTotalProofs() {
        long total = 0;
        for (LengthStatistics length : lengths) {
            total += length.uniqueProofs();
        }
        return total;
    }

    public long getFilteredProofs() {
        return filteredProofs;
    }

    public int getTheorems() {
        return theorems;
    }

    public int getEmptyFrontierLength() {
        return emptyFrontierLength;
    }

    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    //endregion

    //region OUTPUT

    /**
     * Righe di avanzamento e riepilogo nel formato del report finale, senza tempi:
     * due esecuzioni con la stessa configurazione producono lo stesso testo.
     */
    public String toSummary() {
        StringBuilder output = new StringBuilder();
        output.append("Trovate ").append(axiomInstances).append(" prove uniche di lunghezza 1.\n");

        for (LengthStatistics length : lengths) {
            if (length.length() == 1) continue;
            output.append("Lunghezza ").append(length.length()).append(": ")
                    .append(length.candidates()).append(" candidati, ")
                    .append(length.duplicates()).append(" duplicati scartati, ")
                    .append(length.uniqueProofs()).append(" nuove prove uniche.\n");
        }
        if (emptyFrontierLength > 0) {
            output.append("Nessuna prova di lunghezza ").append(emptyFrontierLength)
                    .append(", ricerca interrotta.\n");
        }

        output.append("Trovate in totale ").append(getTotalProofs()).append(" prove (incluse non minime).\n");
        output.append("Trovate ").append(filteredProofs)
                .append(" prove di lunghezza 3 o più che usano Modus Ponens.\n");
        output.append("Prova più semplice per ciascuno di ").append(theorems).append(" teoremi distinti.\n");
        return output.toString();
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("==========================[ RICERCA COMPLETATA: STATISTICHE ]==========================\n");
        output.append("    Istanze assiomi: ").append(axiomInstances)
                .append(" (").append(axiomCombinations).append(" assegnamenti)\n");
        for (LengthStatistics length : lengths) {
            output.append(String.format("    Lunghezza %d: %d candidati, %d duplicati, %d prove%n",
                    length.length(), length.candidates(), length.duplicates(), length.uniqueProofs()));
        }
        output.append("    Prove totali:    ").append(getTotalProofs()).append("\n");
        output.append("    Prove filtrate:  ").append(filteredProofs).append("\n");
        output.append("    Teoremi:         ").append(theorems).append("\n");
        output.append("    Tempo:           ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=======================================================================================\n");
        return output.toString();
    }

    public String toCompactString() {
        return String.format("Stats[Assiomi:%d, Prove:%d, Filtrate:%d, Teoremi:%d, Time:%dms]",
                axiomInstances, getTotalProofs(), filteredProofs, theorems, getExecutionTimeMs());
    }

    //endregion
}
