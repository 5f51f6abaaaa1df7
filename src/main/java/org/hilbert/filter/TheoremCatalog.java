package org.hilbert.filter;

import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaPrinter;
import org.hilbert.proof.ProofState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * CATALOGO DEI TEOREMI - Prova più semplice per ogni teorema distinto
 *
 * Riceve le prove nell'ordine di scoperta della ricerca (lunghezza crescente, poi
 * ordine di frontiera), scarta quelle rifiutate dal filtro e conserva per ogni
 * formula finale la prova di punteggio minimo.
 *
 * CRITERIO DI SOSTITUZIONE:
 * - punteggio strettamente minore, oppure
 * - punteggio uguale e meno righe
 * A parità completa resta la prova scoperta per prima, per cui il risultato è
 * riproducibile purché l'ordine di offerta lo sia.
 *
 * Il catalogo vive per l'intera esecuzione e viene solo aggiornato, mai svuotato.
 */
public class TheoremCatalog {

    private static final Logger LOGGER = Logger.getLogger(TheoremCatalog.class.getName());

    private static final Comparator<TheoremResult> PRESENTATION_ORDER =
            Comparator.comparingInt(TheoremResult::length)
                    .thenComparing(result -> FormulaPrinter.render(result.theorem()));

    private final ComplexityScorer scorer;
    private final ProofFilter filter;
    private final Map<Formula, TheoremResult> best = new HashMap<>();

    private long offered;
    private long accepted;

    public TheoremCatalog(ComplexityScorer scorer, ProofFilter filter) {
        this.scorer = scorer;
        this.filter = filter;
    }

    /**
     * @return true se la prova è diventata la migliore per il suo teorema
     */
    public boolean offer(ProofState state) {
        offered++;
        if (!filter.accepts(state)) {
            return false;
        }
        accepted++;

        long score = scorer.score(state);
        TheoremResult current = best.get(state.theorem());

        if (current == null || isSimpler(score, state.length(), current)) {
            best.put(state.theorem(), new TheoremResult(state.theorem(), state, score));
            return true;
        }
        return false;
    }

    private static boolean isSimpler(long score, int length, TheoremResult current) {
        return score < current.score() || (score == current.score() && length < current.length());
    }

    /**
     * @return mappa teorema -> miglior prova, ordinata per lunghezza della prova e
     *         poi per forma stampata del teorema
     */
    public Map<Formula, TheoremResult> results() {
        List<TheoremResult> ordered = new ArrayList<>(best.values());
        ordered.sort(PRESENTATION_ORDER);

        Map<Formula, TheoremResult> results = new LinkedHashMap<>();
        for (TheoremResult result : ordered) {
            results.put(result.theorem(), result);
        }

        LOGGER.fine("Catalogo: " + results.size() + " teoremi da " + accepted + " prove accettate su " + offered);
        return results;
    }

    public int theoremCount() {
        return best.size();
    }

    public long getOfferedCount() {
        return offered;
    }

    public long getAcceptedCount() {
        return accepted;
    }
}
