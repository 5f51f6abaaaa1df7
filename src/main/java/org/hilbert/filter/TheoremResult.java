package org.hilbert.filter;

import org.hilbert.formula.Formula;
import org.hilbert.proof.ProofState;

/**
 * Miglior prova trovata per un teorema.
 *
 * @param theorem formula dell'ultima riga
 * @param proof prova di punteggio minimo
 * @param score punteggio di complessità della prova
 */
public record TheoremResult(Formula theorem, ProofState proof, long score) {

    public int length() {
        return proof.length();
    }
}
