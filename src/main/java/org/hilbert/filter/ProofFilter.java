package org.hilbert.filter;

import org.hilbert.proof.ProofState;

/**
 * Scarta le prove prive di valore dimostrativo:
 * - lunghezza inferiore a {@value #MIN_LENGTH} righe
 * - nessuna riga ottenuta per Modus Ponens (semplici elenchi di assiomi)
 */
public class ProofFilter {

    public static final int MIN_LENGTH = 3;

    public boolean accepts(ProofState state) {
        return state.length() >= MIN_LENGTH && state.usesModusPonens();
    }
}
