package org.hilbert.filter;

import org.hilbert.proof.ProofState;

/**
 * Misura deterministica della complessità di una prova: più basso = più semplice.
 * A parità di punteggio il catalogo preferisce la prova più corta, poi la prima scoperta.
 */
@FunctionalInterface
public interface ComplexityScorer {

    long score(ProofState state);
}
