package org.hilbert.filter;

import org.hilbert.proof.ProofState;

/**
 * Punteggio = somma delle lunghezze stampate di tutte le formule della prova
 * (simboli, parentesi e spazi inclusi). Cresce con il numero di righe e con la
 * dimensione sintattica di ciascuna formula.
 */
public class SymbolLengthScorer implements ComplexityScorer {

    @Override
    public long score(ProofState state) {
        return state.symbolLength();
    }
}
