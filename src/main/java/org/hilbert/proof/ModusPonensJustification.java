package org.hilbert.proof;

/**
 * Riga derivata per Modus Ponens: da {@code P} (riga {@code premiseIndex}) e
 * {@code P → Q} (riga {@code implicationIndex}) si ottiene {@code Q}.
 * Gli indici sono 0-based e riferiscono righe della stessa prova.
 */
public record ModusPonensJustification(int premiseIndex, int implicationIndex) implements Justification {

    public ModusPonensJustification {
        if (premiseIndex < 0 || implicationIndex < 0) {
            throw new ProofInvariantException("Indici MP negativi: (" + premiseIndex + ", " + implicationIndex + ")");
        }
        if (premiseIndex == implicationIndex) {
            throw new ProofInvariantException("MP richiede due righe distinte, ricevuto due volte " + premiseIndex);
        }
    }

    @Override
    public boolean isModusPonens() {
        return true;
    }

    /**
     * Formato 1-based: premessa, poi implicazione.
     */
    @Override
    public String describe() {
        return "MP (" + (premiseIndex + 1) + "," + (implicationIndex + 1) + ")";
    }
}
