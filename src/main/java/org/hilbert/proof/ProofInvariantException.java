package org.hilbert.proof;

/**
 * Violazione di un invariante strutturale di una prova: giustificazione che
 * riferisce una riga fuori intervallo o non strettamente precedente, oppure
 * riga che non corrisponde alla propria giustificazione.
 *
 * È un difetto, non una condizione recuperabile: non va mai intercettata nel motore.
 */
public class ProofInvariantException extends IllegalStateException {

    public ProofInvariantException(String message) {
        super(message);
    }
}
