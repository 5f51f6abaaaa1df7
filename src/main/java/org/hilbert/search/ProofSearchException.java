package org.hilbert.search;

/**
 * Errore della ricerca di prove.
 */
public class ProofSearchException extends RuntimeException {

    public ProofSearchException(String message) {
        super(message);
    }

    public ProofSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
