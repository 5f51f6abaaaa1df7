package org.hilbert.search;

/**
 * Configurazione non valida, segnalata prima di avviare qualsiasi ricerca.
 */
public class ConfigurationException extends ProofSearchException {

    public ConfigurationException(String message) {
        super(message);
    }
}
