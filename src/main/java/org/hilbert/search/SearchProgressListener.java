package org.hilbert.search;

/**
 * Notificato una volta per ogni lunghezza completata, dopo la barriera di fine livello.
 */
@FunctionalInterface
public interface SearchProgressListener {

    SearchProgressListener NONE = (length, frontierSize, theoremCount) -> { };

    /**
     * @param length lunghezza appena completata
     * @param frontierSize prove uniche trovate a quella lunghezza
     * @param theoremCount teoremi distinti che superano il filtro fino a quel momento
     */
    void onLengthCompleted(int length, int frontierSize, int theoremCount);
}
