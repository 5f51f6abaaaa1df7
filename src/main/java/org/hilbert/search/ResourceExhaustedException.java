package org.hilbert.search;

/**
 * La frontiera di una lunghezza ha superato la soglia configurata.
 *
 * Condizione recuperabile: il chiamante può ridurre la base o la lunghezza
 * massima e ripetere la ricerca.
 */
public class ResourceExhaustedException extends ProofSearchException {

    private final int length;
    private final long frontierSize;
    private final long ceiling;

    public ResourceExhaustedException(int length, long frontierSize, long ceiling) {
        super("Frontiera di lunghezza " + length + " oltre la soglia (" + frontierSize + " > " + ceiling
                + " stati): ridurre la base o la lunghezza massima");
        this.length = length;
        this.frontierSize = frontierSize;
        this.ceiling = ceiling;
    }

    public int getLength() {
        return length;
    }

    public long getFrontierSize() {
        return frontierSize;
    }

    public long getCeiling() {
        return ceiling;
    }
}
