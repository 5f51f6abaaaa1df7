package org.hilbert.proof;

/**
 * Giustificazione di una riga di prova: istanza di assioma oppure Modus Ponens
 * su due righe strettamente precedenti.
 */
public interface Justification {

    boolean isModusPonens();

    /**
     * @return testo leggibile, es. {@code A1 [A=a, B=b]} oppure {@code MP (1,2)}
     */
    String describe();
}
