package org.hilbert.proof;

import org.hilbert.formula.Formula;

import java.util.Objects;

/**
 * Riga di prova: formula derivata e relativa giustificazione.
 */
public record ProofLine(Formula formula, Justification justification) {

    public ProofLine {
        Objects.requireNonNull(formula, "Formula non può essere null");
        Objects.requireNonNull(justification, "Giustificazione non può essere null");
    }

    @Override
    public String toString() {
        return formula + "   " + justification.describe();
    }
}
