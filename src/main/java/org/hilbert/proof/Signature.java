package org.hilbert.proof;

import org.hilbert.formula.Formula;

import java.util.Arrays;
import java.util.List;

/**
 * FIRMA DI PROVA - Chiave di identità del cammino di ricerca
 *
 * Due stati hanno la stessa firma se e solo se la sequenza ordinata delle loro
 * formule coincide; le giustificazioni sono ignorate. È una chiave di cammino,
 * distinta dall'identità del teorema: prove diverse dello stesso teorema finale
 * hanno firme diverse e vanno conservate entrambe.
 *
 * Il confronto percorre a ritroso le due catene e termina appena incontra un
 * prefisso fisicamente condiviso.
 */
public final class Signature {

    private final ProofState state;

    Signature(ProofState state) {
        this.state = state;
    }

    public int length() {
        return state.length();
    }

    public List<Formula> formulas() {
        return Arrays.asList(state.formulas());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Signature other)) return false;
        if (state.length() != other.state.length() || state.signatureHash() != other.state.signatureHash()) {
            return false;
        }

        ProofState left = state;
        ProofState right = other.state;
        while (left != null) {
            if (left == right) {
                return true;
            }
            if (!left.theorem().equals(right.theorem())) {
                return false;
            }
            left = left.parent();
            right = right.parent();
        }
        return true;
    }

    @Override
    public int hashCode() {
        return state.signatureHash();
    }

    @Override
    public String toString() {
        return formulas().toString();
    }
}
