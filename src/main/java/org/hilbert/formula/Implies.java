package org.hilbert.formula;

import java.util.Map;
import java.util.Objects;

/**
 * Implicazione {@code (A → B)}.
 *
 * È l'unica forma su cui opera il Modus Ponens: da {@code left} e
 * {@code (left → right)} si deriva {@code right}.
 */
public final class Implies implements Formula {

    private final Formula left;
    private final Formula right;
    private final int hash;
    private final int size;
    private final int symbolLength;

    public Implies(Formula left, Formula right) {
        this.left = Objects.requireNonNull(left, "Antecedente non può essere null");
        this.right = Objects.requireNonNull(right, "Conseguente non può essere null");
        this.hash = 31 * (31 * left.hashCode() + right.hashCode()) + 13;
        this.size = 1 + left.size() + right.size();
        this.symbolLength = left.symbolLength() + right.symbolLength() + 5;   // "(" + " → " + ")"
    }

    public Formula left() {
        return left;
    }

    public Formula right() {
        return right;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int depth() {
        return 1 + Math.max(left.depth(), right.depth());
    }

    @Override
    public int symbolLength() {
        return symbolLength;
    }

    @Override
    public Formula substitute(Map<String, Formula> bindings) {
        Formula newLeft = left.substitute(bindings);
        Formula newRight = right.substitute(bindings);
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new Implies(newLeft, newRight);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Implies other)) return false;
        return hash == other.hash && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return FormulaPrinter.render(this);
    }
}
