package org.hilbert.formula;

import java.util.Map;
import java.util.Objects;

/**
 * Negazione {@code (¬A)}.
 */
public final class Not implements Formula {

    private final Formula operand;
    private final int hash;
    private final int size;
    private final int symbolLength;

    public Not(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Operando per negazione non può essere null");
        this.hash = 31 * operand.hashCode() + 7;
        this.size = 1 + operand.size();
        this.symbolLength = operand.symbolLength() + 3;   // "(¬" + operando + ")"
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int depth() {
        return 1 + operand.depth();
    }

    @Override
    public int symbolLength() {
        return symbolLength;
    }

    @Override
    public Formula substitute(Map<String, Formula> bindings) {
        Formula substituted = operand.substitute(bindings);
        return substituted == operand ? this : new Not(substituted);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Not other)) return false;
        return hash == other.hash && operand.equals(other.operand);
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
