package org.hilbert.formula;

import java.util.Map;

/**
 * Variabile proposizionale (foglia dell'albero).
 */
public final class Atom implements Formula {

    private final String name;
    private final int hash;

    /**
     * @param name nome della variabile proposizionale (non null, non vuoto)
     * @throws IllegalArgumentException se name null o vuoto
     */
    public Atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null o vuoto");
        }
        this.name = name.trim();
        this.hash = this.name.hashCode();
    }

    public String name() {
        return name;
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public int depth() {
        return 0;
    }

    @Override
    public int symbolLength() {
        return name.length();
    }

    @Override
    public Formula substitute(Map<String, Formula> bindings) {
        Formula replacement = bindings.get(name);
        return replacement != null ? replacement : this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Atom other)) return false;
        return hash == other.hash && name.equals(other.name);
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
