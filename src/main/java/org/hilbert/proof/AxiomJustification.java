package org.hilbert.proof;

import org.hilbert.axiom.AxiomSchema;
import org.hilbert.formula.Formula;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Riga ottenuta istanziando uno schema assiomatico con i legami indicati.
 *
 * @param schema schema istanziato
 * @param bindings variabile di schema -> formula della base, in ordine di schema
 */
public record AxiomJustification(AxiomSchema schema, Map<String, Formula> bindings) implements Justification {

    public AxiomJustification {
        Objects.requireNonNull(schema, "Schema non può essere null");
        Objects.requireNonNull(bindings, "Legami non possono essere null");
    }

    @Override
    public boolean isModusPonens() {
        return false;
    }

    @Override
    public String describe() {
        return schema.name() + " [" + bindings.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ")) + "]";
    }
}
