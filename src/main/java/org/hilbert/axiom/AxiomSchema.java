package org.hilbert.axiom;

import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SCHEMI ASSIOMATICI - Sistema di Hilbert per la logica proposizionale {¬, →}
 *
 * - A1: A → (B → A)
 * - A2: (A → (B → C)) → ((A → B) → (A → C))
 * - A3: (¬B → ¬A) → (A → B)
 *
 * Le variabili di schema sono atomi del template; un'istanza si ottiene con
 * una sostituzione simultanea di tutte le variabili.
 */
public enum AxiomSchema {

    A1("(A → (B → A))", List.of("A", "B")),
    A2("((A → (B → C)) → ((A → B) → (A → C)))", List.of("A", "B", "C")),
    A3("(((¬B) → (¬A)) → (A → B))", List.of("A", "B"));

    private final Formula template;
    private final List<String> variables;

    AxiomSchema(String templateText, List<String> variables) {
        this.template = FormulaParser.parse(templateText);
        this.variables = variables;
    }

    public Formula template() {
        return template;
    }

    /**
     * @return variabili di schema nell'ordine in cui vengono legate
     */
    public List<String> variables() {
        return variables;
    }

    /**
     * Istanzia lo schema legando le variabili, nell'ordine di {@link #variables()},
     * alle formule date.
     *
     * @param values una formula per ciascuna variabile di schema
     * @return legami variabile -> formula in ordine di schema (non modificabile)
     * @throws IllegalArgumentException se il numero di valori non coincide con le variabili
     */
    public Map<String, Formula> bind(List<Formula> values) {
        if (values.size() != variables.size()) {
            throw new IllegalArgumentException("Schema " + name() + " richiede " + variables.size()
                    + " formule, ricevute: " + values.size());
        }
        Map<String, Formula> bindings = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            bindings.put(variables.get(i), values.get(i));
        }
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * @param bindings legami completi per tutte le variabili dello schema
     * @return istanza concreta dello schema
     * @throws IllegalArgumentException se i legami non coprono esattamente le variabili
     */
    public Formula instantiate(Map<String, Formula> bindings) {
        if (!bindings.keySet().equals(Set.copyOf(variables))) {
            throw new IllegalArgumentException("Legami " + bindings.keySet() + " non corrispondono alle variabili "
                    + variables + " dello schema " + name());
        }
        return template.substitute(bindings);
    }
}
