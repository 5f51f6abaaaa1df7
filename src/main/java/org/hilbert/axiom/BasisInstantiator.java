package org.hilbert.axiom;

import org.hilbert.formula.Formula;
import org.hilbert.proof.AxiomJustification;
import org.hilbert.proof.ProofLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * ISTANZIATORE DI BASE - Generazione di tutte le istanze degli schemi A1, A2, A3
 *
 * Per ogni schema e per ogni assegnamento delle formule della base alle variabili
 * di schema (prodotto cartesiano completo, ultima variabile più veloce) produce
 * la formula concreta con la giustificazione {@code Axiom(schema, legami)}.
 *
 * Le istanze sono deduplicate per formula mantenendo il primo legame incontrato:
 * una prova di lunghezza 1 è determinata interamente dalla sua unica formula.
 *
 * COSTO: O(|base|^3) per A2, O(|base|^2) per A1 e A3.
 */
public class BasisInstantiator {

    private static final Logger LOGGER = Logger.getLogger(BasisInstantiator.class.getName());

    private final List<Formula> basis;

    /** Assegnamenti esaminati, duplicati inclusi */
    private int combinationsExamined;

    /**
     * @param basis formule di sostituzione, in ordine (sola lettura)
     */
    public BasisInstantiator(List<Formula> basis) {
        if (basis == null || basis.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Base nulla o contenente formule null");
        }
        this.basis = List.copyOf(basis);
    }

    /**
     * @return righe di lunghezza 1 uniche per formula, in ordine di schema e di legame
     */
    public List<ProofLine> instantiate() {
        Map<Formula, ProofLine> unique = new LinkedHashMap<>();
        combinationsExamined = 0;

        if (basis.isEmpty()) {
            LOGGER.warning("Base vuota: nessuna istanza di assioma generabile");
            return Collections.emptyList();
        }

        for (AxiomSchema schema : AxiomSchema.values()) {
            int slots = schema.variables().size();
            int[] indices = new int[slots];

            do {
                List<Formula> values = new ArrayList<>(slots);
                for (int index : indices) {
                    values.add(basis.get(index));
                }

                Map<String, Formula> bindings = schema.bind(values);
                Formula instance = schema.instantiate(bindings);
                unique.putIfAbsent(instance, new ProofLine(instance, new AxiomJustification(schema, bindings)));
                combinationsExamined++;

            } while (advance(indices, basis.size()));
        }

        LOGGER.fine("Istanze di assioma: " + unique.size() + " uniche su " + combinationsExamined + " assegnamenti");
        return Collections.unmodifiableList(new ArrayList<>(unique.values()));
    }

    /**
     * Avanza il contatore di indici come un odometro.
     *
     * @return false quando tutte le combinazioni sono state prodotte
     */
    private static boolean advance(int[] indices, int radix) {
        for (int position = indices.length - 1; position >= 0; position--) {
            if (++indices[position] < radix) {
                return true;
            }
            indices[position] = 0;
        }
        return false;
    }

    public int getCombinationsExamined() {
        return combinationsExamined;
    }
}
