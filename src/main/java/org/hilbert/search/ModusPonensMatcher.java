package org.hilbert.search;

import org.hilbert.formula.Formula;
import org.hilbert.formula.Implies;
import org.hilbert.proof.ModusPonensJustification;
import org.hilbert.proof.ProofLine;
import org.hilbert.proof.ProofState;

import java.util.ArrayList;
import java.util.List;

/**
 * MATCHER MODUS PONENS - Tutte le conseguenze immediate di uno stato
 *
 * Per ogni coppia ordinata di posizioni distinte (i, j), se la riga j ha forma
 * {@code P → Q} e la riga i è strutturalmente uguale a {@code P}, produce
 * {@code Q} giustificata da {@code MP(i, j)}. Entrambi gli ordini sono provati:
 * la premessa può stare prima o dopo l'implicazione.
 *
 * Ordine di emissione: i crescente, poi j crescente. Costo O(n²) per stato.
 */
public class ModusPonensMatcher {

    public List<ProofLine> match(ProofState state) {
        Formula[] formulas = state.formulas();
        List<ProofLine> consequences = new ArrayList<>();

        for (int premise = 0; premise < formulas.length; premise++) {
            for (int implication = 0; implication < formulas.length; implication++) {
                if (premise == implication) {
                    continue;
                }
                if (formulas[implication] instanceof Implies implies && implies.left().equals(formulas[premise])) {
                    consequences.add(new ProofLine(implies.right(),
                            new ModusPonensJustification(premise, implication)));
                }
            }
        }

        return consequences;
    }
}
