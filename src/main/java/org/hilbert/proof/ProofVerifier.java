package org.hilbert.proof;

import org.hilbert.formula.Formula;
import org.hilbert.formula.Implies;

import java.util.List;
import java.util.logging.Logger;

/**
 * VERIFICATORE DI PROVE - Riesecuzione riga per riga
 *
 * Ogni riga deve essere:
 * - un'istanza corretta dello schema indicato con i legami registrati, oppure
 * - la conseguenza per Modus Ponens di due righe distinte strettamente precedenti,
 *   la seconda delle quali ha forma {@code P → Q} con {@code P} uguale alla prima
 *   e {@code Q} uguale alla riga verificata.
 */
public final class ProofVerifier {

    private static final Logger LOGGER = Logger.getLogger(ProofVerifier.class.getName());

    private ProofVerifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static void verify(ProofState state) {
        verify(state.lines());
    }

    /**
     * @param lines righe della prova in ordine
     * @throws ProofInvariantException alla prima riga non giustificata
     */
    public static void verify(List<ProofLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            ProofLine line = lines.get(i);

            if (line.justification() instanceof AxiomJustification axiom) {
                verifyAxiomLine(i, line.formula(), axiom);
            } else {
                verifyModusPonensLine(i, line.formula(), (ModusPonensJustification) line.justification(), lines);
            }
        }
        LOGGER.finest("Prova verificata: " + lines.size() + " righe");
    }

    /**
     * Variante booleana di {@link #verify(ProofState)}.
     */
    public static boolean isValid(ProofState state) {
        try {
            verify(state);
            return true;
        } catch (ProofInvariantException e) {
            LOGGER.fine("Prova non valida: " + e.getMessage());
            return false;
        }
    }

    private static void verifyAxiomLine(int index, Formula formula, AxiomJustification axiom) {
        Formula expected;
        try {
            expected = axiom.schema().instantiate(axiom.bindings());
        } catch (IllegalArgumentException e) {
            throw new ProofInvariantException("Riga " + (index + 1) + ": " + e.getMessage());
        }
        if (!expected.equals(formula)) {
            throw new ProofInvariantException("Riga " + (index + 1) + ": " + formula
                    + " non è l'istanza " + axiom.describe() + " (atteso " + expected + ")");
        }
    }

    private static void verifyModusPonensLine(int index, Formula formula, ModusPonensJustification mp,
                                              List<ProofLine> lines) {
        if (mp.premiseIndex() >= index || mp.implicationIndex() >= index) {
            throw new ProofInvariantException("Riga " + (index + 1) + ": " + mp.describe()
                    + " riferisce righe non strettamente precedenti");
        }

        Formula premise = lines.get(mp.premiseIndex()).formula();
        Formula implication = lines.get(mp.implicationIndex()).formula();

        if (!(implication instanceof Implies implies)
                || !implies.left().equals(premise)
                || !implies.right().equals(formula)) {
            throw new ProofInvariantException("Riga " + (index + 1) + ": " + formula
                    + " non segue per MP da " + premise + " e " + implication);
        }
    }
}
