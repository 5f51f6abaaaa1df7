package org.hilbert.filter;

import org.hilbert.axiom.AxiomSchema;
import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaParser;
import org.hilbert.proof.AxiomJustification;
import org.hilbert.proof.ModusPonensJustification;
import org.hilbert.proof.ProofLine;
import org.hilbert.proof.ProofState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hilbert.formula.Formula.atom;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TheoremCatalogTest {

    private static final ProofLine A1 = axiom(AxiomSchema.A1, atom("a"), atom("a"));
    private static final ProofLine A2 = axiom(AxiomSchema.A2, atom("a"), atom("a"), atom("a"));
    private static final ProofLine A3 = axiom(AxiomSchema.A3, atom("a"), atom("a"));
    private static final Formula CONCLUSION = FormulaParser.parse("(a -> a) -> (a -> a)");

    private static ProofLine axiom(AxiomSchema schema, Formula... values) {
        Map<String, Formula> bindings = schema.bind(List.of(values));
        return new ProofLine(schema.instantiate(bindings), new AxiomJustification(schema, bindings));
    }

    private static ProofLine modusPonens(int premise, int implication) {
        return new ProofLine(CONCLUSION, new ModusPonensJustification(premise, implication));
    }

    @Test
    public void filterRequiresLengthAndModusPonens() {
        ProofFilter filter = new ProofFilter();

        assertFalse(filter.accepts(ProofState.of(List.of(A1, A2))));
        assertFalse(filter.accepts(ProofState.of(List.of(A1, A2, A3))));
        assertTrue(filter.accepts(ProofState.of(List.of(A1, A2, modusPonens(0, 1)))));
    }

    @Test
    public void scoreIsTotalSymbolLength() {
        ProofState proof = ProofState.of(List.of(A1, A2, modusPonens(0, 1)));

        long expected = A1.formula().toString().length() + A2.formula().toString().length()
                + CONCLUSION.toString().length();
        assertEquals(expected, new SymbolLengthScorer().score(proof));
    }

    @Test
    public void lowerScoreReplacesCurrentBest() {
        TheoremCatalog catalog = new TheoremCatalog(new SymbolLengthScorer(), new ProofFilter());
        ProofState longer = ProofState.of(List.of(A1, A3, A2, modusPonens(0, 2)));
        ProofState shorter = ProofState.of(List.of(A1, A2, modusPonens(0, 1)));

        assertTrue(catalog.offer(longer));
        assertTrue(catalog.offer(shorter));

        assertSame(shorter, catalog.results().get(CONCLUSION).proof());
        assertEquals(2, catalog.getAcceptedCount());
    }

    @Test
    public void equalScoreKeepsFirstDiscovered() {
        TheoremCatalog catalog = new TheoremCatalog(new SymbolLengthScorer(), new ProofFilter());
        ProofState first = ProofState.of(List.of(A1, A2, modusPonens(0, 1)));
        ProofState second = ProofState.of(List.of(A2, A1, modusPonens(1, 0)));

        assertTrue(catalog.offer(first));
        assertFalse(catalog.offer(second));

        assertSame(first, catalog.results().get(CONCLUSION).proof());
    }

    @Test
    public void equalScoreWithFewerLinesWins() {
        // Punteggio costante: decide il numero di righe
        TheoremCatalog catalog = new TheoremCatalog(state -> 1L, new ProofFilter());
        ProofState longer = ProofState.of(List.of(A1, A3, A2, modusPonens(0, 2)));
        ProofState shorter = ProofState.of(List.of(A1, A2, modusPonens(0, 1)));

        catalog.offer(longer);
        catalog.offer(shorter);

        assertEquals(3, catalog.results().get(CONCLUSION).length());
    }

    @Test
    public void rejectedProofsAreCountedButNotKept() {
        TheoremCatalog catalog = new TheoremCatalog(new SymbolLengthScorer(), new ProofFilter());

        assertFalse(catalog.offer(ProofState.of(List.of(A1, A2, A3))));

        assertEquals(1, catalog.getOfferedCount());
        assertEquals(0, catalog.getAcceptedCount());
        assertEquals(0, catalog.theoremCount());
        assertTrue(catalog.results().isEmpty());
    }
}
