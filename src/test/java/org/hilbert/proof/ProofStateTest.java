package org.hilbert.proof;

import org.hilbert.axiom.AxiomSchema;
import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hilbert.formula.Formula.atom;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProofStateTest {

    private static final ProofLine A1 = axiom(AxiomSchema.A1, atom("a"), atom("a"));
    private static final ProofLine A2 = axiom(AxiomSchema.A2, atom("a"), atom("a"), atom("a"));
    private static final ProofLine MP = new ProofLine(FormulaParser.parse("(a -> a) -> (a -> a)"),
            new ModusPonensJustification(0, 1));

    static ProofLine axiom(AxiomSchema schema, Formula... values) {
        Map<String, Formula> bindings = schema.bind(List.of(values));
        return new ProofLine(schema.instantiate(bindings), new AxiomJustification(schema, bindings));
    }

    @Test
    public void extendSharesPrefixAndKeepsParentUnchanged() {
        ProofState first = ProofState.start(A1);
        ProofState second = first.extend(A2);
        ProofState third = second.extend(MP);

        assertEquals(1, first.length());
        assertEquals(3, third.length());
        assertSame(second, third.parent());
        assertSame(first, second.parent());
        assertEquals(List.of(A1, A2, MP), third.lines());
        assertEquals(MP, third.line(2));
        assertEquals(A1, third.line(0));
        assertEquals(MP.formula(), third.theorem());
    }

    @Test
    public void cumulativeMetrics() {
        ProofState axioms = ProofState.of(List.of(A1, A2));
        ProofState withMp = axioms.extend(MP);

        assertFalse(axioms.usesModusPonens());
        assertTrue(withMp.usesModusPonens());
        assertEquals(A1.formula().symbolLength() + A2.formula().symbolLength() + MP.formula().symbolLength(),
                withMp.symbolLength());
        assertArrayEquals(new Formula[]{A1.formula(), A2.formula(), MP.formula()}, withMp.formulas());
    }

    @Test
    public void modusPonensCannotReferenceLaterLines() {
        ProofState state = ProofState.start(A1);

        assertThrows(ProofInvariantException.class, () -> state.extend(MP));
        assertThrows(ProofInvariantException.class, () -> ProofState.start(MP));
    }

    @Test
    public void justificationIndicesAreValidated() {
        assertThrows(ProofInvariantException.class, () -> new ModusPonensJustification(-1, 0));
        assertThrows(ProofInvariantException.class, () -> new ModusPonensJustification(1, 1));
    }

    @Test
    public void emptyLineListIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ProofState.of(List.of()));
    }

    @Test
    public void lineIndexOutOfRange() {
        ProofState state = ProofState.of(List.of(A1, A2));

        assertThrows(IndexOutOfBoundsException.class, () -> state.line(2));
        assertThrows(IndexOutOfBoundsException.class, () -> state.line(-1));
    }

    @Test
    public void signatureComparesFormulaSequences() {
        ProofState first = ProofState.of(List.of(A1, A2, MP));
        ProofState second = ProofState.of(List.of(A1, A2)).extend(
                new ProofLine(MP.formula(), new ModusPonensJustification(0, 1)));

        assertEquals(first.signature(), second.signature());
        assertEquals(first.signature().hashCode(), second.signature().hashCode());
        assertEquals(List.of(A1.formula(), A2.formula(), MP.formula()), first.signature().formulas());
    }

    @Test
    public void signatureIsOrderSensitive() {
        ProofState forward = ProofState.of(List.of(A1, A2));
        ProofState backward = ProofState.of(List.of(A2, A1));

        assertNotEquals(forward.signature(), backward.signature());
        assertNotEquals(ProofState.start(A1).signature(), forward.signature());
    }

    @Test
    public void justificationDescriptionsAreOneBased() {
        assertEquals("A1 [A=a, B=a]", A1.justification().describe());
        assertEquals("MP (1,2)", MP.justification().describe());
    }
}
