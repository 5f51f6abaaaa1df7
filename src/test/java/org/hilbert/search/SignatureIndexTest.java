package org.hilbert.search;

import org.hilbert.proof.ProofState;
import org.hilbert.proof.Signature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hilbert.search.SearchFixtures.A1;
import static org.hilbert.search.SearchFixtures.A2;
import static org.hilbert.search.SearchFixtures.A3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SignatureIndexTest {

    @Test
    public void reserveAcceptsOnlyFirstOccurrence() {
        SignatureIndex index = new SignatureIndex();
        Signature signature = ProofState.of(List.of(A1, A2)).signature();

        assertTrue(index.reserveIfAbsent(signature));
        assertFalse(index.reserveIfAbsent(ProofState.of(List.of(A1, A2)).signature()));
        assertEquals(1, index.size());
    }

    @Test
    public void sameTheoremThroughDifferentPathsIsNotDuplicate() {
        SignatureIndex index = new SignatureIndex();

        assertTrue(index.reserveIfAbsent(ProofState.of(List.of(A2, A1)).signature()));
        assertTrue(index.reserveIfAbsent(ProofState.of(List.of(A3, A1)).signature()));
        assertTrue(index.reserveIfAbsent(ProofState.of(List.of(A1, A1)).signature()));
        assertEquals(3, index.size());
    }

    @Test
    public void claimKeepsMinimalOrdinal() {
        SignatureIndex index = new SignatureIndex();
        Signature signature = ProofState.of(List.of(A1, A3)).signature();

        index.claim(signature, 7L);
        index.claim(signature, 3L);
        index.claim(signature, 5L);

        assertTrue(index.isOwner(signature, 3L));
        assertFalse(index.isOwner(signature, 5L));
        assertFalse(index.isOwner(ProofState.start(A1).signature(), 3L));
    }
}
