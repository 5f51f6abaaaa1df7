package org.hilbert.search;

import org.hilbert.proof.Signature;

import java.util.concurrent.ConcurrentHashMap;

/**
 * INDICE DI DEDUPLICAZIONE - Firme già raggiunte a una data lunghezza
 *
 * Valido per un solo livello della ricerca e ricreato a ogni lunghezza.
 * Basato su {@link ConcurrentHashMap}, che partiziona internamente le chiavi
 * per hash e rende atomiche tutte le operazioni.
 *
 * Due modalità d'uso:
 * - sequenziale: {@link #reserveIfAbsent(Signature)}, vince la prima occorrenza
 * - parallela: {@link #claim(Signature, long)} da più thread, poi dopo la barriera
 *   {@link #isOwner(Signature, long)}; vince l'ordinale di scoperta minimo, cioè
 *   lo stesso candidato che vincerebbe in modalità sequenziale
 */
public class SignatureIndex {

    private static final Long RESERVED = -1L;

    private final ConcurrentHashMap<Signature, Long> owners;

    public SignatureIndex() {
        this.owners = new ConcurrentHashMap<>();
    }

    public SignatureIndex(int expectedSize) {
        this.owners = new ConcurrentHashMap<>(Math.max(16, expectedSize));
    }

    /**
     * Test e inserimento in un solo passo atomico.
     *
     * @return true solo alla prima occorrenza della firma
     */
    public boolean reserveIfAbsent(Signature signature) {
        return owners.putIfAbsent(signature, RESERVED) == null;
    }

    /**
     * Registra la firma conservando l'ordinale minimo tra quelli proposti.
     *
     * @param ordinal ordine di scoperta del candidato (non negativo)
     */
    public void claim(Signature signature, long ordinal) {
        owners.merge(signature, ordinal, Math::min);
    }

    /**
     * Da invocare solo dopo che tutti i {@link #claim} del livello sono terminati.
     */
    public boolean isOwner(Signature signature, long ordinal) {
        Long owner = owners.get(signature);
        return owner != null && owner == ordinal;
    }

    public long size() {
        return owners.mappingCount();
    }
}
