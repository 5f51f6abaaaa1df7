package org.hilbert.proof;

import org.hilbert.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * STATO DI PROVA - Prefisso di prova immutabile con condivisione del prefisso
 *
 * Ogni stato è la sua ultima riga più un riferimento allo stato padre: estendere
 * uno stato crea un nuovo nodo senza copiare le righe precedenti, per cui le
 * frontiere della ricerca condividono in memoria tutti i prefissi comuni.
 *
 * INVARIANTI:
 * - Ogni giustificazione MP riferisce solo righe in posizioni strettamente minori
 * - La prima riga non può essere un Modus Ponens
 * - L'ultima formula è il teorema dimostrato dallo stato
 *
 * Metriche cumulative (hash della firma, uso di MP, lunghezza in simboli) sono
 * calcolate in costruzione in O(1) a partire dal padre.
 */
public final class ProofState {

    //region STRUTTURA DATI

    /** Stato con una riga in meno, null per le prove di lunghezza 1 */
    private final ProofState parent;

    /** Ultima riga della prova */
    private final ProofLine line;

    private final int length;

    /** Hash della sequenza di formule, coerente con {@link Signature#equals} */
    private final int signatureHash;

    private final boolean usesModusPonens;

    /** Somma delle lunghezze stampate di tutte le formule */
    private final long symbolLength;

    //endregion

    //region COSTRUZIONE

    private ProofState(ProofState parent, ProofLine line) {
        this.parent = parent;
        this.line = line;
        this.length = parent == null ? 1 : parent.length + 1;
        this.signatureHash = (parent == null ? 1 : parent.signatureHash) * 31 + line.formula().hashCode();
        this.usesModusPonens = (parent != null && parent.usesModusPonens) || line.justification().isModusPonens();
        this.symbolLength = (parent == null ? 0 : parent.symbolLength) + line.formula().symbolLength();
    }

    /**
     * Crea una prova di lunghezza 1.
     *
     * @param first prima riga, necessariamente un'istanza di assioma
     * @throws ProofInvariantException se la riga è un Modus Ponens
     */
    public static ProofState start(ProofLine first) {
        checkReferences(first, 0);
        return new ProofState(null, first);
    }

    /**
     * Costruisce la prova formata dalle righe date, nell'ordine.
     *
     * @throws ProofInvariantException se una giustificazione riferisce righe non precedenti
     * @throws IllegalArgumentException se la lista è vuota
     */
    public static ProofState of(List<ProofLine> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Una prova richiede almeno una riga");
        }
        ProofState state = start(lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            state = state.extend(lines.get(i));
        }
        return state;
    }

    /**
     * Estende la prova con una nuova riga in coda. Lo stato corrente non cambia.
     *
     * @param next riga da accodare
     * @return nuovo stato di lunghezza {@code length() + 1}
     * @throws ProofInvariantException se la riga riferisce posizioni inesistenti
     */
    public ProofState extend(ProofLine next) {
        checkReferences(next, length);
        return new ProofState(this, next);
    }

    private static void checkReferences(ProofLine line, int availableLines) {
        if (line.justification() instanceof ModusPonensJustification mp) {
            if (mp.premiseIndex() >= availableLines || mp.implicationIndex() >= availableLines) {
                throw new ProofInvariantException("Riga " + (availableLines + 1) + " riferisce righe non precedenti: "
                        + mp.describe() + " con " + availableLines + " righe disponibili");
            }
        }
    }

    //endregion

    //region ACCESSO

    public int length() {
        return length;
    }

    public ProofState parent() {
        return parent;
    }

    public ProofLine lastLine() {
        return line;
    }

    /**
     * @return formula dell'ultima riga, il teorema dimostrato
     */
    public Formula theorem() {
        return line.formula();
    }

    public boolean usesModusPonens() {
        return usesModusPonens;
    }

    public long symbolLength() {
        return symbolLength;
    }

    /**
     * @param index posizione 0-based
     */
    public ProofLine line(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Riga " + index + " fuori da una prova di " + length + " righe");
        }
        ProofState current = this;
        for (int i = length - 1; i > index; i--) {
            current = current.parent;
        }
        return current.line;
    }

    /**
     * @return righe in ordine di prova (lista non modificabile)
     */
    public List<ProofLine> lines() {
        List<ProofLine> lines = new ArrayList<>(length);
        for (ProofState current = this; current != null; current = current.parent) {
            lines.add(current.line);
        }
        Collections.reverse(lines);
        return Collections.unmodifiableList(lines);
    }

    /**
     * Formule in ordine di prova, in un array per l'accesso diretto del matcher.
     */
    public Formula[] formulas() {
        Formula[] formulas = new Formula[length];
        ProofState current = this;
        for (int i = length - 1; i >= 0; i--) {
            formulas[i] = current.line.formula();
            current = current.parent;
        }
        return formulas;
    }

    public Signature signature() {
        return new Signature(this);
    }

    int signatureHash() {
        return signatureHash;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        List<ProofLine> lines = lines();
        for (int i = 0; i < lines.size(); i++) {
            builder.append(i + 1).append(". ").append(lines.get(i)).append('\n');
        }
        return builder.toString();
    }
}
