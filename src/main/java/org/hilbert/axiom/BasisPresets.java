package org.hilbert.axiom;

import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaParser;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Basi predefinite per la sostituzione negli schemi.
 */
public final class BasisPresets {

    /** Base minima sufficiente per la prova di {@code (a → a)} in 5 righe */
    public static final List<Formula> MINIMAL = parseAll(
            "a",
            "(a → a)");

    /** Base ridotta per test rapidi */
    public static final List<Formula> REDUCED = parseAll(
            "a", "b",
            "(¬a)",
            "(a → a)",
            "(a → b)");

    /**
     * Base curata a 9 formule. Con lunghezza massima 5 lo spazio di ricerca supera
     * qualsiasi soglia di frontiera ragionevole.
     */
    public static final List<Formula> CURATED = parseAll(
            "a", "b",
            "(¬a)", "(¬b)",
            "(a → a)",
            "(a → b)",
            "(¬(¬a))",
            "((¬a) → (¬b))",
            "((¬b) → (¬a))");

    /** Nomi accettati da {@link #forName(String)} */
    public static final List<String> NAMES = List.of("minimal", "reduced", "curated");

    private BasisPresets() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param name uno tra {@link #NAMES}, senza distinzione tra maiuscole e minuscole
     * @throws IllegalArgumentException se il nome non corrisponde a nessuna base
     */
    public static List<Formula> forName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "minimal" -> MINIMAL;
            case "reduced" -> REDUCED;
            case "curated" -> CURATED;
            default -> throw new IllegalArgumentException("Base predefinita sconosciuta: " + name
                    + ". Supportate: " + NAMES);
        };
    }

    private static List<Formula> parseAll(String... texts) {
        return Arrays.stream(texts).map(FormulaParser::parse).toList();
    }
}
