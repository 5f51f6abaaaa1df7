package org.hilbert.axiom;

import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaPrinter;
import org.hilbert.formula.Implies;
import org.hilbert.formula.Not;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * GENERATORE DI BASI - Tutte le formule fino a una profondità data
 *
 * Costruisce per strati di profondità l'insieme delle formule sugli atomi configurati:
 * - profondità 0: gli atomi
 * - profondità d: {@code (¬A)} con depth(A) = d-1, e {@code (A → B)} con
 *   max(depth(A), depth(B)) = d-1
 *
 * Con atomi {a, b}: profondità 0 -> 2 formule, 1 -> 8, 2 -> 74.
 * Già la profondità 2 rende la ricerca impraticabile: il generatore serve a
 * produrre file di base da ridurre a mano.
 */
public class BasisGenerator {

    private static final Logger LOGGER = Logger.getLogger(BasisGenerator.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Nome directory contenitore per basi generate */
    private static final String BASIS_DIR = "BASIS";

    private static final String FILE_PREFIX = "basis_depth_";

    private static final String FILE_EXTENSION = ".txt";

    public static final int MAX_DEPTH = 3;

    //endregion

    private final List<Formula> atoms;

    public BasisGenerator() {
        this(List.of(Formula.atom("a"), Formula.atom("b")));
    }

    /**
     * @param atoms variabili proposizionali di profondità 0
     */
    public BasisGenerator(List<Formula> atoms) {
        if (atoms == null || atoms.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno un atomo per generare una base");
        }
        this.atoms = List.copyOf(atoms);
    }

    //region GENERAZIONE

    /**
     * @param maxDepth profondità massima inclusa (0 ≤ maxDepth ≤ {@value #MAX_DEPTH})
     * @return formule distinte ordinate per forma stampata
     * @throws IllegalArgumentException se maxDepth fuori intervallo
     */
    public List<Formula> generate(int maxDepth) {
        if (maxDepth < 0 || maxDepth > MAX_DEPTH) {
            throw new IllegalArgumentException("Profondità deve essere tra 0 e " + MAX_DEPTH + ", ricevuta: " + maxDepth);
        }

        List<Set<Formula>> byDepth = new ArrayList<>();
        byDepth.add(new LinkedHashSet<>(atoms));
        Set<Formula> all = new LinkedHashSet<>(atoms);

        for (int depth = 1; depth <= maxDepth; depth++) {
            Set<Formula> layer = new LinkedHashSet<>();
            Set<Formula> previous = byDepth.get(depth - 1);

            for (Formula operand : previous) {
                layer.add(new Not(operand));
            }

            for (int lower = 0; lower < depth; lower++) {
                for (Formula left : byDepth.get(lower)) {
                    for (Formula right : previous) {
                        layer.add(new Implies(left, right));
                        layer.add(new Implies(right, left));
                    }
                }
            }

            byDepth.add(layer);
            all.addAll(layer);
            LOGGER.fine("Profondità " + depth + ": " + layer.size() + " formule");
        }

        List<Formula> sorted = new ArrayList<>(all);
        sorted.sort(Comparator.comparing(FormulaPrinter::render));
        return sorted;
    }

    //endregion

    //region SALVATAGGIO FILE

    /**
     * Scrive la base generata in {@code <outputDirectory>/BASIS/basis_depth_<d>.txt},
     * una formula per riga, nel formato letto da {@code BasisFileReader}.
     *
     * @return percorso del file scritto
     * @throws IOException se errori durante la scrittura
     */
    public Path writeBasisFile(Path outputDirectory, int maxDepth) throws IOException {
        List<Formula> basis = generate(maxDepth);

        Path basisDir = outputDirectory.resolve(BASIS_DIR);
        Files.createDirectories(basisDir);
        Path file = basisDir.resolve(FILE_PREFIX + maxDepth + FILE_EXTENSION);

        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write("# Base generata: profondità massima " + maxDepth + ", " + basis.size() + " formule\n");
            for (Formula formula : basis) {
                writer.write(FormulaPrinter.render(formula));
                writer.write('\n');
            }
        }

        LOGGER.info("Base di " + basis.size() + " formule salvata in " + file);
        return file;
    }

    //endregion
}
