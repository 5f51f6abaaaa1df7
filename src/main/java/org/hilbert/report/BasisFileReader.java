package org.hilbert.report;

import org.hilbert.formula.Formula;
import org.hilbert.formula.FormulaParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lettura di un file di base: una formula per riga, righe vuote e commenti
 * ({@code #}) ignorati. Gli errori di sintassi si propagano invariati.
 */
public final class BasisFileReader {

    private static final Logger LOGGER = Logger.getLogger(BasisFileReader.class.getName());

    private static final String COMMENT_PREFIX = "#";

    private BasisFileReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param file percorso del file di base (UTF-8)
     * @return formule nell'ordine del file
     * @throws IOException se errori di accesso al file
     * @throws org.hilbert.formula.FormulaParseException se una riga non è una formula valida
     */
    public static List<Formula> read(Path file) throws IOException {
        return parseLines(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public static List<Formula> parseLines(List<String> lines) {
        List<Formula> basis = new ArrayList<>();
        for (String line : lines) {
            String content = line.trim();
            if (content.isEmpty() || content.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            basis.add(FormulaParser.parse(content));
        }

        LOGGER.fine("Base letta: " + basis.size() + " formule");
        return basis;
    }
}
