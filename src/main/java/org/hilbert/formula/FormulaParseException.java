package org.hilbert.formula;

/**
 * Testo di formula malformato. Il parser non tenta recuperi né parsing parziali.
 */
public class FormulaParseException extends RuntimeException {

    private final String text;
    private final int line;
    private final int column;

    public FormulaParseException(String text, int line, int column, String detail) {
        super("Formula non valida '" + text + "' (riga " + line + ", colonna " + column + "): " + detail);
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
