package org.hilbert.formula;

/**
 * STAMPA FORMULE - Notazione completamente parentesizzata
 *
 * Formato:
 * - Atomo: nome ({@code a})
 * - Negazione: {@code (¬A)}
 * - Implicazione: {@code (A → B)}
 *
 * La notazione è quella accettata da {@link FormulaParser}, per cui
 * {@code FormulaParser.parse(FormulaPrinter.render(f)).equals(f)} per ogni formula.
 */
public final class FormulaPrinter {

    public static final char NOT_SYMBOL = '¬';
    public static final String IMPLIES_SYMBOL = " → ";

    private FormulaPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static String render(Formula formula) {
        StringBuilder builder = new StringBuilder(formula.symbolLength());
        appendTo(builder, formula);
        return builder.toString();
    }

    private static void appendTo(StringBuilder builder, Formula formula) {
        if (formula instanceof Atom atom) {
            builder.append(atom.name());
        } else if (formula instanceof Not not) {
            builder.append('(').append(NOT_SYMBOL);
            appendTo(builder, not.operand());
            builder.append(')');
        } else {
            Implies implies = (Implies) formula;
            builder.append('(');
            appendTo(builder, implies.left());
            builder.append(IMPLIES_SYMBOL);
            appendTo(builder, implies.right());
            builder.append(')');
        }
    }
}
