package org.hilbert.formula;

import java.util.Map;

/**
 * FORMULA PROPOSIZIONALE - Albero immutabile nel linguaggio {¬, →}
 *
 * Implementazioni: {@link Atom}, {@link Not}, {@link Implies}.
 * L'uguaglianza è strutturale (nodo per nodo), non semantica: {@code (a → b)} e
 * {@code ((¬b) → (¬a))} sono formule diverse anche se logicamente equivalenti.
 *
 * INVARIANTI:
 * - Nessuno stato mutabile condiviso, istanze liberamente condivisibili tra thread
 * - Formule uguali possono essere oggetti fisicamente distinti
 * - hashCode, dimensione e lunghezza stampata calcolati una volta in costruzione
 */
public interface Formula {

    //region FACTORY

    static Formula atom(String name) {
        return new Atom(name);
    }

    static Formula not(Formula operand) {
        return new Not(operand);
    }

    static Formula implies(Formula left, Formula right) {
        return new Implies(left, right);
    }

    //endregion

    //region METRICHE STRUTTURALI

    /**
     * @return numero di nodi dell'albero
     */
    int size();

    /**
     * Profondità secondo la stratificazione del generatore di basi:
     * atomi profondità 0, connettivi 1 + profondità massima degli operandi.
     */
    int depth();

    /**
     * Lunghezza in simboli della forma stampata da {@link FormulaPrinter},
     * parentesi e spazi inclusi. Usata dal punteggio di complessità delle prove.
     */
    int symbolLength();

    //endregion

    //region SOSTITUZIONE

    /**
     * Sostituzione simultanea: ogni atomo il cui nome compare in {@code bindings}
     * viene rimpiazzato dalla formula associata. Le formule inserite non vengono
     * riesaminate, quindi un atomo della base chiamato come una variabile di schema
     * non viene sostituito una seconda volta.
     *
     * @param bindings nome variabile -> formula concreta
     * @return nuova formula (o {@code this} se nessun atomo è stato sostituito)
     */
    Formula substitute(Map<String, Formula> bindings);

    //endregion
}
