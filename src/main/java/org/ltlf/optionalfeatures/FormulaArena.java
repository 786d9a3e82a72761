package org.ltlf.optionalfeatures;

import org.ltlf.formula.LtlfFormula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena di nodi interni: ogni sottoformula distinta riceve un identificativo intero.
 *
 * Formule strutturalmente uguali ricevono lo stesso identificativo, quindi i
 * sottotermini condivisi sono rappresentati una sola volta. Dopo l'inserimento
 * la navigazione avviene solo tramite identificativi e array di figli.
 */
final class FormulaArena {

    private final Map<LtlfFormula, Integer> ids = new HashMap<>();
    private final List<LtlfFormula> nodes = new ArrayList<>();
    private final List<int[]> children = new ArrayList<>();

    /**
     * Inserisce la formula e tutte le sue sottoformule, senza ricorsione.
     *
     * @return identificativo della formula
     */
    int intern(LtlfFormula formula) {
        Integer known = ids.get(formula);
        if (known != null) {
            return known;
        }

        Deque<LtlfFormula> pending = new ArrayDeque<>();
        pending.push(formula);
        while (!pending.isEmpty()) {
            LtlfFormula current = pending.peek();
            if (ids.containsKey(current)) {
                pending.pop();
                continue;
            }

            boolean ready = true;
            for (int i = current.operands.size() - 1; i >= 0; i--) {
                LtlfFormula operand = current.operands.get(i);
                if (!ids.containsKey(operand)) {
                    pending.push(operand);
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }

            pending.pop();
            int[] operandIds = new int[current.operands.size()];
            for (int i = 0; i < operandIds.length; i++) {
                operandIds[i] = ids.get(current.operands.get(i));
            }
            ids.put(current, nodes.size());
            nodes.add(current);
            children.add(operandIds);
        }
        return ids.get(formula);
    }

    LtlfFormula formula(int id) {
        return nodes.get(id);
    }

    int[] children(int id) {
        return children.get(id);
    }

    int size() {
        return nodes.size();
    }
}
