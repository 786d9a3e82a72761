package org.ltlf.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.ltlf.formula.FormulaWalker.Step;
import org.ltlf.formula.LtlfFormula.Type;

/**
 * Motore della dualità: forma normale negata e negazione propagata.
 *
 * Le tre modalità sono mutuamente ricorsive e vengono risolte dalla stessa visita
 * iterativa, un compito per coppia (formula, modalità):
 * • NNF: forma normale di f
 * • NNF_NEGATED: forma normale di !(f)
 * • NEGATE: negazione strutturale di f, che per implicazione, equivalenza, F e G
 *   ricade sulla forma normale negata
 *
 * I risultati sono memorizzati per compito, quindi i sottotermini condivisi
 * vengono trasformati una volta sola.
 */
final class NegationNormalForm {

    private static final Logger LOGGER = Logger.getLogger(NegationNormalForm.class.getName());

    private enum Mode {
        NNF,
        NNF_NEGATED,
        NEGATE
    }

    private record Task(LtlfFormula formula, Mode mode) {
    }

    private NegationNormalForm() {
    }

    static LtlfFormula toNnf(LtlfFormula formula) {
        LtlfFormula result = FormulaWalker.walkShared(new Task(formula, Mode.NNF), NegationNormalForm::expand);
        LOGGER.finest(() -> "Forma normale negata: " + result);
        return result;
    }

    static LtlfFormula negate(LtlfFormula formula) {
        return FormulaWalker.walkShared(new Task(formula, Mode.NEGATE), NegationNormalForm::expand);
    }

    private static Step<Task, LtlfFormula> expand(Task task) {
        return switch (task.mode()) {
            case NNF -> positive(task.formula());
            case NNF_NEGATED -> negative(task.formula());
            case NEGATE -> negation(task.formula());
        };
    }

    //region NNF(f)

    private static Step<Task, LtlfFormula> positive(LtlfFormula f) {
        return switch (f.type) {
            case ATOM, TRUE, FALSE, LAST, END, INIT -> Step.leaf(f);
            case NOT -> f.operand().isAtomic()
                    ? Step.leaf(f)
                    : Step.single(new Task(f.operand(), Mode.NNF_NEGATED), inner -> inner);
            case IMPLIES -> Step.of(
                    List.of(new Task(f.premise(), Mode.NNF_NEGATED), new Task(f.lastOperand(), Mode.NNF)),
                    parts -> LtlfFormula.or(parts.get(0), parts.get(1)));
            case EQUIVALENCE -> {
                int n = f.operands.size();
                List<Task> children = new ArrayList<>(tasks(f.operands, Mode.NNF));
                children.addAll(tasks(f.operands, Mode.NNF_NEGATED));
                yield Step.of(children, parts -> LtlfFormula.or(
                        LtlfFormula.and(parts.subList(0, n)),
                        LtlfFormula.and(parts.subList(n, 2 * n))));
            }
            case EVENTUALLY -> Step.single(new Task(f.operand(), Mode.NNF),
                    inner -> LtlfFormula.until(LtlfFormula.TRUE, inner));
            case ALWAYS -> Step.single(new Task(f.operand(), Mode.NNF),
                    inner -> LtlfFormula.release(LtlfFormula.FALSE, inner));
            case NEXT, WEAK_NEXT, BEFORE, WEAK_BEFORE, ONCE, HISTORICALLY ->
                    Step.single(new Task(f.operand(), Mode.NNF), inner -> LtlfFormula.unary(f.type, inner));
            case AND, OR, UNTIL, RELEASE, SINCE, TRIGGER ->
                    Step.of(tasks(f.operands, Mode.NNF), parts -> LtlfFormula.nary(f.type, parts));
        };
    }

    //endregion

    //region NNF(!f)

    private static Step<Task, LtlfFormula> negative(LtlfFormula f) {
        return switch (f.type) {
            case ATOM, LAST, END, INIT -> Step.leaf(LtlfFormula.not(f));
            case TRUE -> Step.leaf(LtlfFormula.FALSE);
            case FALSE -> Step.leaf(LtlfFormula.TRUE);
            case NOT -> Step.single(new Task(f.operand(), Mode.NNF), inner -> inner);
            case IMPLIES -> Step.of(
                    List.of(new Task(f.premise(), Mode.NNF), new Task(f.lastOperand(), Mode.NNF_NEGATED)),
                    parts -> LtlfFormula.and(parts.get(0), parts.get(1)));
            case EQUIVALENCE -> {
                int n = f.operands.size();
                List<Task> children = new ArrayList<>(tasks(f.operands, Mode.NNF_NEGATED));
                children.addAll(tasks(f.operands, Mode.NNF));
                yield Step.of(children, parts -> LtlfFormula.and(
                        LtlfFormula.or(parts.subList(0, n)),
                        LtlfFormula.or(parts.subList(n, 2 * n))));
            }
            case EVENTUALLY -> Step.single(new Task(f.operand(), Mode.NNF_NEGATED),
                    inner -> LtlfFormula.release(LtlfFormula.FALSE, inner));
            case ALWAYS -> Step.single(new Task(f.operand(), Mode.NNF_NEGATED),
                    inner -> LtlfFormula.until(LtlfFormula.TRUE, inner));
            case NEXT, WEAK_NEXT, BEFORE, WEAK_BEFORE, ONCE, HISTORICALLY ->
                    Step.single(new Task(f.operand(), Mode.NNF_NEGATED), inner -> LtlfFormula.unary(dual(f.type), inner));
            case AND, OR, UNTIL, RELEASE, SINCE, TRIGGER ->
                    Step.of(tasks(f.operands, Mode.NNF_NEGATED), parts -> LtlfFormula.nary(dual(f.type), parts));
        };
    }

    //endregion

    //region NEGATE(f)

    private static Step<Task, LtlfFormula> negation(LtlfFormula f) {
        return switch (f.type) {
            case ATOM, LAST, END, INIT -> Step.leaf(LtlfFormula.not(f));
            case TRUE -> Step.leaf(LtlfFormula.FALSE);
            case FALSE -> Step.leaf(LtlfFormula.TRUE);
            case NOT -> Step.leaf(f.operand());
            case IMPLIES, EQUIVALENCE, EVENTUALLY, ALWAYS ->
                    Step.single(new Task(f, Mode.NNF_NEGATED), inner -> inner);
            case NEXT, WEAK_NEXT, BEFORE, WEAK_BEFORE, ONCE, HISTORICALLY ->
                    Step.single(new Task(f.operand(), Mode.NEGATE), inner -> LtlfFormula.unary(dual(f.type), inner));
            case AND, OR, UNTIL, RELEASE, SINCE, TRIGGER ->
                    Step.of(tasks(f.operands, Mode.NEGATE), parts -> LtlfFormula.nary(dual(f.type), parts));
        };
    }

    //endregion

    /**
     * Operatore duale rispetto alla negazione.
     */
    static Type dual(Type type) {
        return switch (type) {
            case AND -> Type.OR;
            case OR -> Type.AND;
            case NEXT -> Type.WEAK_NEXT;
            case WEAK_NEXT -> Type.NEXT;
            case UNTIL -> Type.RELEASE;
            case RELEASE -> Type.UNTIL;
            case BEFORE -> Type.WEAK_BEFORE;
            case WEAK_BEFORE -> Type.BEFORE;
            case SINCE -> Type.TRIGGER;
            case TRIGGER -> Type.SINCE;
            case ONCE -> Type.HISTORICALLY;
            case HISTORICALLY -> Type.ONCE;
            case EVENTUALLY -> Type.ALWAYS;
            case ALWAYS -> Type.EVENTUALLY;
            case TRUE -> Type.FALSE;
            case FALSE -> Type.TRUE;
            default -> throw new IllegalArgumentException("Operatore senza duale: " + type);
        };
    }

    private static List<Task> tasks(List<LtlfFormula> operands, Mode mode) {
        List<Task> result = new ArrayList<>(operands.size());
        for (LtlfFormula operand : operands) {
            result.add(new Task(operand, mode));
        }
        return result;
    }
}
