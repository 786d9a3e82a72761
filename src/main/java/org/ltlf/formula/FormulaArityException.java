package org.ltlf.formula;

/**
 * Sollevata quando un operatore n-ario riceve meno di due operandi.
 */
public class FormulaArityException extends IllegalArgumentException {

    private final LtlfFormula.Type operator;
    private final int arity;

    public FormulaArityException(LtlfFormula.Type operator, int arity) {
        super("Operatore " + operator + " richiede almeno due operandi, ricevuti: " + arity);
        this.operator = operator;
        this.arity = arity;
    }

    public LtlfFormula.Type getOperator() {
        return operator;
    }

    public int getArity() {
        return arity;
    }
}
