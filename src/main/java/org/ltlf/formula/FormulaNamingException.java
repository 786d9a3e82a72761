package org.ltlf.formula;

/**
 * Sollevata quando un simbolo atomico non rispetta la convenzione di naming.
 */
public class FormulaNamingException extends IllegalArgumentException {

    private final String offendingName;

    public FormulaNamingException(String offendingName) {
        super("Il nome del simbolo non rispetta la convenzione di naming: " + offendingName);
        this.offendingName = offendingName;
    }

    public String getOffendingName() {
        return offendingName;
    }
}
