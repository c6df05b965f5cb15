package org.wff.proof;

/**
 * Esito della validazione: valido, oppure messaggio e riga del primo errore.
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null, null);

    private final boolean valid;
    private final String errorMessage;
    private final Integer errorLine;

    private ValidationResult(boolean valid, String errorMessage, Integer errorLine) {
        this.valid = valid;
        this.errorMessage = errorMessage;
        this.errorLine = errorLine;
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param line riga dell'errore, null se l'errore riguarda la dimostrazione nel suo insieme
     */
    public static ValidationResult failure(Integer line, String message) {
        return new ValidationResult(false, message, line);
    }

    public boolean isValid() {
        return valid;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Integer getErrorLine() {
        return errorLine;
    }

    @Override
    public String toString() {
        if (valid) return "VALIDA";
        return errorLine == null ? "NON VALIDA: " + errorMessage : "NON VALIDA (riga " + errorLine + "): " + errorMessage;
    }
}
