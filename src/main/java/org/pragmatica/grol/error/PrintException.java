package org.pragmatica.grol.error;

/**
 * Unchecked carrier for a {@link PrintError}.
 */
public final class PrintException extends RuntimeException {
    private final PrintError error;

    public PrintException(PrintError error) {
        super(error.message());
        this.error = error;
    }

    public PrintError error() {
        return error;
    }
}
