package org.brighterscript;

public class BrighterScriptException extends RuntimeException {

    public BrighterScriptException(String message) {
        super(message);
    }

    public BrighterScriptException(String message, Throwable cause) {
        super(message, cause);
    }

    public BrighterScriptException(Throwable cause) {
        super(cause);
    }
}
