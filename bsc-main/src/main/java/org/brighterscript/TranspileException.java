package org.brighterscript;

public class TranspileException extends BrighterScriptException {

    private final String nodeDescription;

    public TranspileException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public TranspileException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
