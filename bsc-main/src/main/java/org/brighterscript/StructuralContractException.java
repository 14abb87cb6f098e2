package org.brighterscript;

/**
 * Thrown when a node reaches the transpiler in a shape the parser never produces, such as an
 * interface member routed to lowering. These are not user errors and abort the current subtree.
 */
public class StructuralContractException extends TranspileException {

    public StructuralContractException(String message, String nodeDescription) {
        super(message, nodeDescription);
    }
}
