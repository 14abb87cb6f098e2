package org.brighterscript;

import java.util.List;

public class ClassHierarchyCycleException extends StructuralContractException {

    private final List<String> chain;

    public ClassHierarchyCycleException(String className, List<String> chain) {
        super("Class '" + className + "' has a cyclic inheritance chain: " + String.join(" -> ", chain), className);
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}
