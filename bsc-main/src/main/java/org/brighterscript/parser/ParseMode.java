package org.brighterscript.parser;

/**
 * The dialect a name is rendered for. BrighterScript joins namespace parts with {@code .},
 * BrightScript flattens them with {@code _}.
 */
public enum ParseMode {
    BRIGHTSCRIPT("_"),
    BRIGHTERSCRIPT(".");

    private final String namespaceSeparator;

    ParseMode(String namespaceSeparator) {
        this.namespaceSeparator = namespaceSeparator;
    }

    public String getNamespaceSeparator() {
        return namespaceSeparator;
    }
}
