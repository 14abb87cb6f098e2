package org.brighterscript.parser;

import com.github.javaparser.Range;

/**
 * Anything that occupies a region of the source file: tokens and AST nodes.
 */
public interface Located {

    Range getRange();
}
