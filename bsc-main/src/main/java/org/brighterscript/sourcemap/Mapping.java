package org.brighterscript.sourcemap;

/**
 * One generated-to-original position pair. Lines are 1-based, columns 0-based, matching the
 * source map v3 conventions.
 */
public record Mapping(int generatedLine, int generatedColumn, String source, int originalLine, int originalColumn) {
}
