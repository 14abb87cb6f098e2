package org.brighterscript.config;

/**
 * Transpiler settings. Defaults can be overridden with JVM system properties, for example
 * {@code -Dbsc.transpile.indent="\t"} or {@code -Dbsc.transpile.sourceMaps=false}.
 */
public final class TranspileConfig {

    public static final String INDENT_PROPERTY = "bsc.transpile.indent";
    public static final String SOURCE_MAPS_PROPERTY = "bsc.transpile.sourceMaps";
    public static final String MAX_INHERITANCE_DEPTH_PROPERTY = "bsc.transpile.maxInheritanceDepth";

    static final String DEFAULT_INDENT = "    ";
    static final int DEFAULT_MAX_INHERITANCE_DEPTH = 64;

    private final String indent;
    private final boolean sourceMaps;
    private final int maxInheritanceDepth;

    private TranspileConfig(String indent, boolean sourceMaps, int maxInheritanceDepth) {
        if (maxInheritanceDepth < 1) {
            throw new IllegalArgumentException("maxInheritanceDepth must be positive: " + maxInheritanceDepth);
        }
        this.indent = indent;
        this.sourceMaps = sourceMaps;
        this.maxInheritanceDepth = maxInheritanceDepth;
    }

    public static TranspileConfig defaults() {
        return new TranspileConfig(DEFAULT_INDENT, true, DEFAULT_MAX_INHERITANCE_DEPTH);
    }

    /**
     * Defaults overlaid with any {@code bsc.transpile.*} system properties.
     */
    public static TranspileConfig fromSystemProperties() {
        String indent = System.getProperty(INDENT_PROPERTY, DEFAULT_INDENT);
        boolean sourceMaps = Boolean.parseBoolean(System.getProperty(SOURCE_MAPS_PROPERTY, "true"));
        String depth = System.getProperty(MAX_INHERITANCE_DEPTH_PROPERTY);
        int maxDepth = DEFAULT_MAX_INHERITANCE_DEPTH;
        if (depth != null) {
            try {
                maxDepth = Integer.parseInt(depth.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + MAX_INHERITANCE_DEPTH_PROPERTY + ": " + depth, e);
            }
        }
        return new TranspileConfig(indent, sourceMaps, maxDepth);
    }

    public TranspileConfig withIndent(String indent) {
        return new TranspileConfig(indent, sourceMaps, maxInheritanceDepth);
    }

    public TranspileConfig withSourceMaps(boolean sourceMaps) {
        return new TranspileConfig(indent, sourceMaps, maxInheritanceDepth);
    }

    public TranspileConfig withMaxInheritanceDepth(int maxInheritanceDepth) {
        return new TranspileConfig(indent, sourceMaps, maxInheritanceDepth);
    }

    public String getIndent() {
        return indent;
    }

    public boolean isSourceMaps() {
        return sourceMaps;
    }

    public int getMaxInheritanceDepth() {
        return maxInheritanceDepth;
    }
}
