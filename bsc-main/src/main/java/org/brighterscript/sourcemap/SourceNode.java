package org.brighterscript.sourcemap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A tree of generated text fragments, each optionally tagged with the original position it came
 * from. A node is either a leaf holding text or a composite holding children; unmapped leaves
 * inherit the position of their nearest mapped ancestor when mappings are computed.
 * <p>
 * Original lines are 1-based and columns 0-based. A line of {@code -1} marks a node with no
 * original position.
 */
public final class SourceNode {

    public static final int UNMAPPED = -1;

    private final int line;
    private final int column;
    private final String source;
    private final String text;
    private final List<SourceNode> children;

    private SourceNode(int line, int column, String source, String text, List<SourceNode> children) {
        this.line = line;
        this.column = column;
        this.source = source;
        this.text = text;
        this.children = children;
    }

    /**
     * Plain generated text with no original position.
     */
    public static SourceNode text(String text) {
        return new SourceNode(UNMAPPED, UNMAPPED, null, text, Collections.emptyList());
    }

    public static SourceNode leaf(int line, int column, String source, String text) {
        return new SourceNode(line, column, source, text, Collections.emptyList());
    }

    public static SourceNode composite(int line, int column, String source, List<SourceNode> children) {
        return new SourceNode(line, column, source, null, List.copyOf(children));
    }

    public static SourceNode composite(List<SourceNode> children) {
        return composite(UNMAPPED, UNMAPPED, null, children);
    }

    public boolean isMapped() {
        return line != UNMAPPED;
    }

    public boolean isLeaf() {
        return text != null;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getSource() {
        return source;
    }

    public String getText() {
        return text;
    }

    public List<SourceNode> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        appendTo(builder);
        return builder.toString();
    }

    private void appendTo(StringBuilder builder) {
        if (text != null) {
            builder.append(text);
            return;
        }
        for (SourceNode child : children) {
            child.appendTo(builder);
        }
    }

    public CodeWithSourceMap toStringWithSourceMap() {
        MappingCollector collector = new MappingCollector();
        collector.visit(this, null);
        return new CodeWithSourceMap(collector.code.toString(), collector.mappings);
    }

    private static final class MappingCollector {
        private final StringBuilder code = new StringBuilder();
        private final List<Mapping> mappings = new ArrayList<>();
        private int generatedLine = 1;
        private int generatedColumn = 0;
        private SourceNode lastMapped;
        private boolean lastWasMapped;

        void visit(SourceNode node, SourceNode inheritedPosition) {
            SourceNode position = node.isMapped() ? node : inheritedPosition;
            if (!node.isLeaf()) {
                for (SourceNode child : node.children) {
                    visit(child, position);
                }
                return;
            }
            String chunk = node.text;
            if (chunk.isEmpty()) {
                return;
            }
            if (position != null) {
                if (!lastWasMapped || lastMapped != position) {
                    addMapping(position);
                }
                lastMapped = position;
                lastWasMapped = true;
            } else {
                lastWasMapped = false;
            }
            for (int i = 0; i < chunk.length(); i++) {
                char c = chunk.charAt(i);
                code.append(c);
                if (c == '\n') {
                    generatedLine++;
                    generatedColumn = 0;
                    if (i + 1 < chunk.length() && position != null) {
                        addMapping(position);
                    } else {
                        lastWasMapped = false;
                    }
                } else {
                    generatedColumn++;
                }
            }
        }

        private void addMapping(SourceNode position) {
            mappings.add(new Mapping(generatedLine, generatedColumn, position.source, position.line, position.column));
        }
    }
}
