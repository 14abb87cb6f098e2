package org.brighterscript.transpiler;

import org.brighterscript.sourcemap.SourceNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The ordered fragment sequence a node lowers to. Each fragment is a {@link SourceNode}, so the
 * same sequence renders as flat text or as a mapped tree.
 */
public final class TranspileResult implements Iterable<SourceNode> {

    private final List<SourceNode> chunks = new ArrayList<>();

    public static TranspileResult empty() {
        return new TranspileResult();
    }

    public static TranspileResult of(String... texts) {
        TranspileResult result = new TranspileResult();
        for (String text : texts) {
            result.add(text);
        }
        return result;
    }

    public TranspileResult add(String text) {
        chunks.add(SourceNode.text(text));
        return this;
    }

    public TranspileResult add(SourceNode chunk) {
        chunks.add(chunk);
        return this;
    }

    public TranspileResult addAll(TranspileResult other) {
        chunks.addAll(other.chunks);
        return this;
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int size() {
        return chunks.size();
    }

    public List<SourceNode> getChunks() {
        return Collections.unmodifiableList(chunks);
    }

    @Override
    public Iterator<SourceNode> iterator() {
        return getChunks().iterator();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (SourceNode chunk : chunks) {
            builder.append(chunk);
        }
        return builder.toString();
    }
}
