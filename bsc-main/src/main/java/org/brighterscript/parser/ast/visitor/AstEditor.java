package org.brighterscript.parser.ast.visitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Applies in-place edits to a syntax tree and remembers how to revert them. Lowering rewrites
 * super calls and injects constructor statements through this editor; the driver calls
 * {@link #undoAll()} once the file is emitted so the tree can be lowered again.
 */
public class AstEditor {

    private final Deque<Runnable> undoStack = new ArrayDeque<>();

    /**
     * Replace a single-valued property.
     */
    public <T> void setProperty(Supplier<T> getter, Consumer<T> setter, T newValue) {
        T oldValue = getter.get();
        setter.accept(newValue);
        undoStack.push(() -> setter.accept(oldValue));
    }

    public <T> void setArrayValue(List<T> list, int index, T newValue) {
        T oldValue = list.set(index, newValue);
        undoStack.push(() -> list.set(index, oldValue));
    }

    public <T> void addToArray(List<T> list, int index, T item) {
        list.add(index, item);
        undoStack.push(() -> list.remove(index));
    }

    public <T> void arrayUnshift(List<T> list, T item) {
        addToArray(list, 0, item);
    }

    /**
     * Remove {@code deleteCount} items at {@code index} and insert {@code items} in their place.
     */
    public <T> void arraySplice(List<T> list, int index, int deleteCount, List<? extends T> items) {
        List<T> removed = new ArrayList<>(list.subList(index, index + deleteCount));
        list.subList(index, index + deleteCount).clear();
        list.addAll(index, items);
        int inserted = items.size();
        undoStack.push(() -> {
            list.subList(index, index + inserted).clear();
            list.addAll(index, removed);
        });
    }

    /**
     * Record an arbitrary edit: {@code apply} runs now, {@code undo} runs on {@link #undoAll()}.
     */
    public void edit(Runnable apply, Runnable undo) {
        apply.run();
        undoStack.push(undo);
    }

    public int getEditCount() {
        return undoStack.size();
    }

    /**
     * Revert every recorded edit, most recent first.
     */
    public void undoAll() {
        while (!undoStack.isEmpty()) {
            undoStack.pop().run();
        }
    }
}
