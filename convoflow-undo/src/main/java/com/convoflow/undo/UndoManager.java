package com.convoflow.undo;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Bounded undo/redo history of whole snapshots.
 * <p>
 * The top of the undo stack is always the current state, so {@link #undo()} needs at least two
 * entries. Pushing a snapshot equal to the top is ignored; any other push clears the redo stack.
 * The caller restores returned snapshots as they are and must not push the restored state back.
 * Snapshots are compared with {@code equals} and should be immutable.
 * Not thread-safe; owned by a single editor session.
 *
 * @param <S> snapshot type
 */
public final class UndoManager<S> {

    private final int limit;
    private final Deque<S> undoStack = new ArrayDeque<>();
    private final Deque<S> redoStack = new ArrayDeque<>();

    /**
     * @param limit maximum number of snapshots kept on the undo stack; values below 1 are raised to 1
     */
    public UndoManager(int limit) {
        this.limit = Math.max(1, limit);
    }

    /**
     * @param limit   maximum number of snapshots kept
     * @param initial state the history starts from; never returned by {@link #undo()} as a step beyond itself
     */
    public UndoManager(int limit, S initial) {
        this(limit);
        undoStack.push(Objects.requireNonNull(initial, "initial"));
    }

    /**
     * Records a new state. No-op when equal to the current top.
     *
     * @return true if the snapshot was recorded
     */
    public boolean push(S snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.equals(undoStack.peek())) {
            return false;
        }
        undoStack.push(snapshot);
        while (undoStack.size() > limit) {
            undoStack.removeLast();
        }
        redoStack.clear();
        return true;
    }

    /**
     * Steps back one state.
     *
     * @return the snapshot to restore, or null when there is nothing to undo
     */
    public S undo() {
        if (!canUndo()) {
            return null;
        }
        redoStack.push(undoStack.pop());
        return undoStack.peek();
    }

    /**
     * Re-applies the last undone state.
     *
     * @return the snapshot to restore, or null when there is nothing to redo
     */
    public S redo() {
        if (!canRedo()) {
            return null;
        }
        S snapshot = redoStack.pop();
        undoStack.push(snapshot);
        return snapshot;
    }

    public boolean canUndo() {
        return undoStack.size() > 1;
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    /** Current state, or null when nothing has been pushed. */
    public S current() {
        return undoStack.peek();
    }

    public int size() {
        return undoStack.size();
    }

    public int getLimit() {
        return limit;
    }

    /** Drops both stacks, e.g. when a different document is loaded. */
    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
