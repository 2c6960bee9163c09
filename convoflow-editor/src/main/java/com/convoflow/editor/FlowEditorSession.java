package com.convoflow.editor;

import com.convoflow.config.EditorConfig;
import com.convoflow.graph.adapter.FlowAdapter;
import com.convoflow.graph.model.PresentationGraph;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.validation.DanglingReference;
import com.convoflow.schema.validation.DanglingReferences;
import com.convoflow.schema.validation.FlowValidator;
import com.convoflow.undo.UndoManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Owns the presentation graph of one open flow and runs every edit through the settle cycle:
 * mutation, decision-node reconciliation, edge derivation, then one undo snapshot.
 * <p>
 * The graph is replaced as a whole value; nothing outside the session mutates it. Edits are
 * serialized: an edit issued while another one is running is rejected. Undo and redo restore
 * snapshots as they are, without settling them again or recording a new snapshot.
 */
public final class FlowEditorSession {

    private static final Logger log = LoggerFactory.getLogger(FlowEditorSession.class);

    private final FlowAdapter adapter;
    private final FlowValidator validator;
    private final UndoManager<PresentationGraph> history;

    private PresentationGraph current;
    private SelectionContext selection = SelectionContext.NONE;
    private boolean applying;
    private boolean loaded;
    private boolean locallyEdited;

    public FlowEditorSession(EditorConfig config, FlowDocument initial) {
        this(new FlowAdapter(config), new FlowValidator(), config.getUndoLimit(), initial);
    }

    public FlowEditorSession(FlowAdapter adapter, FlowValidator validator, int undoLimit, FlowDocument initial) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.current = adapter.toPresentation(Objects.requireNonNull(initial, "initial"));
        this.history = new UndoManager<>(undoLimit, current);
    }

    /**
     * Applies one edit and settles the result.
     *
     * @param mutation pure function from the current graph to the edited graph; may throw to reject the edit
     * @return the settled graph now current
     * @throws IllegalStateException when called while another edit is being applied
     */
    public synchronized PresentationGraph apply(UnaryOperator<PresentationGraph> mutation) {
        if (applying) {
            throw new IllegalStateException("An edit is already being applied");
        }
        applying = true;
        try {
            PresentationGraph edited = Objects.requireNonNull(mutation.apply(current), "mutation result");
            if (edited == current) {
                return current;
            }
            locallyEdited = true;
            commit(edited);
            return current;
        } finally {
            applying = false;
        }
    }

    /** Restores the previous snapshot; returns false when there is nothing to undo. */
    public synchronized boolean undo() {
        rejectWhileApplying();
        PresentationGraph snapshot = history.undo();
        if (snapshot == null) {
            return false;
        }
        restore(snapshot);
        return true;
    }

    /** Re-applies the last undone snapshot; returns false when there is nothing to redo. */
    public synchronized boolean redo() {
        rejectWhileApplying();
        PresentationGraph snapshot = history.redo();
        if (snapshot == null) {
            return false;
        }
        restore(snapshot);
        return true;
    }

    public synchronized boolean canUndo() {
        return history.canUndo();
    }

    public synchronized boolean canRedo() {
        return history.canRedo();
    }

    public synchronized PresentationGraph current() {
        return current;
    }

    /**
     * Canonical document of the current graph after both validation passes.
     *
     * @throws com.convoflow.schema.validation.FlowValidationException when the document is invalid
     */
    public synchronized FlowDocument exportDocument() {
        FlowDocument document = adapter.toDocument(current);
        validator.validateOrThrow(document);
        return document;
    }

    /** Routing fields that name nodes which no longer exist. Advisory; never repaired automatically. */
    public synchronized List<DanglingReference> warnings() {
        return DanglingReferences.find(adapter.toDocument(current).getNodes());
    }

    /**
     * Replaces the graph with a loaded document, but only for the first load and only while the user
     * has not edited anything. The history restarts from the loaded state.
     *
     * @param origin where the document came from, for logging
     * @return true if the document was applied
     */
    public synchronized boolean offerLoadedDocument(FlowDocument document, String origin) {
        if (loaded || locallyEdited) {
            log.info("Ignoring document from {}: {}", origin, loaded ? "a document is already loaded" : "local edits present");
            return false;
        }
        current = adapter.toPresentation(document);
        history.clear();
        history.push(current);
        loaded = true;
        log.info("Loaded document {} from {} ({} nodes)", document.getDocumentId(), origin, document.getNodes().size());
        return true;
    }

    /**
     * Writes the current document to the local cache.
     *
     * @throws com.convoflow.schema.validation.FlowValidationException when the document is invalid; nothing is written
     */
    public void save(LocalDocumentCache cache) {
        FlowDocument document = exportDocument();
        cache.write(document);
        log.debug("Saved document {} to {}", document.getDocumentId(), cache.getFile());
    }

    public synchronized boolean isLoaded() {
        return loaded;
    }

    public synchronized boolean isLocallyEdited() {
        return locallyEdited;
    }

    public synchronized SelectionContext getSelection() {
        return selection;
    }

    public synchronized void setSelection(SelectionContext selection) {
        this.selection = selection != null ? selection : SelectionContext.NONE;
    }

    public FlowAdapter getAdapter() {
        return adapter;
    }

    /** Snapshots were settled when recorded; they are restored as they are and not recorded again. */
    private void restore(PresentationGraph snapshot) {
        current = snapshot;
    }

    private void commit(PresentationGraph graph) {
        current = adapter.settle(graph);
        history.push(current);
    }

    private void rejectWhileApplying() {
        if (applying) {
            throw new IllegalStateException("Cannot undo or redo while an edit is being applied");
        }
    }
}
