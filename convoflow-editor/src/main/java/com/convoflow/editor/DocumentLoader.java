package com.convoflow.editor;

import com.convoflow.config.EditorConfig;
import com.convoflow.schema.FlowJson;
import com.convoflow.schema.model.FlowDocument;
import com.convoflow.schema.validation.FlowValidator;
import com.convoflow.schema.validation.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Loads the document for a flow when the editor is opened: remote source first, local cache as
 * fallback. The remote wait is advisory; a remote document arriving after the fallback is still
 * offered to the session, which ignores it once something is loaded or edited.
 * Every document is structurally validated before use; invalid ones are skipped.
 */
public final class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    static final String ORIGIN_REMOTE = "remote";
    static final String ORIGIN_REMOTE_LATE = "remote (late)";
    static final String ORIGIN_LOCAL = "local cache";

    private final FlowDocumentSource remote;
    private final LocalDocumentCache cache;
    private final FlowValidator validator;
    private final long timeoutMs;

    public DocumentLoader(FlowDocumentSource remote, LocalDocumentCache cache, EditorConfig config) {
        this(remote, cache, new FlowValidator(), config.getRemoteLoadTimeoutMs());
    }

    /**
     * @param remote    remote source; null when the editor runs without a backend
     * @param cache     local cache used as fallback; null to skip it
     * @param timeoutMs how long to wait for the remote before falling back
     */
    public DocumentLoader(FlowDocumentSource remote, LocalDocumentCache cache, FlowValidator validator, long timeoutMs) {
        this.remote = remote;
        this.cache = cache;
        this.validator = validator;
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    /**
     * Loads a document into the session: remote if it answers in time with a valid document,
     * otherwise the local cache.
     *
     * @return true if the session accepted a document
     */
    public boolean loadInto(FlowEditorSession session, String flowId) {
        if (remote != null) {
            CompletableFuture<Optional<String>> pending = remote.fetch(flowId);
            try {
                Optional<FlowDocument> document = pending.get(timeoutMs, TimeUnit.MILLISECONDS)
                        .flatMap(json -> parse(json, "remote:" + flowId));
                if (document.isPresent()) {
                    return session.offerLoadedDocument(document.get(), ORIGIN_REMOTE);
                }
                log.info("No remote document for flow={}; falling back to local cache", flowId);
            } catch (TimeoutException e) {
                log.info("Remote document for flow={} not available after {}ms; falling back to local cache", flowId, timeoutMs);
                pending.thenAccept(json -> json
                        .flatMap(j -> parse(j, "remote:" + flowId))
                        .ifPresent(doc -> session.offerLoadedDocument(doc, ORIGIN_REMOTE_LATE)));
            } catch (ExecutionException e) {
                log.warn("Remote load failed for flow={}: {}", flowId, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for remote document for flow={}", flowId);
            }
        }
        return loadLocal().map(doc -> session.offerLoadedDocument(doc, ORIGIN_LOCAL)).orElse(false);
    }

    /** The cached document, if present and structurally valid. */
    public Optional<FlowDocument> loadLocal() {
        if (cache == null) {
            return Optional.empty();
        }
        return cache.read().flatMap(json -> parse(json, "file:" + cache.getFile()));
    }

    private Optional<FlowDocument> parse(String json, String source) {
        JsonNode tree;
        try {
            tree = FlowJson.readTree(json);
        } catch (RuntimeException e) {
            log.warn("Failed to parse flow document from {}: {}", source, e.getMessage());
            return Optional.empty();
        }
        ValidationResult result = validator.validateStructure(tree);
        if (!result.isValid()) {
            log.warn("Flow document from {} is invalid: {}", source, result.firstError());
            return Optional.empty();
        }
        try {
            return Optional.of(FlowJson.fromTree(tree));
        } catch (RuntimeException e) {
            log.warn("Failed to read flow document from {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }
}
