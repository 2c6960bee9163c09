package com.convoflow.editor;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Remote store of flow documents, e.g. the backend the editor was opened from.
 * Implementations are provided by the host application.
 */
public interface FlowDocumentSource {

    /**
     * Fetches the raw document JSON for a flow.
     *
     * @param flowId id of the flow to open
     * @return future completing with the JSON, or empty when the remote has no document for this flow
     */
    CompletableFuture<Optional<String>> fetch(String flowId);
}
