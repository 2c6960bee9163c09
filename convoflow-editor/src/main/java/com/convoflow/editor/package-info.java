/**
 * Editor session: owns the presentation graph of the open flow, runs the settle cycle and undo,
 * loads documents (remote first, local cache as fallback) and exports validated documents.
 */
package com.convoflow.editor;
