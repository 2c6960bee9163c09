/**
 * Two-pass validation of flow documents.
 * <ul>
 *   <li>{@link com.convoflow.schema.validation.StructuralValidator} – shape, types and enums of the raw JSON</li>
 *   <li>{@link com.convoflow.schema.validation.GraphValidator} – ids, initial node and references</li>
 *   <li>{@link com.convoflow.schema.validation.DanglingReferences} – per-field warnings while editing</li>
 * </ul>
 */
package com.convoflow.schema.validation;
