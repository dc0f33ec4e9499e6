package io.lighting.stencil.document;

/**
 * A block-level element of a document body.
 */
public sealed interface DocumentElement permits Paragraph, Table {
}
