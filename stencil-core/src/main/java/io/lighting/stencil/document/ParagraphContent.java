package io.lighting.stencil.document;

public sealed interface ParagraphContent permits Run, Hyperlink {
}
