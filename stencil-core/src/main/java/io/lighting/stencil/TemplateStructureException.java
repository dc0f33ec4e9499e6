package io.lighting.stencil;

/**
 * Unbalanced or malformed directives: a missing {{end}}, a stray {{else}}, bad loop syntax.
 */
public class TemplateStructureException extends TemplateException {
    public TemplateStructureException(String message) {
        super(message);
    }
}
