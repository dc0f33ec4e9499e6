package io.lighting.stencil.template;

import io.lighting.stencil.TemplateStructureException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parsed header of a loop: {@code [indexVar ,] itemVar in collection}.
 *
 * @param indexVariable name bound to the zero-based position, or {@code null}
 * @param itemVariable  name bound to the current item
 * @param collection    expression producing the iterated value
 */
public record ForSpec(String indexVariable, String itemVariable, Expression collection) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ForSpec {
        Objects.requireNonNull(itemVariable, "itemVariable");
        Objects.requireNonNull(collection, "collection");
    }

    public static ForSpec parse(String header) {
        Objects.requireNonNull(header, "header");
        int in = header.indexOf(" in ");
        if (in < 0) {
            throw new TemplateStructureException("invalid for syntax: missing 'in' keyword in {{for " + header + "}}");
        }
        String variables = header.substring(0, in).trim();
        String collection = header.substring(in + 4).trim();
        if (collection.isEmpty()) {
            throw new TemplateStructureException("invalid for syntax: missing collection in {{for " + header + "}}");
        }
        String[] parts = variables.split(",", -1);
        if (parts.length > 2) {
            throw new TemplateStructureException(
                "invalid for syntax: expected 'item' or 'index, item' but got '" + variables + "'"
            );
        }
        String indexVariable = parts.length == 2 ? variable(parts[0], header) : null;
        String itemVariable = variable(parts[parts.length - 1], header);
        return new ForSpec(indexVariable, itemVariable, Expression.parse(collection));
    }

    private static String variable(String raw, String header) {
        String name = raw.trim();
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new TemplateStructureException(
                "invalid for syntax: '" + name + "' is not a variable name in {{for " + header + "}}"
            );
        }
        return name;
    }
}
