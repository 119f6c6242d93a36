package com.storefront.checkout.webhook;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of JSON locations a single logical field may arrive at. The
 * documents are searched in the order given, and within each document the
 * locations are tried in declaration order; the first non-blank scalar wins.
 */
public final class FieldPrecedence {

    private final String field;
    private final List<JsonPointer> locations;

    private FieldPrecedence(String field, List<JsonPointer> locations) {
        this.field = field;
        this.locations = locations;
    }

    public static FieldPrecedence of(String field, String... pointers) {
        return new FieldPrecedence(field, Arrays.stream(pointers).map(JsonPointer::compile).toList());
    }

    public Optional<String> resolve(JsonNode... documents) {
        for (JsonNode document : documents) {
            if (document == null || document.isMissingNode()) {
                continue;
            }
            for (JsonPointer location : locations) {
                JsonNode node = document.at(location);
                if (node.isValueNode() && !node.isNull()) {
                    String value = node.asText();
                    if (!value.isBlank()) {
                        return Optional.of(value);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /** Human-readable name of the field, used in error messages. */
    public String field() {
        return field;
    }
}
