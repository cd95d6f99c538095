package com.peerwarden.routeros;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of an {@code add} call, classified by where (if anywhere) RouterOS put
 * the identifier of the item it created.
 * 
 * Depending on the RouterOS version and endpoint the identifier arrives as a
 * {@code ret} value, as the {@code .id} of a returned item (or of the first
 * element of a returned array), as an {@code after} value, or not at all.
 */
public sealed interface CreateOutcome {

    /** The identifier returned by the call itself ({@code {"ret": "*1A"}}). */
    record DirectId(String id) implements CreateOutcome {}

    /** The identifier found inside a returned item. */
    record NestedId(String id) implements CreateOutcome {}

    /** No identifier in the response; the caller has to look the item up. */
    record NoId(String rawResponse) implements CreateOutcome {}

    /**
     * Classifies a raw {@code add} response body.
     */
    static CreateOutcome classify(JsonNode response) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            return new NoId("");
        }
        if (response.isTextual() && !response.asText().isBlank()) {
            return new DirectId(response.asText());
        }
        if (response.isObject()) {
            String ret = text(response, "ret");
            if (ret != null) {
                return new DirectId(ret);
            }
            String nested = text(response, ".id");
            if (nested == null) {
                nested = text(response, "after");
            }
            if (nested != null) {
                return new NestedId(nested);
            }
        }
        if (response.isArray() && !response.isEmpty()) {
            String nested = text(response.get(0), ".id");
            if (nested != null) {
                return new NestedId(nested);
            }
        }
        return new NoId(response.toString());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
