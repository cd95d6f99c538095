package com.peerwarden.routeros;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.jqwik.api.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for create-response classification.
 */
class CreateOutcomePropertyTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Property(tries = 100)
    void retIdIsAlwaysReturnedVerbatim(@ForAll("routerIds") String id) {
        ObjectNode response = mapper.createObjectNode().put("ret", id);

        assertThat(CreateOutcome.classify(response)).isEqualTo(new CreateOutcome.DirectId(id));
    }

    @Property(tries = 100)
    void itemIdIsReturnedVerbatimWhateverElseTheItemCarries(
            @ForAll("routerIds") String id,
            @ForAll("comments") String comment) {
        ObjectNode item = mapper.createObjectNode()
                .put("comment", comment)
                .put(".id", id)
                .put("disabled", "false");

        assertThat(CreateOutcome.classify(item)).isEqualTo(new CreateOutcome.NestedId(id));
        assertThat(CreateOutcome.classify(mapper.createArrayNode().add(item)))
                .isEqualTo(new CreateOutcome.NestedId(id));
    }

    @Provide
    Arbitrary<String> routerIds() {
        return Arbitraries.strings().withChars("0123456789ABCDEF").ofMinLength(1).ofMaxLength(6)
                .map(hex -> "*" + hex);
    }

    @Provide
    Arbitrary<String> comments() {
        return Arbitraries.strings().alpha().numeric().withChars(' ', '-').ofMaxLength(30);
    }
}
