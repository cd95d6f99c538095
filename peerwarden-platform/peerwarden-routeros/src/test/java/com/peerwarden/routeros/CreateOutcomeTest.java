package com.peerwarden.routeros;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CreateOutcomeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void retValueIsDirectId() throws Exception {
        CreateOutcome outcome = CreateOutcome.classify(json("{\"ret\":\"*1A\"}"));

        assertThat(outcome).isEqualTo(new CreateOutcome.DirectId("*1A"));
    }

    @Test
    void bareStringIsDirectId() throws Exception {
        assertThat(CreateOutcome.classify(json("\"*2\""))).isEqualTo(new CreateOutcome.DirectId("*2"));
    }

    @Test
    void returnedItemIdIsNestedId() throws Exception {
        CreateOutcome outcome = CreateOutcome.classify(
                json("{\".id\":\"*3\",\"public-key\":\"abc\",\"comment\":\"laptop\"}"));

        assertThat(outcome).isEqualTo(new CreateOutcome.NestedId("*3"));
    }

    @Test
    void firstArrayElementIdIsNestedId() throws Exception {
        CreateOutcome outcome = CreateOutcome.classify(json("[{\".id\":\"*4\"},{\".id\":\"*5\"}]"));

        assertThat(outcome).isEqualTo(new CreateOutcome.NestedId("*4"));
    }

    @Test
    void afterValueIsNestedId() throws Exception {
        assertThat(CreateOutcome.classify(json("{\"after\":\"*6\"}"))).isEqualTo(new CreateOutcome.NestedId("*6"));
    }

    @Test
    void retTakesPrecedenceOverNestedId() throws Exception {
        CreateOutcome outcome = CreateOutcome.classify(json("{\"ret\":\"*7\",\".id\":\"*8\"}"));

        assertThat(outcome).isInstanceOf(CreateOutcome.DirectId.class);
        assertThat(((CreateOutcome.DirectId) outcome).id()).isEqualTo("*7");
    }

    @Test
    void emptyOrIdlessResponsesRequireLookup() throws Exception {
        assertThat(CreateOutcome.classify(null)).isInstanceOf(CreateOutcome.NoId.class);
        assertThat(CreateOutcome.classify(json("{}"))).isInstanceOf(CreateOutcome.NoId.class);
        assertThat(CreateOutcome.classify(json("[]"))).isInstanceOf(CreateOutcome.NoId.class);
        assertThat(CreateOutcome.classify(json("{\"ret\":\"\"}"))).isInstanceOf(CreateOutcome.NoId.class);
        assertThat(CreateOutcome.classify(json("[{\"comment\":\"x\"}]"))).isInstanceOf(CreateOutcome.NoId.class);
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}
