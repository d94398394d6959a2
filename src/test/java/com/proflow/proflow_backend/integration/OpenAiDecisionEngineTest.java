package com.proflow.proflow_backend.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OpenAiDecisionEngine")
class OpenAiDecisionEngineTest {

    private final OpenAiDecisionEngine engine =
            new OpenAiDecisionEngine("", "http://localhost:1/v1/chat/completions", "gpt-4o-mini", 500, 0.2);

    @Test
    @DisplayName("without an api key every decision is an error and no request is made")
    void unconfigured() {
        Decision decision = engine.decide("Find Dana", RetrievedContext.empty(), List.of());

        assertThat(decision.success()).isFalse();
        assertThat(decision.error()).contains("proflow.decision.api-key");
    }

    @Test
    @DisplayName("parses narrative and tool calls and appends the assistant turn to the history")
    void parsesToolCalls() throws Exception {
        String body = """
                {"choices":[{"message":{"role":"assistant","content":null,
                  "tool_calls":[{"id":"call_1","type":"function",
                    "function":{"name":"search_contacts","arguments":"{\\"query\\":\\"Dana\\"}"}}]}}]}
                """;

        Decision decision = engine.parse(body, List.of(ConversationMessage.user("Find Dana")));

        assertThat(decision.success()).isTrue();
        assertThat(decision.requestsTools()).isTrue();
        assertThat(decision.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.id()).isEqualTo("call_1");
            assertThat(call.name()).isEqualTo("search_contacts");
            assertThat(call.arguments()).containsEntry("query", "Dana");
        });
        assertThat(decision.history()).hasSize(2);
        assertThat(decision.history().get(1))
                .isEqualTo(ConversationMessage.assistant("Requested tools: search_contacts"));
    }

    @Test
    @DisplayName("unparseable tool arguments are replaced by an empty map")
    void badArguments() throws Exception {
        String body = """
                {"choices":[{"message":{"content":"Looking up",
                  "tool_calls":[{"id":"c","function":{"name":"search_contacts","arguments":"not json"}}]}}]}
                """;

        Decision decision = engine.parse(body, List.of());

        assertThat(decision.narrative()).isEqualTo("Looking up");
        assertThat(decision.toolCalls().get(0).arguments()).isEmpty();
    }

    @Test
    @DisplayName("a reply without choices is an error")
    void noChoices() throws Exception {
        Decision decision = engine.parse("{\"choices\":[]}", List.of());

        assertThat(decision.success()).isFalse();
        assertThat(decision.error()).isEqualTo("Decision engine returned no choices");
    }
}
