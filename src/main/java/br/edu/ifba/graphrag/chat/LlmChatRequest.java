package br.edu.ifba.graphrag.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature
) {}
