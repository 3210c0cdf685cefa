package br.edu.ifba.graphrag.chat;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One message of a chat completions request or response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
    String role,
    String content
) {
    public static ChatMessage user(final String content) {
        return new ChatMessage("user", content);
    }
}
