package com.quill.ai;

/**
 * One message of a chat-completions request.
 *
 * @param role {@code system} or {@code user}
 * @param content message text
 */
public record ChatMessage(String role, String content) {

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }
}
