package org.meshbus.api.providers;

/**
 * One chat message of a language model conversation.
 *
 * @param role    {@code system}, {@code user} or {@code assistant}.
 * @param content Message text.
 */
public record LlmMessage(String role, String content) {

    public static LlmMessage system(String content) {
        return new LlmMessage("system", content);
    }

    public static LlmMessage user(String content) {
        return new LlmMessage("user", content);
    }

    public static LlmMessage assistant(String content) {
        return new LlmMessage("assistant", content);
    }
}
