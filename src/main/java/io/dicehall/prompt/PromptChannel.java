package io.dicehall.prompt;

/**
 * Delivers turn prompts to players. Implementations own formatting and rate limiting.
 */
public interface PromptChannel {
    /**
     * @return a handle that can later be passed to {@link #deletePrompt}
     */
    String sendPrompt(String destination, PromptView view);

    void deletePrompt(String destination, String handle);
}
