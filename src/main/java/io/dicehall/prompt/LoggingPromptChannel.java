package io.dicehall.prompt;

import io.dicehall.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Writes prompts to the log instead of a chat transport. Used by the CLI worker.
 */
public final class LoggingPromptChannel implements PromptChannel {
    private static final Logger log = LoggerFactory.getLogger(LoggingPromptChannel.class);

    @Override
    public String sendPrompt(String destination, PromptView view) {
        String handle = "prm_" + UUID.randomUUID();
        log.info("prompt {} -> {} {}", handle, destination, Jsons.toCompactJson(view));
        return handle;
    }

    @Override
    public void deletePrompt(String destination, String handle) {
        log.info("prompt {} withdrawn from {}", handle, destination);
    }
}
