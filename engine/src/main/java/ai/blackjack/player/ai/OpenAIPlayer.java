package ai.blackjack.player.ai;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.retry.NonTransientAiException;

/**
 * Chat player backed by the OpenAI API.
 * <p>
 * The key comes from the {@code openai.apiKey} property or the {@code OPENAI_API_KEY}
 * environment variable. Rate-limited calls are retried after the delay the server suggests.
 */
public class OpenAIPlayer extends ChatPlayer {
    private static final Logger log = LoggerFactory.getLogger(OpenAIPlayer.class);
    private static final Pattern RATE_LIMIT_DELAY = Pattern.compile("try again in ([0-9]+(?:\\.[0-9]+)?)s");
    private static final int MAX_ATTEMPTS = 5;
    public static final String DEFAULT_MODEL = "gpt-4o";

    public OpenAIPlayer(String apiKey, String modelName) {
        super(buildChatClient(resolveApiKey(apiKey), modelName), "OpenAI");
    }

    @Override
    protected <T> T ask(String userPrompt, Class<T> type) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return super.ask(userPrompt, type);
            } catch (NonTransientAiException ex) {
                if (attempt == MAX_ATTEMPTS) {
                    log.warn("OpenAI rate limit hit, giving up after {} attempts", attempt);
                    throw ex;
                }
                long sleepMillis = extractRetryDelayMillis(ex.getMessage());
                log.warn("OpenAI rate limit hit, sleeping {} ms before retry {}/{}", sleepMillis, attempt, MAX_ATTEMPTS);
                try {
                    Thread.sleep(sleepMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
            }
        }
        return null;
    }

    static long extractRetryDelayMillis(String message) {
        if (message != null) {
            Matcher m = RATE_LIMIT_DELAY.matcher(message);
            if (m.find()) {
                // server suggestion plus a small buffer
                return (long) Math.ceil(Double.parseDouble(m.group(1)) * 1000L) + 500L;
            }
        }
        return 3_500L;
    }

    static String resolveApiKey(String propertyValue) {
        if (propertyValue != null && !propertyValue.isBlank()) {
            return propertyValue.trim();
        }
        String env = System.getenv("OPENAI_API_KEY");
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        throw new IllegalStateException(
                "OpenAI API key must be set via 'openai.apiKey' property or OPENAI_API_KEY environment variable.");
    }

    private static ChatClient buildChatClient(String apiKey, String modelName) {
        OpenAiApi api = OpenAiApi.builder()
                .apiKey(apiKey)
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(modelName)
                .temperature(0.1)
                .build();

        OpenAiChatModel model = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .build();

        return ChatClient.builder(model).build();
    }
}
