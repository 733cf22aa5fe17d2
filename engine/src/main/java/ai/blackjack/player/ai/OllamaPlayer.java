package ai.blackjack.player.ai;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;

/**
 * Chat player backed by a local Ollama server. Requires the configured model to be pulled.
 */
public class OllamaPlayer extends ChatPlayer {
    static final String LOCAL_OLLAMA_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "llama3";

    public OllamaPlayer() {
        this(DEFAULT_MODEL);
    }

    public OllamaPlayer(String modelName) {
        this(buildLocalChatClient(modelName));
    }

    OllamaPlayer(ChatClient chatClient) {
        super(chatClient, "Ollama");
    }

    private static ChatClient buildLocalChatClient(String modelName) {
        OllamaApi api = OllamaApi.builder()
                .baseUrl(LOCAL_OLLAMA_URL)
                .build();

        OllamaChatModel model = OllamaChatModel.builder()
                .ollamaApi(api)
                .defaultOptions(OllamaOptions.builder()
                        .model(modelName)
                        .temperature(0.1)
                        .build())
                .build();

        return ChatClient.builder(model).build();
    }
}
