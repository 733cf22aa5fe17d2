package ai.blackjack.player;

import ai.blackjack.player.ai.BasicStrategyPlayer;
import ai.blackjack.player.ai.NaiveStrategyPlayer;
import ai.blackjack.player.ai.OllamaPlayer;
import ai.blackjack.player.ai.OpenAIPlayer;
import ai.blackjack.player.ai.policy.PolicyServiceClient;
import ai.blackjack.player.ai.policy.PolicyServicePlayer;
import java.util.Locale;
import java.util.Random;
import java.util.Scanner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the decision provider for a configured seat type:
 * {@code human}, {@code basic}, {@code naive}, {@code ollama}, {@code openai} or {@code policy}.
 * Provider settings (model names, API key, service URL) come from Spring properties.
 */
@Component
public class PlayerFactory {
    public static final String HUMAN = "human";
    public static final String BASIC = "basic";
    public static final String NAIVE = "naive";
    public static final String OLLAMA = "ollama";
    public static final String OPENAI = "openai";
    public static final String POLICY = "policy";

    private final String ollamaModel;
    private final String openAiKey;
    private final String openAiModel;
    private final String policyBaseUrl;
    private final Scanner console = new Scanner(System.in);

    /**
     * Factory with the default provider settings, for use outside Spring.
     */
    public PlayerFactory() {
        this(OllamaPlayer.DEFAULT_MODEL, "", OpenAIPlayer.DEFAULT_MODEL, PolicyServiceClient.DEFAULT_BASE_URL);
    }

    @Autowired
    public PlayerFactory(
            @Value("${ollama.model:" + OllamaPlayer.DEFAULT_MODEL + "}") String ollamaModel,
            @Value("${openai.apiKey:}") String openAiKey,
            @Value("${openai.model:" + OpenAIPlayer.DEFAULT_MODEL + "}") String openAiModel,
            @Value("${policy.baseUrl:" + PolicyServiceClient.DEFAULT_BASE_URL + "}") String policyBaseUrl) {
        this.ollamaModel = ollamaModel;
        this.openAiKey = openAiKey;
        this.openAiModel = openAiModel;
        this.policyBaseUrl = policyBaseUrl;
    }

    /**
     * Console shared by human players and the interactive prompt, so they never read ahead of each other.
     */
    public Scanner getConsole() {
        return console;
    }

    /**
     * @param type   seat type, case-insensitive
     * @param random source of randomness for players that need one
     * @throws IllegalArgumentException for an unknown type
     */
    public Player create(String type, Random random) {
        String key = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case HUMAN:
                return new HumanPlayer(console, System.out);
            case BASIC:
                return new BasicStrategyPlayer();
            case NAIVE:
                return new NaiveStrategyPlayer(random);
            case OLLAMA:
                return new OllamaPlayer(ollamaModel);
            case OPENAI:
                return new OpenAIPlayer(openAiKey, openAiModel);
            case POLICY:
                return new PolicyServicePlayer(new PolicyServiceClient(policyBaseUrl));
            default:
                throw new IllegalArgumentException("Unknown player type '" + type
                        + "'; expected one of human, basic, naive, ollama, openai, policy");
        }
    }
}
