package ai.blackjack.player.ai.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin HTTP client for an external blackjack policy/value model service.
 * <p>
 * Posts a {@link PolicyRequest} as JSON to {@code {baseUrl}/evaluate} and reads a
 * {@link PolicyResponse}. A service that is down, answers with a non-2xx status or sends an
 * unreadable body is logged and reported as {@code null} so the caller can fall back.
 */
public class PolicyServiceClient {
    private static final Logger log = LoggerFactory.getLogger(PolicyServiceClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int CONNECT_TIMEOUT_MILLIS = 2_000;
    private static final int READ_TIMEOUT_MILLIS = 10_000;
    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:8000";

    private final URI evaluateUri;

    public PolicyServiceClient() {
        this(DEFAULT_BASE_URL);
    }

    /**
     * @param baseUrl base URL of the service, with or without a trailing slash
     */
    public PolicyServiceClient(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.evaluateUri = URI.create(base + "/evaluate");
    }

    public URI getEvaluateUri() {
        return evaluateUri;
    }

    /**
     * Asks the service to evaluate one decision point. Blocks until the service answers.
     *
     * @return the response, or {@code null} if the call failed or the body could not be read
     */
    public PolicyResponse evaluate(PolicyRequest request) {
        long started = System.nanoTime();
        if (log.isDebugEnabled()) {
            log.debug("Evaluating {} vs {} (legal: {}) at {}",
                    request.getHand(), request.getDealerUpcard(), request.getLegalDecisions(), evaluateUri);
        }
        String json;
        try {
            json = post(MAPPER.writeValueAsBytes(request));
        } catch (IOException | RuntimeException e) {
            log.warn("Policy service call to {} failed after {} ms: {}", evaluateUri, elapsedMillis(started),
                    e.toString());
            return null;
        }
        if (json == null || json.isEmpty()) {
            return null;
        }
        PolicyResponse response;
        try {
            response = MAPPER.readValue(json, PolicyResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable policy service response: {}", e.getOriginalMessage());
            return null;
        }
        if (log.isDebugEnabled()) {
            log.debug("Policy service chose {} (EV {}) in {} ms",
                    response.getChosenDecision(), response.getExpectedValue(), elapsedMillis(started));
        }
        return response;
    }

    /**
     * @return the response body of a 2xx answer, or {@code null} for any other status
     */
    private String post(byte[] body) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) evaluateUri.toURL().openConnection();
        try {
            connection.setRequestMethod("POST");
            connection.setConnectTimeout(CONNECT_TIMEOUT_MILLIS);
            connection.setReadTimeout(READ_TIMEOUT_MILLIS);
            connection.setDoOutput(true);
            connection.setRequestProperty("Content-Type", "application/json");
            connection.setRequestProperty("Accept", "application/json");
            connection.setFixedLengthStreamingMode(body.length);
            try (OutputStream out = connection.getOutputStream()) {
                out.write(body);
            }

            int status = connection.getResponseCode();
            boolean ok = status / 100 == 2;
            String text = readFully(ok ? connection.getInputStream() : connection.getErrorStream());
            if (!ok) {
                log.warn("Policy service at {} answered HTTP {}: {}", evaluateUri, status, text);
                return null;
            }
            return text;
        } finally {
            connection.disconnect();
        }
    }

    private static String readFully(InputStream stream) throws IOException {
        if (stream == null) {
            return "";
        }
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
