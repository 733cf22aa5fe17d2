package ai.blackjack.analysis;

import ai.blackjack.game.record.RoundRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a round history to disk as a pretty-printed JSON array.
 */
public class RoundHistoryWriter {
    private static final Logger log = LoggerFactory.getLogger(RoundHistoryWriter.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @return {@code true} if the file was written; I/O failures are logged and reported as {@code false}
     */
    public boolean write(List<RoundRecord> history, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OBJECT_MAPPER.writeValue(file.toFile(), history);
            if (log.isDebugEnabled()) {
                log.debug("Wrote {} rounds to {}", history.size(), file);
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to write round history to {}: {}", file, e.toString());
            return false;
        }
    }
}
