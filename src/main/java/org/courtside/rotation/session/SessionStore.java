package org.courtside.rotation.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.courtside.rotation.config.ObjectMapperFactory;
import org.courtside.rotation.ledger.LedgerSnapshot;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stores sessions and the ledger as JSON files under a data directory.
 * Files are written atomically to prevent partial writes.
 *
 * <pre>
 * data/
 *   ledger.json
 *   sessions/&lt;session-id&gt;.json
 * </pre>
 */
public class SessionStore {

    private static final String LEDGER_FILE = "ledger.json";
    private static final String SESSIONS_DIR = "sessions";

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public SessionStore(Path dataDir) {
        this.dataDir = dataDir;
        this.objectMapper = ObjectMapperFactory.createPretty();
    }

    public Path dataDir() {
        return dataDir;
    }

    public void save(Session session) throws IOException {
        validateId(session.id());
        writeAtomically(sessionsDir().resolve(session.id() + ".json"), session);
    }

    public Optional<Session> load(String sessionId) throws IOException {
        validateId(sessionId);
        Path file = sessionsDir().resolve(sessionId + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), Session.class));
    }

    /**
     * All stored sessions, newest date first.
     */
    public List<Session> list() throws IOException {
        List<Session> result = new ArrayList<>();
        Path dir = sessionsDir();
        if (!Files.isDirectory(dir)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : stream) {
                result.add(objectMapper.readValue(file.toFile(), Session.class));
            }
        }
        result.sort(Comparator.comparing(Session::date).reversed().thenComparing(Session::id));
        return result;
    }

    public boolean delete(String sessionId) throws IOException {
        validateId(sessionId);
        return Files.deleteIfExists(sessionsDir().resolve(sessionId + ".json"));
    }

    public void saveLedger(LedgerSnapshot snapshot) throws IOException {
        writeAtomically(dataDir.resolve(LEDGER_FILE), snapshot);
    }

    public LedgerSnapshot loadLedger() throws IOException {
        Path file = dataDir.resolve(LEDGER_FILE);
        if (!Files.exists(file)) {
            return LedgerSnapshot.empty();
        }
        return objectMapper.readValue(file.toFile(), LedgerSnapshot.class);
    }

    private Path sessionsDir() {
        return dataDir.resolve(SESSIONS_DIR);
    }

    private void writeAtomically(Path target, Object value) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private static void validateId(String id) {
        if (id.isBlank() || id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new SessionNotFoundException("Invalid session id: " + id);
        }
    }
}
