package org.calista.elicitation.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SessionSnapshotStore: one JSON snapshot per session under {@code <sessionsDir>/<sessionId>.json}.
 *
 * <p>Writes are atomic through {@link FileIO}.</p>
 */
public final class SessionSnapshotStore {
    private static final Logger log = LogManager.getLogger(SessionSnapshotStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final FileIO io;
    private final ObjectMapper mapper;
    private final String sessionsDir;

    public SessionSnapshotStore(FileIO io, ObjectMapper mapper, String sessionsDir) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.sessionsDir = Objects.requireNonNull(sessionsDir, "sessionsDir");
    }

    public Path fileFor(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        if (!SAFE_ID.matcher(sessionId).matches() || sessionId.startsWith(".")) {
            throw new IllegalArgumentException("session id not usable as a file name: " + sessionId);
        }
        return io.resolve(sessionsDir + "/" + sessionId + ".json");
    }

    public void save(SessionSnapshot snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        Path file = fileFor(snapshot.sessionId);
        io.writeString(file, mapper.writeValueAsString(snapshot));
        log.debug("Snapshot saved: {} ({} completed)", file, snapshot.completedVignettes.size());
    }

    /**
     * @return empty when no snapshot exists for the session
     * @throws IOException when the file exists but is not a valid snapshot
     */
    public Optional<SessionSnapshot> load(String sessionId) throws IOException {
        Path file = fileFor(sessionId);
        Optional<String> json = io.readStringIfExists(file);
        if (json.isEmpty()) return Optional.empty();

        SessionSnapshot s;
        try {
            s = mapper.readValue(json.get(), SessionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed snapshot " + file + ": " + e.getOriginalMessage(), e);
        }
        try {
            s.validate();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid snapshot " + file + ": " + e.getMessage(), e);
        }
        return Optional.of(s);
    }

    public boolean exists(String sessionId) {
        return io.exists(fileFor(sessionId));
    }
}
