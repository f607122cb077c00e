package org.calista.elicitation.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSONL log of {@link ElicitationEvent}s. Malformed lines are skipped on read.
 */
public final class EventStore {
    private static final Logger log = LogManager.getLogger(EventStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public void append(ElicitationEvent e) throws IOException {
        Objects.requireNonNull(e, "event");
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    public List<ElicitationEvent> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        List<ElicitationEvent> out = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            try {
                ElicitationEvent e = mapper.readValue(line, ElicitationEvent.class);
                if (e != null && e.type != null) out.add(e);
            } catch (JsonProcessingException ex) {
                log.warn("Skipping malformed event line {} in {}: {}", lineNo, file, ex.getOriginalMessage());
            }
        }
        return out;
    }

    /** Events of one session, in log order. */
    public List<ElicitationEvent> readSession(String sessionId) throws IOException {
        Objects.requireNonNull(sessionId, "sessionId");
        List<ElicitationEvent> out = new ArrayList<>();
        for (ElicitationEvent e : readAll()) {
            if (sessionId.equals(e.sessionId)) out.add(e);
        }
        return out;
    }

    public Path file() {
        return file;
    }
}
