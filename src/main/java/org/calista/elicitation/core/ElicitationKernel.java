package org.calista.elicitation.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.elicitation.engine.ElicitationSession;
import org.calista.elicitation.engine.PrewarmCache;
import org.calista.elicitation.engine.VignetteEngine;
import org.calista.elicitation.engine.VignettePersonalizer;
import org.calista.elicitation.io.FileIO;
import org.calista.elicitation.session.ElicitationEvent;
import org.calista.elicitation.session.EventStore;
import org.calista.elicitation.session.SessionSnapshot;
import org.calista.elicitation.session.SessionSnapshotStore;
import org.calista.elicitation.vignette.VignetteLibrary;
import org.calista.elicitation.vignette.VignetteLibraryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ElicitationKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> config (file, bundled defaults, env) + library + stores
 *   2) openSession / resumeSession / replaySession
 *   3) close()           -> stops the pre-warm pool when the kernel owns it
 *
 * Config, library and engine are immutable and shared by all sessions.
 */
public final class ElicitationKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ElicitationKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final AdaptiveConfig cfg;
    private final VignetteLibrary library;
    private final VignetteEngine engine;
    private final EventStore events;
    private final SessionSnapshotStore snapshots;
    private final VignettePersonalizer personalizer;
    private final ExecutorService prewarmPool;
    private final boolean ownsPool; // false when the executor was injected
    private final Clock clock;

    private ElicitationKernel(FileIO io,
                              ObjectMapper mapper,
                              AdaptiveConfig cfg,
                              VignetteLibrary library,
                              EventStore events,
                              SessionSnapshotStore snapshots,
                              VignettePersonalizer personalizer,
                              ExecutorService prewarmPool,
                              boolean ownsPool,
                              Clock clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.library = Objects.requireNonNull(library, "library");
        this.events = Objects.requireNonNull(events, "events");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.personalizer = Objects.requireNonNull(personalizer, "personalizer");
        this.prewarmPool = Objects.requireNonNull(prewarmPool, "prewarmPool");
        this.ownsPool = ownsPool;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.engine = new VignetteEngine(cfg, library);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Directory the config file and a relative {@code storage.base_dir} are resolved against.
         */
        private Path configRoot = Path.of(".");

        private Map<String, String> env = System.getenv();
        private ObjectMapper mapper;
        private ExecutorService executor;
        private VignettePersonalizer personalizer = VignettePersonalizer.identity();
        private VignetteLibrary library;
        private Clock clock = Clock.systemUTC();

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = Objects.requireNonNull(env, "env");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Pre-warm executor. Not shut down by the kernel. */
        public Builder executor(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public Builder personalizer(VignettePersonalizer personalizer) {
            this.personalizer = Objects.requireNonNull(personalizer, "personalizer");
            return this;
        }

        /** Uses this library instead of loading the configured one. */
        public Builder library(VignetteLibrary library) {
            this.library = Objects.requireNonNull(library, "library");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Loads config and library and opens the stores.
         *
         * @throws ConfigurationException invalid configuration
         * @throws IOException            unreadable or invalid vignette library
         */
        public ElicitationKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            FileIO.Options options = FileIO.Options.builder().charset(charset).build();

            // config lives outside the data dir
            FileIO external = new FileIO(configRoot, options);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            AdaptiveConfig cfg = ConfigReader.load(external, cfgPath, om, env);

            Path base = Path.of(cfg.baseDir());
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, options);

            VignetteLibrary lib = (this.library != null) ? this.library : loadLibrary(cfg, om, io);

            EventStore events = new EventStore(io, om, io.resolve(cfg.eventLog()));
            SessionSnapshotStore snapshots = new SessionSnapshotStore(io, om, cfg.sessionsDir());

            boolean owns = (this.executor == null);
            ExecutorService pool = owns ? Executors.newSingleThreadExecutor(daemonThreads()) : this.executor;

            ElicitationKernel k = new ElicitationKernel(io, om, cfg, lib, events, snapshots, personalizer, pool, owns, clock);
            k.logCreated(cfgPath);
            return k;
        }

        private static VignetteLibrary loadLibrary(AdaptiveConfig cfg, ObjectMapper om, FileIO io) throws IOException {
            VignetteLibraryLoader loader = new VignetteLibraryLoader(om);
            return cfg.libraryOnClasspath()
                    ? loader.loadFromClasspath(cfg.libraryDir())
                    : loader.loadFromDirectory(io, cfg.libraryDir());
        }

        private static ThreadFactory daemonThreads() {
            AtomicInteger n = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, "vignette-prewarm-" + n.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }

        public static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    public ElicitationSession openSession(String sessionId) {
        return newSession(sessionId);
    }

    /**
     * Restores a session from its snapshot.
     *
     * @return empty when no snapshot exists
     */
    public Optional<ElicitationSession> resumeSession(String sessionId) throws IOException {
        Optional<SessionSnapshot> snap = snapshots.load(sessionId);
        if (snap.isEmpty()) return Optional.empty();
        ElicitationSession s = newSession(sessionId);
        s.restore(snap.get());
        return Optional.of(s);
    }

    /**
     * Rebuilds a session from the event log.
     */
    public ElicitationSession replaySession(String sessionId) throws IOException {
        List<ElicitationEvent> log = events.readSession(sessionId);
        ElicitationSession s = newSession(sessionId);
        s.replay(log);
        return s;
    }

    public void saveSession(ElicitationSession session) throws IOException {
        Objects.requireNonNull(session, "session");
        snapshots.save(session.snapshot());
    }

    private ElicitationSession newSession(String sessionId) {
        return ElicitationSession.builder(engine)
                .sessionId(sessionId)
                .events(events)
                .prewarm(new PrewarmCache(personalizer, prewarmPool)) // one per session
                .clock(clock)
                .build();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public AdaptiveConfig config() { return cfg; }
    public VignetteLibrary library() { return library; }
    public VignetteEngine engine() { return engine; }
    public EventStore eventStore() { return events; }
    public SessionSnapshotStore snapshotStore() { return snapshots; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (!ownsPool) return;
        prewarmPool.shutdownNow();
        try {
            if (!prewarmPool.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Pre-warm pool did not stop within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("ElicitationKernel created: config={}, baseDir={}, library={} vignettes ({} adaptive), adaptive={}",
                cfgPath, io.baseDir(), library.size(), library.adaptive().size(), cfg.enabled());
    }
}
