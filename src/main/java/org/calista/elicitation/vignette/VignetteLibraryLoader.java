package org.calista.elicitation.vignette;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.io.FileIO;
import org.calista.elicitation.profile.DominanceFilter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the three library files, validates them and builds a {@link VignetteLibrary}.
 *
 * <p>
 * A file holds either a JSON array of vignette definitions or an object with a {@code vignettes} array.
 * Structural problems (not two options, identical options, duplicate ids, bad JSON) fail the load;
 * dominated vignettes are dropped with a warning.
 * </p>
 */
public final class VignetteLibraryLoader {
    private static final Logger log = LogManager.getLogger(VignetteLibraryLoader.class);

    public static final String STATIC_BEGINNING_FILE = "static_beginning.json";
    public static final String ADAPTIVE_FILE = "adaptive_library.json";
    public static final String STATIC_END_FILE = "static_end.json";

    private final ObjectMapper mapper;

    public VignetteLibraryLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Loads from a classpath directory such as {@code "vignettes"}. A missing file means an empty list.
     */
    public VignetteLibrary loadFromClasspath(String directory) throws IOException {
        Objects.requireNonNull(directory, "directory");
        String base = directory.endsWith("/") ? directory : directory + "/";
        return build(
                readClasspath(base + STATIC_BEGINNING_FILE),
                readClasspath(base + ADAPTIVE_FILE),
                readClasspath(base + STATIC_END_FILE));
    }

    /**
     * Loads from {@code relativeDir} inside the FileIO sandbox. A missing file means an empty list.
     */
    public VignetteLibrary loadFromDirectory(FileIO io, String relativeDir) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(relativeDir, "relativeDir");
        return build(
                readFile(io, io.resolve(relativeDir + "/" + STATIC_BEGINNING_FILE)),
                readFile(io, io.resolve(relativeDir + "/" + ADAPTIVE_FILE)),
                readFile(io, io.resolve(relativeDir + "/" + STATIC_END_FILE)));
    }

    /**
     * Parses one library file.
     *
     * @param source name used in error messages
     */
    public List<Vignette> parse(String json, String source) throws IOException {
        Objects.requireNonNull(json, "json");
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException("unreadable vignette file " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) return List.of();

        JsonNode array = root.isArray() ? root : root.path("vignettes");
        if (!array.isArray()) throw new IOException("vignette file " + source + ": expected an array or {\"vignettes\": [...]}");

        List<Vignette> out = new ArrayList<>(array.size());
        int i = 0;
        for (JsonNode node : array) {
            VignetteDefinition def;
            try {
                def = mapper.treeToValue(node, VignetteDefinition.class);
            } catch (JsonProcessingException e) {
                throw new IOException("vignette file " + source + " entry #" + i + ": " + e.getOriginalMessage(), e);
            }
            try {
                out.add(def.toVignette());
            } catch (IllegalArgumentException e) {
                throw new IOException("vignette file " + source + " entry #" + i + ": " + e.getMessage(), e);
            }
            i++;
        }
        return out;
    }

    /**
     * Drops dominated vignettes and checks id uniqueness across the lists.
     */
    public VignetteLibrary build(List<Vignette> staticBeginning, List<Vignette> adaptive, List<Vignette> staticEnd) throws IOException {
        List<Vignette> begin = dropDominated(staticBeginning, "static_beginning");
        List<Vignette> adapt = dropDominated(adaptive, "adaptive");
        List<Vignette> end = dropDominated(staticEnd, "static_end");

        Set<String> ids = new HashSet<>();
        for (List<Vignette> list : List.of(begin, adapt, end)) {
            for (Vignette v : list) {
                if (!ids.add(v.vignetteId())) throw new IOException("duplicate vignette id: " + v.vignetteId());
            }
        }

        VignetteLibrary lib = new VignetteLibrary(begin, adapt, end);
        log.info("Vignette library loaded: {}", lib);
        return lib;
    }

    private List<Vignette> dropDominated(List<Vignette> in, String listName) {
        List<Vignette> kept = new ArrayList<>(in.size());
        for (Vignette v : in) {
            if (DominanceFilter.isDominated(v)) {
                log.warn("Dropping dominated vignette {} from {} list", v.vignetteId(), listName);
                continue;
            }
            kept.add(v);
        }
        return kept;
    }

    private List<Vignette> readClasspath(String resource) throws IOException {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = VignetteLibraryLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("Vignette resource not found (empty list): {}", resource);
                return List.of();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
        }
    }

    private List<Vignette> readFile(FileIO io, Path file) throws IOException {
        if (!io.exists(file)) {
            log.debug("Vignette file not found (empty list): {}", file);
            return List.of();
        }
        return parse(io.readString(file), file.toString());
    }
}
