package org.calista.elicitation.offline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.bayes.LikelihoodCalculator;
import org.calista.elicitation.core.ElicitationKernel;
import org.calista.elicitation.info.FisherInformationCalculator;
import org.calista.elicitation.io.FileIO;
import org.calista.elicitation.profile.DesignSpace;
import org.calista.elicitation.profile.FeatureEncoder;
import org.calista.elicitation.profile.Profile;
import org.calista.elicitation.profile.ProfileGenerator;
import org.calista.elicitation.profile.ProfilePair;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteDefinition;
import org.calista.elicitation.vignette.VignetteLibrary;
import org.calista.elicitation.vignette.VignetteLibraryLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * LibraryDesigner: offline pipeline: design space, candidate pairs, static design,
 * adaptive pool, converted vignettes, JSON files the online loader reads.
 */
public final class LibraryDesigner {
    private static final Logger log = LogManager.getLogger(LibraryDesigner.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final int numStatic;
        public final int numBeginning;
        public final int numAdaptive;
        public final int sampleSize;
        public final int maxProfiles;
        public final double diversityWeight;
        public final double temperature;
        public final double[] priorMean;
        public final double priorVariance;

        private Options(Builder b) {
            this.numStatic = b.numStatic;
            this.numBeginning = b.numBeginning;
            this.numAdaptive = b.numAdaptive;
            this.sampleSize = b.sampleSize;
            this.maxProfiles = b.maxProfiles;
            this.diversityWeight = b.diversityWeight;
            this.temperature = b.temperature;
            this.priorMean = b.priorMean.clone();
            this.priorVariance = b.priorVariance;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private int numStatic = 6;
            private int numBeginning = 4;
            private int numAdaptive = 40;
            private int sampleSize = 10_000;
            private int maxProfiles = 0;
            private double diversityWeight = AdaptiveLibraryBuilder.DEFAULT_DIVERSITY_WEIGHT;
            private double temperature = 1.0;
            private double[] priorMean = new double[FeatureEncoder.DIMENSIONS];
            private double priorVariance = 1.0;

            public Builder numStatic(int v) { this.numStatic = v; return this; }
            public Builder numBeginning(int v) { this.numBeginning = v; return this; }
            public Builder numAdaptive(int v) { this.numAdaptive = v; return this; }
            public Builder sampleSize(int v) { this.sampleSize = v; return this; }
            /** {@code <= 0}: every profile of the design space. */
            public Builder maxProfiles(int v) { this.maxProfiles = v; return this; }
            public Builder diversityWeight(double v) { this.diversityWeight = v; return this; }
            public Builder temperature(double v) { this.temperature = v; return this; }
            public Builder priorVariance(double v) { this.priorVariance = v; return this; }

            public Builder priorMean(double[] v) {
                Objects.requireNonNull(v, "priorMean");
                if (v.length != FeatureEncoder.DIMENSIONS) {
                    throw new IllegalArgumentException("priorMean needs " + FeatureEncoder.DIMENSIONS + " entries");
                }
                this.priorMean = v.clone();
                return this;
            }

            public Options build() {
                if (numBeginning > numStatic) throw new IllegalArgumentException("numBeginning > numStatic");
                if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");
                return new Options(this);
            }
        }
    }

    /**
     * Usage: {@code LibraryDesigner [outputDir] [seed]}. Writes a library designed over the bundled
     * design space into {@code outputDir} (default {@code designed-library}).
     */
    public static void main(String[] args) throws IOException {
        Path out = Path.of(args.length > 0 ? args[0] : "designed-library");
        long seed = (args.length > 1) ? Long.parseLong(args[1]) : 42L;

        ObjectMapper mapper = ElicitationKernel.Builder.defaultMapper();
        LibraryDesigner designer = new LibraryDesigner(DesignSpace.fromClasspath(mapper), Options.builder().build());
        VignetteLibrary lib = designer.design(new Random(seed));
        write(lib, new FileIO(out), ".", mapper);
    }

    private final ProfileGenerator generator;
    private final VignetteConverter converter;
    private final StaticDesignBuilder staticBuilder;
    private final AdaptiveLibraryBuilder adaptiveBuilder;
    private final Options opt;

    public LibraryDesigner(DesignSpace space, Options options) {
        Objects.requireNonNull(space, "space");
        this.opt = Objects.requireNonNull(options, "options");
        this.generator = new ProfileGenerator(space);
        this.converter = new VignetteConverter(generator);
        FisherInformationCalculator fisher = new FisherInformationCalculator(new LikelihoodCalculator(opt.temperature), 0.0);
        this.staticBuilder = new StaticDesignBuilder(fisher);
        this.adaptiveBuilder = new AdaptiveLibraryBuilder(fisher, opt.diversityWeight);
    }

    /**
     * Designs a full library. The same seed yields the same library.
     */
    public VignetteLibrary design(Random random) {
        Objects.requireNonNull(random, "random");
        List<Profile> profiles = generator.generateAllProfiles(opt.maxProfiles);
        List<ProfilePair> candidates = generator.generateCandidates(profiles, opt.sampleSize, random);

        StaticDesign design = staticBuilder.select(candidates, opt.numStatic, opt.numBeginning,
                opt.priorMean, opt.priorVariance);
        List<ProfilePair> adaptive = adaptiveBuilder.build(candidates, opt.numAdaptive, design.all(), opt.priorMean);

        VignetteLibrary lib = new VignetteLibrary(
                converter.convertAll(design.beginning(), "static_begin"),
                converter.convertAll(adaptive, "adaptive"),
                converter.convertAll(design.end(), "static_end"));
        log.info("Designed library: {} profiles, {} candidates -> {} (prior mean {})",
                profiles.size(), candidates.size(), lib, Arrays.toString(opt.priorMean));
        return lib;
    }

    /**
     * Writes the three library files under {@code relativeDir} in the format {@link VignetteLibraryLoader} reads.
     */
    public static void write(VignetteLibrary library, FileIO io, String relativeDir, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(library, "library");
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(relativeDir, "relativeDir");
        Objects.requireNonNull(mapper, "mapper");
        writeList(library.staticBeginning(), io, relativeDir + "/" + VignetteLibraryLoader.STATIC_BEGINNING_FILE, mapper);
        writeList(library.adaptive(), io, relativeDir + "/" + VignetteLibraryLoader.ADAPTIVE_FILE, mapper);
        writeList(library.staticEnd(), io, relativeDir + "/" + VignetteLibraryLoader.STATIC_END_FILE, mapper);
        log.info("Library written to {}", io.resolve(relativeDir));
    }

    private static void writeList(List<Vignette> vignettes, FileIO io, String file, ObjectMapper mapper) throws IOException {
        List<VignetteDefinition> defs = new ArrayList<>(vignettes.size());
        for (Vignette v : vignettes) defs.add(VignetteDefinition.of(v));
        io.writeString(io.resolve(file), mapper.writerWithDefaultPrettyPrinter().writeValueAsString(defs));
    }

    public ProfileGenerator generator() {
        return generator;
    }

    public Options options() {
        return opt;
    }
}
