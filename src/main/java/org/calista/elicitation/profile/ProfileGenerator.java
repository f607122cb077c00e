package org.calista.elicitation.profile;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Enumerates job profiles of a {@link DesignSpace} and pairs them into candidates.
 *
 * <p>Randomness is always injected: the same seed yields the same candidate list.</p>
 */
public final class ProfileGenerator {
    private static final Logger log = LogManager.getLogger(ProfileGenerator.class);

    private final DesignSpace space;

    public ProfileGenerator(DesignSpace space) {
        this.space = Objects.requireNonNull(space, "space");
        space.validate();
    }

    public DesignSpace space() {
        return space;
    }

    /**
     * Cartesian product in declaration order; the last attribute varies fastest.
     *
     * @param maxProfiles cap on the result size, {@code <= 0} for no cap
     */
    public List<Profile> generateAllProfiles(int maxProfiles) {
        List<AttributeSpec> attrs = space.attributes;
        int k = attrs.size();
        List<List<Double>> values = new ArrayList<>(k);
        for (AttributeSpec a : attrs) values.add(a.values());

        long total = space.totalCombinations();
        int cap = (maxProfiles > 0) ? (int) Math.min(maxProfiles, total) : (int) Math.min(Integer.MAX_VALUE, total);
        List<Profile> out = new ArrayList<>(cap);

        int[] idx = new int[k];
        while (out.size() < cap) {
            Map<String, Double> p = new LinkedHashMap<>();
            for (int i = 0; i < k; i++) p.put(attrs.get(i).name, values.get(i).get(idx[i]));
            out.add(new Profile(p));

            // odometer increment
            int pos = k - 1;
            while (pos >= 0) {
                idx[pos]++;
                if (idx[pos] < values.get(pos).size()) break;
                idx[pos] = 0;
                pos--;
            }
            if (pos < 0) break;
        }
        log.info("Generated {} candidate profiles from {} total combinations", out.size(), total);
        return out;
    }

    public List<ProfilePair> generateCandidates(int sampleSize, Random random) {
        return generateCandidates(generateAllProfiles(0), sampleSize, random);
    }

    /**
     * Candidate pairs over {@code profiles}: every unordered pair when there are at most
     * {@code sampleSize} of them, otherwise {@code sampleSize} distinct pairs drawn uniformly.
     */
    public List<ProfilePair> generateCandidates(List<Profile> profiles, int sampleSize, Random random) {
        Objects.requireNonNull(profiles, "profiles");
        Objects.requireNonNull(random, "random");
        if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");

        int n = profiles.size();
        long totalPairs = (long) n * (n - 1) / 2;
        List<ProfilePair> out = new ArrayList<>((int) Math.min(sampleSize, totalPairs));
        if (totalPairs == 0) return out;

        if (totalPairs <= sampleSize) {
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) out.add(new ProfilePair(profiles.get(i), profiles.get(j)));
            }
            log.debug("generateCandidates: exhaustive, {} pairs", out.size());
            return out;
        }

        Set<Long> sampled = new HashSet<>();
        while (out.size() < sampleSize) {
            int i = random.nextInt(n);
            int j = random.nextInt(n);
            if (i == j) continue;
            if (i > j) {
                int t = i;
                i = j;
                j = t;
            }
            long key = (long) i * n + j;
            if (!sampled.add(key)) continue;
            out.add(new ProfilePair(profiles.get(i), profiles.get(j)));
        }
        log.debug("generateCandidates: sampled {} of {} pairs", out.size(), totalPairs);
        return out;
    }

    public double[] encodeProfile(Profile profile) {
        Objects.requireNonNull(profile, "profile");
        return FeatureEncoder.encode(profile.attributes());
    }

    /** "Label: level | Label: level | ..." in declaration order; unknown levels are skipped. */
    public String describe(Profile profile) {
        Objects.requireNonNull(profile, "profile");
        List<String> parts = new ArrayList<>();
        for (AttributeSpec a : space.attributes) {
            Double v = profile.attributes().get(a.name);
            if (v == null) continue;
            a.labelFor(v).ifPresent(l -> parts.add(a.label + ": " + l));
        }
        return String.join(" | ", parts);
    }
}
