package org.calista.elicitation.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.vignette.UserContext;
import org.calista.elicitation.vignette.Vignette;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * PrewarmCache: personalizes upcoming vignettes in the background, keyed by vignette id.
 *
 * <ul>
 *   <li>{@link #prewarm} is idempotent: one task per id</li>
 *   <li>{@link #resolve} never blocks: the personalized copy if ready, otherwise the base vignette</li>
 *   <li>tasks receive only immutable vignettes and the user context, never session state</li>
 * </ul>
 */
public final class PrewarmCache {
    private static final Logger log = LogManager.getLogger(PrewarmCache.class);

    private final VignettePersonalizer personalizer;
    private final Executor executor;
    private final ConcurrentMap<String, CompletableFuture<Vignette>> cache = new ConcurrentHashMap<>();

    public PrewarmCache(VignettePersonalizer personalizer, Executor executor) {
        this.personalizer = Objects.requireNonNull(personalizer, "personalizer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void prewarm(Vignette base, UserContext context) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(context, "context");
        cache.computeIfAbsent(base.vignetteId(), id -> CompletableFuture.supplyAsync(() -> personalizeSafely(base, context), executor));
    }

    public void prewarmAll(Collection<Vignette> upcoming, UserContext context) {
        Objects.requireNonNull(upcoming, "upcoming");
        for (Vignette v : upcoming) prewarm(v, context);
    }

    /**
     * Personalized copy of {@code base} when its task has finished, else {@code base} itself.
     */
    public Vignette resolve(Vignette base) {
        Objects.requireNonNull(base, "base");
        CompletableFuture<Vignette> f = cache.get(base.vignetteId());
        if (f == null || !f.isDone() || f.isCompletedExceptionally()) return base;
        Vignette v = f.getNow(base);
        return (v == null) ? base : v;
    }

    public boolean isReady(String vignetteId) {
        CompletableFuture<Vignette> f = cache.get(vignetteId);
        return f != null && f.isDone() && !f.isCompletedExceptionally();
    }

    public int size() {
        return cache.size();
    }

    private Vignette personalizeSafely(Vignette base, UserContext context) {
        try {
            Vignette out = personalizer.personalize(base, context);
            if (out == null || !out.sameDesignAs(base)) {
                log.warn("Personalizer changed the design of {}; using the base vignette", base.vignetteId());
                return base;
            }
            return out;
        } catch (Exception e) {
            log.warn("Personalization failed for {}: {}", base.vignetteId(), e.toString());
            return base;
        }
    }
}
