package org.calista.elicitation.vignette;

import org.calista.elicitation.math.Matrices;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A binary discrete-choice question.
 *
 * <p>Immutable. Exactly two options with distinct option ids whose encoded feature vectors differ.
 * Text may be replaced for presentation ({@link #withScenarioText}, {@link #withOptionText}); ids and
 * attributes never change.</p>
 */
public final class Vignette {

    private final String vignetteId;
    private final String category;
    private final String scenarioText;
    private final List<VignetteOption> options;

    public Vignette(String vignetteId, String category, String scenarioText, List<VignetteOption> options) {
        this.vignetteId = VignetteOption.requireText(vignetteId, "vignetteId");
        this.category = (category == null || category.isBlank()) ? null : category;
        this.scenarioText = (scenarioText == null) ? "" : scenarioText;
        Objects.requireNonNull(options, "options");
        if (options.size() != 2) {
            throw new IllegalArgumentException("vignette '" + vignetteId + "' must have exactly 2 options, got " + options.size());
        }
        VignetteOption a = Objects.requireNonNull(options.get(0), "options[0]");
        VignetteOption b = Objects.requireNonNull(options.get(1), "options[1]");
        if (a.optionId().equals(b.optionId())) {
            throw new IllegalArgumentException("vignette '" + vignetteId + "' has duplicate option id " + a.optionId());
        }
        if (Arrays.equals(a.features(), b.features())) {
            throw new IllegalArgumentException("vignette '" + vignetteId + "' options encode to identical features");
        }
        this.options = List.of(a, b);
    }

    public String vignetteId() {
        return vignetteId;
    }

    public Optional<String> category() {
        return Optional.ofNullable(category);
    }

    public String scenarioText() {
        return scenarioText;
    }

    public List<VignetteOption> options() {
        return options;
    }

    public VignetteOption optionA() {
        return options.get(0);
    }

    public VignetteOption optionB() {
        return options.get(1);
    }

    public Optional<VignetteOption> option(String optionId) {
        for (VignetteOption o : options) {
            if (o.optionId().equals(optionId)) return Optional.of(o);
        }
        return Optional.empty();
    }

    /**
     * The option not chosen.
     *
     * @throws IllegalArgumentException when {@code optionId} is not one of this vignette's options
     */
    public VignetteOption otherThan(String optionId) {
        if (optionA().optionId().equals(optionId)) return optionB();
        if (optionB().optionId().equals(optionId)) return optionA();
        throw new IllegalArgumentException("unknown option '" + optionId + "' for vignette " + vignetteId);
    }

    /** f(A) - f(B) */
    public double[] delta() {
        return Matrices.subtract(optionA().features(), optionB().features());
    }

    /** Same question, same attributes. */
    public boolean sameDesignAs(Vignette other) {
        if (other == null) return false;
        if (!vignetteId.equals(other.vignetteId)) return false;
        for (int i = 0; i < 2; i++) {
            VignetteOption x = options.get(i);
            VignetteOption y = other.options.get(i);
            if (!x.optionId().equals(y.optionId()) || !x.attributes().equals(y.attributes())) return false;
        }
        return true;
    }

    public Vignette withScenarioText(String text) {
        return new Vignette(vignetteId, category, text, options);
    }

    public Vignette withOptionText(String optionId, String title, String description) {
        VignetteOption target = option(optionId)
                .orElseThrow(() -> new IllegalArgumentException("unknown option '" + optionId + "' for vignette " + vignetteId));
        VignetteOption replaced = target.withText(title, description);
        return new Vignette(vignetteId, category, scenarioText,
                target == optionA() ? List.of(replaced, optionB()) : List.of(optionA(), replaced));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vignette)) return false;
        Vignette v = (Vignette) o;
        return vignetteId.equals(v.vignetteId)
                && Objects.equals(category, v.category)
                && scenarioText.equals(v.scenarioText)
                && options.equals(v.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vignetteId, category, scenarioText, options);
    }

    @Override
    public String toString() {
        return "Vignette{" + vignetteId + "}";
    }
}
