package org.calista.elicitation.vignette;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.elicitation.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class VignetteTest {

    private final Vignette v1 = Fixtures.spanningSet("v").get(0);

    @Test
    void requiresExactlyTwoOptions() {
        VignetteOption a = new VignetteOption("A", "a", "", Fixtures.baseline());
        assertThatThrownBy(() -> new Vignette("x", null, "", List.of(a)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly 2 options");
    }

    @Test
    void rejectsDuplicateOptionIds() {
        VignetteOption a = new VignetteOption("A", "", "", Fixtures.baseline());
        VignetteOption b = new VignetteOption("A", "", "", Fixtures.job(Map.of("job_security", 1.0)));
        assertThatThrownBy(() -> new Vignette("x", null, "", List.of(a, b)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate option id");
    }

    @Test
    void rejectsOptionsThatEncodeIdentically() {
        // unknown attributes do not reach the encoding
        VignetteOption a = new VignetteOption("A", "", "", Fixtures.baseline());
        VignetteOption b = new VignetteOption("B", "", "", Fixtures.job(Map.of("free_lunch", 1.0)));
        assertThatThrownBy(() -> new Vignette("x", null, "", List.of(a, b)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("identical features");
    }

    @Test
    void blankIdsAreRejected() {
        assertThatThrownBy(() -> new VignetteOption(" ", "", "", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delta_isAMinusB() {
        assertThat(v1.delta()).containsExactly(new double[]{0.5, 0, -1, 0, 0, 0, 0}, within(1e-12));
    }

    @Test
    void otherThan_andOptionLookup() {
        assertThat(v1.otherThan("A").optionId()).isEqualTo("B");
        assertThat(v1.otherThan("B").optionId()).isEqualTo("A");
        assertThat(v1.option("C")).isEmpty();
        assertThatThrownBy(() -> v1.otherThan("C")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void textRewrites_keepTheDesign() {
        Vignette personalized = v1.withScenarioText("As a nurse, which job?")
                .withOptionText("B", "Ward lead track", "Promotion within two years");

        assertThat(personalized.sameDesignAs(v1)).isTrue();
        assertThat(personalized).isNotEqualTo(v1);
        assertThat(personalized.optionB().title()).isEqualTo("Ward lead track");
        assertThat(personalized.optionA()).isEqualTo(v1.optionA());
    }

    @Test
    void sameDesignAs_detectsChangedAttributes() {
        Vignette other = Fixtures.vignette("v01", Map.of("wage", 35_000.0), Map.of("career_growth", 1.0));
        assertThat(other.sameDesignAs(v1)).isFalse();
    }

    @Test
    void blankCategoryIsAbsent() {
        Vignette v = new Vignette("x", " ", null, v1.options());
        assertThat(v.category()).isEmpty();
        assertThat(v.scenarioText()).isEmpty();
    }

    @Test
    void definition_usesSnakeCaseWireNames() throws Exception {
        ObjectMapper om = Fixtures.mapper();
        Vignette v = new Vignette("v01", "financial", "Pick one", v1.options());
        JsonNode json = om.readTree(om.writeValueAsString(VignetteDefinition.of(v)));

        assertThat(json.path("vignette_id").asText()).isEqualTo("v01");
        assertThat(json.path("scenario_text").asText()).isEqualTo("Pick one");
        assertThat(json.path("options").get(0).path("option_id").asText()).isEqualTo("A");
        assertThat(json.path("options").get(0).path("attributes").path("wage").asDouble()).isEqualTo(30_000.0);

        Vignette back = om.treeToValue(json, VignetteDefinition.class).toVignette();
        assertThat(back).isEqualTo(v);
    }

    @Test
    void library_indexesAndClassifiesIds() {
        VignetteLibrary lib = Fixtures.smallLibrary();
        assertThat(lib.size()).isEqualTo(10);
        assertThat(lib.isStaticBeginning("v01")).isTrue();
        assertThat(lib.isAdaptive("v05")).isTrue();
        assertThat(lib.isStaticEnd("v10")).isTrue();
        assertThat(lib.isAdaptive("v10")).isFalse();
        assertThat(lib.find("nope")).isEmpty();
        assertThat(lib.all()).extracting(Vignette::vignetteId).startsWith("v01", "v02", "v03");
    }

    @Test
    void library_rejectsDuplicateIdsAcrossLists() {
        assertThatThrownBy(() -> new VignetteLibrary(List.of(v1), List.of(), List.of(v1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate vignette id");
    }
}
