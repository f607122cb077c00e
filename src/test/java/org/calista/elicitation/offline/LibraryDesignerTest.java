package org.calista.elicitation.offline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.elicitation.Fixtures;
import org.calista.elicitation.io.FileIO;
import org.calista.elicitation.profile.DominanceFilter;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteLibrary;
import org.calista.elicitation.vignette.VignetteLibraryLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class LibraryDesignerTest {

    @TempDir
    Path dir;

    private static LibraryDesigner designer() {
        return new LibraryDesigner(DesignSpaces.tradeOffs(), LibraryDesigner.Options.builder()
                .numStatic(6)
                .numBeginning(4)
                .numAdaptive(10)
                .sampleSize(400)
                .build());
    }

    @Test
    void design_producesAllThreeListsWithoutDominatedVignettes() {
        VignetteLibrary lib = designer().design(new Random(42));

        assertThat(lib.staticBeginning()).extracting(Vignette::vignetteId)
                .containsExactly("static_begin_001", "static_begin_002", "static_begin_003", "static_begin_004");
        assertThat(lib.staticEnd()).extracting(Vignette::vignetteId)
                .containsExactly("static_end_001", "static_end_002");
        assertThat(lib.adaptive()).hasSize(10);
        assertThat(lib.all()).noneMatch(DominanceFilter::isDominated);
    }

    @Test
    void design_isReproducibleForASeed() {
        VignetteLibrary first = designer().design(new Random(7));
        VignetteLibrary second = designer().design(new Random(7));

        assertThat(second.all()).hasSameSizeAs(first.all());
        for (int i = 0; i < first.all().size(); i++) {
            assertThat(second.all().get(i).sameDesignAs(first.all().get(i))).isTrue();
        }
    }

    @Test
    void write_producesFilesTheLoaderReads() throws IOException {
        ObjectMapper mapper = Fixtures.mapper();
        VignetteLibrary lib = designer().design(new Random(1));
        FileIO io = new FileIO(dir);

        LibraryDesigner.write(lib, io, "designed", mapper);

        assertThat(Files.exists(dir.resolve("designed").resolve(VignetteLibraryLoader.ADAPTIVE_FILE))).isTrue();
        VignetteLibrary loaded = new VignetteLibraryLoader(mapper).loadFromDirectory(io, "designed");
        assertThat(loaded.size()).isEqualTo(lib.size());
        for (Vignette v : lib.all()) {
            Vignette back = loaded.find(v.vignetteId()).orElseThrow();
            assertThat(back.sameDesignAs(v)).isTrue();
            assertThat(back.scenarioText()).isEqualTo(v.scenarioText());
            assertThat(back.category()).isEqualTo(v.category());
        }
    }

    @Test
    void options_rejectMoreBeginningThanStaticVignettes() {
        assertThatThrownBy(() -> LibraryDesigner.Options.builder().numStatic(2).numBeginning(3).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LibraryDesigner.Options.builder().priorMean(new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
