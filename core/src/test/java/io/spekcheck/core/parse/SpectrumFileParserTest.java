package io.spekcheck.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.spekcheck.core.error.SpectrumParseException;
import io.spekcheck.core.model.Detector;
import io.spekcheck.core.model.Dye;
import io.spekcheck.core.model.Excitation;
import io.spekcheck.core.model.Filter;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SpectrumFileParser")
class SpectrumFileParserTest {

    private static final Map<String, String> DYE_ATTRS = Map.of("uid", "alexa-488", "keySpace", "dyes");

    private static final String DYE_FILE = String.join(
            "\n",
            "Name: Alexa Fluor 488",
            "Type: dye",
            "# measured in PBS",
            "Extinction coefficient: 73000 M-1 cm-1",
            "Quantum Yield: 0.92",
            "",
            "wavelength, excitation, emission",
            "400, 2.0, 0.0",
            "500, 100.0, 40.0",
            "",
            "600, 0.0, 100.0");

    @Nested
    @DisplayName("readers")
    class Readers {

        @Test
        @DisplayName("a dye file gives both spectra and the header numbers")
        void dye() {
            Dye dye = SpectrumFileParser.readDye(DYE_FILE, DYE_ATTRS);

            assertThat(dye.uid()).isEqualTo("alexa-488");
            assertThat(dye.exCoeff()).isEqualTo(73000.0);
            assertThat(dye.qYield()).isEqualTo(0.92);
            assertThat(dye.excitation().wavelength()).containsExactly(400, 500, 600);
            assertThat(dye.excitation().data()).containsExactly(new double[] {0.02, 1.0, 0.0}, within(1e-12));
            assertThat(dye.emission().data()).containsExactly(new double[] {0.0, 0.4, 1.0}, within(1e-12));
            assertThat(dye.isValid()).isTrue();
        }

        @Test
        @DisplayName("an unknown header value reads as null")
        void unknownHeaderValue() {
            String text = DYE_FILE.replace("Quantum Yield: 0.92", "Quantum Yield: unknown");

            assertThat(SpectrumFileParser.readDye(text, DYE_ATTRS).qYield()).isNull();
        }

        @Test
        @DisplayName("fractions up to 10 are kept as they are")
        void fractions() {
            Excitation lamp = SpectrumFileParser.readExcitation(
                    "wavelength,intensity\n400,0.25\n401,0.5\n", Map.of("uid", "led"));

            assertThat(lamp.intensity().data()).containsExactly(0.25, 0.5);
        }

        @Test
        @DisplayName("a filter reads transmission, or derives it from reflection")
        void filter() {
            Filter transmissive = SpectrumFileParser.readFilter("wavelength,transmission\n400,0.8\n500,0.1", Map.of("uid", "bp"));
            Filter dichroic = SpectrumFileParser.readFilter("wavelength,reflection\n400,0.75\n500,0.25", Map.of("uid", "di"));

            assertThat(transmissive.transmission().data()).containsExactly(0.8, 0.1);
            assertThat(dichroic.reflection().data()).containsExactly(0.75, 0.25);
            assertThat(dichroic.transmission().data()).containsExactly(0.25, 0.75);
        }

        @Test
        void detector() {
            Detector camera = SpectrumFileParser.readDetector("Name: sCMOS\nwavelength,qe\n400,50\n500,80", Map.of("uid", "cam"));

            assertThat(camera.qe().data()).containsExactly(new double[] {0.5, 0.8}, within(1e-12));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("errors name the entity and its key space")
        void source() {
            assertThatThrownBy(() -> SpectrumFileParser.readDye("wavelength,excitation,emission\n400,1,1", DYE_ATTRS))
                    .isInstanceOf(SpectrumParseException.class)
                    .hasMessageStartingWith("missing value for '")
                    .satisfies(e -> {
                        SpectrumParseException error = (SpectrumParseException) e;
                        assertThat(error.subject()).isEqualTo("alexa-488");
                        assertThat(error.source()).isEqualTo("dyes/alexa-488");
                    });
        }

        @Test
        void duplicateHeaderKey() {
            String text = DYE_FILE.replace("Quantum Yield: 0.92", "Quantum Yield: 0.92\nQuantum Yield: 0.9");

            assertThatThrownBy(() -> SpectrumFileParser.readDye(text, DYE_ATTRS))
                    .isInstanceOf(SpectrumParseException.class)
                    .hasMessageStartingWith("duplicate header key 'Quantum Yield'");
        }

        @Test
        @DisplayName("a column may not repeat a header property")
        void headerAndCsvOverlap() {
            String text = DYE_FILE.replace("wavelength, excitation, emission", "wavelength, excitation, emission, q_yield")
                    .replace("400, 2.0, 0.0", "400, 2.0, 0.0, 1")
                    .replace("500, 100.0, 40.0", "500, 100.0, 40.0, 1")
                    .replace("600, 0.0, 100.0", "600, 0.0, 100.0, 1");

            assertThatThrownBy(() -> SpectrumFileParser.readDye(text, DYE_ATTRS))
                    .hasMessage("csv and header have duplicate properties");
        }

        @Test
        void duplicateColumn() {
            assertThatThrownBy(() -> SpectrumFileParser.readFilter(
                            "wavelength,transmission,transmission\n400,1,1", Map.of("uid", "f")))
                    .hasMessage("duplicate column 'transmission'");
        }

        @Test
        void missingColumn() {
            assertThatThrownBy(() -> SpectrumFileParser.readFilter("wavelength,absorbance\n400,1", Map.of("uid", "f")))
                    .hasMessage("missing 'transmission' or 'reflection' column");
            assertThatThrownBy(() -> SpectrumFileParser.readExcitation("wavelength,power\n400,1", Map.of("uid", "x")))
                    .hasMessage("missing 'intensity' column");
        }

        @Test
        void rowErrors() {
            assertThatThrownBy(() -> SpectrumFileParser.readExcitation(
                            "wavelength,intensity\n400,1\n401", Map.of("uid", "x")))
                    .hasMessage("line 3: expected 2 values, got 1");
            assertThatThrownBy(() -> SpectrumFileParser.readExcitation(
                            "wavelength,intensity\n400,abc", Map.of("uid", "x")))
                    .hasMessage("line 2: 'abc' is not a number")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        void structure() {
            assertThatThrownBy(() -> SpectrumFileParser.readExcitation("Name: lamp\n", Map.of("uid", "x")))
                    .hasMessage("no CSV section");
            assertThatThrownBy(() -> SpectrumFileParser.readExcitation("wavelength\n400", Map.of("uid", "x")))
                    .hasMessage("CSV has no spectrum column");
            assertThatThrownBy(() -> SpectrumFileParser.readExcitation(null, Map.of("uid", "x")))
                    .hasMessage("no content");
            assertThatThrownBy(() -> SpectrumFileParser.readExcitation("wavelength,intensity", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
