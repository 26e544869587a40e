package io.spekcheck.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Optical entities")
class OpticalEntityTest {

    private static final Spectrum GOOD = new Spectrum(new double[] {400, 500}, new double[] {0.2, 0.8});
    private static final Spectrum BAD = new Spectrum(new double[] {400, 500}, new double[] {0.2, 1.8});

    @Nested
    @DisplayName("Dye")
    class DyeValidation {

        @Test
        void validDye() {
            var dye = new Dye("alexa-488", GOOD, GOOD, 73000.0, 0.92);

            assertThat(dye.isValid()).isTrue();
            assertThat(dye.uid()).isEqualTo("alexa-488");
        }

        @Test
        @DisplayName("unknown quantum yield and extinction coefficient are allowed")
        void nullScalarsAllowed() {
            assertThat(new Dye("x", GOOD, GOOD, null, null).isValid()).isTrue();
        }

        @Test
        void missingEmission() {
            var dye = new Dye("x", GOOD, null, 1.0, 1.0);

            assertThat(dye.validationError()).isEqualTo("'emission' property is not a Spectrum object");
        }

        @Test
        void invalidExcitationSpectrum() {
            assertThat(new Dye("x", BAD, GOOD, 1.0, 1.0).validationError()).contains("[0 1]");
        }

        @Test
        void negativeExtinctionCoefficient() {
            assertThat(new Dye("x", GOOD, GOOD, -1.0, 0.5).validationError())
                    .isEqualTo("Extinction Coefficient must be a positive number");
        }

        @Test
        void negativeQuantumYield() {
            assertThat(new Dye("x", GOOD, GOOD, 1.0, -0.5).validationError())
                    .isEqualTo("Quantum Yield must be a positive number");
        }

        @Test
        void referenceBrightnessIsAlexa488() {
            assertThat(Dye.REFERENCE_BRIGHTNESS).isEqualTo(0.92 * 73000);
        }
    }

    @Nested
    @DisplayName("Filter")
    class FilterBehaviour {

        @Test
        @DisplayName("reflection is derived once and kept")
        void reflectionMemoized() {
            var filter = new Filter("di-488", GOOD);

            Spectrum reflection = filter.reflection();

            assertThat(reflection.data()).containsExactly(1.0 - 0.2, 1.0 - 0.8);
            assertThat(filter.reflection()).isSameAs(reflection);
        }

        @Test
        @DisplayName("a filter measured in reflection keeps that measurement")
        void fromReflection() {
            var filter = Filter.fromReflection("di-561", GOOD);

            assertThat(filter.reflection()).isSameAs(GOOD);
            assertThat(filter.transmission().data()).containsExactly(1.0 - 0.2, 1.0 - 0.8);
        }

        @Test
        void spectrumForMode() {
            var filter = new Filter("f", GOOD);

            assertThat(filter.spectrumFor(Mode.TRANSMIT)).isSameAs(GOOD);
            assertThat(filter.spectrumFor(Mode.REFLECT)).isSameAs(filter.reflection());
        }

        @Test
        void missingTransmission() {
            assertThat(new Filter("f", null).validationError())
                    .isEqualTo("'transmission' property is not a Spectrum object");
        }
    }

    @Test
    void excitationAndDetectorValidation() {
        assertThat(new Excitation("led", GOOD).isValid()).isTrue();
        assertThat(new Excitation("led", null).validationError()).contains("'intensity'");
        assertThat(new Detector("cam", BAD).isValid()).isFalse();
        assertThat(new Detector("cam", GOOD).qe()).isSameAs(GOOD);
    }

    @Test
    void uidIsRequired() {
        assertThatThrownBy(() -> new Excitation(null, GOOD)).isInstanceOf(NullPointerException.class);
    }

    @Nested
    @DisplayName("Mode and path elements")
    class ModeAndPathElement {

        @Test
        void codesAreCaseInsensitive() {
            assertThat(Mode.fromCode("T")).isEqualTo(Mode.TRANSMIT);
            assertThat(Mode.fromCode("r")).isEqualTo(Mode.REFLECT);
            assertThat(Mode.TRANSMIT.code()).isEqualTo("t");
        }

        @Test
        void invalidCode() {
            assertThatThrownBy(() -> Mode.fromCode("x"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid filter mode 'x'");
        }

        @Test
        void toggle() {
            assertThat(Mode.TRANSMIT.toggle()).isEqualTo(Mode.REFLECT);
            assertThat(Mode.REFLECT.toggle()).isEqualTo(Mode.TRANSMIT);
        }

        @Test
        void elementDescribesByUid() {
            var element = new PathElement(new Filter("ff01-525", GOOD), Mode.REFLECT);

            assertThat(element.describe()).isEqualTo(new FilterPosition("ff01-525", Mode.REFLECT));
            assertThat(element.activeSpectrum()).isSameAs(element.filter().reflection());
            assertThat(element.withMode(Mode.TRANSMIT).activeSpectrum()).isSameAs(GOOD);
        }
    }

    @Nested
    @DisplayName("SetupDescription")
    class Description {

        @Test
        void emptyIsValid() {
            assertThat(SetupDescription.empty().isValid()).isTrue();
        }

        @Test
        void pathsAreCopiedAndUnmodifiable() {
            var positions = new java.util.ArrayList<FilterPosition>();
            positions.add(new FilterPosition("a", Mode.TRANSMIT));
            var description = new SetupDescription(null, "dye", null, positions, java.util.List.of());
            positions.clear();

            assertThat(description.exPath()).hasSize(1);
            assertThatThrownBy(() -> description.exPath().add(new FilterPosition("b", Mode.REFLECT)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void missingPathIsInvalid() {
            var description = new SetupDescription(null, null, null, null, java.util.List.of());

            assertThat(description.validate()).isEqualTo("exPath must be a list");
        }

        @Test
        void positionWithoutModeIsInvalid() {
            var description = new SetupDescription(
                    null, null, null, java.util.List.of(), java.util.List.of(new FilterPosition("f", null)));

            assertThat(description.validate()).isEqualTo("mode of 'f' must be r or t");
        }
    }
}
