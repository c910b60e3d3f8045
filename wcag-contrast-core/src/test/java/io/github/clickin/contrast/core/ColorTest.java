package io.github.clickin.contrast.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColorTest {

    @Test
    void fromHexAcceptsBothForms() {
        assertThat(Color.fromHex("#FFFFFF")).isEqualTo(Color.of(255, 255, 255));
        assertThat(Color.fromHex("000000")).isEqualTo(Color.of(0, 0, 0));
        assertThat(Color.fromHex("#f26ca7")).isEqualTo(Color.of(242, 108, 167));
    }

    @Test
    void fromHexIsCaseInsensitive() {
        assertThat(Color.fromHex("#ffffff")).isEqualTo(Color.fromHex("#FFFFFF"));
        assertThat(Color.fromHex("F26cA7")).isEqualTo(Color.of(242, 108, 167));
    }

    @Test
    void fromHexStripsSurroundingWhitespace() {
        assertThat(Color.fromHex("  #FF00aa \n")).isEqualTo(Color.of(255, 0, 170));
        assertThat(Color.fromHex("\t336699")).isEqualTo(Color.of(51, 102, 153));
    }

    @Test
    void fromHexExposesChannelsAsDoubles() {
        Color color = Color.fromHex("#1a2b3c");
        assertThat(color.red()).isEqualTo(26.0);
        assertThat(color.green()).isEqualTo(43.0);
        assertThat(color.blue()).isEqualTo(60.0);
    }

    @Test
    void rejectsEmptyInput() {
        assertParseError("", ColorParseError.EMPTY_INPUT);
        assertParseError(null, ColorParseError.EMPTY_INPUT);
    }

    @Test
    void rejectsNonAsciiBeforeCheckingLength() {
        assertParseError("\u00e4", ColorParseError.NON_ASCII_INPUT);
        assertParseError("#ffffff\u00a0", ColorParseError.NON_ASCII_INPUT);
        // Cyrillic small a, looks like a hex digit
        assertParseError("#\u0430\u0430bbcc", ColorParseError.NON_ASCII_INPUT);
    }

    @Test
    void rejectsInvalidLength() {
        assertParseError("#fff", ColorParseError.INVALID_LENGTH);
        assertParseError("ff00aa0", ColorParseError.INVALID_LENGTH);
        assertParseError("#ff00aa0", ColorParseError.INVALID_LENGTH);
        assertParseError("##ffffff", ColorParseError.INVALID_LENGTH);
        assertParseError("   ", ColorParseError.INVALID_LENGTH);
    }

    @Test
    void reportsFailingChannelWithDecoderCause() {
        assertThatThrownBy(() -> Color.fromHex("12345g"))
                .isInstanceOf(WcagContrastException.InvalidColor.class)
                .hasCauseInstanceOf(WcagContrastException.InvalidHexByte.class)
                .satisfies(e -> {
                    WcagContrastException.InvalidColor error = (WcagContrastException.InvalidColor) e;
                    assertThat(error.error()).isEqualTo(ColorParseError.INVALID_CHANNEL);
                    assertThat(error.channel()).isEqualTo(Channel.BLUE);
                    assertThat(error.hexError().error()).isEqualTo(HexDecodeError.INVALID_RIGHT_DIGIT);
                    assertThat(error.hexError().input()).isEqualTo("5g");
                });
    }

    @Test
    void hashInsideSixDigitsFailsOnRedChannel() {
        assertThatThrownBy(() -> Color.fromHex("#ff00a"))
                .isInstanceOf(WcagContrastException.InvalidColor.class)
                .satisfies(e -> {
                    WcagContrastException.InvalidColor error = (WcagContrastException.InvalidColor) e;
                    assertThat(error.channel()).isEqualTo(Channel.RED);
                    assertThat(error.hexError().error()).isEqualTo(HexDecodeError.INVALID_LEFT_DIGIT);
                });
    }

    @Test
    void greenChannelFailureIsReported() {
        assertThatThrownBy(() -> Color.fromHex("#00zz00"))
                .hasMessageContaining("green")
                .satisfies(e -> assertThat(((WcagContrastException.InvalidColor) e).channel())
                        .isEqualTo(Channel.GREEN));
    }

    @Test
    void ofRejectsChannelsOutsideByteRange() {
        assertThatThrownBy(() -> Color.of(256, 0, 0))
                .isInstanceOf(WcagContrastException.InvalidChannel.class)
                .satisfies(e -> assertThat(((WcagContrastException.InvalidChannel) e).channel())
                        .isEqualTo(Channel.RED));
        assertThatThrownBy(() -> Color.of(0, -1, 0))
                .isInstanceOf(WcagContrastException.InvalidChannel.class)
                .satisfies(e -> assertThat(((WcagContrastException.InvalidChannel) e).channel())
                        .isEqualTo(Channel.GREEN));
    }

    @Test
    void normalizeReturnsNewColorInUnitRange() {
        Color color = Color.of(255, 0, 51);
        Color normalized = color.normalize();

        assertThat(normalized.red()).isEqualTo(1.0);
        assertThat(normalized.green()).isEqualTo(0.0);
        assertThat(normalized.blue()).isEqualTo(0.2);
        assertThat(color).isEqualTo(Color.of(255, 0, 51));
    }

    @Test
    void toHexReproducesParsedInput() {
        for (int v = 0; v <= 255; v++) {
            String hex = "#" + HexByte.encode(v) + HexByte.encode(255 - v) + HexByte.encode(v ^ 0x5a);
            assertThat(Color.fromHex(hex.toUpperCase()).toHex()).isEqualTo(hex);
        }
    }

    @Test
    void toStringListsChannels() {
        assertThat(Color.of(255, 255, 255)).hasToString("(r: 255.0, g: 255.0, b: 255.0)");
    }

    private static void assertParseError(String input, ColorParseError expected) {
        assertThatThrownBy(() -> Color.fromHex(input))
                .isInstanceOf(WcagContrastException.InvalidColor.class)
                .satisfies(e -> {
                    WcagContrastException.InvalidColor error = (WcagContrastException.InvalidColor) e;
                    assertThat(error.error()).isEqualTo(expected);
                    assertThat(error.channel()).isNull();
                });
    }
}
