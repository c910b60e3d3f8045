package io.github.clickin.contrast.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HexByteTest {

    @Test
    void decodesBoundaryAndMixedValues() {
        assertThat(HexByte.decode("ff")).isEqualTo(255);
        assertThat(HexByte.decode("00")).isEqualTo(0);
        assertThat(HexByte.decode("1a")).isEqualTo(26);
    }

    @Test
    void decodeIsCaseInsensitive() {
        assertThat(HexByte.decode("FF")).isEqualTo(255);
        assertThat(HexByte.decode("aB")).isEqualTo(171);
    }

    @Test
    void rejectsWrongLength() {
        assertError("1", HexDecodeError.INVALID_LENGTH);
        assertError("abc", HexDecodeError.INVALID_LENGTH);
        assertError("", HexDecodeError.INVALID_LENGTH);
        assertError(null, HexDecodeError.INVALID_LENGTH);
    }

    @Test
    void reportsWhichDigitIsInvalid() {
        assertError("1g", HexDecodeError.INVALID_RIGHT_DIGIT);
        assertError("g1", HexDecodeError.INVALID_LEFT_DIGIT);
        assertError("gg", HexDecodeError.INVALID_LEFT_DIGIT);
        assertError("#f", HexDecodeError.INVALID_LEFT_DIGIT);
    }

    @Test
    void rejectsNonAsciiDigits() {
        // fullwidth digit one, which Character.digit would otherwise accept
        assertError("\uff111", HexDecodeError.INVALID_LEFT_DIGIT);
        assertError("1\u00e9", HexDecodeError.INVALID_RIGHT_DIGIT);
    }

    @Test
    void errorMessageNamesInput() {
        assertThatThrownBy(() -> HexByte.decode("zz"))
                .hasMessageContaining("\"zz\"");
    }

    @Test
    void encodeWritesTwoLowercaseDigits() {
        assertThat(HexByte.encode(0)).isEqualTo("00");
        assertThat(HexByte.encode(26)).isEqualTo("1a");
        assertThat(HexByte.encode(255)).isEqualTo("ff");
    }

    @Test
    void encodeRejectsValuesOutsideByteRange() {
        assertThatThrownBy(() -> HexByte.encode(256)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HexByte.encode(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decodeInvertsEncode() {
        for (int v = 0; v <= 255; v++) {
            assertThat(HexByte.decode(HexByte.encode(v))).isEqualTo(v);
        }
    }

    private static void assertError(String input, HexDecodeError expected) {
        assertThatThrownBy(() -> HexByte.decode(input))
                .isInstanceOf(WcagContrastException.InvalidHexByte.class)
                .satisfies(e -> {
                    WcagContrastException.InvalidHexByte error = (WcagContrastException.InvalidHexByte) e;
                    assertThat(error.error()).isEqualTo(expected);
                    assertThat(error.input()).isEqualTo(input);
                });
    }
}
