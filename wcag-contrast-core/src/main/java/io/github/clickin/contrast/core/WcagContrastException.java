package io.github.clickin.contrast.core;

import java.util.Objects;

/**
 * Base class for color parsing and validation errors.
 *
 * <p>Every failure of this module is an input-validation failure. Subclasses carry a
 * machine-readable kind next to the message, and keep the underlying error as the cause
 * when one failure is reported in terms of another.
 */
public abstract class WcagContrastException extends RuntimeException {

    protected WcagContrastException(String message) {
        super(message);
    }

    protected WcagContrastException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a two-character hex digit pair cannot be decoded into a byte.
     */
    public static class InvalidHexByte extends WcagContrastException {
        private final HexDecodeError error;
        private final String input;

        public InvalidHexByte(HexDecodeError error, String input) {
            super(error.describe(input));
            this.error = Objects.requireNonNull(error, "error");
            this.input = input;
        }

        public HexDecodeError error() {
            return error;
        }

        /**
         * The rejected input, possibly {@code null}.
         */
        public String input() {
            return input;
        }
    }

    /**
     * Raised when a hex color string cannot be parsed.
     *
     * <p>For {@link ColorParseError#INVALID_CHANNEL} the failing channel is available through
     * {@link #channel()} and the decoder error through {@link #hexError()}.
     */
    public static class InvalidColor extends WcagContrastException {
        private final ColorParseError error;
        private final Channel channel;

        public InvalidColor(ColorParseError error, String input) {
            super(error.describe(input));
            this.error = Objects.requireNonNull(error, "error");
            this.channel = null;
        }

        public InvalidColor(Channel channel, String input, InvalidHexByte cause) {
            super(ColorParseError.INVALID_CHANNEL.describe(input) + ": " + channel.label()
                    + " channel, " + cause.getMessage(), cause);
            this.error = ColorParseError.INVALID_CHANNEL;
            this.channel = Objects.requireNonNull(channel, "channel");
        }

        public ColorParseError error() {
            return error;
        }

        /**
         * The channel whose digits failed to decode, or {@code null} when the failure is not
         * tied to a channel.
         */
        public Channel channel() {
            return channel;
        }

        public InvalidHexByte hexError() {
            return (InvalidHexByte) getCause();
        }
    }

    /**
     * Raised when a channel value lies outside the 8-bit range or is not a finite number.
     */
    public static class InvalidChannel extends WcagContrastException {
        private final Channel channel;

        public InvalidChannel(Channel channel, double value) {
            super(channel.label() + " channel out of range [0, 255]: " + value);
            this.channel = Objects.requireNonNull(channel, "channel");
        }

        public Channel channel() {
            return channel;
        }
    }
}
