package io.github.clickin.contrast.json.jackson;

/**
 * Raised when a contrast report cannot be written to or read from JSON.
 */
public class ReportCodecException extends Exception {
    public ReportCodecException(String message) {
        super(message);
    }

    public ReportCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
