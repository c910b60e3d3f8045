package io.github.clickin.contrast.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.clickin.contrast.core.ContrastReport;

import java.util.Objects;

/**
 * Reads and writes {@link ContrastReport} as JSON using Jackson.
 *
 * <p>Colors are written as {@code #rrggbb} strings, see {@link ColorModule}.
 */
public final class JacksonReportCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a codec with a default ObjectMapper.
     */
    public JacksonReportCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a codec from a custom ObjectMapper.
     *
     * <p>The mapper is copied before {@link ColorModule} is registered, so the caller's
     * instance is left untouched.
     *
     * @param mapper the ObjectMapper to start from
     */
    public JacksonReportCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy().registerModule(new ColorModule());
    }

    /**
     * Returns a codec that indents its output.
     */
    public JacksonReportCodec pretty() {
        return new JacksonReportCodec(mapper.copy().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public byte[] writeBytes(ContrastReport report) throws ReportCodecException {
        try {
            return mapper.writeValueAsBytes(report);
        } catch (Exception e) {
            throw new ReportCodecException("Failed to serialize contrast report to bytes", e);
        }
    }

    public String writeString(ContrastReport report) throws ReportCodecException {
        try {
            return mapper.writeValueAsString(report);
        } catch (Exception e) {
            throw new ReportCodecException("Failed to serialize contrast report to string", e);
        }
    }

    public ContrastReport readReport(byte[] data) throws ReportCodecException {
        if (data == null || data.length == 0) {
            throw new ReportCodecException("Cannot read contrast report from empty data");
        }
        try {
            return mapper.readValue(data, ContrastReport.class);
        } catch (Exception e) {
            throw new ReportCodecException("Failed to deserialize bytes to contrast report", e);
        }
    }

    public ContrastReport readReport(String json) throws ReportCodecException {
        if (json == null || json.isBlank()) {
            throw new ReportCodecException("Cannot read contrast report from empty string");
        }
        try {
            return mapper.readValue(json, ContrastReport.class);
        } catch (Exception e) {
            throw new ReportCodecException("Failed to deserialize string to contrast report", e);
        }
    }
}
