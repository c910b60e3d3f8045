package io.github.clickin.contrast.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.clickin.contrast.core.Color;
import io.github.clickin.contrast.core.WcagContrastException;

import java.io.IOException;

/**
 * Jackson module that writes {@link Color} as its {@code #rrggbb} string and parses it back
 * with {@link Color#fromHex(String)}.
 */
public final class ColorModule extends SimpleModule {

    public ColorModule() {
        super("wcag-contrast-color", Version.unknownVersion());
        addSerializer(Color.class, new ColorSerializer());
        addDeserializer(Color.class, new ColorDeserializer());
    }

    static final class ColorSerializer extends StdSerializer<Color> {
        ColorSerializer() {
            super(Color.class);
        }

        @Override
        public void serialize(Color value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toHex());
        }
    }

    static final class ColorDeserializer extends StdDeserializer<Color> {
        ColorDeserializer() {
            super(Color.class);
        }

        @Override
        public Color deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                return (Color) ctxt.handleUnexpectedToken(Color.class, p);
            }
            String text = p.getText();
            try {
                return Color.fromHex(text);
            } catch (WcagContrastException e) {
                throw JsonMappingException.from(p, "Invalid color \"" + text + "\": " + e.getMessage(), e);
            }
        }
    }
}
