package org.ergs.fixie.core.paths;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.ergs.fixie.util.Holding;

import java.io.IOException;

/**
 * Jackson bindings for holding fields: numbers or symbolic strings on read,
 * a number or {@code "inf"} on write.
 */
final class HoldingJson {

    private HoldingJson() {
    }

    static final class Serializer extends StdSerializer<Double> {

        Serializer() {
            super(Double.class);
        }

        @Override
        public void serialize(Double value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            if (Holding.isInfinite(value)) {
                gen.writeString(Holding.INFINITE);
            } else {
                gen.writeNumber(value);
            }
        }
    }

    static final class Deserializer extends StdDeserializer<Double> {

        Deserializer() {
            super(Double.class);
        }

        @Override
        public Double deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            Object raw;
            if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                raw = p.getDoubleValue();
            } else if (token == JsonToken.VALUE_STRING) {
                raw = p.getText();
            } else {
                return (Double) ctxt.handleUnexpectedToken(Double.class, p);
            }
            try {
                return Holding.normalize(raw);
            } catch (IllegalArgumentException e) {
                throw ctxt.weirdStringException(String.valueOf(raw), Double.class, e.getMessage());
            }
        }

        @Override
        public Double getNullValue(DeserializationContext ctxt) throws JsonMappingException {
            return ctxt.reportInputMismatch(this, "holding must not be null");
        }
    }
}
