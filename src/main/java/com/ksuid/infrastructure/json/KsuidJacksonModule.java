package com.ksuid.infrastructure.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;
import com.ksuid.domain.model.Ksuid;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads and writes {@link Ksuid} as its 27-character string form.
 * Registered with Spring's ObjectMapper as a bean.
 */
@Component
public class KsuidJacksonModule extends SimpleModule {

    public KsuidJacksonModule() {
        super("KsuidModule");
        addSerializer(Ksuid.class, new KsuidSerializer());
        addDeserializer(Ksuid.class, new KsuidDeserializer());
    }

    static class KsuidSerializer extends StdScalarSerializer<Ksuid> {

        KsuidSerializer() {
            super(Ksuid.class);
        }

        @Override
        public void serialize(Ksuid value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toString());
        }
    }

    static class KsuidDeserializer extends StdScalarDeserializer<Ksuid> {

        KsuidDeserializer() {
            super(Ksuid.class);
        }

        @Override
        public Ksuid deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String text = p.getValueAsString();
            if (text == null) {
                return (Ksuid) ctxt.handleUnexpectedToken(Ksuid.class, p);
            }
            var result = Ksuid.parse(text);
            if (result.isFailure()) {
                return (Ksuid) ctxt.handleWeirdStringValue(Ksuid.class, text, "%s", result.errorOrNull().message());
            }
            return result.getOrThrow();
        }
    }
}
