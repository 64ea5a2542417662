package de.levingamer8.greaterlauncher.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Writes flags as {@code "1"} / {@code "0"}, the form the game-side tooling expects. */
public class FlagSerializer extends JsonSerializer<Boolean> {

    @Override
    public void serialize(Boolean value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(Boolean.TRUE.equals(value) ? "1" : "0");
    }
}
