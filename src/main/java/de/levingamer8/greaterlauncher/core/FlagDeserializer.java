package de.levingamer8.greaterlauncher.core;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import de.levingamer8.greaterlauncher.settings.SettingValue;

import java.io.IOException;
import java.util.Locale;

/**
 * Reads on/off flags from launcher_configs.json. Older launcher versions wrote {@code 1}, newer ones
 * {@code "1"}, hand-edited files sometimes {@code true}. All of them mean on.
 * Values that are neither clearly on nor clearly off deserialize to {@code null}.
 */
public class FlagDeserializer extends JsonDeserializer<Boolean> {

    @Override
    public Boolean deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        return parse(node);
    }

    @Override
    public Boolean getNullValue(DeserializationContext ctxt) {
        return null;
    }

    static Boolean parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (!node.isValueNode()) return null;

        SettingValue v = SettingValue.parse(node.asText());
        if (v.isTruthy()) return Boolean.TRUE;
        String t = v.asString().strip().toLowerCase(Locale.ROOT);
        if (t.equals("0") || t.equals("false") || t.equals("no")) return Boolean.FALSE;
        try {
            return Double.parseDouble(t) == 0.0d ? Boolean.FALSE : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
