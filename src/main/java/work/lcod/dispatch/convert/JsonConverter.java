package work.lcod.dispatch.convert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import work.lcod.dispatch.runtime.CommandContext;

/**
 * Parses JSON documents into Jackson trees. Several tokens are joined with spaces before parsing.
 */
public final class JsonConverter implements ValueConverter<JsonNode> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public ValueType<JsonNode> type() {
        return ValueType.JSON;
    }

    @Override
    public JsonNode convertFromString(String argument, CommandContext ctx) {
        if (argument == null || argument.isBlank()) {
            return null;
        }
        try {
            return JSON.readTree(argument);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    @Override
    public JsonNode convertFromArray(List<String> arguments, CommandContext ctx) {
        return convertFromString(String.join(" ", arguments), ctx);
    }
}
