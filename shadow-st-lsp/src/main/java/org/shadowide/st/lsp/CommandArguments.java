package org.shadowide.st.lsp;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.List;

/**
 * Reads {@code executeCommand} arguments, which arrive as Gson elements over JSON-RPC and as plain Java values when
 * called in-process.
 */
final class CommandArguments {

    private final String command;
    private final List<Object> arguments;

    CommandArguments(String command, List<Object> arguments) {
        this.command = command;
        this.arguments = arguments != null ? arguments : Collections.emptyList();
    }

    String requireString(int index) {
        String value = optionalString(index);
        Validate.isTrue(value != null, "%s: argument %d must be a string", command, index);
        return value;
    }

    String optionalString(int index) {
        Object value = get(index);
        if (value instanceof JsonPrimitive) {
            return ((JsonPrimitive) value).getAsString();
        }
        if (value instanceof JsonElement) {
            return null;
        }
        return value != null ? value.toString() : null;
    }

    int requireInt(int index) {
        Object value = get(index);
        if (value instanceof JsonPrimitive && ((JsonPrimitive) value).isNumber()) {
            return ((JsonPrimitive) value).getAsInt();
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        String text = optionalString(index);
        Validate.isTrue(text != null && text.matches("-?\\d+"), "%s: argument %d must be an integer", command, index);
        return Integer.parseInt(text);
    }

    private Object get(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }
}
