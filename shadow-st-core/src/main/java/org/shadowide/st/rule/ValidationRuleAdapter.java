package org.shadowide.st.rule;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gson mapping between {@link ValidationRule} variants and {@code {id, type, value, message, severity}}.
 * The shape of {@code value} depends on {@code type}: a number for {@code min} and {@code max}, an object
 * {@code {min, max}} for {@code range} and a string for {@code regex} and {@code custom}.
 */
public class ValidationRuleAdapter implements JsonSerializer<ValidationRule>, JsonDeserializer<ValidationRule> {

    private static final Logger logger = LoggerFactory.getLogger(ValidationRuleAdapter.class);

    private static final Gson GSON = new GsonBuilder()
            .registerTypeHierarchyAdapter(ValidationRule.class, new ValidationRuleAdapter())
            .create();

    public static Gson gson() {
        return GSON;
    }

    @Override
    public ValidationRule deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
        if (json == null || !json.isJsonObject()) {
            throw new JsonParseException("Validation rule must be an object: " + json);
        }
        JsonObject object = json.getAsJsonObject();
        String type = string(object, "type");
        if (type == null) {
            throw new JsonParseException("Validation rule has no type: " + json);
        }
        String id = string(object, "id");
        String message = string(object, "message");
        RuleSeverity severity = RuleSeverity.fromId(string(object, "severity"));
        JsonElement value = object.get("value");
        switch (type.toLowerCase(Locale.ROOT)) {
            case "min":
                return new MinRule(id, number(value, "min"), message, severity);
            case "max":
                return new MaxRule(id, number(value, "max"), message, severity);
            case "range":
                if (value == null || !value.isJsonObject()) {
                    throw new JsonParseException("range rule value must be an object with min and max: " + value);
                }
                JsonObject bounds = value.getAsJsonObject();
                try {
                    return new RangeRule(id, number(bounds.get("min"), "range.min"), number(bounds.get("max"), "range.max"),
                            message, severity);
                } catch (IllegalArgumentException e) {
                    throw new JsonParseException(e.getMessage(), e);
                }
            case "regex":
                return new RegexRule(id, text(value, "regex"), message, severity);
            case "custom":
                return new CustomRule(id, text(value, "custom"), message, severity);
            default:
                throw new JsonParseException("Unknown validation rule type: " + type);
        }
    }

    @Override
    public JsonElement serialize(ValidationRule rule, Type typeOfSrc, JsonSerializationContext context) {
        JsonObject object = new JsonObject();
        if (rule.getId() != null) {
            object.addProperty("id", rule.getId());
        }
        object.addProperty("type", rule.getType());
        if (rule instanceof MinRule) {
            object.addProperty("value", ((MinRule) rule).getMin());
        } else if (rule instanceof MaxRule) {
            object.addProperty("value", ((MaxRule) rule).getMax());
        } else if (rule instanceof RangeRule) {
            JsonObject bounds = new JsonObject();
            bounds.addProperty("min", ((RangeRule) rule).getMin());
            bounds.addProperty("max", ((RangeRule) rule).getMax());
            object.add("value", bounds);
        } else if (rule instanceof RegexRule) {
            object.addProperty("value", ((RegexRule) rule).getPattern());
        } else if (rule instanceof CustomRule) {
            object.addProperty("value", ((CustomRule) rule).getExpression());
        }
        object.addProperty("message", rule.getMessage());
        object.addProperty("severity", rule.getSeverity().getId());
        return object;
    }

    /**
     * Reads {@code {"TagName": [rule, ...], ...}}. Tag names are matched case-insensitively. Rules that do not parse
     * are skipped with a warning.
     */
    public static Map<String, List<ValidationRule>> parseTagRules(JsonElement json) {
        Map<String, List<ValidationRule>> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (json == null || !json.isJsonObject()) {
            return result;
        }
        for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject().entrySet()) {
            List<ValidationRule> rules = new ArrayList<>();
            JsonElement value = entry.getValue();
            JsonArray array;
            if (value.isJsonArray()) {
                array = value.getAsJsonArray();
            } else {
                array = new JsonArray();
                array.add(value);
            }
            for (JsonElement element : array) {
                try {
                    rules.add(GSON.fromJson(element, ValidationRule.class));
                } catch (JsonParseException e) {
                    logger.warn("Ignoring validation rule for tag {}: {}", entry.getKey(), e.getMessage());
                }
            }
            result.put(entry.getKey(), Collections.unmodifiableList(rules));
        }
        return result;
    }

    private static String string(JsonObject object, String member) {
        JsonElement element = object.get(member);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return element.getAsString();
    }

    private static double number(JsonElement element, String what) {
        if (element != null && element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            try {
                return primitive.isNumber() ? primitive.getAsDouble() : Double.parseDouble(primitive.getAsString().trim());
            } catch (NumberFormatException e) {
                throw new JsonParseException(what + " value is not a number: " + element, e);
            }
        }
        throw new JsonParseException(what + " value must be a number: " + element);
    }

    private static String text(JsonElement element, String what) {
        if (element == null || !element.isJsonPrimitive()) {
            throw new JsonParseException(what + " value must be a string: " + element);
        }
        return element.getAsString();
    }
}
