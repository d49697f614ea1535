package org.shadowide.st.lsp.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.shadowide.st.rule.ValidationRule;
import org.shadowide.st.rule.ValidationRuleAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Centralized configuration handler for the Structured Text language server.
 */
public class ConfigurationService {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    public static final String SECTION = "structuredText";

    private static final Gson GSON = new Gson();

    /**
     * Applies the {@value #SECTION} section of a settings object. Settings may also be the section itself.
     *
     * @return whether any setting was applied
     */
    public static boolean apply(JsonObject config, StLspSettings settings) {
        if (config == null || settings == null) return false;

        JsonObject section = config;
        if (config.has(SECTION)) {
            JsonElement element = config.get(SECTION);
            if (!element.isJsonObject()) {
                logger.warn("Ignoring non-object '{}' configuration: {}", SECTION, element);
                return false;
            }
            section = element.getAsJsonObject();
        }

        boolean changed = false;

        // format
        JsonObject format = object(section, "format");
        if (format != null) {
            if (format.has("tabSize")) {
                Integer tabSize = integer(format, "tabSize");
                if (tabSize != null && tabSize >= 1) {
                    settings.setTabSize(tabSize);
                    logger.info("Tab size changed to: {}", tabSize);
                    changed = true;
                } else {
                    logger.warn("Ignoring invalid format.tabSize: {}", format.get("tabSize"));
                }
            }
            if (format.has("insertSpaces")) {
                Boolean insertSpaces = bool(format, "insertSpaces");
                if (insertSpaces != null) {
                    settings.setInsertSpaces(insertSpaces);
                    logger.info("Insert spaces changed to: {}", insertSpaces);
                    changed = true;
                }
            }
        }

        // undo
        JsonObject undo = object(section, "undo");
        if (undo != null && undo.has("maxStackSize")) {
            Integer maxStackSize = integer(undo, "maxStackSize");
            if (maxStackSize != null && maxStackSize >= 1) {
                settings.setMaxUndoStackSize(maxStackSize);
                logger.info("Undo stack size changed to: {}", maxStackSize);
                changed = true;
            } else {
                logger.warn("Ignoring invalid undo.maxStackSize: {}", undo.get("maxStackSize"));
            }
        }

        // diagnostics
        JsonObject diagnostics = object(section, "diagnostics");
        if (diagnostics != null) {
            if (diagnostics.has("debounceMillis")) {
                Integer debounceMillis = integer(diagnostics, "debounceMillis");
                if (debounceMillis != null && debounceMillis >= 0) {
                    settings.setDebounceMillis(debounceMillis);
                    logger.info("Diagnostics debounce changed to: {} ms", debounceMillis);
                    changed = true;
                } else {
                    logger.warn("Ignoring invalid diagnostics.debounceMillis: {}", diagnostics.get("debounceMillis"));
                }
            }
            if (diagnostics.has("maxLoopDepth")) {
                Integer maxLoopDepth = integer(diagnostics, "maxLoopDepth");
                if (maxLoopDepth != null && maxLoopDepth >= 1) {
                    settings.setMaxLoopDepth(maxLoopDepth);
                    logger.info("Max loop depth changed to: {}", maxLoopDepth);
                    changed = true;
                } else {
                    logger.warn("Ignoring invalid diagnostics.maxLoopDepth: {}", diagnostics.get("maxLoopDepth"));
                }
            }
        }

        // validation rules per tag
        if (section.has("tagRules")) {
            Map<String, List<ValidationRule>> tagRules = ValidationRuleAdapter.parseTagRules(section.get("tagRules"));
            settings.setTagRules(tagRules);
            logger.info("Validation rules configured for {} tag(s)", tagRules.size());
            changed = true;
        }
        return changed;
    }

    public static boolean apply(Map<String, Object> config, StLspSettings settings) {
        if (config == null) return false;
        JsonElement tree = GSON.toJsonTree(config);
        return tree.isJsonObject() && apply(tree.getAsJsonObject(), settings);
    }

    private static JsonObject object(JsonObject parent, String member) {
        JsonElement element = parent.get(member);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    private static Integer integer(JsonObject parent, String member) {
        JsonElement element = parent.get(member);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return element.getAsNumber().intValue();
    }

    private static Boolean bool(JsonObject parent, String member) {
        JsonElement element = parent.get(member);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            return null;
        }
        return element.getAsBoolean();
    }
}
