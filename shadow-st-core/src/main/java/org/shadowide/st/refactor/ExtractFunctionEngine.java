package org.shadowide.st.refactor;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.shadowide.st.text.Identifiers;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Copies a line range into a new {@code FUNCTION} appended to the end of the document.
 * <p>
 * The selected lines stay where they are and no call to the new function is inserted; the user wires the call up.
 */
public class ExtractFunctionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ExtractFunctionEngine.class);

    public static final String DEFAULT_RETURN_TYPE = "VOID";

    /**
     * @param startLine 1-based, inclusive, must be before {@code endLine}
     * @param endLine   1-based, inclusive
     * @param returnType blank means {@value #DEFAULT_RETURN_TYPE}
     */
    public ExtractFunctionResult extractFunction(String text, int startLine, int endLine, String functionName,
                                                 String returnType) {
        Validate.notNull(text, "text");
        String[] lines = TextLines.split(text);
        if (startLine >= endLine || startLine < 1 || endLine > lines.length) {
            logger.warn("Rejected extract function selection {}-{} in a {} line document", startLine, endLine,
                    lines.length);
            return ExtractFunctionResult.failure(RefactorError.INVALID_SELECTION,
                    "Invalid selection " + startLine + "-" + endLine + ": start line must be before end line"
                            + " and both must lie within 1-" + lines.length);
        }
        if (!Identifiers.isUsableName(functionName)) {
            logger.warn("Rejected extract function name '{}'", functionName);
            return ExtractFunctionResult.failure(RefactorError.INVALID_IDENTIFIER,
                    "Invalid function name '" + functionName + "'. " + RefactorError.INVALID_IDENTIFIER.getDefaultMessage());
        }
        String type = StringUtils.isBlank(returnType) ? DEFAULT_RETURN_TYPE : returnType.trim();
        if (!Identifiers.isIdentifier(type)) {
            logger.warn("Rejected extract function return type '{}'", returnType);
            return ExtractFunctionResult.failure(RefactorError.INVALID_IDENTIFIER,
                    "Invalid return type '" + returnType + "'");
        }

        String extractedCode = TextLines.join(Arrays.copyOfRange(lines, startLine - 1, endLine));
        String declaration = functionDeclaration(functionName, type, extractedCode);
        String newContent = text.endsWith("\n") ? text + declaration : text + "\n" + declaration;
        logger.debug("Extracted lines {}-{} into function {}", startLine, endLine, functionName);
        return ExtractFunctionResult.success(newContent, extractedCode, declaration);
    }

    static String functionDeclaration(String name, String returnType, String body) {
        return "\nFUNCTION " + name + " : " + returnType + "\n"
                + "VAR\n"
                + "  (* Add variables here *)\n"
                + "END_VAR\n"
                + "\n"
                + body + "\n"
                + "\n"
                + "END_FUNCTION\n";
    }
}
