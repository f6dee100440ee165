package me.golemcore.agent.domain.toolcall;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.agent.domain.model.ToolCallFormat;
import me.golemcore.agent.domain.model.ToolInvocation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts output that is, as a whole, a JSON object carrying {@code tool} and
 * {@code params} fields, optionally wrapped in a single {@code ```json} fence.
 * JSON embedded in surrounding prose is not a structured call.
 */
public class StructuredToolCallParser implements ToolCallParser {

    static final String TOOL_FIELD = "tool";
    static final String PARAMS_FIELD = "params";

    private static final Pattern JSON_FENCE = Pattern.compile("^```(?:json)?[ \\t]*\\R(.*?)\\R?```$",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final ToolParameterParser parameterParser;

    public StructuredToolCallParser(ToolParameterParser parameterParser) {
        this.parameterParser = parameterParser;
    }

    @Override
    public ToolCallFormat getFormat() {
        return ToolCallFormat.STRUCTURED;
    }

    @Override
    public Optional<ToolInvocation> parse(String modelOutput) {
        if (modelOutput == null) {
            return Optional.empty();
        }
        String candidate = unwrapFence(modelOutput.trim());
        JsonNode root = parameterParser.readObject(candidate);
        if (root == null) {
            return Optional.empty();
        }

        JsonNode tool = root.get(TOOL_FIELD);
        JsonNode params = root.get(PARAMS_FIELD);
        if (tool == null || !tool.isTextual() || tool.asText().isBlank()) {
            return Optional.empty();
        }
        if (params == null || !params.isObject()) {
            return Optional.empty();
        }

        return Optional.of(ToolInvocation.builder()
                .toolName(tool.asText().trim())
                .parameters(parameterParser.toMap(params))
                .format(ToolCallFormat.STRUCTURED)
                .build());
    }

    private String unwrapFence(String text) {
        Matcher matcher = JSON_FENCE.matcher(text);
        return matcher.matches() ? matcher.group(1).trim() : text;
    }
}
