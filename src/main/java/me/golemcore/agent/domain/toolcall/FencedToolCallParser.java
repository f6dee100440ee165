package me.golemcore.agent.domain.toolcall;

import me.golemcore.agent.domain.model.ToolCallFormat;
import me.golemcore.agent.domain.model.ToolInvocation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts a fenced block whose opening fence sits at the start of a line and
 * is tagged {@code tool:NAME}:
 *
 * <pre>
 * ```tool:calculator
 * {"operation": "add", "a": 10, "b": 5}
 * ```
 * </pre>
 *
 * The body runs up to the next {@code ```}, which may close the block on the
 * body's own line. It is parameter text (JSON or {@code key=value} pairs).
 */
public class FencedToolCallParser implements ToolCallParser {

    private static final Pattern FENCED_CALL = Pattern.compile(
            "^[ \\t]*```tool:[ \\t]*([A-Za-z0-9_.\\-]+)[ \\t]*\\R(.*?)```",
            Pattern.MULTILINE | Pattern.DOTALL);

    private final ToolParameterParser parameterParser;

    public FencedToolCallParser(ToolParameterParser parameterParser) {
        this.parameterParser = parameterParser;
    }

    @Override
    public ToolCallFormat getFormat() {
        return ToolCallFormat.FENCED;
    }

    @Override
    public Optional<ToolInvocation> parse(String modelOutput) {
        if (modelOutput == null) {
            return Optional.empty();
        }
        Matcher matcher = FENCED_CALL.matcher(modelOutput);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(ToolInvocation.builder()
                .toolName(matcher.group(1))
                .parameters(parameterParser.parse(matcher.group(2)))
                .format(ToolCallFormat.FENCED)
                .build());
    }
}
