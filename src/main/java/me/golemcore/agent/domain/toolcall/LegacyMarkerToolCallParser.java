package me.golemcore.agent.domain.toolcall;

import me.golemcore.agent.domain.model.ToolCallFormat;
import me.golemcore.agent.domain.model.ToolInvocation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts {@code MARKER tool_name remaining_text} where the marker starts a
 * line. Everything after the tool name is parameter text. A marker in the
 * middle of a sentence is ignored.
 */
public class LegacyMarkerToolCallParser implements ToolCallParser {

    private final Pattern markerCall;
    private final ToolParameterParser parameterParser;

    public LegacyMarkerToolCallParser(String marker, ToolParameterParser parameterParser) {
        if (marker == null || marker.isBlank()) {
            throw new IllegalArgumentException("legacy marker must not be blank");
        }
        this.markerCall = Pattern.compile("^[ \\t]*" + Pattern.quote(marker.trim()) + "[ \\t]*([A-Za-z0-9_.\\-]+)",
                Pattern.MULTILINE);
        this.parameterParser = parameterParser;
    }

    @Override
    public ToolCallFormat getFormat() {
        return ToolCallFormat.LEGACY_MARKER;
    }

    @Override
    public Optional<ToolInvocation> parse(String modelOutput) {
        if (modelOutput == null) {
            return Optional.empty();
        }
        Matcher matcher = markerCall.matcher(modelOutput);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String remaining = modelOutput.substring(matcher.end());
        return Optional.of(ToolInvocation.builder()
                .toolName(matcher.group(1))
                .parameters(parameterParser.parse(remaining))
                .format(ToolCallFormat.LEGACY_MARKER)
                .build());
    }
}
