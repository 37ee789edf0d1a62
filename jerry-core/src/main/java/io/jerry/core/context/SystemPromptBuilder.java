package io.jerry.core.context;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SystemPromptBuilder {
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Map<String, ZoneId> WORLD_ZONES = worldZones();
    private static final String PERSONA = """
        You are a versatile AI assistant named Jerry. You were created as an open-source project.
        Provide concise, relevant assistance tailored to each request from users.

        This is a private thread between you and user.

        Note that context is sent in order of the most recent message last.
        Do not respond to messages in the context, as they have already been answered.

        Consider using the appropriate tool to provide more accurate and helpful responses.
        You have access to a variety of tools to help you with your tasks. These
        tools can be called and used to provide information to help you or the user, or perform
        actions that the user requests.

        You can use many tools in parallel and also plan to use them in the future in sequential
        order to provide the best possible assistance to the user. Ensure that you are using the
        right tools for the right tasks.

        When discussing times or scheduling, be aware of the user's potential time zone
        and provide relevant time conversions when appropriate.

        Current times around the world:
        %s

        Be professional and friendly.
        Don't ask for clarification unless absolutely necessary.
        Don't ask questions in your response.
        Don't use user names in your response.
        """;

    private final Clock clock;

    public SystemPromptBuilder(Clock clock) {
        this.clock = clock;
    }

    public String build(Map<String, String> toolDescriptions) {
        StringBuilder prompt = new StringBuilder(PERSONA.formatted(worldTimes()));
        String tools = toolSection(toolDescriptions);
        if (!tools.isEmpty()) {
            prompt.append('\n').append(tools);
        }
        return prompt.toString();
    }

    String worldTimes() {
        StringBuilder times = new StringBuilder();
        for (Map.Entry<String, ZoneId> zone : WORLD_ZONES.entrySet()) {
            if (times.length() > 0) {
                times.append('\n');
            }
            times.append(zone.getKey())
                .append(": ")
                .append(ZonedDateTime.now(clock.withZone(zone.getValue())).format(TIME_FORMAT));
        }
        return times.toString();
    }

    static String toolSection(Map<String, String> toolDescriptions) {
        if (toolDescriptions == null || toolDescriptions.isEmpty()) {
            return "";
        }
        StringBuilder section = new StringBuilder("Available tools:\n");
        for (Map.Entry<String, String> tool : toolDescriptions.entrySet()) {
            String description = tool.getValue() == null ? "" : tool.getValue();
            int newline = description.indexOf('\n');
            String firstLine = newline < 0 ? description : description.substring(0, newline);
            section.append("- ").append(tool.getKey()).append(": ").append(firstLine).append('\n');
        }
        return section.toString();
    }

    private static Map<String, ZoneId> worldZones() {
        Map<String, ZoneId> zones = new LinkedHashMap<>();
        zones.put("UTC", ZoneId.of("UTC"));
        zones.put("Eastern Time (ET)", ZoneId.of("America/New_York"));
        zones.put("Central Time (CT)", ZoneId.of("America/Chicago"));
        zones.put("Mountain Time (MT)", ZoneId.of("America/Denver"));
        zones.put("Pacific Time (PT)", ZoneId.of("America/Los_Angeles"));
        zones.put("GMT", ZoneId.of("GMT"));
        zones.put("Central European Time (CET)", ZoneId.of("Europe/Paris"));
        zones.put("Japan Standard Time (JST)", ZoneId.of("Asia/Tokyo"));
        zones.put("Australian Eastern Time (AET)", ZoneId.of("Australia/Sydney"));
        return Collections.unmodifiableMap(zones);
    }
}
