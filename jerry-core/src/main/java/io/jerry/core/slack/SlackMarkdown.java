package io.jerry.core.slack;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SlackMarkdown {
    private static final Pattern FENCE = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern BULLET = Pattern.compile("(?m)^(\\s*)[*-]\\s+");
    private static final Pattern HEADER = Pattern.compile("(?m)^#{1,6}\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern BOLD_STARS = Pattern.compile("\\*\\*(.+?)\\*\\*");
    private static final Pattern BOLD_UNDERSCORES = Pattern.compile("__(.+?)__");
    private static final Pattern STRIKE = Pattern.compile("~~(.+?)~~");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)]\\(([^)\\s]+)\\)");

    private SlackMarkdown() {
    }

    public static String toMrkdwn(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        Matcher fences = FENCE.matcher(markdown);
        int last = 0;
        while (fences.find()) {
            out.append(convert(markdown.substring(last, fences.start())));
            out.append(fences.group());
            last = fences.end();
        }
        out.append(convert(markdown.substring(last)));
        return out.toString();
    }

    private static String convert(String text) {
        String result = BULLET.matcher(text).replaceAll("$1• ");
        result = HEADER.matcher(result).replaceAll("*$1*");
        result = BOLD_STARS.matcher(result).replaceAll("*$1*");
        result = BOLD_UNDERSCORES.matcher(result).replaceAll("*$1*");
        result = STRIKE.matcher(result).replaceAll("~$1~");
        return LINK.matcher(result).replaceAll("<$2|$1>");
    }
}
