package com.mailbridge.mime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based HTML to text conversion, used when the configured
 * {@link TextNormalizer} fails
 */
public final class TagStripper {

    private static final int FLAGS = Pattern.DOTALL | Pattern.CASE_INSENSITIVE;

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile("<(script|style)[^>]*>.*?</\\1\\s*>", FLAGS);
    private static final Pattern HEADING = Pattern.compile("<h([1-6])[^>]*>(.*?)</h\\1\\s*>", FLAGS);
    private static final Pattern LIST_ITEM = Pattern.compile("<li(\\s[^>]*)?>", FLAGS);
    private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>|</?(p|div|tr|ul|ol|table)(\\s[^>]*)?>|</li\\s*>", FLAGS);
    private static final Pattern CELL_END = Pattern.compile("</t[dh]\\s*>", FLAGS);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n\\s*\\n\\s*\\n");
    private static final Pattern LINE_EDGES = Pattern.compile("(?m)^[ \\t]+|[ \\t]+$");

    // &amp; last so "&amp;lt;" stays "&lt;"
    private static final Map<String, String> ENTITIES = new LinkedHashMap<>();

    static {
        ENTITIES.put("&nbsp;", " ");
        ENTITIES.put("&lt;", "<");
        ENTITIES.put("&gt;", ">");
        ENTITIES.put("&quot;", "\"");
        ENTITIES.put("&#39;", "'");
        ENTITIES.put("&apos;", "'");
        ENTITIES.put("&copy;", "\u00A9");
        ENTITIES.put("&reg;", "\u00AE");
        ENTITIES.put("&trade;", "\u2122");
        ENTITIES.put("&hellip;", "\u2026");
        ENTITIES.put("&mdash;", "\u2014");
        ENTITIES.put("&ndash;", "\u2013");
        ENTITIES.put("&ldquo;", "\u201C");
        ENTITIES.put("&rdquo;", "\u201D");
        ENTITIES.put("&lsquo;", "\u2018");
        ENTITIES.put("&rsquo;", "\u2019");
        ENTITIES.put("&amp;", "&");
    }

    private TagStripper() {}

    public static String strip(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String content = SCRIPT_OR_STYLE.matcher(html).replaceAll("");
        content = HEADING.matcher(content).replaceAll(m ->
                Matcher.quoteReplacement("\n" + "#".repeat(Integer.parseInt(m.group(1))) + " " + m.group(2) + "\n"));
        content = LIST_ITEM.matcher(content).replaceAll("\n- ");
        content = LINE_BREAK.matcher(content).replaceAll("\n");
        content = CELL_END.matcher(content).replaceAll(" | ");
        content = TAG.matcher(content).replaceAll("");

        for (Map.Entry<String, String> entity : ENTITIES.entrySet()) {
            content = content.replace(entity.getKey(), entity.getValue());
        }

        content = LINE_EDGES.matcher(content).replaceAll("");
        content = BLANK_RUN.matcher(content).replaceAll("\n\n");
        return content.strip();
    }
}
