package com.mailbridge.mime;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * HTML to text conversion on top of jsoup
 * - block elements become line breaks
 * - list items become "- " lines, headings "#" markers
 * - links keep their target as "text (href)"
 */
@Component
public class JsoupTextNormalizer implements TextNormalizer {

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "tr", "table", "ul", "ol", "li", "blockquote", "pre",
            "section", "article", "header", "footer", "h1", "h2", "h3", "h4", "h5", "h6");

    private static final Pattern TRAILING_SPACES = Pattern.compile("(?m)[ \\t]+$");
    private static final Pattern LEADING_SPACES = Pattern.compile("(?m)^[ \\t]+");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");

    @Override
    public String toText(String markup) {
        if (markup == null || markup.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(markup);
        document.select("script, style, head").remove();

        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    out.append(textNode.text());
                } else if (node instanceof Element element) {
                    String tag = element.normalName();
                    if ("br".equals(tag)) {
                        out.append('\n');
                    } else if ("li".equals(tag)) {
                        out.append("\n- ");
                    } else if (tag.length() == 2 && tag.charAt(0) == 'h' && Character.isDigit(tag.charAt(1))) {
                        out.append('\n').append("#".repeat(tag.charAt(1) - '0')).append(' ');
                    } else if (BLOCK_TAGS.contains(tag)) {
                        out.append('\n');
                    } else if ("td".equals(tag) || "th".equals(tag)) {
                        out.append(" | ");
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element) {
                    String tag = element.normalName();
                    if ("a".equals(tag)) {
                        String href = element.attr("href");
                        if (!href.isBlank() && !href.equals(element.text().trim())) {
                            out.append(" (").append(href).append(')');
                        }
                    } else if (BLOCK_TAGS.contains(tag)) {
                        out.append('\n');
                    }
                }
            }
        }, document.body());

        String text = out.toString().replace('\u00A0', ' ');
        text = TRAILING_SPACES.matcher(text).replaceAll("");
        text = LEADING_SPACES.matcher(text).replaceAll("");
        text = BLANK_RUN.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}
