package org.example.bookmarksync.service;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * jsoup based {@link HtmlMarkdownConverter}. Produces ATX headings, fenced code blocks,
 * {@code *} emphasis and {@code **} strong text.
 */
@Service
public class JsoupHtmlMarkdownConverter implements HtmlMarkdownConverter {

    private static final Set<String> SKIPPED_TAGS = Set.of(
        "script", "style", "noscript", "head", "template", "iframe", "svg", "form", "button"
    );

    private static final Set<String> BLOCK_TAGS = Set.of(
        "p", "div", "section", "article", "main", "header", "footer", "aside", "nav",
        "figure", "figcaption", "table", "tr", "dl", "dt", "dd"
    );

    @Override
    public String convert(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        StringBuilder out = new StringBuilder();
        appendChildren(doc.body(), out, 0);
        return normalizeBlankLines(out.toString()).trim();
    }

    private void appendChildren(Element element, StringBuilder out, int listDepth) {
        for (Node child : element.childNodes()) {
            appendNode(child, out, listDepth);
        }
    }

    private void appendNode(Node node, StringBuilder out, int listDepth) {
        if (node instanceof TextNode textNode) {
            String text = collapseWhitespace(textNode.getWholeText());
            if (!text.isBlank() || (out.length() > 0 && !endsWithWhitespace(out))) {
                out.append(escapeMarkdown(text));
            }
            return;
        }
        if (!(node instanceof Element element)) {
            return;
        }

        String tag = element.normalName();
        if (SKIPPED_TAGS.contains(tag)) {
            return;
        }

        switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                int level = tag.charAt(1) - '0';
                String heading = element.text().trim();
                if (!heading.isEmpty()) {
                    block(out).append("#".repeat(level)).append(' ').append(heading).append("\n\n");
                }
            }
            case "br" -> out.append("\n");
            case "hr" -> block(out).append("---\n\n");
            case "strong", "b" -> wrapInline(element, out, "**", listDepth);
            case "em", "i" -> wrapInline(element, out, "*", listDepth);
            case "code" -> {
                String code = element.text();
                if (!code.isEmpty()) {
                    out.append('`').append(code).append('`');
                }
            }
            case "pre" -> block(out).append("```\n").append(element.wholeText().stripTrailing()).append("\n```\n\n");
            case "a" -> appendLink(element, out, listDepth);
            case "img" -> appendImage(element, out);
            case "ul", "ol" -> appendList(element, out, listDepth, "ol".equals(tag));
            case "blockquote" -> appendBlockquote(element, out);
            default -> {
                if (BLOCK_TAGS.contains(tag)) {
                    block(out);
                    appendChildren(element, out, listDepth);
                    block(out);
                } else {
                    appendChildren(element, out, listDepth);
                }
            }
        }
    }

    private void wrapInline(Element element, StringBuilder out, String marker, int listDepth) {
        StringBuilder inner = new StringBuilder();
        appendChildren(element, inner, listDepth);
        String text = inner.toString().trim();
        if (!text.isEmpty()) {
            out.append(marker).append(text).append(marker);
        }
    }

    private void appendLink(Element element, StringBuilder out, int listDepth) {
        StringBuilder inner = new StringBuilder();
        appendChildren(element, inner, listDepth);
        String text = inner.toString().trim();
        String href = element.attr("abs:href");
        if (href.isEmpty()) {
            href = element.attr("href");
        }
        if (href.isEmpty() || href.startsWith("javascript:")) {
            out.append(text);
        } else if (text.isEmpty()) {
            out.append('<').append(href).append('>');
        } else {
            out.append('[').append(text).append("](").append(href).append(')');
        }
    }

    private void appendImage(Element element, StringBuilder out) {
        String src = element.attr("abs:src");
        if (src.isEmpty()) {
            src = element.attr("src");
        }
        if (!src.isEmpty()) {
            out.append("![").append(element.attr("alt").trim()).append("](").append(src).append(')');
        }
    }

    private void appendList(Element list, StringBuilder out, int listDepth, boolean ordered) {
        if (listDepth == 0) {
            block(out);
        } else if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
        String indent = "  ".repeat(listDepth);
        int index = 1;
        for (Element item : list.children()) {
            if (!"li".equals(item.normalName())) {
                continue;
            }
            StringBuilder inner = new StringBuilder();
            appendChildren(item, inner, listDepth + 1);
            String text = normalizeBlankLines(inner.toString()).strip();
            String bullet = ordered ? (index++) + ". " : "- ";
            out.append(indent).append(bullet).append(text).append('\n');
        }
        if (listDepth == 0) {
            out.append('\n');
        }
    }

    private void appendBlockquote(Element element, StringBuilder out) {
        StringBuilder inner = new StringBuilder();
        appendChildren(element, inner, 0);
        String text = normalizeBlankLines(inner.toString()).trim();
        if (text.isEmpty()) {
            return;
        }
        block(out);
        for (String line : text.split("\n")) {
            out.append(line.isBlank() ? ">" : "> " + line).append('\n');
        }
        out.append('\n');
    }

    /**
     * Ensures the buffer ends at a paragraph boundary.
     */
    private static StringBuilder block(StringBuilder out) {
        int length = out.length();
        if (length == 0) {
            return out;
        }
        while (length > 0 && out.charAt(length - 1) == ' ') {
            out.setLength(--length);
        }
        if (length >= 2 && out.charAt(length - 1) == '\n' && out.charAt(length - 2) == '\n') {
            return out;
        }
        out.append(length > 0 && out.charAt(length - 1) == '\n' ? "\n" : "\n\n");
        return out;
    }

    private static String collapseWhitespace(String text) {
        return text.replaceAll("\\s+", " ");
    }

    private static boolean endsWithWhitespace(StringBuilder out) {
        return Character.isWhitespace(out.charAt(out.length() - 1));
    }

    private static String escapeMarkdown(String text) {
        return text.replaceAll("([\\\\`*_\\[\\]])", "\\\\$1");
    }

    private static String normalizeBlankLines(String markdown) {
        return markdown
            .replaceAll("[ \\t]+\\n", "\n")
            .replaceAll("\\n{3,}", "\n\n");
    }
}
