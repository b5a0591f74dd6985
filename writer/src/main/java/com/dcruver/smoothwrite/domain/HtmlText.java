package com.dcruver.smoothwrite.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders rich note content to plain text.
 *
 * Follows the rules a rich-text widget applies when it displays HTML:
 * whitespace collapses, block elements end a line, everything else is
 * reduced to its text. Content without any markup is taken as plain text
 * and keeps its line breaks.
 */
public final class HtmlText {

    private static final Pattern MARKUP = Pattern.compile("<[a-zA-Z!/][^>]*>");
    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern INVISIBLE_BLOCK = Pattern.compile(
        "<(head|style|script|title)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern DOCTYPE = Pattern.compile("<!\\w[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_TAG = Pattern.compile(
        "</?(p|div|h[1-6]|li|ul|ol|tr|table|blockquote|pre|hr|dl|dt|dd|body|html)\\b[^>]*>",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern ENTITY = Pattern.compile("&(#[xX][0-9a-fA-F]+|#\\d+|[a-zA-Z]+);");

    private static final Map<String, String> NAMED_ENTITIES = Map.of(
        "amp", "&",
        "lt", "<",
        "gt", ">",
        "quot", "\"",
        "apos", "'",
        "nbsp", " "
    );

    private HtmlText() {
    }

    /**
     * Check whether content contains at least one markup tag.
     */
    public static boolean looksLikeMarkup(String content) {
        return content != null && MARKUP.matcher(content).find();
    }

    /**
     * Convert content to plain text, trimmed, with blank lines removed.
     *
     * @param content HTML or plain text, may be null
     * @return plain text; empty when the content has no visible text
     */
    public static String toPlainText(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }

        String text;
        if (looksLikeMarkup(content)) {
            text = COMMENT.matcher(content).replaceAll("");
            text = INVISIBLE_BLOCK.matcher(text).replaceAll("");
            text = DOCTYPE.matcher(text).replaceAll("");
            text = WHITESPACE.matcher(text).replaceAll(" ");
            text = LINE_BREAK.matcher(text).replaceAll("\n");
            text = BLOCK_TAG.matcher(text).replaceAll("\n");
            text = ANY_TAG.matcher(text).replaceAll("");
            text = decodeEntities(text);
        } else {
            text = content.replace("\r\n", "\n").replace('\r', '\n');
        }

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * First non-empty line of the plain-text rendering, or empty.
     */
    public static String firstLine(String content) {
        String plain = toPlainText(content);
        int newline = plain.indexOf('\n');
        return newline < 0 ? plain : plain.substring(0, newline);
    }

    private static String decodeEntities(String text) {
        Matcher matcher = ENTITY.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(decodeEntity(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String decodeEntity(String name, String original) {
        if (name.startsWith("#")) {
            try {
                int codePoint = name.length() > 1 && (name.charAt(1) == 'x' || name.charAt(1) == 'X')
                    ? Integer.parseInt(name.substring(2), 16)
                    : Integer.parseInt(name.substring(1));
                if (codePoint == 0xA0) {
                    return " ";
                }
                return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : original;
            } catch (NumberFormatException e) {
                return original;
            }
        }
        return NAMED_ENTITIES.getOrDefault(name.toLowerCase(), original);
    }
}
