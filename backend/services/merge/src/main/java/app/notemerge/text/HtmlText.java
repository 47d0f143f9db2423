package app.notemerge.text;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlText {

    private static final Pattern MEDIA_TAG_PATTERN = Pattern.compile(
            "<(?:img|audio|video|source)\\b[^>]*?\\bsrc\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))[^>]*>"
                    + "|<object\\b[^>]*?\\bdata\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))[^>]*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern COMMENT_PATTERN = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>", Pattern.DOTALL);
    private static final Pattern ENTITY_PATTERN = Pattern.compile("&(#[0-9]+|#[xX][0-9a-fA-F]+|[a-zA-Z]+);");
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
     * Removes markup but keeps referenced media filenames, padded with spaces.
     */
    public static String stripHtmlPreservingMediaFilenames(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        Matcher matcher = MEDIA_TAG_PATTERN.matcher(html);
        StringBuilder out = new StringBuilder(html.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(" " + firstGroup(matcher) + " "));
        }
        matcher.appendTail(out);
        return stripHtml(out.toString());
    }

    public static String stripHtml(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String withoutComments = COMMENT_PATTERN.matcher(html).replaceAll("");
        String withoutTags = TAG_PATTERN.matcher(withoutComments).replaceAll("");
        return decodeEntities(withoutTags);
    }

    public static String decodeEntities(String text) {
        if (text == null || text.indexOf('&') < 0) {
            return text;
        }
        Matcher matcher = ENTITY_PATTERN.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String decoded = decodeEntity(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(decoded == null ? matcher.group() : decoded));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static String escapeAttribute(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    private static String decodeEntity(String body) {
        if (body.startsWith("#x") || body.startsWith("#X")) {
            return codePoint(body.substring(2), 16);
        }
        if (body.startsWith("#")) {
            return codePoint(body.substring(1), 10);
        }
        return NAMED_ENTITIES.get(body.toLowerCase(Locale.ROOT));
    }

    private static String codePoint(String digits, int radix) {
        try {
            int value = Integer.parseInt(digits, radix);
            if (!Character.isValidCodePoint(value)) {
                return null;
            }
            return new String(Character.toChars(value));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String firstGroup(Matcher matcher) {
        for (int i = 1; i <= matcher.groupCount(); i++) {
            String value = matcher.group(i);
            if (value != null) {
                return value;
            }
        }
        return "";
    }
}
