package app.notemerge.service.media;

import app.notemerge.text.HtmlText;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds media filenames embedded in note field HTML and rebuilds the field with
 * replacements. Understands html media tags and {@code [sound:...]} references.
 */
public final class MediaReferences {

    private static final Pattern HTML_MEDIA_PATTERN = Pattern.compile(
            "(<(?:img|audio|video|source|object)\\b[^>]*?\\b(?:src|data)\\s*=\\s*)(?:\"([^\"]*)\"|'([^']*)'|([^\\s>\"']+))",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern SOUND_PATTERN = Pattern.compile("\\[sound:([^\\]]+)]");

    private MediaReferences() {
    }

    /**
     * Applies {@code resolver} to every referenced filename. An empty result keeps the
     * reference as written. Returns the original instance when nothing was replaced.
     */
    public static String replace(String text, Function<String, Optional<String>> resolver) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String html = replaceHtmlRefs(text, resolver);
        return replaceSoundRefs(html, resolver);
    }

    private static String replaceHtmlRefs(String text, Function<String, Optional<String>> resolver) {
        Matcher matcher = HTML_MEDIA_PATTERN.matcher(text);
        StringBuilder out = null;
        int last = 0;
        while (matcher.find()) {
            String quote;
            String raw;
            if (matcher.group(2) != null) {
                quote = "\"";
                raw = matcher.group(2);
            } else if (matcher.group(3) != null) {
                quote = "'";
                raw = matcher.group(3);
            } else {
                quote = "";
                raw = matcher.group(4);
            }
            Optional<String> replacement = resolver.apply(HtmlText.decodeEntities(raw));
            if (replacement.isEmpty()) {
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length() + 16);
            }
            String escaped = HtmlText.escapeAttribute(replacement.get());
            if (quote.isEmpty() && escaped.chars().anyMatch(Character::isWhitespace)) {
                quote = "\"";
            }
            out.append(text, last, matcher.start())
                    .append(matcher.group(1))
                    .append(quote)
                    .append(escaped)
                    .append(quote);
            last = matcher.end();
        }
        if (out == null) {
            return text;
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    private static String replaceSoundRefs(String text, Function<String, Optional<String>> resolver) {
        Matcher matcher = SOUND_PATTERN.matcher(text);
        StringBuilder out = null;
        int last = 0;
        while (matcher.find()) {
            Optional<String> replacement = resolver.apply(matcher.group(1));
            if (replacement.isEmpty()) {
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length() + 16);
            }
            out.append(text, last, matcher.start())
                    .append("[sound:")
                    .append(replacement.get())
                    .append(']');
            last = matcher.end();
        }
        if (out == null) {
            return text;
        }
        out.append(text, last, text.length());
        return out.toString();
    }
}
