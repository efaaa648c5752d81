package com.openforge.memkeep.gateway;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-level HTML to text.  Good enough for feeding pages to a model; not a parser.
 */
public final class HtmlText {

    private static final Pattern SCRIPT   = Pattern.compile("<script[^>]*>[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE    = Pattern.compile("<style[^>]*>[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG      = Pattern.compile("<[^>]+>");
    private static final Pattern SPACE    = Pattern.compile("\\s+");
    private static final Pattern TITLE    = Pattern.compile("<title[^>]*>([\\s\\S]*?)</title>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARTICLE  = Pattern.compile("<article[^>]*>([\\s\\S]*?)</article>", Pattern.CASE_INSENSITIVE);
    private static final Pattern MAIN     = Pattern.compile("<main[^>]*>([\\s\\S]*?)</main>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY     = Pattern.compile("<body[^>]*>([\\s\\S]*?)</body>", Pattern.CASE_INSENSITIVE);

    private HtmlText() {}

    /** Drops scripts, styles and tags and collapses whitespace. */
    public static String toPlainText(String html) {
        if (html == null) {
            return "";
        }
        String text = SCRIPT.matcher(html).replaceAll("");
        text = STYLE.matcher(text).replaceAll("");
        text = TAG.matcher(text).replaceAll(" ");
        text = text.replace("&nbsp;", " ").replace("&amp;", "&").replace("&lt;", "<").replace("&gt;", ">");
        return SPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String title(String html) {
        return group(TITLE, html).map(HtmlText::toPlainText).orElse("");
    }

    /** The article element if present, else main, else body, else the whole document. */
    public static String mainContent(String html) {
        if (html == null) {
            return "";
        }
        return group(ARTICLE, html)
                .or(() -> group(MAIN, html))
                .or(() -> group(BODY, html))
                .orElse(html);
    }

    public static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static Optional<String> group(Pattern pattern, String html) {
        if (html == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(html);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
