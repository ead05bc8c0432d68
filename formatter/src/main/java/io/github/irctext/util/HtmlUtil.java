package io.github.irctext.util;

import org.apache.commons.text.StringEscapeUtils;

/** Utility functions for HTML-related string handling. */
public final class HtmlUtil {

    private HtmlUtil() {}

    /**
     * Decodes named and numeric HTML entities, e.g. {@code &amp;}, {@code &#39;} and {@code &#x27;}. {@code &apos;},
     * which HTML 4 lacks, is decoded too. Unknown entities are left as they are.
     *
     * @param s input string
     * @return unescaped string; empty string if input is empty
     */
    public static String unescape(String s) {
        if (s.isEmpty()) return "";
        return StringEscapeUtils.unescapeHtml4(s.replace("&apos;", "'"));
    }

    /** Removes simple inline tags such as {@code <b>} and {@code </b>} that search APIs wrap around matches. */
    public static String stripTags(String s) {
        if (s.isEmpty()) return "";
        return s.replaceAll("(?i)</?(b|i|em|strong)>", "");
    }
}
