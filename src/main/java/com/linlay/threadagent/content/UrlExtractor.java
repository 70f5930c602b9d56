package com.linlay.threadagent.content;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds http(s) links in free text. Trailing sentence punctuation is not part of the link.
 */
public final class UrlExtractor {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+");
    private static final String TRAILING_PUNCTUATION = ".,;:!?)]}>\"'，。！？）」』";

    private UrlExtractor() {
    }

    public static List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            String url = stripTrailing(matcher.group());
            if (url.indexOf("://") + 3 < url.length()) {
                urls.add(url);
            }
        }
        return new ArrayList<>(urls);
    }

    /**
     * Replaces each link that has an entry in {@code contentByUrl} with a delimited content
     * block. Links without an entry stay as they are.
     */
    public static String replaceWithContent(String text, Map<String, String> contentByUrl) {
        if (text == null || contentByUrl == null || contentByUrl.isEmpty()) {
            return text;
        }
        Matcher matcher = URL_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String match = matcher.group();
            String url = stripTrailing(match);
            String content = contentByUrl.get(url);
            String replacement = content == null ? match : block(url, content) + match.substring(url.length());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String block(String url, String content) {
        return "[Web content summary from " + url + "]:\n'''\n" + content + "\n'''\n[END]";
    }

    static String stripTrailing(String url) {
        int end = url.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
