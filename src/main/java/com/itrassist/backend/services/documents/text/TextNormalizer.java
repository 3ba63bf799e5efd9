package com.itrassist.backend.services.documents.text;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw document text (PDF output, HTML pages, pasted text) into plain lines that the
 * line-oriented extraction rules can work with.
 */
public final class TextNormalizer {

    private static final Pattern SCRIPT = Pattern.compile("<script[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile("<style[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_TAG = Pattern.compile(
            "<\\s*(br|/p|/div|/tr|/li|/h[1-6]|/table|p|div|tr|li|h[1-6])\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern ENTITY = Pattern.compile("&(nbsp|amp|lt|gt|quot|#39|#8377);");

    private static final Map<String, String> ENTITIES = Map.of(
            "nbsp", " ",
            "amp", "&",
            "lt", "<",
            "gt", ">",
            "quot", "\"",
            "#39", "'",
            "#8377", "₹"
    );

    private TextNormalizer() {}

    /**
     * Removes markup from an HTML page, keeping block boundaries as line breaks.
     * Example: {@code "<p>Gross Salary: 1,200</p><p>TDS 90</p>"} becomes {@code "Gross Salary: 1,200\nTDS 90"}.
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) return "";

        String result = SCRIPT.matcher(html).replaceAll(" ");
        result = STYLE.matcher(result).replaceAll(" ");
        result = BLOCK_TAG.matcher(result).replaceAll("\n");
        result = ANY_TAG.matcher(result).replaceAll(" ");
        result = decodeEntities(result);

        return normalizeText(result);
    }

    /**
     * Normalises spacing: NBSP and other Unicode separators become plain spaces, carriage returns
     * become line breaks, runs of spaces collapse inside each line and blank lines are dropped.
     */
    public static String normalizeText(String text) {
        if (text == null || text.isBlank()) return "";

        // PDFBox emits NBSP and other separators that \s does not match.
        String result = text.replace('\u00A0', ' ');
        result = result.replace("\r\n", "\n").replace('\r', '\n');
        result = result.replaceAll("[\\p{Z}&&[^\\n]]+", " ");
        result = result.replace('\t', ' ');

        StringBuilder out = new StringBuilder();
        for (String line : result.split("\n")) {
            String collapsed = line.replaceAll(" {2,}", " ").trim();
            if (collapsed.isEmpty()) continue;
            if (out.length() > 0) out.append('\n');
            out.append(collapsed);
        }
        return out.toString();
    }

    private static String decodeEntities(String text) {
        Matcher m = ENTITY.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(ENTITIES.getOrDefault(m.group(1), " ")));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
