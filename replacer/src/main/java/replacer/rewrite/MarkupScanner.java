package replacer.rewrite;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits raw XML into the regions whose text may be rewritten: element character data and
 * CDATA section content. Tags with their attributes, comments, processing instructions and
 * the DOCTYPE declaration are skipped.
 *
 * <p>Assumes the input has already been checked for well-formedness.
 */
final class MarkupScanner {

    /** Half-open {@code [start, end)} range of rewritable text. */
    record Region(int start, int end) {
        boolean contains(int from, int to) {
            return from >= start && to <= end;
        }
    }

    private MarkupScanner() {
    }

    static List<Region> textRegions(String xml) {
        List<Region> regions = new ArrayList<>();
        int i = 0;
        int n = xml.length();
        int textStart = 0;
        while (i < n) {
            if (xml.charAt(i) != '<') {
                i++;
                continue;
            }
            if (i > textStart) regions.add(new Region(textStart, i));

            if (xml.startsWith("<!--", i)) {
                i = skipPast(xml, i + 4, "-->");
            } else if (xml.startsWith("<![CDATA[", i)) {
                int contentStart = i + 9;
                int close = xml.indexOf("]]>", contentStart);
                int contentEnd = close < 0 ? n : close;
                regions.add(new Region(contentStart, contentEnd));
                i = close < 0 ? n : close + 3;
            } else if (xml.startsWith("<?", i)) {
                i = skipPast(xml, i + 2, "?>");
            } else if (xml.startsWith("<!", i)) {
                i = skipDeclaration(xml, i + 2);
            } else {
                i = skipTag(xml, i + 1);
            }
            textStart = i;
        }
        if (textStart < n) regions.add(new Region(textStart, n));
        return regions;
    }

    private static int skipPast(String xml, int from, String terminator) {
        int idx = xml.indexOf(terminator, from);
        return idx < 0 ? xml.length() : idx + terminator.length();
    }

    // quoted attribute values may contain '>'
    private static int skipTag(String xml, int from) {
        char quote = 0;
        for (int i = from; i < xml.length(); i++) {
            char c = xml.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i + 1;
            }
        }
        return xml.length();
    }

    // DOCTYPE with an optional [internal subset]
    private static int skipDeclaration(String xml, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < xml.length(); i++) {
            char c = xml.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == '>' && depth <= 0) {
                return i + 1;
            }
        }
        return xml.length();
    }
}
