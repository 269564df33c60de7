package replacer.rewrite;

import replacer.exceptions.MalformedReportException;
import replacer.model.FieldReference;
import replacer.model.ReplacementPlan;
import replacer.model.ReportDescriptor;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

/**
 * Replaces a field reference inside one report definition.
 *
 * <h2>Matching</h2>
 * An occurrence of {@code Object.Field} is a reference only when the character before it is
 * neither an identifier character ({@code [A-Za-z0-9_]}) nor {@code '.'}, and the character
 * after it is not an identifier character. So {@code Account.OldField__cLongerName},
 * {@code MyAccount.OldField__c} and {@code Parent.Account.OldField__c} are left alone.
 * Matching is case-sensitive.
 *
 * <h2>Scope</h2>
 * Only element character data and CDATA content are rewritten. Tag names, attributes,
 * comments, processing instructions and the DOCTYPE are copied as they are. Nothing else in
 * the definition changes: no re-serialization, no whitespace or entity normalization. A
 * definition without references comes back as the identical string.
 *
 * <p>Stateless and thread-safe; one instance is shared by all rewrite workers.
 */
public class ReferenceRewriter {

    private final SAXParserFactory parserFactory;

    public ReferenceRewriter() {
        this.parserFactory = SAXParserFactory.newInstance();
        parserFactory.setNamespaceAware(true);
        parserFactory.setValidating(false);
        setFeature(parserFactory, "http://xml.org/sax/features/external-general-entities", false);
        setFeature(parserFactory, "http://xml.org/sax/features/external-parameter-entities", false);
        setFeature(parserFactory, "http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    }

    private static void setFeature(SAXParserFactory factory, String feature, boolean value) {
        try {
            factory.setFeature(feature, value);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IllegalStateException("XML parser does not support " + feature, e);
        }
    }

    /**
     * Rewrites a report, attributing failures to its id.
     */
    public RewriteResult rewrite(ReportDescriptor report, ReplacementPlan plan) throws MalformedReportException {
        if (!report.isRetrieved()) {
            throw new IllegalArgumentException("Report " + report.reportId() + " has not been retrieved");
        }
        return rewrite(report.reportId(), report.rawDefinition(), plan);
    }

    /**
     * Rewrites a raw definition.
     *
     * @throws MalformedReportException if the definition is not well-formed XML
     */
    public RewriteResult rewrite(String rawDefinition, ReplacementPlan plan) throws MalformedReportException {
        return rewrite(null, rawDefinition, plan);
    }

    private RewriteResult rewrite(String reportId, String rawDefinition, ReplacementPlan plan)
            throws MalformedReportException {
        checkWellFormed(reportId, rawDefinition, plan.oldField());

        String oldToken = plan.oldField().qualifiedName();
        String newToken = plan.newField().qualifiedName();
        List<MarkupScanner.Region> regions = MarkupScanner.textRegions(rawDefinition);

        StringBuilder out = null;
        int copiedUpTo = 0;
        int found = 0;
        int regionIdx = 0;
        int from = 0;
        int idx;
        while ((idx = rawDefinition.indexOf(oldToken, from)) >= 0) {
            int end = idx + oldToken.length();
            while (regionIdx < regions.size() && regions.get(regionIdx).end() < end) {
                regionIdx++;
            }
            boolean inText = regionIdx < regions.size() && regions.get(regionIdx).contains(idx, end);
            if (inText && isTokenBoundary(rawDefinition, idx, end)) {
                if (out == null) out = new StringBuilder(rawDefinition.length() + 16);
                out.append(rawDefinition, copiedUpTo, idx).append(newToken);
                copiedUpTo = end;
                found++;
                from = end;
            } else {
                from = idx + 1;
            }
        }

        if (out == null) {
            return new RewriteResult(rawDefinition, 0, 0);
        }
        out.append(rawDefinition, copiedUpTo, rawDefinition.length());
        return new RewriteResult(out.toString(), found, found);
    }

    /**
     * Counts token-exact references without rewriting. Malformed input counts as 0.
     */
    public int countReferences(String rawDefinition, FieldReference field) {
        String token = field.qualifiedName();
        List<MarkupScanner.Region> regions = MarkupScanner.textRegions(rawDefinition);
        int count = 0;
        int from = 0;
        int idx;
        while ((idx = rawDefinition.indexOf(token, from)) >= 0) {
            int end = idx + token.length();
            if (isTokenBoundary(rawDefinition, idx, end) && inAnyRegion(regions, idx, end)) {
                count++;
                from = end;
            } else {
                from = idx + 1;
            }
        }
        return count;
    }

    private static boolean inAnyRegion(List<MarkupScanner.Region> regions, int from, int to) {
        for (MarkupScanner.Region r : regions) {
            if (r.contains(from, to)) return true;
        }
        return false;
    }

    static boolean isTokenBoundary(String s, int start, int end) {
        if (start > 0) {
            char before = s.charAt(start - 1);
            if (isIdentifierChar(before) || before == '.') return false;
        }
        return end >= s.length() || !isIdentifierChar(s.charAt(end));
    }

    private static boolean isIdentifierChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }

    private void checkWellFormed(String reportId, String rawDefinition, FieldReference oldField)
            throws MalformedReportException {
        try {
            SAXParser parser = parserFactory.newSAXParser();
            parser.parse(new InputSource(new StringReader(rawDefinition)), new DefaultHandler());
        } catch (SAXException e) {
            int rough = countRawOccurrences(rawDefinition, oldField.qualifiedName());
            throw new MalformedReportException("Report definition is not well-formed XML: " + e.getMessage(),
                    reportId, rough, e);
        } catch (ParserConfigurationException | IOException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    private static int countRawOccurrences(String s, String token) {
        int count = 0;
        int from = 0;
        int idx;
        while ((idx = s.indexOf(token, from)) >= 0) {
            if (isTokenBoundary(s, idx, idx + token.length())) count++;
            from = idx + token.length();
        }
        return count;
    }
}
