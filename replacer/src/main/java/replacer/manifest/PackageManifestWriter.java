package replacer.manifest;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.TreeSet;

/**
 * Writes {@code package.xml} manifests listing reports for retrieve and deploy.
 *
 * <pre>
 * &lt;?xml version="1.0" encoding="UTF-8"?&gt;
 * &lt;Package xmlns="http://soap.sforce.com/2006/04/metadata"&gt;
 *     &lt;types&gt;
 *         &lt;members&gt;Sales_Reports/Pipeline&lt;/members&gt;
 *         &lt;name&gt;Report&lt;/name&gt;
 *     &lt;/types&gt;
 *     &lt;version&gt;65.0&lt;/version&gt;
 * &lt;/Package&gt;
 * </pre>
 */
public final class PackageManifestWriter {

    public static final String METADATA_NAMESPACE = "http://soap.sforce.com/2006/04/metadata";

    private PackageManifestWriter() {
    }

    /**
     * Renders a manifest. Members are sorted and de-duplicated.
     */
    public static String render(Collection<String> reportFullNames, String apiVersion) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            Document doc = factory.newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);

            Element pkg = doc.createElementNS(METADATA_NAMESPACE, "Package");
            doc.appendChild(pkg);

            Element types = doc.createElementNS(METADATA_NAMESPACE, "types");
            pkg.appendChild(types);
            for (String member : new TreeSet<>(reportFullNames)) {
                Element members = doc.createElementNS(METADATA_NAMESPACE, "members");
                members.setTextContent(member);
                types.appendChild(members);
            }
            Element name = doc.createElementNS(METADATA_NAMESPACE, "name");
            name.setTextContent("Report");
            types.appendChild(name);

            Element version = doc.createElementNS(METADATA_NAMESPACE, "version");
            version.setTextContent(apiVersion);
            pkg.appendChild(version);

            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = tf.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "4");

            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return normalizeDeclaration(out.toString());
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("Cannot render package manifest", e);
        }
    }

    /**
     * Writes a manifest to the given file, creating parent directories.
     *
     * @return the file written
     */
    public static Path write(Path file, Collection<String> reportFullNames, String apiVersion) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, render(reportFullNames, apiVersion), StandardCharsets.UTF_8);
        return file;
    }

    // The JDK transformer emits the declaration and root element on the same line
    private static String normalizeDeclaration(String xml) {
        String decl = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
        String body = xml.startsWith("<?xml") ? xml.substring(xml.indexOf("?>") + 2) : xml;
        body = body.strip();
        return decl + "\n" + body + "\n";
    }
}
