package wingman.extract;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Minimal RFC 4180 writer: CRLF record separators; fields holding a comma, quote, CR or LF
 * are quoted, with embedded quotes doubled.
 */
public class CsvWriter implements Closeable {

    private static final String RECORD_SEPARATOR = "\r\n";

    private final Writer out;

    public CsvWriter(Writer out) {
        this.out = out;
    }

    public void writeRow(List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) out.write(',');
            out.write(escape(fields.get(i)));
        }
        out.write(RECORD_SEPARATOR);
    }

    static String escape(String field) {
        if (field == null) return "";
        boolean quote = field.indexOf(',') >= 0 || field.indexOf('"') >= 0
                || field.indexOf('\r') >= 0 || field.indexOf('\n') >= 0;
        if (!quote) return field;
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
