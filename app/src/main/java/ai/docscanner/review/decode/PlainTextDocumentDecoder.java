package ai.docscanner.review.decode;

import ai.docscanner.review.markup.MarkupDocument;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Treats each run of lines separated by a blank line as one paragraph.
 */
public class PlainTextDocumentDecoder implements DocumentDecoder {

    private static final Pattern BLANK_LINE = Pattern.compile("\\R[ \\t]*\\R\\s*");

    @Override
    public String name() {
        return "text";
    }

    @Override
    public MarkupDocument decode(String content) {
        if (content == null) {
            throw new DocumentDecodingException("Text content must not be null");
        }
        Document document = Document.createShell("");
        Element body = document.body();
        for (String paragraph : BLANK_LINE.split(content.strip())) {
            if (!paragraph.isBlank()) {
                body.appendElement("p").text(paragraph.strip());
            }
        }
        return MarkupDocument.of(document);
    }
}
