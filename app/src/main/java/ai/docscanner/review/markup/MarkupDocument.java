package ai.docscanner.review.markup;

import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Normalized markup tree handed over by the format decoders. Wraps a jsoup {@link Document}
 * configured so that element fragments are serialized verbatim.
 */
public final class MarkupDocument {

    private final Document document;

    private MarkupDocument(Document document) {
        this.document = Objects.requireNonNull(document, "document");
        this.document.outputSettings().prettyPrint(false);
    }

    public static MarkupDocument parse(String html) {
        if (html == null) {
            throw new IllegalArgumentException("html must not be null");
        }
        return new MarkupDocument(Jsoup.parse(html));
    }

    public static MarkupDocument of(Document document) {
        return new MarkupDocument(document);
    }

    public Element body() {
        return document.body();
    }

    public String html() {
        return document.body().html();
    }
}
