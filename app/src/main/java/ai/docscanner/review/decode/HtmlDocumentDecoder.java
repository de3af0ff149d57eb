package ai.docscanner.review.decode;

import ai.docscanner.review.markup.MarkupDocument;

public class HtmlDocumentDecoder implements DocumentDecoder {

    @Override
    public String name() {
        return "html";
    }

    @Override
    public MarkupDocument decode(String content) {
        if (content == null) {
            throw new DocumentDecodingException("HTML content must not be null");
        }
        return MarkupDocument.parse(content);
    }
}
