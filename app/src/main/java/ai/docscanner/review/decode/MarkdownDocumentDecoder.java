package ai.docscanner.review.decode;

import ai.docscanner.review.markup.MarkupDocument;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.util.List;

/**
 * Renders Markdown to HTML with flexmark and parses the result.
 */
public class MarkdownDocumentDecoder implements DocumentDecoder {

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MarkdownDocumentDecoder() {
        MutableDataSet options = new MutableDataSet()
                .set(Parser.EXTENSIONS, List.of(TablesExtension.create()))
                .set(Parser.BLANK_LINES_IN_AST, false)
                .set(HtmlRenderer.ESCAPE_HTML, true)
                .set(HtmlRenderer.SOFT_BREAK, " ");
        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
    }

    @Override
    public String name() {
        return "markdown";
    }

    @Override
    public MarkupDocument decode(String content) {
        if (content == null) {
            throw new DocumentDecodingException("Markdown content must not be null");
        }
        try {
            Node document = parser.parse(content);
            return MarkupDocument.parse(renderer.render(document));
        } catch (RuntimeException ex) {
            throw new DocumentDecodingException("Failed to render Markdown", ex);
        }
    }
}
