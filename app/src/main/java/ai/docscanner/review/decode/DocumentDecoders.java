package ai.docscanner.review.decode;

import java.util.Locale;

/**
 * Picks a decoder from a file name extension.
 */
public final class DocumentDecoders {

    private DocumentDecoders() {
    }

    public static DocumentDecoder forFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new DocumentDecodingException("File name must not be blank");
        }
        int dot = fileName.lastIndexOf('.');
        String extension = dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (extension) {
            case "html", "htm" -> new HtmlDocumentDecoder();
            case "md", "markdown" -> new MarkdownDocumentDecoder();
            case "txt", "adoc" -> new PlainTextDocumentDecoder();
            default -> throw new DocumentDecodingException("Unsupported document type: " + fileName);
        };
    }
}
