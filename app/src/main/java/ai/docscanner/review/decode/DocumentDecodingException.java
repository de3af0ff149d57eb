package ai.docscanner.review.decode;

public class DocumentDecodingException extends RuntimeException {

    public DocumentDecodingException(String message) {
        super(message);
    }

    public DocumentDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
