package wikigate.core.model.common;

/**
 * The upstream body could not be decoded into the expected result type.
 */
public class ResponseDecodingException extends WikiAccessException {

    public ResponseDecodingException(String message) {
        super(ErrorKind.DECODING, message);
    }

    public ResponseDecodingException(String message, Throwable cause) {
        super(ErrorKind.DECODING, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
