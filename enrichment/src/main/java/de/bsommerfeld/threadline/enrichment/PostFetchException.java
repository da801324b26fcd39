package de.bsommerfeld.threadline.enrichment;

/**
 * Thrown when a batch of posts could not be fetched (network error,
 * rejected request, unparsable response).
 */
public class PostFetchException extends Exception {

    public PostFetchException(String message) {
        super(message);
    }

    public PostFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
