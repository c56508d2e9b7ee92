package de.bsommerfeld.wbm.db;

/**
 * Thrown when the tweet index cannot be opened, its schema cannot be applied,
 * or a statement fails.
 */
public class TweetStoreException extends Exception {

    public TweetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
