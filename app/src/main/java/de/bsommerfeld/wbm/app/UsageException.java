package de.bsommerfeld.wbm.app;

/**
 * Malformed command line. Reported with the usage text and exit code 2.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
