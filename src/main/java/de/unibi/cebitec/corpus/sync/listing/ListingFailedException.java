package de.unibi.cebitec.corpus.sync.listing;

/**
 * A listing request failed. Units listed before the failure stay usable.
 */
public class ListingFailedException extends Exception {

    public ListingFailedException(String message) {
        super(message);
    }

    public ListingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
