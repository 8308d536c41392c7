package de.unibi.cebitec.corpus.sync.listing;

public class InvalidThreadRangeException extends Exception {

    public InvalidThreadRangeException(String message) {
        super(message);
    }
}
