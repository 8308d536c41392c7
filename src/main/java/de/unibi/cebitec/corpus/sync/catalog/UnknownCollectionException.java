package de.unibi.cebitec.corpus.sync.catalog;

public class UnknownCollectionException extends Exception {

    public UnknownCollectionException(String kind, String id, Iterable<String> knownIds) {
        super("Unknown " + kind + " '" + id + "'. Available: " + String.join(", ", knownIds));
    }
}
