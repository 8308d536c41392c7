package de.unibi.cebitec.corpus.sync.catalog;

public enum SourceType {
    /**
     * Flat key listing below a prefix of an S3 bucket; one object per key.
     */
    S3_LISTING,
    /**
     * Fixed-width numbered zip bundles ("threads") below an HTTP base URL; one archive expands to many files.
     */
    THREAD_ARCHIVES
}
