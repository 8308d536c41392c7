package de.unibi.cebitec.corpus.sync.model;

import java.util.Objects;

/**
 * One addressable remote unit as produced by a listing: an S3 object or a numbered archive.
 */
public final class ObjectDescriptor {

    private final String key;
    private final long sizeBytes;

    public ObjectDescriptor(String key, long sizeBytes) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Object key must not be empty.");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Negative size for key '" + key + "': " + sizeBytes);
        }
        this.key = key;
        this.sizeBytes = sizeBytes;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the listed size, {@code 0} if the listing does not report sizes
     */
    public long getSizeBytes() {
        return sizeBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ObjectDescriptor)) {
            return false;
        }
        ObjectDescriptor that = (ObjectDescriptor) o;
        return this.sizeBytes == that.sizeBytes && this.key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.key, this.sizeBytes);
    }

    @Override
    public String toString() {
        return this.key + " (" + this.sizeBytes + " B)";
    }
}
