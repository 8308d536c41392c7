package de.unibi.cebitec.corpus.sync.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * What a destination tree holds after a run: totals and a breakdown by top-level folder.
 */
public final class DirectorySummary {

    private final long fileCount;
    private final long totalBytes;
    private final Map<String, Category> categories;

    public DirectorySummary(long fileCount, long totalBytes, Map<String, Category> categories) {
        this.fileCount = fileCount;
        this.totalBytes = totalBytes;
        this.categories = Collections.unmodifiableMap(new TreeMap<>(categories));
    }

    public long getFileCount() {
        return fileCount;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public Map<String, Category> getCategories() {
        return categories;
    }

    public static final class Category {

        private final long fileCount;
        private final long totalBytes;

        public Category(long fileCount, long totalBytes) {
            this.fileCount = fileCount;
            this.totalBytes = totalBytes;
        }

        public static Category combine(Category a, Category b) {
            return new Category(a.fileCount + b.fileCount, a.totalBytes + b.totalBytes);
        }

        public long getFileCount() {
            return fileCount;
        }

        public long getTotalBytes() {
            return totalBytes;
        }
    }
}
