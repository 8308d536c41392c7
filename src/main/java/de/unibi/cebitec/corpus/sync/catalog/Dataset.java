package de.unibi.cebitec.corpus.sync.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The tiered dataset families that can be synchronized.
 */
public enum Dataset {

    GOVDOCS("govdocs", "GovDocs1", "~986,000 real government files from .gov domains",
            SourceType.THREAD_ARCHIVES, "https://downloads.digitalcorpora.org/corpora/files/govdocs1/zipfiles/", "",
            "GovDocs1", 250,
            TierCatalog.builder()
                    .tier("tiny", 1, "~1,000", "~540 MB", "Minimal test set")
                    .tier("sample", 10, "~10,000", "~5.4 GB", "Good for development/testing")
                    .tier("small", 50, "~50,000", "~27 GB", "Substantial test dataset")
                    .tier("medium", 100, "~100,000", "~54 GB", "Large representative sample")
                    .tier("large", 250, "~250,000", "~135 GB", "Quarter of full dataset")
                    .tier("xlarge", 500, "~500,000", "~270 GB", "Half of full dataset")
                    .tier("complete", 1000, "~986,000", "~540 GB", "Complete GovDocs1 corpus")
                    .build()),

    SAFEDOCS("safedocs", "SAFEDOCS", "~8 million PDFs from Common Crawl (CC-MAIN-2021-31-PDF-UNTRUNCATED)",
            SourceType.S3_LISTING, "digitalcorpora", "corpora/files/CC-MAIN-2021-31-PDF-UNTRUNCATED/",
            "SAFEDOCS", 100000,
            TierCatalog.builder()
                    .tier("tiny", 1000, "1,000", "~100 MB", "Minimal test set")
                    .tier("sample", 10000, "10,000", "~1 GB", "Good for development/testing")
                    .tier("small", 50000, "50,000", "~5 GB", "Substantial test dataset")
                    .tier("medium", 100000, "100,000", "~10 GB", "Large representative sample")
                    .tier("large", 500000, "500,000", "~50 GB", "Large dataset")
                    .tier("xlarge", 1000000, "1,000,000", "~100 GB", "Million PDF sample")
                    .tier("xxlarge", 2000000, "2,000,000", "~200 GB", "Two million PDFs")
                    .tier("complete", 8000000, "8,000,000", "~800 GB", "Complete SAFEDOCS corpus (8M PDFs)")
                    .build()),

    UNSAFEDOCS("unsafedocs", "UNSAFE-DOCS", "~5.3 million PDFs and 180K other files from Common Crawl (CC-MAIN-2021-31-UNSAFE)",
            SourceType.S3_LISTING, "digitalcorpora", "corpora/files/CC-MAIN-2021-31-UNSAFE/",
            "UNSAFE-DOCS", 100000,
            TierCatalog.builder()
                    .tier("tiny", 1000, "1,000", "~120 MB", "Minimal test set")
                    .tier("sample", 10000, "10,000", "~1.2 GB", "Good for development/testing")
                    .tier("small", 50000, "50,000", "~6 GB", "Substantial test dataset")
                    .tier("medium", 100000, "100,000", "~12 GB", "Large representative sample")
                    .tier("large", 500000, "500,000", "~60 GB", "Large dataset")
                    .tier("xlarge", 1000000, "1,000,000", "~120 GB", "Million file sample")
                    .tier("xxlarge", 2000000, "2,000,000", "~240 GB", "Two million files")
                    .tier("complete", 5480000, "5,480,000", "~650 GB", "Complete UNSAFE-DOCS corpus (5.3M PDFs + 180K other)")
                    .build());

    private final String id;
    private final String displayName;
    private final String description;
    private final SourceType sourceType;
    private final String location;
    private final String prefix;
    private final String folderName;
    private final long confirmationThreshold;
    private final TierCatalog tiers;

    Dataset(String id, String displayName, String description, SourceType sourceType, String location, String prefix,
            String folderName, long confirmationThreshold, TierCatalog tiers) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.sourceType = sourceType;
        this.location = location;
        this.prefix = prefix;
        this.folderName = folderName;
        this.confirmationThreshold = confirmationThreshold;
        this.tiers = tiers;
    }

    public static Dataset fromId(String id) throws UnknownCollectionException {
        if (id != null) {
            for (Dataset dataset : values()) {
                if (dataset.id.equals(id.toLowerCase(Locale.ROOT))) {
                    return dataset;
                }
            }
        }
        throw new UnknownCollectionException("dataset", id, ids());
    }

    public static List<String> ids() {
        List<String> ids = new ArrayList<>();
        for (Dataset dataset : values()) {
            ids.add(dataset.id);
        }
        return ids;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    /**
     * Bucket name for {@link SourceType#S3_LISTING}, archive base URL for {@link SourceType#THREAD_ARCHIVES}.
     */
    public String getLocation() {
        return location;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getFolderName() {
        return folderName;
    }

    /**
     * Unit count from which a run has to be confirmed interactively.
     */
    public long getConfirmationThreshold() {
        return confirmationThreshold;
    }

    public TierCatalog getTiers() {
        return tiers;
    }
}
