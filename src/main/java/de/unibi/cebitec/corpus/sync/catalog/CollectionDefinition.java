package de.unibi.cebitec.corpus.sync.catalog;

/**
 * A single named S3 prefix of the digital corpora bucket, either a forensic scenario or a small file corpus.
 */
public final class CollectionDefinition {

    public enum Kind {
        SCENARIO("scenario", "corpora/scenarios/", "scenarios"),
        CORPUS("corpus", "corpora/files/", "file_corpora");

        private final String label;
        private final String keyPrefix;
        private final String localFolder;

        Kind(String label, String keyPrefix, String localFolder) {
            this.label = label;
            this.keyPrefix = keyPrefix;
            this.localFolder = localFolder;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Kind kind;
    private final String id;
    private final String name;
    private final String description;
    private final String approxSizeLabel;
    private final int approxFileCount;
    private final String category;

    CollectionDefinition(Kind kind, String id, String name, String description, String approxSizeLabel, int approxFileCount, String category) {
        this.kind = kind;
        this.id = id;
        this.name = name;
        this.description = description;
        this.approxSizeLabel = approxSizeLabel;
        this.approxFileCount = approxFileCount;
        this.category = category;
    }

    public Kind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return size label, or {@code null} when unpublished
     */
    public String getApproxSizeLabel() {
        return approxSizeLabel;
    }

    /**
     * @return published file count, {@code 0} when unknown
     */
    public int getApproxFileCount() {
        return approxFileCount;
    }

    public String getCategory() {
        return category;
    }

    public String getKeyPrefix() {
        return this.kind.keyPrefix + this.id + "/";
    }

    /**
     * Location of this collection relative to the DigitalCorpora root, e.g. {@code scenarios/2019-owl}.
     */
    public String getRelativeFolder() {
        return this.kind.localFolder + "/" + this.id;
    }
}
