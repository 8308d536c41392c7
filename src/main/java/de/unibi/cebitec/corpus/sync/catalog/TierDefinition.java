package de.unibi.cebitec.corpus.sync.catalog;

/**
 * A named preset bounding how many remote units of a dataset are synchronized.
 */
public final class TierDefinition {

    private final String name;
    private final long itemLimit;
    private final String approxItemsLabel;
    private final String approxSizeLabel;
    private final String description;

    public TierDefinition(String name, long itemLimit, String approxItemsLabel, String approxSizeLabel, String description) {
        if (itemLimit < 0) {
            throw new IllegalArgumentException("Item limit of tier '" + name + "' must not be negative: " + itemLimit);
        }
        this.name = name;
        this.itemLimit = itemLimit;
        this.approxItemsLabel = approxItemsLabel;
        this.approxSizeLabel = approxSizeLabel;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public long getItemLimit() {
        return itemLimit;
    }

    public String getApproxItemsLabel() {
        return approxItemsLabel;
    }

    public String getApproxSizeLabel() {
        return approxSizeLabel;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return this.name + " (" + this.itemLimit + " units, " + this.approxSizeLabel + ")";
    }
}
