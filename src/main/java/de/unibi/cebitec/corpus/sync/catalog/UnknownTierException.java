package de.unibi.cebitec.corpus.sync.catalog;

public class UnknownTierException extends Exception {

    private final String tierName;

    public UnknownTierException(String tierName, Iterable<String> knownTiers) {
        super("Unknown tier '" + tierName + "'. Available tiers: " + String.join(", ", knownTiers));
        this.tierName = tierName;
    }

    public String getTierName() {
        return tierName;
    }
}
