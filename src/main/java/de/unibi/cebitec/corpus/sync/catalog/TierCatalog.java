package de.unibi.cebitec.corpus.sync.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only lookup table of the tiers a dataset offers. Tiers keep their declaration order so that help
 * output lists them from smallest to largest.
 */
public final class TierCatalog {

    private final Map<String, TierDefinition> tiers;

    private TierCatalog(Map<String, TierDefinition> tiers) {
        this.tiers = Collections.unmodifiableMap(tiers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public TierDefinition resolve(String tierName) throws UnknownTierException {
        TierDefinition tier = tierName == null ? null : this.tiers.get(tierName);
        if (tier == null) {
            throw new UnknownTierException(tierName, this.tiers.keySet());
        }
        return tier;
    }

    public List<TierDefinition> list() {
        return Collections.unmodifiableList(new ArrayList<>(this.tiers.values()));
    }

    public boolean contains(String tierName) {
        return this.tiers.containsKey(tierName);
    }

    public static final class Builder {

        private final Map<String, TierDefinition> tiers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder tier(String name, long itemLimit, String approxItemsLabel, String approxSizeLabel, String description) {
            if (this.tiers.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate tier: " + name);
            }
            this.tiers.put(name, new TierDefinition(name, itemLimit, approxItemsLabel, approxSizeLabel, description));
            return this;
        }

        public TierCatalog build() {
            return new TierCatalog(new LinkedHashMap<>(this.tiers));
        }
    }
}
