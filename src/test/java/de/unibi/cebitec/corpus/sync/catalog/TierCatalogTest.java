package de.unibi.cebitec.corpus.sync.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TierCatalogTest {

    @Test
    void resolvesGovDocsTiersToThreadCounts() throws UnknownTierException {
        TierCatalog tiers = Dataset.GOVDOCS.getTiers();
        assertEquals(1, tiers.resolve("tiny").getItemLimit());
        assertEquals(10, tiers.resolve("sample").getItemLimit());
        assertEquals(50, tiers.resolve("small").getItemLimit());
        assertEquals(100, tiers.resolve("medium").getItemLimit());
        assertEquals(250, tiers.resolve("large").getItemLimit());
        assertEquals(500, tiers.resolve("xlarge").getItemLimit());
        assertEquals(1000, tiers.resolve("complete").getItemLimit());
    }

    @Test
    void resolvesS3DatasetTiersToItemLimits() throws UnknownTierException {
        assertEquals(1000, Dataset.SAFEDOCS.getTiers().resolve("tiny").getItemLimit());
        assertEquals(10000, Dataset.SAFEDOCS.getTiers().resolve("sample").getItemLimit());
        assertEquals(8000000, Dataset.SAFEDOCS.getTiers().resolve("complete").getItemLimit());
        assertEquals(2000000, Dataset.UNSAFEDOCS.getTiers().resolve("xxlarge").getItemLimit());
        assertEquals(5480000, Dataset.UNSAFEDOCS.getTiers().resolve("complete").getItemLimit());
    }

    @Test
    void unknownTierListsAvailableNames() {
        UnknownTierException e = assertThrows(UnknownTierException.class, () -> Dataset.GOVDOCS.getTiers().resolve("huge"));
        assertEquals("huge", e.getTierName());
        assertTrue(e.getMessage().contains("tiny"));
        assertTrue(e.getMessage().contains("complete"));
        assertThrows(UnknownTierException.class, () -> Dataset.SAFEDOCS.getTiers().resolve(null));
    }

    @Test
    void tierNamesAreCaseSensitive() {
        assertFalse(Dataset.SAFEDOCS.getTiers().contains("Sample"));
        assertTrue(Dataset.SAFEDOCS.getTiers().contains("sample"));
    }

    @Test
    void listKeepsDeclarationOrder() {
        List<String> names = new ArrayList<>();
        for (TierDefinition tier : Dataset.GOVDOCS.getTiers().list()) {
            names.add(tier.getName());
        }
        assertEquals(Arrays.asList("tiny", "sample", "small", "medium", "large", "xlarge", "complete"), names);
    }

    @Test
    void builderRejectsDuplicatesAndNegativeLimits() {
        assertThrows(IllegalArgumentException.class, () -> TierCatalog.builder().tier("a", 1, "1", "1 B", "").tier("a", 2, "2", "2 B", ""));
        assertThrows(IllegalArgumentException.class, () -> TierCatalog.builder().tier("a", -1, "", "", ""));
    }

    @Test
    void listIsReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> Dataset.SAFEDOCS.getTiers().list().clear());
    }

    @Test
    void datasetLookupIgnoresCase() throws UnknownCollectionException {
        assertSame(Dataset.UNSAFEDOCS, Dataset.fromId("UnsafeDocs"));
        assertSame(Dataset.GOVDOCS, Dataset.fromId("govdocs"));
        assertThrows(UnknownCollectionException.class, () -> Dataset.fromId("nope"));
        assertEquals(Arrays.asList("govdocs", "safedocs", "unsafedocs"), Dataset.ids());
    }

    @Test
    void datasetsPointAtTheirSources() {
        assertEquals(SourceType.THREAD_ARCHIVES, Dataset.GOVDOCS.getSourceType());
        assertEquals("digitalcorpora", Dataset.SAFEDOCS.getLocation());
        assertEquals("corpora/files/CC-MAIN-2021-31-PDF-UNTRUNCATED/", Dataset.SAFEDOCS.getPrefix());
        assertEquals("corpora/files/CC-MAIN-2021-31-UNSAFE/", Dataset.UNSAFEDOCS.getPrefix());
        assertEquals("UNSAFE-DOCS", Dataset.UNSAFEDOCS.getFolderName());
    }
}
