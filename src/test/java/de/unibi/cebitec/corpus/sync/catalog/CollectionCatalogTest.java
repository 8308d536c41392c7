package de.unibi.cebitec.corpus.sync.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.unibi.cebitec.corpus.sync.catalog.CollectionDefinition.Kind;
import org.junit.jupiter.api.Test;

class CollectionCatalogTest {

    @Test
    void scenarioMapsToScenarioPrefixAndFolder() throws UnknownCollectionException {
        CollectionDefinition owl = CollectionCatalog.resolve(Kind.SCENARIO, "2019-owl");
        assertEquals("corpora/scenarios/2019-owl/", owl.getKeyPrefix());
        assertEquals("scenarios/2019-owl", owl.getRelativeFolder());
        assertEquals("~223 GB", owl.getApproxSizeLabel());
        assertEquals(29, owl.getApproxFileCount());
    }

    @Test
    void corpusMapsToFilesPrefixAndFolder() throws UnknownCollectionException {
        CollectionDefinition media = CollectionCatalog.resolve(Kind.CORPUS, "media1");
        assertEquals("corpora/files/media1/", media.getKeyPrefix());
        assertEquals("file_corpora/media1", media.getRelativeFolder());
        assertEquals("media", media.getCategory());
        assertNull(media.getApproxSizeLabel());
    }

    @Test
    void kindsDoNotShareIds() {
        assertThrows(UnknownCollectionException.class, () -> CollectionCatalog.resolve(Kind.CORPUS, "2019-owl"));
        UnknownCollectionException e = assertThrows(UnknownCollectionException.class,
                () -> CollectionCatalog.resolve(Kind.SCENARIO, "media1"));
        assertTrue(e.getMessage().contains("2008-nitroba"));
    }

    @Test
    void listsAllCollections() {
        assertEquals(7, CollectionCatalog.scenarios().size());
        assertEquals(5, CollectionCatalog.corpora().size());
        assertEquals("2018-lonewolf", CollectionCatalog.scenarios().get(0).getId());
    }
}
