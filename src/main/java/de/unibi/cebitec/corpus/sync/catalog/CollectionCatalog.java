package de.unibi.cebitec.corpus.sync.catalog;

import de.unibi.cebitec.corpus.sync.catalog.CollectionDefinition.Kind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forensic scenarios and file corpora hosted in the digital corpora bucket. Each collection is synchronized
 * completely (scenarios) or up to an optional item limit (corpora).
 */
public final class CollectionCatalog {

    public static final String BUCKET = "digitalcorpora";
    public static final String FOLDER_NAME = "DigitalCorpora";

    private static final Map<String, CollectionDefinition> SCENARIOS;
    private static final Map<String, CollectionDefinition> CORPORA;

    static {
        Map<String, CollectionDefinition> scenarios = new LinkedHashMap<>();
        scenario(scenarios, "2018-lonewolf", "2018 Lone Wolf Scenario", "Laptop seizure of fictional person planning mass shooting", "~79 GB", 19);
        scenario(scenarios, "2019-narcos", "2019 Narcos", "Passengers intercepted by customs for illegal activity", "~153 GB", 16);
        scenario(scenarios, "2019-owl", "2019 Owl", "Illegal trade of owls scenario", "~223 GB", 29);
        scenario(scenarios, "2019-tuck", "2019 Tuck", "Person attempting to join terrorist organization", "~100 GB", 10);
        scenario(scenarios, "2012-ngdc", "2012 National Gallery DC", "Fictional attack on National Gallery DC", "~112 GB", 161);
        scenario(scenarios, "2009-m57-patents", "2009 M57 Patents", "Complex scenario with multiple drives and actors", "~150 GB", 50);
        scenario(scenarios, "2008-nitroba", "2008 Nitroba University", "Network forensics harassment scenario", "~25 GB", 15);
        SCENARIOS = Collections.unmodifiableMap(scenarios);

        Map<String, CollectionDefinition> corpora = new LinkedHashMap<>();
        corpus(corpora, "2008-pdfs", "2008 PDFs Collection", "Various PDF files from 2008", "documents");
        corpus(corpora, "2009-audio", "2009 Audio Files", "Audio file corpus", "media");
        corpus(corpora, "2009-video", "2009 Video Files", "Video file corpus", "media");
        corpus(corpora, "media1", "Media Corpus 1", "Mixed media files collection", "media");
        corpus(corpora, "media2", "Media Corpus 2", "Additional media files", "media");
        CORPORA = Collections.unmodifiableMap(corpora);
    }

    private CollectionCatalog() {
    }

    private static void scenario(Map<String, CollectionDefinition> target, String id, String name, String description, String size, int files) {
        target.put(id, new CollectionDefinition(Kind.SCENARIO, id, name, description, size, files, "scenario"));
    }

    private static void corpus(Map<String, CollectionDefinition> target, String id, String name, String description, String category) {
        target.put(id, new CollectionDefinition(Kind.CORPUS, id, name, description, null, 0, category));
    }

    public static CollectionDefinition resolve(Kind kind, String id) throws UnknownCollectionException {
        Map<String, CollectionDefinition> table = kind == Kind.SCENARIO ? SCENARIOS : CORPORA;
        CollectionDefinition definition = id == null ? null : table.get(id);
        if (definition == null) {
            throw new UnknownCollectionException(kind.getLabel(), id, table.keySet());
        }
        return definition;
    }

    public static List<CollectionDefinition> scenarios() {
        return Collections.unmodifiableList(new ArrayList<>(SCENARIOS.values()));
    }

    public static List<CollectionDefinition> corpora() {
        return Collections.unmodifiableList(new ArrayList<>(CORPORA.values()));
    }
}
