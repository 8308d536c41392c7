package de.unibi.cebitec.corpus.sync.layout;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.nio.file.Path;

/**
 * Maps remote units to their canonical local location. Implementations must be pure: the same key and root
 * always give the same path, which is what makes skipping by existence sound.
 */
public interface DestinationLayout {

    Path getRoot();

    Path localPathFor(ObjectDescriptor descriptor);

    /**
     * @return {@code true} if units are archives that expand into a directory at their local path
     */
    boolean isArchive();

    /**
     * @return {@code false} if distinct keys may map to the same local path
     */
    default boolean isInjective() {
        return true;
    }
}
