package de.unibi.cebitec.corpus.sync.layout;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.nio.file.Path;

/**
 * Thread archive {@code 042.zip} is extracted into {@code <root>/042}.
 */
public class ThreadArchiveLayout implements DestinationLayout {

    private final Path root;

    public ThreadArchiveLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Path localPathFor(ObjectDescriptor descriptor) {
        String key = descriptor.getKey();
        String name = key.contains("/") ? key.substring(key.lastIndexOf('/') + 1) : key;
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        if (name.isEmpty() || name.equals("..") || name.equals(".")) {
            throw new IllegalArgumentException("Archive key '" + key + "' has no usable name");
        }
        return this.root.resolve(name);
    }

    @Override
    public boolean isArchive() {
        return true;
    }

    @Override
    public boolean isInjective() {
        return false;
    }
}
