package de.unibi.cebitec.corpus.sync.layout;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.nio.file.Path;

/**
 * Stores every unit directly below the root under the last element of its key: {@code bin-images/0001.jpg}
 * lands at {@code <root>/0001.jpg}. Keys from different folders may collide.
 */
public class FlatLayout implements DestinationLayout {

    private final Path root;

    public FlatLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Path localPathFor(ObjectDescriptor descriptor) {
        String key = descriptor.getKey();
        String name = key.substring(key.lastIndexOf('/') + 1);
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Key '" + key + "' has no usable file name");
        }
        return this.root.resolve(name);
    }

    @Override
    public boolean isArchive() {
        return false;
    }

    @Override
    public boolean isInjective() {
        return false;
    }
}
