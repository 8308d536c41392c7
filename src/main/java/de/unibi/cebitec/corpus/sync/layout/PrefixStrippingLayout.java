package de.unibi.cebitec.corpus.sync.layout;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.io.File;
import java.nio.file.Path;

/**
 * Mirrors the key structure below a listing prefix: {@code <prefix>a/b.pdf} lands at {@code <root>/a/b.pdf}.
 * Only keys that are already in normal form are accepted ({@code a//b.pdf} or {@code a/./b.pdf} are rejected),
 * so no two keys share a local path.
 */
public class PrefixStrippingLayout implements DestinationLayout {

    private final Path root;
    private final String prefix;

    public PrefixStrippingLayout(Path root, String prefix) {
        this.root = root.toAbsolutePath().normalize();
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Path localPathFor(ObjectDescriptor descriptor) {
        String key = descriptor.getKey();
        if (!key.startsWith(this.prefix)) {
            throw new IllegalArgumentException("Key '" + key + "' is not below prefix '" + this.prefix + "'");
        }
        String relative = key.substring(this.prefix.length());
        // a prefix given without trailing slash still separates at the next '/'
        if (!this.prefix.isEmpty() && !this.prefix.endsWith("/") && relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        if (relative.isEmpty()) {
            throw new IllegalArgumentException("Key '" + key + "' has no name below prefix '" + this.prefix + "'");
        }
        Path target = this.root.resolve(relative).normalize();
        if (!target.startsWith(this.root) || target.equals(this.root)) {
            throw new IllegalArgumentException("Key '" + key + "' resolves outside of " + this.root);
        }
        String canonical = this.root.relativize(target).toString().replace(File.separatorChar, '/');
        if (!canonical.equals(relative)) {
            throw new IllegalArgumentException("Key '" + key + "' is not in normal form (would be stored as '" + canonical + "')");
        }
        return target;
    }

    @Override
    public boolean isArchive() {
        return false;
    }
}
