package de.unibi.cebitec.corpus.sync.layout;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Where a dataset lives locally.
 */
public final class DestinationRoots {

    private DestinationRoots() {
    }

    /**
     * Resolves the dataset root below a user supplied path.
     *
     * @param path              user supplied directory, {@code ~} is expanded
     * @param folderName        dataset folder, e.g. {@code SAFEDOCS}
     * @param pathIsDatasetRoot {@code true} if {@code path} already is the dataset folder
     */
    public static Path resolve(String path, String folderName, boolean pathIsDatasetRoot) {
        Path base = Paths.get(expandHome(path, System.getProperty("user.home"))).toAbsolutePath().normalize();
        return pathIsDatasetRoot ? base : base.resolve(folderName);
    }

    public static Path platformDefault(String folderName) {
        return platformDefault(folderName, System.getProperty("os.name", ""), System.getProperty("user.home"));
    }

    static Path platformDefault(String folderName, String osName, String userHome) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return Paths.get("S:\\" + folderName);
        }
        if (os.startsWith("mac") || os.startsWith("darwin")) {
            return Paths.get(userHome, "Downloads", folderName);
        }
        return Paths.get("/storage/nexus", folderName);
    }

    static String expandHome(String path, String userHome) {
        if (path.equals("~")) {
            return userHome;
        }
        if (path.startsWith("~/")) {
            return userHome + path.substring(1);
        }
        return path;
    }
}
