package de.unibi.cebitec.corpus.sync.util;

import java.net.URI;
import java.net.URISyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code http(s)://<host>/<path>/<file>} of a single file given on the command line.
 */
public class FileURL {
    private static final Logger log = LoggerFactory.getLogger(FileURL.class);
    private final String baseUrl;
    private final String fileName;
    private final String host;

    public FileURL(String url) throws URISyntaxException, IllegalArgumentException {
        URI uri = new URI(url);
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Invalid URL '" + url + "' - expected http(s)://<host>/<file>");
        }
        this.host = uri.getHost();
        if (this.host == null) {
            throw new IllegalArgumentException("Invalid URL '" + url + "' - no host specified!");
        }
        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new IllegalArgumentException("Invalid URL '" + url + "' - query and fragment are not supported");
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        int slash = path.lastIndexOf('/');
        this.fileName = path.substring(slash + 1);
        if (this.fileName.isEmpty() || this.fileName.equals(".") || this.fileName.equals("..")) {
            throw new IllegalArgumentException("Invalid URL '" + url + "' - it does not name a file");
        }
        this.baseUrl = url.substring(0, url.length() - this.fileName.length());
        log.debug("URL: {}   BASE: {}   FILE: {}", url, this.baseUrl, this.fileName);
    }

    /**
     * Everything up to and including the last '/'.
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    public String getFileName() {
        return fileName;
    }

    public String getHost() {
        return host;
    }
}
