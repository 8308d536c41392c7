package de.unibi.cebitec.corpus.sync.transfer;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain GET of {@code <baseUrl><key>}.
 */
public class HttpObjectFetcher implements ObjectFetcher {

    public static final Logger log = LoggerFactory.getLogger(HttpObjectFetcher.class);
    private final CloseableHttpClient httpClient;
    private final String baseUrl;

    public HttpObjectFetcher(CloseableHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    public String urlOf(FetchTask task) {
        return this.baseUrl + task.getKey();
    }

    @Override
    public long fetch(FetchTask task, Path target) throws IOException {
        String url = urlOf(task);
        HttpGet httpGet = new HttpGet(url);
        log.debug("Starting download of {}", url);
        try (CloseableHttpResponse httpResponse = this.httpClient.execute(httpGet)) {
            int status = httpResponse.getStatusLine().getStatusCode();
            HttpEntity httpEntity = httpResponse.getEntity();
            if (status != HttpStatus.SC_OK) {
                throw new IOException("GET " + url + " returned HTTP " + status);
            }
            if (httpEntity == null) {
                throw new IOException("GET " + url + " returned no body");
            }
            long expected = httpEntity.getContentLength();
            long bytesRead;
            try (InputStream in = httpEntity.getContent()) {
                bytesRead = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            if (expected >= 0 && bytesRead != expected) {
                throw new IOException("Transfer of '" + url + "' has been interrupted! "
                        + bytesRead + " of " + expected + " bytes received.");
            }
            log.debug("Download done: {} ({} bytes)", url, bytesRead);
            return bytesRead;
        } catch (IOException e) {
            httpGet.abort();
            throw e;
        }
    }
}
