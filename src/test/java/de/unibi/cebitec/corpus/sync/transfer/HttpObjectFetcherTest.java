package de.unibi.cebitec.corpus.sync.transfer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import de.unibi.cebitec.corpus.sync.model.FetchTask;
import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpObjectFetcherTest {

    private static final byte[] ARCHIVE = "PK fake archive bytes".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private HttpServer server;
    private CloseableHttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/zipfiles/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            if (path.endsWith("/000.zip")) {
                exchange.sendResponseHeaders(200, ARCHIVE.length);
                try (OutputStream body = exchange.getResponseBody()) {
                    body.write(ARCHIVE);
                }
            } else {
                exchange.sendResponseHeaders(404, -1);
                exchange.close();
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/zipfiles";
        httpClient = HttpClients.createDefault();
    }

    @AfterEach
    void stopServer() throws IOException {
        httpClient.close();
        server.stop(0);
    }

    private FetchTask task(String key) {
        return new FetchTask(new ObjectDescriptor(key, 0), root.resolve(key.replace(".zip", "")), true);
    }

    @Test
    void buildsUrlFromBaseAndKey() {
        HttpObjectFetcher fetcher = new HttpObjectFetcher(httpClient, "https://downloads.example.org/zipfiles/");
        assertEquals("https://downloads.example.org/zipfiles/042.zip", fetcher.urlOf(task("042.zip")));
        assertEquals("https://downloads.example.org/zipfiles/042.zip",
                new HttpObjectFetcher(httpClient, "https://downloads.example.org/zipfiles").urlOf(task("042.zip")));
    }

    @Test
    void writesBodyToTarget() throws IOException {
        FetchTask task = task("000.zip");
        long bytes = new HttpObjectFetcher(httpClient, baseUrl).fetch(task, task.getTempPath());

        assertEquals(ARCHIVE.length, bytes);
        assertArrayEquals(ARCHIVE, Files.readAllBytes(task.getTempPath()));
    }

    @Test
    void nonOkStatusIsAnError() {
        FetchTask task = task("001.zip");
        IOException e = assertThrows(IOException.class,
                () -> new HttpObjectFetcher(httpClient, baseUrl).fetch(task, task.getTempPath()));
        assertTrue(e.getMessage().contains("404"));
    }
}
