package de.unibi.cebitec.corpus.sync.transfer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.S3Object;
import de.unibi.cebitec.corpus.sync.model.FetchTask;
import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class S3ObjectFetcherTest {

    private static final byte[] CONTENT = "%PDF-1.7 minimal".getBytes(StandardCharsets.UTF_8);

    @Mock
    private AmazonS3 s3;

    @TempDir
    Path root;

    private static S3Object object(byte[] content) {
        S3Object obj = new S3Object();
        obj.setObjectContent(new ByteArrayInputStream(content));
        return obj;
    }

    @Test
    void copiesObjectContent() throws IOException {
        when(s3.getObject(any(GetObjectRequest.class))).thenReturn(object(CONTENT));
        FetchTask task = new FetchTask(new ObjectDescriptor("corpora/files/x/a.pdf", CONTENT.length), root.resolve("a.pdf"), false);

        long bytes = new S3ObjectFetcher(s3, "digitalcorpora").fetch(task, task.getTempPath());

        assertEquals(CONTENT.length, bytes);
        assertArrayEquals(CONTENT, Files.readAllBytes(task.getTempPath()));
        ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3).getObject(request.capture());
        assertEquals("digitalcorpora", request.getValue().getBucketName());
        assertEquals("corpora/files/x/a.pdf", request.getValue().getKey());
    }

    @Test
    void shortBodyIsAnError() {
        when(s3.getObject(any(GetObjectRequest.class))).thenReturn(object(CONTENT));
        FetchTask task = new FetchTask(new ObjectDescriptor("k.pdf", CONTENT.length + 100), root.resolve("k.pdf"), false);

        assertThrows(IOException.class, () -> new S3ObjectFetcher(s3, "digitalcorpora").fetch(task, task.getTempPath()));
    }

    @Test
    void missingContentIsAnError() {
        when(s3.getObject(any(GetObjectRequest.class))).thenReturn(null);
        FetchTask task = new FetchTask(new ObjectDescriptor("gone.pdf", 1), root.resolve("gone.pdf"), false);

        assertThrows(IOException.class, () -> new S3ObjectFetcher(s3, "digitalcorpora").fetch(task, task.getTempPath()));
    }
}
