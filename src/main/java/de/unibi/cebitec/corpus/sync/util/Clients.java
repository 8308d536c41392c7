package de.unibi.cebitec.corpus.sync.util;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.AnonymousAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import de.unibi.cebitec.corpus.sync.SyncSettings;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;

/**
 * Anonymous clients for public corpora.
 */
public final class Clients {

    private Clients() {
    }

    public static AmazonS3 s3(SyncSettings settings) {
        ClientConfiguration clientConfig = new ClientConfiguration();
        clientConfig.setConnectionTimeout(settings.getRequestTimeoutMillis());
        clientConfig.setSocketTimeout(settings.getRequestTimeoutMillis());
        // retries are counted by the worker pool, not inside the SDK
        clientConfig.setMaxErrorRetry(0);
        clientConfig.setMaxConnections(settings.getParallel() + 10);

        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard();
        builder = settings.getEndpoint() == null ?
                builder.withRegion(settings.getRegion()) :
                builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(settings.getEndpoint(), settings.getRegion()))
                        .withPathStyleAccessEnabled(true);
        return builder.withClientConfiguration(clientConfig)
                .withCredentials(new AWSStaticCredentialsProvider(new AnonymousAWSCredentials()))
                .build();
    }

    public static CloseableHttpClient http(SyncSettings settings) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(settings.getRequestTimeoutMillis())
                .setConnectionRequestTimeout(settings.getRequestTimeoutMillis())
                .setSocketTimeout(settings.getRequestTimeoutMillis())
                .build();
        return HttpClientBuilder.create()
                .setDefaultRequestConfig(requestConfig)
                .setMaxConnPerRoute(settings.getParallel())
                .setMaxConnTotal(settings.getParallel() + 10)
                .disableAutomaticRetries()
                .build();
    }
}
