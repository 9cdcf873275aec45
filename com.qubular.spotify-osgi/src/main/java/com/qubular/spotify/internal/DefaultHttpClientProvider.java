package com.qubular.spotify.internal;

import com.qubular.spotify.HttpClientProvider;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Deactivate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Component(service = HttpClientProvider.class)
public class DefaultHttpClientProvider implements HttpClientProvider, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DefaultHttpClientProvider.class);
    private final HttpClient httpClient;

    @Activate
    public DefaultHttpClientProvider() {
        this.httpClient = new HttpClient(new SslContextFactory.Client());
        try {
            this.httpClient.start();
        } catch (Exception e) {
            throw new RuntimeException("Unable to start HttpClient", e);
        }
        logger.debug("Started HttpClient");
    }

    @Override
    public HttpClient getHttpClient() {
        return httpClient;
    }

    @Deactivate
    @Override
    public void close() {
        try {
            httpClient.stop();
        } catch (Exception e) {
            logger.warn("Unable to stop HttpClient", e);
        }
    }
}
