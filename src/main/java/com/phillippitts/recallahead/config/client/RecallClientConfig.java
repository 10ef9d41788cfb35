package com.phillippitts.recallahead.config.client;

import com.phillippitts.recallahead.config.properties.RecallClientProperties;
import com.phillippitts.recallahead.service.client.MemorySearchClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Wires the JDK {@link HttpClient} and the memory search client on top of it.
 */
@Configuration
public class RecallClientConfig {

    @Bean
    public HttpClient recallHttpClient(RecallClientProperties props) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public MemorySearchClient memorySearchClient(HttpClient recallHttpClient, RecallClientProperties props) {
        return new MemorySearchClient(recallHttpClient, props);
    }
}
