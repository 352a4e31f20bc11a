package com.kmg.batch.config;

import com.kmg.batch.service.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    @Bean
    RestClient providerRestClient(BatchProperties properties) {
        BatchProperties.Provider provider = properties.getProvider();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) provider.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) provider.getReadTimeout().toMillis());

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(provider.getBaseUrl())
                .requestFactory(requestFactory);
        if (provider.getApiKey() != null && !provider.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + provider.getApiKey());
        }
        return builder.build();
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
