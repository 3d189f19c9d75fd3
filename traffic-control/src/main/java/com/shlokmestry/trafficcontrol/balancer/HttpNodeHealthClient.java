package com.shlokmestry.trafficcontrol.balancer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class HttpNodeHealthClient implements NodeHealthClient {

    private static final Logger log = LoggerFactory.getLogger(HttpNodeHealthClient.class);

    private final RestClient http;

    public HttpNodeHealthClient(RestClient.Builder builder, BalancerProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.healthCheck().timeout());
        requestFactory.setReadTimeout(properties.healthCheck().timeout());
        this.http = builder.requestFactory(requestFactory).build();
    }

    @Override
    public boolean isHealthy(String url) {
        try {
            // non-2xx responses surface as RestClientResponseException
            return http.get()
                    .uri(url)
                    .retrieve()
                    .toBodilessEntity()
                    .getStatusCode()
                    .is2xxSuccessful();
        } catch (RuntimeException e) {
            // RestClientException, or IllegalArgumentException for a url that is not absolute
            log.debug("Health check request failed url={} error={}", url, e.getMessage());
            return false;
        }
    }
}
