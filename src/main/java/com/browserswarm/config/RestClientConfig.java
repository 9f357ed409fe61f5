package com.browserswarm.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
public class RestClientConfig {

    static final String HTTP_LOGGER_NAME = "com.browserswarm.http.logging";

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
    }

    /**
     * Logs request lines, headers and bodies plus response status and headers. Response bodies
     * are not read here because event streams must reach the caller unconsumed.
     */
    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger(HTTP_LOGGER_NAME);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--- HTTP Request ---");
            httpLogger.debug("URI: {} {}", request.getMethod(), request.getURI());
            httpLogger.debug("Headers: {}", masked(request.getHeaders()));
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
            httpLogger.debug("--------------------");
        }

        private void logResponse(ClientHttpResponse response) {
            httpLogger.debug("--- HTTP Response ---");
            try {
                httpLogger.debug("Status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("Status: Unknown");
            }
            httpLogger.debug("Headers: {}", response.getHeaders());
            httpLogger.debug("---------------------");
        }

        private HttpHeaders masked(HttpHeaders headers) {
            if (!headers.containsKey(HttpHeaders.AUTHORIZATION) && !headers.containsKey("x-goog-api-key")) {
                return headers;
            }
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(headers);
            if (copy.containsKey(HttpHeaders.AUTHORIZATION)) {
                copy.set(HttpHeaders.AUTHORIZATION, "***");
            }
            if (copy.containsKey("x-goog-api-key")) {
                copy.set("x-goog-api-key", "***");
            }
            return copy;
        }
    }
}
