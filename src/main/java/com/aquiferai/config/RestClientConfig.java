package com.aquiferai.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Logs model backend traffic on {@code com.aquiferai.http.logging} at debug level.
 */
@Configuration
public class RestClientConfig {

    static final String HTTP_LOGGER = "com.aquiferai.http.logging";

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // response body is read twice when debug logging is on
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger(HTTP_LOGGER);
        private static final int MAX_BODY_LOG = 4000;

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            // local backends are configured with a placeholder key
            var headers = request.getHeaders();
            String auth = headers.getFirst("Authorization");
            if (auth != null) {
                String trimmed = auth.trim();
                if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                    headers.remove("Authorization");
                }
            }
            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            httpLogger.debug("--> {} {}", request.getMethod(), request.getURI());
            if (body.length > 0) {
                httpLogger.debug("Request body: {}", abbreviate(new String(body, StandardCharsets.UTF_8)));
            }
            long started = System.nanoTime();
            ClientHttpResponse response = execution.execute(request, body);
            long tookMs = (System.nanoTime() - started) / 1_000_000;
            httpLogger.debug("<-- {} {} ({} ms)", response.getStatusCode(), request.getURI(), tookMs);
            byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
            if (responseBody.length > 0) {
                httpLogger.debug("Response body: {}", abbreviate(new String(responseBody, StandardCharsets.UTF_8)));
            }
            return response;
        }

        private static String abbreviate(String value) {
            if (value.length() <= MAX_BODY_LOG) {
                return value;
            }
            return value.substring(0, MAX_BODY_LOG) + "...";
        }
    }
}
