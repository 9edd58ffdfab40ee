package com.einvoicenews.collector.client;

import com.einvoicenews.collector.config.CollectorProperties;
import com.einvoicenews.collector.exception.FetchException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Blocking page download over the shared reactive {@link WebClient}.
 */
@Component
public class WebClientPageTransport implements PageTransport {

    private final WebClient webClient;
    private final Map<String, String> headers;

    @Autowired
    public WebClientPageTransport(WebClient webClient, CollectorProperties properties) {
        this(webClient, properties.getHttp().getHeaders());
    }

    public WebClientPageTransport(WebClient webClient, Map<String, String> headers) {
        this.webClient = webClient;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    @Override
    public String get(String url, Duration timeout) {
        try {
            String body = webClient.get()
                    .uri(URI.create(url))
                    .headers(h -> headers.forEach(h::set))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return body != null ? body : "";
        } catch (WebClientResponseException e) {
            throw FetchException.httpStatus(url, e.getStatusCode().value());
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw FetchException.timeout(url, timeout.toMillis());
            }
            throw FetchException.transport(url, cause);
        }
    }
}
