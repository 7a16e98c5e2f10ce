package czm.staff_application_be.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.staff_application_be.config.BridgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link MessageGateway} backed by the chat bridge's HTTP API.
 *
 * <pre>
 * POST   {base}/conversations/{conversationId}/messages            -> {"handle": "..."}
 * PUT    {base}/conversations/{conversationId}/messages/{handle}
 * DELETE {base}/conversations/{conversationId}/messages/{handle}
 * </pre>
 */
@Component
public class HttpMessageGateway implements MessageGateway {
    private static final Logger log = LoggerFactory.getLogger(HttpMessageGateway.class);

    private final RestTemplate restTemplate;
    private final BridgeProperties props;

    public HttpMessageGateway(RestTemplate bridgeRestTemplate, BridgeProperties props) {
        this.restTemplate = bridgeRestTemplate;
        this.props = props;
    }

    public record SentMessage(@JsonProperty("handle") String handle) {}

    @Override
    public String send(String conversationId, MessageContent content) {
        URI uri = uri("/conversations/{conversationId}/messages", Map.of("conversationId", conversationId));
        SentMessage sent = withRetry("send", () -> restTemplate.postForObject(uri, content, SentMessage.class));
        if (sent == null || sent.handle() == null) {
            throw new IllegalStateException("Bridge did not return a message handle for " + conversationId);
        }
        return sent.handle();
    }

    @Override
    public void edit(String conversationId, String messageHandle, MessageContent content) {
        URI uri = uri("/conversations/{conversationId}/messages/{handle}",
                Map.of("conversationId", conversationId, "handle", messageHandle));
        withRetry("edit", () -> restTemplate.exchange(uri, HttpMethod.PUT, new HttpEntity<>(content), Void.class));
    }

    @Override
    public void delete(String conversationId, String messageHandle) {
        URI uri = uri("/conversations/{conversationId}/messages/{handle}",
                Map.of("conversationId", conversationId, "handle", messageHandle));
        try {
            withRetry("delete", () -> restTemplate.exchange(uri, HttpMethod.DELETE, null, Void.class));
        } catch (HttpStatusCodeException ex) {
            if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.debug("Message {} in {} is already gone", messageHandle, conversationId);
                return;
            }
            throw ex;
        }
    }

    private URI uri(String path, Map<String, ?> variables) {
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) {
            throw new IllegalStateException("bridge.base-url is not configured");
        }
        return UriComponentsBuilder.fromHttpUrl(props.getBaseUrl())
                .path(path)
                .buildAndExpand(variables)
                .encode()
                .toUri();
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (HttpStatusCodeException ex) {
                int status = ex.getStatusCode().value();
                if ((status == 429 || status >= 500) && attempt < props.getRetryMax()) {
                    attempt++;
                    long backoff = (long) props.getRetryBackoffMs() * attempt;
                    log.warn("Bridge {} returned {}. Retrying in {}ms (attempt {}/{})", operation, status, backoff, attempt, props.getRetryMax());
                    sleep(backoff);
                    continue;
                }
                log.warn("Bridge {} failed with {} body={}", operation, status, truncate(ex.getResponseBodyAsString(), 300));
                throw ex;
            }
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    private static void sleep(long ms) {
        try { Thread.sleep(ms); } catch (InterruptedException ignored) { Thread.currentThread().interrupt(); }
    }
}
