package czm.staff_application_be.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {
    /** Base URL of the chat bridge, e.g. http://bridge:8081/api */
    private String baseUrl;
    /** Shared token sent as X-Bridge-Token */
    private String token;
    /** Request timeout ms */
    private int timeoutMs = 5_000;
    /** Max retries on 429/5xx */
    private int retryMax = 2;
    /** Backoff in ms between retries */
    private int retryBackoffMs = 300;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }
    public int getRetryMax() { return retryMax; }
    public void setRetryMax(int retryMax) { this.retryMax = retryMax; }
    public int getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(int retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
}
