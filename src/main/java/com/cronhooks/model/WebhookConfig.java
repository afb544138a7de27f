package com.cronhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookConfig {
    private String url;
    private String method;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> headers = new LinkedHashMap<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String body;

    @JsonProperty("jq_selectors")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> jqSelectors = new LinkedHashMap<>();

    @JsonProperty("body_template")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String bodyTemplate;

    @JsonProperty("only_if_vars_non_empty")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean onlyIfVarsNonEmpty;

    // Seconds, 0 means the executor default
    @JsonProperty("timeout")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private int timeoutSeconds;

    private boolean enabled;

    public WebhookConfig() {}

    public WebhookConfig(String url, String method) {
        this.url = url;
        this.method = method;
    }

    public WebhookConfig(WebhookConfig other) {
        this.url = other.url;
        this.method = other.method;
        this.headers = other.headers != null ? new LinkedHashMap<>(other.headers) : new LinkedHashMap<>();
        this.body = other.body;
        this.jqSelectors = other.jqSelectors != null ? new LinkedHashMap<>(other.jqSelectors) : new LinkedHashMap<>();
        this.bodyTemplate = other.bodyTemplate;
        this.onlyIfVarsNonEmpty = other.onlyIfVarsNonEmpty;
        this.timeoutSeconds = other.timeoutSeconds;
        this.enabled = other.enabled;
    }

    // Getters and Setters
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getMethod() { return method; }
    public void setMethod(String method) { this.method = method; }

    public Map<String, String> getHeaders() { return headers; }
    public void setHeaders(Map<String, String> headers) { this.headers = headers; }

    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }

    public Map<String, String> getJqSelectors() { return jqSelectors; }
    public void setJqSelectors(Map<String, String> jqSelectors) { this.jqSelectors = jqSelectors; }

    public String getBodyTemplate() { return bodyTemplate; }
    public void setBodyTemplate(String bodyTemplate) { this.bodyTemplate = bodyTemplate; }

    public boolean isOnlyIfVarsNonEmpty() { return onlyIfVarsNonEmpty; }
    public void setOnlyIfVarsNonEmpty(boolean onlyIfVarsNonEmpty) { this.onlyIfVarsNonEmpty = onlyIfVarsNonEmpty; }

    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    public boolean hasBodyTemplate() {
        return bodyTemplate != null && !bodyTemplate.isEmpty();
    }

    public boolean hasJqSelectors() {
        return jqSelectors != null && !jqSelectors.isEmpty();
    }

    @Override
    public String toString() {
        return "WebhookConfig{" +
                "method='" + method + '\'' +
                ", url='" + url + '\'' +
                ", headers=" + (headers != null ? headers.size() : 0) +
                ", timeout=" + timeoutSeconds +
                ", enabled=" + enabled +
                '}';
    }
}
