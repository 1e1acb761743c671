package com.keystone.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "keystone.llm")
public class LlmProperties {

    /** Provider label shown by health checks. */
    private String provider = "openai";

    /** Chat model override; blank keeps the provider default. */
    private String model = "";

    private String apiKey = "";

    /** Upper bound on one Planner or Verifier call, including retries inside the client. */
    private Duration callTimeout = Duration.ofSeconds(120);

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank() && !"not-set".equals(apiKey);
    }
}
