package com.foresight.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "foresight.llm")
public class LlmProperties {

    private String provider = "";
    private String model = "";
    private boolean logPrompts = false;

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

    public boolean isLogPrompts() {
        return logPrompts;
    }

    public void setLogPrompts(boolean logPrompts) {
        this.logPrompts = logPrompts;
    }

    public boolean isConfigured() {
        return provider != null && !provider.isBlank() && model != null && !model.isBlank();
    }
}
