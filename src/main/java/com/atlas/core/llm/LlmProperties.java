package com.atlas.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "atlas.llm")
public class LlmProperties {

    /** Model override; blank means the provider default from spring.ai.* is used. */
    private String model = "";
    private int planningMaxTokens = 2048;
    private int summaryMaxTokens = 1024;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getPlanningMaxTokens() {
        return planningMaxTokens;
    }

    public void setPlanningMaxTokens(int planningMaxTokens) {
        this.planningMaxTokens = planningMaxTokens;
    }

    public int getSummaryMaxTokens() {
        return summaryMaxTokens;
    }

    public void setSummaryMaxTokens(int summaryMaxTokens) {
        this.summaryMaxTokens = summaryMaxTokens;
    }

    public boolean hasModelOverride() {
        return model != null && !model.isBlank();
    }
}
