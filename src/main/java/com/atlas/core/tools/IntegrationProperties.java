package com.atlas.core.tools;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "atlas.integrations")
public class IntegrationProperties {

    private boolean trello = true;
    private boolean hetzner = true;
    private boolean claudeContainers = true;

    public boolean isTrello() {
        return trello;
    }

    public void setTrello(boolean trello) {
        this.trello = trello;
    }

    public boolean isHetzner() {
        return hetzner;
    }

    public void setHetzner(boolean hetzner) {
        this.hetzner = hetzner;
    }

    public boolean isClaudeContainers() {
        return claudeContainers;
    }

    public void setClaudeContainers(boolean claudeContainers) {
        this.claudeContainers = claudeContainers;
    }

    public IntegrationFlags toFlags() {
        return new IntegrationFlags(trello, hetzner, claudeContainers);
    }
}
