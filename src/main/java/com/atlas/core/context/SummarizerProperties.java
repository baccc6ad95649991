package com.atlas.core.context;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "atlas.summarizer")
public class SummarizerProperties {

    /** Number of most recent messages kept verbatim. */
    private int keepRecent = 10;

    public int getKeepRecent() {
        return keepRecent;
    }

    public void setKeepRecent(int keepRecent) {
        this.keepRecent = keepRecent;
    }
}
