package com.atlas.core.tools;

import com.atlas.core.metrics.AtlasMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolsConfig {

    /**
     * The planner's available tool set is fixed at construction, so it is built
     * once from the configured integration flags.
     */
    @Bean
    public ToolAwarePlanner toolAwarePlanner(ToolRegistry registry, IntegrationProperties properties,
                                             @Autowired(required = false) AtlasMetrics metrics) {
        return new ToolAwarePlanner(registry, properties.toFlags(), metrics);
    }
}
