package com.foresight.core.host;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Identity of the agent this service analyses on behalf of.
 */
@Component
@ConfigurationProperties(prefix = "foresight.agent")
public class AgentProperties {

    private String id = "foresight-agent";
    private String name = "Foresight";

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
