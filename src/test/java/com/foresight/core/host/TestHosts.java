package com.foresight.core.host;

import java.util.List;

/**
 * Builds in-process hosts for tests outside this package.
 */
public final class TestHosts {

    private TestHosts() {}

    public static LocalHostEnvironment local(List<Capability> capabilities, List<ContextProvider> providers,
                                             ResultRegistry registry) {
        return new LocalHostEnvironment(capabilities, List.of(), providers, registry);
    }

    public static AgentProperties agent(String id) {
        var agent = new AgentProperties();
        agent.setId(id);
        return agent;
    }
}
