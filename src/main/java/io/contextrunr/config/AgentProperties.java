package io.contextrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity of the agent whose context is being assembled.
 *
 * @param id   participant id the agent sends messages as
 * @param name display name, also used to address the agent in free text
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(String id, String name) {

    public AgentProperties {
        if (id == null || id.isBlank()) {
            id = "agent";
        }
        if (name == null || name.isBlank()) {
            name = "Qi";
        }
    }

    public boolean isAgent(String participantId) {
        return id.equals(participantId);
    }
}
