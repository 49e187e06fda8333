package io.contextrunr.config;

import io.contextrunr.memory.ConversationStore;
import io.contextrunr.memory.GroupMetadataLookup;
import io.contextrunr.memory.StoreGroupMetadataLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires context assembly: binds its properties, supplies the clock, and falls back to
 * store-derived group metadata when no transport lookup is registered.
 */
@Configuration
@EnableConfigurationProperties({ContextProperties.class, AgentProperties.class})
public class ContextConfig {

    private static final Logger log = LoggerFactory.getLogger(ContextConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(GroupMetadataLookup.class)
    public GroupMetadataLookup groupMetadataLookup(ConversationStore conversationStore) {
        log.info("No group metadata lookup registered, using recorded conversations");
        return new StoreGroupMetadataLookup(conversationStore);
    }
}
