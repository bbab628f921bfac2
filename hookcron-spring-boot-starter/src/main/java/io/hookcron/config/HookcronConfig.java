package io.hookcron.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hookcron.JobStore;
import io.hookcron.WebhookDispatcher;
import io.hookcron.WebhookScheduler;
import io.hookcron.http.RestTemplateWebhookDispatcher;
import io.hookcron.internal.DefaultWebhookScheduler;
import io.hookcron.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for hookcron components.
 */
@AutoConfiguration
@ConditionalOnClass({WebhookScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(HookcronProperties.class)
@ConditionalOnProperty(prefix = "hookcron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HookcronConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobStore hookcronJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected HookcronMongoIndexConfig hookcronMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new HookcronMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookDispatcher webhookDispatcher(HookcronProperties props) {
        return new RestTemplateWebhookDispatcher(props.getRequestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookScheduler webhookScheduler(HookcronProperties props, JobStore jobStore, WebhookDispatcher dispatcher) {
        return new DefaultWebhookScheduler(props, jobStore, dispatcher);
    }

    @Bean
    @ConditionalOnMissingBean
    public HookcronLifecycle hookcronLifecycle(WebhookScheduler scheduler) {
        return new HookcronLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hookcron", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton hookcronIndexesInitializer(HookcronMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
