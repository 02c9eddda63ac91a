package io.github.drompincen.tabsensei.gateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Repositories exist only when at least one provider is backed by MongoDB.
 */
@Configuration
@ConditionalOnExpression("'${tabsensei.store.provider:memory}' == 'mongo' or '${tabsensei.alarm.provider:memory}' == 'mongo'")
@EnableMongoRepositories(basePackages = "io.github.drompincen.tabsensei.persistence.repository")
public class MongoConfig {
}
