package cull.email.app.config;

import cull.email.app.service.QueryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetentionEngineConfig {

    @Bean
    public QueryBuilder queryBuilder(CullProperties properties) {
        return new QueryBuilder(properties.getQuery().toDayConversion());
    }
}
