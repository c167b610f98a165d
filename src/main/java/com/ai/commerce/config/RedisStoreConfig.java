package com.ai.commerce.config;

import com.ai.commerce.store.KeyValueStore;
import com.ai.commerce.store.RedisKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Shared Redis store, used when several orchestrator instances must see the same locks and counters.
 */
@Configuration
@ConditionalOnProperty(name = "orchestrator.store.type", havingValue = "redis")
public class RedisStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisStoreConfig.class);

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);
        if (redisPassword != null && !redisPassword.isEmpty()) {
            config.setPassword(redisPassword);
        }
        return new LettuceConnectionFactory(config);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public KeyValueStore redisKeyValueStore(StringRedisTemplate stringRedisTemplate) {
        log.info("Using Redis key/value store at {}:{}", redisHost, redisPort);
        return new RedisKeyValueStore(stringRedisTemplate);
    }
}
