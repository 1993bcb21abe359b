package com.example.voice.config;

import com.example.voice.service.cache.ContextCacheStore;
import com.example.voice.service.cache.NoOpContextCacheStore;
import com.example.voice.service.cache.RedisContextCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    @ConditionalOnProperty(name = "voice.cache.enabled", havingValue = "true", matchIfMissing = true)
    public ContextCacheStore redisContextCacheStore(StringRedisTemplate stringRedisTemplate) {
        return new RedisContextCacheStore(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "voice.cache.enabled", havingValue = "false")
    public ContextCacheStore noOpContextCacheStore() {
        return new NoOpContextCacheStore();
    }
}
