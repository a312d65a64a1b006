package com.inventoryhold.reservation.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis client for the distributed capacity hold strategy.
 * Only created when {@code inventory.reservation.strategy=distributed}.
 */
@Configuration
@ConditionalOnProperty(name = "inventory.reservation.strategy", havingValue = "distributed")
public class RedissonConfig {

    @Value("${inventory.redis.address:redis://localhost:6379}")
    private String address;

    @Value("${inventory.redis.password:}")
    private String password;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(address)
                .setPassword(password.isBlank() ? null : password);
        return Redisson.create(config);
    }
}
