package com.acme.assistant.worker.config;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(
      @Property(name = "redisson.address") String address,
      @Nullable @Property(name = "redisson.password") String password,
      @Property(name = "redisson.database", defaultValue = "0") int database,
      @Property(name = "redisson.timeout", defaultValue = "3000") int timeoutMillis) {
    Config config = new Config();
    SingleServerConfig server =
        config.useSingleServer().setAddress(address).setDatabase(database).setTimeout(timeoutMillis);
    if (password != null && !password.isBlank()) {
      server.setPassword(password);
    }
    return Redisson.create(config);
  }
}
