package com.acme.assistant.redis;

import com.acme.assistant.config.StreamConfig;
import com.redis.testcontainers.RedisContainer;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** Shared Redis container; every test starts from an empty database. */
@Testcontainers(disabledWithoutDocker = true)
abstract class RedisContainerTestBase {

    @Container
    static GenericContainer<?> redis =
            new RedisContainer(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    protected RedissonClient redisson;

    @BeforeEach
    void connect() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + redis.getHost() + ":" + redis.getFirstMappedPort());
        redisson = Redisson.create(config);
        redisson.getKeys().flushall();
    }

    @AfterEach
    void disconnect() {
        if (redisson != null) {
            redisson.shutdown();
        }
    }

    protected StreamConfig streamConfig() {
        StreamConfig config = new StreamConfig();
        config.setInputStream("to_secretary");
        config.setGroup("assistant");
        config.setConsumerName("test");
        config.setBlockTimeout(Duration.ofMillis(200));
        config.setIdleTimeout(Duration.ofMillis(300));
        config.setReclaimInterval(Duration.ofMinutes(10));
        return config;
    }
}
