package com.example.portalsync.config;

import com.example.portalsync.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Pooled Lettuce connection for sessions, the hot cache and fetch locks.
 * Only active with the redis store backend.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

  private static final Duration EVICTION_RUN_INTERVAL = Duration.ofSeconds(30);
  private static final Duration MIN_EVICTABLE_IDLE = Duration.ofMinutes(1);

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());
    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(EVICTION_RUN_INTERVAL);
    config.setMinEvictableIdleTime(MIN_EVICTABLE_IDLE);
    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    redisConfig.setDatabase(redisProps.database());
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      redisConfig.setPassword(redisProps.password());
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(clientOptions(redisProps.timeout()));

    if (redisProps.ssl()) {
      builder.useSsl();
    }

    log.info("Redis store at {}:{} (db {}, ssl={})",
        redisProps.host(), redisProps.port(), redisProps.database(), redisProps.ssl());
    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);
    return factory;
  }

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisTemplate template = new StringRedisTemplate();
    template.setConnectionFactory(connectionFactory);
    template.afterPropertiesSet();
    return template;
  }

  private static ClientOptions clientOptions(Duration timeout) {
    return ClientOptions.builder()
        .socketOptions(SocketOptions.builder()
            .connectTimeout(timeout)
            .keepAlive(true)
            .tcpNoDelay(true)
            .build())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .cancelCommandsOnReconnectFailure(false)
        .timeoutOptions(TimeoutOptions.enabled(timeout))
        .build();
  }
}
