package com.example.authclient.config;

import com.example.authclient.adapter.store.EncryptedFileSecretStore;
import com.example.authclient.adapter.store.InMemorySecretStore;
import com.example.authclient.adapter.store.RedisSecretStore;
import com.example.authclient.adapter.store.SecretStore;
import com.example.authclient.properties.AuthClientProperties;
import com.example.authclient.service.EncryptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.nio.file.Path;

/**
 * Selects the secret store backend from {@code auth.store.type}.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class SecretStoreConfig {

  private static final String DEFAULT_DIRECTORY = ".auth-client";

  @Bean
  @ConditionalOnMissingBean(SecretStore.class)
  @ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "memory")
  public SecretStore inMemorySecretStore() {
    log.warn("Using in-memory secret store; credentials will not survive a restart");
    return new InMemorySecretStore();
  }

  @Bean
  @ConditionalOnMissingBean(SecretStore.class)
  @ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "file", matchIfMissing = true)
  public SecretStore encryptedFileSecretStore(AuthClientProperties properties) {
    AuthClientProperties.StoreProperties store = properties.store();
    Path directory = store.filePath() != null && !store.filePath().isBlank()
        ? Path.of(store.filePath())
        : Path.of(System.getProperty("user.home"), DEFAULT_DIRECTORY);
    log.info("Using encrypted file secret store at {}", directory);
    return new EncryptedFileSecretStore(directory, new EncryptionService(store.encryptionKey()));
  }

  @Bean
  @ConditionalOnMissingBean(SecretStore.class)
  @ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "redis")
  public SecretStore redisSecretStore(RedisConnectionFactory connectionFactory, AuthClientProperties properties) {
    AuthClientProperties.StoreProperties store = properties.store();
    log.info("Using Redis secret store with key prefix {}", store.redisKeyPrefix());
    return new RedisSecretStore(credentialRedisTemplate(connectionFactory),
                                new EncryptionService(store.encryptionKey()),
                                store.redisKeyPrefix());
  }

  private static RedisTemplate<String, String> credentialRedisTemplate(RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);

    StringRedisSerializer stringSerializer = new StringRedisSerializer();
    template.setKeySerializer(stringSerializer);
    template.setValueSerializer(stringSerializer);
    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }
}
