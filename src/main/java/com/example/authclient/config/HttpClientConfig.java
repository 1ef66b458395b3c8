package com.example.authclient.config;

import com.example.authclient.properties.AuthClientProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp client shared by discovery, token endpoint and account API calls
 */
@Configuration(proxyBeanMethods = false)
public class HttpClientConfig {

  private static final int MAX_IDLE_CONNECTIONS = 5;
  private static final long KEEP_ALIVE_MINUTES = 5;

  @Bean
  @ConditionalOnMissingBean
  public OkHttpClient authOkHttpClient(AuthClientProperties properties) {
    AuthClientProperties.HttpProperties http = properties.http();
    return new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(MAX_IDLE_CONNECTIONS, KEEP_ALIVE_MINUTES, TimeUnit.MINUTES))
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(http.connectTimeout())
        .readTimeout(http.readTimeout())
        .writeTimeout(http.readTimeout())
        // Retries are the caller's decision
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
