package com.example.authclient.adapter.discovery.client;

import com.example.authclient.adapter.discovery.dto.ProviderMetadata;
import com.example.authclient.exception.AuthConfigurationException;
import com.example.authclient.properties.AuthClientProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;

/**
 * Fetches and caches the provider's OpenID configuration.
 * Every failure is a configuration problem from the caller's point of view.
 */
@Slf4j
@Component
public class OidcDiscoveryClient {

  private static final String DISCOVERY_BREAKER = "oidcDiscovery";
  private static final String WELL_KNOWN_PATH = ".well-known/openid-configuration";

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Cache<String, ProviderMetadata> metadataCache;

  public OidcDiscoveryClient(OkHttpClient httpClient, ObjectMapper objectMapper, AuthClientProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    AuthClientProperties.DiscoveryProperties discovery = properties.discovery();
    this.metadataCache = Caffeine.newBuilder()
        .maximumSize(discovery.cacheMaxSize())
        .expireAfterWrite(discovery.cacheTtl())
        .build();
  }

  /**
   * Returns the provider metadata for the issuer, using the local cache when possible.
   *
   * @param issuerUrl the configured issuer
   * @return metadata with at least an authorization endpoint
   * @throws AuthConfigurationException if discovery fails or the document is unusable
   */
  @CircuitBreaker(name = DISCOVERY_BREAKER, fallbackMethod = "discoverFallback")
  public ProviderMetadata discover(URI issuerUrl) {
    String cacheKey = issuerUrl.toString();
    ProviderMetadata cached = metadataCache.getIfPresent(cacheKey);
    if (cached != null) {
      log.debug("Returning cached provider metadata for {}", cacheKey);
      return cached;
    }

    ProviderMetadata metadata = fetchMetadata(issuerUrl);
    metadataCache.put(cacheKey, metadata);
    log.info("Discovered OpenID configuration for issuer: {}", cacheKey);
    return metadata;
  }

  public ProviderMetadata discoverFallback(URI issuerUrl, Throwable ex) {
    if (ex instanceof AuthConfigurationException configurationException) {
      throw configurationException;
    }
    log.error("OIDC discovery circuit breaker is open for issuer: {}", issuerUrl, ex);
    throw new AuthConfigurationException("OpenID configuration discovery is temporarily unavailable.", ex);
  }

  /**
   * Drops cached metadata, forcing the next call to hit the network.
   */
  public void evict(URI issuerUrl) {
    metadataCache.invalidate(issuerUrl.toString());
  }

  private ProviderMetadata fetchMetadata(URI issuerUrl) {
    String issuer = issuerUrl.toString();
    String base = issuer.endsWith("/") ? issuer : issuer + "/";
    HttpUrl discoveryUrl = HttpUrl.parse(base + WELL_KNOWN_PATH);
    if (discoveryUrl == null) {
      throw new AuthConfigurationException("Issuer URL is not an http(s) URL: " + issuerUrl);
    }

    Request request = new Request.Builder()
        .url(discoveryUrl)
        .header("Accept", "application/json")
        .get()
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new AuthConfigurationException("Discovery returned a non-successful status: " + response.code());
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new AuthConfigurationException("Received an empty discovery document");
      }

      ProviderMetadata metadata = objectMapper.readValue(body.string(), ProviderMetadata.class);
      if (metadata == null || !metadata.hasAuthorizationEndpoint()) {
        throw new AuthConfigurationException("Discovery document has no authorization endpoint");
      }
      return metadata;
    } catch (IOException e) {
      log.error("Failed to discover OpenID configuration for {}", issuerUrl, e);
      throw new AuthConfigurationException("Failed to discover OpenID configuration", e);
    }
  }
}
