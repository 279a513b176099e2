package com.flamingo.ai.resumescreening.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.HttpHost;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client over the HttpComponents 5 low-level client (ES 9.0+).
 *
 * <p>Only active when the resume index is backed by Elasticsearch.
 */
@Configuration
@ConditionalOnProperty(
    name = "screening.vector-index.type",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class ElasticsearchConfig {

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client(
      @Value("${elasticsearch.scheme:http}") String scheme,
      @Value("${elasticsearch.host:localhost}") String host,
      @Value("${elasticsearch.port:9200}") int port) {
    log.info("Resume index backed by Elasticsearch at {}://{}:{}", scheme, host, port);
    return Rest5Client.builder(new HttpHost(scheme, host, port)).build();
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(Rest5Client rest5Client) {
    return new ElasticsearchClient(
        new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper()));
  }
}
