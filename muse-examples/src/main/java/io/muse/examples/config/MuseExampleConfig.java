package io.muse.examples.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.muse.persistence.collection.CollectionRegistry;
import io.muse.persistence.collection.InMemoryCollectionRegistry;
import io.muse.persistence.collection.yaml.YamlCollectionLoader;
import io.muse.persistence.exec.PaginationEngine;
import io.muse.persistence.jdbc.JdbcHandle;
import io.muse.persistence.jdbc.JdbcPaginationEngine;
import io.muse.persistence.jdbc.postgres.PostgresDialect;
import io.muse.persistence.memory.InMemoryHandle;
import io.muse.persistence.memory.InMemoryPaginationEngine;
import io.muse.persistence.memory.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MuseProperties.class)
public class MuseExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(MuseExampleConfig.class);

  @Bean
  public CollectionRegistry collectionRegistry(MuseProperties props) {
    var defs = new YamlCollectionLoader().loadResource(props.getCollections());
    log.info("muse.collections resource={} count={}", props.getCollections(), defs.size());
    return new InMemoryCollectionRegistry(defs);
  }

  @Bean
  @ConditionalOnProperty(prefix = "muse", name = "engine", havingValue = "memory", matchIfMissing = true)
  public InMemoryStore inMemoryStore(MuseProperties props, CollectionRegistry collections) {
    InMemoryStore store = new InMemoryStore();
    if (props.getSeedData() != null && !props.getSeedData().isBlank()) {
      new SeedDataLoader(collections).load(props.getSeedData(), store);
    }
    return store;
  }

  @Bean
  @ConditionalOnProperty(prefix = "muse", name = "engine", havingValue = "memory", matchIfMissing = true)
  public PaginationEngine<InMemoryHandle> inMemoryPaginationEngine(InMemoryStore store, CollectionRegistry collections) {
    log.info("muse.engine family=memory");
    return new InMemoryPaginationEngine(new InMemoryHandle("memory", store), collections);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "muse", name = "engine", havingValue = "jdbc")
  public HikariDataSource museDataSource(MuseProperties props) {
    MuseProperties.Datasource db = props.getDatasource();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing muse.datasource.jdbc-url for muse.engine=jdbc");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setReadOnly(true);
    hc.setPoolName("muse-ro");
    return new HikariDataSource(hc);
  }

  @Bean
  @ConditionalOnProperty(prefix = "muse", name = "engine", havingValue = "jdbc")
  public PaginationEngine<JdbcHandle> jdbcPaginationEngine(HikariDataSource ds, MuseProperties props,
                                                           CollectionRegistry collections) {
    MuseProperties.Datasource db = props.getDatasource();
    log.info("muse.engine family=jdbc schema={}", db.getSchema());
    JdbcHandle handle = new JdbcHandle("jdbc:muse-ro", ds, db.getSchema());
    return new JdbcPaginationEngine(handle, collections, new PostgresDialect(), null, db.getIsolationLevel());
  }
}
