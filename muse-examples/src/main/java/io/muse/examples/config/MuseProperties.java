package io.muse.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "muse")
public class MuseProperties {
  /** {@code memory} (seeded from {@link #seedData}) or {@code jdbc}. */
  private String engine = "memory";
  private String collections = "collections/ontology.yaml";
  private String seedData = "data/ontology-seed.yaml";
  private final Datasource datasource = new Datasource();
  private final Pagination pagination = new Pagination();

  public String getEngine() { return engine; }
  public void setEngine(String engine) { this.engine = engine; }
  public String getCollections() { return collections; }
  public void setCollections(String collections) { this.collections = collections; }
  public String getSeedData() { return seedData; }
  public void setSeedData(String seedData) { this.seedData = seedData; }
  public Datasource getDatasource() { return datasource; }
  public Pagination getPagination() { return pagination; }

  public static class Datasource {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maximumPoolSize = 10;

    /** java.sql.Connection isolation constant; unset keeps the driver default. */
    private Integer isolationLevel;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public Integer getIsolationLevel() { return isolationLevel; }
    public void setIsolationLevel(Integer isolationLevel) { this.isolationLevel = isolationLevel; }
  }

  public static class Pagination {
    private int defaultItemCount = 25;
    private int maxItemCount = 100;
    private int surroundingPages = 5;

    public int getDefaultItemCount() { return defaultItemCount; }
    public void setDefaultItemCount(int defaultItemCount) { this.defaultItemCount = defaultItemCount; }
    public int getMaxItemCount() { return maxItemCount; }
    public void setMaxItemCount(int maxItemCount) { this.maxItemCount = maxItemCount; }
    public int getSurroundingPages() { return surroundingPages; }
    public void setSurroundingPages(int surroundingPages) { this.surroundingPages = surroundingPages; }
  }
}
