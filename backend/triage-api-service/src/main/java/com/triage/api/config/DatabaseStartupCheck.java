package com.triage.api.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/** Refuses to start the service when the database cannot be reached. */
@Component
public class DatabaseStartupCheck {

  private static final Logger log = LoggerFactory.getLogger(DatabaseStartupCheck.class);

  private final DataSource dataSource;

  public DatabaseStartupCheck(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @PostConstruct
  public void verify() {
    try (Connection conn = dataSource.getConnection()) {
      log.info("Database connection successful: {} {}",
          conn.getMetaData().getDatabaseProductName(), conn.getMetaData().getDatabaseProductVersion());
    } catch (SQLException e) {
      throw new IllegalStateException("Database is not reachable: " + e.getMessage(), e);
    }
  }
}
