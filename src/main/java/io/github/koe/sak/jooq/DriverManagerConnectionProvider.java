/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.koe.sak.jooq;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.jooq.ConnectionProvider;
import org.jooq.exception.DataAccessException;

/**
 * Opens a fresh JDBC connection for every acquisition and closes it on release.
 *
 * <p>Meant for deployments without a pool. jOOQ holds on to one acquired connection for the whole
 * of a transaction, so transactional blocks still run on a single connection.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
  private final String url;
  private final String user;
  private final String password;

  public DriverManagerConnectionProvider(String url, String user, String password) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or blank");
    }

    this.url = url;
    this.user = user;
    this.password = password;
  }

  @Override
  public Connection acquire() {
    try {
      return user == null
          ? DriverManager.getConnection(url)
          : DriverManager.getConnection(url, user, password);
    } catch (SQLException e) {
      throw new DataAccessException("Could not connect to %s".formatted(url), e);
    }
  }

  @Override
  public void release(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      throw new DataAccessException("Could not close connection to %s".formatted(url), e);
    }
  }
}
