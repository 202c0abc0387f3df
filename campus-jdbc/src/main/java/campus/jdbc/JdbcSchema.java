package campus.jdbc;

import campus.jdbc.outbox.JdbcOutboxStores;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Creates the tables of the default schema. Scripts are classpath resources named
 * {@code campus/jdbc/schema-<store>.sql}, where {@code <store>} is the
 * {@linkplain campus.jdbc.outbox.AbstractJdbcOutboxStore#name() name} of the detected
 * outbox store. Every statement is idempotent, so running it on startup is safe.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

  private JdbcSchema() {}

  public static void initialize(DataSource dataSource) {
    String dialect = JdbcOutboxStores.detect(dataSource).name();
    List<String> statements = statements(dialect);
    try (Connection conn = dataSource.getConnection(); Statement statement = conn.createStatement()) {
      conn.setAutoCommit(true);
      for (String sql : statements) {
        statement.execute(sql);
      }
    } catch (SQLException e) {
      throw new JdbcAccessException("Failed to initialize " + dialect + " schema", e);
    }
    logger.info("Initialized " + dialect + " schema (" + statements.size() + " statements)");
  }

  static List<String> statements(String dialect) {
    String resource = "campus/jdbc/schema-" + dialect + ".sql";
    String script;
    try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for " + dialect + ": " + resource);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }

    StringBuilder withoutComments = new StringBuilder();
    for (String line : script.split("\n")) {
      if (!line.trim().startsWith("--")) {
        withoutComments.append(line).append('\n');
      }
    }
    List<String> statements = new ArrayList<>();
    for (String sql : withoutComments.toString().split(";")) {
      if (!sql.isBlank()) {
        statements.add(sql.trim());
      }
    }
    return statements;
  }
}
