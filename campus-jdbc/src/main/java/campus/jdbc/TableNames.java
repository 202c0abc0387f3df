package campus.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names of the outbox tables. Aggregate tables are fixed; the outbox tables may be renamed
 * as long as the name is a plain identifier that PostgreSQL will not truncate.
 */
public final class TableNames {
  public static final String OUTBOX_MESSAGE = "outbox_message";
  public static final String OUTBOX_STREAM = "outbox_stream";
  public static final String CONSUMER_OFFSET = "consumer_offset";

  static final int MAX_LENGTH = 63;
  private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private TableNames() {}

  /**
   * @return {@code tableName}, for use in field initializers
   * @throws IllegalArgumentException unless {@code tableName} is a plain SQL identifier of
   *                                  at most 63 characters
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.length() > MAX_LENGTH || !IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
