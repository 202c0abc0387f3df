package campus.spring.boot;

import campus.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties bound under the {@code campus} prefix.
 *
 * @see CampusAutoConfiguration
 */
@ConfigurationProperties(prefix = "campus")
public class CampusProperties {

  private final Outbox outbox = new Outbox();
  private final Schema schema = new Schema();
  private final Processor processor = new Processor();
  private final Retry retry = new Retry();
  private final Registration registration = new Registration();
  private final Mail mail = new Mail();
  private final Metrics metrics = new Metrics();

  public Outbox getOutbox() {
    return outbox;
  }

  public Schema getSchema() {
    return schema;
  }

  public Processor getProcessor() {
    return processor;
  }

  public Retry getRetry() {
    return retry;
  }

  public Registration getRegistration() {
    return registration;
  }

  public Mail getMail() {
    return mail;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Outbox {
    /**
     * Table holding outbox records.
     */
    private String tableName = TableNames.OUTBOX_MESSAGE;

    /**
     * Table holding the per-stream offset counters.
     */
    private String streamTableName = TableNames.OUTBOX_STREAM;

    /**
     * Table holding consumer group offsets.
     */
    private String offsetTableName = TableNames.CONSUMER_OFFSET;

    public String getTableName() {
      return tableName;
    }

    public void setTableName(String tableName) {
      this.tableName = tableName;
    }

    public String getStreamTableName() {
      return streamTableName;
    }

    public void setStreamTableName(String streamTableName) {
      this.streamTableName = streamTableName;
    }

    public String getOffsetTableName() {
      return offsetTableName;
    }

    public void setOffsetTableName(String offsetTableName) {
      this.offsetTableName = offsetTableName;
    }
  }

  public static class Schema {
    /**
     * Run the bundled schema script on startup.
     */
    private boolean initialize = false;

    public boolean isInitialize() {
      return initialize;
    }

    public void setInitialize(boolean initialize) {
      this.initialize = initialize;
    }
  }

  public static class Processor {
    private boolean enabled = true;
    private Duration interval = Duration.ofSeconds(1);
    private int batchSize = 100;
    private Duration drainTimeout = Duration.ofSeconds(5);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getDrainTimeout() {
      return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
    }
  }

  public static class Retry {
    private Duration baseDelay = Duration.ofMillis(200);
    private Duration maxDelay = Duration.ofMinutes(1);

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }

  public static class Registration {
    private Duration codeTtl = Duration.ofMinutes(10);
    private Duration resendCooldown = Duration.ofMinutes(1);
    private int maxAttempts = 3;
    private int codeLength = 6;

    public Duration getCodeTtl() {
      return codeTtl;
    }

    public void setCodeTtl(Duration codeTtl) {
      this.codeTtl = codeTtl;
    }

    public Duration getResendCooldown() {
      return resendCooldown;
    }

    public void setResendCooldown(Duration resendCooldown) {
      this.resendCooldown = resendCooldown;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public int getCodeLength() {
      return codeLength;
    }

    public void setCodeLength(int codeLength) {
      this.codeLength = codeLength;
    }
  }

  public static class Mail {
    /**
     * Base URL of the staff invitation acceptance page.
     */
    private String invitationBaseUrl = "http://localhost:3000/invitations";

    public String getInvitationBaseUrl() {
      return invitationBaseUrl;
    }

    public void setInvitationBaseUrl(String invitationBaseUrl) {
      this.invitationBaseUrl = invitationBaseUrl;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "campus";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
