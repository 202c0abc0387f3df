package campus.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CampusPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      CampusProperties props = ctx.getBean(CampusProperties.class);
      assertEquals("outbox_message", props.getOutbox().getTableName());
      assertEquals("outbox_stream", props.getOutbox().getStreamTableName());
      assertEquals("consumer_offset", props.getOutbox().getOffsetTableName());
      assertFalse(props.getSchema().isInitialize());
      assertTrue(props.getProcessor().isEnabled());
      assertEquals(Duration.ofSeconds(1), props.getProcessor().getInterval());
      assertEquals(100, props.getProcessor().getBatchSize());
      assertEquals(Duration.ofSeconds(5), props.getProcessor().getDrainTimeout());
      assertEquals(Duration.ofMillis(200), props.getRetry().getBaseDelay());
      assertEquals(Duration.ofMinutes(1), props.getRetry().getMaxDelay());
      assertEquals(Duration.ofMinutes(10), props.getRegistration().getCodeTtl());
      assertEquals(Duration.ofMinutes(1), props.getRegistration().getResendCooldown());
      assertEquals(3, props.getRegistration().getMaxAttempts());
      assertEquals(6, props.getRegistration().getCodeLength());
      assertEquals("http://localhost:3000/invitations", props.getMail().getInvitationBaseUrl());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("campus", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "campus.outbox.table-name=my_outbox",
        "campus.outbox.stream-table-name=my_stream",
        "campus.outbox.offset-table-name=my_offset",
        "campus.schema.initialize=true",
        "campus.processor.enabled=false",
        "campus.processor.interval=250ms",
        "campus.processor.batch-size=20",
        "campus.processor.drain-timeout=PT10S",
        "campus.retry.base-delay=1s",
        "campus.retry.max-delay=5m",
        "campus.registration.code-ttl=15m",
        "campus.registration.resend-cooldown=30s",
        "campus.registration.max-attempts=5",
        "campus.registration.code-length=8",
        "campus.mail.invitation-base-url=https://campus.example.edu/invite",
        "campus.metrics.enabled=false",
        "campus.metrics.name-prefix=eu.campus"
    ).run(ctx -> {
      CampusProperties props = ctx.getBean(CampusProperties.class);
      assertEquals("my_outbox", props.getOutbox().getTableName());
      assertEquals("my_stream", props.getOutbox().getStreamTableName());
      assertEquals("my_offset", props.getOutbox().getOffsetTableName());
      assertTrue(props.getSchema().isInitialize());
      assertFalse(props.getProcessor().isEnabled());
      assertEquals(Duration.ofMillis(250), props.getProcessor().getInterval());
      assertEquals(20, props.getProcessor().getBatchSize());
      assertEquals(Duration.ofSeconds(10), props.getProcessor().getDrainTimeout());
      assertEquals(Duration.ofSeconds(1), props.getRetry().getBaseDelay());
      assertEquals(Duration.ofMinutes(5), props.getRetry().getMaxDelay());
      assertEquals(Duration.ofMinutes(15), props.getRegistration().getCodeTtl());
      assertEquals(Duration.ofSeconds(30), props.getRegistration().getResendCooldown());
      assertEquals(5, props.getRegistration().getMaxAttempts());
      assertEquals(8, props.getRegistration().getCodeLength());
      assertEquals("https://campus.example.edu/invite", props.getMail().getInvitationBaseUrl());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("eu.campus", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(CampusProperties.class)
  static class PropsConfig {
  }
}
