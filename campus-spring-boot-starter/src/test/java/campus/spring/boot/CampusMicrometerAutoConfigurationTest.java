package campus.spring.boot;

import campus.micrometer.MicrometerMetricsExporter;
import campus.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class CampusMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(CampusMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void usesDefaultPrefix() {
    runner.run(ctx -> {
      ctx.getBean(MetricsExporter.class).incrementPublished("events_user", 2);
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertEquals(2.0, registry.get("campus.outbox.published").tag("stream", "events_user").counter().count());
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("campus.metrics.name-prefix=eu.campus").run(ctx -> {
      ctx.getBean(MetricsExporter.class).incrementDelivered("events_registration", "registration-mailer");
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("eu.campus.processor.delivered").counter());
      assertNull(registry.find("campus.processor.delivered").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("campus.metrics.enabled=false")
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void backsOffWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CampusMicrometerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customMetricsExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
