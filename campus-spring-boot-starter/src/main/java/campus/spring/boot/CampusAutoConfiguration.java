package campus.spring.boot;

import campus.app.CampusEvents;
import campus.app.RegistrationCompletedHandler;
import campus.app.RegistrationService;
import campus.app.StaffInvitationService;
import campus.app.UserService;
import campus.crypto.Argon2PasswordHasher;
import campus.event.EventCodec;
import campus.event.EventTypeRegistry;
import campus.event.JacksonEventCodec;
import campus.invitation.StaffInvitationRepository;
import campus.jdbc.DataSourceConnectionProvider;
import campus.jdbc.JdbcSchema;
import campus.jdbc.outbox.AbstractJdbcOutboxStore;
import campus.jdbc.outbox.JdbcOffsetStore;
import campus.jdbc.outbox.JdbcOutboxStores;
import campus.jdbc.repository.JdbcRegistrationRepository;
import campus.jdbc.repository.JdbcStaffInvitationRepository;
import campus.jdbc.repository.JdbcStaffRepository;
import campus.jdbc.repository.JdbcStudentRepository;
import campus.jdbc.repository.JdbcUserRepository;
import campus.mail.MailHandlers;
import campus.mail.StudentWelcomeMailHandler;
import campus.outbox.OutboxPublisher;
import campus.processor.EventHandler;
import campus.processor.EventProcessor;
import campus.processor.ExponentialBackoffRetryPolicy;
import campus.processor.HandlerGroup;
import campus.processor.HandlerRegistry;
import campus.registration.RegistrationPolicy;
import campus.registration.RegistrationRepository;
import campus.spi.ConnectionProvider;
import campus.spi.MailSender;
import campus.spi.MetricsExporter;
import campus.spi.OffsetStore;
import campus.spi.PasswordHasher;
import campus.spi.Transactions;
import campus.spi.TxContext;
import campus.spring.SpringTransactions;
import campus.spring.SpringTxContext;
import campus.user.StaffRepository;
import campus.user.StudentRepository;
import campus.user.UserRepository;
import io.opentelemetry.api.OpenTelemetry;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration of the campus identity services.
 *
 * <p>Wires the outbox, the JDBC repositories and the application services from a
 * {@link DataSource} and {@link CampusProperties}. Every {@link EventHandler} and
 * {@link HandlerGroup} bean is registered with the {@link EventProcessor}, which starts
 * and stops with the context. Mail handlers are added when a {@link MailSender} bean
 * exists.
 *
 * @see CampusProperties
 * @see CampusMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(EventProcessor.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CampusProperties.class)
public class CampusAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock campusClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventTypeRegistry eventTypeRegistry() {
    return CampusEvents.registry();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventCodec eventCodec(EventTypeRegistry eventTypes) {
    return new JacksonEventCodec(eventTypes);
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcOutboxStore outboxStore(DataSource dataSource, CampusProperties props) {
    // Every repository and the processor depend on the store, so the tables exist first.
    if (props.getSchema().isInitialize()) {
      JdbcSchema.initialize(dataSource);
    }
    CampusProperties.Outbox outbox = props.getOutbox();
    return JdbcOutboxStores.detect(dataSource, outbox.getTableName(), outbox.getStreamTableName());
  }

  @Bean
  @ConditionalOnMissingBean(OffsetStore.class)
  public JdbcOffsetStore offsetStore(CampusProperties props, Clock clock) {
    return new JdbcOffsetStore(props.getOutbox().getOffsetTableName(), clock);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(Transactions.class)
  public SpringTransactions transactions(DataSource dataSource, PlatformTransactionManager transactionManager) {
    return new SpringTransactions(dataSource, transactionManager);
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboxPublisher outboxPublisher(
      TxContext txContext,
      AbstractJdbcOutboxStore outboxStore,
      EventCodec codec,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return new OutboxPublisher(txContext, outboxStore, codec, metricsProvider.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public RegistrationPolicy registrationPolicy(CampusProperties props) {
    CampusProperties.Registration r = props.getRegistration();
    return new RegistrationPolicy(r.getCodeTtl(), r.getResendCooldown(), r.getMaxAttempts(), r.getCodeLength());
  }

  @Bean
  @ConditionalOnMissingBean(PasswordHasher.class)
  public Argon2PasswordHasher passwordHasher() {
    return Argon2PasswordHasher.withDefaults();
  }

  @Bean
  @ConditionalOnMissingBean(RegistrationRepository.class)
  public JdbcRegistrationRepository registrationRepository(
      Transactions transactions, TxContext txContext, OutboxPublisher publisher,
      RegistrationPolicy policy, Clock clock) {
    return new JdbcRegistrationRepository(transactions, txContext, publisher, policy, clock);
  }

  @Bean
  @ConditionalOnMissingBean(StaffInvitationRepository.class)
  public JdbcStaffInvitationRepository staffInvitationRepository(
      Transactions transactions, TxContext txContext, OutboxPublisher publisher, Clock clock) {
    return new JdbcStaffInvitationRepository(
        transactions, txContext, publisher, JacksonEventCodec.defaultMapper(), clock);
  }

  @Bean
  @ConditionalOnMissingBean(UserRepository.class)
  public JdbcUserRepository userRepository(
      Transactions transactions, TxContext txContext, OutboxPublisher publisher, Clock clock) {
    return new JdbcUserRepository(transactions, txContext, publisher, clock);
  }

  @Bean
  @ConditionalOnMissingBean(StudentRepository.class)
  public JdbcStudentRepository studentRepository(
      Transactions transactions, TxContext txContext, OutboxPublisher publisher, Clock clock) {
    return new JdbcStudentRepository(transactions, txContext, publisher, clock);
  }

  @Bean
  @ConditionalOnMissingBean(StaffRepository.class)
  public JdbcStaffRepository staffRepository(
      Transactions transactions, TxContext txContext, OutboxPublisher publisher, Clock clock) {
    return new JdbcStaffRepository(transactions, txContext, publisher, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RegistrationService registrationService(
      RegistrationRepository registrations,
      UserRepository users,
      PasswordHasher passwordHasher,
      RegistrationPolicy policy,
      Clock clock) {
    return new RegistrationService(registrations, users, passwordHasher, policy, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public StaffInvitationService staffInvitationService(
      StaffInvitationRepository invitations,
      UserRepository users,
      StaffRepository staffRepository,
      PasswordHasher passwordHasher,
      Clock clock) {
    return new StaffInvitationService(invitations, users, staffRepository, passwordHasher, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public UserService userService(UserRepository users) {
    return new UserService(users);
  }

  @Bean
  @ConditionalOnMissingBean
  public RegistrationCompletedHandler registrationCompletedHandler(
      UserRepository users, StudentRepository students, StaffRepository staff, Clock clock) {
    return new RegistrationCompletedHandler(users, students, staff, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public HandlerRegistry handlerRegistry(
      EventTypeRegistry eventTypes,
      ObjectProvider<EventHandler<?>> handlers,
      ObjectProvider<HandlerGroup> groups) {
    HandlerRegistry registry = new HandlerRegistry(eventTypes);
    handlers.orderedStream().forEach(registry::register);
    groups.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "campus.processor", name = "enabled", matchIfMissing = true)
  public EventProcessor eventProcessor(
      CampusProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcOutboxStore outboxStore,
      OffsetStore offsetStore,
      EventCodec codec,
      HandlerRegistry handlers,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<OpenTelemetry> openTelemetryProvider) {
    CampusProperties.Processor p = props.getProcessor();
    CampusProperties.Retry retry = props.getRetry();
    EventProcessor.Builder builder = EventProcessor.builder()
        .connectionProvider(connectionProvider)
        .outboxStore(outboxStore)
        .offsetStore(offsetStore)
        .codec(codec)
        .handlers(handlers)
        .retryPolicy(new ExponentialBackoffRetryPolicy(retry.getBaseDelay(), retry.getMaxDelay()))
        .batchSize(p.getBatchSize())
        .intervalMs(p.getInterval().toMillis())
        .drainTimeoutMs(p.getDrainTimeout().toMillis());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    OpenTelemetry openTelemetry = openTelemetryProvider.getIfAvailable();
    if (openTelemetry != null) {
      builder.tracer(openTelemetry.getTracer("campus.processor"));
    }
    return builder.build();
  }

  /**
   * Mail handlers, registered as consumer groups of their own.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnBean(MailSender.class)
  static class MailHandlerConfiguration {

    @Bean
    public HandlerGroup registrationMailHandlers(MailSender mailSender) {
      return MailHandlers.registration(mailSender);
    }

    @Bean
    public HandlerGroup invitationMailHandlers(MailSender mailSender, CampusProperties props) {
      return MailHandlers.invitation(mailSender, props.getMail().getInvitationBaseUrl());
    }

    @Bean
    public StudentWelcomeMailHandler studentWelcomeMailHandler(MailSender mailSender) {
      return new StudentWelcomeMailHandler(mailSender);
    }
  }
}
