package io.campaign.spring.boot;

import io.campaign.CampaignJobs;
import io.campaign.JobSubmitter;
import io.campaign.dead.DeadJobManager;
import io.campaign.dispatch.ExponentialBackoffRetryPolicy;
import io.campaign.dispatch.RetryPolicy;
import io.campaign.jdbc.DataSourceConnectionProvider;
import io.campaign.jdbc.dialect.Dialects;
import io.campaign.jdbc.JdbcStores;
import io.campaign.notify.DefaultNotifierRegistry;
import io.campaign.notify.LoggingNotifier;
import io.campaign.notify.Notifier;
import io.campaign.notify.NotifierRegistry;
import io.campaign.recipient.RecipientDirectory;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.logging.Logger;

/**
 * Auto-configuration for the campaign dispatch pipeline.
 *
 * <p>Wires a {@link CampaignJobs} composite from a {@link DataSource} and
 * {@link CampaignProperties}, and exposes its submitter, directory and dead-job manager as
 * beans. Every {@link Notifier} bean is registered under its channel; when none serves
 * the default channel, messages on it are only logged.
 *
 * @see CampaignProperties
 * @see CampaignMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(CampaignJobs.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CampaignProperties.class)
public class CampaignAutoConfiguration {
  private static final Logger logger = Logger.getLogger(CampaignAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public JdbcStores campaignStores(DataSource dataSource, CampaignProperties props) {
    return JdbcStores.create(Dialects.detect(dataSource), props.getJobTable(), null);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public NotifierRegistry notifierRegistry(CampaignProperties props, ObjectProvider<Notifier> notifiers) {
    String defaultChannel = props.getNotifier().getDefaultChannel();
    DefaultNotifierRegistry registry = new DefaultNotifierRegistry(defaultChannel);
    notifiers.orderedStream().forEach(registry::register);
    if (registry.notifierFor(defaultChannel) == null) {
      logger.info("No Notifier bean for channel=" + defaultChannel + "; messages will only be logged");
      registry.register(new LoggingNotifier(defaultChannel));
    }
    return registry;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public CampaignJobs campaignJobs(CampaignProperties props,
      ConnectionProvider connectionProvider,
      JdbcStores stores,
      NotifierRegistry notifierRegistry,
      ObjectProvider<MetricsExporter> metricsProvider) {

    CampaignProperties.Dispatcher dispatcher = props.getDispatcher();
    RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(
        props.getRetry().getBaseDelay().toMillis(), props.getRetry().getMaxDelay().toMillis());

    var builder = CampaignJobs.builder()
        .connectionProvider(connectionProvider)
        .recipientStore(stores.recipients())
        .groupStore(stores.groups())
        .campaignStore(stores.campaigns())
        .jobStore(stores.jobs())
        .notifierRegistry(notifierRegistry)
        .retryPolicy(retryPolicy)
        .workerCount(dispatcher.getWorkerCount())
        .hotQueueCapacity(dispatcher.getHotQueueCapacity())
        .coldQueueCapacity(dispatcher.getColdQueueCapacity())
        .maxAttempts(dispatcher.getMaxAttempts())
        .jobTimeout(dispatcher.getJobTimeout())
        .drainTimeoutMs(dispatcher.getDrainTimeout().toMillis())
        .sendConcurrency(props.getSend().getConcurrency())
        .sendTimeout(props.getSend().getTimeout())
        .intervalMs(props.getPoller().getInterval().toMillis())
        .batchSize(props.getPoller().getBatchSize())
        .skipRecent(props.getPoller().getSkipRecent());
    if (props.getOwnerId() != null && !props.getOwnerId().isEmpty()) {
      builder.ownerId(props.getOwnerId());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobSubmitter jobSubmitter(CampaignJobs campaignJobs) {
    return campaignJobs.submitter();
  }

  @Bean
  @ConditionalOnMissingBean
  public RecipientDirectory recipientDirectory(CampaignJobs campaignJobs) {
    return campaignJobs.recipients();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadJobManager deadJobManager(CampaignJobs campaignJobs) {
    return campaignJobs.deadJobs();
  }
}
