package kvstore.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import kvstore.micrometer.MicrometerMetricsExporter;
import kvstore.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * with a {@link MeterRegistry} bean and {@code kvstore.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link KvStoreAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for the timeout manager.
 */
@AutoConfiguration(before = KvStoreAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "kvstore.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(KvStoreProperties.class)
public class KvStoreMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, KvStoreProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
