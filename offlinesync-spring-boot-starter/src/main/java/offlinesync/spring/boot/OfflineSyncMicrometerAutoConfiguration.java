package offlinesync.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import offlinesync.micrometer.MicrometerMetricsExporter;
import offlinesync.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code offlinesync.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link OfflineSyncAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the composite.
 */
@AutoConfiguration(before = OfflineSyncAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "offlinesync.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(OfflineSyncProperties.class)
public class OfflineSyncMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, OfflineSyncProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
