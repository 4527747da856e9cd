package kvstore.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import kvstore.micrometer.MicrometerMetricsExporter;
import kvstore.spi.MetricsExporter;
import kvstore.timeout.TimeoutManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KvStoreMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(KvStoreMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @TempDir
    Path dir;

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("kvstore.metrics.name-prefix=chat.kv").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("chat.kv.timeout.scheduled").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("kvstore.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void skippedWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(KvStoreMicrometerAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void timeoutManagerReportsToRegistry() {
        runner.withConfiguration(AutoConfigurations.of(KvStoreAutoConfiguration.class))
                .withPropertyValues("kvstore.file.path=" + dir)
                .run(ctx -> {
                    var manager = ctx.getBean(TimeoutManager.class);
                    manager.registerTimeout("later", record -> { });
                    manager.addTimeout("later", 60_000, null);

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.find("kvstore.timeout.scheduled").counter().count());
                    assertEquals(1.0, registry.find("kvstore.timeout.armed").gauge().value());
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
