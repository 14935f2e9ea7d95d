package com.pgstress.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.AutoConfigureBefore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

import jakarta.annotation.PreDestroy;
import java.util.List;

/**
 * Metrics tagging and JVM GC binding for stress runs.
 *
 * <p>The {@code application} and {@code target} tags let runs against different
 * clusters share one metrics backend.
 */
@Configuration
@AutoConfigureBefore(name = "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration")
@ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
public class MetricsConfig {

    private JvmGcMetrics jvmGcMetrics;

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public MeterFilter commonTagsMeterFilter(WorkloadConfiguration configuration) {
        return MeterFilter.commonTags(List.of(
            Tag.of("application", "pg-stress-test"),
            Tag.of("target", configuration.host() + ":" + configuration.port())
        ));
    }

    /**
     * Binds GC pause metrics.
     *
     * @return the meter registry customizer
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> gcMetricsCustomizer() {
        return registry -> {
            jvmGcMetrics = new JvmGcMetrics();
            jvmGcMetrics.bindTo(registry);
        };
    }

    @PreDestroy
    public void closeJvmGcMetrics() {
        if (jvmGcMetrics != null) {
            jvmGcMetrics.close();
        }
    }
}
