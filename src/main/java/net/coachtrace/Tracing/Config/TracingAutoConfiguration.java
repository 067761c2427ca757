package net.coachtrace.Tracing.Config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import net.coachtrace.Tracing.Aspect.TracedOperationAspect;
import net.coachtrace.Tracing.Backend.OpenTelemetryBackendClient;
import net.coachtrace.Tracing.Backend.TracingBackendClientFactory;
import net.coachtrace.Tracing.Context.TraceContextStore;
import net.coachtrace.Tracing.Flush.BackoffCalculator;
import net.coachtrace.Tracing.Flush.FlushController;
import net.coachtrace.Tracing.Headers.TraceContextFilter;
import net.coachtrace.Tracing.Headers.TraceHeaderCodec;
import net.coachtrace.Tracing.Metrics.MicrometerTracingMetricsRecorder;
import net.coachtrace.Tracing.Metrics.NoOpTracingMetricsRecorder;
import net.coachtrace.Tracing.Metrics.TracingMetricsRecorder;
import net.coachtrace.Tracing.Sampling.SamplingEngine;
import net.coachtrace.Tracing.Sampling.SamplingRuleLoader;
import net.coachtrace.Tracing.TraceRegistry;
import net.coachtrace.Tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.core.Ordered;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Auto-configuration for the tracing layer.
 * Provides default beans that users can override if needed.
 *
 * Register a TracingBackendClientFactory bean to send telemetry somewhere other than
 * OpenTelemetry. Tracing itself can be switched off with coachtrace.tracing.enabled=false,
 * in which case TracingService stays a safe no-op.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableAspectJAutoProxy
@EnableConfigurationProperties(TracingProperties.class)
public class TracingAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(TracingAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TraceContextStore traceContextStore() {
        return new TraceContextStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceHeaderCodec traceHeaderCodec() {
        return new TraceHeaderCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceRegistry traceRegistry() {
        return new TraceRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public TracingMetricsRecorder tracingMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            logger.debug("no MeterRegistry found, tracing metrics disabled");
            return new NoOpTracingMetricsRecorder();
        }
        return new MicrometerTracingMetricsRecorder(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public SamplingRuleLoader samplingRuleLoader(ObjectProvider<ObjectMapper> objectMapper,
                                                 ResourceLoader resourceLoader) {
        return new SamplingRuleLoader(objectMapper.getIfAvailable(TracingAutoConfiguration::defaultObjectMapper), resourceLoader);
    }

    @Bean
    @ConditionalOnMissingBean
    public SamplingEngine samplingEngine(TracingProperties properties, SamplingRuleLoader samplingRuleLoader) {
        double rate = properties.getSamplingRate();
        if (Double.isNaN(rate) || rate < 0 || rate > 1) {
            logger.warn("invalid coachtrace.tracing.sampling-rate {}, using {}", rate, TracingConfig.DEFAULT_SAMPLING_RATE);
            rate = TracingConfig.DEFAULT_SAMPLING_RATE;
        }
        return new SamplingEngine(rate, samplingRuleLoader.load(properties.getSampling()));
    }

    /*
     * TaskScheduler for flush retries
     */
    @Bean
    @ConditionalOnMissingBean(name = "tracingFlushScheduler")
    public TaskScheduler tracingFlushScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("coachtrace-flush-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(1);
        scheduler.setErrorHandler(t ->
                LoggerFactory.getLogger("coachtrace-flush-scheduler")
                        .error("scheduler error: {}", t.getMessage(), t)
        );
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public FlushController flushController(@Qualifier("tracingFlushScheduler") TaskScheduler tracingFlushScheduler,
                                           BackoffCalculator backoffCalculator,
                                           TracingMetricsRecorder tracingMetricsRecorder) {
        return new FlushController(tracingFlushScheduler, backoffCalculator, tracingMetricsRecorder);
    }

    /**
     * Default backend: spans on the application's OpenTelemetry instance, or the global one.
     * forceFlush is only available when an SdkTracerProvider bean exists.
     */
    @Bean
    @ConditionalOnMissingBean
    public TracingBackendClientFactory tracingBackendClientFactory(ObjectProvider<OpenTelemetry> openTelemetry,
                                                                   ObjectProvider<SdkTracerProvider> sdkTracerProvider,
                                                                   ObjectProvider<ObjectMapper> objectMapper) {
        return config -> {
            logger.info("creating OpenTelemetry tracing backend for project {}", config.getProjectName());
            return new OpenTelemetryBackendClient(
                    openTelemetry.getIfAvailable(GlobalOpenTelemetry::get),
                    sdkTracerProvider.getIfAvailable(),
                    objectMapper.getIfAvailable(TracingAutoConfiguration::defaultObjectMapper));
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public TracingService tracingService(TracingProperties properties,
                                         TracingBackendClientFactory tracingBackendClientFactory,
                                         SamplingEngine samplingEngine,
                                         TraceContextStore traceContextStore,
                                         TraceHeaderCodec traceHeaderCodec,
                                         FlushController flushController,
                                         TraceRegistry traceRegistry,
                                         TracingMetricsRecorder tracingMetricsRecorder) {
        return new TracingService(properties, tracingBackendClientFactory, samplingEngine, traceContextStore,
                traceHeaderCodec, flushController, traceRegistry, tracingMetricsRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    public TracedOperationAspect tracedOperationAspect(TracingService tracingService,
                                                       TraceContextStore traceContextStore) {
        return new TracedOperationAspect(tracingService, traceContextStore);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.web.filter.OncePerRequestFilter")
    @ConditionalOnProperty(prefix = "coachtrace.tracing.http-filter", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    static class TraceContextFilterConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "traceContextFilterRegistration")
        public FilterRegistrationBean<TraceContextFilter> traceContextFilterRegistration(TraceHeaderCodec traceHeaderCodec,
                                                                                         TraceContextStore traceContextStore) {
            FilterRegistrationBean<TraceContextFilter> registration =
                    new FilterRegistrationBean<>(new TraceContextFilter(traceHeaderCodec, traceContextStore));
            registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
            registration.addUrlPatterns("/*");
            return registration;
        }
    }

    // used when the application has no ObjectMapper bean
    private static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
