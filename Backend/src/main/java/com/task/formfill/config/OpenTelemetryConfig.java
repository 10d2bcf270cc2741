package com.task.formfill.config;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

@Configuration
public class OpenTelemetryConfig {

    private static final Logger log = LoggerFactory.getLogger(OpenTelemetryConfig.class);

    @Value("${tracing.enabled:true}")
    private boolean enabled;

    @Value("${tracing.endpoint:https://cloud.langfuse.com/api/public/otel}")
    private String endpoint;

    @Value("${tracing.public-key:}")
    private String publicKey;

    @Value("${tracing.secret-key:}")
    private String secretKey;

    @Bean
    public OpenTelemetry openTelemetry() {
        if (!enabled || publicKey.isBlank() || secretKey.isBlank()) {
            log.info("Tracing export disabled, using no-op OpenTelemetry");
            return OpenTelemetry.noop();
        }
        try {
            log.info("Initializing OpenTelemetry with endpoint: {}", endpoint);

            String credentials = publicKey + ":" + secretKey;
            String basicAuth = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));

            OtlpHttpSpanExporter exporter = OtlpHttpSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .addHeader("Authorization", basicAuth)
                    .build();

            Resource resource = Resource.getDefault().toBuilder()
                    .put(AttributeKey.stringKey("service.name"), "formfill")
                    .build();

            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
                    .setResource(resource)
                    .build();

            return OpenTelemetrySdk.builder()
                    .setTracerProvider(provider)
                    .build();
        } catch (RuntimeException e) {
            log.warn("OpenTelemetry initialization failed, falling back to noop: {}", e.getMessage());
            return GlobalOpenTelemetry.get();
        }
    }

    @Bean
    public Tracer tracer(OpenTelemetry otel) {
        return otel.getTracer("com.task.formfill");
    }
}
