package ca.gc.cra.strata.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Exporter selection follows the standard OpenTelemetry variables: {@code otel.metrics.exporter} /
 * {@code OTEL_METRICS_EXPORTER} ({@code otlp} or {@code none}), {@code otel.exporter.otlp.endpoint} /
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}, and {@code otel.resource.attributes} / {@code OTEL_RESOURCE_ATTRIBUTES}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.strata";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long FLUSH_TIMEOUT_SECONDS = 5;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {}

  /**
   * Builds a provider from system properties and environment variables; falls back to no-op on failure.
   */
  static BootstrapResult initialize() {
    return initialize(key -> System.getProperty(key.toLowerCase(Locale.ROOT).replace('_', '.')), System.getenv());
  }

  static BootstrapResult initialize(Function<String, String> properties, Map<String, String> env) {
    try {
      Settings settings = Settings.resolve(properties, env);
      if (!settings.exportEnabled()) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader, settings.extraAttributes());
      log.info("OpenTelemetry metrics exporting over OTLP to {}", settings.endpoint());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  /**
   * Builds a provider bound to a caller-supplied reader, typically an in-memory reader in tests.
   */
  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extraAttributes) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version, extraAttributes))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  private static Resource resource(String version, Attributes extraAttributes) {
    AttributesBuilder attributes = Attributes.builder()
        .put(SERVICE_NAME, "strata")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .put(SERVICE_INSTANCE_ID, instanceId());
    return Resource.getDefault()
        .merge(Resource.create(attributes.build()))
        .merge(Resource.create(extraAttributes));
  }

  private static String instanceId() {
    String runtimeName = ManagementFactory.getRuntimeMXBean().getName();
    return (runtimeName == null || runtimeName.isBlank()) ? "unknown" : runtimeName;
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return (version == null || version.isBlank()) ? "0.0.0-dev" : version;
  }

  private record Settings(boolean exportEnabled, String endpoint, Attributes extraAttributes) {
    static Settings resolve(Function<String, String> properties, Map<String, String> env) {
      String exporter = firstNonBlank(properties.apply("OTEL_METRICS_EXPORTER"), env.get("OTEL_METRICS_EXPORTER"), "otlp")
          .toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        log.warn("Unknown OTEL_METRICS_EXPORTER value '{}'; defaulting to otlp", exporter);
        exporter = "otlp";
      }
      String endpoint = firstNonBlank(
          properties.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), env.get("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
      String attributes = firstNonBlank(
          properties.apply("OTEL_RESOURCE_ATTRIBUTES"), env.get("OTEL_RESOURCE_ATTRIBUTES"), "");
      return new Settings(exporter.equals("otlp"), endpoint, parseAttributes(attributes));
    }

    private static Attributes parseAttributes(String raw) {
      AttributesBuilder builder = Attributes.builder();
      for (String token : raw.split(",")) {
        String trimmed = token.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        int idx = trimmed.indexOf('=');
        String key = idx > 0 ? trimmed.substring(0, idx).trim() : "";
        String value = idx > 0 ? trimmed.substring(idx + 1).trim() : "";
        if (key.isEmpty() || value.isEmpty()) {
          log.warn("Ignoring malformed OTEL_RESOURCE_ATTRIBUTES entry: {}", trimmed);
          continue;
        }
        builder.put(AttributeKey.stringKey(key), value);
      }
      return builder.build();
    }

    private static String firstNonBlank(String first, String second, String fallback) {
      if (first != null && !first.isBlank()) {
        return first.trim();
      }
      if (second != null && !second.isBlank()) {
        return second.trim();
      }
      return fallback;
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String operation) {
      result.join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {} s", operation, FLUSH_TIMEOUT_SECONDS);
      }
    }
  }
}
