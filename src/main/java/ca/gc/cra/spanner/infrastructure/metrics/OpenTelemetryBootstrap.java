package ca.gc.cra.spanner.infrastructure.metrics;

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
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider behind {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Exporter selection comes from {@link MetricsSettings}; extra resource attributes come from
 * {@code OTEL_RESOURCE_ATTRIBUTES}. Any failure while building the provider degrades to a noop meter.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.spanner";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize(MetricsSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.exporter() == MetricsSettings.Exporter.NONE) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader =
          PeriodicMetricReader.builder(exporter).setInterval(settings.interval()).build();
      BootstrapResult result = withReader(reader, System.getenv("OTEL_RESOURCE_ATTRIBUTES"));
      log.info("OpenTelemetry metrics exporting to {} every {}", settings.endpoint(), settings.interval());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop meter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return withReader(Objects.requireNonNull(reader, "reader"), null);
  }

  private static BootstrapResult withReader(MetricReader reader, String resourceAttributes) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version, parseResourceAttributes(resourceAttributes)))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new BootstrapResult(meter, provider);
  }

  private static Resource resource(String version, Attributes additional) {
    Attributes base = Attributes.builder()
        .put(SERVICE_NAME, "spanner")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .build();
    return Resource.getDefault().merge(Resource.create(base)).merge(Resource.create(additional));
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        if (!trimmed.isEmpty()) {
          log.warn("Ignoring malformed OTEL_RESOURCE_ATTRIBUTES entry: {}", trimmed);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? "0.0.0-dev" : impl;
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
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
