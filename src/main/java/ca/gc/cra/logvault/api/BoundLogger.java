package ca.gc.cra.logvault.api;

import ca.gc.cra.logvault.application.metrics.MetricsSnapshot;
import ca.gc.cra.logvault.domain.entry.EntryKind;
import ca.gc.cra.logvault.domain.entry.FieldValue;
import ca.gc.cra.logvault.domain.entry.Fields;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view over a {@link LogEngine} carrying bound fields, a component and an optional tag.
 */
final class BoundLogger implements StructuredLogger {
  private final LogEngine engine;
  private final Map<String, FieldValue> fields;
  private final String component;
  private final EntryKind kind;

  BoundLogger(LogEngine engine, Map<String, FieldValue> fields, String component, EntryKind kind) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.fields = Objects.requireNonNull(fields, "fields");
    this.component = component;
    this.kind = kind;
  }

  Map<String, FieldValue> fields() {
    return fields;
  }

  String component() {
    return component;
  }

  /** Tag set by {@link #asAccess()} or {@link #asMetrics()}; {@code null} when untagged. */
  EntryKind kind() {
    return kind;
  }

  @Override
  public void emit(LogLevel level, String message, Map<String, ?> callFields) {
    engine.dispatch(this, level, message, callFields);
  }

  @Override
  public boolean isEnabled(LogLevel level) {
    return engine.isEnabled(level);
  }

  @Override
  public StructuredLogger withFields(Map<String, ?> extra) {
    Map<String, FieldValue> converted = Fields.of(extra);
    if (converted.isEmpty()) {
      return this;
    }
    return new BoundLogger(engine, Fields.merge(fields, converted), component, kind);
  }

  @Override
  public StructuredLogger withComponent(String name) {
    return new BoundLogger(engine, fields, name, kind);
  }

  @Override
  public StructuredLogger asAccess() {
    return new BoundLogger(engine, fields, component, EntryKind.ACCESS);
  }

  @Override
  public StructuredLogger asMetrics() {
    return new BoundLogger(engine, fields, component, EntryKind.METRICS);
  }

  @Override
  public void flush() throws IOException {
    engine.flush();
  }

  @Override
  public void close() throws IOException {
    engine.close();
  }

  @Override
  public MetricsSnapshot metricsSnapshot() {
    return engine.metricsSnapshot();
  }
}
