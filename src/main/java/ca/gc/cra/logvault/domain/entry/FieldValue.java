package ca.gc.cra.logvault.domain.entry;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Closed set of value types a structured field may carry.
 * <p><strong>Why:</strong> Keeps serialization deterministic; formatters switch over a fixed set of shapes
 * instead of reflecting over arbitrary objects.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface FieldValue
    permits FieldValue.Text,
        FieldValue.Int,
        FieldValue.Decimal,
        FieldValue.Bool,
        FieldValue.Elapsed,
        FieldValue.Failure,
        FieldValue.Nested {

  /**
   * Returns a human readable rendering used by the text formatter and diagnostics.
   *
   * @return display string
   */
  String display();

  /**
   * Converts an arbitrary caller value into the closest variant.
   *
   * <p>Integral numbers map to {@link Int}, other numbers to {@link Decimal}, {@link Duration} to
   * {@link Elapsed}, {@link Throwable} to {@link Failure}, maps to {@link Nested}; everything else is
   * rendered through {@link Object#toString()}.</p>
   *
   * @param value caller value; {@code null} becomes the text {@code null}
   * @return field value
   */
  static FieldValue from(Object value) {
    if (value == null) {
      return new Text("null");
    }
    if (value instanceof FieldValue field) {
      return field;
    }
    if (value instanceof CharSequence text) {
      return new Text(text.toString());
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte
        || value instanceof AtomicLong
        || value instanceof AtomicInteger) {
      return new Int(((Number) value).longValue());
    }
    if (value instanceof BigInteger big) {
      return big.bitLength() < Long.SIZE ? new Int(big.longValue()) : new Text(big.toString());
    }
    if (value instanceof Number number) {
      return new Decimal(number.doubleValue());
    }
    if (value instanceof Boolean bool) {
      return new Bool(bool);
    }
    if (value instanceof Duration duration) {
      return new Elapsed(duration);
    }
    if (value instanceof Throwable error) {
      return Failure.of(error);
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, FieldValue> nested = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        nested.put(String.valueOf(entry.getKey()), from(entry.getValue()));
      }
      return new Nested(nested);
    }
    return new Text(value.toString());
  }

  /** Plain string value. */
  record Text(String value) implements FieldValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value;
    }
  }

  /** Signed 64-bit integer value. */
  record Int(long value) implements FieldValue {
    @Override
    public String display() {
      return Long.toString(value);
    }
  }

  /** Double precision value. */
  record Decimal(double value) implements FieldValue {
    @Override
    public String display() {
      return Double.toString(value);
    }
  }

  /** Boolean value. */
  record Bool(boolean value) implements FieldValue {
    @Override
    public String display() {
      return Boolean.toString(value);
    }
  }

  /** Elapsed time, rendered in ISO-8601 form. */
  record Elapsed(Duration value) implements FieldValue {
    public Elapsed {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value.toString();
    }

    /**
     * Returns the duration in fractional milliseconds.
     *
     * @return milliseconds
     */
    public double millis() {
      return value.toNanos() / 1_000_000d;
    }
  }

  /**
   * Error captured from a {@link Throwable}; only the type and message are retained.
   *
   * @param type fully qualified exception class name
   * @param message exception message; empty when absent
   */
  record Failure(String type, String message) implements FieldValue {
    public Failure {
      Objects.requireNonNull(type, "type");
      message = message == null ? "" : message;
    }

    /**
     * Captures a throwable.
     *
     * @param error source throwable; must not be {@code null}
     * @return failure value
     */
    public static Failure of(Throwable error) {
      Objects.requireNonNull(error, "error");
      return new Failure(error.getClass().getName(), error.getMessage());
    }

    @Override
    public String display() {
      return message.isEmpty() ? type : type + ": " + message;
    }
  }

  /** Ordered nested map of fields. */
  record Nested(Map<String, FieldValue> values) implements FieldValue {
    public Nested {
      Objects.requireNonNull(values, "values");
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String display() {
      StringBuilder builder = new StringBuilder("{");
      boolean first = true;
      for (Map.Entry<String, FieldValue> entry : values.entrySet()) {
        if (!first) {
          builder.append(", ");
        }
        builder.append(entry.getKey()).append('=').append(entry.getValue().display());
        first = false;
      }
      return builder.append('}').toString();
    }
  }
}
