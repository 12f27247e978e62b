package ca.gc.cra.logvault.infrastructure.format;

import ca.gc.cra.logvault.application.port.EntryFormatter;
import ca.gc.cra.logvault.domain.entry.FieldValue;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/**
 * Renders entries as single-line JSON objects using Jackson's streaming generator.
 *
 * <p>Top-level keys come first ({@code timestamp}, {@code level}, {@code message}, {@code component},
 * {@code caller}), followed by the entry fields in insertion order.</p>
 *
 * @since 0.1.0
 */
public final class JsonEntryFormatter implements EntryFormatter {
  private static final int INITIAL_BUFFER = 256;

  private final JsonFactory jsonFactory = new JsonFactory();

  @Override
  public byte[] format(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    ByteArrayOutputStream out = new ByteArrayOutputStream(INITIAL_BUFFER);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField(EntryLayout.TIMESTAMP, EntryLayout.timestamp(entry));
      gen.writeStringField(EntryLayout.LEVEL, entry.level().label());
      gen.writeStringField(EntryLayout.MESSAGE, entry.message());
      if (EntryLayout.writeComponent(entry)) {
        gen.writeStringField(EntryLayout.COMPONENT, entry.component());
      }
      if (entry.sourceLocation() != null) {
        gen.writeStringField(EntryLayout.CALLER, entry.sourceLocation());
      }
      for (Map.Entry<String, FieldValue> field : entry.fields().entrySet()) {
        gen.writeFieldName(EntryLayout.fieldKey(field.getKey()));
        writeValue(gen, field.getValue());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize log entry", ex);
    }
    out.write('\n');
    return out.toByteArray();
  }

  private static void writeValue(JsonGenerator gen, FieldValue value) throws IOException {
    if (value instanceof FieldValue.Text text) {
      gen.writeString(text.value());
    } else if (value instanceof FieldValue.Int number) {
      gen.writeNumber(number.value());
    } else if (value instanceof FieldValue.Decimal number) {
      gen.writeNumber(number.value());
    } else if (value instanceof FieldValue.Bool bool) {
      gen.writeBoolean(bool.value());
    } else if (value instanceof FieldValue.Nested nested) {
      gen.writeStartObject();
      for (Map.Entry<String, FieldValue> child : nested.values().entrySet()) {
        gen.writeFieldName(child.getKey());
        writeValue(gen, child.getValue());
      }
      gen.writeEndObject();
    } else {
      gen.writeString(value.display());
    }
  }
}
