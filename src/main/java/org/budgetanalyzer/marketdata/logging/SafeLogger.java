package org.budgetanalyzer.marketdata.logging;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.introspect.Annotated;
import com.fasterxml.jackson.databind.introspect.JacksonAnnotationIntrospector;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Renders objects as pretty-printed JSON for log output, masking values annotated with {@link
 * Sensitive}.
 *
 * <p>Never throws: an object that cannot be serialized is rendered through {@code toString()}.
 */
public final class SafeLogger {

  private static final String MASK = "********";

  private static final ObjectMapper objectMapper =
      JsonMapper.builder()
          .findAndAddModules()
          .annotationIntrospector(new SensitiveAnnotationIntrospector())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .build();

  private SafeLogger() {}

  /**
   * Serializes an object to JSON with sensitive values masked.
   *
   * @param value the object to render
   * @return JSON text, or {@code String.valueOf(value)} if serialization fails
   */
  public static String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      return String.valueOf(value);
    }
  }

  static String mask(String value, int showLast) {
    if (value == null || value.isEmpty()) {
      return value;
    }

    if (showLast <= 0 || showLast >= value.length()) {
      return MASK;
    }

    return MASK + value.substring(value.length() - showLast);
  }

  private static final class SensitiveAnnotationIntrospector extends JacksonAnnotationIntrospector {

    @Override
    public Object findSerializer(Annotated annotated) {
      var sensitive = annotated.getAnnotation(Sensitive.class);
      if (sensitive != null) {
        return new MaskingSerializer(sensitive.showLast());
      }

      return super.findSerializer(annotated);
    }
  }

  private static final class MaskingSerializer extends JsonSerializer<Object> {

    private final int showLast;

    private MaskingSerializer(int showLast) {
      this.showLast = showLast;
    }

    @Override
    public void serialize(Object value, JsonGenerator generator, SerializerProvider provider)
        throws IOException {
      generator.writeString(mask(String.valueOf(value), showLast));
    }
  }
}
