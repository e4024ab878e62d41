package edu.washington.escience.carryover.api;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.joda.JodaModule;

/**
 * This class holds the single JSON {@link ObjectMapper} used to read and write plan encodings.
 */
public final class CarryoverJsonMapperProvider {
  /** Only create this object once, and share it. */
  private static final ObjectMapper MAPPER = newMapper();

  /** Utility classes cannot be constructed. */
  private CarryoverJsonMapperProvider() {}

  /**
   * @return An {@link ObjectReader} that fits Carryover's customizations.
   */
  public static ObjectReader getReader() {
    return MAPPER.reader();
  }

  /**
   * @return An {@link ObjectWriter} that fits Carryover's customizations.
   */
  public static ObjectWriter getWriter() {
    return MAPPER.writer();
  }

  /**
   * Create the standard Carryover custom ObjectMapper.
   *
   * @return the standard Carryover custom ObjectMapper.
   */
  private static ObjectMapper newMapper() {
    ObjectMapper mapper = new ObjectMapper();

    /* Serialize DateTimes as Strings */
    mapper.registerModule(new JodaModule());
    /* Serialize Guava types correctly */
    mapper.registerModule(new GuavaModule());

    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    /* Don't automatically detect getters, explicit is better than implicit. */
    mapper.setVisibility(PropertyAccessor.GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.IS_GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.SETTER, Visibility.NONE);

    return mapper;
  }
}
