package edu.washington.escience.carryover.api.encoding;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Base class of the JSON encodings. Encodings are plain objects with public fields filled in by Jackson; fields marked
 * {@link Required} must be present, anything else is checked by {@link #validateExtra()}.
 */
public abstract class CarryoverEncoding {

  /**
   * @return names of the {@link Required} fields that are null.
   * @throws InvalidEncodingException if a field cannot be read.
   */
  private List<String> missingRequiredFields() {
    List<String> missing = new ArrayList<>();
    for (Field f : getClass().getFields()) {
      if (!f.isAnnotationPresent(Required.class)) {
        continue;
      }
      try {
        if (f.get(this) == null) {
          missing.add(f.getName());
        }
      } catch (IllegalAccessException e) {
        throw new InvalidEncodingException("cannot read field " + f.getName() + " of " + getClass().getName(), e);
      }
    }
    return missing;
  }

  /**
   * Check this deserialized encoding: every required field must be present, then {@link #validateExtra()} runs.
   *
   * @throws InvalidEncodingException if the encoding is invalid.
   */
  public final void validate() {
    List<String> missing = missingRequiredFields();
    if (!missing.isEmpty()) {
      throw new InvalidEncodingException(
          getClass().getSimpleName() + " is missing required fields: " + Joiner.on(", ").join(missing));
    }
    validateExtra();
  }

  /**
   * Checks beyond the required fields.
   *
   * @throws InvalidEncodingException if the encoding is invalid.
   */
  protected void validateExtra() {}
}
