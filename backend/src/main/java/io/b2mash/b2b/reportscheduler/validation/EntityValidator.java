package io.b2mash.b2b.reportscheduler.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for per-entity validators. Subclasses register a {@link FieldValidator} per field
 * name; {@link #validate(Map)} runs every registered validator for the fields present in the model
 * and keeps going after a failure, so one call reports problems across all fields.
 *
 * <p>Errors accumulate on the instance and are never thrown. Instances are stateful and not
 * thread-safe: use one per validation request.
 */
public abstract class EntityValidator {

  private static final Logger log = LoggerFactory.getLogger(EntityValidator.class);

  private final Map<String, FieldValidator> validationFns = new LinkedHashMap<>();
  private final Set<String> requiredFields = new LinkedHashSet<>();
  private final List<EntityValidationError> errors = new ArrayList<>();

  private ValidateMode validateMode = ValidateMode.ON_CREATE;

  public void setValidateMode(ValidateMode validateMode) {
    this.validateMode = validateMode;
  }

  public ValidateMode getValidateMode() {
    return validateMode;
  }

  /**
   * Validates the fields of an entity model.
   *
   * <p>On create, every required field must be present. Each present field with a registered
   * validator is then validated; fields without one are ignored.
   *
   * @return true if all checks passed
   */
  public boolean validate(Map<String, Object> model) {
    boolean result = true;

    if (validateMode == ValidateMode.ON_CREATE) {
      for (String fieldName : requiredFields) {
        if (!model.containsKey(fieldName)) {
          addError(
              ValidationMessages.EM_SPECIFY, fieldName, ValidationErrorKind.MISSING_OR_UNDECODABLE);
          result = false;
        }
      }
    }

    for (var entry : model.entrySet()) {
      var callback = validationFns.get(entry.getKey());
      if (callback != null && !callback.validate(entry.getValue())) {
        result = false;
      }
    }

    if (!result) {
      log.debug(
          "{} rejected entity: mode={}, errors={}",
          getClass().getSimpleName(),
          validateMode,
          errors.size());
    }
    return result;
  }

  /** Errors recorded so far, in order. */
  public List<EntityValidationError> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  protected void registerValidationFn(String fieldName, FieldValidator callback) {
    validationFns.put(fieldName, callback);
  }

  protected void registerRequiredField(String fieldName) {
    requiredFields.add(fieldName);
  }

  protected void addError(String message, String fieldName, ValidationErrorKind kind) {
    errors.add(new EntityValidationError(message, fieldName, kind));
  }

  protected void addError(String message, String fieldName, int code, ValidationErrorKind kind) {
    errors.add(new EntityValidationError(message, fieldName, code, kind));
  }

  /**
   * Passes if every candidate of {@code value} is literally present in {@code set}. A scalar is a
   * single candidate; a collection contributes each of its elements.
   */
  protected boolean isValueInSet(Object value, Collection<String> set, String fieldName) {
    if (!set.containsAll(ValidationValues.candidates(value))) {
      addError(ValidationMessages.inSet(set), fieldName, ValidationErrorKind.NOT_IN_ALLOWED_SET);
      return false;
    }
    return true;
  }

  /**
   * Passes if at least one candidate of {@code value} contains a match for at least one of the
   * patterns. Matching is a search, not a full-string match.
   */
  protected boolean isRegExpValueInSet(Object value, List<Pattern> patterns, String fieldName) {
    boolean result = false;
    for (String candidate : ValidationValues.candidates(value)) {
      for (Pattern pattern : patterns) {
        if (pattern.matcher(candidate).find()) {
          result = true;
          break;
        }
      }
    }

    if (!result) {
      addError(
          ValidationMessages.inSet(patterns.stream().map(Pattern::pattern).toList()),
          fieldName,
          ValidationErrorKind.NOT_IN_ALLOWED_SET);
    }
    return result;
  }
}
