package com.scholary.synthjobs.admission;

/**
 * Identifies one rate-limit budget: a caller paired with an operation class.
 *
 * <p>The string form is {@code caller:operationClass}, for example {@code user:42:audio-gen}.
 */
public record AdmissionKey(String caller, String operationClass) {

  public AdmissionKey {
    if (caller == null || caller.isBlank()) {
      throw new IllegalArgumentException("caller cannot be blank");
    }
    if (operationClass == null || operationClass.isBlank()) {
      throw new IllegalArgumentException("operationClass cannot be blank");
    }
  }

  public static AdmissionKey of(String caller, String operationClass) {
    return new AdmissionKey(caller, operationClass);
  }

  public String value() {
    return caller + ":" + operationClass;
  }

  @Override
  public String toString() {
    return value();
  }
}
