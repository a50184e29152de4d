package com.retrykit.core.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Marks exceptions retryable by type. Meant to be called from inside an operation, e.g. {@code
 * throw classifier.classify(ex)}; nothing is retried unless its type is listed.
 */
public class ExceptionTypeClassifier {
  private final List<Class<? extends Throwable>> retryableTypes;

  public ExceptionTypeClassifier(List<Class<? extends Throwable>> retryableTypes) {
    this.retryableTypes =
        List.copyOf(Objects.requireNonNull(retryableTypes, "retryableTypes must not be null"));
  }

  public static ExceptionTypeClassifier none() {
    return new ExceptionTypeClassifier(List.of());
  }

  /**
   * Loads each fully qualified name as a {@link Throwable} subtype. Null and blank entries are
   * ignored; a name that cannot be loaded or is not a {@code Throwable} fails the whole call.
   */
  public static ExceptionTypeClassifier fromClassNames(List<String> classNames) {
    if (classNames == null) {
      return none();
    }
    List<Class<? extends Throwable>> types = new ArrayList<>(classNames.size());
    for (String className : classNames) {
      if (className != null && !className.isBlank()) {
        types.add(loadThrowableType(className.trim()));
      }
    }
    return new ExceptionTypeClassifier(types);
  }

  private static Class<? extends Throwable> loadThrowableType(String className) {
    Class<?> loaded;
    try {
      loaded = Class.forName(className);
    } catch (ClassNotFoundException | LinkageError ex) {
      throw new IllegalArgumentException("Cannot load exception class " + className, ex);
    }
    if (!Throwable.class.isAssignableFrom(loaded)) {
      throw new IllegalArgumentException(className + " does not extend java.lang.Throwable");
    }
    return loaded.asSubclass(Throwable.class);
  }

  public List<Class<? extends Throwable>> retryableTypes() {
    return retryableTypes;
  }

  public boolean matches(Throwable exception) {
    Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable candidate = exception;
    while (candidate != null && visited.add(candidate)) {
      for (Class<? extends Throwable> retryableType : retryableTypes) {
        if (retryableType.isInstance(candidate)) {
          return true;
        }
      }
      candidate = candidate.getCause();
    }
    return false;
  }

  public Exception classify(Exception exception) {
    if (exception == null || Retryable.isRetryable(exception) || !matches(exception)) {
      return exception;
    }
    return Retryable.mark(exception);
  }
}
