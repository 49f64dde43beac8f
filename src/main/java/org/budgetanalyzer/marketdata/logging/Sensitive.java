package org.budgetanalyzer.marketdata.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field whose value must be masked when the owning object is logged through {@link
 * SafeLogger}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface Sensitive {

  /** Number of trailing characters left readable, 0 masks the whole value. */
  int showLast() default 0;
}
