package com.tracecontract.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares an operation that never emits ({@link LogLevel#NONE}). The template is still
 * validated.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface LogIgnored {

    String value() default OperationSpec.IGNORED_TEMPLATE;
}
