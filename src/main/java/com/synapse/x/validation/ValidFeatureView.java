package com.synapse.x.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates a feature view name. Null is accepted so that optional request fields fall back
 * to the configured default view.
 */
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = FeatureViewValidator.class)
public @interface ValidFeatureView {

    String message() default "Invalid feature view name.";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
