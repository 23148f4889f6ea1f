package com.synapse.x.validation;

import com.synapse.x.exceptions.BadRequestException;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class FeatureViewValidator implements ConstraintValidator<ValidFeatureView, String> {

    private static final Pattern VIEW_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,63}$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || isValidName(value);
    }

    public static boolean isValidName(String value) {
        return value != null && VIEW_NAME.matcher(value).matches();
    }

    public static String requireValid(String view) {
        if (!isValidName(view)) {
            throw new BadRequestException("Invalid feature_view: '" + view + "'");
        }
        return view;
    }
}
