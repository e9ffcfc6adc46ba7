package com.peerlend.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Bean Validation adapter over AddressValidator.
 */
@Component
public class AssetAddressValidator implements ConstraintValidator<AssetAddress, String> {

    private final AddressValidator addressValidator;

    public AssetAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && addressValidator.isValidAddress(value);
    }
}
