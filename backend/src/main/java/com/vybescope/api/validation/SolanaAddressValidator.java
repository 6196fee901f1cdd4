package com.vybescope.api.validation;

import com.vybescope.subscription.AddressValidator;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Applies the registry's own address rule at the HTTP boundary, so a request body that validates is
 * never rejected later by {@code SubscriptionRegistry} for its addresses. Missing values are invalid.
 */
@Component
@RequiredArgsConstructor
public class SolanaAddressValidator implements ConstraintValidator<SolanaAddress, String> {

    private final AddressValidator addressValidator;

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return addressValidator.isValidAddress(value);
    }
}
