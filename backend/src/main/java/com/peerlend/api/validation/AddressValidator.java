package com.peerlend.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Asset and user addresses are EVM addresses: 0x followed by 40 hex digits.
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern ZERO_ADDRESS = Pattern.compile("^0x0{40}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        String trimmed = address.trim();
        return EVM_ADDRESS.matcher(trimmed).matches() && !ZERO_ADDRESS.matcher(trimmed).matches();
    }
}
