package com.gprintex.rental.domain;

/**
 * Postal address decomposed from a profile payload. Absent parts are empty strings.
 */
public record PostalAddress(
    String street,
    String city,
    String state,
    String postalCode,
    String country
) {
    public PostalAddress {
        street = street != null ? street : "";
        city = city != null ? city : "";
        state = state != null ? state : "";
        postalCode = postalCode != null ? postalCode : "";
        country = country != null ? country : "";
    }

    public static PostalAddress empty() {
        return new PostalAddress("", "", "", "", "");
    }
}
