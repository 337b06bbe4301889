package com.gprintex.rental.domain;

/**
 * Owner or client profile from the identity service. Every field defaults to empty.
 */
public record PartyProfile(
    String firstName,
    String lastName,
    String phone,
    PostalAddress address
) {
    public PartyProfile {
        firstName = firstName != null ? firstName : "";
        lastName = lastName != null ? lastName : "";
        phone = phone != null ? phone : "";
        address = address != null ? address : PostalAddress.empty();
    }

    public static PartyProfile empty() {
        return new PartyProfile("", "", "", PostalAddress.empty());
    }

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }
}
