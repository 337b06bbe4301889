package com.gprintex.rental.domain;

/**
 * Equipment listing from the catalog service. Every field defaults to empty.
 */
public record EquipmentRecord(
    String name,
    String brand,
    String location,
    String pricePerDay,
    String condition,
    String rentalLocation,
    String shortDescription,
    String detailedDescription
) {
    public EquipmentRecord {
        name = name != null ? name : "";
        brand = brand != null ? brand : "";
        location = location != null ? location : "";
        pricePerDay = pricePerDay != null ? pricePerDay : "";
        condition = condition != null ? condition : "";
        rentalLocation = rentalLocation != null ? rentalLocation : "";
        shortDescription = shortDescription != null ? shortDescription : "";
        detailedDescription = detailedDescription != null ? detailedDescription : "";
    }

    public static EquipmentRecord empty() {
        return new EquipmentRecord("", "", "", "", "", "", "", "");
    }
}
