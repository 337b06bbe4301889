package com.gprintex.rental.service;

import com.gprintex.rental.domain.AggregatedContext;
import com.gprintex.rental.domain.ContractTerms;
import com.gprintex.rental.domain.EquipmentRecord;
import com.gprintex.rental.domain.PartyProfile;
import com.gprintex.rental.domain.PostalAddress;
import com.gprintex.rental.domain.RentalRequestRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Builds the generation prompt. Output depends only on its inputs;
 * absent records render as empty strings, absent request fields as N/A.
 */
@Component
public class ContractPromptBuilder {

    static final String NOT_AVAILABLE = "N/A";

    public String build(ContractTerms terms, AggregatedContext context) {
        var request = context.request();
        var prompt = new StringBuilder();

        prompt.append("Generate a professional HTML equipment rental contract based on the following data:\n\n");

        prompt.append("Rental Request Details:\n");
        line(prompt, "Request ID", requestField(request, RentalRequestRecord::id));
        line(prompt, "Status", requestField(request, RentalRequestRecord::status));
        line(prompt, "Quantity", requestField(request, r -> r.quantity().map(String::valueOf)));
        prompt.append('\n');

        prompt.append("Contract Terms:\n");
        line(prompt, "Owner Name", terms.ownerName());
        line(prompt, "Client Name", terms.clientName());
        line(prompt, "Start Date", date(terms.effectiveStartDate(context)));
        line(prompt, "End Date", date(terms.effectiveEndDate(context)));
        line(prompt, "Total Value", terms.effectiveTotal(context).toPlainString() + " TND");
        line(prompt, "Equipment ID", String.join(", ", terms.equipmentRefs()));
        prompt.append('\n');

        profile(prompt, "Owner Profile", context.owner().orElse(PartyProfile.empty()));
        profile(prompt, "Client Profile", context.client().orElse(PartyProfile.empty()));

        var equipment = context.equipment().isEmpty()
            ? List.of(Optional.<EquipmentRecord>empty())
            : context.equipment();
        for (int i = 0; i < equipment.size(); i++) {
            var title = equipment.size() == 1 ? "Equipment Information" : "Equipment Information (" + (i + 1) + ")";
            equipment(prompt, title, equipment.get(i).orElse(EquipmentRecord.empty()));
        }

        var quantity = request.flatMap(RentalRequestRecord::quantity).map(String::valueOf).orElse("1");
        var status = request.flatMap(RentalRequestRecord::status).orElse("active");

        prompt.append("Please return a well-structured HTML contract that includes:\n");
        prompt.append("1. Parties' names and contact information\n");
        prompt.append("2. Equipment details including quantity (").append(quantity).append(")\n");
        prompt.append("3. Rental terms including dates and total value\n");
        prompt.append("4. Special conditions based on request status (").append(status).append(")\n");
        prompt.append("5. Signature sections for both parties\n");
        prompt.append("6. Cancellation policy if status is 'canceled'\n");

        if (!terms.details().isBlank()) {
            prompt.append("\nAdditional details: ").append(terms.details()).append('\n');
        }
        return prompt.toString();
    }

    private static void profile(StringBuilder prompt, String title, PartyProfile profile) {
        prompt.append(title).append(":\n");
        line(prompt, "Full Name", profile.fullName());
        line(prompt, "Phone", profile.phone());
        line(prompt, "Address", address(profile.address()));
        prompt.append('\n');
    }

    private static void equipment(StringBuilder prompt, String title, EquipmentRecord record) {
        prompt.append(title).append(":\n");
        line(prompt, "Name", record.name());
        line(prompt, "Brand", record.brand());
        line(prompt, "Location", record.location());
        line(prompt, "Price per day", record.pricePerDay() + " TND");
        line(prompt, "Condition", record.condition());
        line(prompt, "Rental Location", record.rentalLocation());
        line(prompt, "Description", record.shortDescription());
        prompt.append('\n');
        prompt.append("Detailed Description:\n");
        prompt.append(record.detailedDescription()).append("\n\n");
    }

    private static String address(PostalAddress address) {
        return String.join(", ",
            address.street(), address.city(), address.state(), address.postalCode(), address.country());
    }

    private static String requestField(
        Optional<RentalRequestRecord> request,
        java.util.function.Function<RentalRequestRecord, Optional<String>> field
    ) {
        return request.map(r -> field.apply(r).orElse("")).orElse(NOT_AVAILABLE);
    }

    private static String date(Optional<LocalDate> value) {
        return value.map(LocalDate::toString).orElse("");
    }

    private static void line(StringBuilder prompt, String label, String value) {
        prompt.append("- ").append(label).append(": ").append(value).append('\n');
    }
}
