package com.flagship.gate_ledger.identity;

import com.flagship.gate_ledger.exception.IdentityValidationException;
import lombok.Value;

/**
 * A registered person, keyed by registration number and tagged with its variant.
 */
@Value
public class Identity {
    String regNo;
    String name;
    String department;
    IdentityType type;

    /**
     * Builds a validated identity. All text fields are trimmed.
     *
     * @throws IdentityValidationException if any field is missing or blank
     */
    public static Identity of(String regNo, String name, String department, IdentityType type) {
        String trimmedRegNo = requireText(regNo, "regNo");
        String trimmedName = requireText(name, "name");
        String trimmedDepartment = requireText(department, "department");
        if (type == null) {
            throw new IdentityValidationException("type", "Identity type is required");
        }
        return new Identity(trimmedRegNo, trimmedName, trimmedDepartment, type);
    }

    /**
     * Same as {@link #of} but classifies the regNo when no type is supplied.
     */
    public static Identity ofClassified(String regNo, String name, String department, IdentityType type) {
        String trimmedRegNo = requireText(regNo, "regNo");
        return of(trimmedRegNo, name, department, type != null ? type : IdentityType.classify(trimmedRegNo));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IdentityValidationException(field, field + " is required");
        }
        return value.trim();
    }
}
