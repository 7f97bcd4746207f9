package com.contact.resolution.pim;

/**
 * Fields for creating or updating a contact. Null fields are left unchanged on update.
 */
public record ContactDraft(
        String firstName,
        String lastName,
        String organization,
        String jobTitle,
        String email,
        String phone,
        String note
) {
    public boolean hasName() {
        return isPresent(firstName) || isPresent(lastName) || isPresent(organization);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
