package com.questrail.dfx.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Account details of the user measurements are taken for. Only email and
 * password are required; the rest are sent when a new user is created.
 */
public record UserProfile(
        String email,
        String password,
        String firstName,
        String lastName,
        String phoneNumber,
        String gender,
        String dateOfBirth,
        String heightCm,
        String weightKg
) {
    public UserProfile {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(password, "password");
    }

    public static UserProfile of(String email, String password) {
        return new UserProfile(email, password, null, null, null, null, null, null, null);
    }

    /**
     * Request body of the create-user calls. Absent optional fields are sent
     * as empty strings.
     */
    public Map<String, Object> toCreateRequest() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("FirstName", orEmpty(firstName));
        body.put("LastName", orEmpty(lastName));
        body.put("Email", email);
        body.put("Password", password);
        body.put("PhoneNumber", orEmpty(phoneNumber));
        body.put("Gender", orEmpty(gender));
        body.put("DateOfBirth", orEmpty(dateOfBirth));
        body.put("HeightCm", orEmpty(heightCm));
        body.put("WeightKg", orEmpty(weightKg));
        return body;
    }

    @Override
    public String toString() {
        return "UserProfile[email=" + email + ", password=***]";
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}
