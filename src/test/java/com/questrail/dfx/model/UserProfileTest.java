package com.questrail.dfx.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserProfileTest
{
    @Test
    void createRequestCarriesEveryProfileField() {
        Map<String, Object> body = UserProfile.of("a@b.c", "pw").toCreateRequest();

        assertEquals(List.of("FirstName", "LastName", "Email", "Password", "PhoneNumber",
                "Gender", "DateOfBirth", "HeightCm", "WeightKg"), List.copyOf(body.keySet()));
        assertEquals("a@b.c", body.get("Email"));
        assertEquals("", body.get("FirstName"));
    }

    @Test
    void toStringHidesPassword() {
        String s = UserProfile.of("a@b.c", "secret").toString();
        assertFalse(s.contains("secret"));
        assertTrue(s.contains("a@b.c"));
    }
}
