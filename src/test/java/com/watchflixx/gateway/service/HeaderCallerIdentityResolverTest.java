package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.model.CallerIdentity;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeaderCallerIdentityResolverTest {

    private final HeaderCallerIdentityResolver resolver = new HeaderCallerIdentityResolver();

    @Test
    void missingUserIdMeansAnonymous() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ProxyHeaders.SUBSCRIPTION_PLAN, "premium");
        headers.set(ProxyHeaders.USER_ID, "  ");

        assertNull(resolver.resolve(headers));
    }

    @Test
    void readsIdentityAndNormalisesSubscription() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ProxyHeaders.USER_ID, "u-9");
        headers.set(ProxyHeaders.USER_EMAIL, "viewer@example.com");
        headers.set(ProxyHeaders.PROFILE_ID, "kids");
        headers.set(ProxyHeaders.SUBSCRIPTION_PLAN, "premium");
        headers.set(ProxyHeaders.SUBSCRIPTION_STATUS, "active");

        CallerIdentity identity = resolver.resolve(headers);

        assertEquals("u-9", identity.getUserId());
        assertEquals("viewer@example.com", identity.getEmail());
        assertEquals("PREMIUM", identity.getSubscriptionPlan());
        assertTrue(identity.hasProfile());
        assertTrue(identity.hasActiveSubscription());
    }

    @Test
    void cancelledSubscriptionIsNotActive() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ProxyHeaders.USER_ID, "u-9");
        headers.set(ProxyHeaders.SUBSCRIPTION_PLAN, "BASIC");
        headers.set(ProxyHeaders.SUBSCRIPTION_STATUS, "cancelled");

        CallerIdentity identity = resolver.resolve(headers);

        assertTrue(identity.hasSubscription());
        assertFalse(identity.hasActiveSubscription());
        assertFalse(identity.hasProfile());
    }
}
