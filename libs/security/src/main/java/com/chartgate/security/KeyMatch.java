package com.chartgate.security;

/**
 * A live API key resolved together with its tenant and that tenant's current plan.
 */
public record KeyMatch(ApiKey apiKey, Tenant tenant, Plan plan) {}
