package com.chartgate.gateway.api;

/**
 * Operator change to a tenant; null fields are left as they are.
 *
 * @param status "active" or "suspended"
 * @param planId target plan
 */
public record TenantUpdateRequest(String status, String planId) {}
