package com.example.devopsgateway.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered extraction rules for identity-provider claims.
 *
 * Providers disagree on claim names ("sub" vs "userId", "tenant" vs "tenantId"),
 * so every field is read through a list of candidate keys and the first
 * non-empty value wins. Set-valued claims accept JSON arrays, collections,
 * and comma or space separated strings.
 */
public final class ClaimRules {

    public static final List<String> USER_ID = List.of("sub", "userId", "user_id");
    public static final List<String> LOGIN_ID = List.of("loginId", "email", "login_id");
    public static final List<String> EMAIL = List.of("email");
    public static final List<String> NAME = List.of("name", "user_name");
    public static final List<String> TENANT = List.of("tenant", "tenantId");

    public static final List<String> ROLES = List.of("roles");
    /** "scp"/"scope" are OAuth style scope claims treated as permissions */
    public static final List<String> PERMISSIONS = List.of("permissions", "scp", "scope");

    /** Flat tenant-keyed maps: tenantRoles: {tenant: [..]} */
    public static final String TENANT_ROLES = "tenantRoles";
    public static final String TENANT_PERMISSIONS = "tenantPermissions";
    /** Nested tenant map: tenants: {tenant: {roles: [..], permissions: [..]}} */
    public static final String TENANTS = "tenants";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ClaimRules() {
    }

    /**
     * First non-blank string found under any of the candidate keys, in order.
     */
    public static Optional<String> firstString(Map<String, Object> claims, List<String> keys) {
        if (claims == null) return Optional.empty();
        for (String key : keys) {
            Object value = claims.get(key);
            if (value == null) continue;
            String text = String.valueOf(value).trim();
            if (!text.isEmpty()) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    /**
     * Union of the set-valued claims found under the candidate keys.
     */
    public static Set<String> collectValues(Map<String, Object> claims, List<String> keys) {
        Set<String> values = new LinkedHashSet<>();
        if (claims == null) return values;
        for (String key : keys) {
            values.addAll(toValueSet(claims.get(key)));
        }
        return values;
    }

    /**
     * Roles scoped to the given tenant, from either tenant claim layout.
     */
    public static Set<String> tenantRoles(Map<String, Object> claims, String tenant) {
        return tenantValues(claims, tenant, TENANT_ROLES, "roles");
    }

    /**
     * Permissions scoped to the given tenant, from either tenant claim layout.
     */
    public static Set<String> tenantPermissions(Map<String, Object> claims, String tenant) {
        return tenantValues(claims, tenant, TENANT_PERMISSIONS, "permissions");
    }

    private static Set<String> tenantValues(Map<String, Object> claims, String tenant,
                                            String flatKey, String nestedKey) {
        Set<String> values = new LinkedHashSet<>();
        if (claims == null || tenant == null) return values;

        Map<String, Object> flat = asMap(claims.get(flatKey));
        if (flat != null) {
            values.addAll(toValueSet(flat.get(tenant)));
        }

        Map<String, Object> tenants = asMap(claims.get(TENANTS));
        if (tenants != null) {
            Map<String, Object> scoped = asMap(tenants.get(tenant));
            if (scoped != null) {
                values.addAll(toValueSet(scoped.get(nestedKey)));
            }
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        if (value instanceof JsonNode node && node.isObject()) {
            return MAPPER.convertValue(node, Map.class);
        }
        return null;
    }

    static Set<String> toValueSet(Object value) {
        Set<String> values = new LinkedHashSet<>();
        if (value == null) return values;

        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    values.add(String.valueOf(item).trim());
                }
            }
        } else if (value instanceof JsonNode node && node.isArray()) {
            node.forEach(item -> {
                if (!item.asText().isBlank()) values.add(item.asText().trim());
            });
        } else if (value instanceof Object[] array) {
            for (Object item : array) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    values.add(String.valueOf(item).trim());
                }
            }
        } else {
            for (String part : String.valueOf(value).split("[,\\s]+")) {
                if (!part.isBlank()) values.add(part.trim());
            }
        }
        return values;
    }
}
