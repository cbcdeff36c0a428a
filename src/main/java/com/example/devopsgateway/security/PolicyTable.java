package com.example.devopsgateway.security;

import com.example.devopsgateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable role → permissions mapping, loaded once at startup.
 * Role lookups are case-insensitive; unknown roles expand to nothing.
 */
@Slf4j
@Component
public class PolicyTable {

    private final Map<String, Set<String>> rolePermissions;

    @Autowired
    public PolicyTable(GatewayProperties properties) {
        this(properties.getPolicy().getRoles());
    }

    public PolicyTable(Map<String, ? extends Collection<String>> roles) {
        TreeMap<String, Set<String>> table = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (roles != null) {
            roles.forEach((role, permissions) -> table.put(role,
                    permissions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(permissions))));
        }
        this.rolePermissions = Collections.unmodifiableMap(table);
        if (table.isEmpty()) {
            log.warn("Policy table is empty: role-derived permissions are disabled");
        } else {
            log.info("Loaded policy table with {} roles: {}", table.size(), table.keySet());
        }
    }

    /**
     * Permissions granted by a single role.
     */
    public Set<String> permissionsFor(String role) {
        if (role == null) return Set.of();
        return rolePermissions.getOrDefault(role, Set.of());
    }

    /**
     * Union of the permissions granted by every given role.
     */
    public Set<String> expand(Collection<String> roles) {
        Set<String> expanded = new LinkedHashSet<>();
        if (roles != null) {
            for (String role : roles) {
                expanded.addAll(permissionsFor(role));
            }
        }
        return expanded;
    }

    public boolean hasRole(String role) {
        return role != null && rolePermissions.containsKey(role);
    }

    public Set<String> roleNames() {
        return rolePermissions.keySet();
    }

    public Map<String, Set<String>> asMap() {
        return rolePermissions;
    }

    /**
     * Roles whose grant includes a wildcard permission.
     */
    public List<String> wildcardRoles() {
        return rolePermissions.entrySet().stream()
                .filter(e -> e.getValue().stream().anyMatch(OperationPermissions::isWildcard))
                .map(Map.Entry::getKey)
                .toList();
    }
}
