package com.example.devopsgateway.security;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Identity and authorization snapshot for a single request.
 * Built once per request by the {@link PrincipalResolver}, never persisted.
 */
@Value
@Builder(toBuilder = true)
public class Principal {

    public static final String ANONYMOUS_USER_ID = "anonymous";

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("login_id")
    String loginId;

    String email;
    String name;
    String tenant;

    @Singular
    Set<String> roles;

    @Singular
    Set<String> permissions;

    @JsonIgnore
    String token;

    @JsonIgnore
    String refreshToken;

    /** Stringified claims as issued by the identity provider, kept for delegated checks */
    @JsonIgnore
    @Singular
    Map<String, String> rawClaims;

    @JsonIgnore
    boolean anonymous;

    /**
     * Legacy alias of {@link #getPermissions()}.
     */
    public Set<String> getScopes() {
        return permissions;
    }

    /**
     * Whether a failed local check may be re-asked to the identity provider.
     */
    @JsonIgnore
    public boolean isDelegationEligible() {
        return !anonymous && rawClaims != null && !rawClaims.isEmpty();
    }
}
