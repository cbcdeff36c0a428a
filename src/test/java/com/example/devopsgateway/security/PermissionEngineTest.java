package com.example.devopsgateway.security;

import com.example.devopsgateway.exception.IdentityProviderUnavailableException;
import com.example.devopsgateway.exception.PermissionDeniedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PermissionEngineTest {

    private static final List<String> UNIVERSE = List.of(
            "read_logs", "read_metrics", "deploy_staging", "deploy_production", "rollback_staging", "read_audit");

    @Mock
    private IdentityProvider identityProvider;

    private PermissionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PermissionEngine(identityProvider);
    }

    private static Principal principal(Set<String> permissions) {
        return Principal.builder().userId("u-1").permissions(permissions).build();
    }

    @Nested
    @DisplayName("local any/all semantics")
    class LocalChecks {

        @Test
        void anyModeIsNonEmptyIntersection() {
            Random random = new Random(42);
            for (int i = 0; i < 200; i++) {
                Set<String> effective = randomSubset(random);
                Set<String> required = randomSubset(random);
                boolean expected = required.stream().anyMatch(effective::contains);
                assertThat(engine.authorize(principal(effective), required, PermissionMode.ANY))
                        .as("any: required=%s effective=%s", required, effective)
                        .isEqualTo(expected);
            }
        }

        @Test
        void allModeIsSubset() {
            Random random = new Random(7);
            for (int i = 0; i < 200; i++) {
                Set<String> effective = randomSubset(random);
                Set<String> required = randomSubset(random);

                boolean expected = effective.containsAll(required);
                assertThat(engine.authorize(principal(effective), required, PermissionMode.ALL))
                        .as("all: required=%s effective=%s", required, effective)
                        .isEqualTo(expected);
            }
        }

        @Test
        void emptyRequirementFailsAnyAndPassesAll() {
            Principal reader = principal(Set.of("read_logs"));

            assertThat(engine.authorize(reader, Set.of(), PermissionMode.ANY)).isFalse();
            assertThat(engine.authorize(reader, Set.of(), PermissionMode.ALL)).isTrue();
            assertThat(engine.authorizeRoles(reader, Set.of(), PermissionMode.ANY)).isFalse();
        }

        @Test
        void wildcardPassesEverything() {
            Principal admin = principal(Set.of("*"));
            Principal scopedAdmin = principal(Set.of("admin:*"));

            for (PermissionMode mode : PermissionMode.values()) {
                assertThat(engine.authorize(admin, Set.of("deploy_production", "read_audit"), mode)).isTrue();
                assertThat(engine.authorize(scopedAdmin, Set.of("anything_at_all"), mode)).isTrue();
            }
        }

        @Test
        void nullPrincipalIsDenied() {
            assertThat(engine.authorize(null, Set.of("read_logs"), PermissionMode.ANY)).isFalse();
        }

        @Test
        void requireThrowsWithRequiredSetInMessage() {
            assertThatThrownBy(() -> engine.require(principal(Set.of("read_logs")),
                    Set.of("read_audit"), PermissionMode.ALL))
                    .isInstanceOf(PermissionDeniedException.class)
                    .hasMessageContaining("all of")
                    .hasMessageContaining("read_audit");
        }

        @Test
        void roleChecksUseRoleNames() {
            Principal developer = Principal.builder().userId("dev").role("Developer").build();

            assertThat(engine.authorizeRoles(developer, Set.of("Developer", "Admin"), PermissionMode.ANY)).isTrue();
            assertThat(engine.authorizeRoles(developer, Set.of("Developer", "Admin"), PermissionMode.ALL)).isFalse();
        }

        private Set<String> randomSubset(Random random) {
            return IntStream.range(0, UNIVERSE.size())
                    .filter(i -> random.nextBoolean())
                    .mapToObj(UNIVERSE::get)
                    .collect(Collectors.toSet());
        }
    }

    @Nested
    @DisplayName("delegated re-check")
    class Delegation {

        private final Principal issued = Principal.builder()
                .userId("u-2")
                .permission("read_logs")
                .rawClaim("sub", "u-2")
                .build();

        @Test
        void grantsWhenProviderAgrees() {
            when(identityProvider.isConfigured()).thenReturn(true);
            when(identityProvider.delegatedCheck(anyMap(), eq(Set.of("read_audit")), eq(CheckKind.PERMISSION),
                    eq(PermissionMode.ANY)))
                    .thenReturn(new IdentityProvider.DelegatedCheckResult(true, Set.of("read_audit")));

            assertThat(engine.authorize(issued, Set.of("read_audit"), PermissionMode.ANY)).isTrue();
        }

        @Test
        void failsClosedWhenProviderUnreachable() {
            when(identityProvider.isConfigured()).thenReturn(true);
            when(identityProvider.delegatedCheck(anyMap(), anySet(), any(), any()))
                    .thenThrow(new IdentityProviderUnavailableException("down"));

            assertThat(engine.authorize(issued, Set.of("read_audit"), PermissionMode.ANY)).isFalse();
        }

        @Test
        void skippedForAnonymousPrincipal() {
            Principal anonymous = Principal.builder()
                    .userId("anonymous")
                    .permission("read_logs")
                    .rawClaims(Map.of())
                    .anonymous(true)
                    .build();

            assertThat(engine.authorize(anonymous, Set.of("deploy_staging"), PermissionMode.ANY)).isFalse();
            verify(identityProvider, never()).delegatedCheck(anyMap(), anySet(), any(), any());
        }

        @Test
        void skippedWhenLocalCheckPasses() {
            assertThat(engine.authorize(issued, Set.of("read_logs"), PermissionMode.ANY)).isTrue();
            verify(identityProvider, never()).delegatedCheck(anyMap(), anySet(), any(), any());
        }

        @Test
        void roleDelegationUsesRoleKind() {
            when(identityProvider.isConfigured()).thenReturn(true);
            when(identityProvider.delegatedCheck(anyMap(), eq(Set.of("Auditor")), eq(CheckKind.ROLE),
                    eq(PermissionMode.ALL)))
                    .thenReturn(new IdentityProvider.DelegatedCheckResult(true, Set.of("Auditor")));

            assertThat(engine.authorizeRoles(issued, Set.of("Auditor"), PermissionMode.ALL)).isTrue();
        }
    }
}
