package com.example.devopsgateway.gateway;

import com.example.devopsgateway.backend.TelemetrySampleGenerator;
import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.domain.DeployResult;
import com.example.devopsgateway.domain.DeploymentStatus;
import com.example.devopsgateway.domain.LogEntry;
import com.example.devopsgateway.domain.LogsResult;
import com.example.devopsgateway.domain.MetricsResult;
import com.example.devopsgateway.domain.Rollback;
import com.example.devopsgateway.domain.RollbackResult;
import com.example.devopsgateway.domain.Route;
import com.example.devopsgateway.exception.AuthenticationException;
import com.example.devopsgateway.exception.GatewayException;
import com.example.devopsgateway.exception.InternalException;
import com.example.devopsgateway.exception.PermissionDeniedException;
import com.example.devopsgateway.exception.ValidationException;
import com.example.devopsgateway.security.IdentityProvider;
import com.example.devopsgateway.security.PermissionEngine;
import com.example.devopsgateway.security.PolicyTable;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.PrincipalResolver;
import com.example.devopsgateway.service.AuditService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProxiedGatewayRouterTest {

    @Mock
    private GatewayTransport transport;
    @Mock
    private GatewayRouter fallback;
    @Mock
    private IdentityProvider identityProvider;
    @Mock
    private AuditService auditService;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final Executor sameThread = Runnable::run;
    private final RequestContext ctx = RequestContext.builder().requestId("req-1").authorization("Bearer t").build();

    private GatewayProperties properties;
    private PendingResultStore resultStore;
    private SimpleMeterRegistry meterRegistry;
    private ProxiedGatewayRouter router;

    private final Principal developer = Principal.builder()
            .userId("dev-1")
            .role("Developer")
            .permission("read_logs")
            .permission("read_metrics")
            .permission("deploy_staging")
            .permission("rollback_staging")
            .build();

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getProxy().setEnabled(true);
        properties.getProxy().setUrl("http://gateway.local/mcp");
        properties.getPolicy().setRoles(Map.of(
                "Developer", List.of("read_logs", "read_metrics", "deploy_staging", "rollback_staging")));
        createRouter(sameThread);
    }

    private void createRouter(Executor executor) {
        meterRegistry = new SimpleMeterRegistry();
        resultStore = new PendingResultStore(properties);
        router = new ProxiedGatewayRouter(new PermissionEngine(identityProvider), auditService, meterRegistry,
                transport, fallback,
                new PlaceholderDataGenerator(new TelemetrySampleGenerator(), properties), resultStore,
                executor, properties, objectMapper,
                new PrincipalResolver(identityProvider, new PolicyTable(properties), properties, objectMapper));
    }

    @Nested
    @DisplayName("permission checks happen before any transport call")
    class Permissions {

        @Test
        void productionDeployWithoutPermissionMakesNoTransportCall() {
            assertThatThrownBy(() -> router.deploy(ctx, developer, "payment-service", "1.2.0", "production"))
                    .isInstanceOf(PermissionDeniedException.class)
                    .hasMessageContaining("deploy_production");

            verifyNoInteractions(transport);
            verifyNoInteractions(fallback);
        }

        @Test
        void unknownEnvironmentIsValidationNotDenial() {
            assertThatThrownBy(() -> router.rollback(ctx, developer, "dep-1", "memory leak", "qa"))
                    .isInstanceOf(ValidationException.class);

            verifyNoInteractions(transport);
        }

        @Test
        void shortRollbackReasonIsRejectedBeforeTransport() {
            assertThatThrownBy(() -> router.rollback(ctx, developer, "dep-1", "x", "staging"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("reason");
            assertThatThrownBy(() -> router.rollback(ctx, developer, "dep-1", null, "staging"))
                    .isInstanceOf(ValidationException.class);

            verifyNoInteractions(transport, fallback);
        }

        @Test
        void readWithoutPermissionMakesNoTransportCall() {
            Principal nobody = Principal.builder().userId("nobody").build();

            assertThatThrownBy(() -> router.getLogs(ctx, nobody, null, 10, null))
                    .isInstanceOf(PermissionDeniedException.class);

            verifyNoInteractions(transport);
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        void deployReturnsGatewayResult() throws Exception {
            when(transport.callTool(eq(ctx), eq(ProxiedGatewayRouter.DEPLOY_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree(
                            "{\"tool\":\"deploy_service\",\"success\":true,\"status\":\"SUCCESS\",\"message\":\"done\"}"));

            DeployResult result = router.deploy(ctx, developer, "payment-service", "1.2.0", "staging");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
            assertThat(result.getEnvironment()).isEqualTo("staging");
            verify(transport).callTool(ctx, ProxiedGatewayRouter.DEPLOY_TOOL,
                    Map.of("service_name", "payment-service", "version", "1.2.0", "environment", "staging"));
            verifyNoInteractions(fallback);
            verify(auditService).record(eq("dev-1"), eq("DEPLOY"), eq("payment-service"), eq(Route.PROXIED),
                    anyMap(), eq("req-1"), eq(true));
        }

        @Test
        void rollbackFallsBackToDirectExactlyOnceWithSameArguments() {
            RollbackResult direct = RollbackResult.of(Rollback.builder()
                    .rollbackId("rb-1")
                    .deploymentId("dep-1")
                    .reason("rollback due to memory leak")
                    .environment("staging")
                    .status(DeploymentStatus.SUCCESS)
                    .timestamp(Instant.now())
                    .build(), "Rolled back deployment dep-1 in staging");
            when(transport.callTool(eq(ctx), eq(ProxiedGatewayRouter.ROLLBACK_TOOL), anyMap()))
                    .thenThrow(new GatewayException("Gateway error: 502"));
            when(fallback.rollback(ctx, developer, "dep-1", "rollback due to memory leak", "staging"))
                    .thenReturn(direct);

            RollbackResult result = router.rollback(ctx, developer, "dep-1", "rollback due to memory leak", "staging");

            assertThat(result).isSameAs(direct);
            verify(fallback, times(1)).rollback(ctx, developer, "dep-1", "rollback due to memory leak", "staging");
            assertThat(meterRegistry.counter("devops.gateway.fallbacks", "operation", "rollback_deployment").count())
                    .isEqualTo(1.0);
            verify(auditService).record(eq("dev-1"), eq("ROLLBACK"), eq("dep-1"), eq(Route.FALLBACK),
                    anyMap(), eq("req-1"), eq(false));
        }

        @Test
        void directFailureAfterFallbackIsSurfaced() {
            when(transport.callTool(any(), anyString(), anyMap())).thenThrow(new GatewayException("down"));
            when(fallback.deploy(ctx, developer, "svc", "1.0", "staging"))
                    .thenThrow(new InternalException("deploy_service failed"));

            assertThatThrownBy(() -> router.deploy(ctx, developer, "svc", "1.0", "staging"))
                    .isInstanceOf(InternalException.class);
            verify(fallback, times(1)).deploy(ctx, developer, "svc", "1.0", "staging");
        }

        @Test
        void resultWithoutStatusTriggersFallback() throws Exception {
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.DEPLOY_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree("{\"unexpected\":true}"));
            when(fallback.deploy(ctx, developer, "svc", "1.0", "staging")).thenReturn(DeployResult.builder()
                    .success(true).status(DeploymentStatus.SUCCESS).environment("staging").build());

            assertThat(router.deploy(ctx, developer, "svc", "1.0", "staging").getStatus())
                    .isEqualTo(DeploymentStatus.SUCCESS);
            verify(fallback).deploy(ctx, developer, "svc", "1.0", "staging");
        }

        @Test
        void stagingRollbackKeepsEnvironmentWhenGatewayOmitsIt() throws Exception {
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.ROLLBACK_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree("{\"success\":true,\"status\":\"IN_PROGRESS\"}"));

            RollbackResult result = router.rollback(ctx, developer, "dep-1", "rollback due to memory leak", "staging");

            assertThat(result.getStatus()).isIn(DeploymentStatus.SUCCESS, DeploymentStatus.IN_PROGRESS);
            assertThat(result.getEnvironment()).isEqualTo("staging");
        }

        @Test
        void authenticateBuildsPrincipalFromGatewayPayload() throws Exception {
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.AUTHENTICATE_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree("{\"tool\":\"authenticate_user\",\"success\":true,"
                            + "\"result\":{\"user_id\":\"u-5\",\"login_id\":\"ops@example.com\",\"tenant\":\"acme\","
                            + "\"roles\":[\"Operator\"],\"permissions\":[\"deploy_production\"]}}"));

            Principal principal = router.authenticate(ctx, "session", null);

            assertThat(principal.getUserId()).isEqualTo("u-5");
            assertThat(principal.getLoginId()).isEqualTo("ops@example.com");
            assertThat(principal.getPermissions()).containsExactly("deploy_production");
            assertThat(principal.getToken()).isEqualTo("session");
            verifyNoInteractions(fallback);
        }

        @Test
        void rolesOnlyAnswerIsResolvedLikeADirectSession() throws Exception {
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.AUTHENTICATE_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree("{\"sub\":\"u1\",\"roles\":[\"Developer\"]}"));

            Principal principal = router.authenticate(ctx, "session", "refresh");

            assertThat(principal.getUserId()).isEqualTo("u1");
            assertThat(principal.getRoles()).containsExactly("Developer");
            assertThat(principal.getPermissions())
                    .containsExactlyInAnyOrder("read_logs", "read_metrics", "deploy_staging", "rollback_staging");
            assertThat(principal.getRawClaims()).containsEntry("sub", "u1");
            assertThat(principal.isDelegationEligible()).isTrue();
            assertThat(principal.getRefreshToken()).isEqualTo("refresh");
        }

        @Test
        void authenticateRejectionIsNotRetriedDirectly() throws Exception {
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.AUTHENTICATE_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree("{\"success\":false,\"error\":\"Invalid session token\"}"));

            assertThatThrownBy(() -> router.authenticate(ctx, "session", null))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Invalid session token");
            verify(fallback, never()).authenticate(any(), anyString(), any());
        }
    }

    @Nested
    @DisplayName("optimistic reads")
    class OptimisticReads {

        @Test
        void placeholderIsMarkedLoadingAndCarriesRequestId() {
            Executor neverRuns = command -> { };
            createRouter(neverRuns);

            LogsResult result = router.getLogs(ctx, developer, "error", 100, null);

            assertThat(result.getLoading()).isTrue();
            assertThat(result.getRequestId()).isNotBlank().isNotEqualTo("req-1");
            assertThat(result.getMessage()).isEqualTo("Loading real data in background...");
            assertThat(result.getCount()).isEqualTo(15);
            assertThat(result.getData()).allSatisfy(entry -> {
                assertThat(entry.level()).isEqualTo("ERROR");
                assertThat(entry.message()).startsWith("LOADING: ");
            });
            assertThat(resultStore.find(result.getRequestId())).get()
                    .extracting(PendingResult::getStatus).isEqualTo(PendingResult.Status.PENDING);
        }

        @Test
        void backgroundResultIsStoredForPolling() throws Exception {
            when(transport.callTool(eq(ctx), eq(ProxiedGatewayRouter.METRICS_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree("{\"uri\":\"metrics\",\"type\":\"metrics\",\"count\":1,"
                            + "\"data\":[{\"name\":\"cpu_utilization\",\"value\":42.0,\"unit\":\"percent\"}]}"));

            MetricsResult placeholder = router.getMetrics(ctx, developer, 5, null);

            assertThat(placeholder.getLoading()).isTrue();
            assertThat(placeholder.getCount()).isEqualTo(5);
            PendingResult stored = resultStore.find(placeholder.getRequestId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(PendingResult.Status.COMPLETED);
            assertThat(stored.getOwner()).isEqualTo("dev-1");
            assertThat(((MetricsResult) stored.getData()).getData()).hasSize(1);
        }

        @Test
        void clientRequestIdNeverKeysTheStoredResult() {
            createRouter(command -> { });
            Principal other = developer.toBuilder().userId("dev-2").build();

            LogsResult first = router.getLogs(ctx, developer, null, 5, null);
            MetricsResult second = router.getMetrics(ctx, other, 5, null);

            assertThat(first.getRequestId()).isNotEqualTo(second.getRequestId());
            assertThat(resultStore.find(first.getRequestId())).get()
                    .extracting(PendingResult::getOwner, PendingResult::getOperation)
                    .containsExactly("dev-1", "get_logs");
            assertThat(resultStore.find(second.getRequestId())).get()
                    .extracting(PendingResult::getOwner).isEqualTo("dev-2");
            assertThat(resultStore.find("req-1")).isEmpty();
        }

        @Test
        void backgroundFailureIsRecordedNotThrown() {
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.LOGS_TOOL), anyMap()))
                    .thenThrow(new GatewayException("Gateway error: 500"));

            LogsResult placeholder = router.getLogs(ctx, developer, null, 3, null);

            assertThat(placeholder.getCount()).isEqualTo(3);
            PendingResult stored = resultStore.find(placeholder.getRequestId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(PendingResult.Status.FAILED);
            assertThat(stored.getError()).contains("500");
            verifyNoInteractions(fallback);
        }
    }

    @Nested
    @DisplayName("synchronous reads")
    class SynchronousReads {

        @BeforeEach
        void synchronousMode() {
            properties.getProxy().setReadMode(GatewayProperties.ReadMode.SYNCHRONOUS);
        }

        @Test
        void returnsRealDataWithoutPlaceholder() throws Exception {
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.LOGS_TOOL), anyMap()))
                    .thenReturn(objectMapper.readTree("{\"count\":1,\"data\":[{\"level\":\"INFO\",\"message\":\"ok\"}]}"));

            LogsResult result = router.getLogs(ctx, developer, null, 10, null);

            assertThat(result.getLoading()).isNull();
            assertThat(result.getData()).extracting(LogEntry::message).containsExactly("ok");
        }

        @Test
        void failureFallsBackToDirect() {
            LogsResult direct = LogsResult.builder().count(0).build();
            when(transport.callTool(any(), eq(ProxiedGatewayRouter.LOGS_TOOL), anyMap()))
                    .thenThrow(new GatewayException("Gateway error: 503"));
            when(fallback.getLogs(ctx, developer, null, 10, null)).thenReturn(direct);

            assertThat(router.getLogs(ctx, developer, null, 10, null)).isSameAs(direct);
        }
    }
}
