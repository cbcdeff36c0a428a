package com.example.devopsgateway.gateway;

import com.example.devopsgateway.domain.DeployResult;
import com.example.devopsgateway.domain.Deployment;
import com.example.devopsgateway.domain.DeploymentStatus;
import com.example.devopsgateway.domain.LogEntry;
import com.example.devopsgateway.domain.LogsResult;
import com.example.devopsgateway.domain.Route;
import com.example.devopsgateway.exception.InternalException;
import com.example.devopsgateway.exception.PermissionDeniedException;
import com.example.devopsgateway.exception.ValidationException;
import com.example.devopsgateway.security.IdentityProvider;
import com.example.devopsgateway.security.PermissionEngine;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.PrincipalResolver;
import com.example.devopsgateway.service.AuditService;
import com.example.devopsgateway.service.DeployService;
import com.example.devopsgateway.service.LogService;
import com.example.devopsgateway.service.MetricsService;
import com.example.devopsgateway.service.RollbackService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DirectGatewayRouterTest {

    @Mock
    private LogService logService;
    @Mock
    private MetricsService metricsService;
    @Mock
    private DeployService deployService;
    @Mock
    private RollbackService rollbackService;
    @Mock
    private PrincipalResolver principalResolver;
    @Mock
    private AuditService auditService;
    @Mock
    private IdentityProvider identityProvider;

    private SimpleMeterRegistry meterRegistry;
    private DirectGatewayRouter router;
    private final RequestContext ctx = RequestContext.builder().requestId("req-9").build();

    private final Principal operator = Principal.builder()
            .userId("op-1")
            .permission("read_logs")
            .permission("deploy_production")
            .permission("rollback_production")
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        router = new DirectGatewayRouter(new PermissionEngine(identityProvider), auditService, meterRegistry,
                logService, metricsService, deployService, rollbackService, principalResolver);
    }

    @Nested
    @DisplayName("logs")
    class Logs {

        @Test
        void levelIsNormalizedAndFiltersEchoed() {
            when(logService.getRecentLogs("WARN", 20, null)).thenReturn(List.of(
                    new LogEntry(Instant.now(), "WARN", "High memory usage detected", "api-gateway")));

            LogsResult result = router.getLogs(ctx, operator, "warning", 20, null);

            assertThat(result.getCount()).isEqualTo(1);
            assertThat(result.getFilters()).containsEntry("level", "WARN").containsEntry("limit", 20);
            assertThat(result.getLoading()).isNull();
            assertThat(meterRegistry.counter("devops.gateway.calls", "operation", "get_logs", "route", "DIRECT").count())
                    .isEqualTo(1.0);
            verify(auditService).record(eq("op-1"), eq("GET_LOGS"), eq("logs"), eq(Route.DIRECT), isNull(),
                    eq("req-9"), eq(true));
        }

        @Test
        void sinceWindowIsHandedToTheService() {
            Instant now = Instant.now();
            when(logService.getRecentLogs(isNull(), eq(10), any(Instant.class))).thenReturn(List.of(
                    new LogEntry(now.minus(Duration.ofMinutes(5)), "INFO", "recent", "svc")));

            LogsResult result = router.getLogs(ctx, operator, null, 10, "1h");

            ArgumentCaptor<Instant> since = ArgumentCaptor.forClass(Instant.class);
            verify(logService).getRecentLogs(isNull(), eq(10), since.capture());
            assertThat(since.getValue())
                    .isBetween(now.minus(Duration.ofMinutes(61)), now.minus(Duration.ofMinutes(59)));
            assertThat(result.getData()).extracting(LogEntry::message).containsExactly("recent");
            assertThat(result.getFilters()).containsEntry("since", "1h");
        }

        @Test
        void invalidArgumentsAreValidationErrors() {
            assertThatThrownBy(() -> router.getLogs(ctx, operator, "LOUD", 10, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> router.getLogs(ctx, operator, null, 0, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> router.getLogs(ctx, operator, null, 10, "yesterday"))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(logService);
        }

        @Test
        void serviceFailureIsInternalError() {
            when(logService.getRecentLogs(null, 10, null)).thenThrow(new IllegalStateException("backend exploded"));

            assertThatThrownBy(() -> router.getLogs(ctx, operator, null, 10, null))
                    .isInstanceOf(InternalException.class)
                    .hasMessageContaining("backend exploded");
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        void deployChecksEnvironmentPermissionFirst() {
            assertThatThrownBy(() -> router.deploy(ctx, operator, "svc", "1.0", "staging"))
                    .isInstanceOf(PermissionDeniedException.class)
                    .hasMessageContaining("deploy_staging");
            verifyNoInteractions(deployService);
        }

        @Test
        void deployDelegatesToService() {
            Deployment deployment = Deployment.builder()
                    .deploymentId("d-1").serviceName("svc").version("1.0").environment("production")
                    .status(DeploymentStatus.FAILED).timestamp(Instant.now()).build();
            when(deployService.deploy("svc", "1.0", "production"))
                    .thenReturn(DeployResult.of(deployment, "Failed to deploy svc to production."));

            DeployResult result = router.deploy(ctx, operator, " svc ", "1.0", "PRODUCTION");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getStatus()).isEqualTo(DeploymentStatus.FAILED);
            verify(auditService).record(eq("op-1"), eq("DEPLOY"), eq("svc"), eq(Route.DIRECT), anyMap(),
                    eq("req-9"), eq(false));
        }

        @Test
        void shortRollbackReasonNeverReachesTheService() {
            assertThatThrownBy(() -> router.rollback(ctx, operator, "d-1", " oops ", "production"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at least 5");
            verifyNoInteractions(rollbackService);
        }

        @Test
        void blankServiceNameIsRejected() {
            assertThatThrownBy(() -> router.deploy(ctx, operator, " ", "1.0", "production"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("service_name");
        }
    }

    @Test
    void authenticateUsesStrictResolution() {
        Principal resolved = Principal.builder().userId("u-3").build();
        when(principalResolver.resolveSession("tok", "ref")).thenReturn(resolved);

        assertThat(router.authenticate(ctx, "tok", "ref")).isSameAs(resolved);
    }

    @Test
    void relativeAndAbsoluteSinceParsing() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");

        assertThat(AbstractGatewayRouter.parseSince("30m", now)).isEqualTo(Instant.parse("2024-05-01T11:30:00Z"));
        assertThat(AbstractGatewayRouter.parseSince("2d", now)).isEqualTo(Instant.parse("2024-04-29T12:00:00Z"));
        assertThat(AbstractGatewayRouter.parseSince("2024-04-30T00:00:00Z", now))
                .isEqualTo(Instant.parse("2024-04-30T00:00:00Z"));
        assertThat(AbstractGatewayRouter.parseSince(null, now)).isNull();
    }
}
