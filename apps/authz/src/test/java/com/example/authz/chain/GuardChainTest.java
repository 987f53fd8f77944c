package com.example.authz.chain;

import com.example.authz.adapter.AdminSource;
import com.example.authz.adapter.RoleAdapters;
import com.example.authz.adapter.StoreRoleSource;
import com.example.authz.adapter.UserRoleSource;
import com.example.authz.annotation.EntityOwner;
import com.example.authz.annotation.RequireAdminRole;
import com.example.authz.annotation.RequireStoreRoles;
import com.example.authz.annotation.RequiresPermission;
import com.example.authz.chain.stage.EntityOwnershipStage;
import com.example.authz.chain.stage.PermissionStage;
import com.example.authz.chain.stage.SiteAdminStage;
import com.example.authz.chain.stage.StoreRoleStage;
import com.example.authz.chain.stage.TokenValidationStage;
import com.example.authz.entity.EntityLookupRegistry;
import com.example.authz.entity.EntityOwnerResolver;
import com.example.authz.entity.FindByIdLookup;
import com.example.authz.entity.UserOwned;
import com.example.authz.model.DenialKind;
import com.example.authz.model.DenialReason;
import com.example.authz.model.PermissionAction;
import com.example.authz.model.PermissionResource;
import com.example.authz.model.StoreRole;
import com.example.authz.model.StoreRoleAssignment;
import com.example.authz.model.StoreSummary;
import com.example.authz.policy.PolicyEngine;
import com.example.authz.policy.PolicyResolver;
import com.example.authz.policy.RouteDescriptor;
import com.example.authz.token.TokenValidator;
import com.example.authz.util.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GuardChain")
class GuardChainTest {

    @Mock
    private UserRoleSource userRoleSource;

    @Mock
    private StoreRoleSource storeRoleSource;

    @Mock
    private AdminSource adminSource;

    private final Map<String, Order> orders = Map.of("o1", new Order("o1", "u1"));

    private GuardChain guardChain;

    @BeforeEach
    void setUp() {
        RoleAdapters roleAdapters = new RoleAdapters(userRoleSource, storeRoleSource, adminSource);
        PolicyEngine engine = new PolicyEngine();
        RouteParameters routeParameters = new RouteParameters(RouteParameters.DEFAULT_STORE_ID_PARAMS);
        FindByIdLookup<Order> orderLookup = id -> Mono.justOrEmpty(orders.get(id));
        EntityOwnerResolver resolver = new EntityOwnerResolver(
                EntityLookupRegistry.builder().register("orders", orderLookup).build());

        guardChain = new GuardChain(
                new PolicyResolver(),
                new TokenValidationStage(new TokenValidator(TestTokens.decoder(), roleAdapters, "permissions")),
                new SiteAdminStage(roleAdapters, engine),
                new StoreRoleStage(roleAdapters, engine, routeParameters),
                new EntityOwnershipStage(resolver, roleAdapters, engine),
                new PermissionStage(roleAdapters, engine, routeParameters));

        lenient().when(userRoleSource.isUserActive(anyString())).thenReturn(Mono.just(true));
        lenient().when(adminSource.isUserValidAdmin(anyString())).thenReturn(Mono.just(false));
        lenient().when(storeRoleSource.findStore(anyString()))
                .thenAnswer(inv -> Mono.just(new StoreSummary(inv.getArgument(0), "Store", true)));
        lenient().when(storeRoleSource.hasUserStoreRole(any())).thenReturn(Mono.just(true));
    }

    @Test
    @DisplayName("should run the stages in the documented order")
    void shouldExposeStageOrder() {
        assertThat(guardChain.stages()).extracting(GuardStage::name).containsExactly(
                "TokenValidator", "SiteAdminCheck", "StoreRoleCheck", "EntityOwnershipCheck", "PermissionCheck");
    }

    @Nested
    @DisplayName("authentication")
    class Authentication {

        @Test
        @DisplayName("should allow an authenticated caller on a route without policy")
        void shouldAllowUnconstrainedRoute() {
            StepVerifier.create(guardChain.evaluate(request("open", TestTokens.bearer("u1"), Map.of())))
                    .assertNext(outcome -> {
                        assertThat(outcome.isAllowed()).isTrue();
                        assertThat(outcome.principal().id()).isEqualTo("u1");
                        assertThat(outcome.principal().siteAdminComputed()).isTrue();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny an inactive account with a valid token as unauthenticated")
        void shouldDenyInactiveAccount() {
            when(userRoleSource.isUserActive("u1")).thenReturn(Mono.just(false));

            StepVerifier.create(guardChain.evaluate(request("open", TestTokens.bearer("u1"), Map.of())))
                    .assertNext(outcome -> {
                        assertThat(outcome.decision().deniedKind()).isEqualTo(DenialKind.UNAUTHENTICATED);
                        assertThat(outcome.decision().reason()).isEqualTo(DenialReason.ACCOUNT_INACTIVE);
                        assertThat(outcome.decision().stage()).isEqualTo("TokenValidator");
                        assertThat(outcome.principal()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should stop before any role lookup when the token is missing")
        void shouldShortCircuitOnMissingToken() {
            StepVerifier.create(guardChain.evaluate(request("storeAdminOnly", null, Map.of("storeId", "s1"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason())
                            .isEqualTo(DenialReason.MISSING_CREDENTIAL))
                    .verifyComplete();

            verifyNoInteractions(adminSource, storeRoleSource);
        }
    }

    @Nested
    @DisplayName("site admin")
    class SiteAdmin {

        @Test
        @DisplayName("should bypass store role, ownership and permission checks")
        void siteAdminBypassesEverything() {
            givenSiteAdmin("root");

            StepVerifier.create(guardChain.evaluate(
                            request("everything", TestTokens.bearer("root"), Map.of("storeId", "s1", "id", "missing"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.isAllowed()).isTrue();
                        assertThat(outcome.principal().isSiteAdmin()).isTrue();
                    })
                    .verifyComplete();

            verify(userRoleSource, never()).getUserStoreRoles(anyString());
        }

        @Test
        @DisplayName("should resolve to non-admin when the admin lookup fails")
        void adminLookupFailureMeansNotAdmin() {
            when(adminSource.isUserValidAdmin("u1")).thenReturn(Mono.error(new IllegalStateException("down")));

            StepVerifier.create(guardChain.evaluate(request("adminOnly", TestTokens.bearer("u1"), Map.of())))
                    .assertNext(outcome -> {
                        assertThat(outcome.decision().reason()).isEqualTo(DenialReason.ADMIN_REQUIRED);
                        assertThat(outcome.principal().siteAdmin()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny a regular user on an admin-role route")
        void regularUserIsNotSiteAdmin() {
            StepVerifier.create(guardChain.evaluate(
                            request("adminOnly", TestTokens.bearer("u1"), Map.of("storeId", "s1"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason())
                            .isEqualTo(DenialReason.ADMIN_REQUIRED))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("store roles")
    class StoreRoles {

        @Test
        @DisplayName("should allow the admin of the addressed store")
        void shouldAllowStoreAdmin() {
            givenStoreRoles("u1", new StoreRoleAssignment("u1", "s1", StoreRole.ADMIN));

            StepVerifier.create(guardChain.evaluate(
                            request("storeAdminOnly", TestTokens.bearer("u1"), Map.of("storeId", "s1"))))
                    .assertNext(outcome -> assertThat(outcome.isAllowed()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny a guest of the addressed store")
        void shouldDenyGuest() {
            givenStoreRoles("u1", new StoreRoleAssignment("u1", "s1", StoreRole.GUEST));

            StepVerifier.create(guardChain.evaluate(
                            request("storeAdminOnly", TestTokens.bearer("u1"), Map.of("storeId", "s1"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.decision().deniedKind()).isEqualTo(DenialKind.FORBIDDEN);
                        assertThat(outcome.decision().reason()).isEqualTo(DenialReason.STORE_ROLE_REQUIRED);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny a moderator and an admin of another store")
        void shouldDenyModeratorAndOtherStoreAdmin() {
            givenStoreRoles("u1",
                    new StoreRoleAssignment("u1", "s1", StoreRole.MODERATOR),
                    new StoreRoleAssignment("u1", "s2", StoreRole.ADMIN));

            StepVerifier.create(guardChain.evaluate(
                            request("storeAdminOnly", TestTokens.bearer("u1"), Map.of("storeId", "s1"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason())
                            .isEqualTo(DenialReason.STORE_ROLE_REQUIRED))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report a configuration error when no store id is present")
        void shouldReportMissingStoreId() {
            StepVerifier.create(guardChain.evaluate(request("storeAdminOnly", TestTokens.bearer("u1"), Map.of())))
                    .assertNext(outcome -> {
                        assertThat(outcome.decision().reason()).isEqualTo(DenialReason.STORE_ID_MISSING);
                        assertThat(outcome.decision().isConfigurationError()).isTrue();
                        assertThat(outcome.decision().deniedKind()).isEqualTo(DenialKind.FORBIDDEN);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject malformed store ids before any lookup")
        void shouldRejectMalformedStoreId() {
            StepVerifier.create(guardChain.evaluate(
                            request("storeAdminOnly", TestTokens.bearer("u1"), Map.of("storeId", "s1;drop"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason())
                            .isEqualTo(DenialReason.INVALID_STORE_ID))
                    .verifyComplete();

            verify(storeRoleSource, never()).findStore(anyString());
        }

        @Test
        @DisplayName("should deny unknown stores")
        void shouldDenyUnknownStore() {
            when(storeRoleSource.findStore("s9")).thenReturn(Mono.empty());

            StepVerifier.create(guardChain.evaluate(
                            request("storeAdminOnly", TestTokens.bearer("u1"), Map.of("storeId", "s9"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason())
                            .isEqualTo(DenialReason.STORE_NOT_FOUND))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when the role lookup fails")
        void shouldDenyOnRoleLookupFailure() {
            when(userRoleSource.getUserStoreRoles("u1")).thenReturn(Flux.error(new IllegalStateException("down")));

            StepVerifier.create(guardChain.evaluate(
                            request("storeAdminOnly", TestTokens.bearer("u1"), Map.of("storeId", "s1"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason())
                            .isEqualTo(DenialReason.ROLE_LOOKUP_FAILED))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("ownership")
    class Ownership {

        @Test
        @DisplayName("should allow the owner and expose the entity")
        void shouldAllowOwner() {
            StepVerifier.create(guardChain.evaluate(request("ownedOrder", TestTokens.bearer("u1"), Map.of("id", "o1"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.isAllowed()).isTrue();
                        assertThat(outcome.entity()).isEqualTo(orders.get("o1"));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny another user")
        void shouldDenyOtherUser() {
            StepVerifier.create(guardChain.evaluate(request("ownedOrder", TestTokens.bearer("u2"), Map.of("id", "o1"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason()).isEqualTo(DenialReason.NOT_OWNER))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny as forbidden, not error, when the entity does not exist")
        void shouldDenyMissingEntity() {
            StepVerifier.create(guardChain.evaluate(
                            request("ownedOrder", TestTokens.bearer("u1"), Map.of("id", "nope"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.decision().deniedKind()).isEqualTo(DenialKind.FORBIDDEN);
                        assertThat(outcome.decision().reason()).isEqualTo(DenialReason.ENTITY_NOT_FOUND);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report an unregistered lookup as a configuration error")
        void shouldReportUnregisteredLookup() {
            StepVerifier.create(guardChain.evaluate(
                            request("unknownLookup", TestTokens.bearer("u1"), Map.of("id", "o1"))))
                    .assertNext(outcome -> assertThat(outcome.decision().reason())
                            .isEqualTo(DenialReason.LOOKUP_NOT_CONFIGURED))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("permissions")
    class Permissions {

        @Test
        @DisplayName("should allow when the token grants every scope")
        void shouldAllowGrantedScopes() {
            StepVerifier.create(guardChain.evaluate(
                            request("updateOrders", TestTokens.bearer("u1", "orders:read", "orders:update"),
                                    Map.of("storeId", "s1"))))
                    .assertNext(outcome -> assertThat(outcome.isAllowed()).isTrue())
                    .verifyComplete();

            verify(userRoleSource, never()).getUserStoreRoles(anyString());
        }

        @Test
        @DisplayName("should list missing scopes")
        void shouldListMissingScopes() {
            givenStoreRoles("u1");

            StepVerifier.create(guardChain.evaluate(
                            request("updateOrders", TestTokens.bearer("u1", "orders:read"), Map.of("storeId", "s1"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.decision().reason()).isEqualTo(DenialReason.MISSING_PERMISSIONS);
                        assertThat(outcome.decision().missing()).containsExactly("orders:update");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should let the admin of the route's store through without scopes")
        void storeAdminBypassesScopes() {
            givenStoreRoles("u1", new StoreRoleAssignment("u1", "s1", StoreRole.ADMIN));

            StepVerifier.create(guardChain.evaluate(
                            request("updateOrders", TestTokens.bearer("u1"), Map.of("storeId", "s1"))))
                    .assertNext(outcome -> assertThat(outcome.isAllowed()).isTrue())
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("should turn an unexpected stage error into a forbidden internal error")
    void shouldMapStageErrors() {
        GuardStage failing = new GuardStage() {
            @Override
            public String name() {
                return "Exploding";
            }

            @Override
            public Mono<StageResult> apply(GuardContext context) {
                throw new IllegalStateException("boom");
            }
        };
        GuardChain chain = new GuardChain(new PolicyResolver(), List.of(failing));

        StepVerifier.create(chain.evaluate(request("open", TestTokens.bearer("u1"), Map.of())))
                .assertNext(outcome -> {
                    assertThat(outcome.decision().deniedKind()).isEqualTo(DenialKind.FORBIDDEN);
                    assertThat(outcome.decision().reason()).isEqualTo(DenialReason.INTERNAL_ERROR);
                    assertThat(outcome.decision().stage()).isEqualTo("Exploding");
                })
                .verifyComplete();
    }

    private void givenSiteAdmin(String userId) {
        when(adminSource.isUserValidAdmin(userId)).thenReturn(Mono.just(true));
        when(userRoleSource.isSiteAdmin(userId)).thenReturn(Mono.just(true));
    }

    private void givenStoreRoles(String userId, StoreRoleAssignment... assignments) {
        when(userRoleSource.getUserStoreRoles(userId)).thenReturn(Flux.just(assignments));
    }

    private static GuardRequest request(String handler, String credential, Map<String, String> params) {
        try {
            TestController controller = new TestController();
            return new GuardRequest(
                    RouteDescriptor.of(controller, TestController.class.getMethod(handler)), credential, params);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(handler, e);
        }
    }

    record Order(String id, String ownerId) implements UserOwned {
    }

    static class TestController {

        public void open() {
        }

        @RequireAdminRole
        public void adminOnly() {
        }

        @RequireStoreRoles(StoreRole.ADMIN)
        public void storeAdminOnly() {
        }

        @EntityOwner(lookup = "orders")
        public void ownedOrder() {
        }

        @EntityOwner(lookup = "reviews")
        public void unknownLookup() {
        }

        @RequiresPermission(resource = PermissionResource.ORDERS, actions = {PermissionAction.READ, PermissionAction.UPDATE})
        public void updateOrders() {
        }

        @RequireStoreRoles(StoreRole.ADMIN)
        @EntityOwner(lookup = "orders")
        @RequiresPermission(resource = PermissionResource.ORDERS, actions = PermissionAction.DELETE)
        public void everything() {
        }
    }
}
