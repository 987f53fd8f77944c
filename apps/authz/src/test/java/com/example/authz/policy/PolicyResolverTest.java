package com.example.authz.policy;

import com.example.authz.annotation.EntityOwner;
import com.example.authz.annotation.RequireAdminRole;
import com.example.authz.annotation.RequireAuthenticated;
import com.example.authz.annotation.RequireStoreRoles;
import com.example.authz.annotation.RequiresPermission;
import com.example.authz.model.AdminRole;
import com.example.authz.model.PermissionAction;
import com.example.authz.model.PermissionResource;
import com.example.authz.model.PermissionScope;
import com.example.authz.model.PolicyEntry;
import com.example.authz.model.StoreRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PolicyResolver")
class PolicyResolverTest {

    private PolicyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PolicyResolver();
    }

    @Nested
    @DisplayName("annotation metadata")
    class AnnotationMetadata {

        @Test
        @DisplayName("should return null when nothing is declared")
        void shouldReturnNullWhenNothingDeclared() throws Exception {
            assertThat(resolver.resolve(route(new PlainController(), "list"))).isNull();
        }

        @Test
        @DisplayName("should read store roles and imply authentication")
        void shouldReadStoreRoles() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new OrdersController(), "findAllByStore"));

            assertThat(entry.storeRoles()).containsExactlyInAnyOrder(StoreRole.ADMIN, StoreRole.MODERATOR);
            assertThat(entry.requiresAuthentication()).isTrue();
            assertThat(entry.storeIdParam()).isEqualTo("storeId");
        }

        @Test
        @DisplayName("should collect repeated permission annotations")
        void shouldCollectRepeatedPermissions() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new OrdersController(), "update"));

            assertThat(entry.requiredScopes()).containsExactlyInAnyOrder(
                    PermissionScope.parse("orders:read"),
                    PermissionScope.parse("orders:update"),
                    PermissionScope.parse("inventory:update"));
        }

        @Test
        @DisplayName("should read entity ownership configuration")
        void shouldReadEntityOwner() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new OrdersController(), "findOne"));

            assertThat(entry.entityOwner().lookup()).isEqualTo("orders");
            assertThat(entry.entityOwner().idParam()).isEqualTo("orderId");
            assertThat(entry.entityOwner().allowMissingEntity()).isTrue();
        }

        @Test
        @DisplayName("should fall back to class-level annotations")
        void shouldFallBackToClassLevel() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new AdminController(), "stats"));

            assertThat(entry.adminRole()).isEqualTo(AdminRole.ADMIN);
        }

        @Test
        @DisplayName("method-level annotations should be combined with class-level ones")
        void shouldCombineMethodAndClassLevel() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new AdminController(), "purge"));

            assertThat(entry.adminRole()).isEqualTo(AdminRole.ADMIN);
            assertThat(entry.requiredScopes()).containsExactly(PermissionScope.parse("stores:delete"));
        }

        @Test
        @DisplayName("should return the canonical entry for authentication-only routes")
        void shouldReturnCanonicalAuthenticatedOnly() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new OrdersController(), "mine"));

            assertThat(entry).isSameAs(PolicyEntry.authenticatedOnly());
        }
    }

    @Nested
    @DisplayName("static access policy table")
    class StaticTable {

        @Test
        @DisplayName("should use the table when no annotation is present")
        void shouldUseTable() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new ProductsController(), "remove"));

            assertThat(entry.adminRole()).isEqualTo(AdminRole.ADMIN);
        }

        @Test
        @DisplayName("annotation should override a conflicting table entry")
        void annotationOverridesTable() throws Exception {
            PolicyEntry entry = resolver.resolve(route(new ProductsController(), "findAll"));

            assertThat(entry.storeRoles()).containsExactly(StoreRole.GUEST);
            // Kinds the annotation does not declare still come from the table
            assertThat(entry.requiredScopes()).containsExactly(PermissionScope.parse("products:read"));
        }

        @Test
        @DisplayName("controllers sharing a base class should not share table entries")
        void siblingsDoNotLeakEntries() throws Exception {
            PolicyEntry reviews = resolver.resolve(route(new ReviewsController(), "findAll"));
            PolicyEntry carts = resolver.resolve(route(new CartsController(), "findAll"));

            assertThat(reviews.storeRoles()).containsExactly(StoreRole.MODERATOR);
            assertThat(carts.storeRoles()).containsExactly(StoreRole.ADMIN);
        }

        @Test
        @DisplayName("should re-read the table from the controller instance on every call")
        void shouldNotCacheTableEntries() throws Exception {
            assertThat(resolver.resolve(route(new ReviewsController(), "findAll")).storeRoles())
                    .containsExactly(StoreRole.MODERATOR);
            assertThat(resolver.resolve(route(new CartsController(), "findAll")).storeRoles())
                    .containsExactly(StoreRole.ADMIN);
            assertThat(resolver.resolve(route(new ReviewsController(), "findAll")).storeRoles())
                    .containsExactly(StoreRole.MODERATOR);
        }
    }

    private static RouteDescriptor route(Object controller, String methodName) throws Exception {
        Method method = controller.getClass().getMethod(methodName);
        return RouteDescriptor.of(controller, method);
    }

    static class PlainController {

        public void list() {
        }
    }

    static class OrdersController {

        @RequireStoreRoles(value = {StoreRole.ADMIN, StoreRole.MODERATOR}, storeIdParam = "storeId")
        public void findAllByStore() {
        }

        @RequiresPermission(resource = PermissionResource.ORDERS, actions = {PermissionAction.READ, PermissionAction.UPDATE})
        @RequiresPermission(resource = PermissionResource.INVENTORY, actions = PermissionAction.UPDATE)
        public void update() {
        }

        @EntityOwner(lookup = "orders", idParam = "orderId", allowMissingEntity = true)
        public void findOne() {
        }

        @RequireAuthenticated
        public void mine() {
        }
    }

    @RequireAdminRole
    static class AdminController {

        public void stats() {
        }

        @RequiresPermission(resource = PermissionResource.STORES, actions = PermissionAction.DELETE)
        public void purge() {
        }
    }

    static class ProductsController implements AccessPolicyAware {

        static final AccessPolicyTable POLICIES = AccessPolicyTable.builder()
                .policy("findAll", PolicyEntry.builder()
                        .storeRoles(Set.of(StoreRole.ADMIN))
                        .requiredScopes(Set.of(PermissionScope.parse("products:read")))
                        .build())
                .policy("remove", PolicyEntry.builder().adminRole(AdminRole.ADMIN).build())
                .build();

        @Override
        public AccessPolicyTable accessPolicies() {
            return POLICIES;
        }

        @RequireStoreRoles(StoreRole.GUEST)
        public void findAll() {
        }

        public void remove() {
        }
    }

    abstract static class BaseStoreController implements AccessPolicyAware {

        public void findAll() {
        }
    }

    static class ReviewsController extends BaseStoreController {

        @Override
        public AccessPolicyTable accessPolicies() {
            return AccessPolicyTable.builder()
                    .policy("findAll", PolicyEntry.builder().storeRoles(Set.of(StoreRole.MODERATOR)).build())
                    .build();
        }
    }

    static class CartsController extends BaseStoreController {

        @Override
        public AccessPolicyTable accessPolicies() {
            return AccessPolicyTable.builder()
                    .policy("findAll", PolicyEntry.builder().storeRoles(Set.of(StoreRole.ADMIN)).build())
                    .build();
        }
    }
}
