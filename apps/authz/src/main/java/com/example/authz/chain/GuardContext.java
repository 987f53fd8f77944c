package com.example.authz.chain;

import com.example.authz.model.PolicyEntry;
import com.example.authz.model.Principal;
import org.springframework.lang.Nullable;

/**
 * State threaded through the stages. Each stage returns a new instance.
 *
 * @param request   the evaluated request
 * @param policy    resolved policy, null when the route declares none
 * @param principal null until the token stage succeeds
 * @param entity    entity loaded by the ownership stage, if any
 */
public record GuardContext(
        GuardRequest request,
        @Nullable PolicyEntry policy,
        @Nullable Principal principal,
        @Nullable Object entity
) {
    public static GuardContext initial(GuardRequest request, @Nullable PolicyEntry policy) {
        return new GuardContext(request, policy, null, null);
    }

    public GuardContext withPrincipal(Principal principal) {
        return new GuardContext(request, policy, principal, entity);
    }

    public GuardContext withEntity(Object entity) {
        return new GuardContext(request, policy, principal, entity);
    }
}
