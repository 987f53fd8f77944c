package com.example.authz.policy;

import com.example.authz.exception.GuardConfigurationException;
import org.springframework.lang.NonNull;
import org.springframework.util.ClassUtils;
import org.springframework.web.method.HandlerMethod;

import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Identifies the handler a request was routed to.
 *
 * @param controller     the controller instance
 * @param controllerType the user-level controller class (proxies unwrapped)
 * @param handler        the handler method
 */
public record RouteDescriptor(
        @NonNull Object controller,
        @NonNull Class<?> controllerType,
        @NonNull Method handler
) {
    public RouteDescriptor {
        Objects.requireNonNull(controller, "controller");
        Objects.requireNonNull(controllerType, "controllerType");
        Objects.requireNonNull(handler, "handler");
    }

    public static RouteDescriptor of(Object controller, Method handler) {
        Objects.requireNonNull(controller, "controller");
        return new RouteDescriptor(controller, ClassUtils.getUserClass(controller), handler);
    }

    /**
     * Builds the descriptor from a routed handler, resolving the controller bean
     * when the handler still carries its bean name.
     *
     * @throws GuardConfigurationException if the controller bean cannot be resolved
     */
    public static RouteDescriptor from(HandlerMethod handlerMethod) {
        HandlerMethod resolved = handlerMethod;
        if (handlerMethod.getBean() instanceof String beanName) {
            try {
                resolved = handlerMethod.createWithResolvedBean();
            } catch (RuntimeException e) {
                throw new GuardConfigurationException("Controller bean '" + beanName + "' cannot be resolved", e);
            }
        }
        return new RouteDescriptor(resolved.getBean(), ClassUtils.getUserClass(resolved.getBeanType()),
                resolved.getMethod());
    }

    public String handlerName() {
        return handler.getName();
    }

    public String routeId() {
        return controllerType.getSimpleName() + "#" + handler.getName();
    }
}
