package com.example.authz.config;

import com.example.authz.adapter.AdminSource;
import com.example.authz.adapter.RoleAdapters;
import com.example.authz.adapter.StoreRoleSource;
import com.example.authz.adapter.UserRoleSource;
import com.example.authz.audit.AuthzAuditService;
import com.example.authz.chain.GuardChain;
import com.example.authz.chain.RouteParameters;
import com.example.authz.chain.stage.EntityOwnershipStage;
import com.example.authz.chain.stage.PermissionStage;
import com.example.authz.chain.stage.SiteAdminStage;
import com.example.authz.chain.stage.StoreRoleStage;
import com.example.authz.chain.stage.TokenValidationStage;
import com.example.authz.config.properties.AuthzProperties;
import com.example.authz.entity.EntityLookupRegistry;
import com.example.authz.entity.EntityOwnerResolver;
import com.example.authz.filter.GuardChainWebFilter;
import com.example.authz.policy.PolicyEngine;
import com.example.authz.policy.PolicyResolver;
import com.example.authz.token.Hs256JwtDecoders;
import com.example.authz.token.TokenValidator;
import com.example.authz.observability.metrics.AuthzMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;

/**
 * Wires the guard chain. The host application provides {@link UserRoleSource},
 * {@link StoreRoleSource} and {@link AdminSource} beans, and optionally an
 * {@link EntityLookupRegistry} for ownership-scoped routes.
 */
@Slf4j
@AutoConfiguration(after = {JacksonAutoConfiguration.class, WebFluxAutoConfiguration.class})
@EnableConfigurationProperties(AuthzProperties.class)
@ConditionalOnProperty(name = "app.authz.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ReactiveJwtDecoder authzJwtDecoder(AuthzProperties properties) {
        AuthzProperties.JwtProperties jwt = properties.jwt();
        return Hs256JwtDecoders.create(jwt.secret(), jwt.clockSkew(), jwt.issuer());
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleAdapters roleAdapters(UserRoleSource userRoleSource,
                                     StoreRoleSource storeRoleSource,
                                     AdminSource adminSource) {
        return new RoleAdapters(userRoleSource, storeRoleSource, adminSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenValidator tokenValidator(ReactiveJwtDecoder jwtDecoder, RoleAdapters roleAdapters,
                                         AuthzProperties properties) {
        return new TokenValidator(jwtDecoder, roleAdapters, properties.jwt().permissionsClaim());
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityLookupRegistry entityLookupRegistry() {
        return EntityLookupRegistry.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityOwnerResolver entityOwnerResolver(EntityLookupRegistry registry) {
        log.info("Entity lookups registered for ownership checks: {}", registry.names());
        return new EntityOwnerResolver(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyResolver policyResolver() {
        return new PolicyResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyEngine policyEngine() {
        return new PolicyEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardChain guardChain(PolicyResolver policyResolver,
                                 PolicyEngine policyEngine,
                                 TokenValidator tokenValidator,
                                 RoleAdapters roleAdapters,
                                 EntityOwnerResolver entityOwnerResolver,
                                 AuthzProperties properties) {
        RouteParameters routeParameters = new RouteParameters(properties.storeIdParams());
        return new GuardChain(
                policyResolver,
                new TokenValidationStage(tokenValidator),
                new SiteAdminStage(roleAdapters, policyEngine),
                new StoreRoleStage(roleAdapters, policyEngine, routeParameters),
                new EntityOwnershipStage(entityOwnerResolver, roleAdapters, policyEngine),
                new PermissionStage(roleAdapters, policyEngine, routeParameters));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "app.authz.audit.enabled", havingValue = "true", matchIfMissing = true)
    public AuthzAuditService authzAuditService(ObjectProvider<ObjectMapper> objectMapper) {
        return new AuthzAuditService(objectMapper.getIfAvailable(() -> Jackson2ObjectMapperBuilder.json().build()));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    public GuardChainWebFilter guardChainWebFilter(
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping,
            GuardChain guardChain,
            ObjectProvider<AuthzAuditService> auditService,
            ObjectProvider<MeterRegistry> meterRegistry,
            ObjectProvider<ObjectMapper> objectMapper,
            AuthzProperties properties) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        AuthzMetrics metrics = registry != null ? new AuthzMetrics(registry) : null;
        return new GuardChainWebFilter(handlerMapping, guardChain, auditService.getIfAvailable(), metrics,
                objectMapper.getIfAvailable(() -> Jackson2ObjectMapperBuilder.json().build()), properties.publicPaths());
    }
}
