package com.example.authz.entity;

import com.example.authz.common.util.StringSanitizer;
import com.example.authz.exception.GuardConfigurationException;
import com.example.authz.model.EntityOwnerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Loads the entity addressed by an ownership-scoped route.
 *
 * <p>The registered collaborator is asked through {@link EntityByIdLookup},
 * then {@link FindByIdLookup}, then {@link FindOneLookup}. Kinds it does not
 * implement are skipped; an empty result falls through to the next kind; the
 * first entity found wins.
 */
@Slf4j
@RequiredArgsConstructor
public class EntityOwnerResolver {

    private final EntityLookupRegistry registry;

    /**
     * @return the entity, empty when the id parameter is absent or nothing matches,
     *         or an error with {@link GuardConfigurationException} when the lookup is not usable
     */
    public Mono<Object> resolveOwner(EntityOwnerConfig config, Map<String, String> routeParams) {
        return Mono.defer(() -> {
            Object lookup = registry.find(config.lookup())
                    .orElseThrow(() -> new GuardConfigurationException(
                            "No entity lookup registered under '" + config.lookup() + "'"));
            if (!EntityLookupRegistry.isSupported(lookup)) {
                throw new GuardConfigurationException("Entity lookup '" + config.lookup()
                        + "' exposes none of getEntityById, findById or findOne");
            }

            String id = routeParams.get(config.idParam());
            if (id == null || id.isBlank()) {
                log.debug("Route parameter '{}' missing for entity lookup '{}'",
                        config.idParam(), config.lookup());
                return Mono.empty();
            }

            Mono<Object> result = Mono.empty();
            for (Supplier<Mono<?>> attempt : attemptsFor(lookup, id)) {
                result = result.switchIfEmpty(Mono.defer(() -> nonNull(attempt.get())));
            }
            return result.doOnNext(entity -> log.debug("Entity '{}' resolved via lookup '{}'",
                    StringSanitizer.forLog(id), config.lookup()));
        });
    }

    private List<Supplier<Mono<?>>> attemptsFor(Object lookup, String id) {
        List<Supplier<Mono<?>>> attempts = new ArrayList<>(3);
        if (lookup instanceof EntityByIdLookup<?> byId) {
            attempts.add(() -> byId.getEntityById(id));
        }
        if (lookup instanceof FindByIdLookup<?> findById) {
            attempts.add(() -> findById.findById(id));
        }
        if (lookup instanceof FindOneLookup<?> findOne) {
            attempts.add(() -> findOne.findOne(Map.of("id", id)));
        }
        return attempts;
    }

    private static Mono<Object> nonNull(Mono<?> mono) {
        return mono == null ? Mono.empty() : mono.cast(Object.class);
    }
}
