package io.hearthwarrio.statetrail.webdriver.engine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One resolution tier: tries to locate a visible target for a request.
 * <p>
 * Implementations must not interact with the page beyond bounded probes; the interaction itself is
 * performed by the {@link TierRunner}. Returning empty hands over to the next tier.
 *
 * @param <C> request type
 */
public interface ResolutionStrategy<C> {

    /**
     * Name reported as the action result's {@code method} when this tier wins.
     */
    String method();

    Optional<ResolvedTarget> resolve(C request);

    static <C> ResolutionStrategy<C> of(String method, Function<C, Optional<ResolvedTarget>> resolver) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");
        return new ResolutionStrategy<>() {
            @Override
            public String method() {
                return method;
            }

            @Override
            public Optional<ResolvedTarget> resolve(C request) {
                return resolver.apply(request);
            }

            @Override
            public String toString() {
                return "ResolutionStrategy{" + method + '}';
            }
        };
    }
}
