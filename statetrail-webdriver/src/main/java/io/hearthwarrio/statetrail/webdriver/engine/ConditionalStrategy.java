package io.hearthwarrio.statetrail.webdriver.engine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Predicate/strategy pair: the wrapped tier only runs for requests the predicate accepts.
 */
public final class ConditionalStrategy<C> implements ResolutionStrategy<C> {

    private final Predicate<? super C> applies;
    private final ResolutionStrategy<C> strategy;

    public ConditionalStrategy(Predicate<? super C> applies, ResolutionStrategy<C> strategy) {
        this.applies = Objects.requireNonNull(applies, "applies must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
    }

    public static <C> ConditionalStrategy<C> when(Predicate<? super C> applies, ResolutionStrategy<C> strategy) {
        return new ConditionalStrategy<>(applies, strategy);
    }

    @Override
    public String method() {
        return strategy.method();
    }

    @Override
    public Optional<ResolvedTarget> resolve(C request) {
        if (!applies.test(request)) {
            return Optional.empty();
        }
        return strategy.resolve(request);
    }

    @Override
    public String toString() {
        return "ConditionalStrategy{" + strategy.method() + '}';
    }
}
