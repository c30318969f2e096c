package io.hearthwarrio.statetrail.webdriver.engine;

import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Tries resolution tiers in order and stops at the first one whose target was located
 * and whose interaction completed.
 * <p>
 * A tier that throws or whose interaction fails counts as a miss. Lost sessions propagate.
 */
public final class TierRunner {

    private static final Logger log = LoggerFactory.getLogger(TierRunner.class);

    /**
     * Interaction performed on a located target.
     */
    @FunctionalInterface
    public interface Interaction {
        /**
         * @return true when the interaction completed
         */
        boolean perform(ResolvedTarget target);
    }

    private TierRunner() {
        // utility class
    }

    public static <C> Optional<TierOutcome> run(List<? extends ResolutionStrategy<C>> tiers, C request, Interaction interaction) {
        for (ResolutionStrategy<C> tier : tiers) {
            Optional<ResolvedTarget> target;
            try {
                target = tier.resolve(request);
            } catch (NoSuchSessionException e) {
                throw e;
            } catch (WebDriverException e) {
                log.debug("Tier {} failed for {}: {}", tier.method(), request, e.getMessage());
                continue;
            }
            if (target.isEmpty()) {
                log.trace("Tier {} found nothing for {}", tier.method(), request);
                continue;
            }

            boolean done;
            try {
                done = interaction.perform(target.get());
            } catch (NoSuchSessionException e) {
                throw e;
            } catch (WebDriverException e) {
                log.debug("Tier {} located {} but interaction failed: {}", tier.method(), target.get(), e.getMessage());
                continue;
            }
            if (done) {
                String method = target.get().getMethod() != null ? target.get().getMethod() : tier.method();
                log.debug("Tier {} resolved {}", method, request);
                return Optional.of(new TierOutcome(method, target.get()));
            }
        }
        return Optional.empty();
    }
}
