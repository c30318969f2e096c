package io.hearthwarrio.statetrail.webdriver.engine;

/**
 * Winning tier of a resolution run.
 */
public final class TierOutcome {

    private final String method;
    private final ResolvedTarget target;

    TierOutcome(String method, ResolvedTarget target) {
        this.method = method;
        this.target = target;
    }

    public String getMethod() {
        return method;
    }

    public ResolvedTarget getTarget() {
        return target;
    }

    public String getLabel() {
        return target.getLabel();
    }

    @Override
    public String toString() {
        return "TierOutcome{method='" + method + "', target=" + target + '}';
    }
}
