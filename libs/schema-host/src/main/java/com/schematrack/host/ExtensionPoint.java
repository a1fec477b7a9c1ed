package com.schematrack.host;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named, ordered chain of decorators around a base strategy.
 * <p>
 * Each owner installs at most one decorator; installing again under the same owner is a no-op, so
 * extensions can initialize repeatedly without wrapping the strategy twice. Decorators apply in
 * install order, the first one closest to the base strategy. An owner may claim the point
 * exclusively, after which no other owner can install.
 * <p>
 * Installation is synchronized and meant for startup. {@link #current()} reads a volatile snapshot
 * and never blocks.
 *
 * @param <S> the strategy type
 */
public final class ExtensionPoint<S> {

    private static final Logger log = LoggerFactory.getLogger(ExtensionPoint.class);

    private final String name;
    private final S base;
    private final Map<String, UnaryOperator<S>> decorators = new LinkedHashMap<>();

    private String exclusiveOwner;
    private boolean frozen;
    private volatile S current;

    /**
     * Creates an extension point with no decorators.
     *
     * @param name extension point name, used in logs and errors
     * @param base the default strategy
     */
    public ExtensionPoint(String name, S base) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (base == null) {
            throw new IllegalArgumentException("base must not be null");
        }
        this.name = name;
        this.base = base;
        this.current = base;
    }

    /**
     * Installs a decorator for the given owner.
     *
     * @param owner unique owner name
     * @param decorator receives the next strategy in the chain, returns the wrapping strategy
     * @param exclusive whether to forbid any other owner from installing afterwards
     * @return true if installed, false if this owner had already installed a decorator
     * @throws ExtensionPointUnavailableException if the point is frozen or claimed by someone else
     */
    public synchronized boolean install(String owner, UnaryOperator<S> decorator, boolean exclusive) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be null or blank");
        }
        if (decorator == null) {
            throw new IllegalArgumentException("decorator must not be null");
        }
        if (decorators.containsKey(owner)) {
            log.debug("Extension point {} already has a decorator from {}", name, owner);
            return false;
        }
        if (frozen) {
            throw new ExtensionPointUnavailableException(name, owner, "extension point is frozen");
        }
        if (exclusiveOwner != null) {
            throw new ExtensionPointUnavailableException(
                    name, owner, "exclusively claimed by '" + exclusiveOwner + "'");
        }
        if (exclusive && !decorators.isEmpty()) {
            throw new ExtensionPointUnavailableException(
                    name, owner, "cannot claim exclusively, already used by " + decorators.keySet());
        }

        decorators.put(owner, decorator);
        if (exclusive) {
            exclusiveOwner = owner;
        }
        current = compose();
        log.info("Installed {} on extension point {} (exclusive={})", owner, name, exclusive);
        return true;
    }

    /**
     * Prevents further installs. Already installed decorators stay in place.
     */
    public synchronized void freeze() {
        frozen = true;
    }

    /**
     * Returns the composed strategy: the base wrapped by every installed decorator.
     */
    public S current() {
        return current;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the owners that installed decorators, in install order.
     */
    public synchronized List<String> owners() {
        return List.copyOf(decorators.keySet());
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    private S compose() {
        S composed = base;
        for (UnaryOperator<S> decorator : decorators.values()) {
            composed = decorator.apply(composed);
        }
        return composed;
    }
}
