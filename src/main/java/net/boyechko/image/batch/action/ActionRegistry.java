/*
 * Image-Batch - Batch Image Processing
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.image.batch.action;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named catalog of the available {@link ImageAction}s.
 *
 * <p>Actions are registered during process initialization, after which the registry is sealed and
 * becomes read-only. A sealed registry is safe to share between worker threads without locking.
 * Listing order is registration order.
 */
public class ActionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, ActionDescriptor> actions = new LinkedHashMap<>();
    private volatile boolean sealed;

    /**
     * Adds an action to the catalog.
     *
     * @throws DuplicateActionException if an action with the same id is already registered; the
     *     earlier registration stays in place
     * @throws IllegalStateException if the registry has been sealed
     */
    public synchronized ActionRegistry register(ActionDescriptor descriptor) {
        if (sealed) {
            throw new IllegalStateException(
                    "Registry is sealed; cannot register " + descriptor.id());
        }
        if (actions.containsKey(descriptor.id())) {
            throw new DuplicateActionException(descriptor.id());
        }
        actions.put(descriptor.id(), descriptor);
        logger.debug("Registered action {} ({})", descriptor.id(), descriptor.displayName());
        return this;
    }

    /** Ends the initialization phase. Further {@link #register} calls fail. */
    public synchronized ActionRegistry seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    /** Returns all registered actions in registration order. */
    public synchronized List<ActionDescriptor> listAvailable() {
        return List.copyOf(actions.values());
    }

    /** Returns the actions that run when the caller selects none, in registration order. */
    public synchronized List<ActionDescriptor> defaultSelection() {
        return actions.values().stream().filter(ActionDescriptor::defaultSelected).toList();
    }

    /**
     * Resolves ids to descriptors, keeping the caller's order.
     *
     * @throws UnknownActionException naming the first id that is not registered
     * @throws IllegalArgumentException if an id is listed twice
     */
    public synchronized List<ActionDescriptor> resolve(List<String> ids) {
        List<ActionDescriptor> resolved = new ArrayList<>(ids.size());
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            ActionDescriptor descriptor = actions.get(id);
            if (descriptor == null) {
                throw new UnknownActionException(id);
            }
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Action listed more than once: " + id);
            }
            resolved.add(descriptor);
        }
        return List.copyOf(resolved);
    }

    public synchronized int size() {
        return actions.size();
    }
}
