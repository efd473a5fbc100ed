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
package net.boyechko.image.batch.core;

import java.util.List;
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionRegistry;
import net.boyechko.image.batch.actions.CompressPngAction;
import net.boyechko.image.batch.actions.PowerOfTwoCheckAction;
import net.boyechko.image.batch.actions.VerifyPbrValuesAction;

/**
 * The actions shipped with the tool.
 *
 * <p>To add an action, implement {@link net.boyechko.image.batch.action.ImageAction} and add its
 * descriptor to {@link #descriptors()}. The registration order is the listing order.
 */
public final class DefaultActions {
    private DefaultActions() {}

    public static List<ActionDescriptor> descriptors() {
        return List.of(
                new ActionDescriptor(
                        CompressPngAction.ID,
                        "Compress PNGs",
                        "Compressing",
                        true,
                        new CompressPngAction()),
                new ActionDescriptor(
                        PowerOfTwoCheckAction.ID,
                        "Check Power of 2",
                        "Checking Power of 2 on",
                        false,
                        new PowerOfTwoCheckAction()),
                new ActionDescriptor(
                        VerifyPbrValuesAction.ID,
                        "Verify PBR Values",
                        "Verifying PBR Values on",
                        false,
                        new VerifyPbrValuesAction()));
    }

    /** Returns the process-wide registry, initialized and sealed on first use. */
    public static ActionRegistry registry() {
        return Holder.REGISTRY;
    }

    /** Returns a new, unsealed registry holding the shipped actions. */
    public static ActionRegistry newRegistry() {
        ActionRegistry registry = new ActionRegistry();
        for (ActionDescriptor descriptor : descriptors()) {
            registry.register(descriptor);
        }
        return registry;
    }

    private static final class Holder {
        private static final ActionRegistry REGISTRY = newRegistry().seal();
    }
}
