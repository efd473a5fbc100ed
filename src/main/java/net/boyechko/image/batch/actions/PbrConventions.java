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
package net.boyechko.image.batch.actions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Studio texture conventions checked by {@link VerifyPbrValuesAction}, loaded from YAML.
 *
 * <p>Each convention applies to files whose name ends with its suffix and constrains one or more
 * color channels:
 *
 * <pre>
 * conventions:
 *   - suffix: _mra.png
 *     description: Metal/Roughness/AO mask
 *     channels:
 *       - channel: red
 *         label: METAL
 *         binary: true
 * </pre>
 */
public final class PbrConventions {
    public static final String DEFAULT_RESOURCE = "/pbr-conventions.yaml";
    public static final String OVERRIDE_PROPERTY = "imagebatch.pbr.conventions";

    private static final Logger logger = LoggerFactory.getLogger(PbrConventions.class);
    private static final Set<String> CHANNELS = Set.of("red", "green", "blue", "alpha");

    public List<Convention> conventions = new ArrayList<>();

    public static final class Convention {
        public String suffix;
        public String description;
        public List<ChannelRule> channels = new ArrayList<>();

        public boolean appliesTo(String fileName) {
            return suffix != null
                    && fileName.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT));
        }
    }

    public static final class ChannelRule {
        /** One of red, green, blue, alpha. */
        public String channel;

        /** Name used in messages, e.g. METAL. */
        public String label;

        /** When true, every value must be 0 or 255. */
        public Boolean binary;

        public Integer min;
        public Integer max;

        /** fail (default) or warn. */
        public String severity;

        public boolean isBinary() {
            return Boolean.TRUE.equals(binary);
        }

        public boolean isWarning() {
            return "warn".equalsIgnoreCase(severity);
        }

        public String displayLabel() {
            return label != null ? label : channel.toUpperCase(Locale.ROOT);
        }

        /** Returns true if {@code value} (0-255) satisfies this rule. */
        public boolean accepts(int value) {
            if (isBinary() && value != 0 && value != 255) {
                return false;
            }
            if (min != null && value < min) {
                return false;
            }
            return max == null || value <= max;
        }

        /** Bit shift of this channel inside a packed ARGB int. */
        public int shift() {
            return switch (channel.toLowerCase(Locale.ROOT)) {
                case "alpha" -> 24;
                case "red" -> 16;
                case "green" -> 8;
                case "blue" -> 0;
                default -> throw new IllegalStateException("Unknown channel " + channel);
            };
        }

        public boolean isAlpha() {
            return "alpha".equalsIgnoreCase(channel);
        }
    }

    public List<Convention> matching(String fileName) {
        return conventions.stream().filter(c -> c.appliesTo(fileName)).toList();
    }

    /**
     * Loads the conventions named by the {@value #OVERRIDE_PROPERTY} system property, or the
     * bundled set when it is not set.
     */
    public static PbrConventions loadDefault() {
        String override = System.getProperty(OVERRIDE_PROPERTY);
        if (override != null && !override.isBlank()) {
            return fromFile(Path.of(override));
        }
        return fromResource(DEFAULT_RESOURCE);
    }

    public static PbrConventions fromResource(String resourcePath) {
        try (InputStream in = PbrConventions.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(in, resourcePath);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Failed to load PBR conventions from resource " + resourcePath, e);
        }
    }

    public static PbrConventions fromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load PBR conventions from " + file, e);
        }
    }

    private static PbrConventions load(InputStream in, String source) {
        Yaml yaml = new Yaml(new Constructor(PbrConventions.class, new LoaderOptions()));
        PbrConventions loaded = yaml.load(in);
        if (loaded == null) {
            loaded = new PbrConventions();
        }
        if (loaded.conventions == null) {
            loaded.conventions = new ArrayList<>();
        }

        List<String> problems = loaded.validate();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid PBR conventions in " + source + ": " + String.join("; ", problems));
        }
        logger.debug("Loaded {} PBR conventions from {}", loaded.conventions.size(), source);
        return loaded;
    }

    /** Returns a description of every problem found; empty if the conventions are usable. */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (Convention convention : conventions) {
            if (convention.suffix == null || convention.suffix.isBlank()) {
                problems.add("convention without suffix");
                continue;
            }
            if (convention.channels == null) {
                convention.channels = new ArrayList<>();
            }
            for (ChannelRule rule : convention.channels) {
                if (rule.channel == null
                        || !CHANNELS.contains(rule.channel.toLowerCase(Locale.ROOT))) {
                    problems.add(convention.suffix + ": unknown channel " + rule.channel);
                } else if (!rule.isBinary() && rule.min == null && rule.max == null) {
                    problems.add(convention.suffix + ": " + rule.channel + " has no constraint");
                }
                if (rule.severity != null
                        && !rule.severity.equalsIgnoreCase("fail")
                        && !rule.severity.equalsIgnoreCase("warn")) {
                    problems.add(convention.suffix + ": unknown severity " + rule.severity);
                }
            }
        }
        return problems;
    }
}
