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
package net.boyechko.image.batch.ui.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * A batch described in YAML, loaded with {@code --config}. Command-line flags given alongside
 * the file take precedence over its values.
 *
 * <pre>
 * directories: [textures, models/textures]
 * recursive: true
 * extensions: [png, tga]
 * actions: [compress_png, check_power_of_2]
 * threads: 4
 * stopOnFailure: false
 * report: out/report.json
 * </pre>
 */
public class BatchConfigFile {
    public List<String> directories = new ArrayList<>();
    public Boolean recursive;
    public List<String> extensions = new ArrayList<>();
    public List<String> actions = new ArrayList<>();
    public Integer threads;
    public Boolean stopOnFailure;
    public String report;

    public static BatchConfigFile load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            Yaml yaml = new Yaml(new Constructor(BatchConfigFile.class, new LoaderOptions()));
            BatchConfigFile config = yaml.load(in);
            if (config == null) {
                return new BatchConfigFile();
            }
            if (config.directories == null) config.directories = new ArrayList<>();
            if (config.extensions == null) config.extensions = new ArrayList<>();
            if (config.actions == null) config.actions = new ArrayList<>();
            return config;
        } catch (YAMLException e) {
            throw new IOException("Invalid batch file " + path + ": " + e.getMessage(), e);
        }
    }
}
