/*
 * CLeak: A Resource-Ownership Checker for C/C++
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of CLeak.
 *
 * CLeak is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * CLeak is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with CLeak. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.cleak.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of an analysis: its id and its options.
 */
public class AnalysisConfig {

    private final String id;

    private final AnalysisOptions options;

    public AnalysisConfig(String id) {
        this(id, AnalysisOptions.emptyOptions());
    }

    public AnalysisConfig(String id, AnalysisOptions options) {
        this.id = Objects.requireNonNull(id);
        this.options = Objects.requireNonNull(options);
    }

    @JsonCreator
    AnalysisConfig(@JsonProperty("id") String id,
                   @JsonProperty("options") Map<String, Object> options) {
        this(requireId(id), new AnalysisOptions(
                options == null ? Map.of() : options));
    }

    private static String requireId(String id) {
        if (id == null) {
            throw new ConfigException("Analysis config without id");
        }
        return id;
    }

    /**
     * Convenient way to build a config from alternating keys and values,
     * e.g., {@code AnalysisConfig.of("leakautovar", "check-library", false)}.
     */
    public static AnalysisConfig of(String id, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new ConfigException("Options must be given as key-value pairs");
        }
        Map<String, Object> options = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            options.put(keyValues[i].toString(), keyValues[i + 1]);
        }
        return new AnalysisConfig(id, new AnalysisOptions(options));
    }

    public String getId() {
        return id;
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    /**
     * Reads a list of analysis configs from a YAML file.
     */
    public static List<AnalysisConfig> readConfigs(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return readConfigs(in);
        } catch (IOException e) {
            throw new ConfigException("Failed to read analysis configs from " + path, e);
        }
    }

    public static List<AnalysisConfig> readConfigs(InputStream in) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            List<AnalysisConfig> configs = mapper.readValue(in, new TypeReference<>() {
            });
            return configs == null ? List.of() : configs;
        } catch (IOException e) {
            throw new ConfigException("Malformed analysis configs", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnalysisConfig that)) {
            return false;
        }
        return id.equals(that.id) && options.toMap().equals(that.options.toMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, options.toMap());
    }

    @Override
    public String toString() {
        return "AnalysisConfig{id='" + id + "', options=" + options.toMap() + '}';
    }
}
