package io.nosqlbench.nbpivot.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/// Settings that shape how a pivot is loaded.
///
/// ```yaml
/// numeric_binning: true
/// histogram_bins: 20
/// threads: 2
/// progress_interval: 1000
/// ```
///
/// @param numericBinning whether numeric group-by columns are binned into ranges
/// @param histogramBins fixed number of bins, or 0 for round(sqrt(row count))
/// @param threads size of the executor a table creates when none is supplied
/// @param progressInterval rows between forwarded progress updates
public record PivotOptions(boolean numericBinning, int histogramBins, int threads, long progressInterval) {

    public static final PivotOptions DEFAULTS = new PivotOptions(true, 0, 2, 1000L);

    private static final Set<String> KEYS = Set.of("numeric_binning", "histogram_bins", "threads", "progress_interval");

    public PivotOptions {
        if (histogramBins < 0) {
            throw new PivotConfigurationException("histogram_bins must not be negative, got " + histogramBins);
        }
        if (threads < 1) {
            throw new PivotConfigurationException("threads must be at least 1, got " + threads);
        }
        if (progressInterval < 1) {
            throw new PivotConfigurationException("progress_interval must be at least 1, got " + progressInterval);
        }
    }

    public PivotOptions withNumericBinning(boolean enabled) {
        return new PivotOptions(enabled, histogramBins, threads, progressInterval);
    }

    public PivotOptions withHistogramBins(int bins) {
        return new PivotOptions(numericBinning, bins, threads, progressInterval);
    }

    public PivotOptions withThreads(int threadCount) {
        return new PivotOptions(numericBinning, histogramBins, threadCount, progressInterval);
    }

    /// @param rowCount the number of source rows
    /// @return the configured bin count, or round(sqrt(rowCount)) when none is configured
    public int binCountFor(int rowCount) {
        if (histogramBins > 0) {
            return histogramBins;
        }
        return Math.max(1, (int) Math.round(Math.sqrt(rowCount)));
    }

    /// Load options from a YAML mapping. Keys that are absent keep their defaults.
    /// @param path the yaml file
    /// @return the loaded options
    /// @throws PivotConfigurationException if the file is missing, malformed or has unknown keys
    public static PivotOptions load(Path path) {
        if (!Files.exists(path)) {
            throw new PivotConfigurationException("pivot options file not found: " + path);
        }
        try {
            return fromYaml(Files.readString(path));
        } catch (IOException e) {
            throw new PivotConfigurationException("unable to read pivot options from " + path, e);
        }
    }

    /// Parse options from YAML text.
    /// @param yaml the yaml content, a mapping or empty
    /// @return the parsed options
    public static PivotOptions fromYaml(String yaml) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load load = new Load(loadSettings);
        Object document;
        try {
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new PivotConfigurationException("malformed pivot options: " + e.getMessage(), e);
        }
        if (document == null) {
            return DEFAULTS;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new PivotConfigurationException("pivot options must be a mapping, not "
                + document.getClass().getSimpleName());
        }
        for (Object key : map.keySet()) {
            if (!KEYS.contains(String.valueOf(key))) {
                throw new PivotConfigurationException("unknown pivot option '" + key + "', expected one of " + KEYS);
            }
        }
        return new PivotOptions(
            booleanValue(map, "numeric_binning", DEFAULTS.numericBinning()),
            intValue(map, "histogram_bins", DEFAULTS.histogramBins()),
            intValue(map, "threads", DEFAULTS.threads()),
            longValue(map, "progress_interval", DEFAULTS.progressInterval())
        );
    }

    private static boolean booleanValue(Map<?, ?> map, String key, boolean fallback) {
        Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new PivotConfigurationException(key + " must be true or false, got '" + value + "'");
    }

    private static int intValue(Map<?, ?> map, String key, int fallback) {
        long value = longValue(map, key, fallback);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new PivotConfigurationException(key + " is out of range, got " + value, e);
        }
    }

    private static long longValue(Map<?, ?> map, String key, long fallback) {
        Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new PivotConfigurationException(key + " is out of range, got " + value, e);
            }
        }
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        throw new PivotConfigurationException(key + " must be a whole number, got '" + value + "'");
    }
}
