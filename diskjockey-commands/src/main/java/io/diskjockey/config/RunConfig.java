package io.diskjockey.config;

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

import io.diskjockey.core.model.Grid;
import io.diskjockey.core.model.ModelKind;
import io.diskjockey.core.velocity.VelocityRange;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Typed view of a run's YAML configuration.
///
/// ```yaml
/// out_base: output/
/// data_file: data.hdf5
/// species: 12CO
/// transition: 2-1
/// model: standard
/// parameters: {M_star: 1.0, r_c: 45.0, T_10: 90.0, ...}
/// fix_params: [q, gamma, ksi, dpc]
/// parameter_ranges: {M_star: [0.5, 2.0], ...}
/// exclude: [[-1.0, 1.0]]
/// npix: 256
/// size_arcsec: 12.0
/// grid: {nr: 64, ntheta: 32, r_in: 0.5, r_out: 500.0}
/// pos0: pos0.json
/// samples: 100
/// loops: 10
/// MaxFuncEvals: 2000
/// ```
///
/// Relative paths resolve against the directory holding the config file,
/// which is also the home directory the static simulator inputs are read from.
/// Keys needed only by one run mode (`pos0`, `samples`, `loops` for sampling,
/// `parameter_ranges`, `MaxFuncEvals` for optimizing) are checked when read.
public final class RunConfig {

    private final Path home;
    private final Map<String, Object> raw;

    private final String outBase;
    private final Path dataFile;
    private final String species;
    private final String transition;
    private final ModelKind model;
    private final Map<String, Double> parameters;
    private final List<String> fixParams;
    private final List<VelocityRange> exclude;
    private final int npix;
    private final double sizeArcsec;
    private final Grid grid;
    private final String simulator;
    private final Long seed;
    private final double stretchScale;

    private RunConfig(Path home, Map<String, Object> raw) {
        this.home = home;
        this.raw = raw;
        this.outBase = string("out_base");
        this.dataFile = home.resolve(string("data_file"));
        this.species = string("species");
        this.transition = string("transition");
        try {
            this.model = ModelKind.fromTag(string("model"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("model: " + e.getMessage(), e);
        }
        this.parameters = numberMap("parameters");
        this.fixParams = raw.containsKey("fix_params") ? stringList("fix_params") : List.of();
        this.exclude = raw.containsKey("exclude") ? ranges("exclude") : List.of();
        this.npix = integer("npix");
        if (npix < 2 || Integer.bitCount(npix) != 1) {
            throw new ConfigurationException("npix must be a power of two, got " + npix);
        }
        this.sizeArcsec = number("size_arcsec");
        if (!(sizeArcsec > 0.0)) {
            throw new ConfigurationException("size_arcsec must be positive, got " + sizeArcsec);
        }
        this.grid = grid(section("grid"));
        this.simulator = raw.containsKey("simulator") ? string("simulator") : "radmc3d";
        this.seed = raw.containsKey("seed") ? longInteger("seed") : null;
        this.stretchScale = raw.containsKey("stretch_scale") ? number("stretch_scale") : 2.0;
    }

    /// Reads a YAML configuration file.
    ///
    /// @throws ConfigurationException if the file is not a valid configuration
    /// @throws IOException if the file cannot be read
    public static RunConfig load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("configuration file not found: " + path.toAbsolutePath());
        }
        LoadSettings loadSettings = LoadSettings.builder().setLabel(path.toString()).build();
        Load yaml = new Load(loadSettings);
        Object document;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            document = yaml.loadFromReader(reader);
        } catch (YamlEngineException e) {
            throw new ConfigurationException("Invalid YAML in " + path + ": " + e.getMessage(), e);
        }
        Path home = path.toAbsolutePath().getParent();
        return fromMap(asMap(document, path.toString()), home);
    }

    /// Builds a configuration from already-parsed YAML.
    public static RunConfig fromMap(Map<String, Object> values, Path home) {
        return new RunConfig(home, new LinkedHashMap<>(values));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException(what + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private Object require(String key) {
        Object value = raw.get(key);
        if (value == null) {
            throw new ConfigurationException("missing key '" + key + "'");
        }
        return value;
    }

    private String string(String key) {
        return String.valueOf(require(key));
    }

    private double number(String key) {
        return toDouble(key, require(key));
    }

    private int integer(String key) {
        Object value = require(key);
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.intValue();
        }
        throw new ConfigurationException(key + " must be an integer, got " + value);
    }

    private long longInteger(String key) {
        Object value = require(key);
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.longValue();
        }
        throw new ConfigurationException(key + " must be an integer, got " + value);
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be a number, got '" + s + "'", e);
            }
        }
        throw new ConfigurationException(key + " must be a number, got " + value);
    }

    private Map<String, Object> section(String key) {
        return asMap(require(key), key);
    }

    private Map<String, Double> numberMap(String key) {
        Map<String, Double> out = new LinkedHashMap<>();
        section(key).forEach((name, value) -> out.put(name, toDouble(key + "." + name, value)));
        return Collections.unmodifiableMap(out);
    }

    private List<String> stringList(String key) {
        Object value = require(key);
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(key + " must be a list");
        }
        List<String> out = new ArrayList<>();
        for (Object item : list) {
            out.add(String.valueOf(item));
        }
        return List.copyOf(out);
    }

    private static double[] pair(String key, Object value) {
        if (!(value instanceof List<?> list) || list.size() != 2) {
            throw new ConfigurationException(key + " must be a [lo, hi] pair, got " + value);
        }
        double lo = toDouble(key, list.get(0));
        double hi = toDouble(key, list.get(1));
        if (!(lo <= hi)) {
            throw new ConfigurationException(key + " has lo " + lo + " above hi " + hi);
        }
        return new double[]{lo, hi};
    }

    private List<VelocityRange> ranges(String key) {
        Object value = require(key);
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(key + " must be a list of [lo, hi] pairs");
        }
        List<VelocityRange> out = new ArrayList<>();
        for (Object item : list) {
            double[] p = pair(key, item);
            out.add(new VelocityRange(p[0], p[1]));
        }
        return List.copyOf(out);
    }

    private Map<String, double[]> pairMap(String key) {
        Map<String, double[]> out = new LinkedHashMap<>();
        section(key).forEach((name, value) -> out.put(name, pair(key + "." + name, value)));
        return out;
    }

    private static Grid grid(Map<String, Object> g) {
        try {
            Object nr = g.get("nr");
            Object ntheta = g.get("ntheta");
            if (!(nr instanceof Number) || !(ntheta instanceof Number)) {
                throw new ConfigurationException("grid needs integer nr and ntheta");
            }
            if (g.get("r_in") == null || g.get("r_out") == null) {
                throw new ConfigurationException("grid needs r_in and r_out");
            }
            return new Grid(((Number) nr).intValue(), ((Number) ntheta).intValue(),
                toDouble("grid.r_in", g.get("r_in")), toDouble("grid.r_out", g.get("r_out")));
        } catch (ConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("grid: " + e.getMessage(), e);
        }
    }

    /// Directory of the config file; static simulator inputs live here.
    public Path home() {
        return home;
    }

    /// Prefix of the numbered run directories, resolved later against [#home()].
    public String outBase() {
        return outBase;
    }

    public Path dataFile() {
        return dataFile;
    }

    public String species() {
        return species;
    }

    public String transition() {
        return transition;
    }

    public ModelKind model() {
        return model;
    }

    /// Configured value of every named parameter; fixed ones are taken from here.
    public Map<String, Double> parameters() {
        return parameters;
    }

    public List<String> fixParams() {
        return fixParams;
    }

    public List<VelocityRange> exclude() {
        return exclude;
    }

    public int npix() {
        return npix;
    }

    public double sizeArcsec() {
        return sizeArcsec;
    }

    public Grid grid() {
        return grid;
    }

    public String simulator() {
        return simulator;
    }

    /// The configured seed, `null` when the key is absent.
    public Long seed() {
        return seed;
    }

    public double stretchScale() {
        return stretchScale;
    }

    /// Starting-position file for a fresh sampling run.
    public Path pos0() {
        return home.resolve(string("pos0"));
    }

    /// Iterations per loop.
    public int samples() {
        return integer("samples");
    }

    public int loops() {
        return integer("loops");
    }

    /// Optimizer search range per free parameter.
    public Map<String, double[]> parameterRanges() {
        return pairMap("parameter_ranges");
    }

    /// Uniform prior bounds, empty when `prior_bounds` is absent.
    public Map<String, double[]> priorBounds() {
        return raw.containsKey("prior_bounds") ? pairMap("prior_bounds") : Map.of();
    }

    /// Optimizer evaluation budget.
    public int maxFuncEvals() {
        return integer("MaxFuncEvals");
    }

    @Override
    public String toString() {
        return "RunConfig{model=" + model.tag() + ", data=" + dataFile + ", line=" + species + " " + transition
            + ", npix=" + npix + ", size=" + sizeArcsec + "\", fixed=" + fixParams + "}";
    }
}
