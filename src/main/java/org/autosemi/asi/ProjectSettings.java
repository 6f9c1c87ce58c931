package org.autosemi.asi;

import org.autosemi.Configuration;
import org.autosemi.runtime.ConfigurationException;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.schema.CoreSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Project settings read from {@code autosemi.yaml}.
 * <pre>
 * asi:
 *   enabled: true
 *   probe-budget: 50000
 * packages:
 *   legacy/:
 *     asi: false
 * </pre>
 * {@code asi} may also be a plain boolean, and so may a package entry.
 * Package keys are prefixes of source paths relative to the directory holding the file.
 */
public final class ProjectSettings {
    public static final ProjectSettings EMPTY = new ProjectSettings(null, null, Map.of(), null);

    private final Boolean asiEnabled;
    private final Integer probeBudget;
    private final Map<String, Boolean> packages;
    private final Path file;

    ProjectSettings(Boolean asiEnabled, Integer probeBudget, Map<String, Boolean> packages, Path file) {
        this.asiEnabled = asiEnabled;
        this.probeBudget = probeBudget;
        this.packages = Collections.unmodifiableMap(new LinkedHashMap<>(packages));
        this.file = file;
    }

    /**
     * Reads a settings file.
     *
     * @throws ConfigurationException if the file cannot be read or is not valid settings
     */
    public static ProjectSettings load(Path file) {
        String yaml;
        try {
            yaml = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + file, e);
        }
        return parse(yaml, file.toString(), file.toAbsolutePath().normalize());
    }

    public static ProjectSettings fromYaml(String yaml) {
        return parse(yaml, "<string>", null);
    }

    /**
     * Looks for the settings file in {@code directory} and its parents.
     *
     * @return the nearest settings, or {@link #EMPTY} if there are none
     */
    public static ProjectSettings discover(Path directory) {
        for (Path dir = directory.toAbsolutePath().normalize(); dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(Configuration.SETTINGS_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return load(candidate);
            }
        }
        return EMPTY;
    }

    private static ProjectSettings parse(String yaml, String label, Path file) {
        LoadSettings settings = LoadSettings.builder()
                .setLabel(label)
                .setSchema(new CoreSchema())
                .build();
        Object document;
        try {
            document = new Load(settings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ConfigurationException(label + ": malformed YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return new ProjectSettings(null, null, Map.of(), file);
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException(label + ": expected a mapping at the top level");
        }

        Boolean enabled = null;
        Integer budget = null;
        Map<String, Boolean> packages = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "asi":
                    if (value instanceof Boolean) {
                        enabled = (Boolean) value;
                    } else if (value instanceof Map) {
                        for (Map.Entry<?, ?> option : ((Map<?, ?>) value).entrySet()) {
                            String name = String.valueOf(option.getKey());
                            if (name.equals("enabled")) {
                                enabled = asBoolean(label, "asi.enabled", option.getValue());
                            } else if (name.equals("probe-budget")) {
                                budget = asPositiveInt(label, "asi.probe-budget", option.getValue());
                            } else {
                                throw new ConfigurationException(label + ": unknown setting asi." + name);
                            }
                        }
                    } else {
                        throw new ConfigurationException(label + ": asi: expected a boolean or a mapping");
                    }
                    break;
                case "packages":
                    if (!(value instanceof Map)) {
                        throw new ConfigurationException(label + ": packages: expected a mapping");
                    }
                    for (Map.Entry<?, ?> pkg : ((Map<?, ?>) value).entrySet()) {
                        String prefix = String.valueOf(pkg.getKey());
                        packages.put(prefix, packageAsi(label, prefix, pkg.getValue()));
                    }
                    break;
                default:
                    // other tools may keep their settings in the same file
                    break;
            }
        }
        return new ProjectSettings(enabled, budget, packages, file);
    }

    private static Boolean packageAsi(String label, String prefix, Object value) {
        if (value instanceof Map) {
            Object asi = ((Map<?, ?>) value).get("asi");
            return asBoolean(label, "packages." + prefix + ".asi", asi);
        }
        return asBoolean(label, "packages." + prefix, value);
    }

    private static Boolean asBoolean(String label, String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new ConfigurationException(label + ": " + key + ": expected true or false but found " + value);
    }

    private static Integer asPositiveInt(String label, String key, Object value) {
        if (value instanceof Number) {
            long number = ((Number) value).longValue();
            if (number > 0 && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        throw new ConfigurationException(label + ": " + key + ": expected a positive integer but found " + value);
    }

    /**
     * Project-wide setting, or null if the file does not set it.
     */
    public Boolean asiEnabled() {
        return asiEnabled;
    }

    public Integer probeBudget() {
        return probeBudget;
    }

    public Map<String, Boolean> packages() {
        return packages;
    }

    /**
     * The settings file, or null for settings that were not read from a file.
     */
    public Path file() {
        return file;
    }

    /**
     * Finds the package entry with the longest prefix of {@code unitPath}.
     *
     * @return the matching prefix, or null
     */
    public String matchPackage(String unitPath) {
        if (unitPath == null) {
            return null;
        }
        String best = null;
        for (String prefix : packages.keySet()) {
            if (unitPath.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best;
    }

    /**
     * Turns a source file into the path that package prefixes are matched against:
     * relative to the settings file's directory, with '/' separators.
     */
    public String unitPath(Path source) {
        Path absolute = source.toAbsolutePath().normalize();
        if (file != null && file.getParent() != null && absolute.startsWith(file.getParent())) {
            absolute = file.getParent().relativize(absolute);
        }
        return absolute.toString().replace('\\', '/');
    }

    @Override
    public String toString() {
        return "ProjectSettings{asi=" + asiEnabled + ", probeBudget=" + probeBudget
                + ", packages=" + packages + (file != null ? ", file=" + file : "") + '}';
    }
}
