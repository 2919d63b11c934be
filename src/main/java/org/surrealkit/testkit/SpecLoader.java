package org.surrealkit.testkit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.surrealkit.config.ConfigurationException;
import org.surrealkit.config.ProjectLayout;
import org.surrealkit.json.JsonValues;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the global test config and every suite document (TOML, YAML or JSON) with closed-schema
 * decoding: any unrecognised field fails the load.
 */
public final class SpecLoader {
    private static final Set<String> GLOBAL_KEYS = Set.of("defaults", "actors", "fixtures");
    private static final Set<String> DEFAULTS_KEYS = Set.of("base_url", "timeout_ms");
    private static final Set<String> SUITE_KEYS = Set.of("name", "tags", "actors", "fixtures", "cases");
    private static final Set<String> FIXTURE_KEYS = Set.of("name", "actor", "sql", "file");
    private static final Set<String> ACTOR_KEYS = Set.of(
            "kind", "username", "username_env", "password", "password_env", "namespace", "namespace_env",
            "database", "database_env", "access", "access_env", "params", "token", "token_env", "headers");
    private static final Set<String> CASE_COMMON_KEYS = Set.of("name", "tags", "kind");
    private static final Set<String> SQL_EXPECT_KEYS =
            Set.of("actor", "sql", "allow", "error_contains", "error_code", "assertions");
    private static final Set<String> PERMISSIONS_KEYS = Set.of("actor", "table", "record_id", "rules");
    private static final Set<String> RULE_KEYS = Set.of("action", "allow", "sql", "error_contains");
    private static final Set<String> METADATA_KEYS = Set.of("actor", "table", "sql", "contains", "assertions");
    private static final Set<String> BEHAVIOR_KEYS = Set.of(
            "actor", "setup_sql", "action_sql", "expect_success", "expect_error_contains", "verify_sql", "assertions");
    private static final Set<String> API_KEYS = Set.of(
            "actor", "method", "path", "expected_status", "headers", "body", "timeout_ms",
            "body_assertions", "header_assertions");
    private static final Set<String> JSON_ASSERTION_KEYS = Set.of("path", "exists", "equals", "contains", "regex");
    private static final Set<String> HEADER_ASSERTION_KEYS = Set.of("name", "exists", "equals", "contains", "regex");
    private static final List<String> SUITE_EXTENSIONS = List.of(".toml", ".yaml", ".yml", ".json");

    private SpecLoader() {}

    /**
     * Loads the global config (built-in defaults when absent) and all suites sorted by path.
     *
     * @throws ConfigurationException when no suite file exists
     * @throws SpecValidationException when any document is malformed
     */
    public static LoadedSpecs load(final ProjectLayout layout) throws IOException {
        Objects.requireNonNull(layout, "layout");
        final Path configFile = layout.testConfigFile();
        final GlobalTestConfig global = Files.exists(configFile)
                ? loadGlobal(configFile, layout.relativize(configFile))
                : GlobalTestConfig.empty();

        final List<LoadedSuite> suites = new ArrayList<>();
        for (final Path file : discoverSuiteFiles(layout.suitesDir())) {
            final String relative = layout.relativize(file);
            suites.add(new LoadedSuite(relative, file.getParent(), loadSuite(file, relative)));
        }
        if (suites.isEmpty()) {
            throw new ConfigurationException("no suite files found in " + layout.relativize(layout.suitesDir()));
        }
        suites.sort(Comparator.comparing(LoadedSuite::path));
        return new LoadedSpecs(global, suites);
    }

    static List<Path> discoverSuiteFiles(final Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(directory, FileVisitOption.FOLLOW_LINKS)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(SpecLoader::isSpecDocument)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public static GlobalTestConfig loadGlobal(final Path file, final String sourceName) throws IOException {
        return parseGlobal(read(file), sourceName);
    }

    public static SuiteSpec loadSuite(final Path file, final String sourceName) throws IOException {
        return parseSuite(read(file), sourceName);
    }

    static GlobalTestConfig parseGlobal(final String content, final String sourceName) {
        final Object root = parseDocument(content, sourceName);
        final List<String> errors = new ArrayList<>();
        final GlobalTestConfig config = root == null ? GlobalTestConfig.empty() : decodeGlobal(root, errors);
        throwIfInvalid(errors, sourceName);
        return config;
    }

    static SuiteSpec parseSuite(final String content, final String sourceName) {
        final Object root = parseDocument(content, sourceName);
        final List<String> errors = new ArrayList<>();
        final SuiteSpec suite = decodeSuite(root == null ? Map.of() : root, errors);
        throwIfInvalid(errors, sourceName);
        return suite;
    }

    static Object parseDocument(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (content.isBlank()) {
            return null;
        }
        if (normalizedName.endsWith(".toml")) {
            return parseToml(content, sourceName);
        }
        try {
            if (normalizedName.endsWith(".json")) {
                return JsonValues.parse(content);
            }
            return JsonValues.normalize(new Yaml().load(content));
        } catch (final YAMLException | IllegalArgumentException exception) {
            throw new SpecValidationException(List.of(sourceName + ": parse error: " + exception.getMessage()));
        }
    }

    private static Object parseToml(final String content, final String sourceName) {
        final TomlParseResult result = Toml.parse(content);
        if (result.hasErrors()) {
            final List<String> errors = new ArrayList<>();
            for (final TomlParseError error : result.errors()) {
                errors.add(sourceName + ": parse error: " + error.toString());
            }
            throw new SpecValidationException(errors);
        }
        return fromToml(result);
    }

    /**
     * TOML tables and arrays become maps and lists; dates and times become their ISO text.
     */
    static Object fromToml(final Object value) {
        if (value instanceof TomlTable table) {
            final Map<String, Object> map = new LinkedHashMap<>();
            for (final Map.Entry<String, Object> entry : table.entrySet()) {
                map.put(entry.getKey(), fromToml(entry.getValue()));
            }
            return map;
        }
        if (value instanceof TomlArray array) {
            final List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(fromToml(array.get(i)));
            }
            return list;
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal.toString();
        }
        return value;
    }

    private static GlobalTestConfig decodeGlobal(final Object root, final List<String> errors) {
        final SpecReader reader = SpecReader.of(root, "", errors, GLOBAL_KEYS);
        String baseUrl = null;
        Long timeoutMs = null;
        if (reader.has("defaults")) {
            final SpecReader defaults = SpecReader.of(reader.raw("defaults"), "defaults", errors, DEFAULTS_KEYS);
            baseUrl = defaults.optionalString("base_url");
            timeoutMs = defaults.optionalLong("timeout_ms");
        }
        return new GlobalTestConfig(baseUrl, timeoutMs, decodeActors(reader, errors), decodeFixtures(reader, errors));
    }

    private static SuiteSpec decodeSuite(final Object root, final List<String> errors) {
        final SpecReader reader = SpecReader.of(root, "", errors, SUITE_KEYS);
        final List<CaseSpec> cases = new ArrayList<>();
        final List<Object> rawCases = reader.list("cases");
        for (int i = 0; i < rawCases.size(); i++) {
            final CaseSpec decoded = decodeCase(rawCases.get(i), "cases[" + i + "]", errors);
            if (decoded != null) {
                cases.add(decoded);
            }
        }
        return new SuiteSpec(
                reader.optionalString("name"),
                reader.stringList("tags"),
                decodeActors(reader, errors),
                decodeFixtures(reader, errors),
                cases);
    }

    private static Map<String, ActorSpec> decodeActors(final SpecReader parent, final List<String> errors) {
        final Map<String, ActorSpec> actors = new LinkedHashMap<>();
        final Map<String, Object> raw = parent.optionalObject("actors");
        if (raw == null) {
            return actors;
        }
        for (final Map.Entry<String, Object> entry : raw.entrySet()) {
            final String path = "actors." + entry.getKey();
            final SpecReader reader = SpecReader.of(entry.getValue(), path, errors, ACTOR_KEYS);
            final ActorKind kind = decodeEnum(reader, "kind", ActorKind::fromText);
            if (kind == null) {
                continue;
            }
            actors.put(entry.getKey(), new ActorSpec(
                    kind,
                    reader.optionalString("username"),
                    reader.optionalString("username_env"),
                    reader.optionalString("password"),
                    reader.optionalString("password_env"),
                    reader.optionalString("namespace"),
                    reader.optionalString("namespace_env"),
                    reader.optionalString("database"),
                    reader.optionalString("database_env"),
                    reader.optionalString("access"),
                    reader.optionalString("access_env"),
                    reader.optionalObject("params"),
                    reader.optionalString("token"),
                    reader.optionalString("token_env"),
                    reader.stringMap("headers")));
        }
        return actors;
    }

    private static List<FixtureSpec> decodeFixtures(final SpecReader parent, final List<String> errors) {
        final List<FixtureSpec> fixtures = new ArrayList<>();
        final List<Object> raw = parent.list("fixtures");
        for (int i = 0; i < raw.size(); i++) {
            final SpecReader reader = SpecReader.of(raw.get(i), "fixtures[" + i + "]", errors, FIXTURE_KEYS);
            final String sql = reader.optionalString("sql");
            final String file = reader.optionalString("file");
            if ((sql == null) == (file == null)) {
                reader.error(reader.path() + " requires exactly one of sql or file");
            }
            fixtures.add(new FixtureSpec(reader.optionalString("name"), reader.optionalString("actor"), sql, file));
        }
        return fixtures;
    }

    private static CaseSpec decodeCase(final Object raw, final String path, final List<String> errors) {
        final String kind = raw instanceof Map<?, ?> map && map.get("kind") instanceof String text ? text : null;
        final Set<String> kindKeys = switch (kind == null ? "" : kind) {
            case SqlExpectCase.LABEL -> SQL_EXPECT_KEYS;
            case PermissionsMatrixCase.LABEL -> PERMISSIONS_KEYS;
            case SchemaMetadataCase.LABEL -> METADATA_KEYS;
            case SchemaBehaviorCase.LABEL -> BEHAVIOR_KEYS;
            case ApiRequestCase.LABEL -> API_KEYS;
            default -> null;
        };
        if (kindKeys == null) {
            errors.add(SpecReader.qualify(path, "kind")
                    + (kind == null ? " is required" : " has unsupported value '" + kind + "'"));
            return null;
        }
        final Set<String> allowed = new HashSet<>(CASE_COMMON_KEYS);
        allowed.addAll(kindKeys);
        final SpecReader reader = SpecReader.of(raw, path, errors, allowed);
        final String name = reader.requiredString("name");
        final List<String> tags = reader.stringList("tags");

        final CaseDefinition definition = switch (kind) {
            case SqlExpectCase.LABEL -> new SqlExpectCase(
                    reader.optionalString("actor"),
                    reader.requiredString("sql"),
                    reader.bool("allow", true),
                    reader.optionalString("error_contains"),
                    reader.optionalString("error_code"),
                    decodeJsonAssertions(reader, "assertions", errors));
            case PermissionsMatrixCase.LABEL -> new PermissionsMatrixCase(
                    reader.optionalString("actor"),
                    reader.requiredString("table"),
                    reader.optionalString("record_id"),
                    decodeRules(reader, errors));
            case SchemaMetadataCase.LABEL -> new SchemaMetadataCase(
                    reader.optionalString("actor"),
                    reader.optionalString("table"),
                    reader.optionalString("sql"),
                    reader.stringList("contains"),
                    decodeJsonAssertions(reader, "assertions", errors));
            case SchemaBehaviorCase.LABEL -> new SchemaBehaviorCase(
                    reader.optionalString("actor"),
                    reader.stringList("setup_sql"),
                    reader.requiredString("action_sql"),
                    reader.bool("expect_success", true),
                    reader.optionalString("expect_error_contains"),
                    reader.optionalString("verify_sql"),
                    decodeJsonAssertions(reader, "assertions", errors));
            default -> decodeApiRequest(reader, errors);
        };
        return new CaseSpec(name, tags, definition);
    }

    private static ApiRequestCase decodeApiRequest(final SpecReader reader, final List<String> errors) {
        final Long status = reader.optionalLong("expected_status");
        if (status == null && !reader.has("expected_status")) {
            reader.error(reader.field("expected_status") + " is required");
        } else if (status != null && (status < 100 || status > 599)) {
            reader.error(reader.field("expected_status") + " must be an HTTP status code");
        }
        return new ApiRequestCase(
                reader.optionalString("actor"),
                reader.optionalString("method"),
                reader.requiredString("path"),
                status == null ? 0 : status.intValue(),
                reader.stringMap("headers"),
                reader.has("body"),
                reader.raw("body"),
                reader.optionalLong("timeout_ms"),
                decodeJsonAssertions(reader, "body_assertions", errors),
                decodeHeaderAssertions(reader, errors));
    }

    private static List<PermissionRule> decodeRules(final SpecReader parent, final List<String> errors) {
        final List<PermissionRule> rules = new ArrayList<>();
        final List<Object> raw = parent.list("rules");
        for (int i = 0; i < raw.size(); i++) {
            final SpecReader reader = SpecReader.of(raw.get(i), parent.field("rules") + "[" + i + "]", errors, RULE_KEYS);
            final PermissionAction action = decodeEnum(reader, "action", PermissionAction::fromText);
            if (action == null) {
                continue;
            }
            rules.add(new PermissionRule(
                    action,
                    reader.bool("allow", true),
                    reader.optionalString("sql"),
                    reader.optionalString("error_contains")));
        }
        return rules;
    }

    private static List<JsonAssertionSpec> decodeJsonAssertions(
            final SpecReader parent,
            final String key,
            final List<String> errors) {
        final List<JsonAssertionSpec> assertions = new ArrayList<>();
        final List<Object> raw = parent.list(key);
        for (int i = 0; i < raw.size(); i++) {
            final SpecReader reader =
                    SpecReader.of(raw.get(i), parent.field(key) + "[" + i + "]", errors, JSON_ASSERTION_KEYS);
            if (!reader.has("path")) {
                reader.error(reader.field("path") + " is required");
            }
            assertions.add(new JsonAssertionSpec(
                    reader.optionalString("path"),
                    reader.optionalBool("exists"),
                    reader.has("equals"),
                    reader.raw("equals"),
                    reader.optionalString("contains"),
                    reader.optionalString("regex")));
        }
        return assertions;
    }

    private static List<HeaderAssertionSpec> decodeHeaderAssertions(
            final SpecReader parent,
            final List<String> errors) {
        final List<HeaderAssertionSpec> assertions = new ArrayList<>();
        final List<Object> raw = parent.list("header_assertions");
        for (int i = 0; i < raw.size(); i++) {
            final SpecReader reader = SpecReader.of(
                    raw.get(i), parent.field("header_assertions") + "[" + i + "]", errors, HEADER_ASSERTION_KEYS);
            assertions.add(new HeaderAssertionSpec(
                    reader.requiredString("name"),
                    reader.optionalBool("exists"),
                    reader.optionalString("equals"),
                    reader.optionalString("contains"),
                    reader.optionalString("regex")));
        }
        return assertions;
    }

    private static <E> E decodeEnum(
            final SpecReader reader,
            final String key,
            final Function<String, E> parser) {
        final String raw = reader.optionalString(key);
        if (raw == null) {
            if (!reader.has(key)) {
                reader.error(reader.field(key) + " is required");
            }
            return null;
        }
        try {
            return parser.apply(raw);
        } catch (final IllegalArgumentException exception) {
            reader.error(reader.field(key) + ": " + exception.getMessage());
            return null;
        }
    }

    private static void throwIfInvalid(final List<String> errors, final String sourceName) {
        if (errors.isEmpty()) {
            return;
        }
        final List<String> qualified = new ArrayList<>(errors.size());
        for (final String error : errors) {
            qualified.add(sourceName + ": " + error);
        }
        throw new SpecValidationException(qualified);
    }

    private static boolean isSpecDocument(final Path path) {
        final String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (final String extension : SUITE_EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static String read(final Path file) throws IOException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException exception) {
            throw new IOException("reading " + file + ": " + exception.getMessage(), exception);
        }
    }
}
