package com.itrassist.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a local ".env" file (e.g. OPENROUTER_API_KEY, GOOGLE_APPLICATION_CREDENTIALS) into System
 * properties before Spring starts. Keys already present as environment variables or System
 * properties are left untouched.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final List<Path> CANDIDATES = List.of(Path.of(".env"), Path.of("backend", ".env"));

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Path envPath = CANDIDATES.stream()
                .filter(Files::isRegularFile)
                .findFirst()
                .orElse(null);
        if (envPath == null) return;

        try {
            Map<String, String> entries = parse(Files.readAllLines(envPath, StandardCharsets.UTF_8));
            int loaded = 0;
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                if (isDefined(System.getenv(entry.getKey())) || isDefined(System.getProperty(entry.getKey()))) {
                    continue;
                }
                System.setProperty(entry.getKey(), entry.getValue());
                loaded++;
            }
            log.info("[DotenvLoader] {} of {} keys from {} applied (values hidden)",
                    loaded, entries.size(), envPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("[DotenvLoader] Could not read {}: {}", envPath, e.getMessage());
        }
    }

    /**
     * Parses KEY=VALUE lines. Comments, blank lines, malformed lines and empty values are skipped;
     * surrounding single or double quotes are removed.
     */
    static Map<String, String> parse(List<String> lines) {
        Map<String, String> out = new LinkedHashMap<>();
        if (lines == null) return out;

        for (String raw : lines) {
            if (raw == null) continue;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring("export ".length()).trim();

            int eq = line.indexOf('=');
            if (eq <= 0) continue;

            String key = line.substring(0, eq).trim();
            String value = unquote(line.substring(eq + 1).trim());
            if (key.isEmpty() || value.isEmpty()) continue;

            out.put(key, value);
        }
        return out;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
