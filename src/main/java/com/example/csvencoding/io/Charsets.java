package com.example.csvencoding.io;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Charset lookup for CSV files, including the IBM/Cp aliases mainframe exports use.
 */
@Slf4j
public final class Charsets {

    /** Charset name that asks for detection from the file content. */
    public static final String AUTO = "auto";

    private static final int DETECTION_SAMPLE_BYTES = 64 * 1024;

    private Charsets() {}

    /**
     * Resolves a charset name, trying {@code Cp}/{@code IBM} aliases built from its
     * digits before falling back to UTF-8.
     */
    public static Charset resolve(String name) {
        if (name == null || name.isEmpty()) return Charset.defaultCharset();
        String n = name.trim();
        Charset direct = lookup(n);
        if (direct != null) {
            return direct;
        }

        String digits = n.replaceAll("\\D+", "");
        List<String> candidates = new ArrayList<>();
        if (!digits.isEmpty()) {
            candidates.add("Cp" + digits);
            candidates.add("IBM" + digits);
            candidates.add("ibm-" + digits);
            String lowerName = n.toLowerCase(Locale.ROOT);
            Charset.availableCharsets().forEach((k, v) -> {
                String lower = k.toLowerCase(Locale.ROOT);
                if (lower.contains(lowerName) || lower.contains(digits)) {
                    candidates.add(k);
                }
            });
        }

        for (String c : candidates) {
            Charset cs = lookup(c);
            if (cs != null) {
                log.info("Resolved charset '{}' -> '{}'", name, c);
                return cs;
            }
        }

        log.warn("Failed to resolve charset '{}', falling back to UTF-8", name);
        return StandardCharsets.UTF_8;
    }

    private static Charset lookup(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            log.debug("Charset.forName failed for '{}': {}", name, e.getMessage());
            return null;
        }
    }

    /**
     * Resolves {@code name} for {@code file}; {@link #AUTO} detects the charset from the
     * first bytes of the file with ICU4J.
     */
    public static Charset forFile(Path file, String name) throws IOException {
        if (!AUTO.equalsIgnoreCase(name)) {
            return resolve(name);
        }
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return detect(in.readNBytes(DETECTION_SAMPLE_BYTES));
        }
    }

    public static Charset detect(byte[] sample) {
        CharsetDetector detector = new CharsetDetector();
        detector.setText(sample);
        CharsetMatch match = detector.detect();
        if (match == null) {
            log.warn("No charset detected, falling back to UTF-8");
            return StandardCharsets.UTF_8;
        }
        log.debug("Detected charset {} (confidence {})", match.getName(), match.getConfidence());
        return resolve(match.getName());
    }
}
