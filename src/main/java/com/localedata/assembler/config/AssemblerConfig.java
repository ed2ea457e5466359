package com.localedata.assembler.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import com.localedata.assembler.model.AssemblyMode;
import com.localedata.assembler.model.LocaleTag;

import lombok.Builder;
import lombok.Data;

/**
 * Options of one assembly build.
 */
@Data
@Builder(toBuilder = true)
public class AssemblerConfig {

    public static final List<String> DEFAULT_LOCALES = List.of(
            "en-AU", "en-CA", "en-GB", "en-IN", "en-NG", "en-PH",
            "en-PK", "en-US", "en-ZA", "de-DE", "fr-CA", "fr-FR",
            "es-AR", "es-ES", "es-MX", "id-ID", "it-IT", "ja-JP",
            "ko-KR", "pt-BR", "ru-RU", "tr-TR", "vi-VN", "zxx-XX",
            "zh-Hans-CN", "zh-Hant-HK", "zh-Hant-TW", "zh-Hans-SG");

    public static final String UNCOMPILED = "uncompiled";
    public static final String STANDARD_SIZE = "standard";
    public static final String WEB_TARGET = "web";

    /**
     * Target locales, in the order given.
     */
    @Builder.Default
    private List<String> locales = DEFAULT_LOCALES;

    @Builder.Default
    private AssemblyMode assembly = AssemblyMode.ASSEMBLED;

    /**
     * Selects the repository sub-path layout ("uncompiled" or a compiled layout).
     */
    @Builder.Default
    private String compilation = UNCOMPILED;

    /**
     * Repository data-size profile.
     */
    @Builder.Default
    private String size = STANDARD_SIZE;

    /**
     * Runtime target profile; "web" loads parts as lazily fetched chunks.
     */
    @Builder.Default
    private String target = WEB_TARGET;

    private boolean debug;

    private Path repositoryRoot;

    /**
     * Root under which the locales/ directory of artifacts is written.
     */
    private Path outputRoot;

    /**
     * Module path of the runtime library referenced by generated code.
     */
    @Builder.Default
    private String runtimeRoot = "ilib";

    /**
     * Release trigger units after a fixed delay instead of waiting for the
     * host to signal that every unit has been scanned.
     */
    private boolean bestEffortBarrier;

    /**
     * Wait applied by the best-effort barrier before a trigger unit resolves.
     */
    @Builder.Default
    private Duration quiescenceDelay = Duration.ofMillis(250);

    /**
     * Parses the comma-separated form of the locale option. Blank input yields the defaults.
     */
    public static List<String> parseLocales(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_LOCALES;
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public List<LocaleTag> getLocaleTags() {
        return locales.stream().map(LocaleTag::parse).toList();
    }

    /**
     * Directory holding the category documents for the configured compilation and size.
     */
    public Path getLocaleDataDir() {
        Path base = UNCOMPILED.equals(compilation)
                ? repositoryRoot.resolve("js")
                : repositoryRoot.resolve("output").resolve("js");
        return STANDARD_SIZE.equals(size) ? base.resolve("locale") : base.resolve("locale-" + size);
    }

    public Path getLocalesOutputDir() {
        return outputRoot.resolve("locales");
    }

    public boolean isWebTarget() {
        return WEB_TARGET.equals(target);
    }
}
