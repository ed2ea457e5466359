package com.localedata.assembler.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.emit.EmissionReport;
import com.localedata.assembler.exception.AssemblerConfigurationException;
import com.localedata.assembler.pipeline.BuildContext;

/**
 * Processes the locale directives in one source unit.
 *
 * <ul>
 * <li>{@code /* !data a b *}{@code /} and {@code // !data a b} record categories</li>
 * <li>{@code // !macro name} and {@code "!macro name"} are replaced by build values</li>
 * <li>{@code // !defineLocaleData} becomes locale data setup code</li>
 * <li>{@code // !loadLocaleData} becomes a per-part loading switch</li>
 * </ul>
 *
 * A unit without triggers is rewritten immediately. A unit with a trigger
 * completes only after the build barrier has released and the bundle has been
 * planned and emitted.
 */
public class DirectiveRewriter {
    private static final Logger log = LoggerFactory.getLogger(DirectiveRewriter.class);

    static final Pattern DATA_BLOCK = Pattern.compile("/\\*\\s*!data\\s*([^*]+)\\*/");
    static final Pattern DATA_LINE = Pattern.compile("//\\s*!data\\s*([^\\n]+)");
    static final Pattern MACRO_LINE = Pattern.compile("//\\s*!macro\\s*(\\S*)");
    static final Pattern MACRO_QUOTED = Pattern.compile("[\"']!macro\\s*(\\S*)[\"']");
    static final Pattern DEFINE_TRIGGER = Pattern.compile("//\\s*!defineLocaleData");
    static final Pattern LOAD_TRIGGER = Pattern.compile("//\\s*!loadLocaleData");

    static final String VERSION_PLACEHOLDER = "__VERSION__";

    private final BuildContext context;
    private final LoaderCodeGenerator loaderCode;
    private final AtomicInteger triggerUnits = new AtomicInteger();

    public DirectiveRewriter(BuildContext context) {
        if (context == null) {
            throw new AssemblerConfigurationException("Directive rewriting requires a build context");
        }
        this.context = context;
        this.loaderCode = new LoaderCodeGenerator(context.getConfig(), context.getEmitter().getLocalesDir());
    }

    public CompletableFuture<String> rewrite(SourceUnit unit) {
        AssemblerConfig config = context.getConfig();
        if (config.isDebug()) {
            log.info("Processing unit {}", unit.getName());
        } else {
            log.debug("Processing unit {}", unit.getName());
        }

        List<String> categories = scanCategories(unit.getText());
        categories.forEach(context::record);
        if (config.isDebug() && !categories.isEmpty()) {
            log.info("Unit {} requests {}", unit.getName(), categories);
        }

        String text = expandMacros(unit.getText());

        if (!hasTrigger(text)) {
            return CompletableFuture.completedFuture(text);
        }

        triggerUnits.incrementAndGet();
        log.debug("Unit {} waits for the request set to be complete", unit.getName());
        return context.getBarrier().whenReady()
                .thenApplyAsync(ignored -> replaceTriggers(text, context.finalizeBuild()), context.getExecutor());
    }

    /**
     * Units seen so far that contain a define or load trigger.
     */
    public int getTriggerUnits() {
        return triggerUnits.get();
    }

    static List<String> scanCategories(String text) {
        List<String> categories = new ArrayList<>();
        for (Pattern pattern : List.of(DATA_BLOCK, DATA_LINE)) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                for (String name : m.group(1).trim().split("\\s+")) {
                    if (!name.isEmpty()) {
                        categories.add(name);
                    }
                }
            }
        }
        return categories;
    }

    static boolean hasTrigger(String text) {
        return DEFINE_TRIGGER.matcher(text).find() || LOAD_TRIGGER.matcher(text).find();
    }

    String expandMacros(String text) {
        String expanded = replaceAll(MACRO_LINE, text, m -> expandMacro(m.group(1)));
        return replaceAll(MACRO_QUOTED, expanded, m -> expandMacro(m.group(1)));
    }

    private String expandMacro(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "localelist":
            case "locale-list":
                return context.getConfig().getLocales().stream()
                        .map(locale -> "\"" + locale + "\"")
                        .collect(Collectors.joining(", "));
            case "version":
            case "ilibversion":
                // substituted with the real version later by the host build
                return VERSION_PLACEHOLDER;
            default:
                log.warn("Unknown macro '{}' removed", name);
                return "";
        }
    }

    private String replaceTriggers(String text, EmissionReport report) {
        List<String> entries = report.getManifestEntries();
        String defined = replaceFirst(DEFINE_TRIGGER, text, loaderCode.defineLocaleData(entries));
        return replaceFirst(LOAD_TRIGGER, defined, loaderCode.loadLocaleData(entries));
    }

    private static String replaceAll(Pattern pattern, String text, Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String replaceFirst(Pattern pattern, String text, String replacement) {
        return pattern.matcher(text).replaceFirst(Matcher.quoteReplacement(replacement));
    }
}
