package com.localedata.assembler.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.localedata.assembler.model.AssemblyMode;
import com.localedata.assembler.model.DataDocument;
import com.localedata.assembler.model.PartKey;
import com.localedata.assembler.plan.EntryKind;
import com.localedata.assembler.plan.PlanEntry;
import com.localedata.assembler.util.DataNames;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the entries of one part into a module in either encoding.
 *
 * Immediate-effect modules assign their data into the runtime namespace when
 * loaded. Deferred modules export an installLocale(ilib) function that the
 * runtime loader calls later. Extend entries aimed at the same target are
 * merged into one document at build time, later entries winning per key.
 */
public class PartEncoder {

    static final String ASSEMBLED_TEMPLATE = "part-assembled.ftl";
    static final String DEFERRED_TEMPLATE = "part-deferred.ftl";

    private final Configuration freemarkerConfig;
    private final String runtimeRoot;

    public PartEncoder(String runtimeRoot) {
        this.runtimeRoot = runtimeRoot;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String encode(PartKey part, List<PlanEntry> entries, AssemblyMode mode) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("part", part.getValue());
        model.put("root", part.isRoot());
        model.put("runtimeRoot", runtimeRoot);
        model.put("statements", statements(entries));

        Template template = freemarkerConfig.getTemplate(mode.isDeferred() ? DEFERRED_TEMPLATE : ASSEMBLED_TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Template " + template.getName() + " failed for part " + part, e);
        }
        return out.toString();
    }

    static List<String> statements(List<PlanEntry> entries) {
        List<String> statements = new ArrayList<>();
        Map<String, List<PlanEntry>> extensions = new LinkedHashMap<>();

        for (PlanEntry entry : entries) {
            if (entry.getKind() == EntryKind.EXTEND) {
                extensions.computeIfAbsent(entry.getTarget(), t -> new ArrayList<>()).add(entry);
            } else {
                statements.add(entry.getTarget() + " = " + entry.getPayload().toJson() + ";");
            }
        }

        extensions.forEach((target, group) -> {
            DataDocument merged = group.get(0).getPayload();
            for (PlanEntry entry : group.subList(1, group.size())) {
                merged = merged.mergedWith(entry.getPayload());
            }
            String keys = group.stream().map(PlanEntry::getKey).collect(Collectors.joining(", "));
            statements.add("// " + keys + "\n"
                    + DataNames.RUNTIME + ".extend(" + target + ", " + merged.toJson() + ");");
        });

        return statements;
    }
}
