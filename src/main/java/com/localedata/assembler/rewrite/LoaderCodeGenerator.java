package com.localedata.assembler.rewrite;

import java.nio.file.Path;
import java.util.List;

import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.emit.BundleEmitter;
import com.localedata.assembler.util.FileWriteUtil;

/**
 * Generates the code that replaces the define and load triggers.
 */
public class LoaderCodeGenerator {

    private final AssemblerConfig config;
    private final Path localesDir;

    public LoaderCodeGenerator(AssemblerConfig config, Path localesDir) {
        this.config = config;
        this.localesDir = localesDir;
    }

    /**
     * Setup code for the define trigger. Assembled builds pull in every emitted
     * part; deferred builds install the runtime loader instead.
     */
    public String defineLocaleData(List<String> manifestEntries) {
        StringBuilder sb = new StringBuilder();

        if (config.getAssembly().isDeferred()) {
            sb.append("""
                    ilib.WebpackLoader = require('%s/lib/WebpackLoader.js');
                    ilib.setLoaderCallback(ilib.WebpackLoader(ilib));
                    ilib._dyncode = %s;
                    ilib._dyndata = true;
                    """.formatted(config.getRuntimeRoot(), config.getAssembly().defersCode()));
            return sb.toString();
        }

        for (String part : manifestEntries) {
            if (BundleEmitter.MANIFEST_NAME.equals(part)) {
                continue;
            }
            String name = "locale" + part.replace('-', '_');
            sb.append("var %1$s = require('%2$s'); %1$s && typeof(%1$s.installLocale) === 'function' && %1$s.installLocale(ilib);\n"
                    .formatted(name, modulePath(part + BundleEmitter.PART_EXTENSION)));
        }
        sb.append("""
                ilib._dyncode = false;
                ilib._dyndata = false;
                """);
        return sb.toString();
    }

    /**
     * Switch cases for the load trigger, one per manifest entry; root doubles as the default case.
     */
    public String loadLocaleData(List<String> manifestEntries) {
        StringBuilder sb = new StringBuilder();

        for (String part : manifestEntries) {
            if ("root".equals(part)) {
                sb.append("default:\n");
            }
            sb.append("        case '").append(part).append("':\n");

            if (BundleEmitter.MANIFEST_NAME.equals(part)) {
                sb.append("""
                                    %s.then(function(module) {
                                        callback(module);
                                    });
                                    break;
                        """.formatted(fetch(part, part + BundleEmitter.MANIFEST_EXTENSION)));
            } else {
                sb.append("""
                                    %s.then(function(module) {
                                        module && typeof(module.installLocale) === "function" && module.installLocale(ilib);
                                        callback(module);
                                    });
                                    break;
                        """.formatted(fetch(part, part + BundleEmitter.PART_EXTENSION)));
            }
        }
        return sb.toString();
    }

    private String fetch(String part, String fileName) {
        String path = modulePath(fileName);
        if (config.isWebTarget()) {
            return "import(/* webpackChunkName: '" + part + "' */ '" + path + "')";
        }
        return "Promise.resolve(require('" + path + "'))";
    }

    private String modulePath(String fileName) {
        return FileWriteUtil.toModulePath(localesDir.resolve(fileName));
    }
}
