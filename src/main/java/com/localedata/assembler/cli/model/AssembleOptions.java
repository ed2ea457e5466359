package com.localedata.assembler.cli.model;

import java.nio.file.Path;

import com.localedata.assembler.model.AssemblyMode;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "assemble" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AssembleOptions {

	@Option(names = { "--source-dir", "-s" }, required = true, description = "Directory of source units to scan and rewrite")
	private Path sourceDir;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "assets", description = "Output root for rewritten units and the locales/ bundle directory (default: assets)")
	private Path outputDir;

	@Option(names = { "--repository-root", "-r" }, required = true, description = "Root of the raw locale data repository")
	private Path repositoryRoot;

	@Option(names = { "--locales", "-l" }, description = "Comma-separated target locales (default: 28 common locales)")
	private String locales;

	@Option(names = { "--assembly", "-a" }, defaultValue = "ASSEMBLED", description = "ASSEMBLED, DYNAMIC or DYNAMICDATA")
	private AssemblyMode assembly;

	@Option(names = { "--compilation" }, defaultValue = "uncompiled", description = "Repository layout: uncompiled or compiled")
	private String compilation;

	@Option(names = { "--size" }, defaultValue = "standard", description = "Repository data-size profile")
	private String size;

	@Option(names = { "--target" }, defaultValue = "web", description = "Runtime target profile (web loads parts as chunks)")
	private String target;

	@Option(names = { "--runtime-root" }, defaultValue = "ilib", description = "Module path of the runtime library in generated code")
	private String runtimeRoot;

	@Option(names = { "--quiescence-ms" }, description = "Release trigger units after this delay instead of after every unit was scanned")
	private Integer quiescenceMs;

	@Option(names = { "--debug" }, description = "Verbose per-unit diagnostics")
	private boolean debug;

	@Option(names = { "--force", "-f" }, description = "Replace an existing locales/ output directory")
	private boolean force;

}
