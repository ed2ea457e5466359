package com.localedata.assembler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.localedata.assembler.cli.exception.OptionsValidationException;
import com.localedata.assembler.cli.model.AssembleOptions;
import com.localedata.assembler.cli.model.ValidatedAssembleOptions;
import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.model.LocaleTag;

public class AssembleOptionsValidator {

	public ValidatedAssembleOptions validate(AssembleOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSourceDir() == null) {
			errors.add("Source directory is required (--source-dir / -s).");
		} else if (!existsDirectory(o.getSourceDir())) {
			errors.add("Source directory does not exist or is not a directory: " + o.getSourceDir());
		}

		Path localeDataDir = null;
		if (o.getRepositoryRoot() == null) {
			errors.add("Repository root is required (--repository-root / -r).");
		} else if (!existsDirectory(o.getRepositoryRoot())) {
			errors.add("Repository root does not exist or is not a directory: " + o.getRepositoryRoot());
		} else {
			localeDataDir = AssemblerConfig.builder()
					.repositoryRoot(o.getRepositoryRoot())
					.compilation(isBlank(o.getCompilation()) ? AssemblerConfig.UNCOMPILED : o.getCompilation())
					.size(isBlank(o.getSize()) ? AssemblerConfig.STANDARD_SIZE : o.getSize())
					.build()
					.getLocaleDataDir();
			if (!existsDirectory(localeDataDir)) {
				errors.add("No locale data for compilation '" + o.getCompilation() + "' and size '" + o.getSize()
						+ "' at " + localeDataDir);
			}
		}

		List<String> locales = AssemblerConfig.parseLocales(o.getLocales());
		for (String locale : locales) {
			if (LocaleTag.parse(locale).isEmpty()) {
				errors.add("Not a locale identifier: '" + locale + "'");
			}
		}

		if (o.getQuiescenceMs() != null && o.getQuiescenceMs() < 0) {
			errors.add("Quiescence delay must be >= 0. Got: " + o.getQuiescenceMs());
		}

		if (isBlank(o.getRuntimeRoot())) {
			errors.add("Runtime root must not be blank (--runtime-root).");
		}

		// Normalize output dir and check the bundle directory
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of("assets") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		Path localesDir = normalizedOutputDir.resolve("locales");
		if (Files.exists(localesDir) && !o.isForce()) {
			errors.add("Locale output directory already exists: " + localesDir + ". Use --force to overwrite.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedAssembleOptions(o.getSourceDir().toAbsolutePath().normalize(), normalizedOutputDir,
				localeDataDir, locales);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
