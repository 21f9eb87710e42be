package com.declfactory.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.declfactory.generator.expansion.ExpansionConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "expand" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ExpandOptions {

	@Option(names = { "--input", "-i" }, required = true, arity = "1..*",
			description = "Template source file or directory (repeatable)")
	private List<Path> inputs = new ArrayList<>();

	@Option(names = { "--output-dir", "-o" }, description = "Directory the expanded sources are written to")
	private Path outputDir;

	@Option(names = { "--extension" }, defaultValue = ".java",
			description = "Suffix of template sources inside input directories (default: ${DEFAULT-VALUE})")
	private String extension;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Expand and report without writing any file")
	private boolean dryRun;

	@Option(names = { "--strict-empty" }, description = "Fail when a template iterates over an empty matrix")
	private boolean strictEmpty;

	@Option(names = { "--basis-marker" }, defaultValue = ExpansionConfig.DEFAULT_BASIS_MARKER,
			description = "Simple name of the matrix-binding annotation (default: ${DEFAULT-VALUE})")
	private String basisMarker;

	@Option(names = { "--template-marker" }, defaultValue = ExpansionConfig.DEFAULT_TEMPLATE_MARKER,
			description = "Simple name of the template annotation (default: ${DEFAULT-VALUE})")
	private String templateMarker;

	@Option(names = { "--verbose", "-v" }, description = "Log every expanded file")
	private boolean verbose;
}
