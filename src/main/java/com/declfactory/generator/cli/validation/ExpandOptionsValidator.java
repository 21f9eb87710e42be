package com.declfactory.generator.cli.validation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import javax.lang.model.SourceVersion;

import com.declfactory.generator.cli.exception.OptionsValidationException;
import com.declfactory.generator.cli.model.ExpandOptions;
import com.declfactory.generator.cli.model.ValidatedExpandOptions;

public class ExpandOptionsValidator {

	public ValidatedExpandOptions validate(ExpandOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> inputs = new ArrayList<>();
		if (o.getInputs() == null || o.getInputs().isEmpty()) {
			errors.add("At least one input is required (--input / -i).");
		} else {
			for (Path input : o.getInputs()) {
				if (!Files.exists(input)) {
					errors.add("Input does not exist: " + input);
				} else {
					inputs.add(input.toAbsolutePath().normalize());
				}
			}
		}

		if (isBlank(o.getExtension()) || !o.getExtension().startsWith(".")) {
			errors.add("Extension must start with '.'. Got: " + o.getExtension());
		}

		if (!isMarkerName(o.getBasisMarker())) {
			errors.add("Basis marker is not a valid annotation name: " + o.getBasisMarker());
		}
		if (!isMarkerName(o.getTemplateMarker())) {
			errors.add("Template marker is not a valid annotation name: " + o.getTemplateMarker());
		}
		if (o.getBasisMarker() != null && o.getBasisMarker().equals(o.getTemplateMarker())) {
			errors.add("Basis and template markers must differ. Both are: " + o.getBasisMarker());
		}

		Path normalizedOutputDir = null;
		if (o.getOutputDir() == null) {
			if (!o.isDryRun()) {
				errors.add("Output directory is required unless --dry-run is given (--output-dir / -o).");
			}
		} else {
			normalizedOutputDir = o.getOutputDir().toAbsolutePath().normalize();
			if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
				errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
			} else if (!o.isForce() && !o.isDryRun() && isNonEmptyDirectory(normalizedOutputDir)) {
				errors.add("Output directory is not empty: " + normalizedOutputDir + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedExpandOptions(List.copyOf(inputs), normalizedOutputDir);
	}

	private static boolean isMarkerName(String s) {
		return !isBlank(s) && SourceVersion.isIdentifier(s) && !SourceVersion.isKeyword(s);
	}

	private static boolean isNonEmptyDirectory(Path p) {
		if (!Files.isDirectory(p)) {
			return false;
		}
		try (Stream<Path> entries = Files.list(p)) {
			return entries.findAny().isPresent();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
