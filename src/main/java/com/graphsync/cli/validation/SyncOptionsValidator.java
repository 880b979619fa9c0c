package com.graphsync.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.graphsync.cli.exception.OptionsValidationException;
import com.graphsync.cli.model.SyncOptions;
import com.graphsync.cli.model.ValidatedSyncOptions;

public class SyncOptionsValidator {

	private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

	private static final int MAX_REVISION_HEADER = 400;

	public ValidatedSyncOptions validate(SyncOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getConnectorClass())) {
			errors.add("Connector class is required (--connector-class / -c).");
		}
		if (isBlank(o.getContainerKey())) {
			errors.add("Container key is required (--container / -k).");
		}

		boolean apiSource = !isBlank(o.getApiBaseUrl());
		Path sourceFile = null;
		if (apiSource && o.getSourceFile() != null) {
			errors.add("Use either --source-file or --api-base-url, not both.");
		} else if (!apiSource) {
			if (o.getSourceFile() == null) {
				errors.add("Either --source-file or --api-base-url must be provided.");
			} else if (!Files.isRegularFile(o.getSourceFile())) {
				errors.add("Source file does not exist or is not a file: " + o.getSourceFile());
			} else {
				sourceFile = o.getSourceFile().toAbsolutePath().normalize();
			}
		} else if (!o.getApiBaseUrl().startsWith("http://") && !o.getApiBaseUrl().startsWith("https://")) {
			errors.add("API base URL must start with http:// or https://. Got: " + o.getApiBaseUrl());
		}

		Path repositoryFile = null;
		if (o.getRepositoryFile() == null) {
			errors.add("Repository file is required (--repository / -r).");
		} else {
			repositoryFile = o.getRepositoryFile().toAbsolutePath().normalize();
			if (Files.isDirectory(repositoryFile)) {
				errors.add("Repository must be a file, not a directory: " + repositoryFile);
			}
		}

		if (o.getRevisionHeader() != null && o.getRevisionHeader().length() > MAX_REVISION_HEADER) {
			errors.add("Revision header must be at most " + MAX_REVISION_HEADER + " characters. Got: "
					+ o.getRevisionHeader().length());
		}

		String logLevel = o.getLogLevel() == null ? "INFO" : o.getLogLevel().trim().toUpperCase(Locale.ROOT);
		if (!LOG_LEVELS.contains(logLevel)) {
			errors.add("Log level must be one of TRACE, DEBUG, INFO, WARN, ERROR. Got: " + o.getLogLevel());
		}

		if (o.getSnapshotFile() != null && Files.isDirectory(o.getSnapshotFile())) {
			errors.add("Snapshot must be a file, not a directory: " + o.getSnapshotFile());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedSyncOptions(apiSource, sourceFile, repositoryFile, logLevel);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
