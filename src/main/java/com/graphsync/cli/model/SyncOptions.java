package com.graphsync.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "run" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class SyncOptions {

	@Option(names = { "--connector-class",
			"-c" }, required = true, description = "Fully qualified name of the connector class to run")
	private String connectorClass;

	@Option(names = { "--source-file", "-s" }, description = "Source file read by the loader")
	private Path sourceFile;

	@Option(names = { "--api-base-url" }, description = "Base URL of an API source (instead of --source-file)")
	private String apiBaseUrl;

	@Option(names = {
			"--loader" }, description = "Key of the loader node the connection belongs to (defaults to the container's loader)")
	private String loaderNodeKey;

	@Option(names = { "--container", "-k" }, required = true, description = "Key of the container node to synchronize")
	private String containerKey;

	@Option(names = { "--repository",
			"-r" }, required = true, description = "JSON file holding the target repository (created if missing)")
	private Path repositoryFile;

	@Option(names = { "--no-delete" }, description = "Keep records whose source rows disappeared")
	private boolean noDelete;

	@Option(names = { "--revision-header" }, defaultValue = "graphsync", description = "Prefix of every changeset comment")
	private String revisionHeader;

	@Option(names = { "--snapshot" }, description = "Write the node tree snapshot to this file")
	private Path snapshotFile;

	@Option(names = { "--log-level" }, defaultValue = "INFO", description = "Log level: TRACE, DEBUG, INFO, WARN or ERROR")
	private String logLevel;

}
