package dev.xcdl;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Main application class with CLI support */
@Command(
		name = "xc-downloader",
		version = "1.0.0",
		description = "Queues and downloads media from Xtream-Codes catalogs without fetching anything twice",
		mixinStandardHelpOptions = true,
		subcommands = {DownloadCommand.class, ScanCommand.class, RecordsCommand.class})
public class Main implements Callable<Integer> {

	@Override
	public Integer call() {
		new CommandLine(this).usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
