/*-
 * #%L
 * This file is part of CerviScan.
 * %%
 * Copyright (C) 2024 - 2025 CerviScan developers
 * %%
 * CerviScan is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * CerviScan is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with CerviScan.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package cerviscan;

import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CerviScan launcher.
 *
 * @author CerviScan developers
 *
 */
@Command(name = "cerviscan", subcommands = {HelpCommand.class, ExtractCommand.class},
	footer = {"",
			"Copyright(c) CerviScan developers (2024-2025)"
			}, mixinStandardHelpOptions = true, versionProvider = CerviScan.VersionProvider.class)
public class CerviScan {

	private static final Logger logger = LoggerFactory.getLogger(CerviScan.class);

	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * Turn off logging
		 */
		OFF;
	}

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"} )
	private LogLevel logLevel = LogLevel.INFO;

	/**
	 * Main method to launch CerviScan from the command line.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		System.exit(run(args));
	}

	/**
	 * Parse the arguments and run any subcommand.
	 * @param args
	 * @return the exit code
	 */
	static int run(String... args) {
		CerviScan cerviscan = new CerviScan();
		CommandLine cmd = new CommandLine(cerviscan);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		ParseResult pr;
		try {
			pr = cmd.parseArgs(args);
		} catch (Exception e) {
			logger.error("An error has occurred, please type -h to display help message.\n" + e.getLocalizedMessage());
			return 2;
		}

		// Catch -h/--help and -V/--version
		if (cmd.isUsageHelpRequested()) {
			cmd.usage(System.out);
			return 0;
		} else if (cmd.isVersionHelpRequested()) {
			cmd.printVersionHelp(System.out);
			return 0;
		}

		// Set log level
		if (cerviscan.logLevel != null)
			setRootLogLevel(cerviscan.logLevel);

		if (!pr.hasSubcommand()) {
			cmd.usage(System.out);
			return 0;
		}

		int exitCode = cmd.execute(args);
		if (exitCode != 0)
			logger.warn("Exiting with exit code {}", exitCode);
		return exitCode;
	}

	/**
	 * Set the level of the root logger, if logging is handled by Logback.
	 * @param logLevel
	 */
	static void setRootLogLevel(LogLevel logLevel) {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
			var context = (LoggerContext)LoggerFactory.getILoggerFactory();
			context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(logLevel.name(), Level.INFO));
		} else
			logger.warn("Cannot set root log level to {}", logLevel);
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = CerviScan.class.getPackage().getImplementationVersion();
			var strings = new ArrayList<String>();
			if (version != null) {
				if (!version.startsWith("v"))
					version = "v" + version;
				strings.add("CerviScan " + version);
			}
			if (strings.isEmpty())
				return new String[] {"Unknown CerviScan version!"};
			else {
				strings.add("");
				return strings.toArray(String[]::new);
			}
		}

	}

}
