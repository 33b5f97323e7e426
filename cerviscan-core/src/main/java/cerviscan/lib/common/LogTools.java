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

package cerviscan.lib.common;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Logging helpers for messages that would otherwise be repeated for every image in a batch.
 *
 * @author CerviScan developers
 */
public class LogTools {

	// Messages already logged, keyed by logger name
	private static final Map<String, Set<String>> alreadyLogged = new ConcurrentHashMap<>();

	// Suppressed default constructor for non-instantiability
	private LogTools() {
		throw new AssertionError();
	}

	/**
	 * Log a message once at the specified level.
	 * <p>
	 * This is used to report degenerate inputs (e.g. a color channel with zero variance) without
	 * emitting one identical message for every image processed in a batch.
	 * The same message may still be logged once for each level.
	 *
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		var messages = alreadyLogged.computeIfAbsent(logger.getName(), name -> ConcurrentHashMap.newKeySet());
		if (!messages.add(level + ": " + message))
			return false;
		logger.atLevel(level).log(message);
		return true;
	}

	/**
	 * Log a message once at the INFO level.
	 * @param logger
	 * @param message
	 * @return true if the message was logged
	 */
	public static boolean logOnce(Logger logger, String message) {
		return logOnce(logger, Level.INFO, message);
	}

	/**
	 * Log a message once at the WARN level.
	 * @param logger
	 * @param message
	 * @return true if the message was logged
	 * @see #logOnce(Logger, Level, String)
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}

}
