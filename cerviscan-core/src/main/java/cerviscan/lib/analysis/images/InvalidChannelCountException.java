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

package cerviscan.lib.analysis.images;

/**
 * Exception thrown when an image does not have the number of channels an operation requires.
 * 
 * @author CerviScan developers
 *
 */
public class InvalidChannelCountException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;
	
	private final int expected;
	private final int actual;

	/**
	 * Constructor.
	 * @param expected number of channels required
	 * @param actual number of channels found
	 */
	public InvalidChannelCountException(int expected, int actual) {
		super("Image must have " + expected + " channels, but has " + actual);
		this.expected = expected;
		this.actual = actual;
	}
	
	/**
	 * Number of channels that were required.
	 * @return
	 */
	public int getExpectedChannels() {
		return expected;
	}
	
	/**
	 * Number of channels the image actually had.
	 * @return
	 */
	public int getActualChannels() {
		return actual;
	}

}
