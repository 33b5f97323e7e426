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
 * A minimal interface to provide access to pixel values from a 2D, 1-channel image.
 * <p>
 * Pixels are addressed by column ({@code x}) and row ({@code y}), with the origin at the top left.
 * 
 * @author CerviScan developers
 *
 */
public interface SimpleImage {
	
	/**
	 * Get the value of a single pixel.
	 * @param x x-coordinate (column)
	 * @param y y-coordinate (row)
	 * @return
	 */
	public float getValue(int x, int y);
	
	/**
	 * Image width, in pixels.
	 * @return
	 */
	public int getWidth();
	
	/**
	 * Image height, in pixels.
	 * @return
	 */
	public int getHeight();
	
	/**
	 * Check whether a pixel coordinate falls inside the image.
	 * @param x
	 * @param y
	 * @return true if {@code 0 <= x < width} and {@code 0 <= y < height}
	 */
	public default boolean contains(int x, int y) {
		return x >= 0 && y >= 0 && x < getWidth() && y < getHeight();
	}

}
