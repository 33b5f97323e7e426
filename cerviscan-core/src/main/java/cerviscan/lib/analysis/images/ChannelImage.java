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
 * A 2D image with one or more channels, e.g. an RGB raster or the same raster after color space conversion.
 * 
 * @author CerviScan developers
 *
 */
public interface ChannelImage {
	
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
	 * Number of channels.
	 * @return
	 */
	public int nChannels();
	
	/**
	 * Get the value of a single pixel in one channel.
	 * @param x x-coordinate (column)
	 * @param y y-coordinate (row)
	 * @param channel channel index, starting at 0
	 * @return
	 */
	public float getValue(int x, int y, int channel);
	
	/**
	 * Get a single channel as a {@link SimpleImage}.
	 * @param channel channel index, starting at 0
	 * @return
	 * @throws IndexOutOfBoundsException if the channel is not available
	 */
	public SimpleImage getChannel(int channel);

}
