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

package cerviscan.lib.color;

import java.util.List;

/**
 * Color spaces that an RGB image can be converted into before computing color features.
 * 
 * @author CerviScan developers
 */
public enum ColorSpace {
	
	/**
	 * Original 8-bit red, green and blue values.
	 */
	RGB("r", "g", "b"),
	
	/**
	 * Luma and two chrominance channels, computed from the 8-bit RGB values with a fixed linear transform.
	 */
	YUV("y", "u", "v"),
	
	/**
	 * CIE L*a*b* with a D65 white point, computed from sRGB values.
	 */
	LAB("l", "a", "b");
	
	private final List<String> channelNames;
	
	ColorSpace(String... channelNames) {
		this.channelNames = List.of(channelNames);
	}
	
	/**
	 * Get the short names of the three channels, in order.
	 * These are used as suffixes for feature names, e.g. {@code mean_y}.
	 * @return
	 */
	public List<String> getChannelNames() {
		return channelNames;
	}
	
	/**
	 * Get the short name of a single channel.
	 * @param channel
	 * @return
	 */
	public String getChannelName(int channel) {
		return channelNames.get(channel);
	}

}
