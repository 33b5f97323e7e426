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

/**
 * Static functions to help work with packed RGB values and 8-bit channel intensities.
 * 
 * @author CerviScan developers
 *
 */
public class ColorTools {
	
	/**
	 * Mask for the alpha bits of a packed ARGB value.
	 */
	public static final int MASK_ALPHA = 0xff000000;
	
	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Make a packed RGB value from specified input values.
	 * This is equivalent to an ARGB value with alpha set to 255.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packRGB(int r, int g, int b) {
		return MASK_ALPHA | 
			   ((r & 0xff)<<16) | 
			   ((g & 0xff)<<8) | 
			    (b & 0xff);
	}
	
	/**
	 * Clip an input value to be an integer in the range 0-255 (with rounding down).
	 * 
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return v < 0 ? 0 : (v > 255 ? 255 : (int)v);
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}
	
	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return (rgb & 0xff);
	}
	
	/**
	 * Compute the ITU-R 601-2 luma of an 8-bit RGB triple, using fixed-point arithmetic with rounding.
	 * <p>
	 * This matches the 'L' conversion used by most imaging libraries, and always returns an integer 0-255.
	 * 
	 * @param r red value, 0-255
	 * @param g green value, 0-255
	 * @param b blue value, 0-255
	 * @return
	 */
	public static int luma601(int r, int g, int b) {
		return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
	}

	/**
	 * Compute the ITU-R 601-2 luma of an 8-bit RGB triple, using 14-bit fixed-point coefficients.
	 * <p>
	 * This gives the same result as {@link #luma601(int, int, int)} for most colors, but occasionally
	 * differs by one gray level, e.g. for (0, 0, 250) it gives 29 rather than 28.
	 * 
	 * @param r red value, 0-255
	 * @param g green value, 0-255
	 * @param b blue value, 0-255
	 * @return
	 */
	public static int luma601Fixed14(int r, int g, int b) {
		return (r * 4899 + g * 9617 + b * 1868 + (1 << 13)) >> 14;
	}

}
