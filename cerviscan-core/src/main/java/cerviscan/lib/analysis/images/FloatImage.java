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
 * A writable single-channel image, with pixels stored in a row-major float array.
 * <p>
 * This is the image type used for derived rasters (grayscale, local binary pattern and converted color channels).
 * Instances are created with {@link SimpleImages#createFloatImage(int, int)} or
 * {@link SimpleImages#createFloatImage(float[], int, int)}.
 *
 * @author CerviScan developers
 *
 */
public final class FloatImage implements SimpleImage {

	private final float[] data;
	private final int width;
	private final int height;

	FloatImage(float[] data, int width, int height) {
		this.data = data;
		this.width = width;
		this.height = height;
	}

	@Override
	public float getValue(int x, int y) {
		return data[y * width + x];
	}

	/**
	 * Set the value of a single pixel.
	 * @param x x-coordinate (column)
	 * @param y y-coordinate (row)
	 * @param val new pixel value
	 */
	public void setValue(int x, int y, float val) {
		data[y * width + x] = val;
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}

	/**
	 * Get the pixels as a row-major array.
	 * @param direct if true, return the backing array; changes to it are visible in the image
	 * @return
	 */
	public float[] getArray(boolean direct) {
		return direct ? data : data.clone();
	}

	@Override
	public String toString() {
		return String.format("%s (%d x %d)", getClass().getSimpleName(), width, height);
	}

}
