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

package cerviscan.lib.analysis.features;

import java.util.ArrayList;
import java.util.List;

import cerviscan.lib.analysis.images.SimpleImage;

/**
 * Directions along which gray-level runs are counted.
 * <p>
 * Each direction decomposes an image into a list of pixel sequences. Every pixel belongs to exactly one
 * sequence per direction, so the lengths of all sequences for a direction sum to the number of pixels.
 *
 * @author CerviScan developers
 *
 */
public enum RunLengthDirection {

	/**
	 * Horizontal runs, one sequence per row.
	 */
	DEG_0(0),

	/**
	 * Anti-diagonal runs, from bottom-left to top-right.
	 */
	DEG_45(45),

	/**
	 * Vertical runs, one sequence per column.
	 */
	DEG_90(90),

	/**
	 * Diagonal runs, from top-left to bottom-right.
	 * These are the anti-diagonals of the image rotated by 90 degrees.
	 */
	DEG_135(135);

	private final int angle;

	RunLengthDirection(int angle) {
		this.angle = angle;
	}

	/**
	 * Angle in degrees.
	 * @return
	 */
	public int getAngle() {
		return angle;
	}

	/**
	 * Suffix used when naming features computed for this direction, e.g. {@code deg45}.
	 * @return
	 */
	public String getLabel() {
		return "deg" + angle;
	}

	/**
	 * Split an image into the pixel sequences that define runs in this direction.
	 * The image is not modified.
	 *
	 * @param image
	 * @return a new list of pixel sequences
	 */
	public List<float[]> getSequences(SimpleImage image) {
		int width = image.getWidth();
		int height = image.getHeight();
		List<float[]> sequences = new ArrayList<>();
		if (width == 0 || height == 0)
			return sequences;
		switch (this) {
		case DEG_0:
			for (int y = 0; y < height; y++) {
				float[] seq = new float[width];
				for (int x = 0; x < width; x++)
					seq[x] = image.getValue(x, y);
				sequences.add(seq);
			}
			break;
		case DEG_90:
			for (int x = 0; x < width; x++) {
				float[] seq = new float[height];
				for (int y = 0; y < height; y++)
					seq[y] = image.getValue(x, y);
				sequences.add(seq);
			}
			break;
		case DEG_45:
			// Pixels with x + y == s, starting from the lowest row
			for (int s = 0; s <= width + height - 2; s++) {
				int yStart = Math.min(s, height - 1);
				int yEnd = Math.max(0, s - width + 1);
				float[] seq = new float[yStart - yEnd + 1];
				int i = 0;
				for (int y = yStart; y >= yEnd; y--)
					seq[i++] = image.getValue(s - y, y);
				sequences.add(seq);
			}
			break;
		case DEG_135:
			// Pixels with x - y == k, starting from the top row
			for (int k = -(height - 1); k <= width - 1; k++) {
				int yStart = Math.max(0, -k);
				int yEnd = Math.min(height - 1, width - 1 - k);
				float[] seq = new float[yEnd - yStart + 1];
				int i = 0;
				for (int y = yStart; y <= yEnd; y++)
					seq[i++] = image.getValue(k + y, y);
				sequences.add(seq);
			}
			break;
		default:
			throw new IllegalArgumentException("Unknown direction " + this);
		}
		return sequences;
	}

}
