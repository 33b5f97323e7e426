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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.images.InvalidImageException;
import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.analysis.images.SimpleImages;
import cerviscan.lib.common.LogTools;

/**
 * Gray-level run-length matrix, counting runs of identical gray levels for one or more directions.
 * <p>
 * Counts are indexed by gray-level offset (level minus the minimum level in the image),
 * run index (run length minus one) and direction.
 * The gray-level axis has size {@code max - min + 1}, and the run axis has size {@code max(width, height)}.
 * Both are determined from the whole image, and are therefore shared by all directions.
 *
 * @author CerviScan developers
 *
 */
public class RunLengthMatrix {

	private static final Logger logger = LoggerFactory.getLogger(RunLengthMatrix.class);

	private final int minLevel;
	private final int nLevels;
	private final int maxRunLength;
	private final List<RunLengthDirection> directions;
	private final int[] counts;

	private RunLengthMatrix(int minLevel, int nLevels, int maxRunLength, List<RunLengthDirection> directions) {
		this.minLevel = minLevel;
		this.nLevels = nLevels;
		this.maxRunLength = maxRunLength;
		this.directions = Collections.unmodifiableList(new ArrayList<>(directions));
		this.counts = new int[nLevels * maxRunLength * directions.size()];
	}

	/**
	 * Compute a run-length matrix for all four directions.
	 * @param image image containing integer gray levels
	 * @return
	 * @throws InvalidImageException if the image has no pixels, or contains non-finite values
	 */
	public static RunLengthMatrix compute(SimpleImage image) throws InvalidImageException {
		return compute(image, List.of(RunLengthDirection.values()));
	}

	/**
	 * Compute a run-length matrix for the specified directions.
	 * <p>
	 * Pixel values are expected to be integers (e.g. 8-bit grayscale or LBP codes);
	 * any fractional values are rounded to the nearest integer.
	 *
	 * @param image image containing integer gray levels
	 * @param directions directions to compute; the order is retained
	 * @return
	 * @throws InvalidImageException if the image has no pixels, or contains non-finite values
	 * @throws IllegalArgumentException if no directions are specified, or a direction is repeated
	 */
	public static RunLengthMatrix compute(SimpleImage image, Collection<RunLengthDirection> directions) throws InvalidImageException {
		int width = image.getWidth();
		int height = image.getHeight();
		if (width * height == 0)
			throw new InvalidImageException("Cannot compute run-length matrix for an empty image (" + width + " x " + height + ")");
		if (directions.isEmpty())
			throw new IllegalArgumentException("At least one direction is required");
		if (directions.stream().distinct().count() != directions.size())
			throw new IllegalArgumentException("Directions must be unique: " + directions);

		float[] pixels = SimpleImages.getPixels(image, true);
		int min = Integer.MAX_VALUE;
		int max = Integer.MIN_VALUE;
		for (float v : pixels) {
			int level = toLevel(v);
			if (level < min)
				min = level;
			if (level > max)
				max = level;
		}

		var matrix = new RunLengthMatrix(min, max - min + 1, Math.max(width, height), new ArrayList<>(directions));
		logger.trace("Computing run-length matrix with {} levels, max run length {}", matrix.nLevels, matrix.maxRunLength);
		for (int d = 0; d < matrix.directions.size(); d++) {
			for (float[] sequence : matrix.directions.get(d).getSequences(image))
				matrix.addRuns(sequence, d);
		}
		return matrix;
	}

	private static int toLevel(float value) throws InvalidImageException {
		if (!Float.isFinite(value))
			throw new InvalidImageException("Run-length matrix requires finite pixel values, but found " + value);
		int level = Math.round(value);
		if (level != value)
			LogTools.warnOnce(logger, "Run-length matrix requires integer gray levels - values will be rounded");
		return level;
	}

	private void addRuns(float[] sequence, int directionIndex) {
		int i = 0;
		while (i < sequence.length) {
			int level = toLevel(sequence[i]);
			int j = i + 1;
			while (j < sequence.length && toLevel(sequence[j]) == level)
				j++;
			counts[index(level - minLevel, j - i - 1, directionIndex)]++;
			i = j;
		}
	}

	private int index(int levelIndex, int runIndex, int directionIndex) {
		return (directionIndex * nLevels + levelIndex) * maxRunLength + runIndex;
	}

	private int directionIndex(RunLengthDirection direction) {
		int ind = directions.indexOf(direction);
		if (ind < 0)
			throw new IllegalArgumentException("Direction " + direction + " was not computed, available directions are " + directions);
		return ind;
	}

	/**
	 * Get the number of runs for a gray-level offset, run index and direction.
	 *
	 * @param levelIndex gray level minus {@link #getMinLevel()}
	 * @param runIndex run length minus one
	 * @param direction
	 * @return
	 */
	public int get(int levelIndex, int runIndex, RunLengthDirection direction) {
		if (levelIndex < 0 || levelIndex >= nLevels || runIndex < 0 || runIndex >= maxRunLength)
			throw new IndexOutOfBoundsException(String.format("Index (%d, %d) out of range for matrix %d x %d", levelIndex, runIndex, nLevels, maxRunLength));
		return counts[index(levelIndex, runIndex, directionIndex(direction))];
	}

	/**
	 * Get the total number of runs for a direction.
	 * @param direction
	 * @return
	 */
	public long getTotalRuns(RunLengthDirection direction) {
		int d = directionIndex(direction);
		long sum = 0;
		for (int i = 0; i < nLevels; i++) {
			for (int j = 0; j < maxRunLength; j++)
				sum += counts[index(i, j, d)];
		}
		return sum;
	}

	/**
	 * Minimum gray level in the image, corresponding to level index 0.
	 * @return
	 */
	public int getMinLevel() {
		return minLevel;
	}

	/**
	 * Number of gray levels, i.e. {@code max - min + 1}.
	 * @return
	 */
	public int getNumLevels() {
		return nLevels;
	}

	/**
	 * Size of the run axis, i.e. the longest possible run.
	 * @return
	 */
	public int getMaxRunLength() {
		return maxRunLength;
	}

	/**
	 * Directions included in the matrix, in the order they were requested.
	 * @return
	 */
	public List<RunLengthDirection> getDirections() {
		return directions;
	}

	@Override
	public String toString() {
		return String.format("%s (%d levels from %d, max run %d, %s)",
				getClass().getSimpleName(), nLevels, minLevel, maxRunLength, directions);
	}

}
