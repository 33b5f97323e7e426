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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.analysis.images.SimpleImages;
import cerviscan.lib.analysis.stats.MomentStatistics;
import cerviscan.lib.measurements.FeatureVector;

/**
 * Local Binary Patterns using the 8 immediate neighbours of each pixel.
 * <p>
 * Neighbours are visited clockwise starting from the top-left, and each neighbour with a value
 * &gt;= the center pixel sets one bit of the pattern: top-left (1), top (2), top-right (4), right (8),
 * bottom-right (16), bottom (32), bottom-left (64), left (128).
 * Neighbours outside the image never set a bit.
 * <p>
 * Summary statistics of the resulting LBP image are not masked: for an image where all LBP codes are
 * identical, the kurtosis and skewness are NaN.
 *
 * @author CerviScan developers
 *
 */
public class LocalBinaryPatterns {

	private static final Logger logger = LoggerFactory.getLogger(LocalBinaryPatterns.class);

	private static final List<String> FEATURE_NAMES = List.of("mean", "median", "std", "kurtosis", "skewness");

	// Neighbour offsets in bit order
	private static final int[] xo8 = {-1, 0, 1, 1, 1, 0, -1, -1};
	private static final int[] yo8 = {-1, -1, -1, 0, 1, 1, 1, 0};

	// Suppressed default constructor for non-instantiability
	private LocalBinaryPatterns() {
		throw new AssertionError();
	}

	/**
	 * Names of the summary statistics computed by {@link #measure(SimpleImage)}, in order.
	 * @return
	 */
	public static List<String> getFeatureNames() {
		return FEATURE_NAMES;
	}

	private static int computeLocalBinaryPattern(final SimpleImage img, final int x, final int y) {
		float val = img.getValue(x, y);
		int lbp = 0;
		for (int i = 0; i < 8; i++) {
			int xx = x + xo8[i];
			int yy = y + yo8[i];
			if (img.contains(xx, yy) && img.getValue(xx, yy) >= val)
				lbp |= 1 << i;
		}
		return lbp;
	}

	/**
	 * Compute an image of local binary patterns.
	 *
	 * @param img grayscale input image
	 * @return a new image of the same size, containing integer codes 0-255
	 */
	public static SimpleImage computeLocalBinaryPatternImage(final SimpleImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		var lbp = SimpleImages.createFloatImage(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				lbp.setValue(x, y, computeLocalBinaryPattern(img, x, y));
			}
		}
		return lbp;
	}

	/**
	 * Compute summary statistics for an existing LBP image.
	 * <p>
	 * Statistics are {@code mean}, {@code median}, {@code std} (population standard deviation),
	 * {@code kurtosis} ({@code 4 * sum((x - mean)^4) / (n * std^4) - 3})
	 * and {@code skewness} (Pearson's second skewness coefficient, {@code 3 * (mean - median) / std}).
	 *
	 * @param lbp
	 * @return
	 */
	public static FeatureVector computeStatistics(final SimpleImage lbp) {
		var stats = MomentStatistics.compute(lbp);
		int n = stats.size();
		double mean = stats.getMean();
		double median = stats.getMedian();
		double std = stats.getStdDev();
		double kurtosis = 4 * (stats.getCentralMoment(4) * n) / (n * Math.pow(std, 4)) - 3;
		double skewness = 3 * (mean - median) / std;
		if (!Double.isFinite(kurtosis) || !Double.isFinite(skewness))
			logger.debug("LBP statistics are not finite for {} pixels with standard deviation {}", n, std);
		return FeatureVector.of(FEATURE_NAMES, new double[] {mean, median, std, kurtosis, skewness});
	}

	/**
	 * Compute an LBP image and its summary statistics.
	 *
	 * @param img grayscale input image
	 * @return feature vector with 5 entries
	 * @see #computeLocalBinaryPatternImage(SimpleImage)
	 * @see #computeStatistics(SimpleImage)
	 */
	public static FeatureVector measure(final SimpleImage img) {
		return computeStatistics(computeLocalBinaryPatternImage(img));
	}

}
