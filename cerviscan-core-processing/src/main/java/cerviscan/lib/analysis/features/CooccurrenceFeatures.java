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

import cerviscan.lib.analysis.images.ChannelImage;
import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.color.ColorTools;
import cerviscan.lib.measurements.FeatureVector;

/**
 * Gray-level co-occurrence features for horizontally-adjacent pixels, along with the entropy of the color image.
 * <p>
 * A symmetric co-occurrence matrix with 256 levels is built from each pixel and its right-hand neighbour,
 * and normalized to sum to 1. All features are rounded to 3 decimal places.
 *
 * @author CerviScan developers
 *
 */
public class CooccurrenceFeatures {

	private static final Logger logger = LoggerFactory.getLogger(CooccurrenceFeatures.class);

	private static final int N_LEVELS = 256;

	private static final List<String> FEATURE_NAMES = List.of("contrast", "correlation", "energy", "homogeneity", "entropy");

	// Suppressed default constructor for non-instantiability
	private CooccurrenceFeatures() {
		throw new AssertionError();
	}

	/**
	 * Names of the features, in order.
	 * @return
	 */
	public static List<String> getFeatureNames() {
		return FEATURE_NAMES;
	}

	/**
	 * Compute co-occurrence features.
	 *
	 * @param gray 8-bit grayscale image used for the co-occurrence matrix
	 * @param image image used to compute the entropy; all channel values contribute to a single histogram
	 * @return feature vector with 5 entries
	 */
	public static FeatureVector measure(final SimpleImage gray, final ChannelImage image) {
		var matrix = computeMatrix(gray);
		logger.trace("Co-occurrence matrix with {} entries", matrix.getSum());

		int n = matrix.getN();
		double[] px = new double[n];
		double[] py = new double[n];
		double contrast = 0;
		double asm = 0;
		double homogeneity = 0;
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double val = matrix.get(i, j);
				px[i] += val;
				py[j] += val;
				int d = i - j;
				contrast += val * d * d;
				asm += val * val;
				homogeneity += val / (1 + d * d);
			}
		}

		double mx = 0, my = 0;
		for (int i = 0; i < n; i++) {
			mx += i * px[i];
			my += i * py[i];
		}
		double sx = 0, sy = 0;
		for (int i = 0; i < n; i++) {
			sx += (i - mx) * (i - mx) * px[i];
			sy += (i - my) * (i - my) * py[i];
		}
		sx = Math.sqrt(sx);
		sy = Math.sqrt(sy);

		double correlation;
		if (sx < 1e-15 || sy < 1e-15)
			correlation = 1.0;
		else {
			correlation = 0;
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < n; j++) {
					double val = matrix.get(i, j);
					if (val != 0)
						correlation += val * (i - mx) * (j - my);
				}
			}
			correlation /= sx * sy;
		}

		return FeatureVector.of(FEATURE_NAMES, new double[] {
				round(contrast),
				round(correlation),
				round(Math.sqrt(asm)),
				round(homogeneity),
				round(computeEntropy(image))
		});
	}

	static CoocMatrix computeMatrix(final SimpleImage gray) {
		var matrix = new CoocMatrix(N_LEVELS);
		int width = gray.getWidth();
		int height = gray.getHeight();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width - 1; x++) {
				matrix.addToEntrySymmetric(getLevel(gray.getValue(x, y)), getLevel(gray.getValue(x + 1, y)));
			}
		}
		return matrix;
	}

	/**
	 * Shannon entropy (natural logarithm) of all 8-bit values in an image, pooled across channels.
	 * @param image
	 * @return
	 */
	static double computeEntropy(final ChannelImage image) {
		long[] hist = new long[N_LEVELS];
		long total = 0;
		for (int c = 0; c < image.nChannels(); c++) {
			for (int y = 0; y < image.getHeight(); y++) {
				for (int x = 0; x < image.getWidth(); x++) {
					hist[getLevel(image.getValue(x, y, c))]++;
					total++;
				}
			}
		}
		if (total == 0)
			return 1.0;
		double entropy = 0;
		for (long count : hist) {
			if (count == 0)
				continue;
			double p = (double)count / total;
			entropy -= p * Math.log(p);
		}
		return entropy;
	}

	private static int getLevel(float val) {
		return ColorTools.do8BitRangeCheck(Math.round(val));
	}

	private static double round(double val) {
		return Math.rint(val * 1000) / 1000;
	}

}
