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
import cerviscan.lib.analysis.stats.MomentStatistics;

/**
 * Default implementation of Tamura texture features: coarseness, contrast, directionality and roughness.
 * <p>
 * <ul>
 *   <li><b>coarseness</b>: the mean over all pixels of the best window size {@code 2^k} ({@code k < 5}),
 *   i.e. the size giving the largest difference between the average intensities of adjacent
 *   non-overlapping windows, either horizontally or vertically</li>
 *   <li><b>contrast</b>: {@code std / kurtosis^0.25}, where kurtosis is {@code m4 / std^4}; zero for an image without variation</li>
 *   <li><b>directionality</b>: second moment about the peak of a 16-bin histogram of Prewitt gradient orientations,
 *   using only pixels with a gradient magnitude &gt;= 12; zero if no pixel has a sufficient gradient</li>
 *   <li><b>roughness</b>: the sum of coarseness and contrast</li>
 * </ul>
 *
 * @author CerviScan developers
 *
 */
public class TamuraFeatures implements TamuraFeatureSupplier {

	private static final Logger logger = LoggerFactory.getLogger(TamuraFeatures.class);

	private static final List<String> FEATURE_NAMES = List.of("coarseness", "contrast", "directionality", "roughness");

	private final int kMax;
	private final int nBins;
	private final double gradientThreshold;

	/**
	 * Create Tamura features with default parameters (5 window sizes, 16 orientation bins, gradient threshold 12).
	 */
	public TamuraFeatures() {
		this(5, 16, 12.0);
	}

	/**
	 * Create Tamura features with custom parameters.
	 * @param kMax number of window sizes to consider for coarseness, i.e. {@code k < kMax}
	 * @param nBins number of orientation histogram bins for directionality
	 * @param gradientThreshold minimum gradient magnitude for a pixel to contribute to directionality
	 */
	public TamuraFeatures(int kMax, int nBins, double gradientThreshold) {
		if (kMax < 1)
			throw new IllegalArgumentException("kMax must be >= 1, but was " + kMax);
		if (nBins < 1)
			throw new IllegalArgumentException("Number of bins must be >= 1, but was " + nBins);
		this.kMax = kMax;
		this.nBins = nBins;
		this.gradientThreshold = gradientThreshold;
	}

	@Override
	public List<String> getFeatureNames() {
		return FEATURE_NAMES;
	}

	@Override
	public double[] computeFeatures(SimpleImage gray) {
		double coarseness = computeCoarseness(gray);
		double contrast = computeContrast(gray);
		double directionality = computeDirectionality(gray);
		logger.trace("Tamura coarseness={}, contrast={}, directionality={}", coarseness, contrast, directionality);
		return new double[] {coarseness, contrast, directionality, coarseness + contrast};
	}

	double computeCoarseness(SimpleImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		int n = width * height;
		if (n == 0)
			return Double.NaN;

		// Summed-area table with an extra leading row and column of zeros
		double[] sat = new double[(width + 1) * (height + 1)];
		for (int y = 0; y < height; y++) {
			double rowSum = 0;
			for (int x = 0; x < width; x++) {
				rowSum += img.getValue(x, y);
				sat[(y + 1) * (width + 1) + x + 1] = sat[y * (width + 1) + x + 1] + rowSum;
			}
		}

		double[] bestDiff = new double[n];
		int[] bestK = new int[n];
		for (int k = 0; k < kMax; k++) {
			int half = 1 << k;
			// Windows of size 2*half must fit on both sides of the pixel
			if (2 * half > width && 2 * half > height)
				break;
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					double eh = Math.abs(windowMean(sat, width, height, x + half, y, half) - windowMean(sat, width, height, x - half, y, half));
					double ev = Math.abs(windowMean(sat, width, height, x, y + half, half) - windowMean(sat, width, height, x, y - half, half));
					double e = Math.max(Double.isNaN(eh) ? 0 : eh, Double.isNaN(ev) ? 0 : ev);
					int ind = y * width + x;
					if (e > bestDiff[ind]) {
						bestDiff[ind] = e;
						bestK[ind] = k;
					}
				}
			}
		}
		double sum = 0;
		for (int k : bestK)
			sum += 1 << k;
		return sum / n;
	}

	/**
	 * Mean of the square window of size {@code 2*half} centered on (x, y), or NaN if the window does not fit in the image.
	 */
	private static double windowMean(double[] sat, int width, int height, int x, int y, int half) {
		int x1 = x - half;
		int y1 = y - half;
		int x2 = x + half;
		int y2 = y + half;
		if (x1 < 0 || y1 < 0 || x2 > width || y2 > height)
			return Double.NaN;
		int w = width + 1;
		double sum = sat[y2 * w + x2] - sat[y1 * w + x2] - sat[y2 * w + x1] + sat[y1 * w + x1];
		return sum / ((double)(x2 - x1) * (y2 - y1));
	}

	static double computeContrast(SimpleImage img) {
		var stats = MomentStatistics.compute(img);
		if (stats.size() == 0)
			return Double.NaN;
		double variance = stats.getVariance();
		if (variance == 0)
			return 0;
		double alpha4 = stats.getCentralMoment(4) / (variance * variance);
		return Math.sqrt(variance) / Math.pow(alpha4, 0.25);
	}

	double computeDirectionality(SimpleImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		double[] hist = new double[nBins];
		double binWidth = Math.PI / nBins;
		int count = 0;
		for (int y = 1; y < height - 1; y++) {
			for (int x = 1; x < width - 1; x++) {
				double dh = 0;
				double dv = 0;
				for (int i = -1; i <= 1; i++) {
					dh += img.getValue(x + 1, y + i) - img.getValue(x - 1, y + i);
					dv += img.getValue(x + i, y - 1) - img.getValue(x + i, y + 1);
				}
				double magnitude = (Math.abs(dh) + Math.abs(dv)) / 2.0;
				if (magnitude < gradientThreshold)
					continue;
				// Orientation in [0, pi)
				double theta;
				if (dh == 0)
					theta = 0;
				else
					theta = Math.atan(dv / dh) + Math.PI / 2.0;
				int bin = (int)Math.floor(theta / binWidth + 0.5) % nBins;
				hist[bin]++;
				count++;
			}
		}
		if (count == 0)
			return 0;

		int peak = 0;
		for (int i = 0; i < nBins; i++) {
			hist[i] /= count;
			if (hist[i] > hist[peak])
				peak = i;
		}
		double fdir = 0;
		for (int i = 0; i < nBins; i++) {
			int d = Math.abs(i - peak);
			d = Math.min(d, nBins - d);
			fdir += d * d * hist[i];
		}
		return fdir;
	}

	@Override
	public String toString() {
		return String.format("%s (kMax=%d, bins=%d, threshold=%.1f)", getClass().getSimpleName(), kMax, nBins, gradientThreshold);
	}

}
