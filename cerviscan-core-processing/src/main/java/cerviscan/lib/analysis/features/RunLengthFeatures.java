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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Helper class for computing run-length statistics for one direction of a {@link RunLengthMatrix}.
 * <p>
 * Gray levels are indexed from zero ({@code I = 0 ... levels - 1}) and run lengths from one
 * ({@code J = 1 ... maxRunLength}). Any per-cell term that is infinite or NaN (e.g. division by {@code I = 0})
 * is replaced by zero before summation, so all features are finite for a non-empty image.
 * <p>
 * Note that the long run low gray-level emphasis is computed as {@code sum(M * J^2 / J^2) / S},
 * and is therefore always exactly 1. It is retained so that feature vectors remain compatible with
 * previously-trained classifiers.
 *
 * @author CerviScan developers
 *
 */
public class RunLengthFeatures {

	private static final String[] FEATURE_NAMES = new String[]{
		"Short run emphasis",
		"Long run emphasis",
		"Gray-level non-uniformity",
		"Run-length non-uniformity",
		"Run percentage",
		"Low gray-level run emphasis",
		"High gray-level run emphasis",
		"Short run low gray-level emphasis",
		"Short run high gray-level emphasis",
		"Long run low gray-level emphasis",
		"Long run high gray-level emphasis"
	};

	private static final List<String> ABBREVIATIONS = Collections.unmodifiableList(Arrays.asList(
		"SRE", "LRE", "GLN", "RLN", "RP", "LGLRE", "HGL", "SRLGLE", "SRHGLE", "LRLGLE", "LRHGLE"
	));

	private final RunLengthDirection direction;
	private final double[] f = new double[FEATURE_NAMES.length];

	/**
	 * Constructor.
	 * @param matrix precomputed run-length matrix
	 * @param direction the direction to use; must be included in the matrix
	 */
	RunLengthFeatures(final RunLengthMatrix matrix, final RunLengthDirection direction) {
		this.direction = direction;
		computeFeatures(matrix);
	}

	/**
	 * Compute features from a matrix for a single direction.
	 * @param matrix
	 * @param direction
	 * @return
	 * @throws IllegalArgumentException if the direction is not available in the matrix
	 */
	public static RunLengthFeatures compute(final RunLengthMatrix matrix, final RunLengthDirection direction) {
		return new RunLengthFeatures(matrix, direction);
	}

	/**
	 * Abbreviated feature names, in the order features are stored.
	 * These are used to build the names of features in a {@link cerviscan.lib.measurements.FeatureVector}.
	 * @return
	 */
	public static List<String> getAbbreviations() {
		return ABBREVIATIONS;
	}

	private void computeFeatures(RunLengthMatrix matrix) {
		int nLevels = matrix.getNumLevels();
		int nRuns = matrix.getMaxRunLength();

		double s = 0;
		double sre = 0, lre = 0, lglre = 0, hgl = 0;
		double srlgle = 0, srhgle = 0, lrlgle = 0, lrhgle = 0;
		double[] levelSums = new double[nLevels];
		double[] runSums = new double[nRuns];
		for (int i = 0; i < nLevels; i++) {
			double i2 = (double)i * i;
			for (int jj = 0; jj < nRuns; jj++) {
				double m = matrix.get(i, jj, direction);
				double j = jj + 1;
				double j2 = j * j;
				s += m;
				levelSums[i] += m;
				runSums[jj] += m;

				sre += mask(m / j2);
				lre += mask(m * j2);
				lglre += mask(m / i2);
				hgl += mask(m * i2);
				srlgle += mask(m / (i2 * j2));
				srhgle += mask(mask(m * i2) / j2);
				lrlgle += mask(mask(m * j2) / j2);
				lrhgle += mask(m * i2 * j2);
			}
		}

		double gln = 0;
		for (double v : levelSums)
			gln += v * v;
		double rln = 0;
		for (double v : runSums)
			rln += v * v;

		f[0] = sre / s;
		f[1] = lre / s;
		f[2] = gln / s;
		f[3] = rln / s;
		f[4] = s / ((double)nLevels * nRuns);
		f[5] = lglre / s;
		f[6] = hgl / s;
		f[7] = srlgle / s;
		f[8] = srhgle / s;
		f[9] = lrlgle / s;
		f[10] = lrhgle / s;
	}

	private static double mask(double val) {
		return Double.isFinite(val) ? val : 0;
	}

	/**
	 * Direction used to compute the features.
	 * @return
	 */
	public RunLengthDirection getDirection() {
		return direction;
	}

	/**
	 * Total number of features.
	 * @return
	 */
	public int nFeatures() {
		return f.length;
	}

	/**
	 * Get the name of the specified feature.
	 * @param i
	 * @return
	 */
	public String getFeatureName(int i) {
		return FEATURE_NAMES[i];
	}

	/**
	 * Get the name of the feature as used in feature vectors, e.g. {@code SRE_deg0}.
	 * @param i
	 * @return
	 */
	public String getFeatureKey(int i) {
		return ABBREVIATIONS.get(i) + "_" + direction.getLabel();
	}

	/**
	 * Get the value of the specified feature.
	 * @param i
	 * @return
	 */
	public double getFeature(int i) {
		return f[i];
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < f.length; i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(getFeatureKey(i)).append(": ").append(f[i]);
		}
		return sb.toString();
	}

}
