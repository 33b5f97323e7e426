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

package cerviscan.lib.analysis.stats;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.analysis.images.SimpleImages;

/**
 * Population statistics (mean, central moments, median) for a fixed array of values.
 * <p>
 * Unlike sample statistics, all moments are normalized by {@code n} rather than {@code n - 1}.
 * Values are expected to be finite.
 * <p>
 * Where all values are identical the central moments are exactly zero, so that any statistic
 * normalized by the standard deviation is reliably non-finite rather than the result of rounding errors.
 *
 * @author CerviScan developers
 *
 */
public class MomentStatistics {

	private static final Logger logger = LoggerFactory.getLogger(MomentStatistics.class);

	private final double[] values;
	private final double mean;
	private final double m2, m3, m4;
	private final double min, max;

	private Double median;

	private MomentStatistics(final double[] values) {
		this.values = values;
		int n = values.length;
		if (n == 0) {
			mean = m2 = m3 = m4 = Double.NaN;
			min = max = Double.NaN;
			return;
		}
		min = StatUtils.min(values);
		max = StatUtils.max(values);
		mean = StatUtils.mean(values);
		if (min == max) {
			m2 = m3 = m4 = 0;
			logger.trace("All {} values are identical ({})", n, min);
			return;
		}
		double s2 = 0, s3 = 0, s4 = 0;
		for (double v : values) {
			double d = v - mean;
			double d2 = d * d;
			s2 += d2;
			s3 += d2 * d;
			s4 += d2 * d2;
		}
		m2 = s2 / n;
		m3 = s3 / n;
		m4 = s4 / n;
	}

	/**
	 * Compute statistics for an array of values.
	 * The array is used directly, and should not be modified afterwards.
	 * @param values
	 * @return
	 */
	public static MomentStatistics compute(final double[] values) {
		return new MomentStatistics(values);
	}

	/**
	 * Compute statistics for all pixels of an image.
	 * @param image
	 * @return
	 */
	public static MomentStatistics compute(final SimpleImage image) {
		return new MomentStatistics(SimpleImages.getDoublePixels(image));
	}

	/**
	 * Number of values.
	 * @return
	 */
	public int size() {
		return values.length;
	}

	/**
	 * Arithmetic mean.
	 * @return the mean, or NaN if there are no values
	 */
	public double getMean() {
		return mean;
	}

	/**
	 * Median value, or the mean of the two central values if the number of values is even.
	 * @return the median, or NaN if there are no values
	 */
	public double getMedian() {
		if (median == null)
			median = values.length == 0 ? Double.NaN : new Median().evaluate(values);
		return median;
	}

	/**
	 * Minimum value.
	 * @return
	 */
	public double getMin() {
		return min;
	}

	/**
	 * Maximum value.
	 * @return
	 */
	public double getMax() {
		return max;
	}

	/**
	 * Population variance, i.e. the second central moment.
	 * @return
	 */
	public double getVariance() {
		return m2;
	}

	/**
	 * Population standard deviation.
	 * @return
	 */
	public double getStdDev() {
		return Math.sqrt(m2);
	}

	/**
	 * Get a central moment {@code sum((x - mean)^k) / n}.
	 * @param order the order {@code k}, between 2 and 4
	 * @return
	 */
	public double getCentralMoment(int order) {
		switch (order) {
		case 2:
			return m2;
		case 3:
			return m3;
		case 4:
			return m4;
		default:
			throw new IllegalArgumentException("Only central moments of order 2, 3 or 4 are supported (requested " + order + ")");
		}
	}

	/**
	 * Population skewness, i.e. the third standardized moment {@code m3 / m2^1.5}.
	 * <p>
	 * This is NaN if all values are identical.
	 * @return
	 */
	public double getSkewness() {
		return m3 / Math.pow(m2, 1.5);
	}

	@Override
	public String toString() {
		return String.format("%s n: %d, Mean: %.4f, Std.dev: %.4f, Min: %.4f, Max: %.4f",
				getClass().getSimpleName(), size(), getMean(), getStdDev(), getMin(), getMax());
	}

}
