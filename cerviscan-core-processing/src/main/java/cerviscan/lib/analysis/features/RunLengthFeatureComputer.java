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
import cerviscan.lib.measurements.FeatureVector;

/**
 * Static methods for computing gray-level run-length features.
 * <p>
 * Features are ordered by direction, and then by feature, i.e. all features for 0 degrees come first,
 * followed by 45, 90 and 135 degrees.
 *
 * @author CerviScan developers
 *
 */
public class RunLengthFeatureComputer {

	private static final Logger logger = LoggerFactory.getLogger(RunLengthFeatureComputer.class);

	private static final List<String> FEATURE_NAMES = Collections.unmodifiableList(getFeatureNames(List.of(RunLengthDirection.values())));

	// Suppressed default constructor for non-instantiability
	private RunLengthFeatureComputer() {
		throw new AssertionError();
	}

	/**
	 * Get the names of all features computed by {@link #measure(SimpleImage)}, in order.
	 * @return
	 */
	public static List<String> getFeatureNames() {
		return FEATURE_NAMES;
	}

	/**
	 * Get the names of features computed for the specified directions, in order.
	 * @param directions
	 * @return
	 */
	public static List<String> getFeatureNames(Collection<RunLengthDirection> directions) {
		var names = new ArrayList<String>();
		for (var direction : directions) {
			for (var abbr : RunLengthFeatures.getAbbreviations())
				names.add(abbr + "_" + direction.getLabel());
		}
		return names;
	}

	/**
	 * Compute run-length features for all four directions.
	 *
	 * @param image image containing integer gray levels, e.g. 8-bit grayscale or LBP codes
	 * @return feature vector with 44 entries
	 * @throws InvalidImageException if the image is empty
	 */
	public static FeatureVector measure(final SimpleImage image) throws InvalidImageException {
		return measure(image, List.of(RunLengthDirection.values()));
	}

	/**
	 * Compute run-length features for the specified directions.
	 *
	 * @param image image containing integer gray levels
	 * @param directions
	 * @return feature vector with 11 entries per direction
	 * @throws InvalidImageException if the image is empty
	 */
	public static FeatureVector measure(final SimpleImage image, final Collection<RunLengthDirection> directions) throws InvalidImageException {
		var matrix = RunLengthMatrix.compute(image, directions);
		logger.debug("Computed {}", matrix);
		var builder = FeatureVector.builder();
		for (var direction : matrix.getDirections()) {
			var features = RunLengthFeatures.compute(matrix, direction);
			for (int i = 0; i < features.nFeatures(); i++)
				builder.add(features.getFeatureKey(i), features.getFeature(i));
		}
		return builder.build();
	}

}
