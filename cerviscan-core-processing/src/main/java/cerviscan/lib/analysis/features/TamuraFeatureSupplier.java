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

import cerviscan.lib.analysis.images.SimpleImage;

/**
 * Supplier of Tamura texture features for a grayscale image.
 * <p>
 * Implementations must return a fixed list of names, and a value array of the same length for every image.
 *
 * @author CerviScan developers
 */
public interface TamuraFeatureSupplier {

	/**
	 * Names of the features, in the order values are returned by {@link #computeFeatures(SimpleImage)}.
	 * @return
	 */
	List<String> getFeatureNames();

	/**
	 * Compute feature values for a grayscale image.
	 * @param gray 8-bit grayscale image
	 * @return one value per feature name
	 */
	double[] computeFeatures(SimpleImage gray);

}
