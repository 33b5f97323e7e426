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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import cerviscan.lib.color.ColorSpace;
import cerviscan.lib.io.GsonTools;

/**
 * Parameters controlling which feature groups are included in a feature vector.
 * <p>
 * The default parameters give the standard feature vector: YUV color moments, LBP statistics,
 * run-length features and Tamura features, with constant features removed.
 * Parameters can be stored as JSON, where any missing field takes its default value.
 *
 * @author CerviScan developers
 *
 */
public class FeatureExtractionParameters {

	private ColorSpace colorSpace = ColorSpace.YUV;
	private List<ColorSpace> additionalColorSpaces = new ArrayList<>();
	private boolean includeLbpRunLength = false;
	private boolean includeCooccurrence = false;
	private boolean dropConstantFeatures = true;

	private FeatureExtractionParameters() {}

	private FeatureExtractionParameters(FeatureExtractionParameters params) {
		this.colorSpace = params.colorSpace;
		this.additionalColorSpaces = new ArrayList<>(params.getAdditionalColorSpaces());
		this.includeLbpRunLength = params.includeLbpRunLength;
		this.includeCooccurrence = params.includeCooccurrence;
		this.dropConstantFeatures = params.dropConstantFeatures;
	}

	/**
	 * Get the default parameters.
	 * @return
	 */
	public static FeatureExtractionParameters getDefaultInstance() {
		return new FeatureExtractionParameters();
	}

	/**
	 * Create a builder, initialized with default parameters.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(getDefaultInstance());
	}

	/**
	 * Create a builder, initialized with the values of existing parameters.
	 * @param params
	 * @return
	 */
	public static Builder builder(FeatureExtractionParameters params) {
		return new Builder(params);
	}

	/**
	 * Read parameters from a JSON file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or parsed
	 * @throws IllegalArgumentException if the parameters are invalid
	 */
	public static FeatureExtractionParameters readJson(Path path) throws IOException {
		var params = GsonTools.readJson(path, FeatureExtractionParameters.class);
		params.validate();
		return params;
	}

	/**
	 * Write parameters to a JSON file.
	 * @param path
	 * @throws IOException
	 */
	public void writeJson(Path path) throws IOException {
		GsonTools.writeJson(path, this);
	}

	/**
	 * Check parameters are valid, i.e. a primary color space is set and no color space is used more than once.
	 * @throws IllegalArgumentException if the parameters are invalid
	 */
	public void validate() throws IllegalArgumentException {
		if (colorSpace == null)
			throw new IllegalArgumentException("Color space must not be null");
		var set = new LinkedHashSet<ColorSpace>();
		set.add(colorSpace);
		for (var cs : getAdditionalColorSpaces()) {
			if (cs == null)
				throw new IllegalArgumentException("Additional color spaces must not contain null");
			if (!set.add(cs))
				throw new IllegalArgumentException("Color space " + cs + " is requested more than once");
		}
	}

	/**
	 * Color space used for the primary color moments.
	 * @return
	 */
	public ColorSpace getColorSpace() {
		return colorSpace;
	}

	/**
	 * Additional color spaces for which color moments are appended, with names prefixed by the color space.
	 * @return
	 */
	public List<ColorSpace> getAdditionalColorSpaces() {
		if (additionalColorSpaces == null)
			return Collections.emptyList();
		return Collections.unmodifiableList(additionalColorSpaces);
	}

	/**
	 * Whether run-length features of the LBP image should be appended, with names prefixed by {@code lbp_}.
	 * @return
	 */
	public boolean includeLbpRunLength() {
		return includeLbpRunLength;
	}

	/**
	 * Whether co-occurrence features should be appended, with names prefixed by {@code glcm_}.
	 * @return
	 */
	public boolean includeCooccurrence() {
		return includeCooccurrence;
	}

	/**
	 * Whether features with a value of exactly 1.0 should be removed from the final feature vector.
	 * @return
	 */
	public boolean dropConstantFeatures() {
		return dropConstantFeatures;
	}

	@Override
	public String toString() {
		return GsonTools.getInstance().toJson(this);
	}


	/**
	 * Builder for {@link FeatureExtractionParameters}.
	 */
	public static class Builder {

		private FeatureExtractionParameters params;

		private Builder(FeatureExtractionParameters params) {
			this.params = new FeatureExtractionParameters(params);
		}

		/**
		 * Set the color space for the primary color moments.
		 * @param colorSpace
		 * @return this builder
		 */
		public Builder colorSpace(ColorSpace colorSpace) {
			params.colorSpace = colorSpace;
			return this;
		}

		/**
		 * Set additional color spaces for color moments.
		 * @param colorSpaces
		 * @return this builder
		 */
		public Builder additionalColorSpaces(ColorSpace... colorSpaces) {
			params.additionalColorSpaces = new ArrayList<>(List.of(colorSpaces));
			return this;
		}

		/**
		 * Include run-length features of the LBP image.
		 * @param include
		 * @return this builder
		 */
		public Builder includeLbpRunLength(boolean include) {
			params.includeLbpRunLength = include;
			return this;
		}

		/**
		 * Include co-occurrence features.
		 * @param include
		 * @return this builder
		 */
		public Builder includeCooccurrence(boolean include) {
			params.includeCooccurrence = include;
			return this;
		}

		/**
		 * Remove features with a value of exactly 1.0.
		 * @param drop
		 * @return this builder
		 */
		public Builder dropConstantFeatures(boolean drop) {
			params.dropConstantFeatures = drop;
			return this;
		}

		/**
		 * Build the parameters.
		 * @return
		 * @throws IllegalArgumentException if the parameters are invalid
		 */
		public FeatureExtractionParameters build() {
			var result = new FeatureExtractionParameters(params);
			result.validate();
			return result;
		}

	}

}
