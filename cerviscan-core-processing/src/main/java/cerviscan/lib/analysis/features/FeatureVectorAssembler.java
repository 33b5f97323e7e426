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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.images.ChannelImage;
import cerviscan.lib.analysis.images.InvalidChannelCountException;
import cerviscan.lib.analysis.images.InvalidImageException;
import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.color.ColorSpaceConverter;
import cerviscan.lib.color.ColorSpaceConverter.GrayscaleMethod;
import cerviscan.lib.measurements.FeatureVector;

/**
 * Assemble the complete feature vector for a single RGB image.
 * <p>
 * Feature groups are always added in the same order:
 * <ol>
 *   <li>color moments in the primary color space (9)</li>
 *   <li>LBP statistics (5)</li>
 *   <li>gray-level run-length features for 4 directions (44)</li>
 *   <li>Tamura features (as defined by the supplier)</li>
 *   <li>optionally, run-length features of the LBP image ({@code lbp_} prefix)</li>
 *   <li>optionally, co-occurrence features ({@code glcm_} prefix)</li>
 *   <li>optionally, color moments for additional color spaces (color space prefix, e.g. {@code lab_})</li>
 * </ol>
 * If requested by the parameters, any feature with a value of exactly 1.0 is then removed.
 * <p>
 * An assembler holds only immutable configuration, and may be used from multiple threads.
 *
 * @author CerviScan developers
 *
 */
public class FeatureVectorAssembler {

	private static final Logger logger = LoggerFactory.getLogger(FeatureVectorAssembler.class);

	private static final double CONSTANT_FEATURE_VALUE = 1.0;

	private final FeatureExtractionParameters params;
	private final TamuraFeatureSupplier tamura;
	private final ColorMoments colorMoments;
	private final List<ColorMoments> additionalColorMoments;

	/**
	 * Create an assembler with default parameters and the default Tamura implementation.
	 */
	public FeatureVectorAssembler() {
		this(FeatureExtractionParameters.getDefaultInstance(), new TamuraFeatures());
	}

	/**
	 * Create an assembler with the specified parameters and Tamura feature supplier.
	 * @param params
	 * @param tamura
	 * @throws IllegalArgumentException if the parameters are invalid
	 */
	public FeatureVectorAssembler(FeatureExtractionParameters params, TamuraFeatureSupplier tamura) {
		Objects.requireNonNull(params, "Parameters must not be null");
		Objects.requireNonNull(tamura, "Tamura feature supplier must not be null");
		params.validate();
		this.params = params;
		this.tamura = tamura;
		this.colorMoments = new ColorMoments(params.getColorSpace());
		var list = new ArrayList<ColorMoments>();
		for (var cs : params.getAdditionalColorSpaces())
			list.add(new ColorMoments(cs));
		this.additionalColorMoments = Collections.unmodifiableList(list);
	}

	/**
	 * Get the parameters used by this assembler.
	 * @return
	 */
	public FeatureExtractionParameters getParameters() {
		return params;
	}

	/**
	 * Get the names of all features before constant features are removed, in order.
	 * @return
	 */
	public List<String> getAllFeatureNames() {
		var names = new ArrayList<String>();
		names.addAll(colorMoments.getFeatureNames());
		names.addAll(LocalBinaryPatterns.getFeatureNames());
		names.addAll(RunLengthFeatureComputer.getFeatureNames());
		names.addAll(tamura.getFeatureNames());
		if (params.includeLbpRunLength())
			addPrefixed(names, "lbp_", RunLengthFeatureComputer.getFeatureNames());
		if (params.includeCooccurrence())
			addPrefixed(names, "glcm_", CooccurrenceFeatures.getFeatureNames());
		for (var moments : additionalColorMoments)
			addPrefixed(names, getPrefix(moments), moments.getFeatureNames());
		return names;
	}

	private static void addPrefixed(List<String> names, String prefix, List<String> toAdd) {
		for (var name : toAdd)
			names.add(prefix + name);
	}

	private static String getPrefix(ColorMoments moments) {
		return moments.getColorSpace().name().toLowerCase() + "_";
	}

	/**
	 * Compute the feature vector for an RGB image.
	 *
	 * @param rgb 3-channel image with 8-bit red, green and blue values
	 * @return a new feature vector
	 * @throws InvalidImageException if the image contains no pixels
	 * @throws InvalidChannelCountException if the image does not have 3 channels
	 * @throws IllegalStateException if the Tamura supplier returns the wrong number of values
	 * @throws IllegalArgumentException if any feature names are duplicated
	 */
	public FeatureVector extract(ChannelImage rgb) throws InvalidImageException, InvalidChannelCountException {
		return extractWithImages(rgb).getFeatures();
	}

	/**
	 * Compute the feature vector for an RGB image, and keep the intermediate local binary pattern image.
	 *
	 * @param rgb 3-channel image with 8-bit red, green and blue values
	 * @return the feature vector (with constant features removed, if requested) and the LBP image
	 * @throws InvalidImageException if the image contains no pixels
	 * @throws InvalidChannelCountException if the image does not have 3 channels
	 * @see #extract(ChannelImage)
	 */
	public Extraction extractWithImages(ChannelImage rgb) throws InvalidImageException, InvalidChannelCountException {
		var extraction = compute(rgb);
		if (!params.dropConstantFeatures())
			return extraction;
		var features = extraction.getFeatures();
		var filtered = features.filter((name, value) -> value != CONSTANT_FEATURE_VALUE);
		logger.debug("Removed {} constant features, {} remaining", features.size() - filtered.size(), filtered.size());
		return new Extraction(filtered, extraction.getLocalBinaryPatternImage());
	}

	/**
	 * Compute the feature vector for an RGB image, without removing constant features.
	 *
	 * @param rgb 3-channel image with 8-bit red, green and blue values
	 * @return a new feature vector, containing all features named by {@link #getAllFeatureNames()}
	 * @throws InvalidImageException if the image contains no pixels
	 * @throws InvalidChannelCountException if the image does not have 3 channels
	 * @throws IllegalStateException if the Tamura supplier returns the wrong number of values
	 * @throws IllegalArgumentException if any feature names are duplicated
	 */
	public FeatureVector extractAll(ChannelImage rgb) throws InvalidImageException, InvalidChannelCountException {
		return compute(rgb).getFeatures();
	}

	private Extraction compute(ChannelImage rgb) {
		if (rgb.getWidth() * rgb.getHeight() == 0)
			throw new InvalidImageException("Cannot extract features from an empty image (" + rgb.getWidth() + " x " + rgb.getHeight() + ")");
		if (rgb.nChannels() != 3)
			throw new InvalidChannelCountException(3, rgb.nChannels());

		long startTime = System.currentTimeMillis();
		// Run-length and Tamura features use 16-bit luma rounding, LBP and co-occurrence use 14-bit
		SimpleImage gray = ColorSpaceConverter.toGrayscale(rgb, GrayscaleMethod.LUMA_601);
		SimpleImage gray14 = ColorSpaceConverter.toGrayscale(rgb, GrayscaleMethod.LUMA_601_FIXED_14);
		SimpleImage lbp = LocalBinaryPatterns.computeLocalBinaryPatternImage(gray14);

		var builder = FeatureVector.builder();
		builder.addAll(colorMoments.measure(rgb));
		builder.addAll(LocalBinaryPatterns.computeStatistics(lbp));
		builder.addAll(RunLengthFeatureComputer.measure(gray));
		builder.addAll(measureTamura(gray));

		if (params.includeLbpRunLength())
			builder.addAll("lbp_", RunLengthFeatureComputer.measure(lbp));
		if (params.includeCooccurrence())
			builder.addAll("glcm_", CooccurrenceFeatures.measure(gray14, rgb));
		for (var moments : additionalColorMoments)
			builder.addAll(getPrefix(moments), moments.measure(rgb));

		var features = builder.build();
		long endTime = System.currentTimeMillis();
		logger.debug("Extracted {} features from {} in {} ms", features.size(), rgb, endTime - startTime);
		int nonFinite = features.countNonFinite();
		if (nonFinite > 0)
			logger.debug("{} features are not finite", nonFinite);
		return new Extraction(features, lbp);
	}

	private FeatureVector measureTamura(SimpleImage gray) {
		var names = tamura.getFeatureNames();
		var values = tamura.computeFeatures(gray);
		if (names == null || values == null || names.size() != values.length) {
			throw new IllegalStateException(String.format("%s returned %d names but %d values",
					tamura, names == null ? 0 : names.size(), values == null ? 0 : values.length));
		}
		return FeatureVector.of(names, values);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " " + params;
	}


	/**
	 * Features extracted from a single image, together with the local binary pattern image used to compute them.
	 */
	public static class Extraction {

		private final FeatureVector features;
		private final SimpleImage lbp;

		Extraction(FeatureVector features, SimpleImage lbp) {
			this.features = features;
			this.lbp = lbp;
		}

		/**
		 * Get the extracted features.
		 * @return
		 */
		public FeatureVector getFeatures() {
			return features;
		}

		/**
		 * Get the local binary pattern image, with integer codes 0-255.
		 * @return
		 */
		public SimpleImage getLocalBinaryPatternImage() {
			return lbp;
		}

	}

}
