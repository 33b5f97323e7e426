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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.images.ChannelImage;
import cerviscan.lib.analysis.images.InvalidChannelCountException;
import cerviscan.lib.analysis.stats.MomentStatistics;
import cerviscan.lib.color.ColorSpace;
import cerviscan.lib.color.ColorSpaceConverter;
import cerviscan.lib.common.LogTools;
import cerviscan.lib.measurements.FeatureVector;

/**
 * Color moments (mean, standard deviation and skewness) for each channel of an image in a specified color space.
 * <p>
 * Features are ordered by moment, and then by channel, e.g. for YUV:
 * {@code mean_y, mean_u, mean_v, std_y, std_u, std_v, skew_y, skew_u, skew_v}.
 * <p>
 * The standard deviation is the population standard deviation, and the skewness is {@code m3 / m2^1.5}.
 * If a channel has zero variance its skewness is NaN. This is reported, but not masked.
 *
 * @author CerviScan developers
 *
 */
public class ColorMoments {

	private static final Logger logger = LoggerFactory.getLogger(ColorMoments.class);

	private final ColorSpace colorSpace;
	private final List<String> featureNames;

	/**
	 * Constructor.
	 * @param colorSpace the color space in which moments should be calculated
	 */
	public ColorMoments(final ColorSpace colorSpace) {
		this.colorSpace = colorSpace;
		var names = new ArrayList<String>();
		for (var prefix : new String[] {"mean", "std", "skew"}) {
			for (var channel : colorSpace.getChannelNames())
				names.add(prefix + "_" + channel);
		}
		this.featureNames = Collections.unmodifiableList(names);
	}

	/**
	 * Color space used for calculations.
	 * @return
	 */
	public ColorSpace getColorSpace() {
		return colorSpace;
	}

	/**
	 * Names of the 9 features, in order.
	 * @return
	 */
	public List<String> getFeatureNames() {
		return featureNames;
	}

	/**
	 * Convert an RGB image to the color space and compute color moments.
	 *
	 * @param rgb 3-channel RGB image, with 8-bit values
	 * @return feature vector with 9 entries
	 * @throws InvalidChannelCountException if the image does not have 3 channels
	 */
	public FeatureVector measure(final ChannelImage rgb) throws InvalidChannelCountException {
		var converted = ColorSpaceConverter.convert(rgb, colorSpace);
		int nChannels = converted.nChannels();
		double[] values = new double[nChannels * 3];
		for (int c = 0; c < nChannels; c++) {
			var stats = MomentStatistics.compute(converted.getChannel(c));
			values[c] = stats.getMean();
			values[nChannels + c] = stats.getStdDev();
			values[nChannels * 2 + c] = stats.getSkewness();
			if (stats.getVariance() == 0)
				LogTools.warnOnce(logger, "Zero variance in " + colorSpace + " channel '" + colorSpace.getChannelName(c) + "' - skewness is undefined");
		}
		return FeatureVector.of(featureNames, values);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " (" + colorSpace + ")";
	}

}
