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

package cerviscan.lib.color;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.images.ChannelImage;
import cerviscan.lib.analysis.images.InvalidChannelCountException;
import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.analysis.images.SimpleImages;

/**
 * Static methods for converting RGB images into other color spaces, and into grayscale.
 * <p>
 * All conversions are pure per-pixel transforms: the input image is never modified, and a new image is returned.
 * Input RGB values are expected to be 8-bit, i.e. in the range 0-255.
 *
 * @author CerviScan developers
 */
public class ColorSpaceConverter {

	private static final Logger logger = LoggerFactory.getLogger(ColorSpaceConverter.class);

	/**
	 * Matrix converting 8-bit RGB values into YUV.
	 * <p>
	 * Note that the final coefficient of the V row is positive; this is required for compatibility with
	 * previously-computed features and trained classifiers, and means V is not zero for neutral gray.
	 */
	private static final double[][] RGB_TO_YUV = {
			{0.299, 0.587, 0.114},
			{-0.147, -0.289, 0.436},
			{0.615, -0.515, 0.100}
	};

	/**
	 * Linear sRGB to CIE XYZ (D65).
	 */
	private static final double[][] RGB_TO_XYZ = {
			{0.412453, 0.357580, 0.180423},
			{0.212671, 0.715160, 0.072169},
			{0.019334, 0.119193, 0.950227}
	};

	/**
	 * D65 reference white for the CIE 1931 2 degree observer.
	 */
	private static final double[] WHITE_D65 = {0.95047, 1.0, 1.08883};

	private static final double LAB_EPSILON = 0.008856;
	private static final double LAB_KAPPA = 7.787;

	// Lookup table from 8-bit values to linear sRGB
	private static final double[] srgbLinearLUT = new double[256];

	static {
		for (int i = 0; i < 256; i++) {
			double c = i / 255.0;
			srgbLinearLUT[i] = c > 0.04045 ? Math.pow((c + 0.055) / 1.055, 2.4) : c / 12.92;
		}
	}

	// Suppressed default constructor for non-instantiability
	private ColorSpaceConverter() {
		throw new AssertionError();
	}

	/**
	 * Convert an RGB image into the specified color space.
	 *
	 * @param rgb 3-channel image with 8-bit red, green and blue values
	 * @param colorSpace the target color space
	 * @return a new 3-channel image, with channels ordered as in {@link ColorSpace#getChannelNames()}
	 * @throws InvalidChannelCountException if the input image does not have exactly 3 channels
	 */
	public static ChannelImage convert(final ChannelImage rgb, final ColorSpace colorSpace) throws InvalidChannelCountException {
		checkRGB(rgb);
		int width = rgb.getWidth();
		int height = rgb.getHeight();
		int n = width * height;
		float[][] output = new float[3][n];
		double[] temp = new double[3];
		logger.trace("Converting {} to {}", rgb, colorSpace);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double r = rgb.getValue(x, y, 0);
				double g = rgb.getValue(x, y, 1);
				double b = rgb.getValue(x, y, 2);
				switch (colorSpace) {
				case YUV:
					rgbToYuv(r, g, b, temp);
					break;
				case LAB:
					rgbToLab(r, g, b, temp);
					break;
				case RGB:
				default:
					temp[0] = r;
					temp[1] = g;
					temp[2] = b;
					break;
				}
				int ind = y * width + x;
				output[0][ind] = (float)temp[0];
				output[1][ind] = (float)temp[1];
				output[2][ind] = (float)temp[2];
			}
		}
		return SimpleImages.createChannelImage(output, width, height);
	}

	/**
	 * Rounding used when converting RGB values to 8-bit grayscale.
	 */
	public enum GrayscaleMethod {

		/**
		 * ITU-R 601-2 luma with 16-bit fixed-point coefficients.
		 * @see ColorTools#luma601(int, int, int)
		 */
		LUMA_601,

		/**
		 * ITU-R 601-2 luma with 14-bit fixed-point coefficients.
		 * @see ColorTools#luma601Fixed14(int, int, int)
		 */
		LUMA_601_FIXED_14;

		int apply(int r, int g, int b) {
			switch (this) {
			case LUMA_601_FIXED_14:
				return ColorTools.luma601Fixed14(r, g, b);
			case LUMA_601:
			default:
				return ColorTools.luma601(r, g, b);
			}
		}

	}

	/**
	 * Convert an RGB image into an 8-bit grayscale image, using ITU-R 601-2 luma.
	 * <p>
	 * Input values are rounded and clipped to 0-255 before conversion, so the output always contains
	 * integer values 0-255. A single-channel image is returned as a copy of its only channel.
	 *
	 * @param image RGB or single-channel image
	 * @return
	 * @throws InvalidChannelCountException if the input image has neither 1 nor 3 channels
	 * @see #toGrayscale(ChannelImage, GrayscaleMethod)
	 */
	public static SimpleImage toGrayscale(final ChannelImage image) throws InvalidChannelCountException {
		return toGrayscale(image, GrayscaleMethod.LUMA_601);
	}

	/**
	 * Convert an RGB image into an 8-bit grayscale image, using the specified rounding.
	 * <p>
	 * Local binary patterns and co-occurrence features expect {@link GrayscaleMethod#LUMA_601_FIXED_14};
	 * run-length features expect {@link GrayscaleMethod#LUMA_601}.
	 *
	 * @param image RGB or single-channel image
	 * @param method
	 * @return
	 * @throws InvalidChannelCountException if the input image has neither 1 nor 3 channels
	 */
	public static SimpleImage toGrayscale(final ChannelImage image, final GrayscaleMethod method) throws InvalidChannelCountException {
		if (image.nChannels() == 1)
			return SimpleImages.createFloatImage(SimpleImages.getPixels(image.getChannel(0), false), image.getWidth(), image.getHeight());
		checkRGB(image);
		int width = image.getWidth();
		int height = image.getHeight();
		var gray = SimpleImages.createFloatImage(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int r = ColorTools.do8BitRangeCheck(Math.round(image.getValue(x, y, 0)));
				int g = ColorTools.do8BitRangeCheck(Math.round(image.getValue(x, y, 1)));
				int b = ColorTools.do8BitRangeCheck(Math.round(image.getValue(x, y, 2)));
				gray.setValue(x, y, method.apply(r, g, b));
			}
		}
		return gray;
	}

	/**
	 * Convert a single RGB triple into YUV.
	 *
	 * @param r red value, 0-255
	 * @param g green value, 0-255
	 * @param b blue value, 0-255
	 * @param yuv output array, length at least 3
	 * @return the output array
	 */
	public static double[] rgbToYuv(double r, double g, double b, double[] yuv) {
		return multiply(RGB_TO_YUV, r, g, b, yuv);
	}

	/**
	 * Convert a single sRGB triple into CIE XYZ (D65), after linearizing the 8-bit values.
	 *
	 * @param r red value, 0-255
	 * @param g green value, 0-255
	 * @param b blue value, 0-255
	 * @param xyz output array, length at least 3
	 * @return the output array
	 */
	public static double[] rgbToXyz(double r, double g, double b, double[] xyz) {
		return multiply(RGB_TO_XYZ, srgbToLinear(r), srgbToLinear(g), srgbToLinear(b), xyz);
	}

	/**
	 * Convert a single sRGB triple into CIE L*a*b*, using a D65 white point.
	 *
	 * @param r red value, 0-255
	 * @param g green value, 0-255
	 * @param b blue value, 0-255
	 * @param lab output array, length at least 3
	 * @return the output array
	 */
	public static double[] rgbToLab(double r, double g, double b, double[] lab) {
		rgbToXyz(r, g, b, lab);
		double fx = labF(lab[0] / WHITE_D65[0]);
		double fy = labF(lab[1] / WHITE_D65[1]);
		double fz = labF(lab[2] / WHITE_D65[2]);
		lab[0] = 116.0 * fy - 16.0;
		lab[1] = 500.0 * (fx - fy);
		lab[2] = 200.0 * (fy - fz);
		return lab;
	}

	/**
	 * Convert an 8-bit sRGB value to linear intensity in the range 0-1.
	 * @param v
	 * @return
	 */
	static double srgbToLinear(double v) {
		int ind = (int)v;
		if (ind == v && ind >= 0 && ind < srgbLinearLUT.length)
			return srgbLinearLUT[ind];
		double c = v / 255.0;
		return c > 0.04045 ? Math.pow((c + 0.055) / 1.055, 2.4) : c / 12.92;
	}

	private static double labF(double t) {
		if (t > LAB_EPSILON)
			return Math.cbrt(t);
		return LAB_KAPPA * t + 16.0 / 116.0;
	}

	private static double[] multiply(double[][] matrix, double c0, double c1, double c2, double[] output) {
		double v0 = matrix[0][0] * c0 + matrix[0][1] * c1 + matrix[0][2] * c2;
		double v1 = matrix[1][0] * c0 + matrix[1][1] * c1 + matrix[1][2] * c2;
		double v2 = matrix[2][0] * c0 + matrix[2][1] * c1 + matrix[2][2] * c2;
		output[0] = v0;
		output[1] = v1;
		output[2] = v2;
		return output;
	}

	private static void checkRGB(ChannelImage image) throws InvalidChannelCountException {
		if (image.nChannels() != 3)
			throw new InvalidChannelCountException(3, image.nChannels());
	}

}
