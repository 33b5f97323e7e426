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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import cerviscan.lib.analysis.images.ChannelImage;
import cerviscan.lib.analysis.images.InvalidChannelCountException;
import cerviscan.lib.analysis.images.SimpleImages;

@SuppressWarnings("javadoc")
public class TestColorSpaceConverter {

	private static final double EPSILON = 1e-6;

	private static ChannelImage createRGB(int... packed) {
		return SimpleImages.createRGBImage(packed, packed.length, 1);
	}

	@Test
	public void test_yuv() {
		double[] yuv = ColorSpaceConverter.rgbToYuv(255, 255, 255, new double[3]);
		assertEquals(255.0, yuv[0], EPSILON);
		assertEquals(0.0, yuv[1], EPSILON);
		// The V row sums to 0.2, so white is not neutral
		assertEquals(51.0, yuv[2], EPSILON);

		yuv = ColorSpaceConverter.rgbToYuv(10, 20, 30, yuv);
		assertEquals(0.299*10 + 0.587*20 + 0.114*30, yuv[0], EPSILON);
		assertEquals(-0.147*10 - 0.289*20 + 0.436*30, yuv[1], EPSILON);
		assertEquals(0.615*10 - 0.515*20 + 0.100*30, yuv[2], EPSILON);
	}

	@Test
	public void test_lab() {
		double[] lab = ColorSpaceConverter.rgbToLab(255, 255, 255, new double[3]);
		assertEquals(100.0, lab[0], 0.01);
		assertEquals(0.0, lab[1], 0.01);
		assertEquals(0.0, lab[2], 0.01);

		lab = ColorSpaceConverter.rgbToLab(0, 0, 0, lab);
		assertEquals(0.0, lab[0], EPSILON);
		assertEquals(0.0, lab[1], EPSILON);
		assertEquals(0.0, lab[2], EPSILON);

		lab = ColorSpaceConverter.rgbToLab(255, 0, 0, lab);
		assertEquals(53.24, lab[0], 0.02);
		assertEquals(80.09, lab[1], 0.02);
		assertEquals(67.20, lab[2], 0.02);
	}

	@Test
	public void test_srgbToLinear() {
		assertEquals(0.0, ColorSpaceConverter.srgbToLinear(0), EPSILON);
		assertEquals(1.0, ColorSpaceConverter.srgbToLinear(255), EPSILON);
		// Linear segment below the threshold
		assertEquals(5.0 / 255.0 / 12.92, ColorSpaceConverter.srgbToLinear(5), EPSILON);
		// Non-integer values are computed directly
		assertEquals(Math.pow((127.5 / 255.0 + 0.055) / 1.055, 2.4), ColorSpaceConverter.srgbToLinear(127.5), EPSILON);
	}

	@Test
	public void test_convertImage() {
		var rgb = createRGB(ColorTools.packRGB(255, 255, 255), ColorTools.packRGB(255, 0, 0));
		var yuv = ColorSpaceConverter.convert(rgb, ColorSpace.YUV);
		assertEquals(3, yuv.nChannels());
		assertEquals(2, yuv.getWidth());
		assertEquals(255.0, yuv.getValue(0, 0, 0), 1e-3);
		assertEquals(0.299 * 255, yuv.getValue(1, 0, 0), 1e-3);

		var lab = ColorSpaceConverter.convert(rgb, ColorSpace.LAB);
		assertEquals(100.0, lab.getValue(0, 0, 0), 0.01);
		assertEquals(53.24, lab.getValue(1, 0, 0), 0.02);

		var same = ColorSpaceConverter.convert(rgb, ColorSpace.RGB);
		assertEquals(255, same.getValue(1, 0, 0));
		assertEquals(0, same.getValue(1, 0, 2));

		// Input unchanged
		assertEquals(255, rgb.getValue(1, 0, 0));
	}

	@Test
	public void test_grayscale() {
		var rgb = createRGB(ColorTools.packRGB(255, 0, 0), ColorTools.packRGB(0, 255, 0), ColorTools.packRGB(0, 0, 255), ColorTools.packRGB(255, 255, 255));
		var gray = ColorSpaceConverter.toGrayscale(rgb);
		assertEquals(4, gray.getWidth());
		assertEquals(1, gray.getHeight());
		assertEquals(76, gray.getValue(0, 0));
		assertEquals(150, gray.getValue(1, 0));
		assertEquals(29, gray.getValue(2, 0));
		assertEquals(255, gray.getValue(3, 0));

		// Single channel images are copied
		var single = SimpleImages.createChannelImage(SimpleImages.createFloatImage(new float[] {1, 2}, 2, 1));
		var gray2 = ColorSpaceConverter.toGrayscale(single);
		assertEquals(2, gray2.getValue(1, 0));
	}

	@Test
	public void test_grayscaleMethods() {
		var rgb = createRGB(ColorTools.packRGB(0, 0, 250), ColorTools.packRGB(10, 20, 30));
		var gray16 = ColorSpaceConverter.toGrayscale(rgb, ColorSpaceConverter.GrayscaleMethod.LUMA_601);
		var gray14 = ColorSpaceConverter.toGrayscale(rgb, ColorSpaceConverter.GrayscaleMethod.LUMA_601_FIXED_14);
		assertEquals(28, gray16.getValue(0, 0));
		assertEquals(29, gray14.getValue(0, 0));
		assertEquals(gray16.getValue(1, 0), gray14.getValue(1, 0));
		// Default is 16-bit rounding
		assertEquals(28, ColorSpaceConverter.toGrayscale(rgb).getValue(0, 0));
	}

	@Test
	public void test_invalidChannels() {
		var twoChannels = SimpleImages.createChannelImage(new byte[8], 2, 2, 2);
		var e = assertThrows(InvalidChannelCountException.class, () -> ColorSpaceConverter.convert(twoChannels, ColorSpace.YUV));
		assertEquals(3, e.getExpectedChannels());
		assertEquals(2, e.getActualChannels());
		assertThrows(InvalidChannelCountException.class, () -> ColorSpaceConverter.toGrayscale(twoChannels));
	}

}
