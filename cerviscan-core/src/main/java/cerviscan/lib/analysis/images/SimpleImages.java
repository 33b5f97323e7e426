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

package cerviscan.lib.analysis.images;

import cerviscan.lib.color.ColorTools;

/**
 * Create {@link SimpleImage} and {@link ChannelImage} instances for basic pixel processing.
 *
 * @author CerviScan developers
 *
 */
public class SimpleImages {

	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof FloatImage)
			return ((FloatImage)image).getArray(direct);
		int n = image.getWidth() * image.getHeight();
		int w = image.getWidth();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}

	/**
	 * Get the pixel values for the image as doubles, in row-major order.
	 * @param image
	 * @return
	 */
	public static double[] getDoublePixels(SimpleImage image) {
		float[] pixels = getPixels(image, true);
		double[] values = new double[pixels.length];
		for (int i = 0; i < pixels.length; i++)
			values[i] = pixels[i];
		return values;
	}

	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 *
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the array length does not match the dimensions
	 */
	public static FloatImage createFloatImage(float[] data, int width, int height) {
		checkDimensions(width, height, data.length, 1);
		return new FloatImage(data, width, height);
	}

	/**
	 * Create a {@link SimpleImage} backed by a float array of pixels.
	 *
	 * @param width
	 * @param height
	 * @return
	 */
	public static FloatImage createFloatImage(int width, int height) {
		checkDimensions(width, height, width * height, 1);
		return new FloatImage(new float[width * height], width, height);
	}

	/**
	 * Create a {@link ChannelImage} from one float array per channel.
	 * <p>
	 * Each array holds the pixels of one channel in row-major order.
	 *
	 * @param channels
	 * @param width
	 * @param height
	 * @return
	 */
	public static ChannelImage createChannelImage(float[][] channels, int width, int height) {
		if (channels.length == 0)
			throw new IllegalArgumentException("At least one channel is required");
		SimpleImage[] images = new SimpleImage[channels.length];
		for (int c = 0; c < channels.length; c++)
			images[c] = createFloatImage(channels[c], width, height);
		return new DefaultChannelImage(images, width, height);
	}

	/**
	 * Create a {@link ChannelImage} from interleaved 8-bit data, e.g. {@code RGBRGBRGB...} for a 3-channel image.
	 * <p>
	 * Bytes are treated as unsigned values in the range 0-255.
	 *
	 * @param data interleaved pixel data, row-major
	 * @param width
	 * @param height
	 * @param nChannels
	 * @return
	 */
	public static ChannelImage createChannelImage(byte[] data, int width, int height, int nChannels) {
		if (nChannels <= 0)
			throw new IllegalArgumentException("Number of channels must be > 0, but was " + nChannels);
		checkDimensions(width, height, data.length, nChannels);
		int n = width * height;
		float[][] channels = new float[nChannels][n];
		for (int i = 0; i < n; i++) {
			for (int c = 0; c < nChannels; c++)
				channels[c][i] = data[i * nChannels + c] & 0xFF;
		}
		return createChannelImage(channels, width, height);
	}

	/**
	 * Create a 3-channel RGB {@link ChannelImage} from packed (A)RGB values.
	 * Any alpha value is ignored.
	 *
	 * @param rgb packed RGB pixels, row-major
	 * @param width
	 * @param height
	 * @return
	 */
	public static ChannelImage createRGBImage(int[] rgb, int width, int height) {
		checkDimensions(width, height, rgb.length, 1);
		float[][] channels = new float[3][rgb.length];
		for (int i = 0; i < rgb.length; i++) {
			int val = rgb[i];
			channels[0][i] = ColorTools.red(val);
			channels[1][i] = ColorTools.green(val);
			channels[2][i] = ColorTools.blue(val);
		}
		return createChannelImage(channels, width, height);
	}

	/**
	 * Wrap one or more {@link SimpleImage}s of identical size as a {@link ChannelImage}.
	 * @param channels
	 * @return
	 */
	public static ChannelImage createChannelImage(SimpleImage... channels) {
		if (channels.length == 0)
			throw new IllegalArgumentException("At least one channel is required");
		int width = channels[0].getWidth();
		int height = channels[0].getHeight();
		for (var channel : channels) {
			if (channel.getWidth() != width || channel.getHeight() != height)
				throw new IllegalArgumentException("All channels must have the same dimensions");
		}
		return new DefaultChannelImage(channels.clone(), width, height);
	}

	private static void checkDimensions(int width, int height, int length, int nChannels) {
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Image dimensions must be >= 0, but were " + width + "x" + height);
		if ((long)width * height * nChannels != length)
			throw new IllegalArgumentException(String.format(
					"Pixel array length %d does not match %d x %d x %d", length, width, height, nChannels));
	}


	/**
	 * Implementation of a ChannelImage backed by one SimpleImage per channel.
	 */
	static class DefaultChannelImage implements ChannelImage {

		private SimpleImage[] channels;
		private int width;
		private int height;

		DefaultChannelImage(SimpleImage[] channels, int width, int height) {
			this.channels = channels;
			this.width = width;
			this.height = height;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		@Override
		public int nChannels() {
			return channels.length;
		}

		@Override
		public float getValue(int x, int y, int channel) {
			return channels[channel].getValue(x, y);
		}

		@Override
		public SimpleImage getChannel(int channel) {
			return channels[channel];
		}

		@Override
		public String toString() {
			return String.format("%s (%d x %d, %d channels)", getClass().getSimpleName(), width, height, channels.length);
		}

	}

}
