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

package cerviscan.lib.images;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.images.ChannelImage;
import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.analysis.images.SimpleImages;
import cerviscan.lib.color.ColorTools;

/**
 * Static methods for reading images with {@link ImageIO}, and for converting {@link BufferedImage}s 
 * into the in-memory rasters used for feature extraction.
 * 
 * @author CerviScan developers
 *
 */
public class ImageIoTools {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageIoTools.class);
	
	// Suppressed default constructor for non-instantiability
	private ImageIoTools() {
		throw new AssertionError();
	}
	
	/**
	 * Read an image file as an RGB {@link ChannelImage}.
	 * <p>
	 * Any alpha channel is discarded, and grayscale or indexed images are expanded to RGB.
	 * 
	 * @param path path to the image file
	 * @return
	 * @throws ImageLoadException if the file does not exist, cannot be read, or is not in a format supported by ImageIO
	 */
	public static ChannelImage readRGB(Path path) throws ImageLoadException {
		return toRGB(readBufferedImage(path));
	}
	
	/**
	 * Read an image file with {@link ImageIO}.
	 * 
	 * @param path path to the image file
	 * @return
	 * @throws ImageLoadException if the file does not exist, cannot be read, or is not in a format supported by ImageIO
	 */
	public static BufferedImage readBufferedImage(Path path) throws ImageLoadException {
		if (path == null)
			throw new ImageLoadException("No image path specified");
		if (!Files.isRegularFile(path))
			throw new ImageLoadException("Image file not found: " + path);
		BufferedImage img;
		try {
			img = ImageIO.read(path.toFile());
		} catch (IOException e) {
			throw new ImageLoadException("Unable to read image " + path + ": " + e.getLocalizedMessage(), e);
		}
		if (img == null)
			throw new ImageLoadException("No ImageIO reader could decode " + path);
		logger.debug("Read {} ({} x {})", path, img.getWidth(), img.getHeight());
		return img;
	}
	
	/**
	 * Convert a {@link BufferedImage} to a 3-channel RGB {@link ChannelImage}.
	 * <p>
	 * For 8-bit grayscale images (with or without alpha) the raw sample values are copied to all three channels,
	 * without any color space conversion. Other images are converted using their color model.
	 * 
	 * @param img
	 * @return
	 */
	public static ChannelImage toRGB(BufferedImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		if (isGray8Bit(img)) {
			float[] pixels = new float[width * height];
			img.getRaster().getSamples(0, 0, width, height, 0, pixels);
			var gray = SimpleImages.createFloatImage(pixels, width, height);
			logger.trace("Expanding 8-bit grayscale image to RGB");
			return SimpleImages.createChannelImage(gray, gray, gray);
		}
		int[] rgb = img.getRGB(0, 0, width, height, null, 0, width);
		return SimpleImages.createRGBImage(rgb, width, height);
	}
	
	/**
	 * Check for a single color component stored as 8-bit samples, excluding indexed images.
	 */
	private static boolean isGray8Bit(BufferedImage img) {
		var colorModel = img.getColorModel();
		if (colorModel instanceof IndexColorModel)
			return false;
		if (colorModel.getNumColorComponents() != 1)
			return false;
		var sampleModel = img.getRaster().getSampleModel();
		return sampleModel.getSampleSize(0) == 8;
	}
	
	/**
	 * Create a packed RGB {@link BufferedImage} from a 3-channel image, clipping values to 0-255.
	 * This is useful for writing derived images or test fixtures.
	 * 
	 * @param image
	 * @return
	 */
	public static BufferedImage toBufferedImage(ChannelImage image) {
		int width = image.getWidth();
		int height = image.getHeight();
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int r = ColorTools.do8BitRangeCheck(image.getValue(x, y, 0));
				int g = ColorTools.do8BitRangeCheck(image.getValue(x, y, 1 % image.nChannels()));
				int b = ColorTools.do8BitRangeCheck(image.getValue(x, y, 2 % image.nChannels()));
				img.setRGB(x, y, ColorTools.packRGB(r, g, b));
			}
		}
		return img;
	}
	
	/**
	 * Create an 8-bit grayscale {@link BufferedImage} from a single-channel image, clipping values to 0-255.
	 * 
	 * @param image
	 * @return
	 */
	public static BufferedImage toBufferedImage(SimpleImage image) {
		return toBufferedImage(SimpleImages.createChannelImage(image));
	}

	/**
	 * Write an image with {@link ImageIO}, using the format given by the file extension (e.g. png, tif).
	 * 
	 * @param img
	 * @param path
	 * @throws IOException if the image could not be written, or no writer is available for the format
	 */
	public static void writeImage(BufferedImage img, Path path) throws IOException {
		String name = path.getFileName().toString();
		int ind = name.lastIndexOf('.');
		String format = ind < 0 ? "png" : name.substring(ind + 1).toLowerCase();
		if (!ImageIO.write(img, format, path.toFile()))
			throw new IOException("No ImageIO writer found for format '" + format + "'");
		logger.debug("Wrote {} ({} x {})", path, img.getWidth(), img.getHeight());
	}

}
