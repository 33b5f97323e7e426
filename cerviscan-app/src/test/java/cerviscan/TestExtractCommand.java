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

package cerviscan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParser;

import cerviscan.lib.analysis.features.FeatureVectorAssembler;
import cerviscan.lib.analysis.images.SimpleImages;
import cerviscan.lib.color.ColorTools;
import cerviscan.lib.images.ImageIoTools;
import cerviscan.lib.measurements.FeatureVector;
import picocli.CommandLine;

@SuppressWarnings("javadoc")
public class TestExtractCommand {

	private static Path writeRandomImage(Path dir, String name, long seed) throws IOException {
		var random = new Random(seed);
		int width = 24;
		int height = 16;
		int[] rgb = new int[width * height];
		for (int i = 0; i < rgb.length; i++)
			rgb[i] = ColorTools.packRGB(random.nextInt(256), random.nextInt(256), random.nextInt(256));
		var path = dir.resolve(name);
		ImageIoTools.writeImage(ImageIoTools.toBufferedImage(SimpleImages.createRGBImage(rgb, width, height)), path);
		return path;
	}

	private static int execute(String... args) {
		var cmd = new CommandLine(new ExtractCommand());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		return cmd.execute(args);
	}

	@Test
	public void test_json(@TempDir Path dir) throws IOException {
		var image1 = writeRandomImage(dir, "first.png", 1L);
		var image2 = writeRandomImage(dir, "second.png", 2L);
		var output = dir.resolve("features.json");

		int exitCode = execute("-o", output.toString(), "-t", "2", image1.toString(), image2.toString());
		assertEquals(0, exitCode);

		var array = JsonParser.parseString(Files.readString(output, StandardCharsets.UTF_8)).getAsJsonArray();
		assertEquals(2, array.size());
		var first = array.get(0).getAsJsonObject();
		assertEquals(image1.toString(), first.get("image").getAsString());
		var features = first.get("features").getAsJsonArray();
		assertEquals("mean_y", features.get(0).getAsJsonObject().get("name").getAsString());

		var expected = new FeatureVectorAssembler().extract(ImageIoTools.readRGB(image1));
		assertEquals(expected.size(), features.size());
		for (int i = 0; i < features.size(); i++) {
			var entry = features.get(i).getAsJsonObject();
			assertEquals(expected.getName(i), entry.get("name").getAsString());
			assertEquals(expected.getValue(i), entry.get("value").getAsDouble(), 1e-12);
		}
	}

	@Test
	public void test_csv(@TempDir Path dir) throws IOException {
		var image = writeRandomImage(dir, "image.png", 3L);
		var output = dir.resolve("features.csv");

		int exitCode = execute("-f", "csv", "--keep-constant", "--include-glcm", "-o", output.toString(), image.toString());
		assertEquals(0, exitCode);

		var lines = Files.readAllLines(output, StandardCharsets.UTF_8);
		assertEquals(2, lines.size());
		var header = lines.get(0).split(",");
		var row = lines.get(1).split(",", -1);
		assertEquals("image", header[0]);
		assertEquals("mean_y", header[1]);
		assertEquals("glcm_entropy", header[header.length - 1]);
		assertEquals(62 + 5 + 1, header.length);
		assertEquals(header.length, row.length);
		assertEquals(image.toString(), row[0]);
		// Constant features are kept
		int ind = List.of(header).indexOf("LRLGLE_deg0");
		assertEquals(1.0, Double.parseDouble(row[ind]));
	}

	@Test
	public void test_csvBlankForDroppedFeatures() throws IOException {
		var assembler = new FeatureVectorAssembler();
		var names = assembler.getAllFeatureNames();
		var features = FeatureVector.builder().add(names.get(0), 2.5).build();
		var writer = new StringWriter();
		ExtractCommand.writeCSV(writer, names, List.of(new ExtractCommand.ImageFeatures(Path.of("a,b.png"), features)));
		var lines = writer.toString().split(System.lineSeparator());
		assertEquals(2, lines.length);
		assertTrue(lines[1].startsWith("\"a,b.png\",2.5,"));
		assertTrue(lines[1].endsWith(","));
	}

	@Test
	public void test_failedImage(@TempDir Path dir) throws IOException {
		var image = writeRandomImage(dir, "image.png", 4L);
		var missing = dir.resolve("missing.png");
		var output = dir.resolve("features.json");

		int exitCode = execute("-o", output.toString(), missing.toString(), image.toString());
		assertEquals(1, exitCode);

		// Remaining images are still written
		var array = JsonParser.parseString(Files.readString(output, StandardCharsets.UTF_8)).getAsJsonArray();
		assertEquals(1, array.size());
		assertEquals(image.toString(), array.get(0).getAsJsonObject().get("image").getAsString());
	}

	@Test
	public void test_lbpOutput(@TempDir Path dir) throws IOException {
		var image = writeRandomImage(dir, "sample.png", 5L);
		var lbpDir = dir.resolve("lbp");
		var output = dir.resolve("features.json");

		int exitCode = execute("--lbp-output", lbpDir.toString(), "-o", output.toString(), image.toString());
		assertEquals(0, exitCode);

		var lbpPath = lbpDir.resolve("sample-lbp.png");
		assertTrue(Files.exists(lbpPath));
		var lbp = ImageIoTools.readBufferedImage(lbpPath);
		assertEquals(24, lbp.getWidth());
		assertEquals(16, lbp.getHeight());

		// Written codes match the image used for the LBP features
		var expected = new FeatureVectorAssembler().extractWithImages(ImageIoTools.readRGB(image)).getLocalBinaryPatternImage();
		var written = ImageIoTools.readRGB(lbpPath);
		for (int y = 0; y < 16; y++) {
			for (int x = 0; x < 24; x++)
				assertEquals(expected.getValue(x, y), written.getValue(x, y, 0));
		}
	}

	@Test
	public void test_parameters(@TempDir Path dir) throws IOException {
		var params = dir.resolve("params.json");
		Files.writeString(params, "{\"colorSpace\": \"LAB\", \"includeLbpRunLength\": true}", StandardCharsets.UTF_8);
		var cmd = new ExtractCommand();
		new CommandLine(cmd).parseArgs("-p", params.toString(), "--include-glcm", "image.png");
		var result = cmd.buildParameters();
		assertEquals("LAB", result.getColorSpace().name());
		assertTrue(result.includeLbpRunLength());
		assertTrue(result.includeCooccurrence());
		assertTrue(result.dropConstantFeatures());
	}

	@Test
	public void test_launcher() {
		assertEquals(0, CerviScan.run("--help"));
		assertEquals(0, CerviScan.run());
		assertEquals(2, CerviScan.run("--not-an-option"));
		// Missing image paths
		assertEquals(2, CerviScan.run("extract"));
	}

}
