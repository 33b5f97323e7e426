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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import cerviscan.lib.analysis.images.SimpleImage;
import cerviscan.lib.analysis.images.SimpleImages;

@SuppressWarnings("javadoc")
public class TestRunLengthFeatures {

	private static final double EPSILON = 1e-10;

	@Test
	public void test_featureNames() {
		var names = RunLengthFeatureComputer.getFeatureNames();
		assertEquals(44, names.size());
		assertEquals("SRE_deg0", names.get(0));
		assertEquals("LRHGLE_deg0", names.get(10));
		assertEquals("SRE_deg45", names.get(11));
		assertEquals("RP_deg90", names.get(26));
		assertEquals("LRHGLE_deg135", names.get(43));
		assertEquals(List.of("SRE", "LRE", "GLN", "RLN", "RP", "LGLRE", "HGL", "SRLGLE", "SRHGLE", "LRLGLE", "LRHGLE"),
				RunLengthFeatures.getAbbreviations());
	}

	@Test
	public void test_twoLevelImage() {
		var features = RunLengthFeatureComputer.measure(TestRunLengthMatrix.createTwoLevelImage());
		assertEquals(44, features.size());
		assertEquals(RunLengthFeatureComputer.getFeatureNames(), features.getNames());

		assertEquals(0.25, features.get("SRE_deg0"), EPSILON);
		assertEquals(4.0, features.get("LRE_deg0"), EPSILON);
		assertEquals(4.0, features.get("GLN_deg0"), EPSILON);
		assertEquals(8.0, features.get("RLN_deg0"), EPSILON);
		assertEquals(1.0, features.get("RP_deg0"), EPSILON);
		// Level index 0 gives infinite terms, which are replaced by 0
		assertEquals(0.5, features.get("LGLRE_deg0"), EPSILON);
		assertEquals(0.5, features.get("HGL_deg0"), EPSILON);
		assertEquals(0.125, features.get("SRLGLE_deg0"), EPSILON);
		assertEquals(0.125, features.get("SRHGLE_deg0"), EPSILON);
		assertEquals(1.0, features.get("LRLGLE_deg0"));
		assertEquals(2.0, features.get("LRHGLE_deg0"), EPSILON);

		// Columns are single runs of length 4
		assertEquals(1.0 / 16.0, features.get("SRE_deg90"), EPSILON);
		assertEquals(16.0, features.get("LRE_deg90"), EPSILON);
		assertEquals(4.0 / 8.0, features.get("RP_deg90"), EPSILON);
	}

	@Test
	public void test_uniformImage() {
		var img = SimpleImages.createFloatImage(new float[] {7, 7, 7, 7, 7, 7, 7, 7, 7}, 3, 3);
		var features = RunLengthFeatureComputer.measure(img);
		assertEquals(0, features.countNonFinite());
		assertEquals(1.0 / 9.0, features.get("SRE_deg0"), EPSILON);
		assertEquals(9.0, features.get("LRE_deg0"), EPSILON);
		assertEquals(1.0, features.get("RP_deg0"), EPSILON);
		// Only level index 0 is present
		assertEquals(0.0, features.get("LGLRE_deg0"));
		assertEquals(0.0, features.get("HGL_deg0"));
		assertEquals(0.0, features.get("SRLGLE_deg0"));
		assertEquals(1.0, features.get("LRLGLE_deg0"));
	}

	@Test
	public void test_singlePixel() {
		var features = RunLengthFeatureComputer.measure(SimpleImages.createFloatImage(new float[] {42}, 1, 1));
		assertEquals(0, features.countNonFinite());
		for (var direction : RunLengthDirection.values()) {
			assertEquals(1.0, features.get("SRE_" + direction.getLabel()), EPSILON);
			assertEquals(1.0, features.get("RP_" + direction.getLabel()), EPSILON);
		}
	}

	@Test
	public void test_properties() {
		var img = TestRunLengthMatrix.createRandomImage(32, 24, 255, 42L);
		var features = RunLengthFeatureComputer.measure(img);
		assertEquals(0, features.countNonFinite());
		for (var direction : RunLengthDirection.values()) {
			String suffix = "_" + direction.getLabel();
			for (var abbr : List.of("SRE", "LRE", "GLN", "RLN", "HGL", "LRHGLE"))
				assertTrue(features.get(abbr + suffix) >= 0, abbr + suffix + " should not be negative");
			double rp = features.get("RP" + suffix);
			assertTrue(rp > 0 && rp <= 1, "Run percentage out of range: " + rp);
			assertEquals(1.0, features.get("LRLGLE" + suffix));
		}
	}

	@Test
	public void test_diagonalSymmetry() {
		// Flipping horizontally swaps the two diagonal directions
		int width = 13;
		int height = 9;
		var img = TestRunLengthMatrix.createRandomImage(width, height, 2, 7L);
		var flipped = SimpleImages.createFloatImage(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				flipped.setValue(width - 1 - x, y, img.getValue(x, y));
		}
		var features = RunLengthFeatureComputer.measure(img);
		var featuresFlipped = RunLengthFeatureComputer.measure(flipped);
		for (var abbr : RunLengthFeatures.getAbbreviations()) {
			assertEquals(features.get(abbr + "_deg45"), featuresFlipped.get(abbr + "_deg135"), EPSILON);
			assertEquals(features.get(abbr + "_deg0"), featuresFlipped.get(abbr + "_deg0"), EPSILON);
		}
	}

	@Test
	public void test_singleDirection() {
		SimpleImage img = TestRunLengthMatrix.createTwoLevelImage();
		var features = RunLengthFeatureComputer.measure(img, List.of(RunLengthDirection.DEG_90));
		assertEquals(11, features.size());
		assertEquals("SRE_deg90", features.getName(0));

		var matrix = RunLengthMatrix.compute(img);
		var deg0 = RunLengthFeatures.compute(matrix, RunLengthDirection.DEG_0);
		assertEquals(11, deg0.nFeatures());
		assertEquals("Short run emphasis", deg0.getFeatureName(0));
		assertEquals("SRE_deg0", deg0.getFeatureKey(0));
		assertEquals(0.25, deg0.getFeature(0), EPSILON);
	}

}
