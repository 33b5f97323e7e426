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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import cerviscan.lib.analysis.images.SimpleImages;

@SuppressWarnings("javadoc")
public class TestTamuraFeatures {

	private static final double EPSILON = 1e-10;

	@Test
	public void test_names() {
		var tamura = new TamuraFeatures();
		assertEquals(List.of("coarseness", "contrast", "directionality", "roughness"), tamura.getFeatureNames());
	}

	@Test
	public void test_randomImage() {
		var tamura = new TamuraFeatures();
		var img = TestRunLengthMatrix.createRandomImage(40, 30, 255, 42L);
		double[] values = tamura.computeFeatures(img);
		assertEquals(tamura.getFeatureNames().size(), values.length);
		for (double v : values)
			assertTrue(Double.isFinite(v));
		assertEquals(values[0] + values[1], values[3], EPSILON);
		// Coarseness is a mean of window sizes 1-16
		assertTrue(values[0] >= 1 && values[0] <= 16);
		assertTrue(values[1] > 0);
		assertTrue(values[2] >= 0);
	}

	@Test
	public void test_uniformImage() {
		var img = SimpleImages.createFloatImage(20, 20);
		for (int y = 0; y < 20; y++) {
			for (int x = 0; x < 20; x++)
				img.setValue(x, y, 128);
		}
		double[] values = new TamuraFeatures().computeFeatures(img);
		assertEquals(1.0, values[0], EPSILON);
		assertEquals(0.0, values[1], EPSILON);
		assertEquals(0.0, values[2], EPSILON);
		assertEquals(1.0, values[3], EPSILON);
	}

	@Test
	public void test_contrast() {
		var img = SimpleImages.createFloatImage(new float[] {0, 0, 100, 100}, 4, 1);
		// Two values with equal frequency have a kurtosis of 1
		assertEquals(50.0, TamuraFeatures.computeContrast(img), EPSILON);
	}

	@Test
	public void test_directionalityOfStripes() {
		// Vertical stripes give a single dominant orientation
		var img = SimpleImages.createFloatImage(16, 16);
		for (int y = 0; y < 16; y++) {
			for (int x = 0; x < 16; x++)
				img.setValue(x, y, (x / 2) % 2 == 0 ? 0 : 200);
		}
		assertEquals(0.0, new TamuraFeatures().computeDirectionality(img), EPSILON);
	}

	@Test
	public void test_coarsenessOfLargeBlocks() {
		var small = SimpleImages.createFloatImage(32, 32);
		var large = SimpleImages.createFloatImage(32, 32);
		for (int y = 0; y < 32; y++) {
			for (int x = 0; x < 32; x++) {
				small.setValue(x, y, (x + y) % 2 == 0 ? 0 : 255);
				large.setValue(x, y, ((x / 8) + (y / 8)) % 2 == 0 ? 0 : 255);
			}
		}
		var tamura = new TamuraFeatures();
		assertTrue(tamura.computeCoarseness(large) > tamura.computeCoarseness(small));
	}

	@Test
	public void test_invalidParameters() {
		assertThrows(IllegalArgumentException.class, () -> new TamuraFeatures(0, 16, 12));
		assertThrows(IllegalArgumentException.class, () -> new TamuraFeatures(5, 0, 12));
	}

}
