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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import cerviscan.lib.color.ColorSpace;

@SuppressWarnings("javadoc")
public class TestFeatureExtractionParameters {

	@Test
	public void test_defaults() {
		var params = FeatureExtractionParameters.getDefaultInstance();
		assertEquals(ColorSpace.YUV, params.getColorSpace());
		assertTrue(params.getAdditionalColorSpaces().isEmpty());
		assertFalse(params.includeLbpRunLength());
		assertFalse(params.includeCooccurrence());
		assertTrue(params.dropConstantFeatures());
	}

	@Test
	public void test_builder() {
		var defaults = FeatureExtractionParameters.getDefaultInstance();
		var params = FeatureExtractionParameters.builder(defaults)
				.colorSpace(ColorSpace.LAB)
				.additionalColorSpaces(ColorSpace.RGB, ColorSpace.YUV)
				.includeCooccurrence(true)
				.build();
		assertEquals(ColorSpace.LAB, params.getColorSpace());
		assertEquals(List.of(ColorSpace.RGB, ColorSpace.YUV), params.getAdditionalColorSpaces());
		assertTrue(params.includeCooccurrence());
		// Original is unchanged
		assertEquals(ColorSpace.YUV, defaults.getColorSpace());
		assertThrows(UnsupportedOperationException.class, () -> params.getAdditionalColorSpaces().add(ColorSpace.LAB));
	}

	@Test
	public void test_invalid() {
		assertThrows(IllegalArgumentException.class, () -> FeatureExtractionParameters.builder()
				.additionalColorSpaces(ColorSpace.YUV)
				.build());
		assertThrows(IllegalArgumentException.class, () -> FeatureExtractionParameters.builder()
				.additionalColorSpaces(ColorSpace.LAB, ColorSpace.LAB)
				.build());
		assertThrows(IllegalArgumentException.class, () -> FeatureExtractionParameters.builder()
				.colorSpace(null)
				.build());
	}

	@Test
	public void test_json(@TempDir Path dir) throws IOException {
		var params = FeatureExtractionParameters.builder()
				.colorSpace(ColorSpace.RGB)
				.additionalColorSpaces(ColorSpace.LAB)
				.includeLbpRunLength(true)
				.dropConstantFeatures(false)
				.build();
		var path = dir.resolve("params.json");
		params.writeJson(path);
		var read = FeatureExtractionParameters.readJson(path);
		assertEquals(ColorSpace.RGB, read.getColorSpace());
		assertEquals(List.of(ColorSpace.LAB), read.getAdditionalColorSpaces());
		assertTrue(read.includeLbpRunLength());
		assertFalse(read.includeCooccurrence());
		assertFalse(read.dropConstantFeatures());
		assertEquals(params.toString(), read.toString());
	}

	@Test
	public void test_partialJson(@TempDir Path dir) throws IOException {
		var path = dir.resolve("params.json");
		Files.writeString(path, "{\"includeCooccurrence\": true}");
		var params = FeatureExtractionParameters.readJson(path);
		assertTrue(params.includeCooccurrence());
		assertEquals(ColorSpace.YUV, params.getColorSpace());
		assertTrue(params.dropConstantFeatures());
	}

	@Test
	public void test_invalidJson(@TempDir Path dir) throws IOException {
		var path = dir.resolve("params.json");
		Files.writeString(path, "{\"additionalColorSpaces\": [\"YUV\"]}");
		assertThrows(IllegalArgumentException.class, () -> FeatureExtractionParameters.readJson(path));
		Files.writeString(path, "{\"colorSpace\": ");
		assertThrows(IOException.class, () -> FeatureExtractionParameters.readJson(path));
	}

}
