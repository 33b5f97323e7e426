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

package cerviscan.lib.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;

import cerviscan.lib.measurements.FeatureVector;

@SuppressWarnings("javadoc")
public class TestGsonTools {

	@Test
	public void test_featureVectorJson() {
		var features = FeatureVector.of(List.of("mean_y", "std_y", "skew_y"), new double[] {1.5, 0, Double.NaN});
		var gson = GsonTools.getInstance();
		String json = gson.toJson(features);

		JsonArray array = JsonParser.parseString(json).getAsJsonArray();
		assertEquals(3, array.size());
		assertEquals("mean_y", array.get(0).getAsJsonObject().get("name").getAsString());
		assertEquals(1.5, array.get(0).getAsJsonObject().get("value").getAsDouble());
		assertTrue(json.contains("NaN"));

		var features2 = gson.fromJson(json, FeatureVector.class);
		assertEquals(features, features2);

		var pretty = GsonTools.getInstance(true).toJson(features);
		assertEquals(features, gson.fromJson(pretty, FeatureVector.class));
	}

	@Test
	public void test_duplicateNames() {
		String json = "[{\"name\": \"a\", \"value\": 1}, {\"name\": \"a\", \"value\": 2}]";
		assertThrows(RuntimeException.class, () -> GsonTools.getInstance().fromJson(json, FeatureVector.class));
	}

	@Test
	public void test_readWriteFile(@TempDir Path dir) throws IOException {
		var features = FeatureVector.of(List.of("a", "b"), new double[] {Double.POSITIVE_INFINITY, -2});
		var path = dir.resolve("features.json");
		GsonTools.writeJson(path, features);
		assertEquals(features, GsonTools.readJson(path, FeatureVector.class));
	}

	@Test
	public void test_readInvalidFile(@TempDir Path dir) throws IOException {
		var path = dir.resolve("invalid.json");
		Files.writeString(path, "{not valid", StandardCharsets.UTF_8);
		assertThrows(IOException.class, () -> GsonTools.readJson(path, FeatureVector.class));
		var empty = dir.resolve("empty.json");
		Files.writeString(empty, "", StandardCharsets.UTF_8);
		assertThrows(IOException.class, () -> GsonTools.readJson(empty, FeatureVector.class));
		assertThrows(IOException.class, () -> GsonTools.readJson(dir.resolve("missing.json"), FeatureVector.class));
	}

}
