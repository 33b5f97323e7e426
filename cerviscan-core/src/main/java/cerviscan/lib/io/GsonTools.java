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

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import cerviscan.lib.measurements.FeatureVector;

/**
 * Helper class providing Gson instances with type adapters registered to serialize
 * key CerviScan classes, in particular {@link FeatureVector}.
 * <p>
 * Special floating point values (NaN, infinity) are written as-is, because some features are
 * legitimately undefined for degenerate images.
 *
 * @author CerviScan developers
 *
 */
public class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapter(FeatureVector.class, FeatureVectorTypeAdapter.INSTANCE);

	// Suppressed default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Get default Gson, capable of serializing/deserializing key CerviScan classes.
	 * @return
	 *
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 *
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 *
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

	/**
	 * Read a JSON file into an object of the specified class.
	 *
	 * @param <T>
	 * @param path
	 * @param cls
	 * @return
	 * @throws IOException if the file could not be read, or did not contain valid JSON for the class
	 */
	public static <T> T readJson(Path path, Class<T> cls) throws IOException {
		logger.debug("Reading {} from {}", cls.getSimpleName(), path);
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			T result = getInstance().fromJson(reader, cls);
			if (result == null)
				throw new IOException("No JSON content found in " + path);
			return result;
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse " + path + ": " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Write an object to a JSON file, using pretty-printing.
	 *
	 * @param path
	 * @param object
	 * @throws IOException
	 */
	public static void writeJson(Path path, Object object) throws IOException {
		logger.debug("Writing {} to {}", object.getClass().getSimpleName(), path);
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			getInstance(true).toJson(object, writer);
		}
	}


	/**
	 * TypeAdapter for {@link FeatureVector}, writing an array of name-value objects to preserve order.
	 */
	static class FeatureVectorTypeAdapter extends TypeAdapter<FeatureVector> {

		static FeatureVectorTypeAdapter INSTANCE = new FeatureVectorTypeAdapter();

		@Override
		public void write(JsonWriter out, FeatureVector value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			out.beginArray();
			for (int i = 0; i < value.size(); i++) {
				out.beginObject();
				out.name("name");
				out.value(value.getName(i));

				out.name("value");
				out.value(value.getValue(i));

				out.endObject();
			}
			out.endArray();
		}

		@Override
		public FeatureVector read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			var builder = FeatureVector.builder();
			in.beginArray();
			while (in.hasNext()) {
				String name = null;
				double value = Double.NaN;
				in.beginObject();
				while (in.hasNext()) {
					switch (in.nextName()) {
					case "name":
						name = in.nextString();
						break;
					case "value":
						value = in.nextDouble();
						break;
					default:
						in.skipValue();
					}
				}
				in.endObject();
				if (name == null)
					throw new JsonParseException("Feature without a name at " + in.getPath());
				builder.add(name, value);
			}
			in.endArray();
			try {
				return builder.build();
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(e.getLocalizedMessage(), e);
			}
		}

	}

}
