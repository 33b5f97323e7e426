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

package cerviscan.lib.measurements;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * An ordered, immutable list of named numeric features describing a single image.
 * <p>
 * Names are unique, and the order of features is fixed at construction.
 * Values may be non-finite (NaN or infinite) where a feature is undefined for a degenerate image.
 * <p>
 * Instances are created either with a {@link Builder}, or with {@link #of(List, double[])}.
 *
 * @author CerviScan developers
 *
 */
public final class FeatureVector implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final FeatureVector EMPTY = new FeatureVector(Collections.emptyList(), new double[0]);

	private final List<String> names;
	private final double[] values;
	private final Map<String, Integer> indices;

	private FeatureVector(List<String> names, double[] values) {
		this.names = Collections.unmodifiableList(new ArrayList<>(names));
		this.values = values.clone();
		this.indices = new HashMap<>();
		for (int i = 0; i < names.size(); i++) {
			var name = names.get(i);
			if (name == null)
				throw new IllegalArgumentException("Feature names must not be null");
			if (indices.put(name, i) != null)
				throw new IllegalArgumentException("Duplicate feature name: " + name);
		}
	}

	/**
	 * Create a feature vector from parallel lists of names and values.
	 * @param names feature names, which must be unique
	 * @param values feature values, with the same length as names
	 * @return
	 * @throws IllegalArgumentException if the lengths differ, or names are not unique
	 */
	public static FeatureVector of(List<String> names, double[] values) {
		if (names.size() != values.length)
			throw new IllegalArgumentException(String.format("Number of names (%d) does not match number of values (%d)", names.size(), values.length));
		return new FeatureVector(names, values);
	}

	/**
	 * Get an empty feature vector.
	 * @return
	 */
	public static FeatureVector empty() {
		return EMPTY;
	}

	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Number of features.
	 * @return
	 */
	public int size() {
		return values.length;
	}

	/**
	 * Returns true if there are no features.
	 * @return
	 */
	public boolean isEmpty() {
		return values.length == 0;
	}

	/**
	 * Get an unmodifiable list of the feature names, in order.
	 * @return
	 */
	public List<String> getNames() {
		return names;
	}

	/**
	 * Get the name of the feature at the specified index.
	 * @param ind
	 * @return
	 */
	public String getName(int ind) {
		return names.get(ind);
	}

	/**
	 * Get a snapshot of all values as a double array, in the same order as {@link #getNames()}.
	 * Changes to the array will not impact this feature vector.
	 * @return
	 */
	public double[] values() {
		return values.clone();
	}

	/**
	 * Get the value of the feature at the specified index.
	 * @param ind
	 * @return
	 */
	public double getValue(int ind) {
		return values[ind];
	}

	/**
	 * Returns true if a feature with the specified name is present.
	 * @param name
	 * @return
	 */
	public boolean containsKey(String name) {
		return indices.containsKey(name);
	}

	/**
	 * Get the value of a named feature.
	 * @param name
	 * @return the value, or NaN if the feature is not present
	 * @see #containsKey(String)
	 */
	public double get(String name) {
		Integer ind = indices.get(name);
		return ind == null ? Double.NaN : values[ind];
	}

	/**
	 * Create a new feature vector containing only the features that match a predicate, in the original order.
	 * @param predicate test applied to each name and value
	 * @return
	 */
	public FeatureVector filter(BiPredicate<String, Double> predicate) {
		var builder = builder();
		for (int i = 0; i < values.length; i++) {
			if (predicate.test(names.get(i), values[i]))
				builder.add(names.get(i), values[i]);
		}
		return builder.build();
	}

	/**
	 * Get the number of features with a value that is NaN or infinite.
	 * @return
	 */
	public int countNonFinite() {
		int count = 0;
		for (double v : values) {
			if (!Double.isFinite(v))
				count++;
		}
		return count;
	}

	/**
	 * Get a snapshot of the features as an ordered map.
	 * @return
	 */
	public Map<String, Double> toMap() {
		var map = new LinkedHashMap<String, Double>();
		for (int i = 0; i < values.length; i++)
			map.put(names.get(i), values[i]);
		return map;
	}

	@Override
	public int hashCode() {
		return 31 * names.hashCode() + Arrays.hashCode(values);
	}

	/**
	 * Feature vectors are equal if they have the same names and values in the same order.
	 * NaN values are considered equal to one another.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FeatureVector))
			return false;
		var other = (FeatureVector)obj;
		return names.equals(other.names) && Arrays.equals(values, other.values);
	}

	@Override
	public String toString() {
		return "FeatureVector" + toMap();
	}


	/**
	 * Builder to create a {@link FeatureVector} by appending features in order.
	 */
	public static class Builder {

		private List<String> names = new ArrayList<>();
		private List<Double> values = new ArrayList<>();

		private Builder() {}

		/**
		 * Append a single feature.
		 * @param name
		 * @param value
		 * @return this builder
		 */
		public Builder add(String name, double value) {
			names.add(name);
			values.add(value);
			return this;
		}

		/**
		 * Append features from parallel lists of names and values.
		 * @param names
		 * @param values
		 * @return this builder
		 * @throws IllegalArgumentException if the lengths differ
		 */
		public Builder addAll(List<String> names, double[] values) {
			if (names.size() != values.length)
				throw new IllegalArgumentException(String.format("Number of names (%d) does not match number of values (%d)", names.size(), values.length));
			for (int i = 0; i < values.length; i++)
				add(names.get(i), values[i]);
			return this;
		}

		/**
		 * Append all features from an existing feature vector.
		 * @param features
		 * @return this builder
		 */
		public Builder addAll(FeatureVector features) {
			for (int i = 0; i < features.size(); i++)
				add(features.getName(i), features.getValue(i));
			return this;
		}

		/**
		 * Append all features from an existing feature vector, prefixing each name.
		 * @param prefix
		 * @param features
		 * @return this builder
		 */
		public Builder addAll(String prefix, FeatureVector features) {
			for (int i = 0; i < features.size(); i++)
				add(prefix + features.getName(i), features.getValue(i));
			return this;
		}

		/**
		 * Build the feature vector.
		 * @return
		 * @throws IllegalArgumentException if any names are duplicated
		 */
		public FeatureVector build() {
			double[] arr = new double[values.size()];
			for (int i = 0; i < arr.length; i++)
				arr[i] = values.get(i);
			return new FeatureVector(names, arr);
		}

	}

}
