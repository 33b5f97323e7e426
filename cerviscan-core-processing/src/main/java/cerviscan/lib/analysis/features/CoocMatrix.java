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

/**
 * Data structure containing a gray-level co-occurrence matrix.
 *
 * @author CerviScan developers
 *
 */
class CoocMatrix {

	private int[] mat;
	private int n;
	private long sum = 0;

	public CoocMatrix(int n) {
		this.n = n;
		this.mat = new int[n * n];
	}

	public int getN() {
		return n;
	}

	public void addToEntrySymmetric(int row, int col) {
		addToEntry(row, col);
		addToEntry(col, row);
	}

	public void addToEntry(int row, int col) {
		mat[row * n + col] += 1;
		sum++;
	}

	/**
	 * Total of all counts in the matrix.
	 * @return
	 */
	public long getSum() {
		return sum;
	}

	/**
	 * Return probability (i.e. value divided by sum).
	 * This is NaN if the matrix is empty.
	 *
	 * @param row
	 * @param col
	 * @return
	 */
	public double get(int row, int col) {
		return (double)mat[row * n + col] / sum;
	}

	public int getRawCounts(int row, int col) {
		return mat[row * n + col];
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("[");
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				sb.append(getRawCounts(i, j));
				if (j < n-1)
					sb.append(", ");
			}
			if (i < n-1)
				sb.append("\n");
		}
		sb.append("]");
		return sb.toString();
	}

}
