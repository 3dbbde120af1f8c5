/*******************************************************************************
 * BGCNet - Biosynthetic Gene Cluster Networks
 * Copyright 2024 BGCNet developers
 *
 * This file is part of BGCNet.
 *
 *     BGCNet is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     BGCNet is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with BGCNet.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package bgcnet.math;

import java.util.Arrays;

/**
 * Solves the minimum cost assignment problem (optimal bipartite matching) on square
 * matrices with the Hungarian (Kuhn-Munkres) algorithm, using row and column potentials
 * and shortest augmenting paths. Runs in O(n^3) time
 * @author BGCNet developers
 *
 */
public class HungarianAlgorithm {

	/**
	 * Calculates the assignment of rows to columns with minimum total cost
	 * @param costs Square matrix of finite nonnegative costs. It is not modified
	 * @return int [] Array with the column assigned to each row
	 * @throws IllegalArgumentException If the matrix is not square or has invalid values
	 */
	public static int [] solve(double [][] costs) {
		int n = costs.length;
		for(int i=0;i<n;i++) {
			if(costs[i].length!=n) throw new IllegalArgumentException("Cost matrix must be square. Row "+i+" has "+costs[i].length+" columns, expected: "+n);
			for(int j=0;j<n;j++) {
				double c = costs[i][j];
				if(Double.isNaN(c) || Double.isInfinite(c) || c<0) throw new IllegalArgumentException("Invalid cost "+c+" at row "+i+" column "+j);
			}
		}
		int [] assignment = new int[n];
		if(n==0) return assignment;
		// One based indexes. Column 0 is a virtual column used to start each augmenting path
		double [] rowPotentials = new double[n+1];
		double [] colPotentials = new double[n+1];
		int [] rowOfColumn = new int[n+1];
		int [] previousColumn = new int[n+1];
		double [] minSlack = new double[n+1];
		boolean [] used = new boolean[n+1];
		for(int row=1;row<=n;row++) {
			rowOfColumn[0] = row;
			int col0 = 0;
			Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
			Arrays.fill(used, false);
			do {
				used[col0] = true;
				int i0 = rowOfColumn[col0];
				double delta = Double.POSITIVE_INFINITY;
				int col1 = -1;
				for(int j=1;j<=n;j++) {
					if(used[j]) continue;
					double slack = costs[i0-1][j-1]-rowPotentials[i0]-colPotentials[j];
					if(slack<minSlack[j]) {
						minSlack[j] = slack;
						previousColumn[j] = col0;
					}
					if(minSlack[j]<delta) {
						delta = minSlack[j];
						col1 = j;
					}
				}
				if(col1==-1) throw new IllegalStateException("No augmenting path found for row "+row+". The cost matrix may contain invalid values");
				for(int j=0;j<=n;j++) {
					if(used[j]) {
						rowPotentials[rowOfColumn[j]]+=delta;
						colPotentials[j]-=delta;
					} else {
						minSlack[j]-=delta;
					}
				}
				col0 = col1;
			} while (rowOfColumn[col0]!=0);
			//Flip the augmenting path
			do {
				int col1 = previousColumn[col0];
				rowOfColumn[col0] = rowOfColumn[col1];
				col0 = col1;
			} while (col0!=0);
		}
		for(int j=1;j<=n;j++) {
			assignment[rowOfColumn[j]-1] = j-1;
		}
		return assignment;
	}

	/**
	 * Sums the costs of the given assignment
	 * @param costs Square cost matrix
	 * @param assignment Column assigned to each row
	 * @return double total cost
	 */
	public static double totalCost(double [][] costs, int [] assignment) {
		double total = 0;
		for(int i=0;i<assignment.length;i++) {
			total+=costs[i][assignment[i]];
		}
		return total;
	}

	/**
	 * Solves the assignment problem and returns the optimal total cost
	 * @param costs Square matrix of finite nonnegative costs
	 * @return double minimum total cost
	 */
	public static double minimumCost(double [][] costs) {
		return totalCost(costs, solve(costs));
	}
}
