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
package bgcnet.networks;

import bgcnet.distances.ClusterPairDistance;

/**
 * Relationship between two clusters in a similarity network. The log score is -log2(similarity),
 * so the most similar pairs have the smallest scores. Pairs with similarity zero have an infinite score
 * @author BGCNet developers
 *
 */
public class NetworkEdge {
	private final String clusterId1;
	private final String clusterId2;
	private final String group1;
	private final String group2;
	private final ClusterPairDistance pairDistance;
	private final double logScore;

	public NetworkEdge(String clusterId1, String clusterId2, String group1, String group2, ClusterPairDistance pairDistance) {
		this.clusterId1 = clusterId1;
		this.clusterId2 = clusterId2;
		this.group1 = group1;
		this.group2 = group2;
		this.pairDistance = pairDistance;
		this.logScore = calculateLogScore(pairDistance.getSimilarity());
	}

	/**
	 * Calculates -log2(similarity)
	 * @param similarity Value between 0 and 1
	 * @return double log score. Zero for similarity 1 and positive infinity for similarity 0
	 */
	public static double calculateLogScore(double similarity) {
		if(similarity<=0) return Double.POSITIVE_INFINITY;
		if(similarity>=1) return 0;
		return -Math.log(similarity)/Math.log(2);
	}

	public String getClusterId1() {
		return clusterId1;
	}
	public String getClusterId2() {
		return clusterId2;
	}
	public String getGroup1() {
		return group1;
	}
	public String getGroup2() {
		return group2;
	}
	public ClusterPairDistance getPairDistance() {
		return pairDistance;
	}
	public double getLogScore() {
		return logScore;
	}
	public double getDistance() {
		return pairDistance.getDistance();
	}
	public double getSimilarity() {
		return pairDistance.getSimilarity();
	}
	public double getSquaredSimilarity() {
		double s = getSimilarity();
		return s*s;
	}
	@Override
	public String toString() {
		return clusterId1+"\t"+clusterId2+"\t"+logScore+"\t"+getDistance();
	}
}
