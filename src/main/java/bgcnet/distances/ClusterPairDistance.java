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
package bgcnet.distances;

/**
 * Distance between two clusters together with the partial scores used to calculate it
 * @author BGCNet developers
 *
 */
public class ClusterPairDistance {
	private final double distance;
	private final double jaccard;
	private final double duplicationScore;
	private final double syntenyScore;

	public ClusterPairDistance(double distance, double jaccard, double duplicationScore, double syntenyScore) {
		this.distance = distance;
		this.jaccard = jaccard;
		this.duplicationScore = duplicationScore;
		this.syntenyScore = syntenyScore;
	}
	/**
	 * @return ClusterPairDistance Maximal distance assigned when a cluster has no domains
	 */
	public static ClusterPairDistance maximal() {
		return new ClusterPairDistance(1, 0, 0, 0);
	}
	/**
	 * @return double combined distance between 0 and 1
	 */
	public double getDistance() {
		return distance;
	}
	public double getSimilarity() {
		return 1 - distance;
	}
	public double getJaccard() {
		return jaccard;
	}
	/**
	 * @return double domain duplication score (DDS)
	 */
	public double getDuplicationScore() {
		return duplicationScore;
	}
	/**
	 * @return double Goodman-Kruskal synteny score. Zero for distances based on sequence identity
	 */
	public double getSyntenyScore() {
		return syntenyScore;
	}
	@Override
	public String toString() {
		return "distance: "+distance+" jaccard: "+jaccard+" DDS: "+duplicationScore+" GK: "+syntenyScore;
	}
}
