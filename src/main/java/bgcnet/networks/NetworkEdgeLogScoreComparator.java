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

import java.util.Comparator;

/**
 * Orders edges from the most similar to the least similar pair. Infinite log scores go after every finite score
 * @author BGCNet developers
 *
 */
public class NetworkEdgeLogScoreComparator implements Comparator<NetworkEdge> {

	private static NetworkEdgeLogScoreComparator instance = new NetworkEdgeLogScoreComparator();
	private NetworkEdgeLogScoreComparator () {

	}
	@Override
	public int compare(NetworkEdge e0, NetworkEdge e1) {
		return Double.compare(e0.getLogScore(), e1.getLogScore());
	}
	public static NetworkEdgeLogScoreComparator getInstance() {
		return instance;
	}
}
