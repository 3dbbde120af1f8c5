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
package bgcnet.networks.io;

import java.io.PrintStream;
import java.util.List;

import bgcnet.main.io.ParseUtils;
import bgcnet.networks.NetworkEdge;

/**
 * Writes network edges as tab-delimited rows with the columns: cluster 1, cluster 2,
 * group 1, group 2, log score, distance and squared similarity
 * @author BGCNet developers
 *
 */
public class NetworkFileWriter {
	public static final String NETWORK_FILE_EXTENSION = ".network";

	/**
	 * Builds the name of the network file for a distance mode and a similarity cutoff
	 * @param outputPrefix Prefix of the output files
	 * @param modeName Name of the distance mode
	 * @param cutoff Cutoff as given by the user
	 * @return String prefix_mode_cCUTOFF.network
	 */
	public static String getNetworkFilename(String outputPrefix, String modeName, String cutoff) {
		return outputPrefix+"_"+modeName+"_c"+cutoff+NETWORK_FILE_EXTENSION;
	}

	public void printEdges(List<NetworkEdge> edges, PrintStream out) {
		for(NetworkEdge edge:edges) {
			out.print(edge.getClusterId1());
			out.print("\t"+edge.getClusterId2());
			out.print("\t"+edge.getGroup1());
			out.print("\t"+edge.getGroup2());
			out.print("\t"+ParseUtils.formatNumber(edge.getLogScore()));
			out.print("\t"+ParseUtils.formatNumber(edge.getDistance()));
			out.println("\t"+ParseUtils.formatNumber(edge.getSquaredSimilarity()));
		}
		out.flush();
	}
}
