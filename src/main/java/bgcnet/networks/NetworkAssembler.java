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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import bgcnet.distances.ClusterPairDistance;
import bgcnet.distances.PairwiseDistanceEngine;
import bgcnet.domains.io.ClusterGroupsFileHandler;
import bgcnet.main.ThreadPoolManager;

/**
 * Calculates the distances between every pair of clusters of a collection and builds
 * the list of network edges sorted from the most similar to the least similar pair.
 * Distances can be calculated in parallel. Results are stored by pair and sorted only
 * after all calculations finish, so the output does not depend on the number of threads
 * @author BGCNet developers
 *
 */
public class NetworkAssembler {
	public static final int DEF_NUM_THREADS = 1;
	public static final int MAX_TASK_COUNT = 1000;

	private Logger log = Logger.getLogger(NetworkAssembler.class.getName());

	private final PairwiseDistanceEngine engine;
	private int numThreads = DEF_NUM_THREADS;
	private boolean failFast = false;

	public NetworkAssembler(PairwiseDistanceEngine engine) {
		this.engine = engine;
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public PairwiseDistanceEngine getEngine() {
		return engine;
	}
	public int getNumThreads() {
		return numThreads;
	}
	public void setNumThreads(int numThreads) {
		if(numThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Value: "+numThreads);
		this.numThreads = numThreads;
	}
	public boolean isFailFast() {
		return failFast;
	}
	public void setFailFast(boolean failFast) {
		this.failFast = failFast;
	}

	/**
	 * Builds the network of the given clusters
	 * @param clusterIds Ids of the clusters. Every unordered pair is compared once
	 * @param groups Group label of each cluster. Clusters without label are assigned to group NA
	 * @return List<NetworkEdge> edges sorted by log score. Ties keep the order in which pairs are enumerated
	 * @throws InterruptedException If the parallel calculation is interrupted
	 * @throws IllegalArgumentException If the number of pairs does not fit in an array
	 */
	public List<NetworkEdge> assemble(List<String> clusterIds, Map<String,String> groups) throws InterruptedException {
		int n = clusterIds.size();
		long totalPairs = (long)n*(n-1)/2;
		if(totalPairs>Integer.MAX_VALUE) throw new IllegalArgumentException("Too many clusters to build a network. "+n+" clusters produce "+totalPairs+" pairs, maximum: "+Integer.MAX_VALUE);
		int numPairs = (int)totalPairs;
		NetworkEdge [] edges = new NetworkEdge[numPairs];
		RuntimeException [] errors = new RuntimeException[numPairs];
		List<PairwiseDistanceTask> tasks = new ArrayList<>(numPairs);
		int k = 0;
		for(int i=0;i<n;i++) {
			for(int j=i+1;j<n;j++) {
				tasks.add(new PairwiseDistanceTask(k, clusterIds.get(i), clusterIds.get(j), groups, edges, errors));
				k++;
			}
		}
		log.info("Calculating distances for "+numPairs+" pairs of "+n+" clusters using "+numThreads+" threads");
		if(numThreads==1) {
			for(PairwiseDistanceTask task:tasks) task.run();
		} else {
			ThreadPoolManager pool = new ThreadPoolManager(numThreads, MAX_TASK_COUNT);
			try {
				for(PairwiseDistanceTask task:tasks) pool.queueTask(task);
			} finally {
				pool.terminatePool();
			}
		}
		List<NetworkEdge> answer = new ArrayList<>(numPairs);
		for(int p=0;p<numPairs;p++) {
			if(errors[p]!=null) {
				PairwiseDistanceTask task = tasks.get(p);
				String message = "Error calculating distance between clusters "+task.clusterId1+" and "+task.clusterId2+": "+errors[p].getMessage();
				if(failFast) throw new IllegalStateException(message, errors[p]);
				log.severe(message);
				continue;
			}
			answer.add(edges[p]);
		}
		Collections.sort(answer, NetworkEdgeLogScoreComparator.getInstance());
		log.info("Calculated "+answer.size()+" network edges");
		return answer;
	}

	/**
	 * Selects the edges with squared similarity strictly larger than the given cutoff
	 * @param edges Sorted edges
	 * @param cutoff Minimum squared similarity (exclusive)
	 * @return List<NetworkEdge> selected edges keeping their relative order
	 */
	public static List<NetworkEdge> filter(List<NetworkEdge> edges, double cutoff) {
		List<NetworkEdge> answer = new ArrayList<>();
		for(NetworkEdge edge:edges) {
			if(edge.getSquaredSimilarity()>cutoff) answer.add(edge);
		}
		return answer;
	}

	private static String getGroup(Map<String,String> groups, String clusterId) {
		String group = groups!=null?groups.get(clusterId):null;
		if(group==null) return ClusterGroupsFileHandler.UNKNOWN_GROUP;
		return group;
	}

	private class PairwiseDistanceTask implements Runnable {
		private final int index;
		private final String clusterId1;
		private final String clusterId2;
		private final Map<String,String> groups;
		private final NetworkEdge [] edges;
		private final RuntimeException [] errors;

		PairwiseDistanceTask(int index, String clusterId1, String clusterId2, Map<String,String> groups, NetworkEdge [] edges, RuntimeException [] errors) {
			this.index = index;
			this.clusterId1 = clusterId1;
			this.clusterId2 = clusterId2;
			this.groups = groups;
			this.edges = edges;
			this.errors = errors;
		}

		@Override
		public void run() {
			try {
				ClusterPairDistance distance = engine.distance(clusterId1, clusterId2);
				edges[index] = new NetworkEdge(clusterId1, clusterId2, getGroup(groups, clusterId1), getGroup(groups, clusterId2), distance);
			} catch (RuntimeException e) {
				errors[index] = e;
			}
		}
	}
}
