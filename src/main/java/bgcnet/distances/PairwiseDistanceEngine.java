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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import bgcnet.domains.ClusterDomainProfile;
import bgcnet.math.HungarianAlgorithm;

/**
 * Calculates distances between pairs of gene clusters from their domain profiles.
 * Two modes are available:
 * DOMAIN_DIST combines a size tolerant Jaccard index, a domain duplication score (DDS)
 * and a Goodman-Kruskal synteny score (GK) weighted according to the context.
 * SEQDIST combines the Jaccard index of domain families with a DDS calculated from the
 * sequence dissimilarities of optimally matched domain instances.
 * Distances are symmetric and lie between 0 and 1. Clusters without domains are at distance 1
 * from any other cluster
 * @author BGCNet developers
 *
 */
public class PairwiseDistanceEngine {

	public enum Mode {
		DOMAIN_DIST,
		SEQDIST;

		/**
		 * Decodes a mode name ignoring case
		 * @param value Name of the mode (for example domain_dist)
		 * @return Mode decoded mode
		 */
		public static Mode decode(String value) {
			return valueOf(value.trim().toUpperCase());
		}
	}

	public static final double SEQDIST_JACCARD_WEIGHT = 0.36;
	public static final double SEQDIST_DDS_WEIGHT = 0.64;

	private final DistanceContext context;

	public PairwiseDistanceEngine(DistanceContext context) {
		this.context = context;
	}

	public DistanceContext getContext() {
		return context;
	}

	/**
	 * Calculates the distance between two clusters registered in the context
	 * @param clusterId1 Id of the first cluster
	 * @param clusterId2 Id of the second cluster
	 * @return ClusterPairDistance distance and partial scores
	 */
	public ClusterPairDistance distance(String clusterId1, String clusterId2) {
		return distance(context.getProfile(clusterId1), context.getProfile(clusterId2));
	}

	/**
	 * Calculates the distance between two cluster profiles using the mode of the context
	 * @param profile1 First profile
	 * @param profile2 Second profile
	 * @return ClusterPairDistance distance and partial scores
	 */
	public ClusterPairDistance distance(ClusterDomainProfile profile1, ClusterDomainProfile profile2) {
		if(profile1.isEmpty() || profile2.isEmpty()) return ClusterPairDistance.maximal();
		//Fixed orientation of the pair makes the calculation independent of the argument order
		if(compareProfiles(profile1, profile2)>0) {
			ClusterDomainProfile tmp = profile1;
			profile1 = profile2;
			profile2 = tmp;
		}
		if(context.getMode()==Mode.SEQDIST) return calculateSequenceDistance(profile1, profile2);
		return calculateDomainDistance(profile1.getDomainNames(), profile2.getDomainNames());
	}

	private int compareProfiles(ClusterDomainProfile profile1, ClusterDomainProfile profile2) {
		List<String> names1 = profile1.getDomainNames();
		List<String> names2 = profile2.getDomainNames();
		int n = Math.min(names1.size(), names2.size());
		for(int i=0;i<n;i++) {
			int cmp = names1.get(i).compareTo(names2.get(i));
			if(cmp!=0) return cmp;
		}
		if(names1.size()!=names2.size()) return names1.size()-names2.size();
		String id1 = profile1.getClusterId()!=null?profile1.getClusterId():"";
		String id2 = profile2.getClusterId()!=null?profile2.getClusterId():"";
		return id1.compareTo(id2);
	}

	/**
	 * Distance based on the ordered lists of domain families
	 * @param domains1 Ordered family names of the first cluster
	 * @param domains2 Ordered family names of the second cluster
	 * @return ClusterPairDistance distance with Jaccard, DDS and GK scores
	 */
	public ClusterPairDistance calculateDomainDistance(List<String> domains1, List<String> domains2) {
		if(domains1.isEmpty() || domains2.isEmpty()) return ClusterPairDistance.maximal();
		double jaccard = calculateModifiedJaccard(domains1, domains2);
		double dds = calculateDuplicationScore(domains1, domains2);
		List<String> reversed1 = new ArrayList<>(domains1);
		Collections.reverse(reversed1);
		int nbhood = context.getNeighborhood();
		double gk = Math.max(calculateGoodmanKruskal(domains1, domains2, nbhood), calculateGoodmanKruskal(reversed1, domains2, nbhood));
		double distance = 1 - context.getJaccardWeight()*jaccard - context.getDdsWeight()*dds - context.getGkWeight()*gk;
		return new ClusterPairDistance(clamp(distance), jaccard, dds, gk);
	}

	/**
	 * Jaccard index modified to avoid penalizing clusters of very different sizes:
	 * |A and B| / (2*min(|A|,|B|) - |A and B|) over the sets of families
	 * @param domains1 Family names of the first cluster. Must not be empty
	 * @param domains2 Family names of the second cluster. Must not be empty
	 * @return double modified Jaccard index
	 */
	public static double calculateModifiedJaccard(List<String> domains1, List<String> domains2) {
		Set<String> set1 = new HashSet<>(domains1);
		Set<String> set2 = new HashSet<>(domains2);
		int shared = countShared(set1, set2);
		return (double)shared / (2*Math.min(set1.size(), set2.size()) - shared);
	}

	/**
	 * Domain duplication score exp(-sum|countA-countB|/sum max(countA,countB)) over all families
	 * @param domains1 Family names of the first cluster. Must not be empty
	 * @param domains2 Family names of the second cluster. Must not be empty
	 * @return double score. 1 for identical copy numbers
	 */
	public static double calculateDuplicationScore(List<String> domains1, List<String> domains2) {
		Map<String, Integer> counts1 = countFamilies(domains1);
		Map<String, Integer> counts2 = countFamilies(domains2);
		Set<String> families = new TreeSet<>(counts1.keySet());
		families.addAll(counts2.keySet());
		int differences = 0;
		int total = 0;
		for(String family:families) {
			int c1 = getCount(counts1, family);
			int c2 = getCount(counts2, family);
			differences+=Math.abs(c1-c2);
			total+=Math.max(c1, c2);
		}
		return Math.exp(-(double)differences/total);
	}

	/**
	 * Synteny score based on the Goodman-Kruskal gamma of the ordered domain pairs of both clusters.
	 * Pairs are built from each domain starting at positions 0 to length-nbhood-1 and each of the
	 * following nbhood-1 domains. Pairs present in both clusters are concordant and pairs present
	 * reversed are discordant.
	 * @param domains1 Ordered family names of the first cluster
	 * @param domains2 Ordered family names of the second cluster
	 * @param nbhood Width of the neighborhood window
	 * @return double (1+gamma)/2, or zero if the clusters share less than two families
	 */
	public static double calculateGoodmanKruskal(List<String> domains1, List<String> domains2, int nbhood) {
		Set<String> set1 = new HashSet<>(domains1);
		Set<String> set2 = new HashSet<>(domains2);
		if(countShared(set1, set2)<=1) return 0;
		Set<DomainPair> pairs1 = buildPairs(domains1, nbhood);
		Set<DomainPair> pairs2 = buildPairs(domains2, nbhood);
		Set<DomainPair> allPairs = new HashSet<>(pairs1);
		allPairs.addAll(pairs2);
		int concordant = 0;
		int discordant = 0;
		for(DomainPair p:allPairs) {
			boolean in1 = pairs1.contains(p);
			boolean in2 = pairs2.contains(p);
			DomainPair reverse = p.reverse();
			if(in1 && in2) concordant++;
			else if(in1 && pairs2.contains(reverse)) discordant++;
			else if(in2 && pairs1.contains(reverse)) discordant++;
		}
		double gamma = 0;
		if(concordant+discordant>0) gamma = (double)Math.abs(discordant-concordant)/(discordant+concordant);
		return (1+gamma)/2;
	}

	private static Set<DomainPair> buildPairs(List<String> domains, int nbhood) {
		Set<DomainPair> pairs = new HashSet<>();
		int n = domains.size();
		for(int i=0;i<n-nbhood;i++) {
			for(int j=i+1;j<i+nbhood;j++) {
				pairs.add(new DomainPair(domains.get(i), domains.get(j)));
			}
		}
		return pairs;
	}

	/**
	 * Distance based on the sequence dissimilarities between domain instances of the same family
	 * @param profile1 First profile. Must not be empty
	 * @param profile2 Second profile. Must not be empty
	 * @return ClusterPairDistance distance with Jaccard and DDS scores
	 */
	public ClusterPairDistance calculateSequenceDistance(ClusterDomainProfile profile1, ClusterDomainProfile profile2) {
		if(profile1.isEmpty() || profile2.isEmpty()) return ClusterPairDistance.maximal();
		Set<String> families1 = profile1.getFamilies();
		Set<String> families2 = profile2.getFamilies();
		int shared = countShared(families1, families2);
		double jaccard = (double)shared/(families1.size()+families2.size()-shared);
		Set<String> allFamilies = new TreeSet<>(families1);
		allFamilies.addAll(families2);
		double sumDistances = 0;
		int normalization = 0;
		for(String family:allFamilies) {
			List<String> instances1 = profile1.getInstances(family);
			List<String> instances2 = profile2.getInstances(family);
			int n1 = instances1.size();
			int n2 = instances2.size();
			if(n1==1 && n2==1) {
				sumDistances += context.getDomainDistances().getDissimilarity(family, instances1.get(0), instances2.get(0));
				normalization++;
			} else if (n1+n2==1) {
				sumDistances += 1;
				normalization++;
			} else {
				sumDistances += calculateAssignmentCost(family, instances1, instances2);
				normalization += Math.max(n1, n2);
			}
		}
		double dds = Math.exp(-sumDistances/normalization);
		double distance = 1 - SEQDIST_JACCARD_WEIGHT*jaccard - SEQDIST_DDS_WEIGHT*dds;
		return new ClusterPairDistance(clamp(distance), jaccard, dds, 0);
	}

	/**
	 * Builds a square matrix of dissimilarities padded with zeros and solves the assignment problem
	 * @param family Domain family
	 * @param instances1 Instances of the family in the first cluster
	 * @param instances2 Instances of the family in the second cluster
	 * @return double minimum total dissimilarity of a one to one matching
	 */
	private double calculateAssignmentCost(String family, List<String> instances1, List<String> instances2) {
		int n = Math.max(instances1.size(), instances2.size());
		double [][] costs = new double[n][n];
		DomainDistanceMatrix dms = context.getDomainDistances();
		for(int i=0;i<instances1.size();i++) {
			for(int j=0;j<instances2.size();j++) {
				costs[i][j] = dms.getDissimilarity(family, instances1.get(i), instances2.get(j));
			}
		}
		return HungarianAlgorithm.minimumCost(costs);
	}

	private static int countShared(Set<String> set1, Set<String> set2) {
		int shared = 0;
		for(String s:set1) {
			if(set2.contains(s)) shared++;
		}
		return shared;
	}

	private static Map<String, Integer> countFamilies(List<String> domains) {
		Map<String, Integer> counts = new HashMap<>();
		for(String d:domains) counts.put(d, getCount(counts, d)+1);
		return counts;
	}

	private static int getCount(Map<String, Integer> counts, String family) {
		Integer c = counts.get(family);
		if(c==null) return 0;
		return c;
	}

	private static double clamp(double distance) {
		if(distance<0) return 0;
		if(distance>1) return 1;
		return distance;
	}

	private static final class DomainPair {
		private final String first;
		private final String second;

		DomainPair(String first, String second) {
			this.first = first;
			this.second = second;
		}
		DomainPair reverse() {
			return new DomainPair(second, first);
		}
		@Override
		public boolean equals(Object obj) {
			if(!(obj instanceof DomainPair)) return false;
			DomainPair other = (DomainPair)obj;
			return first.equals(other.first) && second.equals(other.second);
		}
		@Override
		public int hashCode() {
			return 31*first.hashCode()+second.hashCode();
		}
	}
}
