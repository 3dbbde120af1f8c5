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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import bgcnet.domains.ClusterDomainProfile;

/**
 * Read-only inputs shared by all distance calculations of a run: the cluster profiles,
 * the domain distance matrix, the distance mode and the weights of the partial scores.
 * Instances can be shared between threads
 * @author BGCNet developers
 *
 */
public class DistanceContext {
	public static final double DEF_JACCARD_WEIGHT = 0.4;
	public static final double DEF_DDS_WEIGHT = 0.2;
	public static final double DEF_GK_WEIGHT = 0.4;
	public static final int DEF_NEIGHBORHOOD = 4;

	private final Map<String, ClusterDomainProfile> profiles;
	private final DomainDistanceMatrix domainDistances;
	private final PairwiseDistanceEngine.Mode mode;
	private final double jaccardWeight;
	private final double ddsWeight;
	private final double gkWeight;
	private final int neighborhood;

	/**
	 * Creates a context with default weights and neighborhood
	 * @param profiles Profiles by cluster id
	 * @param domainDistances Distances between domain instances. Only used in SEQDIST mode
	 * @param mode Distance mode
	 */
	public DistanceContext(Map<String, ClusterDomainProfile> profiles, DomainDistanceMatrix domainDistances, PairwiseDistanceEngine.Mode mode) {
		this(profiles, domainDistances, mode, DEF_JACCARD_WEIGHT, DEF_DDS_WEIGHT, DEF_GK_WEIGHT, DEF_NEIGHBORHOOD);
	}

	/**
	 * Creates a new context
	 * @param profiles Profiles by cluster id
	 * @param domainDistances Distances between domain instances. If null, an empty matrix is used
	 * @param mode Distance mode
	 * @param jaccardWeight Weight of the Jaccard index in DOMAIN_DIST mode
	 * @param ddsWeight Weight of the domain duplication score in DOMAIN_DIST mode
	 * @param gkWeight Weight of the synteny score in DOMAIN_DIST mode
	 * @param neighborhood Width of the window used to build ordered domain pairs
	 */
	public DistanceContext(Map<String, ClusterDomainProfile> profiles, DomainDistanceMatrix domainDistances, PairwiseDistanceEngine.Mode mode, double jaccardWeight, double ddsWeight, double gkWeight, int neighborhood) {
		if(mode==null) throw new IllegalArgumentException("Distance mode must be specified");
		checkWeight("Jaccard", jaccardWeight);
		checkWeight("DDS", ddsWeight);
		checkWeight("GK", gkWeight);
		if(neighborhood<1) throw new IllegalArgumentException("Neighborhood must be a positive number. Value: "+neighborhood);
		this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
		this.domainDistances = domainDistances!=null?domainDistances:DomainDistanceMatrix.empty();
		this.mode = mode;
		this.jaccardWeight = jaccardWeight;
		this.ddsWeight = ddsWeight;
		this.gkWeight = gkWeight;
		this.neighborhood = neighborhood;
	}

	private static void checkWeight(String name, double value) {
		if(Double.isNaN(value) || Double.isInfinite(value)) throw new IllegalArgumentException(name+" weight must be a finite number. Value: "+value);
	}

	public Map<String, ClusterDomainProfile> getProfiles() {
		return profiles;
	}
	/**
	 * @param clusterId Id of the cluster
	 * @return ClusterDomainProfile profile of the cluster
	 * @throws IllegalArgumentException If the cluster is unknown
	 */
	public ClusterDomainProfile getProfile(String clusterId) {
		ClusterDomainProfile profile = profiles.get(clusterId);
		if(profile==null) throw new IllegalArgumentException("Unknown cluster: "+clusterId);
		return profile;
	}
	public DomainDistanceMatrix getDomainDistances() {
		return domainDistances;
	}
	public PairwiseDistanceEngine.Mode getMode() {
		return mode;
	}
	public double getJaccardWeight() {
		return jaccardWeight;
	}
	public double getDdsWeight() {
		return ddsWeight;
	}
	public double getGkWeight() {
		return gkWeight;
	}
	public int getNeighborhood() {
		return neighborhood;
	}
}
