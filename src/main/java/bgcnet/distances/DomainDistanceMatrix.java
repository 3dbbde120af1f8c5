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
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Sequence dissimilarities between specific instances of the same domain family.
 * Values are stored per family with keys built from the sorted pair of instance ids,
 * so lookups do not depend on the order of the instances. Pairs without a value
 * resolve to a fixed fallback dissimilarity. The matrix is read-only once built
 * @author BGCNet developers
 *
 */
public class DomainDistanceMatrix {
	public static final double DEF_MISSING_DISSIMILARITY = 0.9;
	private static final char KEY_SEPARATOR = '\t';

	private final Map<String, Map<String, Double>> dissimilarities;
	private final double missingDissimilarity;

	private DomainDistanceMatrix(Map<String, Map<String, Double>> dissimilarities, double missingDissimilarity) {
		this.dissimilarities = dissimilarities;
		this.missingDissimilarity = missingDissimilarity;
	}

	/**
	 * @return DomainDistanceMatrix Matrix without values. Every lookup of different instances returns the fallback value
	 */
	public static DomainDistanceMatrix empty() {
		return new DomainDistanceMatrix(Collections.<String, Map<String, Double>>emptyMap(), DEF_MISSING_DISSIMILARITY);
	}

	/**
	 * Looks up the dissimilarity between two instances of the given family
	 * @param family Name of the domain family
	 * @param instance1 Id of the first instance
	 * @param instance2 Id of the second instance
	 * @return double Stored dissimilarity. Zero if both ids are the same. The fallback value if the pair is absent
	 */
	public double getDissimilarity(String family, String instance1, String instance2) {
		if(instance1.equals(instance2)) return 0;
		Map<String, Double> familyValues = dissimilarities.get(family);
		if(familyValues==null) return missingDissimilarity;
		Double value = familyValues.get(buildKey(instance1, instance2));
		if(value==null) return missingDissimilarity;
		return value;
	}

	/**
	 * @param family Name of the domain family
	 * @param instance1 Id of the first instance
	 * @param instance2 Id of the second instance
	 * @return boolean true if a value is stored for the pair
	 */
	public boolean contains(String family, String instance1, String instance2) {
		Map<String, Double> familyValues = dissimilarities.get(family);
		return familyValues!=null && familyValues.containsKey(buildKey(instance1, instance2));
	}

	public Set<String> getFamilies() {
		return dissimilarities.keySet();
	}

	public double getMissingDissimilarity() {
		return missingDissimilarity;
	}

	/**
	 * @return int Total number of stored pairs
	 */
	public int size() {
		int n = 0;
		for(Map<String, Double> familyValues:dissimilarities.values()) n+=familyValues.size();
		return n;
	}

	private static String buildKey(String instance1, String instance2) {
		if(instance1.compareTo(instance2)<=0) return instance1+KEY_SEPARATOR+instance2;
		return instance2+KEY_SEPARATOR+instance1;
	}

	/**
	 * Collects the values of a matrix before it is used for distance calculations
	 */
	public static class Builder {
		private final Map<String, Map<String, Double>> dissimilarities = new HashMap<>();
		private double missingDissimilarity = DEF_MISSING_DISSIMILARITY;

		/**
		 * Stores the dissimilarity between two instances of a family
		 * @param family Name of the domain family
		 * @param instance1 Id of the first instance
		 * @param instance2 Id of the second instance
		 * @param dissimilarity Value between 0 and 1
		 * @return Builder this builder
		 */
		public Builder put(String family, String instance1, String instance2, double dissimilarity) {
			if(Double.isNaN(dissimilarity) || dissimilarity<0 || dissimilarity>1) throw new IllegalArgumentException("Dissimilarity between "+instance1+" and "+instance2+" must be between 0 and 1. Value: "+dissimilarity);
			Map<String, Double> familyValues = dissimilarities.get(family);
			if(familyValues==null) {
				familyValues = new HashMap<>();
				dissimilarities.put(family, familyValues);
			}
			familyValues.put(buildKey(instance1, instance2), dissimilarity);
			return this;
		}
		public Builder setMissingDissimilarity(double missingDissimilarity) {
			if(Double.isNaN(missingDissimilarity) || missingDissimilarity<0 || missingDissimilarity>1) throw new IllegalArgumentException("Fallback dissimilarity must be between 0 and 1. Value: "+missingDissimilarity);
			this.missingDissimilarity = missingDissimilarity;
			return this;
		}
		public DomainDistanceMatrix build() {
			Map<String, Map<String, Double>> copy = new HashMap<>();
			for(Map.Entry<String, Map<String, Double>> entry:dissimilarities.entrySet()) {
				copy.put(entry.getKey(), Collections.unmodifiableMap(new HashMap<>(entry.getValue())));
			}
			return new DomainDistanceMatrix(Collections.unmodifiableMap(copy), missingDissimilarity);
		}
	}
}
