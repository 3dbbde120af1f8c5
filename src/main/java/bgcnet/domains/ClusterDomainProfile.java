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
package bgcnet.domains;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Domain content of a gene cluster after overlap resolution. Keeps the ordered list of
 * domain family names, used to assess synteny, and the specific domain instances of
 * each family, used to assess domain duplication and sequence similarity.
 * Both views are built from the same hits, so every instance id has exactly one position
 * in the ordered list
 * @author BGCNet developers
 *
 */
public class ClusterDomainProfile {
	private final String clusterId;
	private final List<String> domainNames;
	private final Map<String, List<String>> instancesByFamily;

	/**
	 * Builds the profile from the hits retained by the overlap resolver
	 * @param clusterId Id of the cluster
	 * @param resolvedHits Hits sorted by start coordinate
	 */
	public ClusterDomainProfile(String clusterId, List<DomainHit> resolvedHits) {
		this.clusterId = clusterId;
		List<String> names = new ArrayList<>(resolvedHits.size());
		Map<String, List<String>> instances = new LinkedHashMap<>();
		for(DomainHit hit:resolvedHits) {
			String family = hit.getFamilyName();
			names.add(family);
			List<String> familyInstances = instances.get(family);
			if(familyInstances==null) {
				familyInstances = new ArrayList<>();
				instances.put(family, familyInstances);
			}
			familyInstances.add(hit.getInstanceId());
		}
		for(Map.Entry<String, List<String>> entry:instances.entrySet()) {
			entry.setValue(Collections.unmodifiableList(entry.getValue()));
		}
		this.domainNames = Collections.unmodifiableList(names);
		this.instancesByFamily = Collections.unmodifiableMap(instances);
	}

	public String getClusterId() {
		return clusterId;
	}
	/**
	 * @return List<String> Domain family names in genomic order. Families can be repeated
	 */
	public List<String> getDomainNames() {
		return domainNames;
	}
	/**
	 * @return Map<String, List<String>> Specific instance ids grouped by family name
	 */
	public Map<String, List<String>> getInstancesByFamily() {
		return instancesByFamily;
	}
	/**
	 * @param family name of the domain family
	 * @return List<String> Instances of the family in this cluster. Empty list if the family is absent
	 */
	public List<String> getInstances(String family) {
		List<String> answer = instancesByFamily.get(family);
		if(answer==null) return Collections.emptyList();
		return answer;
	}
	public Set<String> getFamilies() {
		return instancesByFamily.keySet();
	}
	public int getNumDomains() {
		return domainNames.size();
	}
	public boolean isEmpty() {
		return domainNames.isEmpty();
	}
}
