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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import htsjdk.samtools.util.OverlapDetector;

/**
 * Removes domain hits that overlap a better scoring hit within the same coding sequence.
 * Every pair of hits sharing a CDS is examined. If the overlap, as a fraction of the length
 * of either hit, exceeds the cutoff, the hit with the strictly lower score is discarded.
 * Hits with equal scores are both kept.
 * @author BGCNet developers
 *
 */
public class DomainOverlapResolver {

	public static final double DEF_OVERLAP_CUTOFF = 0.1;

	private Logger log = Logger.getLogger(DomainOverlapResolver.class.getName());

	private double overlapCutoff = DEF_OVERLAP_CUTOFF;

	public DomainOverlapResolver() {

	}
	public DomainOverlapResolver(double overlapCutoff) {
		setOverlapCutoff(overlapCutoff);
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public double getOverlapCutoff() {
		return overlapCutoff;
	}
	public void setOverlapCutoff(double overlapCutoff) {
		if(overlapCutoff<0 || overlapCutoff>1) throw new IllegalArgumentException("Overlap cutoff must be a fraction between 0 and 1. Value: "+overlapCutoff);
		this.overlapCutoff = overlapCutoff;
	}

	/**
	 * Filters the hits of one cluster
	 * @param hits Domain hits of a single cluster. The list is not modified
	 * @return List<DomainHit> Retained hits sorted by start coordinate
	 */
	public List<DomainHit> resolve(List<DomainHit> hits) {
		Map<DomainHit, Boolean> toRemove = findHitsToRemove(hits);
		List<DomainHit> answer = new ArrayList<>(hits.size()-toRemove.size());
		for(DomainHit hit:hits) {
			if(!toRemove.containsKey(hit)) answer.add(hit);
		}
		Collections.sort(answer, DomainHitPositionComparator.getInstance());
		if(toRemove.size()>0) log.fine("Removed "+toRemove.size()+" overlapping domains out of "+hits.size());
		return answer;
	}

	/**
	 * Scans all overlapping pairs without modifying the input
	 * @param hits to check
	 * @return Map<DomainHit, Boolean> Identity based set of hits that lose at least one comparison
	 */
	private Map<DomainHit, Boolean> findHitsToRemove(List<DomainHit> hits) {
		Map<DomainHit, Boolean> toRemove = new IdentityHashMap<>();
		OverlapDetector<DomainHit> detector = new OverlapDetector<>(0, 0);
		for(DomainHit hit:hits) detector.addLhs(hit, hit);
		for(DomainHit hit:hits) {
			for(DomainHit other:detector.getOverlaps(hit)) {
				if(other == hit) continue;
				if(!isSignificantOverlap(hit, other)) continue;
				if(hit.getScore()>other.getScore()) toRemove.put(other, Boolean.TRUE);
				else if (hit.getScore()<other.getScore()) toRemove.put(hit, Boolean.TRUE);
			}
		}
		return toRemove;
	}

	/**
	 * Decides if two hits overlap more than the cutoff relative to the length of either of them
	 * @param h1 First hit
	 * @param h2 Second hit
	 * @return boolean true if the overlap fraction of at least one of the hits is larger than the cutoff
	 */
	public boolean isSignificantOverlap(DomainHit h1, DomainHit h2) {
		if(!h1.getCdsId().equals(h2.getCdsId())) return false;
		int overlap = h1.getOverlapLength(h2);
		if(overlap<0) return false;
		return getOverlapFraction(overlap, h1)>overlapCutoff || getOverlapFraction(overlap, h2)>overlapCutoff;
	}

	private double getOverlapFraction(int overlap, DomainHit hit) {
		int length = hit.length();
		//Zero length hits lying within another hit are fully covered
		if(length==0) return 1;
		return (double)overlap/length;
	}

	/**
	 * Extracts the family names of the given hits keeping their order
	 * @param hits Resolved hits
	 * @return List<String> Ordered list of domain family names
	 */
	public static List<String> getDomainNames(List<DomainHit> hits) {
		List<String> names = new ArrayList<>(hits.size());
		for(DomainHit hit:hits) names.add(hit.getFamilyName());
		return names;
	}
}
