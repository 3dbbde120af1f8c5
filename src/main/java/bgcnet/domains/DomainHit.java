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

import htsjdk.samtools.util.Locatable;

/**
 * Protein domain detected within a coding sequence of a gene cluster.
 * The coding sequence id plays the role of the contig, so that hits can be
 * compared with the interval utilities of htsjdk. Instances are immutable
 * @author BGCNet developers
 *
 */
public class DomainHit implements Locatable {
	public static final String INSTANCE_ID_SEPARATOR = "_";

	private final String clusterId;
	private final double score;
	private final String geneId;
	private final int start;
	private final int stop;
	private final String strand;
	private final String familyAccession;
	private final String familyName;
	private final String cdsId;
	private final String instanceId;

	/**
	 * Creates a new domain hit
	 * @param clusterId Id of the cluster owning the hit
	 * @param score Detection score
	 * @param geneId Gene id. Can be empty if the gene is not annotated
	 * @param start First coordinate of the domain
	 * @param stop Last coordinate of the domain. Must be greater or equal than start
	 * @param strand Strand of the coding sequence
	 * @param familyAccession Accession of the domain family (for example a Pfam id)
	 * @param familyName Name of the domain family
	 * @param cdsId Identifier of the coding sequence where the domain was found
	 */
	public DomainHit(String clusterId, double score, String geneId, int start, int stop, String strand, String familyAccession, String familyName, String cdsId) {
		if(clusterId==null) throw new IllegalArgumentException("Cluster id can not be null");
		if(familyName==null) throw new IllegalArgumentException("Domain family name can not be null for hit in cluster "+clusterId);
		if(cdsId==null) throw new IllegalArgumentException("CDS id can not be null for hit in cluster "+clusterId);
		if(stop<start) throw new IllegalArgumentException("Invalid coordinates "+start+"-"+stop+" for domain "+familyName+" in cluster "+clusterId);
		this.clusterId = clusterId;
		this.score = score;
		this.geneId = geneId;
		this.start = start;
		this.stop = stop;
		this.strand = strand;
		this.familyAccession = familyAccession;
		this.familyName = familyName;
		this.cdsId = cdsId;
		this.instanceId = buildInstanceId(familyName, cdsId, start, stop);
	}

	/**
	 * Builds the identifier of a specific domain instance
	 * @return String familyName_cdsId_start_stop
	 */
	public static String buildInstanceId(String familyName, String cdsId, int start, int stop) {
		return familyName+INSTANCE_ID_SEPARATOR+cdsId+INSTANCE_ID_SEPARATOR+start+INSTANCE_ID_SEPARATOR+stop;
	}

	public String getClusterId() {
		return clusterId;
	}
	public double getScore() {
		return score;
	}
	public String getGeneId() {
		return geneId;
	}
	public int getStop() {
		return stop;
	}
	public String getStrand() {
		return strand;
	}
	public String getFamilyAccession() {
		return familyAccession;
	}
	public String getFamilyName() {
		return familyName;
	}
	public String getCdsId() {
		return cdsId;
	}
	/**
	 * @return String unique id of this domain occurrence. Used as key in the domain distance matrices
	 */
	public String getInstanceId() {
		return instanceId;
	}
	/**
	 * @return int Number of positions spanned by the hit (stop - start)
	 */
	public int length() {
		return stop - start;
	}
	/**
	 * Calculates the number of positions shared with the given hit
	 * @param other Hit to compare
	 * @return int Overlap length. Zero or negative if the hits do not overlap
	 */
	public int getOverlapLength(DomainHit other) {
		return Math.min(stop, other.stop) - Math.max(start, other.start);
	}

	@Override
	public String getContig() {
		return cdsId;
	}
	@Override
	public int getStart() {
		return start;
	}
	@Override
	public int getEnd() {
		return stop;
	}

	@Override
	public String toString() {
		return clusterId+"\t"+familyName+"\t"+cdsId+":"+start+"-"+stop+"\t"+score;
	}
}
