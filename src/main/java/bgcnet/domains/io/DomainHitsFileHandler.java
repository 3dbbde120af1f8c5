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
package bgcnet.domains.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import bgcnet.domains.DomainHit;
import bgcnet.main.io.ParseUtils;

/**
 * Handler for tab-delimited tables of domain hits. Each row has the columns:
 * cluster, score, gene id, start, stop, strand, family accession, family name and CDS id.
 * Gene id and strand can be empty. Lines starting with # are ignored
 * @author BGCNet developers
 *
 */
public class DomainHitsFileHandler {
	public static final int NUM_COLUMNS = 9;
	public static final String DOMAIN_NAMES_SEPARATOR = " ";

	/**
	 * Loads the hits stored in the given file
	 * @param filename Name of the tab-delimited file
	 * @return List<DomainHit> Hits in file order
	 * @throws IOException If the file can not be read or if a row is malformed. The message includes
	 * the file, line and cluster of the offending record
	 */
	public List<DomainHit> loadHits(String filename) throws IOException {
		try (FileInputStream fis = new FileInputStream(filename)) {
			return loadHits(fis, filename);
		}
	}
	/**
	 * Loads the hits from the given stream
	 * @param is Stream with the hits table
	 * @param source Name of the source used in error messages
	 * @return List<DomainHit> Hits in stream order
	 * @throws IOException If the stream can not be read or a row is malformed
	 */
	public List<DomainHit> loadHits(InputStream is, String source) throws IOException {
		List<DomainHit> hits = new ArrayList<>();
		try (BufferedReader in = new BufferedReader(new InputStreamReader(is))) {
			String line = in.readLine();
			int lineNumber = 1;
			while(line!=null) {
				if(line.trim().length()>0 && line.charAt(0)!='#') {
					hits.add(parseHit(line, source, lineNumber));
				}
				line = in.readLine();
				lineNumber++;
			}
		}
		return hits;
	}
	/**
	 * Groups the hits stored in the given file by cluster id
	 * @param filename Name of the tab-delimited file
	 * @return Map<String,List<DomainHit>> Hits by cluster in order of first appearance
	 * @throws IOException If the file can not be read or if a row is malformed
	 */
	public Map<String,List<DomainHit>> loadHitsByCluster(String filename) throws IOException {
		Map<String,List<DomainHit>> answer = new LinkedHashMap<>();
		for(DomainHit hit:loadHits(filename)) {
			List<DomainHit> clusterHits = answer.get(hit.getClusterId());
			if(clusterHits==null) {
				clusterHits = new ArrayList<>();
				answer.put(hit.getClusterId(), clusterHits);
			}
			clusterHits.add(hit);
		}
		return answer;
	}
	/**
	 * Groups the hits stored in the given file by cluster id, leaving out the clusters having malformed rows
	 * @param filename Name of the tab-delimited file
	 * @param malformedClusters Map receiving, for each cluster with malformed rows, the error found in its first malformed row.
	 * Rows without cluster id are registered with an empty id
	 * @return Map<String,List<DomainHit>> Hits of the well formed clusters in order of first appearance
	 * @throws IOException If the file can not be read
	 */
	public Map<String,List<DomainHit>> loadHitsByCluster(String filename, Map<String,String> malformedClusters) throws IOException {
		try (FileInputStream fis = new FileInputStream(filename)) {
			return loadHitsByCluster(fis, filename, malformedClusters);
		}
	}
	/**
	 * Groups the hits read from the given stream by cluster id, leaving out the clusters having malformed rows
	 * @param is Stream with the hits table
	 * @param source Name of the source used in error messages
	 * @param malformedClusters Map receiving the error found in the first malformed row of each cluster
	 * @return Map<String,List<DomainHit>> Hits of the well formed clusters in order of first appearance
	 * @throws IOException If the stream can not be read
	 */
	public Map<String,List<DomainHit>> loadHitsByCluster(InputStream is, String source, Map<String,String> malformedClusters) throws IOException {
		Map<String,List<DomainHit>> answer = new LinkedHashMap<>();
		try (BufferedReader in = new BufferedReader(new InputStreamReader(is))) {
			String line = in.readLine();
			int lineNumber = 1;
			while(line!=null) {
				if(line.trim().length()>0 && line.charAt(0)!='#') {
					try {
						DomainHit hit = parseHit(line, source, lineNumber);
						List<DomainHit> clusterHits = answer.get(hit.getClusterId());
						if(clusterHits==null) {
							clusterHits = new ArrayList<>();
							answer.put(hit.getClusterId(), clusterHits);
						}
						clusterHits.add(hit);
					} catch (IOException e) {
						String cluster = ParseUtils.parseString(line, '\t')[0].trim();
						if(!malformedClusters.containsKey(cluster)) malformedClusters.put(cluster, e.getMessage());
					}
				}
				line = in.readLine();
				lineNumber++;
			}
		}
		for(String cluster:malformedClusters.keySet()) answer.remove(cluster);
		return answer;
	}

	private DomainHit parseHit(String line, String source, int lineNumber) throws IOException {
		String [] items = ParseUtils.parseString(line, '\t');
		String cluster = items[0].trim();
		String location = "line "+lineNumber+" of "+source+" (cluster "+(cluster.length()>0?cluster:"unknown")+")";
		if(items.length<NUM_COLUMNS) throw new IOException("Malformed domain hit at "+location+". Expected "+NUM_COLUMNS+" columns but found "+items.length);
		String familyName = items[7].trim();
		String cdsId = items[8].trim();
		if(cluster.length()==0) throw new IOException("Missing cluster id at "+location);
		if(familyName.length()==0) throw new IOException("Missing domain family name at "+location);
		if(cdsId.length()==0) throw new IOException("Missing CDS id at "+location);
		double score;
		int start;
		int stop;
		try {
			score = Double.parseDouble(items[1].trim());
			start = Integer.parseInt(items[3].trim());
			stop = Integer.parseInt(items[4].trim());
		} catch (NumberFormatException e) {
			throw new IOException("Number format error at "+location+": "+e.getMessage(),e);
		}
		if(Double.isNaN(score)) throw new IOException("Invalid score at "+location);
		if(stop<start) throw new IOException("Invalid coordinates "+start+"-"+stop+" at "+location);
		return new DomainHit(cluster, score, items[2].trim(), start, stop, items[5].trim(), items[6].trim(), familyName, cdsId);
	}

	/**
	 * Saves the given hits in the tab-delimited format loaded by this handler
	 * @param hits to save
	 * @param out Stream to write the hits
	 */
	public void saveHits(List<DomainHit> hits, PrintStream out) {
		for(DomainHit hit:hits) {
			out.print(hit.getClusterId());
			out.print("\t"+hit.getScore());
			out.print("\t"+hit.getGeneId());
			out.print("\t"+hit.getStart());
			out.print("\t"+hit.getStop());
			out.print("\t"+hit.getStrand());
			out.print("\t"+hit.getFamilyAccession());
			out.print("\t"+hit.getFamilyName());
			out.println("\t"+hit.getCdsId());
		}
		out.flush();
	}
	/**
	 * Saves the ordered domain family names of a cluster in a single line
	 * @param domainNames Ordered family names
	 * @param out Stream to write the list
	 */
	public void saveDomainNames(List<String> domainNames, PrintStream out) {
		for(int i=0;i<domainNames.size();i++) {
			if(i>0) out.print(DOMAIN_NAMES_SEPARATOR);
			out.print(domainNames.get(i));
		}
		out.println();
		out.flush();
	}
	/**
	 * Loads a domain list saved with saveDomainNames
	 * @param is Stream with the list
	 * @return List<String> Ordered family names. Empty if the stream has no domains
	 * @throws IOException If the stream can not be read
	 */
	public List<String> loadDomainNames(InputStream is) throws IOException {
		List<String> answer = new ArrayList<>();
		try (BufferedReader in = new BufferedReader(new InputStreamReader(is))) {
			String line = in.readLine();
			if(line==null) return answer;
			for(String name:ParseUtils.parseString(line.trim(), DOMAIN_NAMES_SEPARATOR.charAt(0))) {
				if(name.length()>0) answer.add(name);
			}
		}
		return answer;
	}
}
