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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import bgcnet.distances.DistanceContext;
import bgcnet.distances.DomainDistanceMatrix;
import bgcnet.distances.PairwiseDistanceEngine;
import bgcnet.distances.io.DomainAlignmentsDistanceLoader;
import bgcnet.domains.ClusterDomainProfile;
import bgcnet.domains.DomainHit;
import bgcnet.domains.DomainOverlapResolver;
import bgcnet.domains.io.ClusterGroupsFileHandler;
import bgcnet.domains.io.DomainHitsFileHandler;
import bgcnet.main.CommandsDescriptor;
import bgcnet.main.OptionValuesDecoder;
import bgcnet.main.io.ParseUtils;
import bgcnet.networks.io.NetworkFileWriter;

/**
 * Builds similarity networks of gene clusters from tables of domain hits. For each cluster,
 * overlapping domains are resolved and the filtered domains are saved. Then the distances
 * between all pairs of clusters are calculated and one network file is written for each
 * similarity cutoff
 * @author BGCNet developers
 *
 */
public class BGCNetworkBuilder {

	// Constants for default values
	public static final String DEF_OUTPUT_PREFIX = "bgcnet";
	public static final double DEF_OVERLAP_CUTOFF = DomainOverlapResolver.DEF_OVERLAP_CUTOFF;
	public static final PairwiseDistanceEngine.Mode DEF_DISTANCE_MODE = PairwiseDistanceEngine.Mode.DOMAIN_DIST;
	public static final double DEF_JACCARD_WEIGHT = DistanceContext.DEF_JACCARD_WEIGHT;
	public static final double DEF_DDS_WEIGHT = DistanceContext.DEF_DDS_WEIGHT;
	public static final double DEF_GK_WEIGHT = DistanceContext.DEF_GK_WEIGHT;
	public static final int DEF_NEIGHBORHOOD = DistanceContext.DEF_NEIGHBORHOOD;
	public static final String DEF_SIMILARITY_CUTOFFS = "0";
	public static final int DEF_NUM_THREADS = NetworkAssembler.DEF_NUM_THREADS;
	public static final String PFD_EXTENSION = ".pfd";
	public static final String PFS_EXTENSION = ".pfs";

	// Logging
	private Logger log = Logger.getLogger(BGCNetworkBuilder.class.getName());

	// Parameters
	private List<String> inputFiles = new ArrayList<>();
	private String outputPrefix = DEF_OUTPUT_PREFIX;
	private String groupsFile = null;
	private String alignmentsDirectory = null;
	private PairwiseDistanceEngine.Mode distanceMode = DEF_DISTANCE_MODE;
	private double overlapCutoff = DEF_OVERLAP_CUTOFF;
	private double jaccardWeight = DEF_JACCARD_WEIGHT;
	private double ddsWeight = DEF_DDS_WEIGHT;
	private double gkWeight = DEF_GK_WEIGHT;
	private int neighborhood = DEF_NEIGHBORHOOD;
	private String similarityCutoffs = DEF_SIMILARITY_CUTOFFS;
	private int numThreads = DEF_NUM_THREADS;
	private boolean failFast = false;
	private boolean skipDomainFiles = false;

	// Get and set methods
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public List<String> getInputFiles() {
		return inputFiles;
	}
	public void setInputFiles(List<String> inputFiles) {
		this.inputFiles = inputFiles;
	}

	public String getOutputPrefix() {
		return outputPrefix;
	}
	public void setOutputPrefix(String outputPrefix) {
		this.outputPrefix = outputPrefix;
	}

	public String getGroupsFile() {
		return groupsFile;
	}
	public void setGroupsFile(String groupsFile) {
		this.groupsFile = groupsFile;
	}

	public String getAlignmentsDirectory() {
		return alignmentsDirectory;
	}
	public void setAlignmentsDirectory(String alignmentsDirectory) {
		this.alignmentsDirectory = alignmentsDirectory;
	}

	public PairwiseDistanceEngine.Mode getDistanceMode() {
		return distanceMode;
	}
	public void setDistanceMode(PairwiseDistanceEngine.Mode distanceMode) {
		this.distanceMode = distanceMode;
	}
	public void setDistanceMode(String value) {
		this.setDistanceMode(PairwiseDistanceEngine.Mode.decode(value));
	}

	public double getOverlapCutoff() {
		return overlapCutoff;
	}
	public void setOverlapCutoff(double overlapCutoff) {
		if(overlapCutoff<0 || overlapCutoff>1) throw new IllegalArgumentException("Overlap cutoff must be a fraction between 0 and 1. Value: "+overlapCutoff);
		this.overlapCutoff = overlapCutoff;
	}
	public void setOverlapCutoff(String value) {
		this.setOverlapCutoff((double) OptionValuesDecoder.decode(value, Double.class));
	}

	public double getJaccardWeight() {
		return jaccardWeight;
	}
	public void setJaccardWeight(double jaccardWeight) {
		this.jaccardWeight = jaccardWeight;
	}
	public void setJaccardWeight(String value) {
		this.setJaccardWeight((double) OptionValuesDecoder.decode(value, Double.class));
	}

	public double getDdsWeight() {
		return ddsWeight;
	}
	public void setDdsWeight(double ddsWeight) {
		this.ddsWeight = ddsWeight;
	}
	public void setDdsWeight(String value) {
		this.setDdsWeight((double) OptionValuesDecoder.decode(value, Double.class));
	}

	public double getGkWeight() {
		return gkWeight;
	}
	public void setGkWeight(double gkWeight) {
		this.gkWeight = gkWeight;
	}
	public void setGkWeight(String value) {
		this.setGkWeight((double) OptionValuesDecoder.decode(value, Double.class));
	}

	public int getNeighborhood() {
		return neighborhood;
	}
	public void setNeighborhood(int neighborhood) {
		if(neighborhood<1) throw new IllegalArgumentException("Neighborhood must be a positive number. Value: "+neighborhood);
		this.neighborhood = neighborhood;
	}
	public void setNeighborhood(String value) {
		this.setNeighborhood((int) OptionValuesDecoder.decode(value, Integer.class));
	}

	public String getSimilarityCutoffs() {
		return similarityCutoffs;
	}
	/**
	 * @param similarityCutoffs Comma separated list of squared similarity cutoffs
	 */
	public void setSimilarityCutoffs(String similarityCutoffs) {
		ParseUtils.parseDoubles(similarityCutoffs);
		this.similarityCutoffs = similarityCutoffs;
	}

	public int getNumThreads() {
		return numThreads;
	}
	public void setNumThreads(int numThreads) {
		if(numThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Value: "+numThreads);
		this.numThreads = numThreads;
	}
	public void setNumThreads(String value) {
		this.setNumThreads((int) OptionValuesDecoder.decode(value, Integer.class));
	}

	public boolean isFailFast() {
		return failFast;
	}
	public void setFailFast(boolean failFast) {
		this.failFast = failFast;
	}
	public void setFailFast(Boolean failFast) {
		this.setFailFast(failFast.booleanValue());
	}

	public boolean isSkipDomainFiles() {
		return skipDomainFiles;
	}
	public void setSkipDomainFiles(boolean skipDomainFiles) {
		this.skipDomainFiles = skipDomainFiles;
	}
	public void setSkipDomainFiles(Boolean skipDomainFiles) {
		this.setSkipDomainFiles(skipDomainFiles.booleanValue());
	}

	public static void main(String[] args) throws Exception {
		BGCNetworkBuilder instance = new BGCNetworkBuilder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		for(;i<args.length;i++) {
			instance.inputFiles.add(args[i]);
		}
		instance.run();
	}

	public void run() throws IOException, InterruptedException {
		logParameters();
		if(inputFiles.isEmpty()) throw new IOException("At least one file with domain hits must be provided");
		Map<String, String> groups = new LinkedHashMap<>();
		if(groupsFile!=null) {
			groups = new ClusterGroupsFileHandler().loadGroups(groupsFile);
			log.info("Loaded group labels for "+groups.size()+" clusters");
		}
		Map<String, ClusterDomainProfile> profiles = loadProfiles(inputFiles);
		DomainDistanceMatrix domainDistances = loadDomainDistances();
		List<NetworkEdge> edges = buildNetwork(profiles, domainDistances, groups);
		saveNetworks(edges);
		log.info("Process finished");
	}

	private void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		out.println("Input files: "+inputFiles);
		out.println("Output prefix: "+outputPrefix);
		if(groupsFile!=null) out.println("Cluster groups file: "+groupsFile);
		if(alignmentsDirectory!=null) out.println("Directory with domain alignments: "+alignmentsDirectory);
		out.println("Distance mode: "+distanceMode);
		out.println("Domain overlap cutoff: "+overlapCutoff);
		if(distanceMode==PairwiseDistanceEngine.Mode.DOMAIN_DIST) {
			out.println("Weights Jaccard: "+jaccardWeight+" DDS: "+ddsWeight+" GK: "+gkWeight);
			out.println("Synteny neighborhood: "+neighborhood);
		}
		out.println("Squared similarity cutoffs: "+similarityCutoffs);
		out.println("Number of threads: "+numThreads);
		if(failFast) out.println("Stop at the first malformed cluster");
		if(skipDomainFiles) out.println("Filtered domain files will not be written");
		log.info(os.toString());
	}

	/**
	 * Loads the hits of the given files, resolves overlapping domains and builds the profile of each cluster.
	 * Clusters with malformed records and files that can not be read are skipped unless failFast is set
	 * @param files Tables of domain hits
	 * @return Map<String, ClusterDomainProfile> Profiles by cluster id in order of appearance
	 * @throws IOException If failFast is set and a file can not be loaded or has a malformed record, or if a filtered domain file can not be written
	 */
	public Map<String, ClusterDomainProfile> loadProfiles(List<String> files) throws IOException {
		DomainHitsFileHandler handler = new DomainHitsFileHandler();
		DomainOverlapResolver resolver = new DomainOverlapResolver(overlapCutoff);
		resolver.setLog(log);
		Map<String, ClusterDomainProfile> profiles = new LinkedHashMap<>();
		for(String file:files) {
			Map<String, List<DomainHit>> hitsByCluster;
			if(failFast) {
				hitsByCluster = handler.loadHitsByCluster(file);
			} else {
				Map<String, String> malformedClusters = new LinkedHashMap<>();
				try {
					hitsByCluster = handler.loadHitsByCluster(file, malformedClusters);
				} catch (IOException e) {
					log.severe("Skipping file "+file+". "+e.getMessage());
					continue;
				}
				for(Map.Entry<String, String> entry:malformedClusters.entrySet()) {
					String clusterId = entry.getKey().length()>0?entry.getKey():"with unknown id";
					log.severe("Skipping cluster "+clusterId+". "+entry.getValue());
				}
			}
			if(hitsByCluster.isEmpty()) log.warning("File "+file+" does not have domain hits");
			for(Map.Entry<String, List<DomainHit>> entry:hitsByCluster.entrySet()) {
				String clusterId = entry.getKey();
				if(profiles.containsKey(clusterId)) {
					String message = "Cluster "+clusterId+" in file "+file+" was already loaded from another file";
					if(failFast) throw new IOException(message);
					log.warning(message+". Ignoring repeated hits");
					continue;
				}
				List<DomainHit> resolved = resolver.resolve(entry.getValue());
				if(!skipDomainFiles) saveDomainFiles(handler, clusterId, resolved);
				profiles.put(clusterId, new ClusterDomainProfile(clusterId, resolved));
			}
		}
		log.info("Loaded domain profiles for "+profiles.size()+" clusters");
		return profiles;
	}

	private void saveDomainFiles(DomainHitsFileHandler handler, String clusterId, List<DomainHit> resolved) throws IOException {
		try (PrintStream out = new PrintStream(outputPrefix+"_"+clusterId+PFD_EXTENSION)) {
			handler.saveHits(resolved, out);
		}
		try (PrintStream out = new PrintStream(outputPrefix+"_"+clusterId+PFS_EXTENSION)) {
			handler.saveDomainNames(DomainOverlapResolver.getDomainNames(resolved), out);
		}
	}

	private DomainDistanceMatrix loadDomainDistances() throws IOException {
		if(distanceMode!=PairwiseDistanceEngine.Mode.SEQDIST) return DomainDistanceMatrix.empty();
		if(alignmentsDirectory==null) {
			DomainDistanceMatrix empty = DomainDistanceMatrix.empty();
			log.warning("No directory with domain alignments was provided. Dissimilarities between different domains will be set to "+empty.getMissingDissimilarity());
			return empty;
		}
		DomainAlignmentsDistanceLoader loader = new DomainAlignmentsDistanceLoader();
		loader.setLog(log);
		DomainDistanceMatrix dms = loader.loadDirectory(alignmentsDirectory);
		log.info("Loaded "+dms.size()+" distances between domains of "+dms.getFamilies().size()+" families");
		return dms;
	}

	/**
	 * Calculates the sorted network edges between all clusters
	 * @param profiles Profiles by cluster id
	 * @param domainDistances Distances between domain instances
	 * @param groups Group label of each cluster
	 * @return List<NetworkEdge> edges sorted by log score
	 * @throws InterruptedException If the parallel calculation is interrupted
	 */
	public List<NetworkEdge> buildNetwork(Map<String, ClusterDomainProfile> profiles, DomainDistanceMatrix domainDistances, Map<String, String> groups) throws InterruptedException {
		DistanceContext context = new DistanceContext(profiles, domainDistances, distanceMode, jaccardWeight, ddsWeight, gkWeight, neighborhood);
		NetworkAssembler assembler = new NetworkAssembler(new PairwiseDistanceEngine(context));
		assembler.setLog(log);
		assembler.setNumThreads(numThreads);
		assembler.setFailFast(failFast);
		return assembler.assemble(new ArrayList<>(profiles.keySet()), groups);
	}

	private void saveNetworks(List<NetworkEdge> edges) throws IOException {
		NetworkFileWriter writer = new NetworkFileWriter();
		String [] cutoffs = ParseUtils.parseString(similarityCutoffs, ',');
		String modeName = distanceMode.name().toLowerCase();
		for(String cutoffStr:cutoffs) {
			cutoffStr = cutoffStr.trim();
			double cutoff = Double.parseDouble(cutoffStr);
			List<NetworkEdge> selected = NetworkAssembler.filter(edges, cutoff);
			String filename = NetworkFileWriter.getNetworkFilename(outputPrefix, modeName, cutoffStr);
			try (PrintStream out = new PrintStream(filename)) {
				writer.printEdges(selected, out);
			}
			log.info("Saved "+selected.size()+" edges with squared similarity above "+cutoffStr+" to "+filename);
		}
	}
}
