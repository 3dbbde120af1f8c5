package bgcnet.networks.test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import bgcnet.distances.ClusterPairDistance;
import bgcnet.distances.DistanceContext;
import bgcnet.distances.PairwiseDistanceEngine;
import bgcnet.domains.ClusterDomainProfile;
import bgcnet.domains.DomainHit;
import bgcnet.networks.NetworkAssembler;
import bgcnet.networks.NetworkEdge;
import junit.framework.TestCase;

public class NetworkAssemblerTest extends TestCase {

	private ClusterDomainProfile buildProfile(String clusterId, String... families) {
		List<DomainHit> hits = new ArrayList<>();
		int start = 0;
		for(String family:families) {
			hits.add(new DomainHit(clusterId, 10, "gene", start, start+90, "+", family, family, "cds1"));
			start+=100;
		}
		return new ClusterDomainProfile(clusterId, hits);
	}

	private NetworkAssembler buildAssembler(Map<String, ClusterDomainProfile> profiles) {
		DistanceContext context = new DistanceContext(profiles, null, PairwiseDistanceEngine.Mode.DOMAIN_DIST);
		NetworkAssembler assembler = new NetworkAssembler(new PairwiseDistanceEngine(context));
		Logger log = Logger.getAnonymousLogger();
		log.setLevel(Level.OFF);
		assembler.setLog(log);
		return assembler;
	}

	private NetworkEdge buildEdge(String id1, String id2, double squaredSimilarity) {
		double distance = 1 - Math.sqrt(squaredSimilarity);
		return new NetworkEdge(id1, id2, "NA", "NA", new ClusterPairDistance(distance, 0, 0, 0));
	}

	public void testAssemble() throws InterruptedException {
		Map<String, ClusterDomainProfile> profiles = new LinkedHashMap<>();
		profiles.put("A", buildProfile("A", "PF1", "PF2"));
		profiles.put("B", buildProfile("B", "PF1", "PF2"));
		profiles.put("C", buildProfile("C", "PF3"));
		profiles.put("D", buildProfile("D"));
		Map<String, String> groups = new HashMap<>();
		groups.put("A", "NRPS");
		groups.put("C", "PKSI");
		NetworkAssembler assembler = buildAssembler(profiles);
		List<NetworkEdge> edges = assembler.assemble(new ArrayList<>(profiles.keySet()), groups);
		assertEquals(6, edges.size());
		NetworkEdge first = edges.get(0);
		assertEquals("A", first.getClusterId1());
		assertEquals("B", first.getClusterId2());
		assertEquals("NRPS", first.getGroup1());
		assertEquals("NA", first.getGroup2());
		assertEquals(0.2, first.getDistance(), 0.0001);
		assertEquals(1.0, first.getPairDistance().getJaccard(), 0.0001);
		assertEquals(0.5, first.getPairDistance().getSyntenyScore(), 0.0001);
		assertEquals(-Math.log(0.8)/Math.log(2), first.getLogScore(), 0.0001);
		//Ties keep the enumeration order
		assertEquals("A", edges.get(1).getClusterId1());
		assertEquals("C", edges.get(1).getClusterId2());
		assertEquals("B", edges.get(2).getClusterId1());
		assertEquals("C", edges.get(2).getClusterId2());
		assertEquals(edges.get(1).getLogScore(), edges.get(2).getLogScore(), 0);
		//Pairs involving the empty cluster have infinite log score
		for(int i=3;i<6;i++) {
			assertEquals("D", edges.get(i).getClusterId2());
			assertEquals(Double.POSITIVE_INFINITY, edges.get(i).getLogScore(), 0);
		}
		for(int i=1;i<edges.size();i++) {
			assertTrue(edges.get(i-1).getLogScore()<=edges.get(i).getLogScore());
		}
	}

	public void testMultithreadedAssembly() throws InterruptedException {
		String [][] families = {
				{"PF1", "PF2", "PF3", "PF4", "PF5"},
				{"PF1", "PF2", "PF3"},
				{"PF5", "PF4", "PF3", "PF2", "PF1"},
				{"PF2", "PF2", "PF6"},
				{"PF7"},
				{"PF1", "PF3", "PF5", "PF7", "PF2", "PF4"},
				{"PF6", "PF7", "PF8"},
				{"PF1", "PF1", "PF1", "PF2"}
		};
		Map<String, ClusterDomainProfile> profiles = new LinkedHashMap<>();
		for(int i=0;i<families.length;i++) {
			String id = "BGC"+i;
			profiles.put(id, buildProfile(id, families[i]));
		}
		List<String> ids = new ArrayList<>(profiles.keySet());
		NetworkAssembler sequential = buildAssembler(profiles);
		List<NetworkEdge> expected = sequential.assemble(ids, null);
		NetworkAssembler parallel = buildAssembler(profiles);
		parallel.setNumThreads(4);
		List<NetworkEdge> actual = parallel.assemble(ids, null);
		assertEquals(28, expected.size());
		assertEquals(expected.size(), actual.size());
		for(int i=0;i<expected.size();i++) {
			assertEquals(expected.get(i).getClusterId1(), actual.get(i).getClusterId1());
			assertEquals(expected.get(i).getClusterId2(), actual.get(i).getClusterId2());
			assertEquals(expected.get(i).getDistance(), actual.get(i).getDistance(), 0);
		}
	}

	public void testErrorsPerPair() throws InterruptedException {
		Map<String, ClusterDomainProfile> profiles = new LinkedHashMap<>();
		profiles.put("A", buildProfile("A", "PF1", "PF2"));
		profiles.put("B", buildProfile("B", "PF1"));
		List<String> ids = new ArrayList<>(profiles.keySet());
		ids.add("MISSING");
		NetworkAssembler assembler = buildAssembler(profiles);
		List<NetworkEdge> edges = assembler.assemble(ids, null);
		assertEquals(1, edges.size());
		assertEquals("NA", edges.get(0).getGroup1());
		assembler.setFailFast(true);
		try {
			assembler.assemble(ids, null);
			fail("Unknown cluster should stop the assembly");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().contains("MISSING"));
		}
	}

	public void testTooManyClusters() throws InterruptedException {
		Map<String, ClusterDomainProfile> profiles = new LinkedHashMap<>();
		profiles.put("A", buildProfile("A", "PF1"));
		NetworkAssembler assembler = buildAssembler(profiles);
		List<String> ids = new ArrayList<>();
		for(int i=0;i<70000;i++) ids.add("BGC"+i);
		try {
			assembler.assemble(ids, null);
			fail("Number of pairs larger than the maximum array size should be rejected");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("70000"));
		}
	}

	public void testFilter() {
		List<NetworkEdge> edges = new ArrayList<>();
		edges.add(buildEdge("A", "B", 0.9));
		edges.add(buildEdge("A", "C", 0.6));
		edges.add(buildEdge("B", "C", 0.2));
		List<NetworkEdge> selected = NetworkAssembler.filter(edges, 0.5);
		assertEquals(2, selected.size());
		assertSame(edges.get(0), selected.get(0));
		assertSame(edges.get(1), selected.get(1));
		assertEquals(3, NetworkAssembler.filter(edges, 0).size());
		assertEquals(0, NetworkAssembler.filter(edges, 0.95).size());
	}

	public void testLogScore() {
		assertEquals(0.0, NetworkEdge.calculateLogScore(1), 0);
		assertEquals(1.0, NetworkEdge.calculateLogScore(0.5), 0.000001);
		assertEquals(2.0, NetworkEdge.calculateLogScore(0.25), 0.000001);
		assertEquals(Double.POSITIVE_INFINITY, NetworkEdge.calculateLogScore(0), 0);
	}
}
