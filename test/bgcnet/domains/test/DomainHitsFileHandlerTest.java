package bgcnet.domains.test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import bgcnet.domains.DomainHit;
import bgcnet.domains.io.ClusterGroupsFileHandler;
import bgcnet.domains.io.DomainHitsFileHandler;
import junit.framework.TestCase;

public class DomainHitsFileHandlerTest extends TestCase {

	private static final String HITS =
			"#cluster\tscore\tgene\tstart\tstop\tstrand\taccession\tname\tcds\n"+
			"BGC1\t50.5\tgeneA\t0\t100\t+\tPF00109\tKS\tcds1\n"+
			"BGC1\t30\t\t80\t180\t+\tPF00698\tAT\tcds1\n"+
			"\n"+
			"BGC2\t12\tgeneB\t10\t40\t-\tPF00550\tPP-binding\tcds9\n";

	private InputStream toStream(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	public void testLoadHits() throws IOException {
		DomainHitsFileHandler handler = new DomainHitsFileHandler();
		List<DomainHit> hits = handler.loadHits(toStream(HITS), "test");
		assertEquals(3, hits.size());
		DomainHit first = hits.get(0);
		assertEquals("BGC1", first.getClusterId());
		assertEquals(50.5, first.getScore(), 0.000001);
		assertEquals("geneA", first.getGeneId());
		assertEquals(0, first.getStart());
		assertEquals(100, first.getStop());
		assertEquals("PF00109", first.getFamilyAccession());
		assertEquals("KS", first.getFamilyName());
		assertEquals("cds1", first.getCdsId());
		assertEquals("", hits.get(1).getGeneId());
		assertEquals("PP-binding_cds9_10_40", hits.get(2).getInstanceId());
	}

	public void testMalformedRows() {
		DomainHitsFileHandler handler = new DomainHitsFileHandler();
		assertMalformed(handler, "BGC1\t50\tgeneA\t0\t100\t+\tPF00109\tKS\n", "BGC1");
		assertMalformed(handler, "BGC1\t50\tgeneA\tzero\t100\t+\tPF00109\tKS\tcds1\n", "line 1");
		assertMalformed(handler, "BGC1\t50\tgeneA\t0\t100\t+\tPF00109\t\tcds1\n", "BGC1");
		assertMalformed(handler, "BGC1\t50\tgeneA\t0\t100\t+\tPF00109\tKS\tcds1\nBGC3\t50\tgeneA\t200\t100\t+\tPF00109\tKS\tcds1\n", "line 2");
	}

	private void assertMalformed(DomainHitsFileHandler handler, String text, String expectedInMessage) {
		try {
			handler.loadHits(toStream(text), "malformed.pfd");
			fail("Malformed row should be rejected: "+text);
		} catch (IOException e) {
			assertTrue(e.getMessage(), e.getMessage().contains(expectedInMessage));
			assertTrue(e.getMessage(), e.getMessage().contains("malformed.pfd"));
		}
	}

	public void testLoadHitsByClusterSkippingMalformed() throws IOException {
		DomainHitsFileHandler handler = new DomainHitsFileHandler();
		String text = HITS+
				"BGC2\t12\tgeneB\t50\t40\t-\tPF00550\tPP-binding\tcds9\n"+
				"\t12\tgeneC\t50\t60\t-\tPF00550\tPP-binding\tcds10\n"+
				"BGC3\t7\tgeneD\t5\t60\t-\tPF00550\tPP-binding\tcds11\n";
		Map<String, String> malformed = new LinkedHashMap<>();
		Map<String, List<DomainHit>> hitsByCluster = handler.loadHitsByCluster(toStream(text), "mixed.pfd", malformed);
		assertEquals(2, hitsByCluster.size());
		assertEquals(2, hitsByCluster.get("BGC1").size());
		assertEquals(1, hitsByCluster.get("BGC3").size());
		assertNull(hitsByCluster.get("BGC2"));
		assertEquals(2, malformed.size());
		assertTrue(malformed.get("BGC2").contains("line 6"));
		assertTrue(malformed.containsKey(""));
	}

	public void testSaveHitsKeepsScores() throws IOException {
		DomainHitsFileHandler handler = new DomainHitsFileHandler();
		List<DomainHit> hits = new ArrayList<>();
		hits.add(new DomainHit("BGC1", 123.456789012345, "g1", 0, 100, "+", "PF00109", "KS", "cds1"));
		hits.add(new DomainHit("BGC1", 1.5E-12, "g1", 150, 250, "+", "PF00698", "AT", "cds1"));
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		handler.saveHits(hits, new PrintStream(os));
		List<DomainHit> loaded = handler.loadHits(toStream(os.toString()), "saved");
		assertEquals(2, loaded.size());
		assertEquals(123.456789012345, loaded.get(0).getScore(), 0);
		assertEquals(1.5E-12, loaded.get(1).getScore(), 0);
	}

	public void testSaveAndLoadDomainNames() throws IOException {
		DomainHitsFileHandler handler = new DomainHitsFileHandler();
		List<DomainHit> hits = handler.loadHits(toStream(HITS), "test");
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		handler.saveHits(hits.subList(0, 1), new PrintStream(os));
		assertEquals("BGC1\t50.5\tgeneA\t0\t100\t+\tPF00109\tKS\tcds1", os.toString().trim());

		List<String> names = new ArrayList<>();
		names.add("KS");
		names.add("AT");
		names.add("KS");
		os = new ByteArrayOutputStream();
		handler.saveDomainNames(names, new PrintStream(os));
		assertEquals("KS AT KS", os.toString().trim());
		assertEquals(names, handler.loadDomainNames(toStream(os.toString())));
		assertTrue(handler.loadDomainNames(toStream("")).isEmpty());
	}

	public void testLoadGroups() throws IOException {
		ClusterGroupsFileHandler handler = new ClusterGroupsFileHandler();
		Map<String, String> groups = handler.loadGroups(toStream("BGC1\tNRPS\nBGC2\n#comment\nBGC3\tPKSI\n"));
		assertEquals(3, groups.size());
		assertEquals("NRPS", groups.get("BGC1"));
		assertEquals(ClusterGroupsFileHandler.UNKNOWN_GROUP, groups.get("BGC2"));
		assertEquals("PKSI", groups.get("BGC3"));
	}
}
