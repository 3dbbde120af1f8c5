package bgcnet.domains.test;

import java.util.ArrayList;
import java.util.List;

import bgcnet.domains.DomainHit;
import bgcnet.domains.DomainOverlapResolver;
import junit.framework.TestCase;

public class DomainOverlapResolverTest extends TestCase {

	private DomainHit createHit(String family, String cds, int start, int stop, double score) {
		return new DomainHit("BGC1", score, "gene_"+cds, start, stop, "+", "PF_"+family, family, cds);
	}

	public void testRemoveWorseOverlappingHit() {
		DomainOverlapResolver resolver = new DomainOverlapResolver();
		DomainHit h1 = createHit("PF1", "gene1", 0, 100, 50);
		DomainHit h2 = createHit("PF2", "gene1", 80, 180, 30);
		List<DomainHit> hits = new ArrayList<>();
		hits.add(h2);
		hits.add(h1);
		assertTrue(resolver.isSignificantOverlap(h1, h2));
		List<DomainHit> resolved = resolver.resolve(hits);
		assertEquals(1, resolved.size());
		assertSame(h1, resolved.get(0));
		//Input is not modified
		assertEquals(2, hits.size());
		assertSame(h2, hits.get(0));
	}

	public void testSmallOverlapKeepsBothHits() {
		DomainOverlapResolver resolver = new DomainOverlapResolver();
		DomainHit h1 = createHit("PF1", "gene1", 0, 100, 50);
		DomainHit h2 = createHit("PF2", "gene1", 95, 195, 30);
		List<DomainHit> hits = new ArrayList<>();
		hits.add(h2);
		hits.add(h1);
		List<DomainHit> resolved = resolver.resolve(hits);
		assertEquals(2, resolved.size());
		//Sorted by start
		assertSame(h1, resolved.get(0));
		assertSame(h2, resolved.get(1));
	}

	public void testShortHitFractionIsConsidered() {
		DomainOverlapResolver resolver = new DomainOverlapResolver();
		//Overlap is 5% of the long hit but 50% of the short hit
		DomainHit longHit = createHit("PF1", "gene1", 0, 100, 10);
		DomainHit shortHit = createHit("PF2", "gene1", 95, 105, 20);
		List<DomainHit> hits = new ArrayList<>();
		hits.add(longHit);
		hits.add(shortHit);
		List<DomainHit> resolved = resolver.resolve(hits);
		assertEquals(1, resolved.size());
		assertSame(shortHit, resolved.get(0));
	}

	public void testEqualScoresKeepBothHits() {
		DomainOverlapResolver resolver = new DomainOverlapResolver();
		DomainHit h1 = createHit("PF1", "gene1", 0, 100, 40);
		DomainHit h2 = createHit("PF2", "gene1", 50, 150, 40);
		List<DomainHit> hits = new ArrayList<>();
		hits.add(h1);
		hits.add(h2);
		assertEquals(2, resolver.resolve(hits).size());
	}

	public void testDifferentCdsAreIndependent() {
		DomainOverlapResolver resolver = new DomainOverlapResolver();
		DomainHit h1 = createHit("PF1", "gene1", 0, 100, 50);
		DomainHit h2 = createHit("PF2", "gene2", 0, 100, 30);
		assertFalse(resolver.isSignificantOverlap(h1, h2));
		List<DomainHit> hits = new ArrayList<>();
		hits.add(h1);
		hits.add(h2);
		assertEquals(2, resolver.resolve(hits).size());
	}

	public void testChainOfOverlaps() {
		DomainOverlapResolver resolver = new DomainOverlapResolver();
		//The middle hit loses against both neighbors. The neighbors do not overlap each other
		DomainHit h1 = createHit("PF1", "gene1", 0, 100, 50);
		DomainHit h2 = createHit("PF2", "gene1", 60, 160, 10);
		DomainHit h3 = createHit("PF3", "gene1", 120, 220, 40);
		List<DomainHit> hits = new ArrayList<>();
		hits.add(h3);
		hits.add(h2);
		hits.add(h1);
		List<DomainHit> resolved = resolver.resolve(hits);
		assertEquals(2, resolved.size());
		assertSame(h1, resolved.get(0));
		assertSame(h3, resolved.get(1));
		List<String> names = DomainOverlapResolver.getDomainNames(resolved);
		assertEquals("PF1", names.get(0));
		assertEquals("PF3", names.get(1));
	}

	public void testCutoffValidation() {
		try {
			new DomainOverlapResolver(1.5);
			fail("Cutoff larger than one should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}
}
