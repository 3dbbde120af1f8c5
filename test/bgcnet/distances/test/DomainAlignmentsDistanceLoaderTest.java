package bgcnet.distances.test;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import bgcnet.distances.DomainDistanceMatrix;
import bgcnet.distances.io.DomainAlignmentsDistanceLoader;
import junit.framework.TestCase;

public class DomainAlignmentsDistanceLoaderTest extends TestCase {

	public void testCalculateIdentity() {
		assertEquals(1.0, DomainAlignmentsDistanceLoader.calculateIdentity("ACDEFG", "acdefg"), 0.000001);
		//Internal gaps count in the aligned length
		assertEquals(5.0/7, DomainAlignmentsDistanceLoader.calculateIdentity("ACDE-FG", "ACDQ-FG"), 0.000001);
		//End gaps are not counted
		assertEquals(4.0/5, DomainAlignmentsDistanceLoader.calculateIdentity("ACDE-FG", "--DEKFG"), 0.000001);
		assertEquals(0.0, DomainAlignmentsDistanceLoader.calculateIdentity("----", "ACDE"), 0.000001);
	}

	public void testLoadDirectory() throws IOException {
		Path dir = Files.createTempDirectory("bgcnetAlignments");
		File ks = dir.resolve("KS.fasta").toFile();
		File at = dir.resolve("AT.fa").toFile();
		File ignored = dir.resolve("notes.txt").toFile();
		try {
			try (PrintStream out = new PrintStream(ks)) {
				out.println(">KS_cds1_0_100");
				out.println("ACDE-FG");
				out.println(">KS_cds2_0_100");
				out.println("ACDQ-FG");
				out.println(">KS_cds3_0_100");
				out.println("--DEKFG");
			}
			try (PrintStream out = new PrintStream(at)) {
				out.println(">AT_cds1_200_300");
				out.println("MKLV");
				out.println(">AT_cds4_10_90");
				out.println("MKLV");
			}
			try (PrintStream out = new PrintStream(ignored)) {
				out.println("Not an alignment");
			}
			DomainAlignmentsDistanceLoader loader = new DomainAlignmentsDistanceLoader();
			DomainDistanceMatrix dms = loader.loadDirectory(dir.toString());
			assertEquals(2, dms.getFamilies().size());
			assertEquals(4, dms.size());
			assertEquals(2.0/7, dms.getDissimilarity("KS", "KS_cds1_0_100", "KS_cds2_0_100"), 0.000001);
			assertEquals(2.0/7, dms.getDissimilarity("KS", "KS_cds2_0_100", "KS_cds1_0_100"), 0.000001);
			assertEquals(0.2, dms.getDissimilarity("KS", "KS_cds3_0_100", "KS_cds1_0_100"), 0.000001);
			assertEquals(0.0, dms.getDissimilarity("AT", "AT_cds1_200_300", "AT_cds4_10_90"), 0.000001);
			assertTrue(dms.contains("AT", "AT_cds4_10_90", "AT_cds1_200_300"));
			assertEquals(DomainDistanceMatrix.DEF_MISSING_DISSIMILARITY, dms.getDissimilarity("AT", "AT_cds1_200_300", "AT_cds9_0_10"), 0);
			assertEquals(DomainDistanceMatrix.DEF_MISSING_DISSIMILARITY, dms.getDissimilarity("ACP", "ACP_cds1_0_10", "ACP_cds2_0_10"), 0);
		} finally {
			ks.delete();
			at.delete();
			ignored.delete();
			dir.toFile().delete();
		}
	}

	public void testUnequalAlignmentLengths() throws IOException {
		Path file = Files.createTempFile("bgcnetKS", ".fasta");
		try {
			try (PrintStream out = new PrintStream(file.toFile())) {
				out.println(">KS_cds1_0_100");
				out.println("ACDEFG");
				out.println(">KS_cds2_0_100");
				out.println("ACD");
			}
			DomainAlignmentsDistanceLoader loader = new DomainAlignmentsDistanceLoader();
			try {
				loader.loadFamilyAlignment("KS", file, new DomainDistanceMatrix.Builder());
				fail("Alignments with different lengths should be rejected");
			} catch (IOException e) {
				assertTrue(e.getMessage().contains("KS_cds2_0_100"));
			}
		} finally {
			file.toFile().delete();
		}
	}

	public void testMatrixValidation() {
		DomainDistanceMatrix.Builder builder = new DomainDistanceMatrix.Builder();
		try {
			builder.put("KS", "a", "b", 1.5);
			fail("Dissimilarity larger than one should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		DomainDistanceMatrix dms = builder.setMissingDissimilarity(0.5).build();
		assertEquals(0.5, dms.getMissingDissimilarity(), 0);
		assertEquals(DomainDistanceMatrix.DEF_MISSING_DISSIMILARITY, DomainDistanceMatrix.empty().getMissingDissimilarity(), 0);
		assertEquals(0.5, dms.getDissimilarity("KS", "a", "b"), 0);
		assertEquals(0.0, dms.getDissimilarity("KS", "a", "a"), 0);
	}
}
