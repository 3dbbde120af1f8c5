package bgcnet.networks.test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import bgcnet.distances.ClusterPairDistance;
import bgcnet.networks.NetworkEdge;
import bgcnet.networks.io.NetworkFileWriter;
import junit.framework.TestCase;

public class NetworkFileWriterTest extends TestCase {
	public void testPrintEdges() {
		List<NetworkEdge> edges = new ArrayList<>();
		edges.add(new NetworkEdge("BGC1", "BGC2", "NRPS", "NA", new ClusterPairDistance(0.5, 0, 0, 0)));
		edges.add(new NetworkEdge("BGC1", "BGC3", "NRPS", "PKSI", ClusterPairDistance.maximal()));
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		new NetworkFileWriter().printEdges(edges, new PrintStream(os));
		String [] lines = os.toString().split("\n");
		assertEquals(2, lines.length);
		assertEquals("BGC1\tBGC2\tNRPS\tNA\t1.0\t0.5\t0.25", lines[0].trim());
		assertEquals("BGC1\tBGC3\tNRPS\tPKSI\tinf\t1.0\t0.0", lines[1].trim());
	}
	public void testNetworkFilename() {
		assertEquals("out_domain_dist_c0.5.network", NetworkFileWriter.getNetworkFilename("out", "domain_dist", "0.5"));
	}
}
